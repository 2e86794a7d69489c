package com.wheeltrader.domain.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/** Result of one decision batch: a decision for every slot plus the alerts raised while deciding. */
@Value
@Builder
public class CycleOutcome {

    long cycleId;
    AllocationPolicy policy;
    List<RollDecision> decisions;
    List<WheelAlert> alerts;
    BigDecimal totalPremium;
    BigDecimal totalCashCommitted;
    int callsCommitted;

    public Optional<RollDecision> decisionFor(int slotId) {
        return decisions.stream().filter(d -> d.getSlotId() == slotId).findFirst();
    }
}
