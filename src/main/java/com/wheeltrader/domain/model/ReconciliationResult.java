package com.wheeltrader.domain.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;

/** Outcome of comparing the slot ledger with the broker's positions at the start of a cycle. */
@Data
@Builder
public class ReconciliationResult {

    private long cycleId;
    private int brokerLegCount;
    private int matched;
    private int confirmedOpen;
    private int closed;
    private int adopted;

    @Builder.Default
    private List<WheelAlert> alerts = new ArrayList<>();

    @Builder.Default
    private List<Integer> haltedSlots = new ArrayList<>();

    public boolean hasChanges() {
        return confirmedOpen + closed + adopted > 0 || !alerts.isEmpty();
    }
}
