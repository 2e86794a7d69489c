package com.wheeltrader.domain.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/**
 * Everything the decision engine reads in one cycle, captured once before any decision is
 * made. Slots are listed in window order, head first.
 */
@Value
@Builder
public class CycleSnapshot {

    long cycleId;
    Instant asOf;
    LocalDate today;
    boolean brokerConnected;
    PortfolioState portfolio;
    ScheduleWindow window;
    List<SlotSnapshot> slots;
    List<OptionContract> chain;

    public Optional<SlotSnapshot> slot(int slotId) {
        return slots.stream().filter(s -> s.getSlotId() == slotId).findFirst();
    }
}
