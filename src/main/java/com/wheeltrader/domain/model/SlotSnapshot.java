package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.SlotState;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/** Read-only view of one slot as captured at the start of a cycle. */
@Value
@Builder
public class SlotSnapshot {

    int slotId;
    LocalDate targetExpiration;
    SlotControl control;

    /** Copy of the slot's live leg, or null when the slot is empty. */
    WheelPosition position;

    DeltaStatus deltaStatus;

    /** True while any order intent for this slot is still working at the broker. */
    boolean pendingOrder;

    public SlotState getState() {
        return SlotState.of(position == null ? null : position.getStatus());
    }
}
