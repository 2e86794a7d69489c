package com.wheeltrader.api.dto.response;

import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.RollAction;
import com.wheeltrader.domain.enums.RollReason;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.SlotState;
import java.math.BigDecimal;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Getter;

/** One row of the slot table in {@link WheelStatusResponse}. */
@Getter
@Builder
public class SlotStatusResponse {

    private final int slotId;
    private final LocalDate targetExpiration;
    private final boolean head;
    private final SlotControl control;
    private final SlotState state;

    // Leg fields are null when the slot is empty
    private final String contractId;
    private final OptionSide side;
    private final BigDecimal strike;
    private final LocalDate expiration;
    private final PositionStatus positionStatus;
    private final BigDecimal delta;
    private final DeltaStatus deltaStatus;
    private final BigDecimal entryPrice;

    private final boolean pendingOrder;

    /** Decision the last cycle made for this slot. */
    private final RollAction lastAction;

    private final RollReason lastReason;
}
