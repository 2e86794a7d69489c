package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * One short option leg held, or pending, in a weekly slot.
 *
 * <p>Owned by the {@code PositionBook} and mutated only between cycles. The decision engine
 * receives copies (see {@link #copy()}) inside the cycle snapshot so no mid-cycle change can
 * leak into a batch of decisions.
 *
 * <p>{@code quantity} is always -1: one short contract per slot.
 */
@Data
@Builder(toBuilder = true)
public class WheelPosition {

    private int slotId;
    private String contractId;
    private String underlying;
    private OptionSide side;
    private BigDecimal strike;
    private LocalDate expiration;

    @Builder.Default
    private int quantity = -1;

    /** Last observed signed delta; null until the first successful observation. */
    private BigDecimal delta;

    private DeltaStatus deltaStatus;
    private PositionStatus status;
    private BigDecimal entryPrice;
    private Instant openedAt;
    private Instant updatedAt;

    public WheelPosition copy() {
        return toBuilder().build();
    }

    public boolean isLive() {
        return status != null && status.isLive();
    }
}
