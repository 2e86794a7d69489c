package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.IntentPurpose;
import com.wheeltrader.domain.enums.IntentStatus;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.enums.OrderType;
import com.wheeltrader.domain.enums.RollReason;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Data;

/**
 * Client-side record of one order we mean to have at the broker for a slot.
 *
 * <p>State-tagged and reconciled from broker order events, never from assumed outcomes:
 * acknowledgement, partial fill, fill, rejection and cancellation may arrive in any order,
 * and a fill that races a cancel request wins.
 *
 * <p>The opening half of a roll is created STAGED with no broker order id and is only
 * submitted once its paired closing intent ({@code pairedIntentId}) fills.
 */
@Data
@Builder
public class OrderIntent {

    private String intentId;
    private long cycleId;
    private int slotId;
    private IntentPurpose purpose;
    private IntentStatus status;
    private RollReason reason;

    private String contractId;
    private OptionSide optionSide;
    private BigDecimal strike;
    private LocalDate expiration;

    private OrderSide orderSide;
    private int quantity;
    private OrderType orderType;
    private BigDecimal limitPrice;

    /** Contract selection behind an opening intent; carries the premium and collateral figures. */
    private TargetContract target;

    private String pairedIntentId;
    private String brokerOrderId;

    @Builder.Default
    private int filledQuantity = 0;

    private BigDecimal averageFillPrice;

    @Builder.Default
    private int repriceCount = 0;

    private String rejectionReason;
    private Instant createdAt;
    private Instant submittedAt;
    private Instant ackedAt;
    private Instant updatedAt;
}
