package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.enums.OrderStatus;
import com.wheeltrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * An order as sent to and reported back by the broker.
 *
 * <p>{@code correlationId} carries the order intent id so that status updates can be
 * matched back to the slot that produced them.
 */
@Data
@Builder(toBuilder = true)
public class BrokerOrder {

    private String brokerOrderId;
    private String correlationId;
    private String contractId;
    private OrderSide side;
    private OrderType type;
    private int quantity;
    private BigDecimal price;
    private OrderStatus status;
    private int filledQuantity;
    private BigDecimal averageFillPrice;
    private String rejectionReason;
    private Instant placedAt;
    private Instant updatedAt;
}
