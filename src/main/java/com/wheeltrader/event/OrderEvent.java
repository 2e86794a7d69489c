package com.wheeltrader.event;

import com.wheeltrader.domain.enums.OrderStatus;
import com.wheeltrader.domain.model.BrokerOrder;
import org.springframework.context.ApplicationEvent;

/**
 * A broker order status update.
 *
 * <p>Published by the broker gateway. The order lifecycle manager reconciles it into the
 * matching order intent (by broker order id, then by correlation id), after which the cycle
 * runner requests a new decision cycle.
 */
public class OrderEvent extends ApplicationEvent {

    private final BrokerOrder order;
    private final OrderEventType eventType;
    private final OrderStatus previousStatus;

    public OrderEvent(Object source, BrokerOrder order, OrderEventType eventType, OrderStatus previousStatus) {
        super(source);
        this.order = order;
        this.eventType = eventType;
        this.previousStatus = previousStatus;
    }

    public OrderEvent(Object source, BrokerOrder order, OrderEventType eventType) {
        this(source, order, eventType, null);
    }

    public BrokerOrder getOrder() {
        return order;
    }

    public OrderEventType getEventType() {
        return eventType;
    }

    /** Status before this update; null when unknown. */
    public OrderStatus getPreviousStatus() {
        return previousStatus;
    }
}
