package com.wheeltrader.domain.enums;

/**
 * Broker-side lifecycle status of an order.
 * PENDING is our internal pre-submission state; the remaining states mirror what the
 * broker reports on its order status stream.
 */
public enum OrderStatus {
    PENDING,
    OPEN,
    PARTIAL,
    COMPLETE,
    CANCELLED,
    REJECTED
}
