package com.wheeltrader.event;

/**
 * Classifies the order status update carried by an {@link OrderEvent}. These mirror the
 * broker's order status stream.
 */
public enum OrderEventType {

    /** Broker accepted the order and it is working. */
    ACKED,

    /** Limit price changed on a working order. */
    MODIFIED,

    /** Some but not all of the quantity executed. */
    PARTIALLY_FILLED,

    /** All requested quantity executed. */
    FILLED,

    /** Refused by the broker or exchange. */
    REJECTED,

    /** Cancelled, either on request or by the broker. */
    CANCELLED
}
