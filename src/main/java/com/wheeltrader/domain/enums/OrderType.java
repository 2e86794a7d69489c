package com.wheeltrader.domain.enums;

/**
 * Order execution type sent to the broker.
 * LIMIT orders are priced at the contract midpoint when placed.
 */
public enum OrderType {
    MARKET,
    LIMIT
}
