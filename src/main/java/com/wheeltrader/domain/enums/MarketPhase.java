package com.wheeltrader.domain.enums;

/**
 * US equity options session phases in exchange time.
 * Only REGULAR allows order dispatch.
 */
public enum MarketPhase {
    PRE_MARKET,
    REGULAR,
    AFTER_HOURS,
    CLOSED
}
