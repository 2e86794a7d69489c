package com.wheeltrader.exception;

/**
 * Thrown when an operation guarded by {@code @TradingHoursOnly} is invoked outside the
 * regular session. Callers should check the session first; this is the backstop.
 */
public class MarketClosedException extends BaseException {

    public MarketClosedException(String message) {
        super(ErrorCode.MARKET_CLOSED, message);
    }
}
