package com.wheeltrader.domain.enums;

/** Buy or sell side of an order. Wheel legs open with SELL and close with BUY. */
public enum OrderSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public OrderSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
