package com.wheeltrader.domain.enums;

/**
 * Option right of a wheel leg. The wheel only ever sells: cash-secured puts while
 * the account is short of its target share count, covered calls while it is over.
 */
public enum OptionSide {
    PUT,
    CALL;

    public OptionSide other() {
        return this == PUT ? CALL : PUT;
    }
}
