package com.wheeltrader.domain.enums;

/**
 * Client-side state of an order intent, reconciled from broker order events.
 *
 * <p>STAGED is used for the opening half of a roll, which is only submitted once the
 * closing half has filled.
 */
public enum IntentStatus {
    STAGED,
    SUBMITTED,
    ACKED,
    PARTIALLY_FILLED,
    FILLED,
    CANCEL_REQUESTED,
    CANCELLED,
    REJECTED;

    public boolean isTerminal() {
        return this == FILLED || this == CANCELLED || this == REJECTED;
    }

    /** Sent to the broker and still awaiting a terminal report. */
    public boolean isWorking() {
        return this == SUBMITTED || this == ACKED || this == PARTIALLY_FILLED || this == CANCEL_REQUESTED;
    }
}
