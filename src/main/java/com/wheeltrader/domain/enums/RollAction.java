package com.wheeltrader.domain.enums;

/** Per-slot output of a decision cycle. */
public enum RollAction {
    HOLD,
    ROLL,
    CLOSE,
    OPEN;

    /** True for actions that must be handed to the order lifecycle manager. */
    public boolean requiresOrders() {
        return this != HOLD;
    }
}
