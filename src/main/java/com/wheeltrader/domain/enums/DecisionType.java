package com.wheeltrader.domain.enums;

/** Granular classification of decision log entries, grouped by subsystem. */
public enum DecisionType {

    // Decision engine
    SLOT_OPEN,
    SLOT_ROLL,
    SLOT_CLOSE,
    SLOT_HOLD,

    // Schedule
    WINDOW_ADVANCED,
    WINDOW_INITIALIZED,

    // Conditions
    CONDITION_RAISED,

    // Orders
    ORDER_PLACED,
    ORDER_FILLED,
    ORDER_PARTIALLY_FILLED,
    ORDER_REJECTED,
    ORDER_CANCELLED,
    ORDER_REPRICED,
    ORDER_TIMEOUT,

    // Operator and system
    SLOT_CONTROL_CHANGED,
    RECONCILIATION,
    CYCLE_SKIPPED
}
