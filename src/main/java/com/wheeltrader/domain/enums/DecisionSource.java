package com.wheeltrader.domain.enums;

/** Identifies which component produced a decision log entry. */
public enum DecisionSource {
    DECISION_ENGINE,
    SCHEDULE_MANAGER,
    DELTA_MONITOR,
    ORDER_LIFECYCLE,
    RECONCILIATION,
    BROKER,
    OPERATOR,
    SYSTEM
}
