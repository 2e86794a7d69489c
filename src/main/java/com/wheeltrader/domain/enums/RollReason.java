package com.wheeltrader.domain.enums;

/**
 * Why a slot received its decision. Recorded on every decision so the decision log can
 * be replayed offline.
 */
public enum RollReason {
    INITIAL_OPEN,
    REOPEN_AFTER_FAILED_ROLL,
    DELTA_TRIGGER,
    EXPIRY_TRIGGER,
    OPERATOR_CLOSE,
    IN_RANGE,
    STALE_DATA,
    AWAITING_BROKER,
    NO_ELIGIBLE_CONTRACT,
    INSUFFICIENT_COVERAGE,
    SLOT_PAUSED,
    SLOT_HALTED,
    BROKER_DISCONNECTED
}
