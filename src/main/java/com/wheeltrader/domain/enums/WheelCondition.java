package com.wheeltrader.domain.enums;

/**
 * Reportable error and warning conditions raised while running the wheel.
 *
 * <p>All conditions except INVARIANT_VIOLATION are recoverable and are handled inside the
 * cycle that detects them. INVARIANT_VIOLATION halts automation of the affected slot
 * until an operator resumes it.
 */
public enum WheelCondition {
    NO_ELIGIBLE_CONTRACT(DecisionSeverity.WARNING),
    STALE_MARKET_DATA(DecisionSeverity.WARNING),
    PARTIAL_ROLL_FAILURE(DecisionSeverity.WARNING),
    BROKER_DISCONNECTED(DecisionSeverity.WARNING),
    INVARIANT_VIOLATION(DecisionSeverity.CRITICAL),
    INSUFFICIENT_COVERAGE(DecisionSeverity.WARNING),
    ROLL_ABORTED(DecisionSeverity.WARNING),
    ORPHAN_POSITION(DecisionSeverity.WARNING),
    ORDER_TIMEOUT(DecisionSeverity.INFO);

    private final DecisionSeverity severity;

    WheelCondition(DecisionSeverity severity) {
        this.severity = severity;
    }

    public DecisionSeverity getSeverity() {
        return severity;
    }
}
