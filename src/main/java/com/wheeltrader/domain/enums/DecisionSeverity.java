package com.wheeltrader.domain.enums;

/**
 * Severity level for decision log entries.
 *
 * <ul>
 *   <li>DEBUG -- routine HOLDs where nothing changed</li>
 *   <li>INFO -- opens, rolls, closes, fills</li>
 *   <li>WARNING -- recoverable conditions (stale data, no eligible contract, partial roll)</li>
 *   <li>CRITICAL -- invariant violations that halt a slot</li>
 * </ul>
 */
public enum DecisionSeverity {
    DEBUG,
    INFO,
    WARNING,
    CRITICAL
}
