package com.wheeltrader.domain.enums;

/**
 * The result of a logged decision.
 *
 * <ul>
 *   <li>TRIGGERED -- action taken (open, roll, close, order placed)</li>
 *   <li>SKIPPED -- evaluated, nothing to do</li>
 *   <li>REJECTED -- blocked (broker rejection, no coverage)</li>
 *   <li>FAILED -- attempted but failed</li>
 *   <li>INFO -- informational</li>
 * </ul>
 */
public enum DecisionOutcome {
    TRIGGERED,
    SKIPPED,
    REJECTED,
    FAILED,
    INFO
}
