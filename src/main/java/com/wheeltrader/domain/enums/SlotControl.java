package com.wheeltrader.domain.enums;

/**
 * Operator-level control flag for a slot, independent of the leg it holds.
 *
 * <p>HALTED is set automatically when an invariant violation is detected for the slot
 * and is only cleared by an explicit operator resume. CLOSE_REQUESTED makes the engine
 * close the live leg; once the slot is flat it becomes PAUSED.
 */
public enum SlotControl {
    ACTIVE,
    PAUSED,
    CLOSE_REQUESTED,
    HALTED;

    public boolean isAutomated() {
        return this == ACTIVE;
    }
}
