package com.wheeltrader.domain.enums;

/**
 * State of a weekly slot, derived from the leg it currently owns.
 * EMPTY means the slot owns no leg at all.
 */
public enum SlotState {
    EMPTY,
    PENDING_OPEN,
    OPEN,
    PENDING_ROLL,
    PENDING_CLOSE,
    CLOSED;

    public static SlotState of(PositionStatus status) {
        if (status == null) {
            return EMPTY;
        }
        return switch (status) {
            case PENDING_OPEN -> PENDING_OPEN;
            case OPEN -> OPEN;
            case PENDING_ROLL -> PENDING_ROLL;
            case PENDING_CLOSE -> PENDING_CLOSE;
            case CLOSED -> CLOSED;
        };
    }
}
