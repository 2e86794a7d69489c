package com.wheeltrader.domain.enums;

/**
 * Lifecycle of a single short option leg owned by a weekly slot.
 *
 * <ul>
 *   <li>PENDING_OPEN -- sell-to-open routed, or a roll lost its opening leg and the slot
 *       waits to be reopened</li>
 *   <li>OPEN -- leg is live at the broker</li>
 *   <li>PENDING_ROLL -- buy-to-close routed as the first half of a roll</li>
 *   <li>PENDING_CLOSE -- buy-to-close routed with no replacement</li>
 *   <li>CLOSED -- terminal; cleared from the slot when the window advances</li>
 * </ul>
 */
public enum PositionStatus {
    PENDING_OPEN,
    OPEN,
    PENDING_ROLL,
    PENDING_CLOSE,
    CLOSED;

    public boolean isLive() {
        return this != CLOSED;
    }
}
