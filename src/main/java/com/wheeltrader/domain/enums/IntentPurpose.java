package com.wheeltrader.domain.enums;

/** What an order intent is for within its slot. */
public enum IntentPurpose {
    OPEN,
    CLOSE,
    ROLL_CLOSE,
    ROLL_OPEN;

    public boolean isOpening() {
        return this == OPEN || this == ROLL_OPEN;
    }
}
