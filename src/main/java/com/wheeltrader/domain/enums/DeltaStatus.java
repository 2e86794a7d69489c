package com.wheeltrader.domain.enums;

/**
 * Delta Monitor classification of a live leg.
 * STALE legs are excluded from roll consideration until a fresh quote arrives.
 */
public enum DeltaStatus {
    IN_RANGE,
    NEAR_MONEY,
    STALE
}
