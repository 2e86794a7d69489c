package com.wheeltrader.calendar;

/**
 * Classifies an entry on the exchange holiday calendar.
 *
 * <p>FULL_HOLIDAY means no session at all. EARLY_CLOSE is a trading day whose regular
 * session ends at the configured early close time (13:00 ET on US exchanges).
 */
public enum HolidayType {
    FULL_HOLIDAY,
    EARLY_CLOSE
}
