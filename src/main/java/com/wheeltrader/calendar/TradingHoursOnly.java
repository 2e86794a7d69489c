package com.wheeltrader.calendar;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Restricts a method to the regular trading session (09:30-16:00 ET).
 *
 * <p>Outside the session the {@link TradingHoursGuard} aspect throws
 * {@link com.wheeltrader.exception.MarketClosedException} with the configured {@link #message()}.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface TradingHoursOnly {

    String message() default "This operation is only available during the regular session";
}
