package com.wheeltrader.config;

import com.wheeltrader.calendar.HolidayCalendarConfig;
import java.time.Clock;
import java.time.ZoneId;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the exchange-zone {@link Clock} shared by every time-dependent component,
 * so tests can pin "now" with {@code Clock.fixed(...)}.
 */
@Configuration
public class ClockConfig {

    @Bean
    public Clock exchangeClock(HolidayCalendarConfig holidayCalendarConfig) {
        return Clock.system(ZoneId.of(holidayCalendarConfig.getTimezone()));
    }
}
