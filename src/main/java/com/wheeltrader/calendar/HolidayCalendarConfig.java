package com.wheeltrader.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Exchange calendar configuration bound from the {@code trading-calendar} prefix.
 *
 * <p>Holidays are maintained by hand in {@code application.yml} from the exchange's published
 * schedule. They drive market phase detection in {@link TradingCalendarService} and the
 * holiday shift of weekly expirations in {@link ExpiryCalendarService}.
 */
@Component
@ConfigurationProperties(prefix = "trading-calendar")
public class HolidayCalendarConfig {

    private String exchange = "NYSE";
    private String timezone = "America/New_York";
    private LocalTime preMarketOpen = LocalTime.of(4, 0);
    private LocalTime sessionOpen = LocalTime.of(9, 30);
    private LocalTime sessionClose = LocalTime.of(16, 0);
    private LocalTime earlyClose = LocalTime.of(13, 0);
    private LocalTime afterHoursClose = LocalTime.of(20, 0);
    private List<Holiday> holidays = new ArrayList<>();

    public String getExchange() {
        return exchange;
    }

    public void setExchange(String exchange) {
        this.exchange = exchange;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public LocalTime getPreMarketOpen() {
        return preMarketOpen;
    }

    public void setPreMarketOpen(LocalTime preMarketOpen) {
        this.preMarketOpen = preMarketOpen;
    }

    public LocalTime getSessionOpen() {
        return sessionOpen;
    }

    public void setSessionOpen(LocalTime sessionOpen) {
        this.sessionOpen = sessionOpen;
    }

    public LocalTime getSessionClose() {
        return sessionClose;
    }

    public void setSessionClose(LocalTime sessionClose) {
        this.sessionClose = sessionClose;
    }

    public LocalTime getEarlyClose() {
        return earlyClose;
    }

    public void setEarlyClose(LocalTime earlyClose) {
        this.earlyClose = earlyClose;
    }

    public LocalTime getAfterHoursClose() {
        return afterHoursClose;
    }

    public void setAfterHoursClose(LocalTime afterHoursClose) {
        this.afterHoursClose = afterHoursClose;
    }

    public List<Holiday> getHolidays() {
        return holidays;
    }

    public void setHolidays(List<Holiday> holidays) {
        this.holidays = holidays;
    }

    /** A single dated entry on the exchange calendar. */
    public static class Holiday {

        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;

        public Holiday() {}

        public Holiday(LocalDate date, String name, HolidayType type) {
            this.date = date;
            this.name = name;
            this.type = type;
        }

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }
    }
}
