package com.wheeltrader.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Service;

/**
 * Weekly expiration dates for US equity options.
 *
 * <p>Standard weeklies expire on Fridays. When the Friday is an exchange holiday the
 * expiration moves to the previous trading day (usually Thursday). The schedule window
 * keeps its target dates on the nominal Fridays; the chain filter's date tolerance picks up
 * the shifted expiration.
 */
@Service
public class ExpiryCalendarService {

    private final TradingCalendarService tradingCalendarService;

    public ExpiryCalendarService(TradingCalendarService tradingCalendarService) {
        this.tradingCalendarService = tradingCalendarService;
    }

    /** Nominal Friday of the week containing the reference date, or the next Friday after a weekend. */
    public LocalDate getNominalWeeklyExpiry(LocalDate referenceDate) {
        return referenceDate.with(TemporalAdjusters.nextOrSame(DayOfWeek.FRIDAY));
    }

    /** Actual weekly expiration for the reference week, shifted back over holidays. */
    public LocalDate getWeeklyExpiry(LocalDate referenceDate) {
        return adjustForHoliday(getNominalWeeklyExpiry(referenceDate));
    }

    /**
     * First target expiration of a freshly built window: the first Friday at least one week
     * after the reference date.
     */
    public LocalDate getFirstWindowExpiry(LocalDate today) {
        return getNominalWeeklyExpiry(today.plusWeeks(1));
    }

    /** Actual expiration dates (holiday adjusted) of all weeklies between two dates, inclusive. */
    public List<LocalDate> getExpiryDatesBetween(LocalDate from, LocalDate to) {
        List<LocalDate> expiries = new ArrayList<>();
        LocalDate friday = getNominalWeeklyExpiry(from);
        while (!friday.isAfter(to.plusDays(6))) {
            LocalDate adjusted = adjustForHoliday(friday);
            if (!adjusted.isBefore(from) && !adjusted.isAfter(to)) {
                expiries.add(adjusted);
            }
            friday = friday.plusWeeks(1);
        }
        return expiries;
    }

    /** Calendar days from the reference date to the expiration; negative once expired. */
    public long getDaysToExpiry(LocalDate from, LocalDate expiry) {
        return ChronoUnit.DAYS.between(from, expiry);
    }

    public boolean isExpiryDay(LocalDate date) {
        return date.equals(getWeeklyExpiry(date));
    }

    private LocalDate adjustForHoliday(LocalDate date) {
        while (tradingCalendarService.isHoliday(date)) {
            date = date.minusDays(1);
        }
        return date;
    }
}
