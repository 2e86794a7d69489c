package com.wheeltrader.calendar;

import com.wheeltrader.domain.enums.MarketPhase;
import com.wheeltrader.event.EventPublisherHelper;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Market hours awareness for the US options session.
 *
 * <p>Polls every 5 seconds and publishes a market status event on every phase change; the
 * cycle runner listens for the transition into REGULAR to run the first cycle of the day
 * without waiting for the next timer tick.
 */
@Service
public class TradingCalendarService {

    private static final Logger log = LoggerFactory.getLogger(TradingCalendarService.class);

    private final HolidayCalendarConfig holidayCalendarConfig;
    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;
    private final AtomicReference<MarketPhase> currentPhase = new AtomicReference<>(MarketPhase.CLOSED);

    public TradingCalendarService(
            HolidayCalendarConfig holidayCalendarConfig, EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.holidayCalendarConfig = holidayCalendarConfig;
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    @Scheduled(fixedRate = 5000)
    public void updateMarketPhase() {
        LocalDateTime now = LocalDateTime.now(clock);
        updateMarketPhase(now.toLocalDate(), now.toLocalTime());
    }

    /** Testable version: recomputes the phase for the given exchange-local date and time. */
    public void updateMarketPhase(LocalDate date, LocalTime time) {
        MarketPhase newPhase = calculatePhase(date, time);
        MarketPhase previousPhase = currentPhase.getAndSet(newPhase);

        if (previousPhase != newPhase) {
            log.info("Market phase transition: {} -> {}", previousPhase, newPhase);
            eventPublisherHelper.publishMarketPhaseTransition(this, previousPhase, newPhase);
        }
    }

    public MarketPhase getCurrentPhase() {
        return currentPhase.get();
    }

    /** True only during the regular session; the only phase in which orders are dispatched. */
    public boolean isMarketOpen() {
        return currentPhase.get() == MarketPhase.REGULAR;
    }

    /** Weekends and full-day holidays. */
    public boolean isHoliday(LocalDate date) {
        DayOfWeek dow = date.getDayOfWeek();
        if (dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY) {
            return true;
        }
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.FULL_HOLIDAY);
    }

    public boolean isEarlyClose(LocalDate date) {
        return holidayCalendarConfig.getHolidays().stream()
                .anyMatch(h -> date.equals(h.getDate()) && h.getType() == HolidayType.EARLY_CLOSE);
    }

    public boolean isTradingDay(LocalDate date) {
        return !isHoliday(date);
    }

    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate prev = from.minusDays(1);
        while (!isTradingDay(prev)) {
            prev = prev.minusDays(1);
        }
        return prev;
    }

    /** Regular session close for the date, honouring early-close days. */
    public LocalTime getSessionClose(LocalDate date) {
        return isEarlyClose(date) ? holidayCalendarConfig.getEarlyClose() : holidayCalendarConfig.getSessionClose();
    }

    /** Minutes until today's regular session ends. Zero if already past. */
    public long getMinutesToClose() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalTime closeTime = getSessionClose(now.toLocalDate());
        if (now.toLocalTime().isBefore(closeTime)) {
            return Duration.between(now.toLocalTime(), closeTime).toMinutes();
        }
        return 0;
    }

    public MarketPhase calculatePhase(LocalDate date, LocalTime time) {
        if (isHoliday(date)) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(holidayCalendarConfig.getPreMarketOpen())) {
            return MarketPhase.CLOSED;
        }
        if (time.isBefore(holidayCalendarConfig.getSessionOpen())) {
            return MarketPhase.PRE_MARKET;
        }
        if (time.isBefore(getSessionClose(date))) {
            return MarketPhase.REGULAR;
        }
        if (time.isBefore(holidayCalendarConfig.getAfterHoursClose())) {
            return MarketPhase.AFTER_HOURS;
        }
        return MarketPhase.CLOSED;
    }
}
