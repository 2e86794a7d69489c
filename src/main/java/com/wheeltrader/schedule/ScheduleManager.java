package com.wheeltrader.schedule;

import com.wheeltrader.calendar.ExpiryCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.WeeklySlot;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Owns the schedule window and keeps it rolling forward.
 *
 * <p>The head slot is retired, and its id re-appended one week after the tail, when:
 * <ul>
 *   <li>its leg is CLOSED</li>
 *   <li>it holds no leg and its target date is within {@code min-days-to-expiry} (or past)</li>
 *   <li>its leg was rolled out beyond the head date, i.e. to the date the next slot will get</li>
 * </ul>
 * CLOSED legs in other slots are cleared so those slots return to EMPTY.
 *
 * <p>Per-slot state machine: EMPTY -> PENDING_OPEN -> OPEN -> (PENDING_ROLL -> OPEN |
 * PENDING_CLOSE -> CLOSED -> EMPTY).
 */
@Component
public class ScheduleManager {

    private static final Logger log = LoggerFactory.getLogger(ScheduleManager.class);

    private final ExpiryCalendarService expiryCalendarService;
    private final WheelProperties wheelProperties;
    private final DecisionLogger decisionLogger;

    private final AtomicReference<ScheduleWindow> window = new AtomicReference<>();

    public ScheduleManager(
            ExpiryCalendarService expiryCalendarService,
            WheelProperties wheelProperties,
            DecisionLogger decisionLogger) {
        this.expiryCalendarService = expiryCalendarService;
        this.wheelProperties = wheelProperties;
        this.decisionLogger = decisionLogger;
    }

    public boolean isInitialized() {
        return window.get() != null;
    }

    public ScheduleWindow getWindow() {
        ScheduleWindow current = window.get();
        if (current == null) {
            throw new IllegalStateException("Schedule window not initialized");
        }
        return current;
    }

    /**
     * Builds the first window. Normally the head is the first Friday at least a week out;
     * after a restart with short legs still open, the head moves back to the earliest of
     * those legs so they land in slots instead of being reported as orphans.
     */
    public ScheduleWindow initialize(LocalDate today, List<BrokerPosition> brokerLegs, long cycleId) {
        LocalDate head = expiryCalendarService.getFirstWindowExpiry(today);
        Optional<LocalDate> earliestLeg = brokerLegs.stream()
                .filter(p -> wheelProperties.getUnderlying().equals(p.getUnderlying()))
                .filter(p -> p.getQuantity() < 0)
                .map(BrokerPosition::getExpiration)
                .filter(exp -> !exp.isBefore(today))
                .min(Comparator.naturalOrder());
        if (earliestLeg.isPresent()) {
            LocalDate legFriday = expiryCalendarService.getNominalWeeklyExpiry(earliestLeg.get());
            if (legFriday.isBefore(head)) {
                head = legFriday;
            }
        }

        ScheduleWindow created = ScheduleWindow.create(head, wheelProperties.getSlotCount());
        window.set(created);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("targets", created.targetDates());
        context.put("recoveredFromLegs", earliestLeg.isPresent());
        decisionLogger.logSystemEvent(
                cycleId,
                DecisionSource.SCHEDULE_MANAGER,
                null,
                DecisionType.WINDOW_INITIALIZED,
                "Schedule window initialized at " + head,
                context,
                DecisionSeverity.INFO);
        return created;
    }

    /**
     * Applies the advance rules until none holds and clears CLOSED legs elsewhere.
     *
     * @return number of times the window advanced
     */
    public int advance(LocalDate today, PositionBook positionBook, long cycleId) {
        ScheduleWindow current = getWindow();
        int advances = 0;
        int limit = maxAdvances(current, today);

        while (advances < limit) {
            WeeklySlot head = current.head();
            Optional<WheelPosition> headLeg = positionBook.find(head.getSlotId());
            String why = headAdvanceReason(head, headLeg.orElse(null), today);
            if (why == null) {
                break;
            }

            if (headLeg.isPresent() && headLeg.get().getStatus() == PositionStatus.CLOSED) {
                positionBook.clear(head.getSlotId());
            }
            ScheduleWindow next = current.advance();

            Map<String, Object> context = new LinkedHashMap<>();
            context.put("retiredTarget", head.getTargetExpiration());
            context.put("appendedTarget", next.tail().getTargetExpiration());
            context.put("targets", next.targetDates());
            decisionLogger.logSystemEvent(
                    cycleId,
                    DecisionSource.SCHEDULE_MANAGER,
                    head.getSlotId(),
                    DecisionType.WINDOW_ADVANCED,
                    "Window advanced: " + why,
                    context,
                    DecisionSeverity.INFO);

            current = next;
            advances++;
        }

        window.set(current);

        for (WeeklySlot slot : current.getSlots()) {
            positionBook
                    .find(slot.getSlotId())
                    .filter(p -> p.getStatus() == PositionStatus.CLOSED)
                    .ifPresent(p -> {
                        log.info("Slot {} leg {} closed, slot back to EMPTY", slot.getSlotId(), p.getContractId());
                        positionBook.clear(slot.getSlotId());
                    });
        }
        return advances;
    }

    /**
     * Upper bound on advances in one pass: each original slot retires at most once for a
     * closed or rolled-out leg, and empty heads retire once per week elapsed since the head.
     */
    public int maxAdvances(ScheduleWindow window, LocalDate today) {
        long weeksBehind = Math.max(0, ChronoUnit.WEEKS.between(window.head().getTargetExpiration(), today));
        return (int) Math.min(Integer.MAX_VALUE - 2L, wheelProperties.getSlotCount() + weeksBehind + 2);
    }

    /** Null when the head should stay, otherwise a short description of why it retires. */
    String headAdvanceReason(WeeklySlot head, WheelPosition leg, LocalDate today) {
        long daysToTarget = ChronoUnit.DAYS.between(today, head.getTargetExpiration());
        if (leg == null) {
            return daysToTarget <= wheelProperties.getMinDaysToExpiry()
                    ? "empty head slot " + head.getSlotId() + " reached " + head.getTargetExpiration()
                    : null;
        }
        if (leg.getStatus() == PositionStatus.CLOSED) {
            return "head slot " + head.getSlotId() + " leg closed";
        }
        LocalDate legExpiration = leg.getExpiration();
        int tolerance = wheelProperties.getChain().getExpirationToleranceDays();
        if (legExpiration != null && legExpiration.isAfter(head.getTargetExpiration().plusDays(tolerance))) {
            return "head slot " + head.getSlotId() + " rolled out to " + legExpiration;
        }
        return null;
    }

    /**
     * Target expiration for a roll replacement. The head rolls out to the date the next
     * appended slot will take; every other slot keeps its own date (a strike roll), so two
     * slots never share an expiration.
     */
    public LocalDate rollTarget(ScheduleWindow window, int slotId) {
        if (window.isHead(slotId)) {
            return window.nextTailExpiration();
        }
        return window.find(slotId)
                .map(WeeklySlot::getTargetExpiration)
                .orElseThrow(() -> new IllegalArgumentException("Unknown slot " + slotId));
    }

    /** Slot whose target is closest to the expiration, within the chain tolerance. */
    public Optional<WeeklySlot> slotForExpiration(ScheduleWindow window, LocalDate expiration) {
        int tolerance = wheelProperties.getChain().getExpirationToleranceDays();
        return window.getSlots().stream()
                .filter(s -> Math.abs(ChronoUnit.DAYS.between(s.getTargetExpiration(), expiration)) <= tolerance)
                .min(Comparator.comparingLong(
                        s -> Math.abs(ChronoUnit.DAYS.between(s.getTargetExpiration(), expiration))));
    }
}
