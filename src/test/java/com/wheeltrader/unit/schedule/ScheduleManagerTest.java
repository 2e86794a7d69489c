package com.wheeltrader.unit.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.wheeltrader.calendar.ExpiryCalendarService;
import com.wheeltrader.calendar.HolidayCalendarConfig;
import com.wheeltrader.calendar.TradingCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.WeeklySlot;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.event.EventPublisherHelper;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.schedule.ScheduleManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ScheduleManager and ScheduleWindow: window creation, restart recovery,
 * head advance rules, roll targets and expiration-to-slot matching.
 */
class ScheduleManagerTest {

    private static final LocalDate MONDAY = LocalDate.of(2026, 10, 19);
    private static final LocalDate HEAD = LocalDate.of(2026, 10, 30);

    private DecisionLogger decisionLogger;
    private PositionBook positionBook;
    private ScheduleManager scheduleManager;

    @BeforeEach
    void setUp() {
        decisionLogger = mock(DecisionLogger.class);
        positionBook = new PositionBook();
        TradingCalendarService tradingCalendarService = new TradingCalendarService(
                new HolidayCalendarConfig(), mock(EventPublisherHelper.class), Clock.systemUTC());
        scheduleManager = new ScheduleManager(
                new ExpiryCalendarService(tradingCalendarService), new WheelProperties(), decisionLogger);
    }

    @Nested
    @DisplayName("Schedule window")
    class Window {

        @Test
        @DisplayName("create builds consecutive weekly targets with ids 0..n-1")
        void create() {
            ScheduleWindow window = ScheduleWindow.create(HEAD, 5);

            assertThat(window.targetDates()).containsExactly(
                    HEAD, HEAD.plusWeeks(1), HEAD.plusWeeks(2), HEAD.plusWeeks(3), HEAD.plusWeeks(4));
            assertThat(window.getSlots()).extracting(WeeklySlot::getSlotId).containsExactly(0, 1, 2, 3, 4);
            assertThat(window.nextTailExpiration()).isEqualTo(HEAD.plusWeeks(5));
        }

        @Test
        @DisplayName("advance retires the head and re-appends its id one week after the tail")
        void advance() {
            ScheduleWindow advanced = ScheduleWindow.create(HEAD, 5).advance();

            assertThat(advanced.head()).isEqualTo(new WeeklySlot(1, HEAD.plusWeeks(1)));
            assertThat(advanced.tail()).isEqualTo(new WeeklySlot(0, HEAD.plusWeeks(5)));
            assertThat(advanced.size()).isEqualTo(5);
            assertThat(advanced.indexOf(0)).isEqualTo(4);
            assertThat(advanced.isHead(1)).isTrue();
            assertThat(advanced.indexOf(9)).isEqualTo(-1);
        }

        @Test
        @DisplayName("rejects gaps and duplicate slot ids")
        void rejectsInvalidWindows() {
            assertThatThrownBy(() -> new ScheduleWindow(List.of(
                            new WeeklySlot(0, HEAD), new WeeklySlot(1, HEAD.plusWeeks(2)))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("not one week after");
            assertThatThrownBy(() -> new ScheduleWindow(List.of(
                            new WeeklySlot(0, HEAD), new WeeklySlot(0, HEAD.plusWeeks(1)))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Duplicate");
            assertThatThrownBy(() -> new ScheduleWindow(List.of())).isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Initialization")
    class Initialization {

        @Test
        @DisplayName("fresh start puts the head on the first Friday at least a week out")
        void freshStart() {
            ScheduleWindow window = scheduleManager.initialize(MONDAY, List.of(), 1);

            assertThat(window.head().getTargetExpiration()).isEqualTo(HEAD);
            assertThat(scheduleManager.isInitialized()).isTrue();
            verify(decisionLogger).logSystemEvent(
                    eq(1L), eq(DecisionSource.SCHEDULE_MANAGER), isNull(), eq(DecisionType.WINDOW_INITIALIZED),
                    anyString(), anyMap(), eq(DecisionSeverity.INFO));
        }

        @Test
        @DisplayName("restart with an earlier open leg moves the head back to that leg's week")
        void restartRecoversEarlierLeg() {
            List<BrokerPosition> legs = List.of(
                    brokerLeg("F", LocalDate.of(2026, 10, 23), -1),
                    brokerLeg("AAPL", LocalDate.of(2026, 10, 21), -1));

            ScheduleWindow window = scheduleManager.initialize(MONDAY, legs, 1);

            assertThat(window.head().getTargetExpiration()).isEqualTo(LocalDate.of(2026, 10, 23));
        }

        @Test
        @DisplayName("long legs and expired legs do not move the head")
        void ignoresLongAndExpiredLegs() {
            List<BrokerPosition> legs = List.of(
                    brokerLeg("F", LocalDate.of(2026, 10, 23), 1),
                    brokerLeg("F", LocalDate.of(2026, 10, 16), -1));

            assertThat(scheduleManager.initialize(MONDAY, legs, 1).head().getTargetExpiration()).isEqualTo(HEAD);
        }

        @Test
        @DisplayName("window is unavailable before initialization")
        void notInitialized() {
            assertThat(scheduleManager.isInitialized()).isFalse();
            assertThatThrownBy(() -> scheduleManager.getWindow()).isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("Advance rules")
    class Advance {

        @BeforeEach
        void init() {
            scheduleManager.initialize(MONDAY, List.of(), 1);
        }

        @Test
        @DisplayName("empty head far from its date stays")
        void emptyHeadStays() {
            assertThat(scheduleManager.advance(MONDAY, positionBook, 2)).isZero();
            assertThat(scheduleManager.getWindow().head().getTargetExpiration()).isEqualTo(HEAD);
        }

        @Test
        @DisplayName("empty head at min-days-to-expiry retires")
        void emptyHeadRetires() {
            int advances = scheduleManager.advance(HEAD.minusDays(1), positionBook, 2);

            assertThat(advances).isEqualTo(1);
            ScheduleWindow window = scheduleManager.getWindow();
            assertThat(window.head()).isEqualTo(new WeeklySlot(1, HEAD.plusWeeks(1)));
            assertThat(window.tail()).isEqualTo(new WeeklySlot(0, HEAD.plusWeeks(5)));
            verify(decisionLogger).logSystemEvent(
                    eq(2L), eq(DecisionSource.SCHEDULE_MANAGER), eq(0), eq(DecisionType.WINDOW_ADVANCED),
                    anyString(), anyMap(), eq(DecisionSeverity.INFO));
        }

        @Test
        @DisplayName("head with a closed leg retires and the slot is cleared")
        void closedHeadRetires() {
            positionBook.put(leg(0, HEAD, PositionStatus.CLOSED));

            assertThat(scheduleManager.advance(MONDAY, positionBook, 2)).isEqualTo(1);
            assertThat(positionBook.find(0)).isEmpty();
        }

        @Test
        @DisplayName("head with an open leg on its date stays for the engine to roll")
        void openHeadStays() {
            positionBook.put(leg(0, HEAD, PositionStatus.OPEN));

            assertThat(scheduleManager.advance(HEAD.minusDays(1), positionBook, 2)).isZero();
        }

        @Test
        @DisplayName("head rolled out to the next tail date retires and keeps its leg")
        void rolledHeadRetires() {
            positionBook.put(leg(0, HEAD.plusWeeks(5), PositionStatus.OPEN));

            assertThat(scheduleManager.advance(HEAD.minusDays(1), positionBook, 2)).isEqualTo(1);
            ScheduleWindow window = scheduleManager.getWindow();
            assertThat(window.tail().getSlotId()).isZero();
            assertThat(window.tail().getTargetExpiration()).isEqualTo(positionBook.find(0).orElseThrow().getExpiration());
        }

        @Test
        @DisplayName("window catches up over several missed weeks")
        void catchesUp() {
            int advances = scheduleManager.advance(LocalDate.of(2026, 11, 16), positionBook, 2);

            assertThat(advances).isEqualTo(3);
            assertThat(scheduleManager.getWindow().head().getTargetExpiration()).isEqualTo(LocalDate.of(2026, 11, 20));
            verify(decisionLogger, times(3)).logSystemEvent(
                    eq(2L), eq(DecisionSource.SCHEDULE_MANAGER), any(),
                    eq(DecisionType.WINDOW_ADVANCED), anyString(), anyMap(), eq(DecisionSeverity.INFO));
        }

        @Test
        @DisplayName("a year-long gap advances weekly until the head is ahead of today")
        void catchesUpAfterLongGap() {
            LocalDate yearLater = LocalDate.of(2027, 10, 18);

            int advances = scheduleManager.advance(yearLater, positionBook, 2);

            assertThat(advances).isEqualTo(51);
            assertThat(scheduleManager.getWindow().head().getTargetExpiration()).isEqualTo(HEAD.plusWeeks(51));
        }

        @Test
        @DisplayName("advance bound grows with the weeks the head is behind today")
        void advanceBound() {
            ScheduleWindow window = ScheduleWindow.create(HEAD, 5);

            assertThat(scheduleManager.maxAdvances(window, MONDAY)).isEqualTo(7);
            assertThat(scheduleManager.maxAdvances(window, LocalDate.of(2027, 10, 18))).isEqualTo(57);
        }

        @Test
        @DisplayName("closed legs outside the head are cleared without advancing")
        void clearsClosedNonHeadLegs() {
            positionBook.put(leg(3, HEAD.plusWeeks(3), PositionStatus.CLOSED));

            assertThat(scheduleManager.advance(MONDAY, positionBook, 2)).isZero();
            assertThat(positionBook.find(3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Targets")
    class Targets {

        @Test
        @DisplayName("head rolls to one week after the tail, other slots keep their date")
        void rollTarget() {
            ScheduleWindow window = ScheduleWindow.create(HEAD, 5);

            assertThat(scheduleManager.rollTarget(window, 0)).isEqualTo(HEAD.plusWeeks(5));
            assertThat(scheduleManager.rollTarget(window, 3)).isEqualTo(HEAD.plusWeeks(3));
            assertThatThrownBy(() -> scheduleManager.rollTarget(window, 7))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("holiday-shifted Thursday expiration maps to its Friday slot")
        void slotForExpiration() {
            ScheduleWindow window = ScheduleWindow.create(HEAD, 5);

            assertThat(scheduleManager.slotForExpiration(window, HEAD.plusWeeks(1).minusDays(1)))
                    .map(WeeklySlot::getSlotId)
                    .contains(1);
            assertThat(scheduleManager.slotForExpiration(window, HEAD.plusWeeks(8))).isEmpty();
        }
    }

    private WheelPosition leg(int slotId, LocalDate expiration, PositionStatus status) {
        return WheelPosition.builder()
                .slotId(slotId)
                .contractId("F-" + expiration + "-P95")
                .underlying("F")
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(expiration)
                .status(status)
                .build();
    }

    private BrokerPosition brokerLeg(String underlying, LocalDate expiration, int quantity) {
        return BrokerPosition.builder()
                .contractId(underlying + "-" + expiration + "-P95")
                .underlying(underlying)
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(expiration)
                .quantity(quantity)
                .averagePrice(new BigDecimal("0.50"))
                .build();
    }
}
