package com.wheeltrader.unit.reconciliation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.wheeltrader.calendar.ExpiryCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.ReconciliationResult;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.reconciliation.PositionReconciler;
import com.wheeltrader.schedule.ScheduleManager;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionReconciler: closing vanished legs, confirming pending opens,
 * adopting unknown legs, orphans and invariant violations.
 */
class PositionReconcilerTest {

    private static final Instant NOW = Instant.parse("2026-10-19T15:00:00Z");
    private static final LocalDate HEAD = LocalDate.of(2026, 10, 30);

    private DecisionLogger decisionLogger;
    private PositionBook positionBook;
    private PositionReconciler reconciler;
    private ScheduleWindow window;

    @BeforeEach
    void setUp() {
        decisionLogger = mock(DecisionLogger.class);
        positionBook = new PositionBook();
        WheelProperties properties = new WheelProperties();
        ScheduleManager scheduleManager =
                new ScheduleManager(mock(ExpiryCalendarService.class), properties, decisionLogger);
        reconciler = new PositionReconciler(positionBook, scheduleManager, properties, decisionLogger);
        window = ScheduleWindow.create(HEAD, 5);
    }

    @Test
    @DisplayName("matching ledger and broker produce no changes")
    void inSync() {
        positionBook.put(leg(0, "F-A", HEAD, PositionStatus.OPEN));

        ReconciliationResult result = reconciler.reconcile(1, List.of(broker("F-A", "F", HEAD, -1)), window, NOW);

        assertThat(result.getMatched()).isEqualTo(1);
        assertThat(result.hasChanges()).isFalse();
        verify(decisionLogger, never()).logSystemEvent(
                anyLong(), any(), any(), any(), anyString(), anyMap(), any());
    }

    @Test
    @DisplayName("leg no longer reported by the broker is marked CLOSED")
    void vanishedLegClosed() {
        positionBook.put(leg(0, "F-A", HEAD, PositionStatus.OPEN));

        ReconciliationResult result = reconciler.reconcile(1, List.of(), window, NOW);

        assertThat(result.getClosed()).isEqualTo(1);
        assertThat(positionBook.find(0).orElseThrow().getStatus()).isEqualTo(PositionStatus.CLOSED);
        verify(decisionLogger).logSystemEvent(
                eq(1L), eq(DecisionSource.RECONCILIATION), any(), eq(DecisionType.RECONCILIATION),
                anyString(), anyMap(), eq(DecisionSeverity.INFO));
    }

    @Test
    @DisplayName("pending open not yet reported stays pending")
    void pendingOpenNotReported() {
        positionBook.put(leg(1, "F-B", HEAD.plusWeeks(1), PositionStatus.PENDING_OPEN));

        reconciler.reconcile(1, List.of(), window, NOW);

        assertThat(positionBook.find(1).orElseThrow().getStatus()).isEqualTo(PositionStatus.PENDING_OPEN);
    }

    @Test
    @DisplayName("pending open reported by the broker is confirmed OPEN at the broker's price")
    void pendingOpenConfirmed() {
        positionBook.put(leg(1, "F-B", HEAD.plusWeeks(1), PositionStatus.PENDING_OPEN));

        ReconciliationResult result =
                reconciler.reconcile(1, List.of(broker("F-B", "F", HEAD.plusWeeks(1), -1)), window, NOW);

        assertThat(result.getConfirmedOpen()).isEqualTo(1);
        WheelPosition leg = positionBook.find(1).orElseThrow();
        assertThat(leg.getStatus()).isEqualTo(PositionStatus.OPEN);
        assertThat(leg.getEntryPrice()).isEqualByComparingTo("0.50");
    }

    @Test
    @DisplayName("unknown short leg on an empty slot's date is adopted")
    void adoptsUnknownLeg() {
        ReconciliationResult result = reconciler.reconcile(
                1, List.of(broker("F-C", "F", HEAD.plusWeeks(2).minusDays(1), -1)), window, NOW);

        assertThat(result.getAdopted()).isEqualTo(1);
        WheelPosition adopted = positionBook.find(2).orElseThrow();
        assertThat(adopted.getStatus()).isEqualTo(PositionStatus.OPEN);
        assertThat(adopted.getContractId()).isEqualTo("F-C");
    }

    @Test
    @DisplayName("unknown leg may fill a slot waiting to reopen after a failed roll")
    void adoptsIntoAwaitingReopen() {
        positionBook.put(WheelPosition.builder()
                .slotId(2)
                .underlying("F")
                .expiration(HEAD.plusWeeks(2))
                .status(PositionStatus.PENDING_OPEN)
                .build());

        reconciler.reconcile(1, List.of(broker("F-C", "F", HEAD.plusWeeks(2), -1)), window, NOW);

        assertThat(positionBook.find(2).orElseThrow().getContractId()).isEqualTo("F-C");
        assertThat(positionBook.getControl(2)).isEqualTo(SlotControl.ACTIVE);
    }

    @Test
    @DisplayName("legs that fit no slot, long legs and other underlyings are left alone")
    void orphansAndIgnored() {
        ReconciliationResult result = reconciler.reconcile(1, List.of(
                broker("F-FAR", "F", HEAD.plusWeeks(10), -1),
                broker("F-LONG", "F", HEAD, 1),
                broker("AAPL-X", "AAPL", HEAD, -1)), window, NOW);

        assertThat(result.getBrokerLegCount()).isEqualTo(2);
        assertThat(result.getAlerts())
                .extracting(WheelAlert::getCondition)
                .containsExactly(WheelCondition.ORPHAN_POSITION, WheelCondition.ORPHAN_POSITION);
        assertThat(positionBook.all()).isEmpty();
    }

    @Test
    @DisplayName("second leg for an occupied slot halts the slot")
    void secondLegHaltsSlot() {
        positionBook.put(leg(3, "F-D", HEAD.plusWeeks(3), PositionStatus.OPEN));

        ReconciliationResult result = reconciler.reconcile(1, List.of(
                broker("F-D", "F", HEAD.plusWeeks(3), -1),
                broker("F-E", "F", HEAD.plusWeeks(3), -1)), window, NOW);

        assertThat(result.getHaltedSlots()).containsExactly(3);
        assertThat(positionBook.getControl(3)).isEqualTo(SlotControl.HALTED);
        assertThat(result.getAlerts()).singleElement().satisfies(a -> {
            assertThat(a.getCondition()).isEqualTo(WheelCondition.INVARIANT_VIOLATION);
            assertThat(a.getSlotId()).isEqualTo(3);
        });
        verify(decisionLogger).logSystemEvent(
                eq(1L), eq(DecisionSource.RECONCILIATION), any(), eq(DecisionType.RECONCILIATION),
                anyString(), anyMap(), eq(DecisionSeverity.CRITICAL));
    }

    @Test
    @DisplayName("more than one contract on a slot leg halts the slot once")
    void quantityViolation() {
        positionBook.put(leg(4, "F-F", HEAD.plusWeeks(4), PositionStatus.OPEN));
        List<BrokerPosition> positions = List.of(broker("F-F", "F", HEAD.plusWeeks(4), -2));

        ReconciliationResult first = reconciler.reconcile(1, positions, window, NOW);
        ReconciliationResult second = reconciler.reconcile(2, positions, window, NOW);

        assertThat(first.getHaltedSlots()).containsExactly(4);
        assertThat(second.getAlerts()).isEmpty();
        assertThat(positionBook.getControl(4)).isEqualTo(SlotControl.HALTED);
    }

    private WheelPosition leg(int slotId, String contractId, LocalDate expiration, PositionStatus status) {
        return WheelPosition.builder()
                .slotId(slotId)
                .contractId(contractId)
                .underlying("F")
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(expiration)
                .status(status)
                .build();
    }

    private BrokerPosition broker(String contractId, String underlying, LocalDate expiration, int quantity) {
        return BrokerPosition.builder()
                .contractId(contractId)
                .underlying(underlying)
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(expiration)
                .quantity(quantity)
                .averagePrice(new BigDecimal("0.50"))
                .build();
    }
}
