package com.wheeltrader.unit.simulator;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.wheeltrader.calendar.ExpiryCalendarService;
import com.wheeltrader.calendar.HolidayCalendarConfig;
import com.wheeltrader.calendar.TradingCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.core.processor.GreeksCalculator;
import com.wheeltrader.core.processor.IVCalculator;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.enums.OrderStatus;
import com.wheeltrader.domain.enums.OrderType;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.event.EventPublisherHelper;
import com.wheeltrader.exception.BrokerException;
import com.wheeltrader.simulator.SimulatedAccount;
import com.wheeltrader.simulator.SimulatedMarket;
import com.wheeltrader.simulator.SimulatorProperties;
import com.wheeltrader.simulator.VirtualOrderBook;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for VirtualOrderBook matching, resting orders, modification, cancellation and
 * rejection.
 */
class VirtualOrderBookTest {

    private static final String PUT_ID =
            SimulatedMarket.contractId("F", LocalDate.of(2026, 10, 30), OptionSide.PUT, new BigDecimal("11"));

    private SimulatorProperties simulatorProperties;
    private SimulatedMarket market;
    private SimulatedAccount account;
    private EventPublisherHelper eventPublisherHelper;
    private VirtualOrderBook book;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-10-19T14:00:00Z"), ZoneId.of("America/New_York"));
        TradingCalendarService calendar =
                new TradingCalendarService(new HolidayCalendarConfig(), mock(EventPublisherHelper.class), clock);
        GreeksCalculator greeksCalculator =
                new GreeksCalculator(new IVCalculator(), calendar, new WheelProperties(), clock);
        simulatorProperties = new SimulatorProperties();
        market = new SimulatedMarket(
                simulatorProperties, greeksCalculator, new ExpiryCalendarService(calendar), clock);
        account = new SimulatedAccount(simulatorProperties);
        eventPublisherHelper = mock(EventPublisherHelper.class);
        book = new VirtualOrderBook(market, account, eventPublisherHelper, simulatorProperties, clock);
    }

    @Nested
    @DisplayName("Matching")
    class Matching {

        @Test
        @DisplayName("limit sell at the mid fills at its limit and credits premium")
        void sellAtMid() {
            BigDecimal mid = mid();

            String id = book.placeOrder(limit(OrderSide.SELL, mid));

            assertThat(id).isEqualTo("SIM-000001");
            assertThat(book.getPendingOrderCount()).isZero();
            BrokerPosition leg = account.positions().get(0);
            assertThat(leg.getQuantity()).isEqualTo(-1);
            assertThat(account.balances().getCash())
                    .isEqualByComparingTo(new BigDecimal("50000").add(mid.multiply(BigDecimal.valueOf(100))));
            verify(eventPublisherHelper).publishOrderAcked(eq(book), any(), eq(OrderStatus.PENDING));
            verify(eventPublisherHelper).publishOrderFilled(
                    eq(book),
                    argThat(o -> o.getStatus() == OrderStatus.COMPLETE && o.getFilledQuantity() == 1),
                    eq(OrderStatus.OPEN));
        }

        @Test
        @DisplayName("limit sell above the mid rests until repriced")
        void sellAboveMidRests() {
            BigDecimal mid = mid();
            String id = book.placeOrder(limit(OrderSide.SELL, mid.add(new BigDecimal("0.05"))));

            assertThat(book.getPendingOrderCount()).isEqualTo(1);
            verify(eventPublisherHelper, never()).publishOrderFilled(any(), any(), any());

            book.modifyOrder(id, BrokerOrder.builder().price(mid).build());

            assertThat(book.getPendingOrderCount()).isZero();
            verify(eventPublisherHelper).publishOrderModified(eq(book), any());
            verify(eventPublisherHelper).publishOrderFilled(eq(book), any(), eq(OrderStatus.OPEN));
        }

        @Test
        @DisplayName("market buy fills at the ask")
        void marketBuy() {
            OptionContract quote = market.quote(PUT_ID).orElseThrow();

            book.placeOrder(BrokerOrder.builder()
                    .contractId(PUT_ID)
                    .side(OrderSide.BUY)
                    .type(OrderType.MARKET)
                    .quantity(1)
                    .build());

            assertThat(book.getOrders().get(0).getAverageFillPrice()).isEqualByComparingTo(quote.getAsk());
            assertThat(account.positions().get(0).getQuantity()).isEqualTo(1);
        }

        @Test
        @DisplayName("resting sell fills after a spot move lifts the mid")
        void rematchAfterSpotMove() {
            book.placeOrder(limit(OrderSide.SELL, mid().add(new BigDecimal("0.05"))));

            market.setSpot(new BigDecimal("11.50"));

            assertThat(book.matchPending()).isEqualTo(1);
            assertThat(book.getPendingOrderCount()).isZero();
        }

        @Test
        @DisplayName("nothing matches on its own with auto-match off")
        void autoMatchOff() {
            simulatorProperties.setAutoMatch(false);

            book.placeOrder(limit(OrderSide.SELL, mid()));

            assertThat(book.getPendingOrderCount()).isEqualTo(1);
            assertThat(book.matchPending()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Cancel and reject")
    class CancelReject {

        @Test
        @DisplayName("cancel removes a resting order once")
        void cancel() {
            String id = book.placeOrder(limit(OrderSide.BUY, new BigDecimal("0.01")));

            book.cancelOrder(id);

            assertThat(book.getPendingOrderCount()).isZero();
            verify(eventPublisherHelper).publishOrderCancelled(
                    eq(book), argThat(o -> o.getStatus() == OrderStatus.CANCELLED), eq(OrderStatus.OPEN));
            assertThatThrownBy(() -> book.cancelOrder(id)).isInstanceOf(BrokerException.class);
        }

        @Test
        @DisplayName("modifying a filled order fails")
        void modifyFilled() {
            String id = book.placeOrder(limit(OrderSide.SELL, mid()));

            assertThatThrownBy(() -> book.modifyOrder(id, BrokerOrder.builder().price(BigDecimal.ONE).build()))
                    .isInstanceOf(BrokerException.class);
        }

        @Test
        @DisplayName("rejectNextOrder rejects exactly one order")
        void rejectNext() {
            book.rejectNextOrder("insufficient margin");

            book.placeOrder(limit(OrderSide.SELL, mid()));
            book.placeOrder(limit(OrderSide.SELL, mid()));

            verify(eventPublisherHelper).publishOrderRejected(
                    eq(book),
                    argThat(o -> "insufficient margin".equals(o.getRejectionReason())),
                    eq(OrderStatus.PENDING));
            verify(eventPublisherHelper).publishOrderFilled(eq(book), any(), any());
        }

        @Test
        @DisplayName("unknown contract and limit without price are rejected")
        void invalidOrders() {
            book.placeOrder(BrokerOrder.builder()
                    .contractId("NOT-AN-OCC-ID")
                    .side(OrderSide.SELL)
                    .type(OrderType.LIMIT)
                    .quantity(1)
                    .price(BigDecimal.ONE)
                    .build());
            book.placeOrder(limit(OrderSide.SELL, null));

            assertThat(book.getOrders()).allMatch(o -> o.getStatus() == OrderStatus.REJECTED);
            assertThat(account.positions()).isEmpty();
        }
    }

    private BigDecimal mid() {
        return market.quote(PUT_ID).orElseThrow().getMid();
    }

    private static BrokerOrder limit(OrderSide side, BigDecimal price) {
        return BrokerOrder.builder()
                .contractId(PUT_ID)
                .correlationId("261019W0OPN0001")
                .side(side)
                .type(OrderType.LIMIT)
                .quantity(1)
                .price(price)
                .build();
    }
}
