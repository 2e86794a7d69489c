package com.wheeltrader.unit.delta;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.core.processor.GreeksCalculator;
import com.wheeltrader.delta.DeltaMonitor;
import com.wheeltrader.delta.DeltaReading;
import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.model.Greeks;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.WheelPosition;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for DeltaMonitor classification, observation and chain enrichment.
 */
class DeltaMonitorTest {

    private static final Instant NOW = Instant.parse("2026-10-19T15:00:00Z");
    private static final LocalDate EXPIRY = LocalDate.of(2026, 11, 6);
    private static final BigDecimal PRICE = new BigDecimal("100");

    private GreeksCalculator greeksCalculator;
    private DeltaMonitor monitor;

    @BeforeEach
    void setUp() {
        greeksCalculator = mock(GreeksCalculator.class);
        monitor = new DeltaMonitor(greeksCalculator, new WheelProperties());
    }

    @Test
    @DisplayName("roll trigger is inclusive on either sign")
    void classify() {
        assertThat(monitor.classify(new BigDecimal("-0.70"))).isEqualTo(DeltaStatus.NEAR_MONEY);
        assertThat(monitor.classify(new BigDecimal("0.70"))).isEqualTo(DeltaStatus.NEAR_MONEY);
        assertThat(monitor.classify(new BigDecimal("-0.6999"))).isEqualTo(DeltaStatus.IN_RANGE);
        assertThat(monitor.classify(new BigDecimal("0.10"))).isEqualTo(DeltaStatus.IN_RANGE);
    }

    @Nested
    @DisplayName("Observing one leg")
    class Observe {

        @Test
        @DisplayName("missing quote is STALE")
        void missingQuote() {
            DeltaReading reading = monitor.observe(leg(), null, PRICE, NOW);

            assertThat(reading.getStatus()).isEqualTo(DeltaStatus.STALE);
            assertThat(reading.getDelta()).isNull();
        }

        @Test
        @DisplayName("quote older than the threshold is STALE")
        void oldQuote() {
            OptionContract quote = quote("-0.30").toBuilder().quoteTime(NOW.minusSeconds(31)).build();

            assertThat(monitor.observe(leg(), quote, PRICE, NOW).getStatus()).isEqualTo(DeltaStatus.STALE);
        }

        @Test
        @DisplayName("delta from the data source is used as is")
        void sourceDelta() {
            OptionContract quote = quote("-0.72").toBuilder().quoteTime(NOW.minusSeconds(5)).build();

            DeltaReading reading = monitor.observe(leg(), quote, PRICE, NOW);

            assertThat(reading.getDelta()).isEqualByComparingTo("-0.72");
            assertThat(reading.getStatus()).isEqualTo(DeltaStatus.NEAR_MONEY);
            assertThat(reading.getSource()).isEqualTo("quote");
            verify(greeksCalculator, never()).calculate(any(), any(), any(), any(), any());
        }

        @Test
        @DisplayName("delta is computed from the mid when the source has none")
        void computedDelta() {
            when(greeksCalculator.calculate(any(), any(), any(), any(), any()))
                    .thenReturn(Greeks.builder().delta(new BigDecimal("-0.41")).iv(new BigDecimal("0.30")).build());

            DeltaReading reading = monitor.observe(leg(), quote(null), PRICE, NOW);

            assertThat(reading.getDelta()).isEqualByComparingTo("-0.41");
            assertThat(reading.getStatus()).isEqualTo(DeltaStatus.IN_RANGE);
            assertThat(reading.getSource()).isEqualTo("black-scholes");
        }

        @Test
        @DisplayName("unsolvable volatility is STALE")
        void unsolvable() {
            when(greeksCalculator.calculate(any(), any(), any(), any(), any())).thenReturn(Greeks.UNAVAILABLE);

            assertThat(monitor.observe(leg(), quote(null), PRICE, NOW).getStatus()).isEqualTo(DeltaStatus.STALE);
        }

        @Test
        @DisplayName("no underlying price and no source delta is STALE")
        void noUnderlying() {
            assertThat(monitor.observe(leg(), quote(null), null, NOW).getStatus()).isEqualTo(DeltaStatus.STALE);
        }
    }

    @Test
    @DisplayName("refresh updates live legs and keeps the last delta when stale")
    void refresh() {
        WheelPosition withQuote = leg();
        WheelPosition stale = leg().toBuilder().slotId(1).contractId("F-P90").build();
        stale.setDelta(new BigDecimal("-0.20"));
        WheelPosition closed = leg().toBuilder().slotId(2).contractId("F-P85").status(PositionStatus.CLOSED).build();

        monitor.refresh(List.of(withQuote, stale, closed), List.of(quote("-0.35")), PRICE, NOW);

        assertThat(withQuote.getDelta()).isEqualByComparingTo("-0.35");
        assertThat(withQuote.getDeltaStatus()).isEqualTo(DeltaStatus.IN_RANGE);
        assertThat(stale.getDelta()).isEqualByComparingTo("-0.20");
        assertThat(stale.getDeltaStatus()).isEqualTo(DeltaStatus.STALE);
        assertThat(closed.getDeltaStatus()).isNull();
    }

    @Test
    @DisplayName("enrichment fills missing deltas and leaves unpriceable contracts alone")
    void enrichChain() {
        OptionContract sourced = quote("-0.30");
        OptionContract missing = quote(null).toBuilder().contractId("F-P90").strike(new BigDecimal("90")).build();
        OptionContract unpriceable = missing.toBuilder().contractId("F-P80").strike(new BigDecimal("80")).build();
        when(greeksCalculator.calculate(any(), argThat(k -> k != null && k.intValue() == 90), any(), any(), any()))
                .thenReturn(Greeks.builder().delta(new BigDecimal("-0.15")).iv(new BigDecimal("0.28")).build());
        when(greeksCalculator.calculate(any(), argThat(k -> k != null && k.intValue() == 80), any(), any(), any()))
                .thenReturn(Greeks.UNAVAILABLE);

        List<OptionContract> enriched = monitor.enrichChain(List.of(sourced, missing, unpriceable), PRICE);

        assertThat(enriched.get(0)).isSameAs(sourced);
        assertThat(enriched.get(1).getDelta()).isEqualByComparingTo("-0.15");
        assertThat(enriched.get(1).getImpliedVolatility()).isEqualByComparingTo("0.28");
        assertThat(enriched.get(2).hasDelta()).isFalse();
    }

    @Test
    @DisplayName("enrichment without an underlying price returns the chain unchanged")
    void enrichWithoutPrice() {
        List<OptionContract> chain = List.of(quote(null));

        assertThat(monitor.enrichChain(chain, null)).isSameAs(chain);
    }

    private static WheelPosition leg() {
        return WheelPosition.builder()
                .slotId(0)
                .contractId("F-P95")
                .underlying("F")
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(EXPIRY)
                .status(PositionStatus.OPEN)
                .build();
    }

    private static OptionContract quote(String delta) {
        return OptionContract.builder()
                .contractId("F-P95")
                .underlying("F")
                .side(OptionSide.PUT)
                .strike(new BigDecimal("95"))
                .expiration(EXPIRY)
                .bid(new BigDecimal("1.00"))
                .ask(new BigDecimal("1.10"))
                .openInterest(500)
                .delta(delta != null ? new BigDecimal(delta) : null)
                .build();
    }
}
