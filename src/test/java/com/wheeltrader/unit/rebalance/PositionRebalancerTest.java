package com.wheeltrader.unit.rebalance;

import static org.assertj.core.api.Assertions.assertThat;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.SidePreference;
import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.AllocationPolicy;
import com.wheeltrader.domain.model.PortfolioState;
import com.wheeltrader.rebalance.LinearTargetDeltaInterpolator;
import com.wheeltrader.rebalance.PositionRebalancer;
import java.math.BigDecimal;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for PositionRebalancer bias and policy mapping.
 */
class PositionRebalancerTest {

    private PositionRebalancer rebalancer;

    @BeforeEach
    void setUp() {
        rebalancer = new PositionRebalancer(new WheelProperties(), new LinearTargetDeltaInterpolator());
    }

    @Nested
    @DisplayName("Allocation bias")
    class Bias {

        @Test
        @DisplayName("all cash is fully put-biased")
        void allCash() {
            assertThat(rebalancer.computeBias(0, 500)).isEqualByComparingTo("-1");
        }

        @Test
        @DisplayName("bias is the relative distance from the share target")
        void relative() {
            assertThat(rebalancer.computeBias(600, 500)).isEqualByComparingTo("0.2");
            assertThat(rebalancer.computeBias(500, 500)).isEqualByComparingTo("0");
        }

        @Test
        @DisplayName("excess shares clamp to +1")
        void clamped() {
            assertThat(rebalancer.computeBias(2000, 500)).isEqualByComparingTo("1");
        }

        @Test
        @DisplayName("no target gives a neutral bias")
        void noTarget() {
            assertThat(rebalancer.computeBias(300, 0)).isEqualByComparingTo("0");
        }
    }

    @Nested
    @DisplayName("Side preference")
    class Side {

        @Test
        @DisplayName("neutral band is inclusive")
        void band() {
            assertThat(rebalancer.sidePreference(new BigDecimal("-0.05"))).isEqualTo(SidePreference.EITHER);
            assertThat(rebalancer.sidePreference(new BigDecimal("0.05"))).isEqualTo(SidePreference.EITHER);
            assertThat(rebalancer.sidePreference(BigDecimal.ZERO)).isEqualTo(SidePreference.EITHER);
        }

        @Test
        @DisplayName("cash heavy prefers puts, equity heavy prefers calls")
        void outsideBand() {
            assertThat(rebalancer.sidePreference(new BigDecimal("-0.0501"))).isEqualTo(SidePreference.PUT);
            assertThat(rebalancer.sidePreference(new BigDecimal("0.0501"))).isEqualTo(SidePreference.CALL);
        }
    }

    @Test
    @DisplayName("target delta interpolates between the configured bounds")
    void targetDelta() {
        assertThat(rebalancer.targetDelta(BigDecimal.ZERO)).isEqualByComparingTo("0.20");
        assertThat(rebalancer.targetDelta(new BigDecimal("-0.5"))).isEqualByComparingTo("0.30");
        assertThat(rebalancer.targetDelta(BigDecimal.ONE.negate())).isEqualByComparingTo("0.40");
        assertThat(rebalancer.targetDelta(BigDecimal.ONE)).isEqualByComparingTo("0.40");
    }

    @Test
    @DisplayName("interpolator clamps magnitudes outside [0, 1]")
    void interpolatorClamps() {
        LinearTargetDeltaInterpolator interpolator = new LinearTargetDeltaInterpolator();
        BigDecimal min = new BigDecimal("0.20");
        BigDecimal max = new BigDecimal("0.40");

        assertThat(interpolator.interpolate(new BigDecimal("3"), min, max)).isEqualByComparingTo("0.40");
        assertThat(interpolator.interpolate(new BigDecimal("-1"), min, max)).isEqualByComparingTo("0.20");
    }

    @Test
    @DisplayName("nearest slots are funded first from |bias| 0.5")
    void nearestFirst() {
        AllocationPolicy strong = rebalancer.policyFor(new BigDecimal("-0.5"));
        AllocationPolicy mild = rebalancer.policyFor(new BigDecimal("0.4999"));

        assertThat(strong.isNearestFirst()).isTrue();
        assertThat(strong.getSidePreference()).isEqualTo(SidePreference.PUT);
        assertThat(strong.getExpirationPreference()).isEqualByComparingTo("0.5");
        assertThat(mild.isNearestFirst()).isFalse();
        assertThat(mild.getSidePreference()).isEqualTo(SidePreference.CALL);
    }

    @Test
    @DisplayName("portfolio state carries balances and the computed bias")
    void portfolioState() {
        Instant asOf = Instant.parse("2026-10-19T15:00:00Z");
        AccountBalances balances = AccountBalances.builder()
                .cash(new BigDecimal("50000"))
                .sharesHeld(250)
                .build();

        PortfolioState state = rebalancer.buildPortfolioState(balances, 500, new BigDecimal("100"), asOf);

        assertThat(state.getCashBalance()).isEqualByComparingTo("50000");
        assertThat(state.getSharesHeld()).isEqualTo(250);
        assertThat(state.getAllocationBias()).isEqualByComparingTo("-0.5");
        assertThat(state.hasUnderlyingPrice()).isTrue();
        assertThat(state.getAsOf()).isEqualTo(asOf);
    }
}
