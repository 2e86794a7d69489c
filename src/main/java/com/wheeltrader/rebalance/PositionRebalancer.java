package com.wheeltrader.rebalance;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.SidePreference;
import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.AllocationPolicy;
import com.wheeltrader.domain.model.PortfolioState;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import org.springframework.stereotype.Component;

/**
 * Turns the cash/equity imbalance into the policy the decision engine trades by.
 *
 * <p>All mappings are pure functions of the bias:
 * <ul>
 *   <li>bias = (shares held - target) / target, clamped to [-1, 1]</li>
 *   <li>side: PUT below -band, CALL above +band, EITHER inside the band</li>
 *   <li>target delta: interpolated from |bias| between the configured bounds</li>
 *   <li>expiration preference: |bias|; at or above the threshold the nearest slots are funded first</li>
 * </ul>
 */
@Component
public class PositionRebalancer {

    private static final int BIAS_SCALE = 4;

    private final WheelProperties wheelProperties;
    private final TargetDeltaInterpolator targetDeltaInterpolator;

    public PositionRebalancer(WheelProperties wheelProperties, TargetDeltaInterpolator targetDeltaInterpolator) {
        this.wheelProperties = wheelProperties;
        this.targetDeltaInterpolator = targetDeltaInterpolator;
    }

    public BigDecimal computeBias(long sharesHeld, int targetShares) {
        if (targetShares <= 0) {
            return BigDecimal.ZERO.setScale(BIAS_SCALE);
        }
        BigDecimal raw = BigDecimal.valueOf(sharesHeld - targetShares)
                .divide(BigDecimal.valueOf(targetShares), BIAS_SCALE, RoundingMode.HALF_UP);
        return raw.max(BigDecimal.ONE.negate()).min(BigDecimal.ONE);
    }

    public SidePreference sidePreference(BigDecimal bias) {
        BigDecimal band = wheelProperties.getNeutralBand();
        if (bias.compareTo(band.negate()) < 0) {
            return SidePreference.PUT;
        }
        if (bias.compareTo(band) > 0) {
            return SidePreference.CALL;
        }
        return SidePreference.EITHER;
    }

    public BigDecimal targetDelta(BigDecimal bias) {
        WheelProperties.Aggressiveness bounds = wheelProperties.getAggressiveness();
        return targetDeltaInterpolator.interpolate(
                bias.abs(), bounds.getMinTargetDelta(), bounds.getMaxTargetDelta());
    }

    public BigDecimal expirationPreference(BigDecimal bias) {
        return bias.abs().min(BigDecimal.ONE);
    }

    public AllocationPolicy policyFor(BigDecimal bias) {
        BigDecimal preference = expirationPreference(bias);
        return AllocationPolicy.builder()
                .bias(bias)
                .sidePreference(sidePreference(bias))
                .targetDelta(targetDelta(bias))
                .expirationPreference(preference)
                .nearestFirst(preference.compareTo(wheelProperties.getAggressiveness().getNearestFirstThreshold()) >= 0)
                .build();
    }

    public PortfolioState buildPortfolioState(
            AccountBalances balances, int targetShares, BigDecimal underlyingPrice, Instant asOf) {
        return PortfolioState.builder()
                .cashBalance(balances.getCash())
                .sharesHeld(balances.getSharesHeld())
                .targetShares(targetShares)
                .allocationBias(computeBias(balances.getSharesHeld(), targetShares))
                .underlyingPrice(underlyingPrice)
                .asOf(asOf)
                .build();
    }
}
