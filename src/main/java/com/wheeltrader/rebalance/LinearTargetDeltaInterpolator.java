package com.wheeltrader.rebalance;

import java.math.BigDecimal;
import java.math.RoundingMode;
import org.springframework.stereotype.Component;

/** Default interpolation: {@code min + |bias| * (max - min)}. */
@Component
public class LinearTargetDeltaInterpolator implements TargetDeltaInterpolator {

    @Override
    public BigDecimal interpolate(BigDecimal biasMagnitude, BigDecimal minTargetDelta, BigDecimal maxTargetDelta) {
        BigDecimal weight = biasMagnitude.max(BigDecimal.ZERO).min(BigDecimal.ONE);
        return minTargetDelta
                .add(weight.multiply(maxTargetDelta.subtract(minTargetDelta)))
                .setScale(4, RoundingMode.HALF_UP);
    }
}
