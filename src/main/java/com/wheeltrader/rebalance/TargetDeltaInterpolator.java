package com.wheeltrader.rebalance;

import java.math.BigDecimal;

/**
 * Maps bias magnitude to the absolute short delta new legs should target.
 *
 * <p>Replaceable: register another bean of this type marked {@code @Primary} to change how aggressiveness grows
 * with imbalance. Implementations must be pure and return a value within [min, max] for
 * any magnitude in [0, 1].
 */
public interface TargetDeltaInterpolator {

    BigDecimal interpolate(BigDecimal biasMagnitude, BigDecimal minTargetDelta, BigDecimal maxTargetDelta);
}
