package com.wheeltrader.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Black-Scholes delta and implied volatility for one contract. Only the figures the wheel
 * acts on are kept.
 *
 * <p>{@link #UNAVAILABLE} is returned when the IV solver cannot bracket the price; callers
 * must check {@link #isAvailable()} before using the delta.
 */
@Value
@Builder
public class Greeks {

    BigDecimal delta;
    BigDecimal gamma;
    BigDecimal theta;

    /** Implied volatility as a decimal (0.35 = 35%). */
    BigDecimal iv;

    public static final Greeks UNAVAILABLE = Greeks.builder()
            .delta(BigDecimal.ZERO)
            .gamma(BigDecimal.ZERO)
            .theta(BigDecimal.ZERO)
            .iv(BigDecimal.valueOf(-1))
            .build();

    public boolean isAvailable() {
        return this != UNAVAILABLE && iv != null && iv.signum() > 0;
    }
}
