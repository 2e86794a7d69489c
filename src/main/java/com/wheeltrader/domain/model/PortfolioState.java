package com.wheeltrader.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Process-wide portfolio snapshot, rebuilt at the start of every cycle and never changed
 * while the cycle runs.
 *
 * <p>{@code allocationBias} is in [-1, 1]: negative when cash heavy (favour puts), positive
 * when equity heavy (favour calls). {@code underlyingPrice} is null when no usable price
 * could be resolved this cycle.
 */
@Value
@Builder
public class PortfolioState {

    BigDecimal cashBalance;
    long sharesHeld;
    int targetShares;
    BigDecimal allocationBias;
    BigDecimal underlyingPrice;
    Instant asOf;

    public boolean hasUnderlyingPrice() {
        return underlyingPrice != null;
    }
}
