package com.wheeltrader.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.Optional;
import lombok.Builder;
import lombok.Value;

/** Snapshot quote of the underlying equity. */
@Value
@Builder
public class UnderlyingQuote {

    String symbol;
    BigDecimal last;
    BigDecimal close;
    BigDecimal bid;
    BigDecimal ask;
    Instant timestamp;

    /**
     * Usable price for the underlying: last trade, then previous close, then the bid/ask
     * midpoint. Empty when none of them is a positive number.
     */
    public Optional<BigDecimal> resolvePrice() {
        if (isPositive(last)) {
            return Optional.of(last);
        }
        if (isPositive(close)) {
            return Optional.of(close);
        }
        if (isPositive(bid) && isPositive(ask)) {
            return Optional.of(bid.add(ask).divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP));
        }
        return Optional.empty();
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }
}
