package com.wheeltrader.domain.model;

import com.wheeltrader.domain.enums.OptionSide;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import lombok.Builder;
import lombok.Value;

/**
 * One listed option contract as returned by the broker's chain query, together with its
 * latest quote. Immutable: enrichment (for example a locally computed delta) produces a
 * copy via {@code toBuilder()}.
 *
 * <p>{@code delta} is signed (negative for puts) and may be null when the data source does
 * not provide it.
 */
@Value
@Builder(toBuilder = true)
public class OptionContract {

    String contractId;
    String underlying;
    OptionSide side;
    BigDecimal strike;
    LocalDate expiration;
    BigDecimal bid;
    BigDecimal ask;
    BigDecimal last;
    long openInterest;
    BigDecimal delta;
    BigDecimal impliedVolatility;
    Instant quoteTime;

    /** Bid/ask midpoint, or null when either side of the quote is missing. */
    public BigDecimal getMid() {
        if (bid == null || ask == null || bid.signum() < 0 || ask.signum() <= 0) {
            return null;
        }
        return bid.add(ask).divide(BigDecimal.valueOf(2), 4, RoundingMode.HALF_UP);
    }

    public BigDecimal getSpread() {
        if (bid == null || ask == null) {
            return null;
        }
        return ask.subtract(bid);
    }

    public boolean hasDelta() {
        return delta != null;
    }
}
