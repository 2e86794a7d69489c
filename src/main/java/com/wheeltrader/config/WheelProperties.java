package com.wheeltrader.config;

import com.wheeltrader.domain.enums.OrderType;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Static configuration of the wheel, bound from the {@code wheel} prefix.
 *
 * <p>Loaded once at startup. The decision engine and its services read these values
 * but never change them; operator controls (pause, resume, close) live in the slot
 * ledger instead.
 *
 * <p>{@code targetShares} may be left unset when {@code fundingAmount} is given, in which
 * case it is derived from the first valid underlying price (see
 * {@link #deriveTargetShares(BigDecimal)}).
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "wheel")
public class WheelProperties {

    private String underlying = "F";

    private Integer targetShares;

    private BigDecimal fundingAmount;

    private int slotCount = 5;

    private int contractMultiplier = 100;

    /** Absolute delta at or above which a short leg is considered near the money. */
    private BigDecimal rollTriggerDelta = new BigDecimal("0.70");

    /** Days to expiry at or below which a leg is rolled regardless of delta. */
    private int minDaysToExpiry = 1;

    /** Quotes older than this are treated as missing. */
    private Duration staleQuoteThreshold = Duration.ofSeconds(30);

    private BigDecimal neutralBand = new BigDecimal("0.05");

    private Aggressiveness aggressiveness = new Aggressiveness();
    private Chain chain = new Chain();
    private Liquidity liquidity = new Liquidity();
    private Orders orders = new Orders();
    private Cycle cycle = new Cycle();
    private Pricing pricing = new Pricing();

    /**
     * Target share count from the funding amount: half the funding in stock, rounded down to
     * whole round lots, never below one lot. Falls back to one lot when the price is unusable.
     */
    public int deriveTargetShares(BigDecimal underlyingPrice) {
        if (targetShares != null) {
            return targetShares;
        }
        if (fundingAmount == null || underlyingPrice == null || underlyingPrice.signum() <= 0) {
            return contractMultiplier;
        }
        int lots = fundingAmount
                .multiply(new BigDecimal("0.5"))
                .divide(underlyingPrice, 0, RoundingMode.DOWN)
                .intValue()
                / contractMultiplier;
        return Math.max(lots, 1) * contractMultiplier;
    }

    @Getter
    @Setter
    public static class Aggressiveness {
        private BigDecimal minTargetDelta = new BigDecimal("0.20");
        private BigDecimal maxTargetDelta = new BigDecimal("0.40");

        /** Preference weight above which the nearest slots are funded first. */
        private BigDecimal nearestFirstThreshold = new BigDecimal("0.50");
    }

    @Getter
    @Setter
    public static class Chain {
        private int expirationToleranceDays = 2;
        private BigDecimal maxOtmPercent = new BigDecimal("0.15");
    }

    @Getter
    @Setter
    public static class Liquidity {
        private long minOpenInterest = 100;
        private BigDecimal maxSpread = new BigDecimal("0.25");
        private BigDecimal maxSpreadRatio = new BigDecimal("0.50");
        private BigDecimal minBid = new BigDecimal("0.05");
    }

    @Getter
    @Setter
    public static class Orders {
        private OrderType type = OrderType.LIMIT;
        private Duration ackTimeout = Duration.ofSeconds(30);
        private Duration fillTimeout = Duration.ofMinutes(2);
        private int maxReprices = 1;
    }

    @Getter
    @Setter
    public static class Cycle {
        private long intervalMs = 60_000;
        private long initialDelayMs = 5_000;
    }

    @Getter
    @Setter
    public static class Pricing {
        private double riskFreeRate = 0.045;
        private double dividendYield = 0.0;
    }
}
