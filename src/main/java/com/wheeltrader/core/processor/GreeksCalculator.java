package com.wheeltrader.core.processor;

import com.wheeltrader.calendar.TradingCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.model.Greeks;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Black-Scholes Greeks for US equity options.
 *
 * <p>Used whenever the data source does not supply a delta: the Delta Monitor for live legs
 * and chain enrichment for candidate contracts. IV is first solved from the option mid by
 * {@link IVCalculator}, then delta, gamma and theta follow analytically from d1 and d2.
 *
 * <ul>
 *   <li>Delta: e^(-qT) N(d1) for calls, e^(-qT) (N(d1) - 1) for puts</li>
 *   <li>Gamma: e^(-qT) n(d1) / (S sigma sqrt(T))</li>
 *   <li>Theta: per calendar day</li>
 * </ul>
 *
 * <p>Time to expiry runs to the session close on the expiration date (16:00 ET, earlier on
 * early-close days) and is floored at one minute.
 */
@Component
public class GreeksCalculator {

    private static final double MINUTES_PER_YEAR = 525_960.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    private final IVCalculator ivCalculator;
    private final TradingCalendarService tradingCalendarService;
    private final WheelProperties wheelProperties;
    private final Clock clock;

    public GreeksCalculator(
            IVCalculator ivCalculator,
            TradingCalendarService tradingCalendarService,
            WheelProperties wheelProperties,
            Clock clock) {
        this.ivCalculator = ivCalculator;
        this.tradingCalendarService = tradingCalendarService;
        this.wheelProperties = wheelProperties;
        this.clock = clock;
    }

    /**
     * Solves IV from the option price, then computes Greeks.
     *
     * @return Greeks, or {@link Greeks#UNAVAILABLE} if any input is unusable or IV cannot be solved
     */
    public Greeks calculate(
            BigDecimal spotPrice, BigDecimal strike, LocalDate expiry, BigDecimal optionPrice, OptionSide side) {
        if (spotPrice == null || strike == null || optionPrice == null || expiry == null) {
            return Greeks.UNAVAILABLE;
        }
        double s = spotPrice.doubleValue();
        double k = strike.doubleValue();
        double price = optionPrice.doubleValue();
        if (price <= 0 || s <= 0 || k <= 0) {
            return Greeks.UNAVAILABLE;
        }

        double t = getTimeToExpiry(expiry);
        double r = wheelProperties.getPricing().getRiskFreeRate();
        double q = wheelProperties.getPricing().getDividendYield();
        double iv = ivCalculator.solve(s, k, t, r, q, price, side);
        if (iv < 0) {
            return Greeks.UNAVAILABLE;
        }
        return fromVolatility(s, k, t, r, q, iv, side);
    }

    /** Greeks from a known volatility, skipping the solver. */
    public Greeks calculateDirect(
            BigDecimal spotPrice, BigDecimal strike, LocalDate expiry, double iv, OptionSide side) {
        double s = spotPrice.doubleValue();
        double k = strike.doubleValue();
        if (s <= 0 || k <= 0 || iv <= 0) {
            return Greeks.UNAVAILABLE;
        }
        return fromVolatility(
                s,
                k,
                getTimeToExpiry(expiry),
                wheelProperties.getPricing().getRiskFreeRate(),
                wheelProperties.getPricing().getDividendYield(),
                iv,
                side);
    }

    /** Theoretical price with the configured rate and dividend yield. */
    public double theoreticalPrice(BigDecimal spotPrice, BigDecimal strike, LocalDate expiry, double iv, OptionSide side) {
        return ivCalculator.blackScholesPrice(
                spotPrice.doubleValue(),
                strike.doubleValue(),
                getTimeToExpiry(expiry),
                wheelProperties.getPricing().getRiskFreeRate(),
                wheelProperties.getPricing().getDividendYield(),
                iv,
                side);
    }

    private Greeks fromVolatility(double s, double k, double t, double r, double q, double iv, OptionSide side) {
        double sqrtT = Math.sqrt(t);
        double d1 = IVCalculator.d1(s, k, t, r, q, iv);
        double d2 = d1 - iv * sqrtT;
        double expQT = Math.exp(-q * t);
        double expRT = Math.exp(-r * t);
        double pdf = NORM.density(d1);

        double decay = -s * expQT * pdf * iv / (2.0 * sqrtT);
        double delta;
        double theta;
        if (side == OptionSide.CALL) {
            delta = expQT * NORM.cumulativeProbability(d1);
            theta = (decay + q * s * expQT * NORM.cumulativeProbability(d1) - r * k * expRT * NORM.cumulativeProbability(d2))
                    / 365.0;
        } else {
            delta = expQT * (NORM.cumulativeProbability(d1) - 1.0);
            theta = (decay
                            - q * s * expQT * NORM.cumulativeProbability(-d1)
                            + r * k * expRT * NORM.cumulativeProbability(-d2))
                    / 365.0;
        }
        double gamma = expQT * pdf / (s * iv * sqrtT);

        return Greeks.builder()
                .delta(BigDecimal.valueOf(delta).setScale(4, RoundingMode.HALF_UP))
                .gamma(BigDecimal.valueOf(gamma).setScale(6, RoundingMode.HALF_UP))
                .theta(BigDecimal.valueOf(theta).setScale(4, RoundingMode.HALF_UP))
                .iv(BigDecimal.valueOf(iv).setScale(4, RoundingMode.HALF_UP))
                .build();
    }

    /** Years until the session close on the expiration date, at least one minute. */
    double getTimeToExpiry(LocalDate expiry) {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime expiryClose = expiry.atTime(tradingCalendarService.getSessionClose(expiry));
        long minutes = Math.max(ChronoUnit.MINUTES.between(now, expiryClose), 1);
        return minutes / MINUTES_PER_YEAR;
    }
}
