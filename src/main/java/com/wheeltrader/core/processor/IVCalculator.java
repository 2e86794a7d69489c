package com.wheeltrader.core.processor;

import com.wheeltrader.domain.enums.OptionSide;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.distribution.NormalDistribution;
import org.springframework.stereotype.Component;

/**
 * Implied volatility solver for European options: Newton-Raphson on vega, falling back to
 * bisection when vega vanishes (deep out of the money weeklies near expiry) or the Newton
 * step fails to settle.
 *
 * <p>Solved values are clamped to [{@value #IV_MIN}, {@value #IV_MAX}]. A price outside the
 * range Black-Scholes can produce returns -1.
 *
 * <p>Stateless and thread-safe.
 */
@Slf4j
@Component
public class IVCalculator {

    private static final double INITIAL_GUESS = 0.30;
    private static final double TOLERANCE = 0.0001;
    private static final int NEWTON_MAX_ITERATIONS = 100;
    private static final int BISECTION_MAX_ITERATIONS = 200;
    private static final double SIGMA_FLOOR = 0.001;
    private static final double SIGMA_CEILING = 5.0;

    static final double IV_MIN = 0.01;
    static final double IV_MAX = 3.0;

    private static final NormalDistribution NORM = new NormalDistribution();

    /**
     * @param s     underlying price
     * @param k     strike
     * @param t     years to expiry, must be positive
     * @param r     risk-free rate
     * @param q     continuous dividend yield
     * @param price observed option price (mid)
     * @return implied volatility as a decimal, or -1 if it cannot be solved
     */
    public double solve(double s, double k, double t, double r, double q, double price, OptionSide side) {
        if (price <= 0 || s <= 0 || k <= 0 || t <= 0) {
            return -1;
        }

        double iv = newton(s, k, t, r, q, price, side);
        if (Double.isNaN(iv)) {
            log.debug("Newton did not converge for S={} K={} T={} price={} {}, using bisection", s, k, t, price, side);
            iv = bisect(s, k, t, r, q, price, side);
        }
        return iv < 0 ? -1 : clamp(iv);
    }

    public double blackScholesPrice(double s, double k, double t, double r, double q, double sigma, OptionSide side) {
        double sqrtT = Math.sqrt(t);
        double d1 = d1(s, k, t, r, q, sigma);
        double d2 = d1 - sigma * sqrtT;
        double discountedSpot = s * Math.exp(-q * t);
        double discountedStrike = k * Math.exp(-r * t);

        if (side == OptionSide.CALL) {
            return discountedSpot * NORM.cumulativeProbability(d1) - discountedStrike * NORM.cumulativeProbability(d2);
        }
        return discountedStrike * NORM.cumulativeProbability(-d2) - discountedSpot * NORM.cumulativeProbability(-d1);
    }

    static double d1(double s, double k, double t, double r, double q, double sigma) {
        return (Math.log(s / k) + (r - q + sigma * sigma / 2.0) * t) / (sigma * Math.sqrt(t));
    }

    /** NaN when Newton fails; the caller then bisects. */
    private double newton(double s, double k, double t, double r, double q, double price, OptionSide side) {
        double sigma = INITIAL_GUESS;
        for (int i = 0; i < NEWTON_MAX_ITERATIONS; i++) {
            double diff = blackScholesPrice(s, k, t, r, q, sigma, side) - price;
            if (Math.abs(diff) < TOLERANCE) {
                return sigma;
            }
            double vega = s * Math.exp(-q * t) * NORM.density(d1(s, k, t, r, q, sigma)) * Math.sqrt(t);
            if (vega < 1e-10) {
                return Double.NaN;
            }
            sigma = Math.max(SIGMA_FLOOR, Math.min(SIGMA_CEILING, sigma - diff / vega));
        }
        return Double.NaN;
    }

    private double bisect(double s, double k, double t, double r, double q, double price, OptionSide side) {
        double lower = SIGMA_FLOOR;
        double upper = SIGMA_CEILING;
        double lowerPrice = blackScholesPrice(s, k, t, r, q, lower, side);
        double upperPrice = blackScholesPrice(s, k, t, r, q, upper, side);
        if (price < lowerPrice || price > upperPrice) {
            log.debug("Price {} outside achievable range [{}, {}]", price, lowerPrice, upperPrice);
            return -1;
        }

        for (int i = 0; i < BISECTION_MAX_ITERATIONS; i++) {
            double mid = (lower + upper) / 2.0;
            double midPrice = blackScholesPrice(s, k, t, r, q, mid, side);
            if (Math.abs(midPrice - price) < TOLERANCE) {
                return mid;
            }
            if (midPrice > price) {
                upper = mid;
            } else {
                lower = mid;
            }
        }
        return (lower + upper) / 2.0;
    }

    double clamp(double iv) {
        if (iv < IV_MIN || iv > IV_MAX) {
            log.warn("Suspect IV {}%, clamping to [{}%, {}%]", iv * 100, IV_MIN * 100, IV_MAX * 100);
            return Math.max(IV_MIN, Math.min(iv, IV_MAX));
        }
        return iv;
    }
}
