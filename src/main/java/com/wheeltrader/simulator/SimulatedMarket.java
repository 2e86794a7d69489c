package com.wheeltrader.simulator;

import com.wheeltrader.calendar.ExpiryCalendarService;
import com.wheeltrader.core.processor.GreeksCalculator;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.model.Greeks;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.UnderlyingQuote;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.stereotype.Component;

/**
 * Synthetic option market for one underlying: a spot price the operator (or a test) moves,
 * and a weekly chain priced with Black-Scholes at a flat volatility.
 *
 * <p>Contract ids follow the OCC layout {@code {root}{yyMMdd}{P|C}{strike x 1000, 8 digits}},
 * e.g. {@code F261023P00011500}, so any id can be priced without a lookup table.
 */
@Component
public class SimulatedMarket {

    private static final DateTimeFormatter OCC_DATE = DateTimeFormatter.ofPattern("yyMMdd");
    private static final int OCC_SUFFIX_LENGTH = 15;
    private static final BigDecimal MIN_TICK = new BigDecimal("0.01");

    private final SimulatorProperties simulatorProperties;
    private final GreeksCalculator greeksCalculator;
    private final ExpiryCalendarService expiryCalendarService;
    private final Clock clock;

    private final AtomicReference<BigDecimal> spot;

    public SimulatedMarket(
            SimulatorProperties simulatorProperties,
            GreeksCalculator greeksCalculator,
            ExpiryCalendarService expiryCalendarService,
            Clock clock) {
        this.simulatorProperties = simulatorProperties;
        this.greeksCalculator = greeksCalculator;
        this.expiryCalendarService = expiryCalendarService;
        this.clock = clock;
        this.spot = new AtomicReference<>(simulatorProperties.getSpot());
    }

    public BigDecimal getSpot() {
        return spot.get();
    }

    public void setSpot(BigDecimal newSpot) {
        spot.set(newSpot);
    }

    public UnderlyingQuote quoteUnderlying(String underlying) {
        BigDecimal last = spot.get();
        return UnderlyingQuote.builder()
                .symbol(underlying)
                .last(last)
                .close(last)
                .bid(last.subtract(MIN_TICK))
                .ask(last.add(MIN_TICK))
                .timestamp(clock.instant())
                .build();
    }

    /** Every listed contract: all weeklies from today over the configured horizon. */
    public List<OptionContract> chain(String underlying) {
        LocalDate today = LocalDate.now(clock);
        Instant now = clock.instant();
        List<OptionContract> chain = new ArrayList<>();
        for (LocalDate expiry : expiryCalendarService.getExpiryDatesBetween(
                today, today.plusWeeks(simulatorProperties.getWeeks()))) {
            for (BigDecimal strike : listedStrikes()) {
                chain.add(price(underlying, OptionSide.PUT, strike, expiry, now));
                chain.add(price(underlying, OptionSide.CALL, strike, expiry, now));
            }
        }
        return chain;
    }

    /** Current quote of one contract, or empty when the id is not a well-formed OCC id. */
    public Optional<OptionContract> quote(String contractId) {
        if (contractId == null || contractId.length() <= OCC_SUFFIX_LENGTH) {
            return Optional.empty();
        }
        int split = contractId.length() - OCC_SUFFIX_LENGTH;
        try {
            String root = contractId.substring(0, split);
            LocalDate expiry = LocalDate.parse(contractId.substring(split, split + 6), OCC_DATE);
            OptionSide side = contractId.charAt(split + 6) == 'P' ? OptionSide.PUT : OptionSide.CALL;
            BigDecimal strike = new BigDecimal(contractId.substring(split + 7)).movePointLeft(3);
            return Optional.of(price(root, side, strike, expiry, clock.instant()));
        } catch (RuntimeException e) {
            return Optional.empty();
        }
    }

    public static String contractId(String underlying, LocalDate expiry, OptionSide side, BigDecimal strike) {
        long strikeMillis = strike.movePointRight(3).setScale(0, RoundingMode.HALF_UP).longValueExact();
        return String.format(
                "%s%s%s%08d", underlying, OCC_DATE.format(expiry), side == OptionSide.PUT ? "P" : "C", strikeMillis);
    }

    List<BigDecimal> listedStrikes() {
        BigDecimal step = simulatorProperties.getStrikeStep();
        BigDecimal atm = spot.get().divide(step, 0, RoundingMode.HALF_UP).multiply(step);
        List<BigDecimal> strikes = new ArrayList<>();
        for (int i = -simulatorProperties.getStrikesEachSide(); i <= simulatorProperties.getStrikesEachSide(); i++) {
            BigDecimal strike = atm.add(step.multiply(BigDecimal.valueOf(i)));
            if (strike.signum() > 0) {
                strikes.add(strike.setScale(2, RoundingMode.HALF_UP));
            }
        }
        return strikes;
    }

    private OptionContract price(String underlying, OptionSide side, BigDecimal strike, LocalDate expiry, Instant now) {
        BigDecimal s = spot.get();
        double vol = simulatorProperties.getVolatility();
        BigDecimal fair = BigDecimal.valueOf(greeksCalculator.theoreticalPrice(s, strike, expiry, vol, side))
                .setScale(2, RoundingMode.HALF_UP);
        BigDecimal halfSpread = simulatorProperties.getHalfSpread();
        BigDecimal bid = fair.subtract(halfSpread).max(BigDecimal.ZERO);
        BigDecimal ask = fair.add(halfSpread).max(MIN_TICK);

        OptionContract.OptionContractBuilder builder = OptionContract.builder()
                .contractId(contractId(underlying, expiry, side, strike))
                .underlying(underlying)
                .side(side)
                .strike(strike)
                .expiration(expiry)
                .bid(bid)
                .ask(ask)
                .last(fair)
                .openInterest(simulatorProperties.getOpenInterest())
                .quoteTime(now);
        if (simulatorProperties.isProvideDelta()) {
            Greeks greeks = greeksCalculator.calculateDirect(s, strike, expiry, vol, side);
            if (greeks.isAvailable()) {
                builder.delta(greeks.getDelta()).impliedVolatility(greeks.getIv());
            }
        }
        return builder.build();
    }
}
