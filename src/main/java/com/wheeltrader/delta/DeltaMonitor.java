package com.wheeltrader.delta;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.core.processor.GreeksCalculator;
import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.model.Greeks;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.WheelPosition;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Observes the delta of every live leg and classifies it against the roll trigger.
 *
 * <p>Delta comes from the data source when the quote carries one, otherwise from
 * Black-Scholes on the quote midpoint. A leg whose quote is missing, older than
 * {@code wheel.stale-quote-threshold}, or unpriceable is STALE and keeps its last known
 * delta; the engine never rolls a STALE leg.
 */
@Component
public class DeltaMonitor {

    private static final Logger log = LoggerFactory.getLogger(DeltaMonitor.class);

    private final GreeksCalculator greeksCalculator;
    private final WheelProperties wheelProperties;

    public DeltaMonitor(GreeksCalculator greeksCalculator, WheelProperties wheelProperties) {
        this.greeksCalculator = greeksCalculator;
        this.wheelProperties = wheelProperties;
    }

    /** NEAR_MONEY when |delta| is at or above the roll trigger, IN_RANGE otherwise. */
    public DeltaStatus classify(BigDecimal delta) {
        return delta.abs().compareTo(wheelProperties.getRollTriggerDelta()) >= 0
                ? DeltaStatus.NEAR_MONEY
                : DeltaStatus.IN_RANGE;
    }

    /** Reads the delta of one leg from its quote. {@code quote} may be null. */
    public DeltaReading observe(WheelPosition position, OptionContract quote, BigDecimal underlyingPrice, Instant now) {
        if (quote == null) {
            return DeltaReading.stale("no quote for " + position.getContractId());
        }
        if (isStale(quote, now)) {
            return DeltaReading.stale("quote older than " + wheelProperties.getStaleQuoteThreshold());
        }
        if (quote.hasDelta()) {
            return new DeltaReading(quote.getDelta(), classify(quote.getDelta()), "quote");
        }
        if (underlyingPrice == null) {
            return DeltaReading.stale("no underlying price to compute delta");
        }
        Greeks greeks = greeksCalculator.calculate(
                underlyingPrice, quote.getStrike(), quote.getExpiration(), quote.getMid(), quote.getSide());
        if (!greeks.isAvailable()) {
            return DeltaReading.stale("implied volatility not solvable from mid " + quote.getMid());
        }
        return new DeltaReading(greeks.getDelta(), classify(greeks.getDelta()), "black-scholes");
    }

    /**
     * Updates delta and delta status of every live leg with a contract. Mutates the given
     * records; called by the evaluation loop between cycles only.
     */
    public void refresh(
            List<WheelPosition> positions, List<OptionContract> chain, BigDecimal underlyingPrice, Instant now) {
        Map<String, OptionContract> quotes = chain.stream()
                .collect(Collectors.toMap(OptionContract::getContractId, Function.identity(), (a, b) -> a));

        for (WheelPosition position : positions) {
            if (!position.isLive() || position.getContractId() == null) {
                continue;
            }
            DeltaReading reading = observe(position, quotes.get(position.getContractId()), underlyingPrice, now);
            if (reading.getDelta() != null) {
                position.setDelta(reading.getDelta());
            }
            if (reading.getStatus() != position.getDeltaStatus()) {
                log.info(
                        "Slot {} {} delta status {} -> {} (delta={}, source={})",
                        position.getSlotId(),
                        position.getContractId(),
                        position.getDeltaStatus(),
                        reading.getStatus(),
                        reading.getDelta(),
                        reading.getSource());
            }
            position.setDeltaStatus(reading.getStatus());
        }
    }

    /**
     * Fills in a Black-Scholes delta for chain contracts whose source provides none. Contracts
     * that cannot be priced are returned unchanged and rank after delta-bearing ones.
     */
    public List<OptionContract> enrichChain(List<OptionContract> chain, BigDecimal underlyingPrice) {
        if (underlyingPrice == null) {
            return chain;
        }
        return chain.stream()
                .map(contract -> contract.hasDelta() || contract.getMid() == null
                        ? contract
                        : withComputedDelta(contract, underlyingPrice))
                .toList();
    }

    private OptionContract withComputedDelta(OptionContract contract, BigDecimal underlyingPrice) {
        Greeks greeks = greeksCalculator.calculate(
                underlyingPrice, contract.getStrike(), contract.getExpiration(), contract.getMid(), contract.getSide());
        if (!greeks.isAvailable()) {
            return contract;
        }
        return contract.toBuilder()
                .delta(greeks.getDelta())
                .impliedVolatility(greeks.getIv())
                .build();
    }

    private boolean isStale(OptionContract quote, Instant now) {
        if (quote.getQuoteTime() == null) {
            return false;
        }
        Duration age = Duration.between(quote.getQuoteTime(), now);
        return age.compareTo(wheelProperties.getStaleQuoteThreshold()) > 0;
    }
}
