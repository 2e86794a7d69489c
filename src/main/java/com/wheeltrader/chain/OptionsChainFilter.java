package com.wheeltrader.chain;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.TargetContract;
import com.wheeltrader.exception.NoEligibleContractException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;
import org.springframework.stereotype.Component;

/**
 * Narrows a raw chain snapshot to the contracts the wheel may sell.
 *
 * <p>A contract is eligible for a slot when:
 * <ul>
 *   <li>its expiration is the slot's target date, or the nearest listed expiration within
 *       {@code chain.expiration-tolerance-days} of it (ties go to the later date)</li>
 *   <li>it passes the liquidity predicate (open interest, minimum bid, spread)</li>
 *   <li>it is out of the money and within {@code chain.max-otm-percent} of the underlying</li>
 * </ul>
 *
 * <p>Stateless; every method is a pure function of its arguments and the static configuration.
 */
@Component
public class OptionsChainFilter {

    private final WheelProperties wheelProperties;

    public OptionsChainFilter(WheelProperties wheelProperties) {
        this.wheelProperties = wheelProperties;
    }

    /**
     * Picks the expiration to trade for a target date. Exact match first, otherwise the
     * closest within tolerance, preferring the later date on a tie.
     */
    public Optional<LocalDate> resolveExpiration(LocalDate target, Collection<LocalDate> available) {
        int tolerance = wheelProperties.getChain().getExpirationToleranceDays();
        return available.stream()
                .distinct()
                .filter(d -> Math.abs(ChronoUnit.DAYS.between(target, d)) <= tolerance)
                .min(Comparator.<LocalDate>comparingLong(d -> Math.abs(ChronoUnit.DAYS.between(target, d)))
                        .thenComparing((a, b) -> b.compareTo(a)));
    }

    /** Liquidity predicate built from {@code wheel.liquidity.*}. */
    public boolean isLiquid(OptionContract contract) {
        WheelProperties.Liquidity liquidity = wheelProperties.getLiquidity();
        if (contract.getOpenInterest() < liquidity.getMinOpenInterest()) {
            return false;
        }
        BigDecimal bid = contract.getBid();
        BigDecimal ask = contract.getAsk();
        if (bid == null || ask == null || bid.compareTo(liquidity.getMinBid()) < 0 || ask.compareTo(bid) < 0) {
            return false;
        }
        BigDecimal spread = contract.getSpread();
        if (spread.compareTo(liquidity.getMaxSpread()) <= 0) {
            return true;
        }
        BigDecimal mid = contract.getMid();
        return mid != null
                && mid.signum() > 0
                && spread.divide(mid, 4, RoundingMode.HALF_UP).compareTo(liquidity.getMaxSpreadRatio()) <= 0;
    }

    /** Out of the money and no further than the configured band from the underlying price. */
    public boolean isInStrikeBand(OptionContract contract, BigDecimal underlyingPrice) {
        BigDecimal band = underlyingPrice.multiply(wheelProperties.getChain().getMaxOtmPercent());
        if (contract.getSide() == OptionSide.PUT) {
            return contract.getStrike().compareTo(underlyingPrice) < 0
                    && contract.getStrike().compareTo(underlyingPrice.subtract(band)) >= 0;
        }
        return contract.getStrike().compareTo(underlyingPrice) > 0
                && contract.getStrike().compareTo(underlyingPrice.add(band)) <= 0;
    }

    /** Eligible contracts of one side for a target date, unranked. */
    public List<OptionContract> candidates(
            List<OptionContract> chain, LocalDate targetExpiration, OptionSide side, BigDecimal underlyingPrice) {
        Optional<LocalDate> expiration = resolveExpiration(
                targetExpiration, chain.stream().map(OptionContract::getExpiration).toList());
        if (expiration.isEmpty()) {
            return List.of();
        }
        return chain.stream()
                .filter(c -> c.getSide() == side)
                .filter(c -> expiration.get().equals(c.getExpiration()))
                .filter(this::isLiquid)
                .filter(c -> isInStrikeBand(c, underlyingPrice))
                .toList();
    }

    /**
     * Ranks candidates for a target delta: contracts whose |delta| is closest to the target
     * first, then contracts without a delta by distance of strike to the underlying. Contracts
     * already at or beyond the roll trigger are dropped so a new leg can never start out
     * near the money.
     */
    public List<OptionContract> rank(
            List<OptionContract> candidates, BigDecimal targetDelta, BigDecimal underlyingPrice) {
        BigDecimal rollTrigger = wheelProperties.getRollTriggerDelta();
        Comparator<OptionContract> byDelta = Comparator.comparing(c -> c.getDelta().abs().subtract(targetDelta).abs());
        Comparator<OptionContract> byStrike = Comparator.comparing(c -> c.getStrike().subtract(underlyingPrice).abs());

        List<OptionContract> withDelta = candidates.stream()
                .filter(OptionContract::hasDelta)
                .filter(c -> c.getDelta().abs().compareTo(rollTrigger) < 0)
                .sorted(byDelta.thenComparing(byStrike))
                .toList();
        List<OptionContract> withoutDelta = candidates.stream()
                .filter(c -> !c.hasDelta())
                .sorted(byStrike)
                .toList();

        return Stream.concat(withDelta.stream(), withoutDelta.stream()).toList();
    }

    /**
     * Ranked eligible contracts of one side for a slot's target date.
     *
     * @throws NoEligibleContractException when nothing survives filtering
     */
    public List<OptionContract> eligible(
            int slotId,
            List<OptionContract> chain,
            LocalDate targetExpiration,
            OptionSide side,
            BigDecimal targetDelta,
            BigDecimal underlyingPrice) {
        List<OptionContract> ranked = rank(candidates(chain, targetExpiration, side, underlyingPrice), targetDelta, underlyingPrice);
        if (ranked.isEmpty()) {
            throw new NoEligibleContractException(slotId, targetExpiration, "no liquid " + side + " in strike band");
        }
        return ranked;
    }

    /** Attaches limit price (mid), premium and collateral to a chosen contract. */
    public TargetContract toTarget(OptionContract contract, BigDecimal targetDelta) {
        BigDecimal multiplier = BigDecimal.valueOf(wheelProperties.getContractMultiplier());
        BigDecimal mid = contract.getMid().setScale(2, RoundingMode.HALF_UP);
        BigDecimal collateral = contract.getSide() == OptionSide.PUT
                ? contract.getStrike().multiply(multiplier)
                : multiplier;
        return TargetContract.builder()
                .contract(contract)
                .targetDelta(targetDelta)
                .limitPrice(mid)
                .premium(mid.multiply(multiplier))
                .collateral(collateral)
                .build();
    }
}
