package com.wheeltrader.simulator;

import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.OptionContract;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Cash, shares and option legs of the paper account.
 *
 * <p>Premium is credited and debited at fill. Legs past their expiration are settled lazily
 * the next time the account is read: an in-the-money short put is assigned (cash paid,
 * shares received), an in-the-money short call is called away (shares delivered, cash
 * received), anything else expires worthless.
 */
@Component
public class SimulatedAccount {

    private static final Logger log = LoggerFactory.getLogger(SimulatedAccount.class);

    private static final int MULTIPLIER = 100;

    private final AtomicReference<BigDecimal> cash;
    private final AtomicLong shares;
    private final Map<String, BrokerPosition> positions = new ConcurrentHashMap<>();

    public SimulatedAccount(SimulatorProperties simulatorProperties) {
        this.cash = new AtomicReference<>(simulatorProperties.getStartingCash());
        this.shares = new AtomicLong(simulatorProperties.getStartingShares());
    }

    public AccountBalances balances() {
        return AccountBalances.builder().cash(cash.get()).sharesHeld(shares.get()).build();
    }

    public List<BrokerPosition> positions() {
        return new ArrayList<>(positions.values());
    }

    public synchronized void applyFill(OptionContract contract, OrderSide side, int quantity, BigDecimal price) {
        BigDecimal notional = price.multiply(BigDecimal.valueOf((long) quantity * MULTIPLIER));
        int signed = side == OrderSide.SELL ? -quantity : quantity;
        cash.updateAndGet(c -> side == OrderSide.SELL ? c.add(notional) : c.subtract(notional));

        BrokerPosition existing = positions.get(contract.getContractId());
        int newQuantity = (existing != null ? existing.getQuantity() : 0) + signed;
        if (newQuantity == 0) {
            positions.remove(contract.getContractId());
            return;
        }
        positions.put(contract.getContractId(), BrokerPosition.builder()
                .contractId(contract.getContractId())
                .underlying(contract.getUnderlying())
                .side(contract.getSide())
                .strike(contract.getStrike())
                .expiration(contract.getExpiration())
                .quantity(newQuantity)
                .averagePrice(price)
                .build());
    }

    /**
     * Settles every leg that expired before {@code today} against the given spot.
     *
     * @return number of legs settled
     */
    public synchronized int settleExpired(LocalDate today, BigDecimal spot) {
        int settled = 0;
        Iterator<BrokerPosition> it = positions.values().iterator();
        while (it.hasNext()) {
            BrokerPosition leg = it.next();
            if (!leg.getExpiration().isBefore(today)) {
                continue;
            }
            it.remove();
            settled++;
            int contracts = Math.abs(leg.getQuantity());
            BigDecimal strikeNotional = leg.getStrike().multiply(BigDecimal.valueOf((long) contracts * MULTIPLIER));
            boolean shortLeg = leg.getQuantity() < 0;
            if (leg.getSide() == OptionSide.PUT && shortLeg && leg.getStrike().compareTo(spot) > 0) {
                cash.updateAndGet(c -> c.subtract(strikeNotional));
                shares.addAndGet((long) contracts * MULTIPLIER);
                log.info("Simulated assignment: {} put, bought {} shares at {}", leg.getContractId(),
                        contracts * MULTIPLIER, leg.getStrike());
            } else if (leg.getSide() == OptionSide.CALL && shortLeg && leg.getStrike().compareTo(spot) < 0) {
                cash.updateAndGet(c -> c.add(strikeNotional));
                shares.addAndGet(-(long) contracts * MULTIPLIER);
                log.info("Simulated call-away: {} call, sold {} shares at {}", leg.getContractId(),
                        contracts * MULTIPLIER, leg.getStrike());
            } else {
                log.info("Simulated expiry: {} expired worthless", leg.getContractId());
            }
        }
        return settled;
    }

    /** Seeds a leg directly, as if it had been opened before the application started. */
    public void addPosition(BrokerPosition position) {
        positions.put(position.getContractId(), position);
    }

    public void setCash(BigDecimal value) {
        cash.set(value);
    }

    public void setShares(long value) {
        shares.set(value);
    }
}
