package com.wheeltrader.simulator;

import com.wheeltrader.broker.BrokerGateway;
import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.UnderlyingQuote;
import com.wheeltrader.exception.BrokerDisconnectedException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Paper trading implementation of {@link BrokerGateway}: chain and quotes from the
 * {@link SimulatedMarket}, orders through the {@link VirtualOrderBook}, balances and legs from
 * the {@link SimulatedAccount}.
 *
 * <p>Expired legs are settled whenever positions or balances are read. The connection can be
 * dropped with {@link #setConnected(boolean)}; while down every call throws
 * {@link BrokerDisconnectedException}.
 */
@Service
public class SimulatorBrokerGateway implements BrokerGateway {

    private static final Logger log = LoggerFactory.getLogger(SimulatorBrokerGateway.class);

    private final SimulatedMarket simulatedMarket;
    private final SimulatedAccount simulatedAccount;
    private final VirtualOrderBook virtualOrderBook;
    private final Clock clock;

    private final AtomicBoolean connected = new AtomicBoolean(true);

    public SimulatorBrokerGateway(
            SimulatedMarket simulatedMarket,
            SimulatedAccount simulatedAccount,
            VirtualOrderBook virtualOrderBook,
            Clock clock) {
        this.simulatedMarket = simulatedMarket;
        this.simulatedAccount = simulatedAccount;
        this.virtualOrderBook = virtualOrderBook;
        this.clock = clock;
    }

    @Override
    public List<OptionContract> getOptionChain(String underlying) {
        ensureConnected();
        return simulatedMarket.chain(underlying);
    }

    @Override
    public UnderlyingQuote getUnderlyingQuote(String underlying) {
        ensureConnected();
        return simulatedMarket.quoteUnderlying(underlying);
    }

    @Override
    public List<BrokerPosition> getPositions() {
        ensureConnected();
        settle();
        return simulatedAccount.positions();
    }

    @Override
    public AccountBalances getAccountBalances(String underlying) {
        ensureConnected();
        settle();
        return simulatedAccount.balances();
    }

    @Override
    public String placeOrder(BrokerOrder order) {
        ensureConnected();
        log.debug("Simulator placeOrder: {} {} {} qty={} @ {}", order.getSide(), order.getType(),
                order.getContractId(), order.getQuantity(), order.getPrice());
        return virtualOrderBook.placeOrder(order);
    }

    @Override
    public void modifyOrder(String brokerOrderId, BrokerOrder order) {
        ensureConnected();
        log.debug("Simulator modifyOrder: {} @ {}", brokerOrderId, order.getPrice());
        virtualOrderBook.modifyOrder(brokerOrderId, order);
    }

    @Override
    public void cancelOrder(String brokerOrderId) {
        ensureConnected();
        log.debug("Simulator cancelOrder: {}", brokerOrderId);
        virtualOrderBook.cancelOrder(brokerOrderId);
    }

    @Override
    public List<BrokerOrder> getOrders() {
        ensureConnected();
        return virtualOrderBook.getOrders();
    }

    @Override
    public boolean isConnected() {
        return connected.get();
    }

    public void setConnected(boolean value) {
        boolean previous = connected.getAndSet(value);
        if (previous != value) {
            log.info("Simulator connection {}", value ? "restored" : "dropped");
        }
    }

    /** Moves the underlying and re-matches resting orders at the new quotes. */
    public void setSpot(BigDecimal spot) {
        simulatedMarket.setSpot(spot);
        virtualOrderBook.matchPending();
    }

    private void settle() {
        simulatedAccount.settleExpired(LocalDate.now(clock), simulatedMarket.getSpot());
    }

    private void ensureConnected() {
        if (!connected.get()) {
            throw new BrokerDisconnectedException("Simulated broker is disconnected");
        }
    }
}
