package com.wheeltrader.simulator;

import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.enums.OrderStatus;
import com.wheeltrader.domain.enums.OrderType;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.event.EventPublisherHelper;
import com.wheeltrader.exception.BrokerException;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Order matching for paper trading.
 *
 * <p>Every accepted order is acknowledged, then matched against the current quote:
 * <ul>
 *   <li>MARKET SELL fills at the bid, MARKET BUY at the ask</li>
 *   <li>LIMIT SELL fills at its limit when the limit is at or below the mid</li>
 *   <li>LIMIT BUY fills at its limit when the limit is at or above the mid</li>
 * </ul>
 * Orders that do not match rest until they are repriced, cancelled or re-matched after a
 * spot move. With {@code wheel.simulator.auto-match=false} nothing matches on its own.
 *
 * <p>Status changes are published as order events, synchronously on the calling thread.
 */
@Service
public class VirtualOrderBook {

    private static final Logger log = LoggerFactory.getLogger(VirtualOrderBook.class);

    private final SimulatedMarket simulatedMarket;
    private final SimulatedAccount simulatedAccount;
    private final EventPublisherHelper eventPublisherHelper;
    private final SimulatorProperties simulatorProperties;
    private final Clock clock;

    private final Map<String, BrokerOrder> pendingOrders = new ConcurrentHashMap<>();
    private final Map<String, BrokerOrder> allOrders = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong(0);
    private final AtomicReference<String> rejectNext = new AtomicReference<>();

    public VirtualOrderBook(
            SimulatedMarket simulatedMarket,
            SimulatedAccount simulatedAccount,
            EventPublisherHelper eventPublisherHelper,
            SimulatorProperties simulatorProperties,
            Clock clock) {
        this.simulatedMarket = simulatedMarket;
        this.simulatedAccount = simulatedAccount;
        this.eventPublisherHelper = eventPublisherHelper;
        this.simulatorProperties = simulatorProperties;
        this.clock = clock;
    }

    public String placeOrder(BrokerOrder request) {
        Instant now = clock.instant();
        String brokerOrderId = String.format("SIM-%06d", sequence.incrementAndGet());
        BrokerOrder order = request.toBuilder()
                .brokerOrderId(brokerOrderId)
                .status(OrderStatus.PENDING)
                .placedAt(now)
                .updatedAt(now)
                .build();
        allOrders.put(brokerOrderId, order);

        String rejection = rejectNext.getAndSet(null);
        if (rejection == null && simulatedMarket.quote(order.getContractId()).isEmpty()) {
            rejection = "Unknown contract " + order.getContractId();
        }
        if (rejection == null && order.getType() == OrderType.LIMIT && order.getPrice() == null) {
            rejection = "LIMIT order without price";
        }
        if (rejection != null) {
            order.setStatus(OrderStatus.REJECTED);
            order.setRejectionReason(rejection);
            log.info("Virtual order {} rejected: {}", brokerOrderId, rejection);
            eventPublisherHelper.publishOrderRejected(this, copy(order), OrderStatus.PENDING);
            return brokerOrderId;
        }

        order.setStatus(OrderStatus.OPEN);
        pendingOrders.put(brokerOrderId, order);
        eventPublisherHelper.publishOrderAcked(this, copy(order), OrderStatus.PENDING);
        log.debug(
                "Virtual order placed: {} {} {} qty={} @ {}",
                brokerOrderId,
                order.getSide(),
                order.getContractId(),
                order.getQuantity(),
                order.getPrice());

        if (simulatorProperties.isAutoMatch()) {
            tryMatch(order);
        }
        return brokerOrderId;
    }

    public void modifyOrder(String brokerOrderId, BrokerOrder modification) {
        BrokerOrder existing = pendingOrders.get(brokerOrderId);
        if (existing == null) {
            throw new BrokerException("Order not found or no longer open: " + brokerOrderId);
        }
        if (modification.getPrice() != null) {
            existing.setPrice(modification.getPrice());
        }
        existing.setUpdatedAt(clock.instant());
        eventPublisherHelper.publishOrderModified(this, copy(existing));
        log.debug("Virtual order modified: {} @ {}", brokerOrderId, existing.getPrice());

        if (simulatorProperties.isAutoMatch()) {
            tryMatch(existing);
        }
    }

    public void cancelOrder(String brokerOrderId) {
        BrokerOrder order = pendingOrders.remove(brokerOrderId);
        if (order == null) {
            throw new BrokerException("Order not found or no longer open: " + brokerOrderId);
        }
        OrderStatus previous = order.getStatus();
        order.setStatus(OrderStatus.CANCELLED);
        order.setUpdatedAt(clock.instant());
        eventPublisherHelper.publishOrderCancelled(this, copy(order), previous);
        log.debug("Virtual order cancelled: {}", brokerOrderId);
    }

    /**
     * Re-matches resting orders against current quotes, oldest first.
     *
     * @return number of orders filled
     */
    public int matchPending() {
        List<BrokerOrder> resting = new ArrayList<>(pendingOrders.values());
        resting.sort(Comparator.comparing(BrokerOrder::getPlacedAt).thenComparing(BrokerOrder::getBrokerOrderId));
        int filled = 0;
        for (BrokerOrder order : resting) {
            if (tryMatch(order)) {
                filled++;
            }
        }
        return filled;
    }

    /** The next order placed is rejected with this reason. */
    public void rejectNextOrder(String reason) {
        rejectNext.set(reason);
    }

    public List<BrokerOrder> getOrders() {
        return allOrders.values().stream().map(VirtualOrderBook::copy).toList();
    }

    public int getPendingOrderCount() {
        return pendingOrders.size();
    }

    private boolean tryMatch(BrokerOrder order) {
        Optional<OptionContract> quote = simulatedMarket.quote(order.getContractId());
        if (quote.isEmpty()) {
            return false;
        }
        BigDecimal fillPrice = matchPrice(order, quote.get());
        if (fillPrice == null) {
            return false;
        }
        if (pendingOrders.remove(order.getBrokerOrderId()) == null) {
            return false;
        }

        OrderStatus previous = order.getStatus();
        simulatedAccount.applyFill(quote.get(), order.getSide(), order.getQuantity(), fillPrice);
        order.setStatus(OrderStatus.COMPLETE);
        order.setFilledQuantity(order.getQuantity());
        order.setAverageFillPrice(fillPrice);
        order.setUpdatedAt(clock.instant());
        log.info(
                "Virtual fill: {} {} {} x{} @ {}",
                order.getBrokerOrderId(),
                order.getSide(),
                order.getContractId(),
                order.getQuantity(),
                fillPrice);
        eventPublisherHelper.publishOrderFilled(this, copy(order), previous);
        return true;
    }

    /** Fill price for the order at this quote, or null when it does not match. */
    static BigDecimal matchPrice(BrokerOrder order, OptionContract quote) {
        if (order.getType() == OrderType.MARKET) {
            BigDecimal price = order.getSide() == OrderSide.SELL ? quote.getBid() : quote.getAsk();
            return price != null && price.signum() > 0 ? price : null;
        }
        BigDecimal mid = quote.getMid();
        if (mid == null || order.getPrice() == null) {
            return null;
        }
        boolean marketable = order.getSide() == OrderSide.SELL
                ? order.getPrice().compareTo(mid) <= 0
                : order.getPrice().compareTo(mid) >= 0;
        return marketable ? order.getPrice() : null;
    }

    private static BrokerOrder copy(BrokerOrder order) {
        return order.toBuilder().build();
    }
}
