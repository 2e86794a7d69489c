package com.wheeltrader.core.engine;

import com.wheeltrader.broker.BrokerConnectionMonitor;
import com.wheeltrader.broker.BrokerGateway;
import com.wheeltrader.calendar.TradingCalendarService;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.delta.DeltaMonitor;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.MarketPhase;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.AccountBalances;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.CycleOutcome;
import com.wheeltrader.domain.model.CycleSnapshot;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.PortfolioState;
import com.wheeltrader.domain.model.ReconciliationResult;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.SlotSnapshot;
import com.wheeltrader.domain.model.UnderlyingQuote;
import com.wheeltrader.domain.model.WeeklySlot;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.event.EventPublisherHelper;
import com.wheeltrader.event.MarketStatusEvent;
import com.wheeltrader.event.OrderEvent;
import com.wheeltrader.exception.BrokerDisconnectedException;
import com.wheeltrader.exception.BrokerException;
import com.wheeltrader.exception.MarketClosedException;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.observability.WheelMetricsService;
import com.wheeltrader.oms.OrderLifecycleManager;
import com.wheeltrader.oms.OrderTimeoutMonitor;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.rebalance.PositionRebalancer;
import com.wheeltrader.reconciliation.PositionReconciler;
import com.wheeltrader.schedule.ScheduleManager;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * The evaluation loop: gathers a consistent snapshot, asks the decision engine for a batch
 * and hands the batch to the order lifecycle manager.
 *
 * <p><b>Triggers:</b> a fixed-delay timer, every broker order event and the market opening.
 * Triggers are coalesced: while a cycle is already queued, further triggers are dropped, so
 * at most one cycle runs and one waits. Cycles run one at a time on the single-threaded
 * {@code cycleExecutor}; all slot records are mutated on that thread.
 *
 * <p><b>Cycle steps:</b>
 * <ol>
 *   <li>apply queued order events</li>
 *   <li>read balances, positions, chain and underlying quote from the broker</li>
 *   <li>initialize the window on the first cycle</li>
 *   <li>reconcile the slot ledger with the broker</li>
 *   <li>refresh leg deltas and advance the window</li>
 *   <li>check slot invariants, halting violating slots</li>
 *   <li>reprice or cancel timed-out orders</li>
 *   <li>decide, log and dispatch</li>
 * </ol>
 * When the broker cannot be read every slot holds with BROKER_DISCONNECTED.
 */
@Service
public class WheelCycleRunner {

    private static final Logger log = LoggerFactory.getLogger(WheelCycleRunner.class);

    private final BrokerGateway brokerGateway;
    private final BrokerConnectionMonitor brokerConnectionMonitor;
    private final TradingCalendarService tradingCalendarService;
    private final ScheduleManager scheduleManager;
    private final PositionBook positionBook;
    private final PositionReconciler positionReconciler;
    private final DeltaMonitor deltaMonitor;
    private final PositionRebalancer positionRebalancer;
    private final RollingDecisionEngine rollingDecisionEngine;
    private final OrderLifecycleManager orderLifecycleManager;
    private final OrderTimeoutMonitor orderTimeoutMonitor;
    private final DecisionLogger decisionLogger;
    private final EventPublisherHelper eventPublisherHelper;
    private final WheelMetricsService wheelMetricsService;
    private final WheelProperties wheelProperties;
    private final Clock clock;
    private final Executor cycleExecutor;

    private final AtomicBoolean cyclePending = new AtomicBoolean(false);
    private final AtomicLong cycleCounter = new AtomicLong(0);
    private final AtomicReference<CycleOutcome> lastOutcome = new AtomicReference<>();
    private final AtomicReference<CycleSnapshot> lastSnapshot = new AtomicReference<>();
    private final AtomicReference<Integer> derivedTargetShares = new AtomicReference<>();

    public WheelCycleRunner(
            BrokerGateway brokerGateway,
            BrokerConnectionMonitor brokerConnectionMonitor,
            TradingCalendarService tradingCalendarService,
            ScheduleManager scheduleManager,
            PositionBook positionBook,
            PositionReconciler positionReconciler,
            DeltaMonitor deltaMonitor,
            PositionRebalancer positionRebalancer,
            RollingDecisionEngine rollingDecisionEngine,
            OrderLifecycleManager orderLifecycleManager,
            OrderTimeoutMonitor orderTimeoutMonitor,
            DecisionLogger decisionLogger,
            EventPublisherHelper eventPublisherHelper,
            WheelMetricsService wheelMetricsService,
            WheelProperties wheelProperties,
            Clock clock,
            @Qualifier("cycleExecutor") Executor cycleExecutor) {
        this.brokerGateway = brokerGateway;
        this.brokerConnectionMonitor = brokerConnectionMonitor;
        this.tradingCalendarService = tradingCalendarService;
        this.scheduleManager = scheduleManager;
        this.positionBook = positionBook;
        this.positionReconciler = positionReconciler;
        this.deltaMonitor = deltaMonitor;
        this.positionRebalancer = positionRebalancer;
        this.rollingDecisionEngine = rollingDecisionEngine;
        this.orderLifecycleManager = orderLifecycleManager;
        this.orderTimeoutMonitor = orderTimeoutMonitor;
        this.decisionLogger = decisionLogger;
        this.eventPublisherHelper = eventPublisherHelper;
        this.wheelMetricsService = wheelMetricsService;
        this.wheelProperties = wheelProperties;
        this.clock = clock;
        this.cycleExecutor = cycleExecutor;
    }

    // ---- Triggers ----

    @Scheduled(
            fixedDelayString = "${wheel.cycle.interval-ms:60000}",
            initialDelayString = "${wheel.cycle.initial-delay-ms:5000}")
    public void onTimer() {
        requestCycle("TIMER");
    }

    /** Runs after the order lifecycle manager has queued the event. */
    @EventListener
    @Order(10)
    public void onOrderEvent(OrderEvent event) {
        requestCycle("ORDER_EVENT");
    }

    @EventListener
    public void onMarketStatus(MarketStatusEvent event) {
        if (event.getCurrentPhase() == MarketPhase.REGULAR) {
            requestCycle("MARKET_OPEN");
        }
    }

    /**
     * Queues a cycle unless one is already waiting.
     *
     * @return true when a cycle was queued, false when the trigger was coalesced
     */
    public boolean requestCycle(String trigger) {
        if (!cyclePending.compareAndSet(false, true)) {
            wheelMetricsService.recordCoalesced();
            log.debug("Cycle trigger {} coalesced into pending cycle", trigger);
            return false;
        }
        try {
            cycleExecutor.execute(() -> {
                cyclePending.set(false);
                runCycleSafely(trigger);
            });
            return true;
        } catch (RejectedExecutionException e) {
            cyclePending.set(false);
            log.warn("Cycle trigger {} rejected by executor: {}", trigger, e.getMessage());
            return false;
        }
    }

    private void runCycleSafely(String trigger) {
        try {
            runCycle(trigger);
        } catch (Exception e) {
            log.error("Decision cycle failed (trigger={})", trigger, e);
        }
    }

    // ---- Cycle ----

    /**
     * Runs one full cycle on the calling thread.
     *
     * @return the decision batch, or empty when the market is closed or the window is not set up yet
     */
    public synchronized Optional<CycleOutcome> runCycle(String trigger) {
        if (!tradingCalendarService.isMarketOpen()) {
            log.debug("Cycle skipped ({}): market phase {}", trigger, tradingCalendarService.getCurrentPhase());
            return Optional.empty();
        }

        long cycleId = cycleCounter.incrementAndGet();
        Instant started = clock.instant();
        LocalDate today = LocalDate.ofInstant(started, clock.getZone());
        log.debug("Cycle {} started (trigger={})", cycleId, trigger);

        orderLifecycleManager.drainEvents(cycleId);

        BrokerView view = readBroker();
        if (view == null) {
            return holdDisconnected(cycleId, started, today);
        }

        BigDecimal price = resolvePrice(view.quote(), started);
        int targetShares = resolveTargetShares(price);

        if (!scheduleManager.isInitialized()) {
            scheduleManager.initialize(today, view.positions(), cycleId);
        }
        ReconciliationResult reconciliation =
                positionReconciler.reconcile(cycleId, view.positions(), scheduleManager.getWindow(), started);
        for (WheelAlert alert : reconciliation.getAlerts()) {
            decisionLogger.logAlert(cycleId, DecisionSource.RECONCILIATION, alert);
        }

        List<OptionContract> chain = deltaMonitor.enrichChain(view.chain(), price);
        deltaMonitor.refresh(positionBook.livePositions(), chain, price, started);
        scheduleManager.advance(today, positionBook, cycleId);
        ScheduleWindow window = scheduleManager.getWindow();

        checkInvariants(cycleId, window, started);
        pauseFlatCloseRequests(cycleId, window);
        orderTimeoutMonitor.checkTimeouts(cycleId, chain, started);

        PortfolioState portfolio =
                positionRebalancer.buildPortfolioState(view.balances(), targetShares, price, started);
        CycleSnapshot snapshot = CycleSnapshot.builder()
                .cycleId(cycleId)
                .asOf(started)
                .today(today)
                .brokerConnected(true)
                .portfolio(portfolio)
                .window(window)
                .slots(slotSnapshots(window))
                .chain(chain)
                .build();

        CycleOutcome outcome = rollingDecisionEngine.decide(snapshot);
        record(outcome);

        try {
            orderLifecycleManager.dispatch(outcome, snapshot);
        } catch (MarketClosedException e) {
            log.warn("Cycle {} decisions not dispatched: {}", cycleId, e.getMessage());
        }

        complete(outcome, snapshot, started);
        return Optional.of(outcome);
    }

    private Optional<CycleOutcome> holdDisconnected(long cycleId, Instant started, LocalDate today) {
        if (!scheduleManager.isInitialized()) {
            log.warn("Cycle {}: broker unavailable before the schedule window was built", cycleId);
            return Optional.empty();
        }
        ScheduleWindow window = scheduleManager.getWindow();
        PortfolioState portfolio = PortfolioState.builder()
                .allocationBias(BigDecimal.ZERO)
                .targetShares(resolveTargetShares(null))
                .asOf(started)
                .build();
        CycleSnapshot snapshot = CycleSnapshot.builder()
                .cycleId(cycleId)
                .asOf(started)
                .today(today)
                .brokerConnected(false)
                .portfolio(portfolio)
                .window(window)
                .slots(slotSnapshots(window))
                .chain(List.of())
                .build();
        CycleOutcome outcome = rollingDecisionEngine.decide(snapshot);
        record(outcome);
        complete(outcome, snapshot, started);
        return Optional.of(outcome);
    }

    /** Broker reads for this cycle; null when any of them failed. */
    private BrokerView readBroker() {
        String underlying = wheelProperties.getUnderlying();
        try {
            AccountBalances balances = brokerGateway.getAccountBalances(underlying);
            List<BrokerPosition> positions = brokerGateway.getPositions();
            List<OptionContract> chain = brokerGateway.getOptionChain(underlying);
            UnderlyingQuote quote = brokerGateway.getUnderlyingQuote(underlying);
            brokerConnectionMonitor.recordSuccess();
            return new BrokerView(balances, positions, chain, quote);
        } catch (BrokerDisconnectedException e) {
            brokerConnectionMonitor.markDisconnected(e.getMessage());
            return null;
        } catch (BrokerException e) {
            brokerConnectionMonitor.recordFailure(e.getMessage());
            return null;
        }
    }

    /** Usable underlying price, or null when the quote is missing, unpriceable or older than the stale threshold. */
    BigDecimal resolvePrice(UnderlyingQuote quote, Instant now) {
        if (quote == null) {
            return null;
        }
        if (quote.getTimestamp() != null
                && Duration.between(quote.getTimestamp(), now).compareTo(wheelProperties.getStaleQuoteThreshold()) > 0) {
            log.warn("Underlying quote for {} is stale (as of {})", quote.getSymbol(), quote.getTimestamp());
            return null;
        }
        return quote.resolvePrice().orElse(null);
    }

    /**
     * Configured target, or the one derived from the funding amount at the first valid price.
     * The derived value is fixed for the lifetime of the process.
     */
    int resolveTargetShares(BigDecimal price) {
        if (wheelProperties.getTargetShares() != null) {
            return wheelProperties.getTargetShares();
        }
        Integer cached = derivedTargetShares.get();
        if (cached != null) {
            return cached;
        }
        int derived = wheelProperties.deriveTargetShares(price);
        if (price != null && price.signum() > 0) {
            derivedTargetShares.compareAndSet(null, derived);
            log.info("Target shares derived from funding {} at {}: {}", wheelProperties.getFundingAmount(), price,
                    derived);
        }
        return derived;
    }

    /**
     * Slot-level invariants the broker cannot break on its own: one contract per leg, each
     * leg's expiration within tolerance of its slot and no two slots on the same expiration.
     * A violating slot is halted until an operator resumes it.
     */
    void checkInvariants(long cycleId, ScheduleWindow window, Instant now) {
        int tolerance = wheelProperties.getChain().getExpirationToleranceDays();
        Map<LocalDate, Integer> slotByExpiration = new HashMap<>();
        for (WeeklySlot slot : window.getSlots()) {
            Optional<WheelPosition> live = positionBook.findLive(slot.getSlotId());
            if (live.isEmpty() || live.get().getContractId() == null) {
                continue;
            }
            WheelPosition leg = live.get();
            List<String> problems = new ArrayList<>();
            if (leg.getQuantity() != -1) {
                problems.add("quantity " + leg.getQuantity());
            }
            if (leg.getExpiration() != null) {
                long offset = Math.abs(ChronoUnit.DAYS.between(slot.getTargetExpiration(), leg.getExpiration()));
                if (offset > tolerance) {
                    problems.add("expiration " + leg.getExpiration() + " is " + offset + " days from target "
                            + slot.getTargetExpiration());
                }
                Integer other = slotByExpiration.putIfAbsent(leg.getExpiration(), slot.getSlotId());
                if (other != null) {
                    problems.add("expiration " + leg.getExpiration() + " shared with slot " + other);
                }
            }
            if (!problems.isEmpty()) {
                halt(cycleId, slot.getSlotId(), leg, String.join("; ", problems), now);
            }
        }
    }

    private void halt(long cycleId, int slotId, WheelPosition leg, String why, Instant now) {
        if (positionBook.getControl(slotId) == SlotControl.HALTED) {
            return;
        }
        positionBook.setControl(slotId, SlotControl.HALTED);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("contractId", leg.getContractId());
        context.put("expiration", leg.getExpiration());
        context.put("quantity", leg.getQuantity());
        decisionLogger.logAlert(cycleId, DecisionSource.SYSTEM, WheelAlert.of(
                WheelCondition.INVARIANT_VIOLATION, slotId, "Slot " + slotId + " halted: " + why, context, now));
    }

    /** A close request is done once the slot is flat and no order is working. */
    private void pauseFlatCloseRequests(long cycleId, ScheduleWindow window) {
        for (WeeklySlot slot : window.getSlots()) {
            int slotId = slot.getSlotId();
            if (positionBook.getControl(slotId) != SlotControl.CLOSE_REQUESTED
                    || positionBook.findLive(slotId).isPresent()
                    || orderLifecycleManager.hasPendingOrder(slotId)) {
                continue;
            }
            positionBook.setControl(slotId, SlotControl.PAUSED);
            decisionLogger.logSystemEvent(
                    cycleId,
                    DecisionSource.OPERATOR,
                    slotId,
                    DecisionType.SLOT_CONTROL_CHANGED,
                    "Slot " + slotId + " flat after close request, now PAUSED",
                    Map.of("control", SlotControl.PAUSED),
                    DecisionSeverity.INFO);
        }
    }

    private List<SlotSnapshot> slotSnapshots(ScheduleWindow window) {
        List<SlotSnapshot> slots = new ArrayList<>();
        for (WeeklySlot slot : window.getSlots()) {
            WheelPosition leg = positionBook.find(slot.getSlotId())
                    .filter(p -> p.getStatus() != PositionStatus.CLOSED)
                    .map(WheelPosition::copy)
                    .orElse(null);
            slots.add(SlotSnapshot.builder()
                    .slotId(slot.getSlotId())
                    .targetExpiration(slot.getTargetExpiration())
                    .control(positionBook.getControl(slot.getSlotId()))
                    .position(leg)
                    .deltaStatus(leg != null ? leg.getDeltaStatus() : null)
                    .pendingOrder(orderLifecycleManager.hasPendingOrder(slot.getSlotId()))
                    .build());
        }
        return List.copyOf(slots);
    }

    private void record(CycleOutcome outcome) {
        for (WheelAlert alert : outcome.getAlerts()) {
            decisionLogger.logAlert(outcome.getCycleId(), DecisionSource.DECISION_ENGINE, alert);
        }
        for (RollDecision decision : outcome.getDecisions()) {
            decisionLogger.logDecision(outcome.getCycleId(), decision);
        }
    }

    private void complete(CycleOutcome outcome, CycleSnapshot snapshot, Instant started) {
        lastOutcome.set(outcome);
        lastSnapshot.set(snapshot);
        Duration elapsed = Duration.between(started, clock.instant());
        eventPublisherHelper.publishCycleCompleted(this, outcome, elapsed);
        log.info(
                "Cycle {} done: bias={} side={} decisions={} alerts={} premium={}",
                outcome.getCycleId(),
                outcome.getPolicy().getBias(),
                outcome.getPolicy().getSidePreference(),
                outcome.getDecisions().stream().filter(d -> !d.isHold()).count(),
                outcome.getAlerts().size(),
                outcome.getTotalPremium());
    }

    // ---- Queries ----

    public Optional<CycleOutcome> getLastOutcome() {
        return Optional.ofNullable(lastOutcome.get());
    }

    public Optional<CycleSnapshot> getLastSnapshot() {
        return Optional.ofNullable(lastSnapshot.get());
    }

    public long getCycleCount() {
        return cycleCounter.get();
    }

    public boolean isCyclePending() {
        return cyclePending.get();
    }

    private record BrokerView(
            AccountBalances balances, List<BrokerPosition> positions, List<OptionContract> chain,
            UnderlyingQuote quote) {}
}
