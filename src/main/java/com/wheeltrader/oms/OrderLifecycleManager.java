package com.wheeltrader.oms;

import com.wheeltrader.broker.BrokerConnectionMonitor;
import com.wheeltrader.broker.BrokerGateway;
import com.wheeltrader.calendar.TradingHoursOnly;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionOutcome;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.IntentPurpose;
import com.wheeltrader.domain.enums.IntentStatus;
import com.wheeltrader.domain.enums.OrderSide;
import com.wheeltrader.domain.enums.OrderType;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.RollReason;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.CycleOutcome;
import com.wheeltrader.domain.model.CycleSnapshot;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.OrderIntent;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.domain.model.SlotSnapshot;
import com.wheeltrader.domain.model.TargetContract;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.event.OrderEvent;
import com.wheeltrader.exception.BrokerDisconnectedException;
import com.wheeltrader.exception.BrokerException;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Turns decisions into broker orders and broker order events back into slot state.
 *
 * <p><b>Ordering:</b> a ROLL becomes a buy-to-close plus a STAGED sell-to-open. The opening
 * order is only routed once the close has filled, so a slot never holds two legs. A slot
 * with any non-terminal intent, staged ones included, is reported as having a pending order
 * and the engine holds it.
 *
 * <p><b>Threading:</b> broker events may arrive on any thread. {@link #onOrderEvent} only
 * queues them; {@link #drainEvents} applies them on the evaluation loop thread at the start
 * of a cycle, so slot records are never mutated concurrently with a decision batch.
 *
 * <p><b>Failure handling:</b>
 * <ul>
 *   <li>open rejected or cancelled: slot back to EMPTY</li>
 *   <li>close rejected or cancelled: leg back to OPEN</li>
 *   <li>roll close rejected or cancelled: leg back to OPEN, staged open discarded,
 *       ROLL_ABORTED on rejection</li>
 *   <li>roll open rejected or cancelled after the close filled: slot PENDING_OPEN,
 *       PARTIAL_ROLL_FAILURE, reopened by the next cycle</li>
 * </ul>
 */
@Service
public class OrderLifecycleManager {

    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    /** Terminal intents kept for the status API. */
    static final int MAX_RETAINED_TERMINAL = 500;

    private final BrokerGateway brokerGateway;
    private final BrokerConnectionMonitor brokerConnectionMonitor;
    private final PositionBook positionBook;
    private final DecisionLogger decisionLogger;
    private final IntentIdGenerator intentIdGenerator;
    private final WheelProperties wheelProperties;
    private final Clock clock;

    private final ConcurrentLinkedQueue<OrderEvent> inbox = new ConcurrentLinkedQueue<>();
    private final Map<String, OrderIntent> intents = new ConcurrentHashMap<>();
    private final Map<String, String> intentIdByBrokerOrderId = new ConcurrentHashMap<>();

    public OrderLifecycleManager(
            BrokerGateway brokerGateway,
            BrokerConnectionMonitor brokerConnectionMonitor,
            PositionBook positionBook,
            DecisionLogger decisionLogger,
            IntentIdGenerator intentIdGenerator,
            WheelProperties wheelProperties,
            Clock clock) {
        this.brokerGateway = brokerGateway;
        this.brokerConnectionMonitor = brokerConnectionMonitor;
        this.positionBook = positionBook;
        this.decisionLogger = decisionLogger;
        this.intentIdGenerator = intentIdGenerator;
        this.wheelProperties = wheelProperties;
        this.clock = clock;
    }

    // ---- Broker events ----

    @EventListener
    @Order(1)
    public void onOrderEvent(OrderEvent event) {
        inbox.add(event);
    }

    /**
     * Applies all queued broker events to intents and slot records.
     *
     * @return number of events applied
     */
    public int drainEvents(long cycleId) {
        int applied = 0;
        OrderEvent event;
        while ((event = inbox.poll()) != null) {
            if (apply(cycleId, event)) {
                applied++;
            }
        }
        pruneTerminal();
        return applied;
    }

    int queuedEvents() {
        return inbox.size();
    }

    private boolean apply(long cycleId, OrderEvent event) {
        BrokerOrder order = event.getOrder();
        Optional<OrderIntent> match = findIntent(order);
        if (match.isEmpty()) {
            log.warn(
                    "Order event {} for untracked order {} (correlationId={})",
                    event.getEventType(),
                    order.getBrokerOrderId(),
                    order.getCorrelationId());
            return false;
        }

        OrderIntent intent = match.get();
        if (intent.getStatus().isTerminal()) {
            log.debug("Ignoring {} for terminal intent {}", event.getEventType(), intent.getIntentId());
            return false;
        }
        if (intent.getBrokerOrderId() == null && order.getBrokerOrderId() != null) {
            intent.setBrokerOrderId(order.getBrokerOrderId());
            intentIdByBrokerOrderId.put(order.getBrokerOrderId(), intent.getIntentId());
        }

        Instant now = clock.instant();
        intent.setUpdatedAt(now);
        switch (event.getEventType()) {
            case ACKED -> {
                if (intent.getStatus() == IntentStatus.SUBMITTED) {
                    intent.setStatus(IntentStatus.ACKED);
                }
                intent.setAckedAt(now);
            }
            case MODIFIED -> intent.setLimitPrice(order.getPrice());
            case PARTIALLY_FILLED -> {
                intent.setFilledQuantity(order.getFilledQuantity());
                intent.setAverageFillPrice(order.getAverageFillPrice());
                if (intent.getStatus() != IntentStatus.CANCEL_REQUESTED) {
                    intent.setStatus(IntentStatus.PARTIALLY_FILLED);
                }
                decisionLogger.logOrderEvent(
                        intent, DecisionType.ORDER_PARTIALLY_FILLED, DecisionOutcome.INFO,
                        "Partial fill " + order.getFilledQuantity() + "/" + intent.getQuantity(), null);
            }
            case FILLED -> onFilled(cycleId, intent, order, now);
            case REJECTED -> onRejected(cycleId, intent, order.getRejectionReason(), now);
            case CANCELLED -> onCancelled(cycleId, intent, now);
        }
        return true;
    }

    private void onFilled(long cycleId, OrderIntent intent, BrokerOrder order, Instant now) {
        boolean cancelRaced = intent.getStatus() == IntentStatus.CANCEL_REQUESTED;
        intent.setStatus(IntentStatus.FILLED);
        intent.setFilledQuantity(order.getFilledQuantity() > 0 ? order.getFilledQuantity() : intent.getQuantity());
        intent.setAverageFillPrice(order.getAverageFillPrice());

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("fillPrice", order.getAverageFillPrice());
        if (cancelRaced) {
            details.put("cancelRaced", true);
        }
        decisionLogger.logOrderEvent(
                intent, DecisionType.ORDER_FILLED, DecisionOutcome.TRIGGERED,
                intent.getPurpose() + " filled for slot " + intent.getSlotId(), details);

        int slotId = intent.getSlotId();
        switch (intent.getPurpose()) {
            case OPEN, ROLL_OPEN -> {
                TargetContract target = intent.getTarget();
                WheelPosition leg = positionBook.find(slotId).orElseGet(() -> WheelPosition.builder()
                        .slotId(slotId)
                        .build());
                leg.setContractId(intent.getContractId());
                leg.setUnderlying(wheelProperties.getUnderlying());
                leg.setSide(intent.getOptionSide());
                leg.setStrike(intent.getStrike());
                leg.setExpiration(intent.getExpiration());
                leg.setStatus(PositionStatus.OPEN);
                leg.setEntryPrice(order.getAverageFillPrice());
                leg.setDelta(target != null ? target.getContract().getDelta() : null);
                leg.setDeltaStatus(DeltaStatus.IN_RANGE);
                leg.setOpenedAt(now);
                leg.setUpdatedAt(now);
                positionBook.put(leg);
            }
            case CLOSE -> {
                closeLeg(slotId, now);
                if (positionBook.getControl(slotId) == SlotControl.CLOSE_REQUESTED) {
                    positionBook.setControl(slotId, SlotControl.PAUSED);
                    log.info("Slot {} closed on operator request, now PAUSED", slotId);
                }
            }
            case ROLL_CLOSE -> {
                Optional<OrderIntent> staged = pairedOf(intent);
                if (cancelRaced || staged.isEmpty()) {
                    staged.ifPresent(s -> discard(s, "close filled while its cancel was in flight", now));
                    closeLeg(slotId, now);
                    return;
                }
                OrderIntent open = staged.get();
                positionBook.put(WheelPosition.builder()
                        .slotId(slotId)
                        .contractId(open.getContractId())
                        .underlying(wheelProperties.getUnderlying())
                        .side(open.getOptionSide())
                        .strike(open.getStrike())
                        .expiration(open.getExpiration())
                        .status(PositionStatus.PENDING_OPEN)
                        .updatedAt(now)
                        .build());
                log.info("Slot {} roll close filled, releasing {}", slotId, open.getIntentId());
            }
        }
    }

    private void onRejected(long cycleId, OrderIntent intent, String reason, Instant now) {
        intent.setStatus(IntentStatus.REJECTED);
        intent.setRejectionReason(reason);
        decisionLogger.logOrderEvent(
                intent, DecisionType.ORDER_REJECTED, DecisionOutcome.REJECTED,
                intent.getPurpose() + " rejected for slot " + intent.getSlotId() + ": " + reason,
                Map.of("rejectionReason", reason != null ? reason : ""));
        unwind(cycleId, intent, true, now);
    }

    private void onCancelled(long cycleId, OrderIntent intent, Instant now) {
        intent.setStatus(IntentStatus.CANCELLED);
        decisionLogger.logOrderEvent(
                intent, DecisionType.ORDER_CANCELLED, DecisionOutcome.INFO,
                intent.getPurpose() + " cancelled for slot " + intent.getSlotId(), null);
        unwind(cycleId, intent, false, now);
    }

    /** Restores slot state after an order ended without a fill. */
    private void unwind(long cycleId, OrderIntent intent, boolean rejected, Instant now) {
        int slotId = intent.getSlotId();
        switch (intent.getPurpose()) {
            case OPEN -> {
                if (intent.getReason() == RollReason.REOPEN_AFTER_FAILED_ROLL) {
                    awaitReopen(slotId, intent, now);
                } else {
                    positionBook.clear(slotId);
                }
            }
            case CLOSE -> restoreOpen(slotId, now);
            case ROLL_CLOSE -> {
                restoreOpen(slotId, now);
                pairedOf(intent).ifPresent(s -> discard(s, "closing half did not fill", now));
                if (rejected) {
                    raise(cycleId, WheelCondition.ROLL_ABORTED, slotId,
                            "Roll of slot " + slotId + " aborted, close rejected: " + intent.getRejectionReason(),
                            intent);
                }
            }
            case ROLL_OPEN -> {
                awaitReopen(slotId, intent, now);
                raise(cycleId, WheelCondition.PARTIAL_ROLL_FAILURE, slotId,
                        "Slot " + slotId + " closed but replacement " + intent.getContractId()
                                + (rejected ? " rejected" : " cancelled") + ", will reopen",
                        intent);
            }
        }
    }

    // ---- Dispatch ----

    /**
     * Routes the orders for one decision batch: releases roll opens whose close has filled,
     * cancels rolls whose trigger reversed before the broker acknowledged them, then turns
     * every OPEN, CLOSE and ROLL decision into intents.
     *
     * @return intents submitted or staged by this call
     */
    @TradingHoursOnly(message = "Wheel orders are only routed during the regular session")
    public List<OrderIntent> dispatch(CycleOutcome outcome, CycleSnapshot snapshot) {
        Map<String, OptionContract> quotes = snapshot.getChain().stream()
                .collect(Collectors.toMap(OptionContract::getContractId, c -> c, (a, b) -> a));
        List<OrderIntent> routed = new ArrayList<>();

        releaseStagedOpens(outcome.getCycleId(), quotes, routed);
        cancelReversedIntents(snapshot);

        for (RollDecision decision : outcome.getDecisions()) {
            if (!decision.getAction().requiresOrders()) {
                continue;
            }
            if (hasPendingOrder(decision.getSlotId())) {
                log.warn("Slot {} already has a working intent, skipping {}", decision.getSlotId(),
                        decision.getAction());
                continue;
            }
            switch (decision.getAction()) {
                case OPEN -> routed.add(routeOpen(outcome.getCycleId(), decision));
                case CLOSE -> routed.add(routeClose(outcome.getCycleId(), decision, quotes));
                case ROLL -> routed.addAll(routeRoll(outcome.getCycleId(), decision, quotes));
                default -> { }
            }
        }
        return routed;
    }

    private OrderIntent routeOpen(long cycleId, RollDecision decision) {
        TargetContract target = decision.getTargetContract();
        Instant now = clock.instant();
        positionBook.put(WheelPosition.builder()
                .slotId(decision.getSlotId())
                .contractId(target.getContractId())
                .underlying(wheelProperties.getUnderlying())
                .side(target.getSide())
                .strike(target.getStrike())
                .expiration(target.getExpiration())
                .status(PositionStatus.PENDING_OPEN)
                .updatedAt(now)
                .build());

        OrderIntent intent = openingIntent(cycleId, decision, IntentPurpose.OPEN, IntentStatus.SUBMITTED, now);
        intents.put(intent.getIntentId(), intent);
        submit(cycleId, intent);
        return intent;
    }

    private OrderIntent routeClose(long cycleId, RollDecision decision, Map<String, OptionContract> quotes) {
        Instant now = clock.instant();
        WheelPosition leg = positionBook.findLive(decision.getSlotId()).orElseThrow(() ->
                new IllegalStateException("CLOSE for slot " + decision.getSlotId() + " without a live leg"));
        leg.setStatus(PositionStatus.PENDING_CLOSE);
        leg.setUpdatedAt(now);

        OrderIntent intent = closingIntent(cycleId, decision, leg, IntentPurpose.CLOSE, quotes, now);
        intents.put(intent.getIntentId(), intent);
        submit(cycleId, intent);
        return intent;
    }

    private List<OrderIntent> routeRoll(long cycleId, RollDecision decision, Map<String, OptionContract> quotes) {
        Instant now = clock.instant();
        WheelPosition leg = positionBook.findLive(decision.getSlotId()).orElseThrow(() ->
                new IllegalStateException("ROLL for slot " + decision.getSlotId() + " without a live leg"));
        leg.setStatus(PositionStatus.PENDING_ROLL);
        leg.setUpdatedAt(now);

        OrderIntent close = closingIntent(cycleId, decision, leg, IntentPurpose.ROLL_CLOSE, quotes, now);
        OrderIntent open = openingIntent(cycleId, decision, IntentPurpose.ROLL_OPEN, IntentStatus.STAGED, now);
        close.setPairedIntentId(open.getIntentId());
        open.setPairedIntentId(close.getIntentId());
        intents.put(open.getIntentId(), open);
        intents.put(close.getIntentId(), close);

        submit(cycleId, close);
        return List.of(close, open);
    }

    /**
     * Submits staged roll opens whose close has filled. A replacement whose quote has reached
     * the roll trigger since it was chosen is dropped instead, and the slot is reopened from a
     * fresh chain by the next batch.
     */
    private void releaseStagedOpens(long cycleId, Map<String, OptionContract> quotes, List<OrderIntent> routed) {
        List<OrderIntent> ready = intents.values().stream()
                .filter(i -> i.getStatus() == IntentStatus.STAGED)
                .filter(i -> pairedOf(i).map(p -> p.getStatus() == IntentStatus.FILLED).orElse(false))
                .sorted(Comparator.comparing(OrderIntent::getCreatedAt))
                .toList();
        for (OrderIntent open : ready) {
            OptionContract quote = quotes.get(open.getContractId());
            if (atRollTrigger(quote)) {
                Instant now = clock.instant();
                int slotId = open.getSlotId();
                discard(open, "replacement delta " + quote.getDelta() + " at the roll trigger", now);
                awaitReopen(slotId, open, now);
                raise(cycleId, WheelCondition.PARTIAL_ROLL_FAILURE, slotId,
                        "Slot " + slotId + " closed but replacement " + open.getContractId()
                                + " reached delta " + quote.getDelta() + " before release, will reopen",
                        open);
                continue;
            }
            BigDecimal mid = midOf(quote);
            if (mid != null && open.getOrderType() == OrderType.LIMIT) {
                open.setLimitPrice(mid);
            }
            open.setStatus(IntentStatus.SUBMITTED);
            submit(open.getCycleId(), open);
            routed.add(open);
        }
    }

    /**
     * Cancels roll closes that were triggered by delta but whose leg is back in range before
     * the broker acknowledged them. Acknowledged orders are left to fill.
     */
    public void cancelReversedIntents(CycleSnapshot snapshot) {
        for (OrderIntent intent : intents.values()) {
            if (intent.getPurpose() != IntentPurpose.ROLL_CLOSE
                    || intent.getStatus() != IntentStatus.SUBMITTED
                    || intent.getReason() != RollReason.DELTA_TRIGGER) {
                continue;
            }
            boolean backInRange = snapshot.slot(intent.getSlotId())
                    .map(SlotSnapshot::getDeltaStatus)
                    .map(status -> status == DeltaStatus.IN_RANGE)
                    .orElse(false);
            if (backInRange) {
                requestCancel(intent, "delta back in range before acknowledgement");
            }
        }
    }

    // ---- Timeout support ----

    /** Changes the limit price of a working intent. */
    public boolean reprice(OrderIntent intent, BigDecimal newLimit) {
        BrokerOrder modification = toBrokerOrder(intent).toBuilder().price(newLimit).build();
        try {
            brokerGateway.modifyOrder(intent.getBrokerOrderId(), modification);
        } catch (BrokerException | BrokerDisconnectedException e) {
            brokerConnectionMonitor.recordFailure(e.getMessage());
            log.warn("Reprice of {} failed: {}", intent.getIntentId(), e.getMessage());
            return false;
        }
        BigDecimal previous = intent.getLimitPrice();
        intent.setLimitPrice(newLimit);
        intent.setRepriceCount(intent.getRepriceCount() + 1);
        intent.setUpdatedAt(clock.instant());
        decisionLogger.logOrderEvent(
                intent, DecisionType.ORDER_REPRICED, DecisionOutcome.INFO,
                "Repriced " + previous + " -> " + newLimit, Map.of("previousLimit", String.valueOf(previous)));
        return true;
    }

    /** Asks the broker to cancel a working intent. The CANCELLED event completes it. */
    public boolean requestCancel(OrderIntent intent, String reason) {
        if (intent.getBrokerOrderId() == null) {
            log.warn("Cannot cancel {}: no broker order id yet", intent.getIntentId());
            return false;
        }
        try {
            brokerGateway.cancelOrder(intent.getBrokerOrderId());
        } catch (BrokerException | BrokerDisconnectedException e) {
            brokerConnectionMonitor.recordFailure(e.getMessage());
            log.warn("Cancel of {} failed: {}", intent.getIntentId(), e.getMessage());
            return false;
        }
        intent.setStatus(IntentStatus.CANCEL_REQUESTED);
        intent.setUpdatedAt(clock.instant());
        log.info("Cancel requested for {} ({}): {}", intent.getIntentId(), intent.getBrokerOrderId(), reason);
        return true;
    }

    // ---- Queries ----

    public boolean hasPendingOrder(int slotId) {
        return intents.values().stream()
                .anyMatch(i -> i.getSlotId() == slotId && !i.getStatus().isTerminal());
    }

    /** Intents sent to the broker and not yet finished. */
    public List<OrderIntent> getWorkingIntents() {
        return intents.values().stream()
                .filter(i -> i.getStatus().isWorking())
                .sorted(Comparator.comparing(OrderIntent::getCreatedAt))
                .toList();
    }

    /** Most recent intents first. */
    public List<OrderIntent> getIntents(int limit) {
        return intents.values().stream()
                .sorted(Comparator.comparing(OrderIntent::getCreatedAt).reversed())
                .limit(limit)
                .toList();
    }

    public Optional<OrderIntent> getIntent(String intentId) {
        return Optional.ofNullable(intents.get(intentId));
    }

    // ---- Internal ----

    private void submit(long cycleId, OrderIntent intent) {
        Instant now = clock.instant();
        intent.setSubmittedAt(now);
        intent.setUpdatedAt(now);
        try {
            String brokerOrderId = brokerGateway.placeOrder(toBrokerOrder(intent));
            brokerConnectionMonitor.recordSuccess();
            intent.setBrokerOrderId(brokerOrderId);
            intentIdByBrokerOrderId.put(brokerOrderId, intent.getIntentId());
            decisionLogger.logOrderEvent(
                    intent, DecisionType.ORDER_PLACED, DecisionOutcome.TRIGGERED,
                    intent.getOrderSide() + " " + intent.getContractId() + " for slot " + intent.getSlotId()
                            + " (" + intent.getPurpose() + ")",
                    null);
        } catch (BrokerDisconnectedException e) {
            brokerConnectionMonitor.markDisconnected(e.getMessage());
            onRejected(cycleId, intent, e.getMessage(), now);
        } catch (BrokerException e) {
            brokerConnectionMonitor.recordFailure(e.getMessage());
            onRejected(cycleId, intent, e.getMessage(), now);
        }
    }

    private OrderIntent openingIntent(
            long cycleId, RollDecision decision, IntentPurpose purpose, IntentStatus status, Instant now) {
        TargetContract target = decision.getTargetContract();
        OrderType type = wheelProperties.getOrders().getType();
        return OrderIntent.builder()
                .intentId(intentIdGenerator.generate(decision.getSlotId(), purpose))
                .cycleId(cycleId)
                .slotId(decision.getSlotId())
                .purpose(purpose)
                .status(status)
                .reason(decision.getReason())
                .contractId(target.getContractId())
                .optionSide(target.getSide())
                .strike(target.getStrike())
                .expiration(target.getExpiration())
                .orderSide(OrderSide.SELL)
                .quantity(1)
                .orderType(type)
                .limitPrice(type == OrderType.LIMIT ? target.getLimitPrice() : null)
                .target(target)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private OrderIntent closingIntent(
            long cycleId,
            RollDecision decision,
            WheelPosition leg,
            IntentPurpose purpose,
            Map<String, OptionContract> quotes,
            Instant now) {
        BigDecimal mid = midOf(quotes.get(leg.getContractId()));
        OrderType type = mid != null ? wheelProperties.getOrders().getType() : OrderType.MARKET;
        return OrderIntent.builder()
                .intentId(intentIdGenerator.generate(decision.getSlotId(), purpose))
                .cycleId(cycleId)
                .slotId(decision.getSlotId())
                .purpose(purpose)
                .status(IntentStatus.SUBMITTED)
                .reason(decision.getReason())
                .contractId(leg.getContractId())
                .optionSide(leg.getSide())
                .strike(leg.getStrike())
                .expiration(leg.getExpiration())
                .orderSide(OrderSide.BUY)
                .quantity(1)
                .orderType(type)
                .limitPrice(type == OrderType.LIMIT ? mid : null)
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    private BrokerOrder toBrokerOrder(OrderIntent intent) {
        return BrokerOrder.builder()
                .correlationId(intent.getIntentId())
                .contractId(intent.getContractId())
                .side(intent.getOrderSide())
                .type(intent.getOrderType())
                .quantity(intent.getQuantity())
                .price(intent.getLimitPrice())
                .build();
    }

    private Optional<OrderIntent> findIntent(BrokerOrder order) {
        if (order.getBrokerOrderId() != null) {
            String intentId = intentIdByBrokerOrderId.get(order.getBrokerOrderId());
            if (intentId != null) {
                return Optional.ofNullable(intents.get(intentId));
            }
        }
        return order.getCorrelationId() != null
                ? Optional.ofNullable(intents.get(order.getCorrelationId()))
                : Optional.empty();
    }

    private Optional<OrderIntent> pairedOf(OrderIntent intent) {
        return intent.getPairedIntentId() != null
                ? Optional.ofNullable(intents.get(intent.getPairedIntentId()))
                : Optional.empty();
    }

    private void discard(OrderIntent staged, String why, Instant now) {
        if (staged.getStatus() != IntentStatus.STAGED) {
            return;
        }
        staged.setStatus(IntentStatus.CANCELLED);
        staged.setRejectionReason(why);
        staged.setUpdatedAt(now);
        log.info("Discarded staged {} for slot {}: {}", staged.getIntentId(), staged.getSlotId(), why);
    }

    private void closeLeg(int slotId, Instant now) {
        positionBook.find(slotId).ifPresent(leg -> {
            leg.setStatus(PositionStatus.CLOSED);
            leg.setUpdatedAt(now);
        });
    }

    private void restoreOpen(int slotId, Instant now) {
        positionBook.find(slotId)
                .filter(leg -> leg.getStatus() == PositionStatus.PENDING_ROLL
                        || leg.getStatus() == PositionStatus.PENDING_CLOSE)
                .ifPresent(leg -> {
                    leg.setStatus(PositionStatus.OPEN);
                    leg.setUpdatedAt(now);
                });
    }

    /** Slot keeps its intended expiration but no contract, and is reopened by the next batch. */
    private void awaitReopen(int slotId, OrderIntent failedOpen, Instant now) {
        positionBook.put(WheelPosition.builder()
                .slotId(slotId)
                .underlying(wheelProperties.getUnderlying())
                .side(failedOpen.getOptionSide())
                .expiration(failedOpen.getExpiration())
                .status(PositionStatus.PENDING_OPEN)
                .updatedAt(now)
                .build());
    }

    private void raise(long cycleId, WheelCondition condition, int slotId, String message, OrderIntent intent) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("intentId", intent.getIntentId());
        context.put("contractId", intent.getContractId());
        context.put("purpose", intent.getPurpose());
        decisionLogger.logAlert(
                cycleId, DecisionSource.ORDER_LIFECYCLE, WheelAlert.of(condition, slotId, message, context,
                        clock.instant()));
    }

    private boolean atRollTrigger(OptionContract quote) {
        return quote != null
                && quote.hasDelta()
                && quote.getDelta().abs().compareTo(wheelProperties.getRollTriggerDelta()) >= 0;
    }

    private static BigDecimal midOf(OptionContract quote) {
        if (quote == null || quote.getMid() == null) {
            return null;
        }
        return quote.getMid().setScale(2, RoundingMode.HALF_UP);
    }

    private void pruneTerminal() {
        List<OrderIntent> terminal = intents.values().stream()
                .filter(i -> i.getStatus().isTerminal())
                .sorted(Comparator.comparing(OrderIntent::getCreatedAt).reversed())
                .toList();
        for (int i = MAX_RETAINED_TERMINAL; i < terminal.size(); i++) {
            OrderIntent stale = terminal.get(i);
            intents.remove(stale.getIntentId());
            if (stale.getBrokerOrderId() != null) {
                intentIdByBrokerOrderId.remove(stale.getBrokerOrderId());
            }
        }
    }
}
