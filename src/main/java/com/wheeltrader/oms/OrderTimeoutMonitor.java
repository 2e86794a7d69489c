package com.wheeltrader.oms;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionOutcome;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.IntentStatus;
import com.wheeltrader.domain.enums.OrderType;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.OrderIntent;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.observability.DecisionLogger;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Chases or cancels orders the broker sits on.
 *
 * <p>Timeout rules:
 * <ul>
 *   <li>no acknowledgement within {@code orders.ack-timeout}: cancel</li>
 *   <li>acknowledged but unfilled after {@code orders.fill-timeout}: reprice a LIMIT order to
 *       the current mid, up to {@code orders.max-reprices} times, each with a fresh fill
 *       timeout; after that, cancel</li>
 * </ul>
 * Every cancellation raises ORDER_TIMEOUT. The resulting CANCELLED event unwinds the slot
 * through the order lifecycle manager like any other cancel.
 *
 * <p>Runs on the evaluation loop thread, once per cycle, before the decision batch.
 */
@Component
public class OrderTimeoutMonitor {

    private static final Logger log = LoggerFactory.getLogger(OrderTimeoutMonitor.class);

    private final OrderLifecycleManager orderLifecycleManager;
    private final WheelProperties wheelProperties;
    private final DecisionLogger decisionLogger;

    public OrderTimeoutMonitor(
            OrderLifecycleManager orderLifecycleManager,
            WheelProperties wheelProperties,
            DecisionLogger decisionLogger) {
        this.orderLifecycleManager = orderLifecycleManager;
        this.wheelProperties = wheelProperties;
        this.decisionLogger = decisionLogger;
    }

    /**
     * @return number of intents repriced or cancelled
     */
    public int checkTimeouts(long cycleId, List<OptionContract> chain, Instant now) {
        List<OrderIntent> working = orderLifecycleManager.getWorkingIntents();
        if (working.isEmpty()) {
            return 0;
        }
        Map<String, OptionContract> quotes = chain.stream()
                .collect(Collectors.toMap(OptionContract::getContractId, Function.identity(), (a, b) -> a));

        int handled = 0;
        for (OrderIntent intent : working) {
            if (intent.getStatus() == IntentStatus.CANCEL_REQUESTED || intent.getSubmittedAt() == null) {
                continue;
            }
            if (intent.getStatus() == IntentStatus.SUBMITTED) {
                if (isAckTimedOut(intent, now)) {
                    handled += cancel(cycleId, intent, "no acknowledgement within "
                            + wheelProperties.getOrders().getAckTimeout(), now);
                }
                continue;
            }
            if (!isFillTimedOut(intent, now)) {
                continue;
            }
            BigDecimal mid = midOf(quotes.get(intent.getContractId()));
            boolean canReprice = intent.getOrderType() == OrderType.LIMIT
                    && intent.getRepriceCount() < wheelProperties.getOrders().getMaxReprices()
                    && mid != null
                    && mid.compareTo(intent.getLimitPrice()) != 0;
            if (canReprice && orderLifecycleManager.reprice(intent, mid)) {
                handled++;
            } else {
                handled += cancel(cycleId, intent, "unfilled after " + wheelProperties.getOrders().getFillTimeout()
                        + " and " + intent.getRepriceCount() + " reprice(s)", now);
            }
        }
        return handled;
    }

    boolean isAckTimedOut(OrderIntent intent, Instant now) {
        return Duration.between(intent.getSubmittedAt(), now)
                .compareTo(wheelProperties.getOrders().getAckTimeout()) > 0;
    }

    /** Fill timeout runs from submission, or from the last reprice once repriced. */
    boolean isFillTimedOut(OrderIntent intent, Instant now) {
        Instant start = intent.getRepriceCount() > 0 && intent.getUpdatedAt() != null
                ? intent.getUpdatedAt()
                : intent.getSubmittedAt();
        return Duration.between(start, now).compareTo(wheelProperties.getOrders().getFillTimeout()) > 0;
    }

    private int cancel(long cycleId, OrderIntent intent, String why, Instant now) {
        log.warn("Order timeout: intent={}, brokerOrderId={}, {}", intent.getIntentId(), intent.getBrokerOrderId(), why);
        if (!orderLifecycleManager.requestCancel(intent, why)) {
            return 0;
        }
        decisionLogger.logOrderEvent(intent, DecisionType.ORDER_TIMEOUT, DecisionOutcome.FAILED, why, null);

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("intentId", intent.getIntentId());
        context.put("purpose", intent.getPurpose());
        context.put("contractId", intent.getContractId());
        context.put("repriceCount", intent.getRepriceCount());
        decisionLogger.logAlert(cycleId, DecisionSource.ORDER_LIFECYCLE, WheelAlert.of(
                WheelCondition.ORDER_TIMEOUT, intent.getSlotId(),
                intent.getPurpose() + " for slot " + intent.getSlotId() + " cancelled: " + why, context, now));
        return 1;
    }

    private static BigDecimal midOf(OptionContract quote) {
        if (quote == null || quote.getMid() == null) {
            return null;
        }
        return quote.getMid().setScale(2, RoundingMode.HALF_UP);
    }
}
