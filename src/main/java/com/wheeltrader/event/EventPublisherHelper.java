package com.wheeltrader.event;

import com.wheeltrader.domain.enums.MarketPhase;
import com.wheeltrader.domain.enums.OrderStatus;
import com.wheeltrader.domain.model.BrokerOrder;
import com.wheeltrader.domain.model.CycleOutcome;
import com.wheeltrader.domain.model.DecisionRecord;
import com.wheeltrader.domain.model.WheelAlert;
import java.time.Duration;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Typed factory methods over Spring's {@link ApplicationEventPublisher} for all wheel events.
 *
 * <p>Listeners are synchronous {@code @EventListener}s. Order events are published from
 * whichever thread the broker reports on; their listeners only record state and request a
 * cycle, never decide.
 */
@Component
public class EventPublisherHelper {

    private final ApplicationEventPublisher applicationEventPublisher;

    public EventPublisherHelper(ApplicationEventPublisher applicationEventPublisher) {
        this.applicationEventPublisher = applicationEventPublisher;
    }

    // ---- Order ----

    public void publishOrderAcked(Object source, BrokerOrder order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.ACKED, previousStatus));
    }

    public void publishOrderModified(Object source, BrokerOrder order) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.MODIFIED));
    }

    public void publishOrderPartiallyFilled(Object source, BrokerOrder order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.PARTIALLY_FILLED, previousStatus));
    }

    public void publishOrderFilled(Object source, BrokerOrder order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(new OrderEvent(source, order, OrderEventType.FILLED, previousStatus));
    }

    public void publishOrderRejected(Object source, BrokerOrder order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.REJECTED, previousStatus));
    }

    public void publishOrderCancelled(Object source, BrokerOrder order, OrderStatus previousStatus) {
        applicationEventPublisher.publishEvent(
                new OrderEvent(source, order, OrderEventType.CANCELLED, previousStatus));
    }

    // ---- Market status ----

    public void publishMarketPhaseTransition(Object source, MarketPhase previousPhase, MarketPhase currentPhase) {
        applicationEventPublisher.publishEvent(new MarketStatusEvent(source, previousPhase, currentPhase));
    }

    // ---- Decisions and alerts ----

    public void publishDecisionLogged(Object source, DecisionRecord decisionRecord) {
        applicationEventPublisher.publishEvent(new DecisionLogEvent(source, decisionRecord));
    }

    public void publishAlert(Object source, WheelAlert alert) {
        applicationEventPublisher.publishEvent(new WheelAlertEvent(source, alert));
    }

    public void publishCycleCompleted(Object source, CycleOutcome outcome, Duration elapsed) {
        applicationEventPublisher.publishEvent(new CycleCompletedEvent(source, outcome, elapsed));
    }
}
