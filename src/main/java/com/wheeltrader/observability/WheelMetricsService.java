package com.wheeltrader.observability;

import com.wheeltrader.broker.BrokerConnectionMonitor;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.event.CycleCompletedEvent;
import com.wheeltrader.event.OrderEvent;
import com.wheeltrader.event.OrderEventType;
import com.wheeltrader.event.WheelAlertEvent;
import com.wheeltrader.position.PositionBook;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

/**
 * Micrometer metrics for the wheel:
 * <ul>
 *   <li><b>wheel.cycles.run</b> (counter): decision cycles completed</li>
 *   <li><b>wheel.cycles.coalesced</b> (counter): cycle triggers folded into an already pending cycle</li>
 *   <li><b>wheel.cycle.latency</b> (timer): snapshot to dispatch</li>
 *   <li><b>wheel.decisions</b> (counter, tag action): decisions per action</li>
 *   <li><b>wheel.alerts</b> (counter, tag condition): raised conditions</li>
 *   <li><b>wheel.orders.placed</b> / <b>wheel.orders.rejected</b> (counters)</li>
 *   <li><b>wheel.allocation.bias</b> (gauge): bias of the last cycle</li>
 *   <li><b>wheel.slots.halted</b> (gauge)</li>
 *   <li><b>wheel.broker.connected</b> (gauge 0/1)</li>
 * </ul>
 */
@Service
public class WheelMetricsService {

    private final MeterRegistry meterRegistry;
    private final Counter cyclesRunCounter;
    private final Counter cyclesCoalescedCounter;
    private final Counter ordersPlacedCounter;
    private final Counter ordersRejectedCounter;
    private final Timer cycleLatencyTimer;
    private final AtomicReference<BigDecimal> lastBias = new AtomicReference<>(BigDecimal.ZERO);

    public WheelMetricsService(
            MeterRegistry meterRegistry,
            PositionBook positionBook,
            BrokerConnectionMonitor brokerConnectionMonitor) {
        this.meterRegistry = meterRegistry;

        this.cyclesRunCounter = Counter.builder("wheel.cycles.run")
                .description("Decision cycles completed")
                .register(meterRegistry);
        this.cyclesCoalescedCounter = Counter.builder("wheel.cycles.coalesced")
                .description("Cycle triggers coalesced into a pending cycle")
                .register(meterRegistry);
        this.ordersPlacedCounter = Counter.builder("wheel.orders.placed")
                .description("Orders acknowledged by the broker")
                .register(meterRegistry);
        this.ordersRejectedCounter = Counter.builder("wheel.orders.rejected")
                .description("Orders rejected by the broker")
                .register(meterRegistry);

        this.cycleLatencyTimer = Timer.builder("wheel.cycle.latency")
                .description("Time from snapshot to dispatch of a decision cycle")
                .publishPercentiles(0.5, 0.95, 0.99)
                .maximumExpectedValue(Duration.ofSeconds(30))
                .register(meterRegistry);

        meterRegistry.gauge("wheel.allocation.bias", lastBias, bias -> bias.get().doubleValue());
        meterRegistry.gauge("wheel.slots.halted", positionBook, book -> (double) book.haltedCount());
        meterRegistry.gauge(
                "wheel.broker.connected", brokerConnectionMonitor, monitor -> monitor.isConnected() ? 1.0 : 0.0);
    }

    @EventListener
    @Order(20)
    public void onCycleCompleted(CycleCompletedEvent event) {
        cyclesRunCounter.increment();
        cycleLatencyTimer.record(event.getElapsed());
        if (event.getOutcome().getPolicy() != null) {
            lastBias.set(event.getOutcome().getPolicy().getBias());
        }
        for (RollDecision decision : event.getOutcome().getDecisions()) {
            Counter.builder("wheel.decisions")
                    .tag("action", decision.getAction().name())
                    .register(meterRegistry)
                    .increment();
        }
    }

    @EventListener
    @Order(20)
    public void onAlert(WheelAlertEvent event) {
        Counter.builder("wheel.alerts")
                .tag("condition", event.getAlert().getCondition().name())
                .register(meterRegistry)
                .increment();
    }

    @EventListener
    @Order(20)
    public void onOrderEvent(OrderEvent event) {
        if (event.getEventType() == OrderEventType.ACKED) {
            ordersPlacedCounter.increment();
        } else if (event.getEventType() == OrderEventType.REJECTED) {
            ordersRejectedCounter.increment();
        }
    }

    public void recordCoalesced() {
        cyclesCoalescedCounter.increment();
    }
}
