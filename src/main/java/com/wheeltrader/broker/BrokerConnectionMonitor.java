package com.wheeltrader.broker;

import com.wheeltrader.domain.enums.BrokerConnectionState;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Tracks whether the broker can be trusted for the next decision batch.
 *
 * <p>Fed from two directions: the cycle runner reports the outcome of every broker call it
 * makes, and a periodic probe asks the gateway directly. A single failed call degrades the
 * connection; {@value #MAX_CONSECUTIVE_FAILURES} consecutive failures, an explicit disconnect,
 * or a failed probe mark it DISCONNECTED, and every slot holds until a call succeeds again.
 */
@Service
public class BrokerConnectionMonitor {

    private static final Logger log = LoggerFactory.getLogger(BrokerConnectionMonitor.class);

    static final int MAX_CONSECUTIVE_FAILURES = 3;

    private final BrokerGateway brokerGateway;

    private final AtomicReference<BrokerConnectionState> currentState =
            new AtomicReference<>(BrokerConnectionState.CONNECTED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger(0);

    public BrokerConnectionMonitor(BrokerGateway brokerGateway) {
        this.brokerGateway = brokerGateway;
    }

    @Scheduled(fixedRateString = "${wheel.broker.health-check-ms:10000}")
    public void checkConnection() {
        if (brokerGateway.isConnected()) {
            if (currentState.get() == BrokerConnectionState.DISCONNECTED) {
                log.info("Broker probe succeeded, connection restored");
                recordSuccess();
            }
        } else {
            markDisconnected("broker probe reports no connection");
        }
    }

    public void recordSuccess() {
        consecutiveFailures.set(0);
        transition(BrokerConnectionState.CONNECTED, "broker call succeeded");
    }

    public void recordFailure(String reason) {
        int failures = consecutiveFailures.incrementAndGet();
        log.warn("Broker call failed ({}/{}): {}", failures, MAX_CONSECUTIVE_FAILURES, reason);
        if (failures >= MAX_CONSECUTIVE_FAILURES) {
            transition(BrokerConnectionState.DISCONNECTED, failures + " consecutive failures: " + reason);
        } else {
            transition(BrokerConnectionState.DEGRADED, reason);
        }
    }

    public void markDisconnected(String reason) {
        consecutiveFailures.incrementAndGet();
        transition(BrokerConnectionState.DISCONNECTED, reason);
    }

    public BrokerConnectionState getState() {
        return currentState.get();
    }

    /** False only when DISCONNECTED; a DEGRADED broker is still used. */
    public boolean isConnected() {
        return currentState.get() != BrokerConnectionState.DISCONNECTED;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures.get();
    }

    private void transition(BrokerConnectionState next, String reason) {
        BrokerConnectionState previous = currentState.getAndSet(next);
        if (previous == next) {
            return;
        }
        if (next == BrokerConnectionState.DISCONNECTED) {
            log.error("Broker connection {} -> {}: {}", previous, next, reason);
        } else {
            log.info("Broker connection {} -> {}: {}", previous, next, reason);
        }
    }
}
