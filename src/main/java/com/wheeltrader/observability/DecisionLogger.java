package com.wheeltrader.observability;

import com.wheeltrader.domain.enums.DecisionOutcome;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.RollAction;
import com.wheeltrader.domain.model.DecisionRecord;
import com.wheeltrader.domain.model.OrderIntent;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.domain.model.TargetContract;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.event.EventPublisherHelper;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Central decision log for the wheel.
 *
 * <p>Every non-HOLD decision, every order lifecycle transition and every reportable condition
 * becomes a {@link DecisionRecord} carrying the slot id, the reason and the snapshot values
 * behind it. Records are:
 * <ul>
 *   <li>kept in an in-memory ring buffer of the last {@value #RING_BUFFER_SIZE} entries, newest first</li>
 *   <li>written to the application log</li>
 *   <li>published as a {@code DecisionLogEvent}</li>
 * </ul>
 *
 * <p>Routine HOLDs only go to the application log at DEBUG so they do not flush the buffer.
 */
@Service
public class DecisionLogger {

    private static final Logger logger = LoggerFactory.getLogger(DecisionLogger.class);

    static final int RING_BUFFER_SIZE = 1000;

    private final EventPublisherHelper eventPublisherHelper;
    private final Clock clock;

    private final ConcurrentLinkedDeque<DecisionRecord> ringBuffer = new ConcurrentLinkedDeque<>();

    public DecisionLogger(EventPublisherHelper eventPublisherHelper, Clock clock) {
        this.eventPublisherHelper = eventPublisherHelper;
        this.clock = clock;
    }

    // ---- Core logging method ----

    public DecisionRecord log(
            long cycleId,
            DecisionSource source,
            Integer slotId,
            String sourceId,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> dataContext,
            DecisionSeverity severity) {

        Instant now = clock.instant();
        DecisionRecord decisionRecord = DecisionRecord.builder()
                .timestamp(now)
                .cycleId(cycleId)
                .source(source)
                .slotId(slotId)
                .sourceId(sourceId)
                .decisionType(decisionType)
                .outcome(outcome)
                .reasoning(reasoning)
                .dataContext(dataContext != null ? dataContext : Map.of())
                .severity(severity)
                .sessionDate(LocalDate.ofInstant(now, clock.getZone()))
                .build();

        persist(decisionRecord);
        return decisionRecord;
    }

    // ---- Engine decisions ----

    /** Logs one engine decision. HOLDs only reach the application log. */
    public void logDecision(long cycleId, RollDecision decision) {
        if (decision.isHold()) {
            logger.debug(
                    "cycle={} slot={} HOLD reason={} context={}",
                    cycleId,
                    decision.getSlotId(),
                    decision.getReason(),
                    decision.getContext());
            return;
        }

        Map<String, Object> context = new LinkedHashMap<>();
        if (decision.getContext() != null) {
            context.putAll(decision.getContext());
        }
        TargetContract target = decision.getTargetContract();
        if (target != null) {
            context.put("targetContractId", target.getContractId());
            context.put("targetSide", target.getSide());
            context.put("targetStrike", target.getStrike());
            context.put("targetExpiration", target.getExpiration());
            context.put("targetDelta", target.getTargetDelta());
            context.put("contractDelta", target.getContract().getDelta());
            context.put("limitPrice", target.getLimitPrice());
            context.put("premium", target.getPremium());
            context.put("collateral", target.getCollateral());
        }

        log(
                cycleId,
                DecisionSource.DECISION_ENGINE,
                decision.getSlotId(),
                decision.getCurrentContractId() != null
                        ? decision.getCurrentContractId()
                        : target != null ? target.getContractId() : null,
                typeOf(decision.getAction()),
                DecisionOutcome.TRIGGERED,
                decision.getAction() + " slot " + decision.getSlotId() + " (" + decision.getReason() + ")",
                context,
                DecisionSeverity.INFO);
    }

    // ---- Conditions ----

    /** Logs a reportable condition and publishes it as an alert. */
    public void logAlert(long cycleId, DecisionSource source, WheelAlert alert) {
        Map<String, Object> context = new LinkedHashMap<>(alert.getContext());
        context.put("condition", alert.getCondition());

        log(
                cycleId,
                source,
                alert.getSlotId(),
                alert.getCondition().name(),
                DecisionType.CONDITION_RAISED,
                alert.getSeverity() == DecisionSeverity.CRITICAL ? DecisionOutcome.FAILED : DecisionOutcome.INFO,
                alert.getMessage(),
                context,
                alert.getSeverity());

        try {
            eventPublisherHelper.publishAlert(this, alert);
        } catch (Exception e) {
            logger.error("Failed to publish WheelAlertEvent: {}", e.getMessage());
        }
    }

    // ---- Orders ----

    public void logOrderEvent(
            OrderIntent intent,
            DecisionType decisionType,
            DecisionOutcome outcome,
            String reasoning,
            Map<String, Object> details) {

        Map<String, Object> context = new LinkedHashMap<>();
        context.put("intentId", intent.getIntentId());
        context.put("purpose", intent.getPurpose());
        context.put("status", intent.getStatus());
        context.put("contractId", intent.getContractId());
        context.put("orderSide", intent.getOrderSide());
        context.put("limitPrice", intent.getLimitPrice());
        if (intent.getBrokerOrderId() != null) {
            context.put("brokerOrderId", intent.getBrokerOrderId());
        }
        if (details != null) {
            context.putAll(details);
        }

        DecisionSeverity severity = (outcome == DecisionOutcome.REJECTED || outcome == DecisionOutcome.FAILED)
                ? DecisionSeverity.WARNING
                : DecisionSeverity.INFO;

        log(
                intent.getCycleId(),
                DecisionSource.ORDER_LIFECYCLE,
                intent.getSlotId(),
                intent.getIntentId(),
                decisionType,
                outcome,
                reasoning,
                context,
                severity);
    }

    // ---- System ----

    public void logSystemEvent(
            long cycleId,
            DecisionSource source,
            Integer slotId,
            DecisionType decisionType,
            String reasoning,
            Map<String, Object> details,
            DecisionSeverity severity) {
        log(cycleId, source, slotId, null, decisionType, DecisionOutcome.INFO, reasoning, details, severity);
    }

    // ---- Ring buffer queries ----

    public List<DecisionRecord> getRecentDecisions(int count) {
        return ringBuffer.stream().limit(count).toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, int slotId) {
        return ringBuffer.stream()
                .filter(r -> r.getSlotId() != null && r.getSlotId() == slotId)
                .limit(count)
                .toList();
    }

    public List<DecisionRecord> getRecentDecisions(int count, DecisionSeverity minSeverity) {
        return ringBuffer.stream()
                .filter(r -> r.getSeverity().ordinal() >= minSeverity.ordinal())
                .limit(count)
                .toList();
    }

    public int getBufferSize() {
        return ringBuffer.size();
    }

    // ---- Internal ----

    private static DecisionType typeOf(RollAction action) {
        return switch (action) {
            case OPEN -> DecisionType.SLOT_OPEN;
            case ROLL -> DecisionType.SLOT_ROLL;
            case CLOSE -> DecisionType.SLOT_CLOSE;
            case HOLD -> DecisionType.SLOT_HOLD;
        };
    }

    private void persist(DecisionRecord decisionRecord) {
        ringBuffer.addFirst(decisionRecord);
        while (ringBuffer.size() > RING_BUFFER_SIZE) {
            ringBuffer.removeLast();
        }

        writeToLog(decisionRecord);

        try {
            eventPublisherHelper.publishDecisionLogged(this, decisionRecord);
        } catch (Exception e) {
            // listener failures never block the decision path
            logger.error("Failed to publish DecisionLogEvent: {}", e.getMessage());
        }
    }

    private void writeToLog(DecisionRecord r) {
        String pattern = "cycle={} slot={} [{}] {} {}: {} {}";
        Object[] args = {
            r.getCycleId(),
            r.getSlotId(),
            r.getSource(),
            r.getDecisionType(),
            r.getOutcome(),
            r.getReasoning(),
            r.getDataContext()
        };
        switch (r.getSeverity()) {
            case CRITICAL -> logger.error(pattern, args);
            case WARNING -> logger.warn(pattern, args);
            case INFO -> logger.info(pattern, args);
            default -> logger.debug(pattern, args);
        }
    }
}
