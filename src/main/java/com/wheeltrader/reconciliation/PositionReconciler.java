package com.wheeltrader.reconciliation;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.BrokerPosition;
import com.wheeltrader.domain.model.ReconciliationResult;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.WeeklySlot;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.schedule.ScheduleManager;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings the slot ledger in line with the broker's positions, which are the source of truth.
 *
 * <p>Resolution per mismatch:
 * <ul>
 *   <li>known leg no longer reported (expired, assigned, closed elsewhere) -> CLOSED</li>
 *   <li>PENDING_OPEN leg already reported -> OPEN</li>
 *   <li>unknown short leg on the underlying whose expiration fits an empty slot -> adopted</li>
 *   <li>unknown short leg that fits no slot, or any long leg -> ORPHAN_POSITION, left alone</li>
 *   <li>second live leg for an occupied slot, or more than one contract -> INVARIANT_VIOLATION,
 *       slot HALTED</li>
 * </ul>
 * Legs on other underlyings are ignored.
 */
@Service
public class PositionReconciler {

    private static final Logger log = LoggerFactory.getLogger(PositionReconciler.class);

    private final PositionBook positionBook;
    private final ScheduleManager scheduleManager;
    private final WheelProperties wheelProperties;
    private final DecisionLogger decisionLogger;

    public PositionReconciler(
            PositionBook positionBook,
            ScheduleManager scheduleManager,
            WheelProperties wheelProperties,
            DecisionLogger decisionLogger) {
        this.positionBook = positionBook;
        this.scheduleManager = scheduleManager;
        this.wheelProperties = wheelProperties;
        this.decisionLogger = decisionLogger;
    }

    public ReconciliationResult reconcile(
            long cycleId, List<BrokerPosition> brokerPositions, ScheduleWindow window, Instant now) {
        Map<String, BrokerPosition> brokerLegs = new LinkedHashMap<>();
        for (BrokerPosition position : brokerPositions) {
            if (wheelProperties.getUnderlying().equals(position.getUnderlying()) && position.getQuantity() != 0) {
                brokerLegs.putIfAbsent(position.getContractId(), position);
            }
        }

        ReconciliationResult result = ReconciliationResult.builder()
                .cycleId(cycleId)
                .brokerLegCount(brokerLegs.size())
                .build();

        for (WheelPosition leg : positionBook.livePositions()) {
            if (leg.getContractId() == null) {
                continue;
            }
            BrokerPosition reported = brokerLegs.remove(leg.getContractId());
            if (reported == null) {
                if (leg.getStatus() != PositionStatus.PENDING_OPEN) {
                    log.info(
                            "Slot {} leg {} no longer reported by broker, marking CLOSED",
                            leg.getSlotId(),
                            leg.getContractId());
                    leg.setStatus(PositionStatus.CLOSED);
                    leg.setUpdatedAt(now);
                    result.setClosed(result.getClosed() + 1);
                }
                continue;
            }

            result.setMatched(result.getMatched() + 1);
            if (reported.getQuantity() != -1) {
                violation(result, leg.getSlotId(), reported, "broker reports quantity " + reported.getQuantity()
                        + " for slot leg " + reported.getContractId(), now);
                continue;
            }
            if (leg.getStatus() == PositionStatus.PENDING_OPEN) {
                leg.setStatus(PositionStatus.OPEN);
                leg.setEntryPrice(reported.getAveragePrice());
                leg.setOpenedAt(now);
                leg.setUpdatedAt(now);
                result.setConfirmedOpen(result.getConfirmedOpen() + 1);
            }
        }

        for (BrokerPosition unknown : brokerLegs.values()) {
            if (unknown.getQuantity() > 0) {
                orphan(result, unknown, "long option leg is not managed by the wheel", now);
                continue;
            }
            Optional<WeeklySlot> slot = scheduleManager.slotForExpiration(window, unknown.getExpiration());
            if (slot.isEmpty()) {
                orphan(result, unknown, "expiration " + unknown.getExpiration() + " matches no slot", now);
                continue;
            }

            int slotId = slot.get().getSlotId();
            Optional<WheelPosition> occupant = positionBook.findLive(slotId);
            boolean awaitingReopen = occupant.isPresent()
                    && occupant.get().getStatus() == PositionStatus.PENDING_OPEN
                    && occupant.get().getContractId() == null;
            if (occupant.isPresent() && !awaitingReopen) {
                violation(result, slotId, unknown, "slot " + slotId + " already holds "
                        + occupant.get().getContractId() + ", broker also reports " + unknown.getContractId(), now);
                continue;
            }

            adopt(result, slotId, unknown, now);
            if (unknown.getQuantity() < -1) {
                violation(result, slotId, unknown, "adopted leg " + unknown.getContractId()
                        + " has quantity " + unknown.getQuantity(), now);
            }
        }

        if (result.hasChanges()) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("brokerLegs", result.getBrokerLegCount());
            context.put("matched", result.getMatched());
            context.put("confirmedOpen", result.getConfirmedOpen());
            context.put("closed", result.getClosed());
            context.put("adopted", result.getAdopted());
            context.put("alerts", result.getAlerts().size());
            decisionLogger.logSystemEvent(
                    cycleId,
                    DecisionSource.RECONCILIATION,
                    null,
                    DecisionType.RECONCILIATION,
                    "Slot ledger reconciled with broker",
                    context,
                    result.getHaltedSlots().isEmpty() ? DecisionSeverity.INFO : DecisionSeverity.CRITICAL);
        }
        return result;
    }

    private void adopt(ReconciliationResult result, int slotId, BrokerPosition leg, Instant now) {
        log.info("Adopting broker leg {} into slot {}", leg.getContractId(), slotId);
        positionBook.put(WheelPosition.builder()
                .slotId(slotId)
                .contractId(leg.getContractId())
                .underlying(leg.getUnderlying())
                .side(leg.getSide())
                .strike(leg.getStrike())
                .expiration(leg.getExpiration())
                .status(PositionStatus.OPEN)
                .entryPrice(leg.getAveragePrice())
                .openedAt(now)
                .updatedAt(now)
                .build());
        result.setAdopted(result.getAdopted() + 1);
    }

    private void orphan(ReconciliationResult result, BrokerPosition leg, String why, Instant now) {
        result.getAlerts().add(WheelAlert.of(
                WheelCondition.ORPHAN_POSITION,
                null,
                "Broker leg " + leg.getContractId() + " not tracked: " + why,
                legContext(leg),
                now));
    }

    private void violation(ReconciliationResult result, int slotId, BrokerPosition leg, String why, Instant now) {
        if (positionBook.getControl(slotId) == SlotControl.HALTED) {
            log.debug("Slot {} already halted: {}", slotId, why);
            return;
        }
        positionBook.setControl(slotId, SlotControl.HALTED);
        result.getHaltedSlots().add(slotId);
        result.getAlerts().add(WheelAlert.of(
                WheelCondition.INVARIANT_VIOLATION, slotId, "Slot " + slotId + " halted: " + why, legContext(leg), now));
    }

    private static Map<String, Object> legContext(BrokerPosition leg) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("contractId", leg.getContractId());
        context.put("side", leg.getSide());
        context.put("strike", leg.getStrike());
        context.put("expiration", leg.getExpiration());
        context.put("quantity", leg.getQuantity());
        return context;
    }
}
