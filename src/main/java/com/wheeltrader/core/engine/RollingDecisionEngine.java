package com.wheeltrader.core.engine;

import com.wheeltrader.chain.OptionsChainFilter;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DeltaStatus;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.PositionStatus;
import com.wheeltrader.domain.enums.RollAction;
import com.wheeltrader.domain.enums.RollReason;
import com.wheeltrader.domain.enums.SidePreference;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.WheelCondition;
import com.wheeltrader.domain.model.AllocationPolicy;
import com.wheeltrader.domain.model.CycleOutcome;
import com.wheeltrader.domain.model.CycleSnapshot;
import com.wheeltrader.domain.model.OptionContract;
import com.wheeltrader.domain.model.PortfolioState;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.domain.model.SlotSnapshot;
import com.wheeltrader.domain.model.TargetContract;
import com.wheeltrader.domain.model.WheelAlert;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.exception.NoEligibleContractException;
import com.wheeltrader.rebalance.PositionRebalancer;
import com.wheeltrader.schedule.ScheduleManager;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Decides, for every slot of the window, whether to hold, roll, close or open.
 *
 * <p>{@link #decide(CycleSnapshot)} is a pure function of the snapshot and the static
 * configuration: it places no orders, changes no state and reads no clock. The same
 * snapshot always produces the same outcome, so any cycle can be replayed from the
 * decision log.
 *
 * <p>Per slot, first matching rule wins:
 * <ol>
 *   <li>broker disconnected: HOLD everything</li>
 *   <li>slot HALTED or PAUSED: HOLD</li>
 *   <li>order still working for the slot: HOLD</li>
 *   <li>no leg (or a roll that lost its opening half): OPEN</li>
 *   <li>leg delta STALE: HOLD</li>
 *   <li>operator asked to close: CLOSE</li>
 *   <li>leg near the money: ROLL</li>
 *   <li>leg at or inside {@code min-days-to-expiry}: ROLL</li>
 *   <li>otherwise HOLD</li>
 * </ol>
 *
 * <p>OPEN and ROLL then compete for cash and shares in funding order (nearest slots first
 * when the bias is strong, farthest first otherwise). A slot whose best contract cannot be
 * covered tries the next ranked contract, then the other side where the policy allows it,
 * and holds only when nothing fits.
 */
@Component
public class RollingDecisionEngine {

    private final PositionRebalancer positionRebalancer;
    private final OptionsChainFilter optionsChainFilter;
    private final ScheduleManager scheduleManager;
    private final WheelProperties wheelProperties;

    public RollingDecisionEngine(
            PositionRebalancer positionRebalancer,
            OptionsChainFilter optionsChainFilter,
            ScheduleManager scheduleManager,
            WheelProperties wheelProperties) {
        this.positionRebalancer = positionRebalancer;
        this.optionsChainFilter = optionsChainFilter;
        this.scheduleManager = scheduleManager;
        this.wheelProperties = wheelProperties;
    }

    public CycleOutcome decide(CycleSnapshot snapshot) {
        PortfolioState portfolio = snapshot.getPortfolio();
        AllocationPolicy policy = positionRebalancer.policyFor(portfolio.getAllocationBias());
        Map<Integer, RollDecision> decisions = new HashMap<>();
        List<WheelAlert> alerts = new ArrayList<>();

        if (!snapshot.isBrokerConnected()) {
            for (SlotSnapshot slot : snapshot.getSlots()) {
                decisions.put(slot.getSlotId(), RollDecision.hold(
                        slot.getSlotId(), RollReason.BROKER_DISCONNECTED, baseContext(slot, snapshot, policy)));
            }
            alerts.add(WheelAlert.of(
                    WheelCondition.BROKER_DISCONNECTED, null, "Broker disconnected, holding all slots", null,
                    snapshot.getAsOf()));
            return assemble(snapshot, policy, decisions, alerts, null);
        }

        List<FundingRequest> requests = new ArrayList<>();
        for (SlotSnapshot slot : snapshot.getSlots()) {
            Map<String, Object> context = baseContext(slot, snapshot, policy);
            RollDecision decision = classify(slot, snapshot, context, alerts);
            if (decision != null) {
                decisions.put(slot.getSlotId(), decision);
                continue;
            }

            RollAction action = slot.getPosition() != null && slot.getPosition().getStatus() == PositionStatus.OPEN
                    ? RollAction.ROLL
                    : RollAction.OPEN;
            RollReason reason = action == RollAction.OPEN ? openReason(slot) : rollReason(slot);
            if (!portfolio.hasUnderlyingPrice()) {
                decisions.put(slot.getSlotId(), RollDecision.hold(slot.getSlotId(), RollReason.STALE_DATA, context));
                alerts.add(WheelAlert.of(
                        WheelCondition.STALE_MARKET_DATA, slot.getSlotId(),
                        "No underlying price, cannot select a contract for slot " + slot.getSlotId(), context,
                        snapshot.getAsOf()));
                continue;
            }
            requests.add(new FundingRequest(slot, action, reason, context));
        }

        Comparator<FundingRequest> byWindowIndex =
                Comparator.comparingInt(r -> snapshot.getWindow().indexOf(r.slot().getSlotId()));
        requests.sort(policy.isNearestFirst() ? byWindowIndex : byWindowIndex.reversed());

        ExposureBudget budget = new ExposureBudget(
                portfolio.getCashBalance(), portfolio.getSharesHeld(), wheelProperties.getContractMultiplier(),
                snapshot.getSlots());
        for (FundingRequest request : requests) {
            decisions.put(request.slot().getSlotId(), fund(request, snapshot, policy, budget, alerts));
        }

        return assemble(snapshot, policy, decisions, alerts, budget);
    }

    /**
     * Applies the hold/close rules. Returns null when the slot needs a contract (OPEN or ROLL).
     */
    private RollDecision classify(
            SlotSnapshot slot, CycleSnapshot snapshot, Map<String, Object> context, List<WheelAlert> alerts) {
        int slotId = slot.getSlotId();
        SlotControl control = slot.getControl() != null ? slot.getControl() : SlotControl.ACTIVE;
        if (control == SlotControl.HALTED) {
            return RollDecision.hold(slotId, RollReason.SLOT_HALTED, context);
        }
        if (control == SlotControl.PAUSED) {
            return RollDecision.hold(slotId, RollReason.SLOT_PAUSED, context);
        }
        if (slot.isPendingOrder()) {
            return RollDecision.hold(slotId, RollReason.AWAITING_BROKER, context);
        }

        WheelPosition leg = slot.getPosition();
        if (leg == null || leg.getStatus() == PositionStatus.PENDING_OPEN) {
            return control == SlotControl.CLOSE_REQUESTED
                    ? RollDecision.hold(slotId, RollReason.SLOT_PAUSED, context)
                    : null;
        }
        if (leg.getStatus() != PositionStatus.OPEN) {
            // PENDING_ROLL or PENDING_CLOSE with no working order: wait for reconciliation
            return RollDecision.hold(slotId, RollReason.AWAITING_BROKER, context);
        }

        if (slot.getDeltaStatus() == DeltaStatus.STALE) {
            alerts.add(WheelAlert.of(
                    WheelCondition.STALE_MARKET_DATA, slotId,
                    "Delta for " + leg.getContractId() + " is stale, holding slot " + slotId, context,
                    snapshot.getAsOf()));
            return RollDecision.hold(slotId, RollReason.STALE_DATA, context);
        }
        if (control == SlotControl.CLOSE_REQUESTED) {
            return RollDecision.builder()
                    .slotId(slotId)
                    .action(RollAction.CLOSE)
                    .reason(RollReason.OPERATOR_CLOSE)
                    .currentContractId(leg.getContractId())
                    .context(context)
                    .build();
        }
        if (slot.getDeltaStatus() == DeltaStatus.NEAR_MONEY || isExpiring(leg, snapshot.getToday())) {
            return null;
        }
        return RollDecision.hold(slotId, RollReason.IN_RANGE, context);
    }

    private RollDecision fund(
            FundingRequest request,
            CycleSnapshot snapshot,
            AllocationPolicy policy,
            ExposureBudget budget,
            List<WheelAlert> alerts) {
        SlotSnapshot slot = request.slot();
        int slotId = slot.getSlotId();
        WheelPosition leg = slot.getPosition();
        WheelPosition releasing = request.action() == RollAction.ROLL ? leg : null;
        LocalDate target = request.action() == RollAction.ROLL
                ? scheduleManager.rollTarget(snapshot.getWindow(), slotId)
                : slot.getTargetExpiration();
        BigDecimal price = snapshot.getPortfolio().getUnderlyingPrice();

        Map<String, Object> context = request.context();
        context.put("replacementTarget", target);

        boolean anyCandidate = false;
        List<String> misses = new ArrayList<>();
        for (OptionSide side : sidesToTry(request.action(), releasing, policy, budget)) {
            List<OptionContract> ranked;
            try {
                ranked = optionsChainFilter.eligible(
                        slotId, snapshot.getChain(), target, side, policy.getTargetDelta(), price);
            } catch (NoEligibleContractException e) {
                misses.add(e.getMessage());
                continue;
            }
            anyCandidate = true;
            for (OptionContract contract : ranked) {
                if (budget.tryReserve(contract, releasing)) {
                    TargetContract chosen = optionsChainFilter.toTarget(contract, policy.getTargetDelta());
                    return RollDecision.builder()
                            .slotId(slotId)
                            .action(request.action())
                            .reason(request.reason())
                            .currentContractId(releasing != null ? releasing.getContractId() : null)
                            .targetContract(chosen)
                            .context(context)
                            .build();
                }
            }
            misses.add("no " + side + " candidate fits remaining coverage");
        }

        context.put("misses", misses);
        context.put("availableCash", budget.getAvailableCash());
        context.put("availableCalls", budget.getAvailableCalls());
        if (anyCandidate) {
            alerts.add(WheelAlert.of(
                    WheelCondition.INSUFFICIENT_COVERAGE, slotId,
                    "Slot " + slotId + " " + request.action() + " skipped: not enough cash or shares", context,
                    snapshot.getAsOf()));
            return RollDecision.hold(slotId, RollReason.INSUFFICIENT_COVERAGE, context);
        }
        alerts.add(WheelAlert.of(
                WheelCondition.NO_ELIGIBLE_CONTRACT, slotId,
                "Slot " + slotId + " " + request.action() + " skipped: no eligible contract near " + target, context,
                snapshot.getAsOf()));
        return RollDecision.hold(slotId, RollReason.NO_ELIGIBLE_CONTRACT, context);
    }

    /** Sides in the order they are tried. A strict preference allows only that side. */
    private List<OptionSide> sidesToTry(
            RollAction action, WheelPosition releasing, AllocationPolicy policy, ExposureBudget budget) {
        SidePreference preference = policy.getSidePreference();
        if (preference == SidePreference.PUT) {
            return List.of(OptionSide.PUT);
        }
        if (preference == SidePreference.CALL) {
            return List.of(OptionSide.CALL);
        }
        OptionSide first = action == RollAction.ROLL && releasing.getSide() != null
                ? releasing.getSide()
                : budget.underweightSide();
        return List.of(first, first.other());
    }

    private RollReason openReason(SlotSnapshot slot) {
        WheelPosition leg = slot.getPosition();
        return leg != null && leg.getStatus() == PositionStatus.PENDING_OPEN
                ? RollReason.REOPEN_AFTER_FAILED_ROLL
                : RollReason.INITIAL_OPEN;
    }

    private RollReason rollReason(SlotSnapshot slot) {
        return slot.getDeltaStatus() == DeltaStatus.NEAR_MONEY ? RollReason.DELTA_TRIGGER : RollReason.EXPIRY_TRIGGER;
    }

    private boolean isExpiring(WheelPosition leg, LocalDate today) {
        return leg.getExpiration() != null
                && ChronoUnit.DAYS.between(today, leg.getExpiration()) <= wheelProperties.getMinDaysToExpiry();
    }

    private Map<String, Object> baseContext(SlotSnapshot slot, CycleSnapshot snapshot, AllocationPolicy policy) {
        PortfolioState portfolio = snapshot.getPortfolio();
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("slotId", slot.getSlotId());
        context.put("state", slot.getState());
        context.put("control", slot.getControl());
        context.put("targetExpiration", slot.getTargetExpiration());
        WheelPosition leg = slot.getPosition();
        if (leg != null) {
            context.put("contractId", leg.getContractId());
            context.put("side", leg.getSide());
            context.put("strike", leg.getStrike());
            context.put("expiration", leg.getExpiration());
            context.put("delta", leg.getDelta());
            if (leg.getExpiration() != null) {
                context.put("daysToExpiry", ChronoUnit.DAYS.between(snapshot.getToday(), leg.getExpiration()));
            }
        }
        context.put("deltaStatus", slot.getDeltaStatus());
        context.put("bias", policy.getBias());
        context.put("sidePreference", policy.getSidePreference());
        context.put("targetDelta", policy.getTargetDelta());
        context.put("underlyingPrice", portfolio.getUnderlyingPrice());
        context.put("cash", portfolio.getCashBalance());
        context.put("sharesHeld", portfolio.getSharesHeld());
        return context;
    }

    private CycleOutcome assemble(
            CycleSnapshot snapshot,
            AllocationPolicy policy,
            Map<Integer, RollDecision> decisions,
            List<WheelAlert> alerts,
            ExposureBudget budget) {
        List<RollDecision> ordered = new ArrayList<>();
        BigDecimal premium = BigDecimal.ZERO;
        for (SlotSnapshot slot : snapshot.getSlots()) {
            RollDecision decision = decisions.get(slot.getSlotId());
            if (decision == null) {
                continue;
            }
            ordered.add(decision);
            if (decision.getTargetContract() != null) {
                premium = premium.add(decision.getTargetContract().getPremium());
            }
        }
        return CycleOutcome.builder()
                .cycleId(snapshot.getCycleId())
                .policy(policy)
                .decisions(List.copyOf(ordered))
                .alerts(List.copyOf(alerts))
                .totalPremium(premium)
                .totalCashCommitted(budget != null ? budget.getCashCommitted() : BigDecimal.ZERO)
                .callsCommitted(budget != null ? budget.getCallsCommitted() : 0)
                .build();
    }

    private record FundingRequest(
            SlotSnapshot slot, RollAction action, RollReason reason, Map<String, Object> context) {}
}
