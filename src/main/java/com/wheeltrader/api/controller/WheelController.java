package com.wheeltrader.api.controller;

import com.wheeltrader.api.dto.request.SlotControlRequest;
import com.wheeltrader.api.dto.response.SlotStatusResponse;
import com.wheeltrader.api.dto.response.WheelStatusResponse;
import com.wheeltrader.broker.BrokerConnectionMonitor;
import com.wheeltrader.calendar.TradingCalendarService;
import com.wheeltrader.chain.OptionsChainFilter;
import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.core.engine.WheelCycleRunner;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.OptionSide;
import com.wheeltrader.domain.enums.SidePreference;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.enums.SlotState;
import com.wheeltrader.domain.model.AllocationPolicy;
import com.wheeltrader.domain.model.CycleOutcome;
import com.wheeltrader.domain.model.CycleSnapshot;
import com.wheeltrader.domain.model.DecisionRecord;
import com.wheeltrader.domain.model.OrderIntent;
import com.wheeltrader.domain.model.PortfolioState;
import com.wheeltrader.domain.model.RollDecision;
import com.wheeltrader.domain.model.ScheduleWindow;
import com.wheeltrader.domain.model.TargetContract;
import com.wheeltrader.domain.model.WeeklySlot;
import com.wheeltrader.domain.model.WheelPosition;
import com.wheeltrader.exception.NoEligibleContractException;
import com.wheeltrader.exception.ResourceNotFoundException;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.oms.OrderLifecycleManager;
import com.wheeltrader.position.PositionBook;
import com.wheeltrader.position.SlotControlService;
import com.wheeltrader.schedule.ScheduleManager;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Operator endpoints for the wheel.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>GET /api/wheel/status -- window, slots, controls and last-cycle portfolio</li>
 *   <li>GET /api/wheel/decisions -- recent decision log, optionally per slot or by severity</li>
 *   <li>GET /api/wheel/orders -- recent order intents</li>
 *   <li>GET /api/wheel/orders/{intentId} -- one order intent</li>
 *   <li>GET /api/wheel/slots/{slotId}/candidates -- contracts the slot would open against the last chain</li>
 *   <li>POST /api/wheel/cycle -- queue a decision cycle now</li>
 *   <li>POST /api/wheel/slots/{slotId}/pause -- stop automating a slot</li>
 *   <li>POST /api/wheel/slots/{slotId}/resume -- resume a paused or halted slot</li>
 *   <li>POST /api/wheel/slots/{slotId}/close -- buy back the slot's leg, then pause it</li>
 * </ul>
 */
@RestController
@RequestMapping("/api/wheel")
public class WheelController {

    private static final Logger log = LoggerFactory.getLogger(WheelController.class);

    private static final int MAX_CANDIDATES = 5;

    private final WheelCycleRunner wheelCycleRunner;
    private final ScheduleManager scheduleManager;
    private final PositionBook positionBook;
    private final SlotControlService slotControlService;
    private final OrderLifecycleManager orderLifecycleManager;
    private final DecisionLogger decisionLogger;
    private final BrokerConnectionMonitor brokerConnectionMonitor;
    private final TradingCalendarService tradingCalendarService;
    private final OptionsChainFilter optionsChainFilter;
    private final WheelProperties wheelProperties;

    public WheelController(
            WheelCycleRunner wheelCycleRunner,
            ScheduleManager scheduleManager,
            PositionBook positionBook,
            SlotControlService slotControlService,
            OrderLifecycleManager orderLifecycleManager,
            DecisionLogger decisionLogger,
            BrokerConnectionMonitor brokerConnectionMonitor,
            TradingCalendarService tradingCalendarService,
            OptionsChainFilter optionsChainFilter,
            WheelProperties wheelProperties) {
        this.wheelCycleRunner = wheelCycleRunner;
        this.scheduleManager = scheduleManager;
        this.positionBook = positionBook;
        this.slotControlService = slotControlService;
        this.orderLifecycleManager = orderLifecycleManager;
        this.decisionLogger = decisionLogger;
        this.brokerConnectionMonitor = brokerConnectionMonitor;
        this.tradingCalendarService = tradingCalendarService;
        this.optionsChainFilter = optionsChainFilter;
        this.wheelProperties = wheelProperties;
    }

    @GetMapping("/status")
    public ResponseEntity<WheelStatusResponse> getStatus() {
        Optional<CycleOutcome> outcome = wheelCycleRunner.getLastOutcome();
        Optional<CycleSnapshot> snapshot = wheelCycleRunner.getLastSnapshot();
        PortfolioState portfolio = snapshot.map(CycleSnapshot::getPortfolio).orElse(null);
        AllocationPolicy policy = outcome.map(CycleOutcome::getPolicy).orElse(null);

        WheelStatusResponse response = WheelStatusResponse.builder()
                .underlying(wheelProperties.getUnderlying())
                .marketPhase(tradingCalendarService.getCurrentPhase())
                .brokerState(brokerConnectionMonitor.getState())
                .cycleCount(wheelCycleRunner.getCycleCount())
                .cyclePending(wheelCycleRunner.isCyclePending())
                .lastCycleId(snapshot.map(CycleSnapshot::getCycleId).orElse(null))
                .lastCycleAt(snapshot.map(CycleSnapshot::getAsOf).orElse(null))
                .cashBalance(portfolio != null ? portfolio.getCashBalance() : null)
                .sharesHeld(portfolio != null ? portfolio.getSharesHeld() : null)
                .targetShares(portfolio != null ? portfolio.getTargetShares() : null)
                .underlyingPrice(portfolio != null ? portfolio.getUnderlyingPrice() : null)
                .allocationBias(policy != null ? policy.getBias() : null)
                .sidePreference(policy != null ? policy.getSidePreference() : null)
                .targetDelta(policy != null ? policy.getTargetDelta() : null)
                .nearestFirst(policy != null ? policy.isNearestFirst() : null)
                .lastCyclePremium(outcome.map(CycleOutcome::getTotalPremium).orElse(null))
                .workingOrderCount(orderLifecycleManager.getWorkingIntents().size())
                .haltedSlotCount(positionBook.haltedCount())
                .slots(slotRows(outcome.orElse(null)))
                .build();
        return ResponseEntity.ok(response);
    }

    /**
     * Recent decision log entries, newest first. {@code slotId} takes precedence over
     * {@code minSeverity} when both are given.
     */
    @GetMapping("/decisions")
    public ResponseEntity<List<DecisionRecord>> getDecisions(
            @RequestParam(defaultValue = "50") int count,
            @RequestParam(required = false) Integer slotId,
            @RequestParam(required = false) DecisionSeverity minSeverity) {
        int limit = Math.max(1, Math.min(count, 1000));
        if (slotId != null) {
            return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit, slotId));
        }
        if (minSeverity != null) {
            return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit, minSeverity));
        }
        return ResponseEntity.ok(decisionLogger.getRecentDecisions(limit));
    }

    @GetMapping("/orders")
    public ResponseEntity<List<OrderIntent>> getOrders(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "false") boolean workingOnly) {
        if (workingOnly) {
            return ResponseEntity.ok(orderLifecycleManager.getWorkingIntents());
        }
        return ResponseEntity.ok(orderLifecycleManager.getIntents(Math.max(1, limit)));
    }

    @GetMapping("/orders/{intentId}")
    public ResponseEntity<OrderIntent> getOrder(@PathVariable String intentId) {
        return orderLifecycleManager
                .getIntent(intentId)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ResourceNotFoundException("Order intent", intentId));
    }

    /**
     * Ranked contracts the slot would open against the last cycle's chain and policy. Side
     * defaults to the policy's preference, puts when either side is allowed.
     */
    @GetMapping("/slots/{slotId}/candidates")
    public ResponseEntity<List<TargetContract>> getCandidates(
            @PathVariable int slotId, @RequestParam(required = false) OptionSide side) {
        CycleSnapshot snapshot = wheelCycleRunner.getLastSnapshot()
                .orElseThrow(() -> new ResourceNotFoundException("Cycle snapshot", "latest"));
        AllocationPolicy policy = wheelCycleRunner.getLastOutcome()
                .map(CycleOutcome::getPolicy)
                .orElseThrow(() -> new ResourceNotFoundException("Cycle outcome", "latest"));
        WeeklySlot slot = snapshot.getWindow().find(slotId)
                .orElseThrow(() -> new ResourceNotFoundException("Slot", String.valueOf(slotId)));
        OptionSide chosen = side != null
                ? side
                : policy.getSidePreference() == SidePreference.CALL ? OptionSide.CALL : OptionSide.PUT;

        if (!snapshot.getPortfolio().hasUnderlyingPrice()) {
            throw new NoEligibleContractException(
                    slotId, slot.getTargetExpiration(), "no underlying price in cycle " + snapshot.getCycleId());
        }
        List<TargetContract> candidates = optionsChainFilter
                .eligible(
                        slotId,
                        snapshot.getChain(),
                        slot.getTargetExpiration(),
                        chosen,
                        policy.getTargetDelta(),
                        snapshot.getPortfolio().getUnderlyingPrice())
                .stream()
                .limit(MAX_CANDIDATES)
                .map(c -> optionsChainFilter.toTarget(c, policy.getTargetDelta()))
                .toList();
        return ResponseEntity.ok(candidates);
    }

    /** Queues a cycle; returns queued=false when one is already waiting. */
    @PostMapping("/cycle")
    public ResponseEntity<Map<String, Object>> triggerCycle() {
        boolean queued = wheelCycleRunner.requestCycle("OPERATOR");
        log.info("Manual cycle requested (queued={})", queued);
        return ResponseEntity.ok(Map.of("queued", queued));
    }

    @PostMapping("/slots/{slotId}/pause")
    public ResponseEntity<Map<String, Object>> pauseSlot(
            @PathVariable int slotId, @Valid @RequestBody(required = false) SlotControlRequest request) {
        SlotControl control = slotControlService.pause(slotId, reason(request));
        return ResponseEntity.ok(Map.of("slotId", slotId, "control", control));
    }

    @PostMapping("/slots/{slotId}/resume")
    public ResponseEntity<Map<String, Object>> resumeSlot(
            @PathVariable int slotId, @Valid @RequestBody(required = false) SlotControlRequest request) {
        SlotControl control = slotControlService.resume(slotId, reason(request));
        return ResponseEntity.ok(Map.of("slotId", slotId, "control", control));
    }

    @PostMapping("/slots/{slotId}/close")
    public ResponseEntity<Map<String, Object>> closeSlot(
            @PathVariable int slotId, @Valid @RequestBody(required = false) SlotControlRequest request) {
        SlotControl control = slotControlService.requestClose(slotId, reason(request));
        wheelCycleRunner.requestCycle("OPERATOR");
        return ResponseEntity.ok(Map.of("slotId", slotId, "control", control));
    }

    private List<SlotStatusResponse> slotRows(CycleOutcome outcome) {
        if (!scheduleManager.isInitialized()) {
            return List.of();
        }
        ScheduleWindow window = scheduleManager.getWindow();
        List<SlotStatusResponse> rows = new ArrayList<>();
        for (WeeklySlot slot : window.getSlots()) {
            int slotId = slot.getSlotId();
            WheelPosition leg = positionBook.find(slotId).orElse(null);
            RollDecision last = outcome != null ? outcome.decisionFor(slotId).orElse(null) : null;
            rows.add(SlotStatusResponse.builder()
                    .slotId(slotId)
                    .targetExpiration(slot.getTargetExpiration())
                    .head(window.isHead(slotId))
                    .control(positionBook.getControl(slotId))
                    .state(SlotState.of(leg != null ? leg.getStatus() : null))
                    .contractId(leg != null ? leg.getContractId() : null)
                    .side(leg != null ? leg.getSide() : null)
                    .strike(leg != null ? leg.getStrike() : null)
                    .expiration(leg != null ? leg.getExpiration() : null)
                    .positionStatus(leg != null ? leg.getStatus() : null)
                    .delta(leg != null ? leg.getDelta() : null)
                    .deltaStatus(leg != null ? leg.getDeltaStatus() : null)
                    .entryPrice(leg != null ? leg.getEntryPrice() : null)
                    .pendingOrder(orderLifecycleManager.hasPendingOrder(slotId))
                    .lastAction(last != null ? last.getAction() : null)
                    .lastReason(last != null ? last.getReason() : null)
                    .build());
        }
        return rows;
    }

    private static String reason(SlotControlRequest request) {
        return request != null && request.getReason() != null ? request.getReason() : "operator request";
    }
}
