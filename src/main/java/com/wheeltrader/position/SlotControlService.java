package com.wheeltrader.position;

import com.wheeltrader.config.WheelProperties;
import com.wheeltrader.domain.enums.DecisionSeverity;
import com.wheeltrader.domain.enums.DecisionSource;
import com.wheeltrader.domain.enums.DecisionType;
import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.exception.BusinessException;
import com.wheeltrader.exception.ResourceNotFoundException;
import com.wheeltrader.observability.DecisionLogger;
import com.wheeltrader.schedule.ScheduleManager;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Operator controls over individual slots.
 *
 * <p>Controls only change flags in the {@link PositionBook}; the next cycle reads them from
 * its snapshot. PAUSED and HALTED slots hold. CLOSE_REQUESTED makes the engine close the
 * live leg, after which the loop moves the slot to PAUSED. HALTED is never set here: it
 * comes from an invariant violation and is cleared only by {@link #resume}.
 */
@Service
public class SlotControlService {

    private static final Logger log = LoggerFactory.getLogger(SlotControlService.class);

    private final PositionBook positionBook;
    private final ScheduleManager scheduleManager;
    private final WheelProperties wheelProperties;
    private final DecisionLogger decisionLogger;

    public SlotControlService(
            PositionBook positionBook,
            ScheduleManager scheduleManager,
            WheelProperties wheelProperties,
            DecisionLogger decisionLogger) {
        this.positionBook = positionBook;
        this.scheduleManager = scheduleManager;
        this.wheelProperties = wheelProperties;
        this.decisionLogger = decisionLogger;
    }

    /** Stops automation of the slot. The live leg, if any, is left untouched. */
    public SlotControl pause(int slotId, String reason) {
        SlotControl current = requireSlot(slotId);
        if (current == SlotControl.HALTED) {
            throw BusinessException.slotConflict(
                    slotId, current, "Slot " + slotId + " is HALTED; resume it before pausing");
        }
        return change(slotId, current, SlotControl.PAUSED, reason);
    }

    /** Returns the slot to automation, clearing PAUSED, HALTED or a pending close request. */
    public SlotControl resume(int slotId, String reason) {
        SlotControl current = requireSlot(slotId);
        if (current == SlotControl.HALTED) {
            log.warn("Operator clearing HALTED on slot {}: {}", slotId, reason);
        }
        return change(slotId, current, SlotControl.ACTIVE, reason);
    }

    /** Asks the engine to buy back the slot's live leg and then leave the slot paused. */
    public SlotControl requestClose(int slotId, String reason) {
        SlotControl current = requireSlot(slotId);
        if (current == SlotControl.HALTED) {
            throw BusinessException.slotConflict(
                    slotId, current, "Slot " + slotId + " is HALTED; resume it before closing");
        }
        if (positionBook.findLive(slotId).isEmpty()) {
            throw BusinessException.slotConflict(slotId, current, "Slot " + slotId + " has no live leg to close");
        }
        return change(slotId, current, SlotControl.CLOSE_REQUESTED, reason);
    }

    public SlotControl getControl(int slotId) {
        return requireSlot(slotId);
    }

    private SlotControl requireSlot(int slotId) {
        boolean known = scheduleManager.isInitialized()
                ? scheduleManager.getWindow().find(slotId).isPresent()
                : slotId >= 0 && slotId < wheelProperties.getSlotCount();
        if (!known) {
            throw new ResourceNotFoundException("Slot", String.valueOf(slotId));
        }
        return positionBook.getControl(slotId);
    }

    private SlotControl change(int slotId, SlotControl from, SlotControl to, String reason) {
        if (from == to) {
            return to;
        }
        positionBook.setControl(slotId, to);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("from", from);
        details.put("to", to);
        details.put("reason", reason);
        decisionLogger.logSystemEvent(
                0,
                DecisionSource.OPERATOR,
                slotId,
                DecisionType.SLOT_CONTROL_CHANGED,
                String.format("Slot %d %s -> %s%s", slotId, from, to, reason != null ? " (" + reason + ")" : ""),
                details,
                from == SlotControl.HALTED ? DecisionSeverity.WARNING : DecisionSeverity.INFO);
        return to;
    }
}
