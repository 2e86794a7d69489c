package com.wheeltrader.position;

import com.wheeltrader.domain.enums.SlotControl;
import com.wheeltrader.domain.model.WheelPosition;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Slot ledger: the one leg record each slot owns, plus the operator control flag per slot.
 *
 * <p>Keyed by slot id, so a slot can never hold two records; a second live leg the broker
 * reports for a slot is caught by reconciliation and halts the slot instead.
 *
 * <p>Leg records are mutated only by the evaluation loop, between decision batches. Controls
 * may be changed by operators at any time; the loop reads them once per cycle.
 */
@Component
public class PositionBook {

    private final Map<Integer, WheelPosition> positions = new ConcurrentHashMap<>();
    private final Map<Integer, SlotControl> controls = new ConcurrentHashMap<>();

    public Optional<WheelPosition> find(int slotId) {
        return Optional.ofNullable(positions.get(slotId));
    }

    /** The slot's record only when it is not CLOSED. */
    public Optional<WheelPosition> findLive(int slotId) {
        return find(slotId).filter(WheelPosition::isLive);
    }

    public List<WheelPosition> all() {
        List<WheelPosition> all = new ArrayList<>(positions.values());
        all.sort(Comparator.comparingInt(WheelPosition::getSlotId));
        return all;
    }

    public List<WheelPosition> livePositions() {
        return all().stream().filter(WheelPosition::isLive).toList();
    }

    public void put(WheelPosition position) {
        positions.put(position.getSlotId(), position);
    }

    public void clear(int slotId) {
        positions.remove(slotId);
    }

    public SlotControl getControl(int slotId) {
        return controls.getOrDefault(slotId, SlotControl.ACTIVE);
    }

    public void setControl(int slotId, SlotControl control) {
        if (control == SlotControl.ACTIVE) {
            controls.remove(slotId);
        } else {
            controls.put(slotId, control);
        }
    }

    public long haltedCount() {
        return controls.values().stream().filter(c -> c == SlotControl.HALTED).count();
    }
}
