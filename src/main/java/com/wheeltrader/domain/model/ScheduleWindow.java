package com.wheeltrader.domain.model;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * The ordered weekly slots and their target expirations.
 *
 * <p>Immutable. Target dates step by exactly seven days from head to tail; the constructor
 * rejects anything else. Advancing the window retires the head and re-appends its slot id
 * one week after the current tail, so slot ids are reused in rotation.
 */
public final class ScheduleWindow {

    private final List<WeeklySlot> slots;

    public ScheduleWindow(List<WeeklySlot> slots) {
        if (slots == null || slots.isEmpty()) {
            throw new IllegalArgumentException("Schedule window needs at least one slot");
        }
        Set<Integer> ids = new HashSet<>();
        for (int i = 0; i < slots.size(); i++) {
            WeeklySlot slot = slots.get(i);
            if (!ids.add(slot.getSlotId())) {
                throw new IllegalArgumentException("Duplicate slot id " + slot.getSlotId());
            }
            if (i > 0 && !slots.get(i - 1).getTargetExpiration().plusWeeks(1).equals(slot.getTargetExpiration())) {
                throw new IllegalArgumentException("Slot " + slot.getSlotId() + " target "
                        + slot.getTargetExpiration() + " is not one week after "
                        + slots.get(i - 1).getTargetExpiration());
            }
        }
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    /** Builds a window of {@code slotCount} slots with ids 0..n-1, starting at {@code firstExpiration}. */
    public static ScheduleWindow create(LocalDate firstExpiration, int slotCount) {
        List<WeeklySlot> slots = new ArrayList<>(slotCount);
        for (int i = 0; i < slotCount; i++) {
            slots.add(new WeeklySlot(i, firstExpiration.plusWeeks(i)));
        }
        return new ScheduleWindow(slots);
    }

    public ScheduleWindow advance() {
        List<WeeklySlot> next = new ArrayList<>(slots.subList(1, slots.size()));
        next.add(new WeeklySlot(head().getSlotId(), nextTailExpiration()));
        return new ScheduleWindow(next);
    }

    public WeeklySlot head() {
        return slots.get(0);
    }

    public WeeklySlot tail() {
        return slots.get(slots.size() - 1);
    }

    /** Target the next appended slot will receive. */
    public LocalDate nextTailExpiration() {
        return tail().getTargetExpiration().plusWeeks(1);
    }

    public List<WeeklySlot> getSlots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Optional<WeeklySlot> find(int slotId) {
        return slots.stream().filter(s -> s.getSlotId() == slotId).findFirst();
    }

    /** Position of the slot from the head (0 = nearest), or -1 if the id is unknown. */
    public int indexOf(int slotId) {
        for (int i = 0; i < slots.size(); i++) {
            if (slots.get(i).getSlotId() == slotId) {
                return i;
            }
        }
        return -1;
    }

    public boolean isHead(int slotId) {
        return head().getSlotId() == slotId;
    }

    public List<LocalDate> targetDates() {
        return slots.stream().map(WeeklySlot::getTargetExpiration).toList();
    }

    @Override
    public String toString() {
        return "ScheduleWindow" + slots;
    }
}
