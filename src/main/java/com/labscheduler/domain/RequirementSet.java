package com.labscheduler.domain;

import com.labscheduler.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * The ordered, validated collection of slots needing coverage.
 */
public final class RequirementSet implements Iterable<Slot> {

    private final List<Slot> slots;

    public RequirementSet(List<Slot> slots) {
        if (slots == null || slots.isEmpty()) {
            throw new ConfigurationException("The requirement set is empty: nothing to schedule");
        }
        Set<String> ids = new HashSet<>();
        for (Slot slot : slots) {
            if (!ids.add(slot.getId())) {
                throw new ConfigurationException("Duplicate slot id '" + slot.getId() + "'");
            }
        }
        this.slots = Collections.unmodifiableList(new ArrayList<>(slots));
    }

    public List<Slot> getSlots() { return slots; }

    public int size() {
        return slots.size();
    }

    public int getTotalRequired() {
        return slots.stream().mapToInt(Slot::getRequired).sum();
    }

    public int getShortestDurationMinutes() {
        return slots.stream().mapToInt(Slot::getDurationMinutes).min().orElse(0);
    }

    @Override
    public Iterator<Slot> iterator() {
        return slots.iterator();
    }
}
