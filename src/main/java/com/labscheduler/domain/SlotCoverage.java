package com.labscheduler.domain;

import java.util.List;

/**
 * Coverage of one slot in the final assignment.
 */
public final class SlotCoverage {

    private final Slot slot;
    private final List<String> assignedStaff;
    private final boolean hardGap;

    public SlotCoverage(Slot slot, List<String> assignedStaff, boolean hardGap) {
        this.slot = slot;
        this.assignedStaff = List.copyOf(assignedStaff);
        this.hardGap = hardGap;
    }

    public int getAssignedCount() {
        return assignedStaff.size();
    }

    public int getShortfall() {
        return Math.max(0, slot.getRequired() - assignedStaff.size());
    }

    public double getFillRatio() {
        return (double) assignedStaff.size() / slot.getRequired();
    }

    public boolean isFullyCovered() {
        return getShortfall() == 0;
    }

    public Slot getSlot() { return slot; }

    public List<String> getAssignedStaff() { return assignedStaff; }

    public int getRequired() { return slot.getRequired(); }

    /** No staff member was eligible for this slot at all. */
    public boolean isHardGap() { return hardGap; }
}
