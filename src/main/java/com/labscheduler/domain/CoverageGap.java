package com.labscheduler.domain;

/**
 * A slot left with fewer staff than required.
 */
public final class CoverageGap {

    private final Slot slot;
    private final int assigned;
    private final boolean hardGap;

    public CoverageGap(Slot slot, int assigned, boolean hardGap) {
        this.slot = slot;
        this.assigned = assigned;
        this.hardGap = hardGap;
    }

    public int getShortfall() {
        return slot.getRequired() - assigned;
    }

    public Slot getSlot() { return slot; }

    public int getAssigned() { return assigned; }

    public int getRequired() { return slot.getRequired(); }

    /** True when no staff member was eligible for the slot at all. */
    public boolean isHardGap() { return hardGap; }

    @Override
    public String toString() {
        return slot.getDisplayName() + " " + slot.getRange() + ": " + assigned + "/" + slot.getRequired()
            + (hardGap ? " (no eligible staff)" : "");
    }
}
