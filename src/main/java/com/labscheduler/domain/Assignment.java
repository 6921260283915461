package com.labscheduler.domain;

import java.util.Objects;

/**
 * A staff member assigned to a slot.
 */
public final class Assignment {

    private final String staffName;
    private final String slotId;

    public Assignment(String staffName, String slotId) {
        this.staffName = Objects.requireNonNull(staffName, "staffName");
        this.slotId = Objects.requireNonNull(slotId, "slotId");
    }

    public String getStaffName() { return staffName; }

    public String getSlotId() { return slotId; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Assignment that)) return false;
        return staffName.equals(that.staffName) && slotId.equals(that.slotId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staffName, slotId);
    }

    @Override
    public String toString() {
        return staffName + " -> " + slotId;
    }
}
