package com.labscheduler.domain;

import com.labscheduler.exception.ConfigurationException;
import com.labscheduler.time.TimeRange;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * A time-bounded work requirement (a lab section meeting) that needs a number of staff.
 *
 * Slots sharing a label belong to the same lab; the per-staff lab cap counts labs,
 * not meetings. An unlabelled slot is its own lab.
 */
public final class Slot {

    private final String id;
    private final TimeRange range;
    private final int required;
    private final String label;

    public Slot(String id, DayOfWeek day, int startMinute, int endMinute, int required, String label) {
        if (id == null || id.isBlank()) {
            throw new ConfigurationException("Slot id must not be blank");
        }
        if (required < 1) {
            throw new ConfigurationException("Slot '" + id + "' must require at least one staff member, got " + required);
        }
        if (day == null) {
            throw new ConfigurationException("Slot '" + id + "' has no day");
        }
        if (startMinute >= endMinute) {
            throw new ConfigurationException("Slot '" + id + "' must end after it starts");
        }
        if (startMinute < 0 || endMinute > TimeRange.MINUTES_PER_DAY) {
            throw new ConfigurationException("Slot '" + id + "' is outside the day");
        }
        this.id = id;
        this.range = new TimeRange(day, startMinute, endMinute);
        this.required = required;
        this.label = label == null || label.isBlank() ? null : label.trim();
    }

    public Slot(String id, DayOfWeek day, int startMinute, int endMinute, int required) {
        this(id, day, startMinute, endMinute, required, null);
    }

    public boolean overlaps(Slot other) {
        return range.overlaps(other.range);
    }

    /** Lab grouping key: the label when present, otherwise the slot id. */
    public String getGroupKey() {
        return label != null ? label : id;
    }

    public int getDurationMinutes() {
        return range.getDurationMinutes();
    }

    public String getDisplayName() {
        return label != null ? label : id;
    }

    public String getId() { return id; }

    public TimeRange getRange() { return range; }

    public DayOfWeek getDay() { return range.getDay(); }

    public int getStartMinute() { return range.getStartMinute(); }

    public int getEndMinute() { return range.getEndMinute(); }

    public int getRequired() { return required; }

    public String getLabel() { return label; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Slot that)) return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Slot{" + getDisplayName() + " " + range + " x" + required + "}";
    }
}
