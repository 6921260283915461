package com.labscheduler.domain;

import com.labscheduler.time.TimeRange;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * A period during which a staff member cannot be assigned.
 */
public final class UnavailabilityInterval {

    private final String staffName;
    private final TimeRange range;

    public UnavailabilityInterval(String staffName, TimeRange range) {
        this.staffName = Objects.requireNonNull(staffName, "staffName").trim();
        this.range = Objects.requireNonNull(range, "range");
    }

    public UnavailabilityInterval(String staffName, DayOfWeek day, int startMinute, int endMinute) {
        this(staffName, new TimeRange(day, startMinute, endMinute));
    }

    public String getStaffName() { return staffName; }

    public TimeRange getRange() { return range; }

    public DayOfWeek getDay() { return range.getDay(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof UnavailabilityInterval that)) return false;
        return staffName.equals(that.staffName) && range.equals(that.range);
    }

    @Override
    public int hashCode() {
        return Objects.hash(staffName, range);
    }

    @Override
    public String toString() {
        return "Unavailable{" + staffName + " " + range + "}";
    }
}
