package com.labscheduler.time;

import java.time.DayOfWeek;
import java.util.Objects;

/**
 * A half-open time range {@code [start, end)} on a day of the week,
 * in minutes since midnight.
 */
public final class TimeRange implements Comparable<TimeRange> {

    public static final int MINUTES_PER_DAY = 24 * 60;

    private final DayOfWeek day;
    private final int startMinute;
    private final int endMinute;

    public TimeRange(DayOfWeek day, int startMinute, int endMinute) {
        Objects.requireNonNull(day, "day");
        if (startMinute < 0 || endMinute > MINUTES_PER_DAY) {
            throw new IllegalArgumentException("Range " + startMinute + "-" + endMinute + " is outside the day");
        }
        if (startMinute >= endMinute) {
            throw new IllegalArgumentException("Range start (" + startMinute + ") must be before end (" + endMinute + ")");
        }
        this.day = day;
        this.startMinute = startMinute;
        this.endMinute = endMinute;
    }

    /**
     * True iff both ranges are on the same day and share at least one instant.
     * A range ending exactly when the other begins does not overlap it.
     */
    public boolean overlaps(TimeRange other) {
        if (day != other.day) return false;
        return startMinute < other.endMinute && other.startMinute < endMinute;
    }

    public static boolean overlaps(TimeRange a, TimeRange b) {
        return a.overlaps(b);
    }

    public int getDurationMinutes() {
        return endMinute - startMinute;
    }

    public DayOfWeek getDay() { return day; }

    public int getStartMinute() { return startMinute; }

    public int getEndMinute() { return endMinute; }

    @Override
    public int compareTo(TimeRange other) {
        int cmp = day.compareTo(other.day);
        if (cmp != 0) return cmp;
        cmp = Integer.compare(startMinute, other.startMinute);
        if (cmp != 0) return cmp;
        return Integer.compare(endMinute, other.endMinute);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange that)) return false;
        return day == that.day && startMinute == that.startMinute && endMinute == that.endMinute;
    }

    @Override
    public int hashCode() {
        return Objects.hash(day, startMinute, endMinute);
    }

    @Override
    public String toString() {
        return TimeLabels.formatDay(day) + " " + TimeLabels.format(startMinute) + "-" + TimeLabels.format(endMinute);
    }
}
