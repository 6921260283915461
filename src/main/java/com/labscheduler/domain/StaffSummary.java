package com.labscheduler.domain;

import com.labscheduler.time.TimeLabels;

import java.math.BigDecimal;
import java.time.DayOfWeek;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Workload of one staff member in the final assignment.
 */
public final class StaffSummary {

    private final String name;
    private final long minutesAssigned;
    private final BigDecimal hoursHired;
    private final int slotCount;
    private final int labCount;
    private final int labCap;
    private final Map<DayOfWeek, Integer> dailyMinutes;
    private final List<String> assignedSlots;
    private final boolean hasResponse;

    public StaffSummary(String name, long minutesAssigned, BigDecimal hoursHired, int slotCount, int labCount,
                        int labCap, Map<DayOfWeek, Integer> dailyMinutes, List<String> assignedSlots,
                        boolean hasResponse) {
        this.name = name;
        this.minutesAssigned = minutesAssigned;
        this.hoursHired = hoursHired;
        this.slotCount = slotCount;
        this.labCount = labCount;
        this.labCap = labCap;
        this.dailyMinutes = dailyMinutes.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(dailyMinutes));
        this.assignedSlots = List.copyOf(assignedSlots);
        this.hasResponse = hasResponse;
    }

    public BigDecimal getHoursAssigned() {
        return TimeLabels.toHours(minutesAssigned);
    }

    public BigDecimal getRemainingHours() {
        return hoursHired.subtract(getHoursAssigned()).stripTrailingZeros();
    }

    /** {@code "Monday: 2h, Wednesday: 1.5h"}, or {@code "None"}. */
    public String getDailyBreakdown() {
        if (dailyMinutes.isEmpty()) {
            return "None";
        }
        return dailyMinutes.entrySet().stream()
            .map(e -> TimeLabels.formatDay(e.getKey()) + ": " + TimeLabels.toHours(e.getValue()).toPlainString() + "h")
            .collect(Collectors.joining(", "));
    }

    public String getName() { return name; }

    public long getMinutesAssigned() { return minutesAssigned; }

    public BigDecimal getHoursHired() { return hoursHired; }

    public int getSlotCount() { return slotCount; }

    public int getLabCount() { return labCount; }

    public int getLabCap() { return labCap; }

    public Map<DayOfWeek, Integer> getDailyMinutes() { return dailyMinutes; }

    public List<String> getAssignedSlots() { return assignedSlots; }

    public boolean hasResponse() { return hasResponse; }
}
