package com.labscheduler.availability;

import com.labscheduler.domain.Slot;
import com.labscheduler.domain.UnavailabilityInterval;
import com.labscheduler.time.TimeRange;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Unavailability of every staff member, grouped per member and indexed by day.
 *
 * A member is known to the index when they answered the availability form, even
 * if they reported no unavailable period. Members unknown to the index cannot be
 * scheduled.
 */
public final class AvailabilityIndex {

    private final Map<String, EnumMap<DayOfWeek, List<TimeRange>>> byStaff;

    private AvailabilityIndex(Map<String, EnumMap<DayOfWeek, List<TimeRange>>> byStaff) {
        this.byStaff = byStaff;
    }

    /**
     * @param respondents  names of every staff member with a response row
     * @param intervals    their unavailable periods; the staff name of each interval
     *                     counts as a response too
     */
    public static AvailabilityIndex of(Collection<String> respondents, Collection<UnavailabilityInterval> intervals) {
        Map<String, EnumMap<DayOfWeek, List<TimeRange>>> byStaff = new LinkedHashMap<>();
        for (String name : respondents) {
            byStaff.computeIfAbsent(name.trim(), n -> new EnumMap<>(DayOfWeek.class));
        }
        for (UnavailabilityInterval interval : intervals) {
            byStaff.computeIfAbsent(interval.getStaffName(), n -> new EnumMap<>(DayOfWeek.class))
                .computeIfAbsent(interval.getDay(), d -> new ArrayList<>())
                .add(interval.getRange());
        }
        byStaff.values().forEach(days -> days.values().forEach(Collections::sort));
        return new AvailabilityIndex(byStaff);
    }

    public static AvailabilityIndex of(Collection<UnavailabilityInterval> intervals) {
        return of(List.of(), intervals);
    }

    /**
     * False iff the staff member has an unavailable period overlapping the slot.
     * A member without a response is reported available here; callers check
     * {@link #hasResponse(String)} separately.
     */
    public boolean isAvailable(String staffName, Slot slot) {
        return isAvailable(staffName, slot.getRange());
    }

    public boolean isAvailable(String staffName, TimeRange range) {
        EnumMap<DayOfWeek, List<TimeRange>> days = byStaff.get(staffName);
        if (days == null) {
            return true;
        }
        List<TimeRange> ranges = days.get(range.getDay());
        if (ranges == null) {
            return true;
        }
        for (TimeRange unavailable : ranges) {
            if (unavailable.overlaps(range)) {
                return false;
            }
        }
        return true;
    }

    public boolean hasResponse(String staffName) {
        return byStaff.containsKey(staffName);
    }

    /** Unavailable ranges of a member, ordered by day then start. */
    public List<TimeRange> unavailableRanges(String staffName) {
        EnumMap<DayOfWeek, List<TimeRange>> days = byStaff.get(staffName);
        if (days == null) {
            return List.of();
        }
        List<TimeRange> result = new ArrayList<>();
        days.values().forEach(result::addAll);
        return Collections.unmodifiableList(result);
    }

    public Set<String> getRespondents() {
        return Collections.unmodifiableSet(byStaff.keySet());
    }

    public int getIntervalCount() {
        return byStaff.values().stream()
            .flatMap(days -> days.values().stream())
            .mapToInt(List::size)
            .sum();
    }
}
