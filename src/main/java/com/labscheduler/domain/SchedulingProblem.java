package com.labscheduler.domain;

import com.labscheduler.availability.AvailabilityIndex;
import com.labscheduler.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only input of one scheduling run: staff, their availability and the requirements.
 * Safe to share between runs.
 */
public final class SchedulingProblem {

    private final List<StaffMember> staff;
    private final AvailabilityIndex availability;
    private final RequirementSet requirements;

    public SchedulingProblem(List<StaffMember> staff, AvailabilityIndex availability, RequirementSet requirements) {
        if (staff == null || staff.isEmpty()) {
            throw new ConfigurationException("No staff members to schedule");
        }
        if (availability == null) {
            throw new ConfigurationException("Availability index is missing");
        }
        if (requirements == null) {
            throw new ConfigurationException("The requirement set is empty: nothing to schedule");
        }
        Set<String> names = new HashSet<>();
        for (StaffMember member : staff) {
            if (!names.add(member.getName())) {
                throw new ConfigurationException("Duplicate staff member '" + member.getName() + "'");
            }
        }
        this.staff = Collections.unmodifiableList(new ArrayList<>(staff));
        this.availability = availability;
        this.requirements = requirements;
    }

    /** Staff members that have an availability response and can therefore be scheduled. */
    public List<StaffMember> getSchedulableStaff() {
        return staff.stream().filter(s -> availability.hasResponse(s.getName())).toList();
    }

    /** Staff members without an availability response; never assigned. */
    public List<StaffMember> getUnscheduledStaff() {
        return staff.stream().filter(s -> !availability.hasResponse(s.getName())).toList();
    }

    public List<StaffMember> getStaff() { return staff; }

    public AvailabilityIndex getAvailability() { return availability; }

    public RequirementSet getRequirements() { return requirements; }

    public List<Slot> getSlots() {
        return requirements.getSlots();
    }
}
