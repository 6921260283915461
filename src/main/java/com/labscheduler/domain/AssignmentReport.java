package com.labscheduler.domain;

import com.labscheduler.engine.RunState;

import java.util.List;

/**
 * Final, structured result of a scheduling run.
 *
 * Under-covered slots are always listed in {@link #getGaps()}, including slots that
 * received nobody.
 */
public final class AssignmentReport {

    private final RunState state;
    private final boolean provenOptimal;
    private final long coverageUpperBound;
    private final SolutionSnapshot snapshot;
    private final List<SlotCoverage> slotCoverage;
    private final List<StaffSummary> staffSummaries;
    private final List<CoverageGap> gaps;
    private final List<String> unscheduledStaff;

    public AssignmentReport(RunState state, boolean provenOptimal, long coverageUpperBound,
                            SolutionSnapshot snapshot, List<SlotCoverage> slotCoverage,
                            List<StaffSummary> staffSummaries, List<CoverageGap> gaps,
                            List<String> unscheduledStaff) {
        this.state = state;
        this.provenOptimal = provenOptimal;
        this.coverageUpperBound = coverageUpperBound;
        this.snapshot = snapshot;
        this.slotCoverage = List.copyOf(slotCoverage);
        this.staffSummaries = List.copyOf(staffSummaries);
        this.gaps = List.copyOf(gaps);
        this.unscheduledStaff = List.copyOf(unscheduledStaff);
    }

    public int getTotalRequired() {
        return slotCoverage.stream().mapToInt(SlotCoverage::getRequired).sum();
    }

    public int getTotalAssigned() {
        return slotCoverage.stream().mapToInt(SlotCoverage::getAssignedCount).sum();
    }

    public long getFullyCoveredCount() {
        return slotCoverage.stream().filter(SlotCoverage::isFullyCovered).count();
    }

    public RunState getState() { return state; }

    public boolean isProvenOptimal() { return provenOptimal; }

    public long getCoverageUpperBound() { return coverageUpperBound; }

    public SolutionSnapshot getSnapshot() { return snapshot; }

    public List<SlotCoverage> getSlotCoverage() { return slotCoverage; }

    public List<StaffSummary> getStaffSummaries() { return staffSummaries; }

    public List<CoverageGap> getGaps() { return gaps; }

    public List<String> getUnscheduledStaff() { return unscheduledStaff; }
}
