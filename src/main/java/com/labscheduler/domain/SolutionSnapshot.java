package com.labscheduler.domain;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable view of one assignment found during a search: slot id to the ordered
 * staff names assigned to it, plus the objective values at that point.
 */
public final class SolutionSnapshot {

    private final Map<String, List<String>> assignments;
    private final long coveredHeadcount;
    private final long balancePenalty;
    private final double coverageRatio;
    private final Duration elapsed;

    public SolutionSnapshot(Map<String, List<String>> assignments, long coveredHeadcount, long balancePenalty,
                            double coverageRatio, Duration elapsed) {
        Map<String, List<String>> copy = new LinkedHashMap<>();
        assignments.forEach((slotId, names) -> copy.put(slotId, List.copyOf(names)));
        this.assignments = Collections.unmodifiableMap(copy);
        this.coveredHeadcount = coveredHeadcount;
        this.balancePenalty = balancePenalty;
        this.coverageRatio = coverageRatio;
        this.elapsed = elapsed == null ? Duration.ZERO : elapsed;
    }

    /** A snapshot with every slot present and nobody assigned. */
    public static SolutionSnapshot empty(List<Slot> slots, Duration elapsed) {
        Map<String, List<String>> assignments = new LinkedHashMap<>();
        for (Slot slot : slots) {
            assignments.put(slot.getId(), List.of());
        }
        return new SolutionSnapshot(assignments, 0, 0, 0.0, elapsed);
    }

    public List<String> staffFor(String slotId) {
        return assignments.getOrDefault(slotId, List.of());
    }

    /** Slot ids assigned to a staff member, in slot order. */
    public List<String> slotsOf(String staffName) {
        List<String> result = new ArrayList<>();
        assignments.forEach((slotId, names) -> {
            if (names.contains(staffName)) {
                result.add(slotId);
            }
        });
        return result;
    }

    public List<Assignment> toAssignments() {
        List<Assignment> result = new ArrayList<>();
        assignments.forEach((slotId, names) -> names.forEach(n -> result.add(new Assignment(n, slotId))));
        return result;
    }

    public Map<String, List<String>> getAssignments() { return assignments; }

    public long getCoveredHeadcount() { return coveredHeadcount; }

    public long getBalancePenalty() { return balancePenalty; }

    public double getCoverageRatio() { return coverageRatio; }

    public Duration getElapsed() { return elapsed; }

    @Override
    public String toString() {
        return "Snapshot{covered=" + coveredHeadcount + ", balance=" + balancePenalty
            + ", ratio=" + String.format("%.2f", coverageRatio) + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
