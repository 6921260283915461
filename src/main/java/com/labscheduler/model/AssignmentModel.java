package com.labscheduler.model;

import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.SolutionSnapshot;
import com.labscheduler.solver.ConstraintSolver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The built model of one run: the solver holding it and the mapping from solver
 * variables back to (staff, slot) pairs.
 */
public final class AssignmentModel {

    private final SchedulingProblem problem;
    private final ConstraintSolver solver;
    private final List<AssignmentVariable> variables;
    private final Map<String, List<AssignmentVariable>> bySlot;
    private final List<Slot> hardGaps;
    private final long coverageUpperBound;
    private final int prunedPairs;
    private final Map<String, Integer> constraintCounts;

    AssignmentModel(SchedulingProblem problem, ConstraintSolver solver, List<AssignmentVariable> variables,
                    List<Slot> hardGaps, long coverageUpperBound, int prunedPairs,
                    Map<String, Integer> constraintCounts) {
        this.problem = problem;
        this.solver = solver;
        this.variables = Collections.unmodifiableList(new ArrayList<>(variables));
        this.hardGaps = List.copyOf(hardGaps);
        this.coverageUpperBound = coverageUpperBound;
        this.prunedPairs = prunedPairs;
        this.constraintCounts = Collections.unmodifiableMap(new LinkedHashMap<>(constraintCounts));

        Map<String, List<AssignmentVariable>> slots = new LinkedHashMap<>();
        for (Slot slot : problem.getSlots()) {
            slots.put(slot.getId(), new ArrayList<>());
        }
        for (AssignmentVariable v : variables) {
            slots.get(v.getSlot().getId()).add(v);
        }
        this.bySlot = slots;
    }

    /**
     * Converts solver values into a snapshot. Staff names per slot follow the input
     * order of the staff list.
     */
    public SolutionSnapshot toSnapshot(boolean[] values, long balancePenalty, Duration elapsed) {
        Map<String, List<String>> assignments = new LinkedHashMap<>();
        long covered = 0;
        for (Map.Entry<String, List<AssignmentVariable>> entry : bySlot.entrySet()) {
            List<String> names = new ArrayList<>();
            for (AssignmentVariable v : entry.getValue()) {
                if (values[v.getVar().getIndex()]) {
                    names.add(v.getStaff().getName());
                }
            }
            covered += names.size();
            assignments.put(entry.getKey(), names);
        }
        double ratio = coverageUpperBound > 0 ? (double) covered / coverageUpperBound : 0.0;
        return new SolutionSnapshot(assignments, covered, balancePenalty, ratio, elapsed);
    }

    public List<AssignmentVariable> eligibleFor(String slotId) {
        return Collections.unmodifiableList(bySlot.getOrDefault(slotId, List.of()));
    }

    public boolean isHardGap(Slot slot) {
        return hardGaps.contains(slot);
    }

    public SchedulingProblem getProblem() { return problem; }

    public ConstraintSolver getSolver() { return solver; }

    public List<AssignmentVariable> getVariables() { return variables; }

    /** Slots no staff member is eligible for. */
    public List<Slot> getHardGaps() { return hardGaps; }

    /** {@code sum(min(required, eligible))} over all slots. */
    public long getCoverageUpperBound() { return coverageUpperBound; }

    public int getPrunedPairs() { return prunedPairs; }

    /** Number of emitted constraints per family (coverage, daily cap, ...). */
    public Map<String, Integer> getConstraintCounts() { return constraintCounts; }
}
