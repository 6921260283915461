package com.labscheduler.model;

import com.labscheduler.availability.AvailabilityIndex;
import com.labscheduler.config.SchedulerSettings;
import com.labscheduler.config.SecondaryObjective;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.StaffMember;
import com.labscheduler.exception.ConfigurationException;
import com.labscheduler.solver.BoolVar;
import com.labscheduler.solver.ConstraintSolver;
import com.labscheduler.solver.LinearExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates a {@link SchedulingProblem} into a 0/1 model on a {@link ConstraintSolver}.
 *
 * Variables: one x per (staff, slot) pair where the staff member responded, is available,
 * and the slot fits both the daily cap and the hired hours. Other pairs are pruned.
 *
 * Constraints, each emitted only when it can bind:
 * - coverage: assigned staff per slot <= required
 * - daily cap: assigned minutes per staff and day <= cap
 * - total cap: assigned minutes per staff <= hired minutes
 * - lab cap: distinct labs per staff <= maxLabsPerStaff (indicator y per multi-slot lab)
 * - no double booking: x1 + x2 <= 1 for overlapping slots of a staff member
 *
 * Objective: maximize covered headcount, optional balance tie-breaker.
 */
public class AssignmentModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(AssignmentModelBuilder.class);

    static final String COVERAGE = "coverage";
    static final String DAILY_CAP = "daily cap";
    static final String TOTAL_CAP = "total cap";
    static final String LAB_CAP = "lab cap";
    static final String LAB_LINK = "lab link";
    static final String NO_OVERLAP = "no overlap";

    private final SchedulerSettings settings;

    public AssignmentModelBuilder(SchedulerSettings settings) {
        this.settings = settings;
    }

    /**
     * @param solver a fresh solver; the model is added to it
     * @throws ConfigurationException when no staff member can be scheduled or the daily
     *         cap is shorter than every slot
     */
    public AssignmentModel build(SchedulingProblem problem, ConstraintSolver solver) {
        List<StaffMember> schedulable = problem.getSchedulableStaff();
        if (schedulable.isEmpty()) {
            throw new ConfigurationException("None of the " + problem.getStaff().size()
                + " staff members has an availability response");
        }
        int shortest = problem.getRequirements().getShortestDurationMinutes();
        if (settings.getDailyCapMinutes() < shortest) {
            throw new ConfigurationException("Daily hour cap of " + settings.getDailyCapMinutes()
                + " minutes is shorter than every slot (shortest is " + shortest + " minutes)");
        }
        if (!problem.getUnscheduledStaff().isEmpty()) {
            log.warn("No availability response for {}: they will not be scheduled",
                problem.getUnscheduledStaff().stream().map(StaffMember::getName).toList());
        }

        AvailabilityIndex availability = problem.getAvailability();
        List<Slot> slots = problem.getSlots();
        Map<String, Integer> counts = new LinkedHashMap<>();
        List<AssignmentVariable> variables = new ArrayList<>();
        Map<String, List<AssignmentVariable>> bySlot = new LinkedHashMap<>();
        slots.forEach(s -> bySlot.put(s.getId(), new ArrayList<>()));
        int pruned = (problem.getStaff().size() - schedulable.size()) * slots.size();
        int indicators = 0;

        for (StaffMember staff : schedulable) {
            // Eligible slots of this staff member, grouped by lab in slot order
            Map<String, List<Slot>> groups = new LinkedHashMap<>();
            for (Slot slot : slots) {
                if (isEligible(staff, slot, availability)) {
                    groups.computeIfAbsent(slot.getGroupKey(), k -> new ArrayList<>()).add(slot);
                } else {
                    pruned++;
                }
            }
            if (groups.isEmpty()) {
                continue;
            }

            boolean labCapBinds = groups.size() > settings.getMaxLabsPerStaff();
            LinearExpression labCount = new LinearExpression();
            List<AssignmentVariable> staffVars = new ArrayList<>();

            for (Map.Entry<String, List<Slot>> group : groups.entrySet()) {
                BoolVar indicator = null;
                if (labCapBinds && group.getValue().size() > 1) {
                    // Created before its slots so the search opens the lab before filling it
                    indicator = solver.addBoolVar("y[" + staff.getName() + "|" + group.getKey() + "]", true);
                    indicators++;
                    labCount.add(indicator);
                }
                for (Slot slot : group.getValue()) {
                    BoolVar x = solver.addBoolVar("x[" + staff.getName() + "|" + slot.getId() + "]", true);
                    AssignmentVariable av = new AssignmentVariable(staff, slot, x);
                    staffVars.add(av);
                    if (labCapBinds && indicator == null) {
                        labCount.add(x);
                    } else if (indicator != null) {
                        solver.addLinearConstraint("link[" + staff.getName() + "|" + slot.getId() + "]",
                            new LinearExpression().add(x, 1).add(indicator, -1), 0);
                        counts.merge(LAB_LINK, 1, Integer::sum);
                    }
                }
            }

            if (labCapBinds) {
                solver.addLinearConstraint("labs[" + staff.getName() + "]", labCount, settings.getMaxLabsPerStaff());
                counts.merge(LAB_CAP, 1, Integer::sum);
            }
            addWorkloadConstraints(solver, staff, staffVars, counts);
            addOverlapConstraints(solver, staff, staffVars, counts);

            for (AssignmentVariable av : staffVars) {
                variables.add(av);
                bySlot.get(av.getSlot().getId()).add(av);
            }
        }

        long upperBound = 0;
        List<Slot> hardGaps = new ArrayList<>();
        for (Slot slot : slots) {
            List<AssignmentVariable> eligible = bySlot.get(slot.getId());
            if (eligible.isEmpty()) {
                hardGaps.add(slot);
                continue;
            }
            upperBound += Math.min(slot.getRequired(), eligible.size());
            if (eligible.size() > slot.getRequired()) {
                solver.addLinearConstraint("coverage[" + slot.getId() + "]",
                    LinearExpression.sum(eligible.stream().map(AssignmentVariable::getVar).toList()),
                    slot.getRequired());
                counts.merge(COVERAGE, 1, Integer::sum);
            }
        }

        solver.setObjective(LinearExpression.sum(variables.stream().map(AssignmentVariable::getVar).toList()));
        solver.setObjectiveUpperBound(upperBound);
        if (settings.getSecondaryObjective() != SecondaryObjective.NONE) {
            solver.setBalanceObjective(balanceGroups(variables));
        }
        solver.setRandomSeed(settings.getRandomSeed());
        solver.setUnimprovedTimeLimit(settings.getUnimprovedTimeLimit());

        if (!hardGaps.isEmpty()) {
            log.warn("{} slot(s) have no eligible staff: {}", hardGaps.size(),
                hardGaps.stream().map(s -> s.getDisplayName() + " " + s.getRange()).toList());
        }
        log.info("Model: {} assignment variables, {} lab indicators, {} pairs pruned, constraints {}, coverage bound {}",
            variables.size(), indicators, pruned, counts, upperBound);

        return new AssignmentModel(problem, solver, variables, hardGaps, upperBound, pruned, counts);
    }

    boolean isEligible(StaffMember staff, Slot slot, AvailabilityIndex availability) {
        int duration = slot.getDurationMinutes();
        return availability.hasResponse(staff.getName())
            && availability.isAvailable(staff.getName(), slot)
            && duration <= settings.getDailyCapMinutes()
            && duration <= staff.getHiredMinutes();
    }

    private void addWorkloadConstraints(ConstraintSolver solver, StaffMember staff,
                                        List<AssignmentVariable> staffVars, Map<String, Integer> counts) {
        Map<DayOfWeek, List<AssignmentVariable>> byDay = new EnumMap<>(DayOfWeek.class);
        long totalMinutes = 0;
        for (AssignmentVariable av : staffVars) {
            byDay.computeIfAbsent(av.getSlot().getDay(), d -> new ArrayList<>()).add(av);
            totalMinutes += av.getSlot().getDurationMinutes();
        }

        for (Map.Entry<DayOfWeek, List<AssignmentVariable>> day : byDay.entrySet()) {
            long dayMinutes = day.getValue().stream().mapToLong(av -> av.getSlot().getDurationMinutes()).sum();
            if (dayMinutes > settings.getDailyCapMinutes()) {
                solver.addLinearConstraint("daily[" + staff.getName() + "|" + day.getKey() + "]",
                    minutesOf(day.getValue()), settings.getDailyCapMinutes());
                counts.merge(DAILY_CAP, 1, Integer::sum);
            }
        }

        if (totalMinutes > staff.getHiredMinutes()) {
            solver.addLinearConstraint("total[" + staff.getName() + "]", minutesOf(staffVars), staff.getHiredMinutes());
            counts.merge(TOTAL_CAP, 1, Integer::sum);
        }
    }

    private void addOverlapConstraints(ConstraintSolver solver, StaffMember staff,
                                       List<AssignmentVariable> staffVars, Map<String, Integer> counts) {
        for (int i = 0; i < staffVars.size(); i++) {
            AssignmentVariable a = staffVars.get(i);
            for (int j = i + 1; j < staffVars.size(); j++) {
                AssignmentVariable b = staffVars.get(j);
                if (a.getSlot().overlaps(b.getSlot())) {
                    solver.addLinearConstraint(
                        "overlap[" + staff.getName() + "|" + a.getSlot().getId() + "|" + b.getSlot().getId() + "]",
                        new LinearExpression().add(a.getVar()).add(b.getVar()), 1);
                    counts.merge(NO_OVERLAP, 1, Integer::sum);
                }
            }
        }
    }

    private List<LinearExpression> balanceGroups(List<AssignmentVariable> variables) {
        Map<StaffMember, LinearExpression> groups = new LinkedHashMap<>();
        if (settings.getSecondaryObjective() == SecondaryObjective.BALANCE_HOURS) {
            long unit = 0;
            for (AssignmentVariable av : variables) {
                unit = gcd(unit, av.getSlot().getDurationMinutes());
            }
            // Durations in units of their gcd keep the squared totals small
            long step = Math.max(1, unit);
            for (AssignmentVariable av : variables) {
                groups.computeIfAbsent(av.getStaff(), s -> new LinearExpression())
                    .add(av.getVar(), av.getSlot().getDurationMinutes() / step);
            }
        } else {
            for (AssignmentVariable av : variables) {
                long perMille = Math.round(av.getSlot().getDurationMinutes() * 1000.0 / av.getStaff().getHiredMinutes());
                groups.computeIfAbsent(av.getStaff(), s -> new LinearExpression())
                    .add(av.getVar(), Math.max(1, perMille));
            }
        }
        return new ArrayList<>(groups.values());
    }

    private static LinearExpression minutesOf(List<AssignmentVariable> vars) {
        LinearExpression expr = new LinearExpression();
        vars.forEach(av -> expr.add(av.getVar(), av.getSlot().getDurationMinutes()));
        return expr;
    }

    private static long gcd(long a, long b) {
        while (b != 0) {
            long t = a % b;
            a = b;
            b = t;
        }
        return a;
    }
}
