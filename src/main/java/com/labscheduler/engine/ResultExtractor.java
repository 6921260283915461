package com.labscheduler.engine;

import com.labscheduler.config.SchedulerSettings;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.CoverageGap;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.SlotCoverage;
import com.labscheduler.domain.SolutionSnapshot;
import com.labscheduler.domain.StaffMember;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.model.AssignmentModel;

import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a {@link SolutionSnapshot} into an {@link AssignmentReport}.
 */
public class ResultExtractor {

    private final SchedulerSettings settings;

    public ResultExtractor(SchedulerSettings settings) {
        this.settings = settings;
    }

    public AssignmentReport extract(SchedulingProblem problem, AssignmentModel model, SolutionSnapshot snapshot,
                                    RunState state, boolean provenOptimal) {
        List<SlotCoverage> coverage = new ArrayList<>();
        List<CoverageGap> gaps = new ArrayList<>();
        Map<String, List<Slot>> slotsByStaff = new HashMap<>();

        for (Slot slot : problem.getSlots()) {
            List<String> assigned = snapshot.staffFor(slot.getId());
            boolean hardGap = model.isHardGap(slot);
            SlotCoverage row = new SlotCoverage(slot, assigned, hardGap);
            coverage.add(row);
            if (row.getShortfall() > 0) {
                gaps.add(new CoverageGap(slot, assigned.size(), hardGap));
            }
            for (String name : assigned) {
                slotsByStaff.computeIfAbsent(name, n -> new ArrayList<>()).add(slot);
            }
        }

        List<StaffSummary> summaries = new ArrayList<>();
        for (StaffMember staff : problem.getStaff()) {
            summaries.add(summarize(staff, slotsByStaff.getOrDefault(staff.getName(), List.of()),
                problem.getAvailability().hasResponse(staff.getName())));
        }

        List<String> unscheduled = problem.getUnscheduledStaff().stream().map(StaffMember::getName).toList();
        return new AssignmentReport(state, provenOptimal, model.getCoverageUpperBound(), snapshot,
            coverage, summaries, gaps, unscheduled);
    }

    private StaffSummary summarize(StaffMember staff, List<Slot> slots, boolean hasResponse) {
        long minutes = 0;
        Map<DayOfWeek, Integer> daily = new EnumMap<>(DayOfWeek.class);
        Set<String> labs = new LinkedHashSet<>();
        List<String> descriptions = new ArrayList<>();
        for (Slot slot : slots) {
            minutes += slot.getDurationMinutes();
            daily.merge(slot.getDay(), slot.getDurationMinutes(), Integer::sum);
            labs.add(slot.getGroupKey());
            descriptions.add(slot.getDisplayName() + " (" + slot.getRange() + ")");
        }
        return new StaffSummary(staff.getName(), minutes, staff.getHoursHired(), slots.size(), labs.size(),
            settings.getMaxLabsPerStaff(), daily, descriptions, hasResponse);
    }
}
