package com.labscheduler.engine;

import com.labscheduler.config.SchedulerSettings;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.SlotCoverage;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.model.AssignmentModel;
import com.labscheduler.model.AssignmentModelBuilder;
import com.labscheduler.solver.RecordingSolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static com.labscheduler.TestProblems.problem;
import static com.labscheduler.TestProblems.slot;
import static com.labscheduler.TestProblems.staff;
import static java.time.DayOfWeek.MONDAY;
import static java.time.DayOfWeek.TUESDAY;
import static java.time.DayOfWeek.WEDNESDAY;
import static org.assertj.core.api.Assertions.assertThat;

class ResultExtractorTest {

    private final SchedulerSettings settings = SchedulerSettings.defaults();

    private AssignmentReport report;

    @BeforeEach
    void extract() {
        SchedulingProblem problem = problem(
            List.of(staff("Alice", 5), staff("Bob", 3), staff("Carol", 4)),
            List.of("Alice", "Bob"),
            List.of(),
            List.of(slot("R2", MONDAY, "9:00", "10:00", 2, "Lab A"),
                slot("R3", TUESDAY, "13:00", "14:30", 1, "Lab A"),
                slot("R4", WEDNESDAY, "9:00", "10:00", 1, "Lab B")));
        AssignmentModel model = new AssignmentModelBuilder(settings).build(problem, new RecordingSolver());

        // Alice: R2, R3, R4 then Bob: R2, R3, R4
        boolean[] values = {true, true, false, true, false, false};
        report = new ResultExtractor(settings).extract(problem, model,
            model.toSnapshot(values, 0, Duration.ofMillis(12)), RunState.FEASIBLE, false);
    }

    @Test
    void coverageRowsFollowSlotOrder() {
        assertThat(report.getSlotCoverage()).extracting(SlotCoverage::getShortfall).containsExactly(0, 0, 1);
        assertThat(report.getSlotCoverage().get(0).getAssignedStaff()).containsExactly("Alice", "Bob");
        assertThat(report.getTotalRequired()).isEqualTo(4);
        assertThat(report.getTotalAssigned()).isEqualTo(3);
        assertThat(report.getFullyCoveredCount()).isEqualTo(2);
        assertThat(report.getCoverageUpperBound()).isEqualTo(4);
    }

    @Test
    void gapsListUnderCoveredSlots() {
        assertThat(report.getGaps()).singleElement().satisfies(gap -> {
            assertThat(gap.getSlot().getId()).isEqualTo("R4");
            assertThat(gap.getShortfall()).isEqualTo(1);
            assertThat(gap.isHardGap()).isFalse();
        });
    }

    @Test
    void staffSummariesCountMinutesDaysAndLabs() {
        StaffSummary alice = summary("Alice");

        assertThat(alice.getMinutesAssigned()).isEqualTo(150);
        assertThat(alice.getHoursAssigned()).isEqualByComparingTo(new BigDecimal("2.5"));
        assertThat(alice.getRemainingHours()).isEqualByComparingTo(new BigDecimal("2.5"));
        assertThat(alice.getSlotCount()).isEqualTo(2);
        assertThat(alice.getLabCount()).isEqualTo(1);
        assertThat(alice.getLabCap()).isEqualTo(3);
        assertThat(alice.getDailyBreakdown()).isEqualTo("Monday: 1h, Tuesday: 1.5h");
        assertThat(alice.getAssignedSlots()).containsExactly("Lab A (Monday 9:00-10:00)", "Lab A (Tuesday 13:00-14:30)");
    }

    @Test
    void staffWithoutResponseIsListedAsUnscheduled() {
        StaffSummary carol = summary("Carol");

        assertThat(carol.hasResponse()).isFalse();
        assertThat(carol.getMinutesAssigned()).isZero();
        assertThat(carol.getDailyBreakdown()).isEqualTo("None");
        assertThat(report.getUnscheduledStaff()).containsExactly("Carol");
    }

    private StaffSummary summary(String name) {
        return report.getStaffSummaries().stream()
            .filter(s -> s.getName().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
