package com.labscheduler.domain;

import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SolutionSnapshotTest {

    @Test
    void looksUpAssignmentsBothWays() {
        Map<String, List<String>> assignments = new LinkedHashMap<>();
        assignments.put("R2", List.of("Alice", "Bob"));
        assignments.put("R3", List.of("Bob"));
        SolutionSnapshot snapshot = new SolutionSnapshot(assignments, 3, 0, 0.75, Duration.ofMillis(40));

        assertThat(snapshot.staffFor("R2")).containsExactly("Alice", "Bob");
        assertThat(snapshot.staffFor("R9")).isEmpty();
        assertThat(snapshot.slotsOf("Bob")).containsExactly("R2", "R3");
        assertThat(snapshot.toAssignments()).containsExactly(
            new Assignment("Alice", "R2"), new Assignment("Bob", "R2"), new Assignment("Bob", "R3"));
    }

    @Test
    void emptySnapshotListsEverySlot() {
        SolutionSnapshot snapshot = SolutionSnapshot.empty(
            List.of(new Slot("R2", DayOfWeek.MONDAY, 540, 600, 1), new Slot("R3", DayOfWeek.MONDAY, 600, 660, 2)),
            null);

        assertThat(snapshot.getAssignments()).containsOnlyKeys("R2", "R3");
        assertThat(snapshot.getCoveredHeadcount()).isZero();
        assertThat(snapshot.getElapsed()).isEqualTo(Duration.ZERO);
    }

    @Test
    void coverageRowsReportShortfall() {
        Slot slot = new Slot("R2", DayOfWeek.MONDAY, 540, 600, 3);
        SlotCoverage coverage = new SlotCoverage(slot, List.of("Alice"), false);
        CoverageGap gap = new CoverageGap(slot, 1, false);

        assertThat(coverage.getShortfall()).isEqualTo(2);
        assertThat(coverage.isFullyCovered()).isFalse();
        assertThat(coverage.getFillRatio()).isEqualTo(1.0 / 3);
        assertThat(gap.getShortfall()).isEqualTo(2);
    }
}
