package com.labscheduler.availability;

import com.labscheduler.domain.Slot;
import com.labscheduler.domain.UnavailabilityInterval;
import com.labscheduler.time.TimeRange;
import org.junit.jupiter.api.Test;

import java.time.DayOfWeek;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AvailabilityIndexTest {

    private final AvailabilityIndex index = AvailabilityIndex.of(
        List.of("Alice", "Bob"),
        List.of(
            new UnavailabilityInterval("Alice", DayOfWeek.MONDAY, 600, 660),
            new UnavailabilityInterval("Alice", DayOfWeek.MONDAY, 540, 600),
            new UnavailabilityInterval("Carol", DayOfWeek.FRIDAY, 480, 540)));

    @Test
    void slotOverlappingAnUnavailablePeriodIsBlocked() {
        assertThat(index.isAvailable("Alice", new Slot("s1", DayOfWeek.MONDAY, 570, 630, 1))).isFalse();
        assertThat(index.isAvailable("Alice", new TimeRange(DayOfWeek.MONDAY, 659, 720))).isFalse();
    }

    @Test
    void touchingOrOtherDaySlotsStayAvailable() {
        assertThat(index.isAvailable("Alice", new TimeRange(DayOfWeek.MONDAY, 660, 720))).isTrue();
        assertThat(index.isAvailable("Alice", new TimeRange(DayOfWeek.MONDAY, 480, 540))).isTrue();
        assertThat(index.isAvailable("Alice", new TimeRange(DayOfWeek.TUESDAY, 540, 600))).isTrue();
    }

    @Test
    void respondentWithoutIntervalsIsAlwaysAvailable() {
        assertThat(index.hasResponse("Bob")).isTrue();
        assertThat(index.isAvailable("Bob", new TimeRange(DayOfWeek.MONDAY, 540, 600))).isTrue();
        assertThat(index.unavailableRanges("Bob")).isEmpty();
    }

    @Test
    void intervalOwnerCountsAsRespondent() {
        assertThat(index.hasResponse("Carol")).isTrue();
        assertThat(index.getRespondents()).containsExactly("Alice", "Bob", "Carol");
    }

    @Test
    void unknownStaffHasNoResponse() {
        assertThat(index.hasResponse("Dave")).isFalse();
        assertThat(index.isAvailable("Dave", new TimeRange(DayOfWeek.MONDAY, 540, 600))).isTrue();
    }

    @Test
    void unavailableRangesAreSorted() {
        assertThat(index.unavailableRanges("Alice"))
            .extracting(TimeRange::getStartMinute)
            .containsExactly(540, 600);
        assertThat(index.getIntervalCount()).isEqualTo(3);
    }
}
