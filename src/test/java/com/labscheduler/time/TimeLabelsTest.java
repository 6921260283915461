package com.labscheduler.time;

import com.labscheduler.exception.InputParseException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigDecimal;
import java.time.DayOfWeek;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimeLabelsTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "9:00|540",
        "13:30|810",
        "9am|540",
        "12am|0",
        "12pm|720",
        "9:30 PM|1290",
        "12 a.m.|0",
        "24:00|1440",
        "0:00|0",
    })
    void parsesTimeLabels(String label, int minutes) {
        assertThat(TimeLabels.toMinutes(label)).isEqualTo(minutes);
    }

    @ParameterizedTest
    @ValueSource(strings = {"9", "25:00", "9:75", "13pm", "0am", "abc", "24:30", " "})
    void rejectsMalformedTimeLabels(String label) {
        assertThatThrownBy(() -> TimeLabels.toMinutes(label)).isInstanceOf(InputParseException.class);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "1am to 2am|60|120",
        "9:00-10:30|540|630",
        "1-2pm|780|840",
        "11-12pm|660|720",
        "11pm to 12am|1380|1440",
        "10am - 11:30am|600|690",
    })
    void parsesRanges(String label, int start, int end) {
        assertThat(TimeLabels.parseRange(label)).containsExactly(start, end);
    }

    @Test
    void rangeWithBadTimeNamesTheLabel() {
        assertThatThrownBy(() -> TimeLabels.parseRange("25:99 to 10am"))
            .isInstanceOf(InputParseException.class)
            .hasMessageContaining("25:99");
    }

    @Test
    void rangeMustEndAfterItStarts() {
        assertThatThrownBy(() -> TimeLabels.parseRange("3pm to 1pm"))
            .isInstanceOf(InputParseException.class)
            .hasMessageContaining("3pm to 1pm");
    }

    @Test
    void rangeWithoutSeparatorIsRejected() {
        assertThatThrownBy(() -> TimeLabels.parseRange("9am"))
            .isInstanceOf(InputParseException.class);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "11|660",
        "13.5|810",
        "9:30|570",
        "1pm|780",
        "24|1440",
    })
    void requirementCellsAcceptBareHours(String cell, int minutes) {
        assertThat(TimeLabels.hourCellToMinutes(cell)).isEqualTo(minutes);
    }

    @Test
    void requirementCellHourOutOfRange() {
        assertThatThrownBy(() -> TimeLabels.hourCellToMinutes("25"))
            .isInstanceOf(InputParseException.class);
    }

    @Test
    void parsesDayNamesAndAbbreviations() {
        assertThat(TimeLabels.parseDay("Monday")).isEqualTo(DayOfWeek.MONDAY);
        assertThat(TimeLabels.parseDay("mon")).isEqualTo(DayOfWeek.MONDAY);
        assertThat(TimeLabels.parseDay(" TUE ")).isEqualTo(DayOfWeek.TUESDAY);
        assertThat(TimeLabels.parseDay("Thurs")).isEqualTo(DayOfWeek.THURSDAY);
    }

    @Test
    void unknownDayIsNamedInTheError() {
        assertThatThrownBy(() -> TimeLabels.parseDay("Funday"))
            .isInstanceOf(InputParseException.class)
            .hasMessageContaining("Funday");
        assertThatThrownBy(() -> TimeLabels.parseDay("M"))
            .isInstanceOf(InputParseException.class);
    }

    @Test
    void formatsMinutesAndHours() {
        assertThat(TimeLabels.format(540)).isEqualTo("9:00");
        assertThat(TimeLabels.format(605)).isEqualTo("10:05");
        assertThat(TimeLabels.format(1440)).isEqualTo("24:00");
        assertThat(TimeLabels.formatDay(DayOfWeek.WEDNESDAY)).isEqualTo("Wednesday");
        assertThat(TimeLabels.toHours(90)).isEqualByComparingTo(new BigDecimal("1.5"));
        assertThat(TimeLabels.toHours(120)).isEqualByComparingTo(new BigDecimal("2"));
    }
}
