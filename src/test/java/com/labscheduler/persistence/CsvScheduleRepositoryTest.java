package com.labscheduler.persistence;

import com.labscheduler.availability.AvailabilityIndex;
import com.labscheduler.domain.RequirementSet;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.StaffMember;
import com.labscheduler.exception.ConfigurationException;
import com.labscheduler.exception.InputParseException;
import com.labscheduler.time.TimeRange;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvScheduleRepositoryTest {

    private final CsvScheduleRepository repository = new CsvScheduleRepository();

    @TempDir
    Path dir;

    @Test
    void readsStaffHours() {
        List<StaffMember> staff = repository.parseStaff(table("TA,Hired for\n Alice ,5\nBob,2.5\n"));

        assertThat(staff).extracting(StaffMember::getName).containsExactly("Alice", "Bob");
        assertThat(staff.get(1).getHoursHired()).isEqualByComparingTo(new BigDecimal("2.5"));
        assertThat(staff.get(1).getHiredMinutes()).isEqualTo(150);
    }

    @Test
    void acceptsAlternativeStaffHeaders() {
        List<StaffMember> staff = repository.parseStaff(table("name,HOURS\nAlice,4\n"));

        assertThat(staff).extracting(StaffMember::getName).containsExactly("Alice");
    }

    @Test
    void negativeHoursStopAFailFastLoad() {
        assertThatThrownBy(() -> repository.parseStaff(table("TA,Hired for\nAlice,5\nBob,-1\n")))
            .isInstanceOf(InputParseException.class)
            .satisfies(e -> {
                InputParseException error = (InputParseException) e;
                assertThat(error.getRow()).isEqualTo(3);
                assertThat(error.getColumn()).isEqualTo("Hired for");
                assertThat(error.getStaffName()).isEqualTo("Bob");
            });
    }

    @Test
    void collectingHandlerSkipsBadRows() {
        InputErrorHandler.Collecting errors = InputErrorHandler.collecting();
        CsvScheduleRepository lenient = new CsvScheduleRepository(errors);

        List<StaffMember> staff = lenient.parseStaff(table("TA,Hired for\nAlice,five\n,3\nBob,2\n"));

        assertThat(staff).extracting(StaffMember::getName).containsExactly("Bob");
        assertThat(errors.hasProblems()).isTrue();
        assertThat(errors.getProblems()).extracting(InputParseException::getRow).containsExactly(2, 3);
    }

    @Test
    void duplicateStaffIsAConfigurationError() {
        assertThatThrownBy(() -> repository.parseStaff(table("TA,Hired for\nAlice,5\nAlice,3\n")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Alice");
    }

    @Test
    void readsUnavailableDaysPerTimeColumn() {
        AvailabilityIndex index = repository.parseAvailability(table(
            "Timestamp,Name,Unavailable [8am to 9am],Unavailable [1-2pm]\n"
                + "t1,Alice,\"Monday, Wednesday\",Friday\n"
                + "t2,Bob,,\n"));

        assertThat(index.getRespondents()).containsExactly("Alice", "Bob");
        assertThat(index.unavailableRanges("Alice")).containsExactly(
            new TimeRange(DayOfWeek.MONDAY, 480, 540),
            new TimeRange(DayOfWeek.WEDNESDAY, 480, 540),
            new TimeRange(DayOfWeek.FRIDAY, 780, 840));
        assertThat(index.isAvailable("Bob", new TimeRange(DayOfWeek.MONDAY, 480, 540))).isTrue();
    }

    @Test
    void badTimeHeaderNamesTheColumn() {
        assertThatThrownBy(() -> repository.parseAvailability(table("Name,Unavailable [25:99 to 10am]\nAlice,Monday\n")))
            .isInstanceOf(InputParseException.class)
            .hasMessageContaining("25:99")
            .satisfies(e -> assertThat(((InputParseException) e).getColumn()).isEqualTo("Unavailable [25:99 to 10am]"));
    }

    @Test
    void unknownDayNamesStaffAndColumn() {
        InputErrorHandler.Collecting errors = InputErrorHandler.collecting();

        AvailabilityIndex index = new CsvScheduleRepository(errors).parseAvailability(
            table("Name,Unavailable [9am to 10am]\nAlice,\"Funday, Tuesday\"\n"));

        assertThat(errors.getProblems()).singleElement().satisfies(e -> {
            assertThat(e.getStaffName()).isEqualTo("Alice");
            assertThat(e.getColumn()).isEqualTo("Unavailable [9am to 10am]");
            assertThat(e.getRow()).isEqualTo(2);
            assertThat(e.getMessage()).contains("Funday");
        });
        assertThat(index.unavailableRanges("Alice")).containsExactly(new TimeRange(DayOfWeek.TUESDAY, 540, 600));
    }

    @Test
    void responsesNeedTimeColumns() {
        assertThatThrownBy(() -> repository.parseAvailability(table("Name,Email\nAlice,a@example.edu\n")))
            .isInstanceOf(InputParseException.class)
            .hasMessageContaining("No unavailability columns");
    }

    @Test
    void keepsTheFirstResponseOfAStaffMember() {
        AvailabilityIndex index = repository.parseAvailability(table(
            "Name,Unavailable [9am to 10am]\nAlice,Monday\nAlice,Tuesday\n"));

        assertThat(index.unavailableRanges("Alice")).containsExactly(new TimeRange(DayOfWeek.MONDAY, 540, 600));
    }

    @Test
    void readsRequirementsWithBareHoursAndLabels() {
        RequirementSet set = repository.parseRequirements(table(
            "Day,Start,End,Required,Lab Section\n"
                + "Monday,11,13,2,Lab 1\n"
                + "tue,9:30,10:45,1,\n"));

        assertThat(set.getSlots()).extracting(Slot::getId).containsExactly("R2", "R3");
        Slot first = set.getSlots().get(0);
        assertThat(first.getDay()).isEqualTo(DayOfWeek.MONDAY);
        assertThat(first.getStartMinute()).isEqualTo(660);
        assertThat(first.getEndMinute()).isEqualTo(780);
        assertThat(first.getRequired()).isEqualTo(2);
        assertThat(first.getLabel()).isEqualTo("Lab 1");
        assertThat(set.getSlots().get(1).getLabel()).isNull();
        assertThat(set.getSlots().get(1).getDurationMinutes()).isEqualTo(75);
    }

    @Test
    void requirementOfZeroIsAConfigurationError() {
        assertThatThrownBy(() -> repository.parseRequirements(table("Day,Start,End,Required\nMonday,9,10,0\n")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("row 2");
    }

    @Test
    void slotEndingBeforeItStartsIsAConfigurationError() {
        assertThatThrownBy(() -> repository.parseRequirements(table("Day,Start,End,Required\nMonday,14,13,1\n")))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("not after");
    }

    @Test
    void badRequirementCellNamesItsColumn() {
        assertThatThrownBy(() -> repository.parseRequirements(table("Day,Start,End,Required\nMonday,9,10,two\n")))
            .isInstanceOf(InputParseException.class)
            .satisfies(e -> {
                InputParseException error = (InputParseException) e;
                assertThat(error.getColumn()).isEqualTo("Required");
                assertThat(error.getRow()).isEqualTo(2);
                assertThat(error.getSource()).isEqualTo("test.csv");
            });
    }

    @Test
    void requirementsWithoutRowsAreEmpty() {
        assertThatThrownBy(() -> repository.parseRequirements(table("Day,Start,End,Required\n")))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void loadsAllThreeFilesFromADirectory() throws IOException {
        Files.writeString(dir.resolve(CsvScheduleRepository.STAFF_FILE), "TA,Hired for\nAlice,5\nBob,3\n");
        Files.writeString(dir.resolve(CsvScheduleRepository.RESPONSES_FILE),
            "Name,Unavailable [9am to 10am]\nAlice,Monday\n");
        Files.writeString(dir.resolve(CsvScheduleRepository.REQUIREMENTS_FILE),
            "Day,Start,End,Required\nMonday,9,10,1\n");

        SchedulingProblem problem = repository.load(dir);

        assertThat(problem.getStaff()).hasSize(2);
        assertThat(problem.getUnscheduledStaff()).extracting(StaffMember::getName).containsExactly("Bob");
        assertThat(problem.getSlots()).hasSize(1);
    }

    @Test
    void missingInputFileIsAConfigurationError() {
        assertThatThrownBy(() -> repository.load(dir))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(CsvScheduleRepository.STAFF_FILE);
    }

    private static CsvTable table(String content) {
        return CsvTable.parse(content, "test.csv");
    }
}
