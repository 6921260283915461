package com.labscheduler.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CsvReportWriterTest {

    @TempDir
    Path dir;

    @Test
    void writesSlotSummary() throws IOException {
        new CsvReportWriter().write(ReportFixtures.report(), dir);

        List<String> lines = Files.readAllLines(dir.resolve(CsvReportWriter.SLOT_SUMMARY_FILE));
        assertThat(lines).containsExactly(
            "Lab Section,Day,Start Time,End Time,Duration (hours),TAs Assigned,Assigned Count,Required Count,Needed",
            "\"Lab 1, Room B\",Monday,9:00,10:30,1.5,Alice,1,1,0",
            "Lab 2,Tuesday,10:00,11:00,1,,0,2,2");
    }

    @Test
    void writesStaffSummary() throws IOException {
        new CsvReportWriter().write(ReportFixtures.report(), dir);

        List<String> lines = Files.readAllLines(dir.resolve(CsvReportWriter.STAFF_SUMMARY_FILE));
        assertThat(lines).containsExactly(
            "TA Name,Hours Assigned,Remaining hours,Hours Hired For,Daily Breakdown,Labs Assigned",
            "Alice,1.5,2.5,4,Monday: 1.5h,\"Lab 1, Room B (Monday 9:00-10:30)\"",
            "Bob <Jr>,0,2,2,None,None",
            "Carol,0,3,3,None,None");
    }

    @Test
    void quotesOnlyWhenNeeded() {
        assertThat(CsvReportWriter.quote("plain")).isEqualTo("plain");
        assertThat(CsvReportWriter.quote("a,b")).isEqualTo("\"a,b\"");
        assertThat(CsvReportWriter.quote("say \"hi\"")).isEqualTo("\"say \"\"hi\"\"\"");
    }
}
