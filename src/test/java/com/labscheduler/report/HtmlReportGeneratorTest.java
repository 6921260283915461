package com.labscheduler.report;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class HtmlReportGeneratorTest {

    @TempDir
    Path dir;

    @Test
    void rendersTablesAndWeeklyGrids() {
        String html = HtmlReportGenerator.render(ReportFixtures.report(), ReportFixtures.PROBLEM);

        assertThat(html).startsWith("<!DOCTYPE html>");
        assertThat(html).contains("<h3>Alice</h3>", "Lab 1, Room B", "Under-covered slots", "Caps or conflicts");
        assertThat(html).contains("<td class=\"unavailable\">Unavailable</td>");
        assertThat(html).contains("No availability response");
    }

    @Test
    void escapesStaffNames() {
        String html = HtmlReportGenerator.render(ReportFixtures.report(), ReportFixtures.PROBLEM);

        assertThat(html).contains("Bob &lt;Jr&gt;").doesNotContain("<h3>Bob <Jr></h3>");
    }

    @Test
    void writesTheFile() throws IOException {
        Path file = dir.resolve("schedule.html");

        HtmlReportGenerator.generateReport(ReportFixtures.report(), ReportFixtures.PROBLEM, file);

        assertThat(Files.readString(file)).contains("<title>Lab Schedule</title>");
    }
}
