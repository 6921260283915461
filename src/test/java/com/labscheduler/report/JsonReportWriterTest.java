package com.labscheduler.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

class JsonReportWriterTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @TempDir
    Path dir;

    @Test
    void exportsRunSummaryAndRows() throws IOException {
        JsonNode root = mapper.readTree(new JsonReportWriter().toJson(ReportFixtures.report()));

        assertThat(root.get("state").asText()).isEqualTo("FEASIBLE");
        assertThat(root.get("provenOptimal").asBoolean()).isFalse();
        assertThat(root.get("coveredHeadcount").asLong()).isEqualTo(1);
        assertThat(root.get("coverageUpperBound").asLong()).isEqualTo(2);
        assertThat(root.get("elapsed").asText()).isEqualTo("PT1.5S");
        assertThat(root.get("slots")).hasSize(2);
        assertThat(root.get("slots").get(0).get("assigned").get(0).asText()).isEqualTo("Alice");
        assertThat(root.get("gaps").get(0).get("shortfall").asInt()).isEqualTo(2);
        assertThat(root.get("unscheduledStaff").get(0).asText()).isEqualTo("Carol");
    }

    @Test
    void hoursAreWrittenAsPlainNumbers() throws IOException {
        String json = new JsonReportWriter().toJson(ReportFixtures.report());

        assertThat(json).contains("\"hoursAssigned\" : 1.5");
        assertThat(json).doesNotContain("E+");
    }

    @Test
    void writesToFile() throws IOException {
        Path file = dir.resolve("report.json");

        new JsonReportWriter().write(ReportFixtures.report(), file);

        assertThat(mapper.readTree(file.toFile()).get("staff")).hasSize(3);
    }
}
