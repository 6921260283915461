package com.labscheduler.report;

import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.SlotCoverage;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.time.TimeLabels;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes the slot summary and staff summary tables as CSV.
 */
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    public static final String SLOT_SUMMARY_FILE = "slot_summary.csv";
    public static final String STAFF_SUMMARY_FILE = "ta_summary.csv";

    static final List<String> SLOT_HEADER = List.of("Lab Section", "Day", "Start Time", "End Time",
        "Duration (hours)", "TAs Assigned", "Assigned Count", "Required Count", "Needed");
    static final List<String> STAFF_HEADER = List.of("TA Name", "Hours Assigned", "Remaining hours",
        "Hours Hired For", "Daily Breakdown", "Labs Assigned");

    /**
     * Writes both files into {@code directory}.
     */
    public void write(AssignmentReport report, Path directory) throws IOException {
        Files.createDirectories(directory);
        writeSlotSummary(report, directory.resolve(SLOT_SUMMARY_FILE));
        writeStaffSummary(report, directory.resolve(STAFF_SUMMARY_FILE));
    }

    public void writeSlotSummary(AssignmentReport report, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRow(out, SLOT_HEADER);
            for (SlotCoverage row : report.getSlotCoverage()) {
                Slot slot = row.getSlot();
                writeRow(out, List.of(
                    slot.getLabel() != null ? slot.getLabel() : "",
                    TimeLabels.formatDay(slot.getDay()),
                    TimeLabels.format(slot.getStartMinute()),
                    TimeLabels.format(slot.getEndMinute()),
                    TimeLabels.toHours(slot.getDurationMinutes()).toPlainString(),
                    String.join(", ", row.getAssignedStaff()),
                    String.valueOf(row.getAssignedCount()),
                    String.valueOf(row.getRequired()),
                    String.valueOf(row.getShortfall())));
            }
        }
        log.info("Wrote {} slot rows to {}", report.getSlotCoverage().size(), file);
    }

    public void writeStaffSummary(AssignmentReport report, Path file) throws IOException {
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            writeRow(out, STAFF_HEADER);
            for (StaffSummary staff : report.getStaffSummaries()) {
                writeRow(out, List.of(
                    staff.getName(),
                    staff.getHoursAssigned().toPlainString(),
                    staff.getRemainingHours().toPlainString(),
                    staff.getHoursHired().stripTrailingZeros().toPlainString(),
                    staff.getDailyBreakdown(),
                    staff.getAssignedSlots().isEmpty() ? "None" : String.join(", ", staff.getAssignedSlots())));
            }
        }
        log.info("Wrote {} staff rows to {}", report.getStaffSummaries().size(), file);
    }

    private static void writeRow(BufferedWriter out, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) out.write(',');
            out.write(quote(cells.get(i)));
        }
        out.write('\n');
    }

    static String quote(String cell) {
        if (cell.contains(",") || cell.contains("\"") || cell.contains("\n")) {
            return '"' + cell.replace("\"", "\"\"") + '"';
        }
        return cell;
    }
}
