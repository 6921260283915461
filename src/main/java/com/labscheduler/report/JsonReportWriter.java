package com.labscheduler.report;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.CoverageGap;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.SlotCoverage;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.time.TimeLabels;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes an {@link AssignmentReport} as JSON.
 */
public class JsonReportWriter {

    private final ObjectMapper objectMapper;

    public JsonReportWriter() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .configure(JsonGenerator.Feature.WRITE_BIGDECIMAL_AS_PLAIN, true);
    }

    public void write(AssignmentReport report, Path output) throws IOException {
        objectMapper.writeValue(output.toFile(), toRecord(report));
    }

    public String toJson(AssignmentReport report) throws JsonProcessingException {
        return objectMapper.writeValueAsString(toRecord(report));
    }

    Map<String, Object> toRecord(AssignmentReport report) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("state", report.getState().name());
        root.put("provenOptimal", report.isProvenOptimal());
        root.put("coveredHeadcount", report.getSnapshot().getCoveredHeadcount());
        root.put("coverageUpperBound", report.getCoverageUpperBound());
        root.put("coverageRatio", report.getSnapshot().getCoverageRatio());
        root.put("balancePenalty", report.getSnapshot().getBalancePenalty());
        root.put("elapsed", report.getSnapshot().getElapsed());
        root.put("totalRequired", report.getTotalRequired());

        List<Map<String, Object>> slots = new ArrayList<>();
        for (SlotCoverage row : report.getSlotCoverage()) {
            Map<String, Object> record = slotRecord(row.getSlot());
            record.put("assigned", row.getAssignedStaff());
            record.put("required", row.getRequired());
            record.put("shortfall", row.getShortfall());
            record.put("hardGap", row.isHardGap());
            slots.add(record);
        }
        root.put("slots", slots);

        List<Map<String, Object>> staff = new ArrayList<>();
        for (StaffSummary s : report.getStaffSummaries()) {
            Map<String, Object> record = new LinkedHashMap<>();
            record.put("name", s.getName());
            record.put("hoursAssigned", s.getHoursAssigned());
            record.put("hoursHired", s.getHoursHired());
            record.put("remainingHours", s.getRemainingHours());
            record.put("slotCount", s.getSlotCount());
            record.put("labCount", s.getLabCount());
            record.put("labCap", s.getLabCap());
            Map<String, Object> daily = new LinkedHashMap<>();
            s.getDailyMinutes().forEach((day, minutes) -> daily.put(TimeLabels.formatDay(day), TimeLabels.toHours(minutes)));
            record.put("dailyHours", daily);
            record.put("assignedSlots", s.getAssignedSlots());
            record.put("hasResponse", s.hasResponse());
            staff.add(record);
        }
        root.put("staff", staff);

        List<Map<String, Object>> gaps = new ArrayList<>();
        for (CoverageGap gap : report.getGaps()) {
            Map<String, Object> record = slotRecord(gap.getSlot());
            record.put("assigned", gap.getAssigned());
            record.put("shortfall", gap.getShortfall());
            record.put("hardGap", gap.isHardGap());
            gaps.add(record);
        }
        root.put("gaps", gaps);
        root.put("unscheduledStaff", report.getUnscheduledStaff());
        return root;
    }

    private static Map<String, Object> slotRecord(Slot slot) {
        Map<String, Object> record = new LinkedHashMap<>();
        record.put("id", slot.getId());
        if (slot.getLabel() != null) {
            record.put("label", slot.getLabel());
        }
        record.put("day", TimeLabels.formatDay(slot.getDay()));
        record.put("start", TimeLabels.format(slot.getStartMinute()));
        record.put("end", TimeLabels.format(slot.getEndMinute()));
        return record;
    }
}
