package com.labscheduler.report;

import com.labscheduler.availability.AvailabilityIndex;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.CoverageGap;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.SlotCoverage;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.engine.RunState;
import com.labscheduler.time.TimeLabels;
import com.labscheduler.time.TimeRange;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Generates an HTML dashboard of a scheduling run: summary banner, coverage and workload
 * tables, under-covered slots and a weekly grid per staff member.
 */
public class HtmlReportGenerator {

    private static final Set<DayOfWeek> WEEK_DAYS = EnumSet.range(DayOfWeek.MONDAY, DayOfWeek.FRIDAY);
    private static final int DEFAULT_FIRST_HOUR = 8;
    private static final int DEFAULT_LAST_HOUR = 18;

    /**
     * Write the dashboard to {@code outputPath} in UTF-8.
     */
    public static void generateReport(AssignmentReport report, SchedulingProblem problem, Path outputPath)
            throws IOException {
        try (Writer writer = new OutputStreamWriter(Files.newOutputStream(outputPath), StandardCharsets.UTF_8)) {
            writer.write(render(report, problem));
        }
    }

    public static String render(AssignmentReport report, SchedulingProblem problem) {
        StringBuilder html = new StringBuilder();

        html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n");
        html.append("<meta charset=\"UTF-8\">\n");
        html.append("<meta name=\"viewport\" content=\"width=device-width, initial-scale=1.0\">\n");
        html.append("<title>Lab Schedule</title>\n");
        html.append("<script src=\"https://cdn.jsdelivr.net/npm/chart.js\"></script>\n");
        html.append("<style>\n").append(getCSS()).append("\n</style>\n");
        html.append("</head>\n<body>\n");

        html.append("<header class=\"header\">\n");
        html.append("<h1>Lab Schedule</h1>\n");
        html.append("<p class=\"subtitle\">").append(problem.getStaff().size()).append(" staff members, ")
            .append(problem.getSlots().size()).append(" slots</p>\n");
        html.append("</header>\n");

        html.append(buildScoreBanner(report));

        html.append("<div class=\"section\">\n");
        html.append("<h2>Hours per staff member</h2>\n");
        html.append("<canvas id=\"hoursChart\" height=\"90\"></canvas>\n");
        html.append("</div>\n");

        html.append(buildCoverageTable(report));
        html.append(buildWorkloadTable(report));
        html.append(buildUncoveredSlots(report));
        html.append(buildWeeklyGrids(report, problem));
        html.append(buildLegend());
        html.append(buildChartScript(report));

        html.append("</body>\n</html>");
        return html.toString();
    }

    private static String buildScoreBanner(AssignmentReport report) {
        StringBuilder sb = new StringBuilder();

        String bannerClass = "good";
        if (report.getState() == RunState.INFEASIBLE) {
            bannerClass = "bad";
        } else if (!report.getGaps().isEmpty()) {
            bannerClass = "warning";
        }

        sb.append("<div class=\"score-banner ").append(bannerClass).append("\">\n");
        sb.append("<div class=\"score-main\">\n");
        sb.append("<span class=\"score-label\">Result</span>\n");
        sb.append("<span class=\"score-value\">").append(report.getState())
            .append(report.isProvenOptimal() ? " (proven)" : "").append("</span>\n");
        sb.append("</div>\n");
        sb.append("<div class=\"score-stats\">\n");
        appendStat(sb, report.getTotalAssigned() + "/" + report.getTotalRequired(), "Positions filled");
        appendStat(sb, String.valueOf(report.getFullyCoveredCount()), "Slots covered");
        appendStat(sb, String.valueOf(report.getGaps().size()), "Gaps");
        appendStat(sb, String.valueOf(report.getStaffSummaries().size()), "Staff");
        sb.append("</div>\n");
        sb.append("</div>\n");
        return sb.toString();
    }

    private static void appendStat(StringBuilder sb, String number, String label) {
        sb.append("<div class=\"stat-item\"><span class=\"stat-number\">").append(escapeHtml(number))
            .append("</span><span class=\"stat-label\">").append(label).append("</span></div>\n");
    }

    private static String buildCoverageTable(AssignmentReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"section\">\n<h2>Slot coverage</h2>\n");
        sb.append("<table class=\"workload-table\">\n<thead><tr>");
        sb.append("<th>Lab Section</th><th>Day</th><th>Time</th><th>Assigned</th><th class=\"num\">Filled</th><th class=\"num\">Needed</th>");
        sb.append("</tr></thead>\n<tbody>\n");
        for (SlotCoverage row : report.getSlotCoverage()) {
            Slot slot = row.getSlot();
            String rowClass = row.isFullyCovered() ? "" : row.getAssignedCount() == 0 ? " class=\"unfilled\"" : " class=\"partial\"";
            sb.append("<tr").append(rowClass).append(">");
            sb.append("<td class=\"staff-name\">").append(escapeHtml(slot.getDisplayName())).append("</td>");
            sb.append("<td>").append(TimeLabels.formatDay(slot.getDay())).append("</td>");
            sb.append("<td>").append(timeSpan(slot)).append("</td>");
            sb.append("<td>").append(escapeHtml(String.join(", ", row.getAssignedStaff()))).append("</td>");
            sb.append("<td class=\"num\">").append(row.getAssignedCount()).append("/").append(row.getRequired()).append("</td>");
            sb.append("<td class=\"num\">").append(row.getShortfall()).append("</td>");
            sb.append("</tr>\n");
        }
        sb.append("</tbody>\n</table>\n</div>\n");
        return sb.toString();
    }

    private static String buildWorkloadTable(AssignmentReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"section\">\n<h2>Staff workload</h2>\n");
        sb.append("<table class=\"workload-table\">\n<thead><tr>");
        sb.append("<th>Name</th><th class=\"num\">Hours</th><th class=\"num\">Hired</th><th class=\"num\">Remaining</th>");
        sb.append("<th class=\"num\">Labs</th><th>Daily breakdown</th>");
        sb.append("</tr></thead>\n<tbody>\n");
        for (StaffSummary staff : report.getStaffSummaries()) {
            sb.append("<tr>");
            sb.append("<td class=\"staff-name\">").append(escapeHtml(staff.getName()));
            if (!staff.hasResponse()) {
                sb.append(" <span class=\"badge\">no response</span>");
            }
            sb.append("</td>");
            sb.append("<td class=\"num total-cell\">").append(staff.getHoursAssigned().toPlainString()).append("</td>");
            sb.append("<td class=\"num\">").append(staff.getHoursHired().stripTrailingZeros().toPlainString()).append("</td>");
            sb.append("<td class=\"num\">").append(staff.getRemainingHours().toPlainString()).append("</td>");
            sb.append("<td class=\"num\">").append(staff.getLabCount()).append("/").append(staff.getLabCap()).append("</td>");
            sb.append("<td>").append(escapeHtml(staff.getDailyBreakdown())).append("</td>");
            sb.append("</tr>\n");
        }
        sb.append("</tbody>\n</table>\n</div>\n");
        return sb.toString();
    }

    private static String buildUncoveredSlots(AssignmentReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"section\">\n<h2>Under-covered slots</h2>\n");
        if (report.getGaps().isEmpty()) {
            sb.append("<p class=\"all-good\">Every slot is fully covered.</p>\n</div>\n");
            return sb.toString();
        }
        sb.append("<table class=\"workload-table\">\n<thead><tr>");
        sb.append("<th>Lab Section</th><th>Day</th><th>Time</th><th class=\"num\">Missing</th><th>Reason</th>");
        sb.append("</tr></thead>\n<tbody>\n");
        for (CoverageGap gap : report.getGaps()) {
            Slot slot = gap.getSlot();
            sb.append("<tr class=\"").append(gap.isHardGap() ? "unfilled" : "partial").append("\">");
            sb.append("<td>").append(escapeHtml(slot.getDisplayName())).append("</td>");
            sb.append("<td>").append(TimeLabels.formatDay(slot.getDay())).append("</td>");
            sb.append("<td>").append(timeSpan(slot)).append("</td>");
            sb.append("<td class=\"num\">").append(gap.getShortfall()).append("</td>");
            sb.append("<td>").append(gap.isHardGap() ? "No eligible staff" : "Caps or conflicts").append("</td>");
            sb.append("</tr>\n");
        }
        sb.append("</tbody>\n</table>\n</div>\n");
        return sb.toString();
    }

    /**
     * One Monday-Friday grid per staff member, one row per hour.
     */
    private static String buildWeeklyGrids(AssignmentReport report, SchedulingProblem problem) {
        int[] hours = hourWindow(problem);
        AvailabilityIndex availability = problem.getAvailability();
        Map<String, Slot> slotsById = problem.getSlots().stream()
            .collect(Collectors.toMap(Slot::getId, s -> s));

        StringBuilder sb = new StringBuilder();
        sb.append("<div class=\"section\">\n<h2>Weekly schedules</h2>\n");
        for (StaffSummary staff : report.getStaffSummaries()) {
            sb.append("<div class=\"staff-card\">\n<h3>").append(escapeHtml(staff.getName())).append("</h3>\n");
            if (!staff.hasResponse()) {
                sb.append("<p class=\"muted\">No availability response: not scheduled.</p>\n</div>\n");
                continue;
            }
            List<Slot> assigned = new ArrayList<>();
            for (String slotId : report.getSnapshot().slotsOf(staff.getName())) {
                assigned.add(slotsById.get(slotId));
            }

            sb.append("<table class=\"calendar-grid\">\n<thead><tr><th>Time</th>");
            for (DayOfWeek day : WEEK_DAYS) {
                sb.append("<th>").append(TimeLabels.formatDay(day)).append("</th>");
            }
            sb.append("</tr></thead>\n<tbody>\n");
            for (int hour = hours[0]; hour < hours[1]; hour++) {
                sb.append("<tr><td class=\"hour\">").append(TimeLabels.format(hour * 60)).append("</td>");
                for (DayOfWeek day : WEEK_DAYS) {
                    TimeRange cell = new TimeRange(day, hour * 60, (hour + 1) * 60);
                    Slot slot = assigned.stream().filter(s -> s.getRange().overlaps(cell)).findFirst().orElse(null);
                    if (slot != null) {
                        sb.append("<td class=\"assigned\" title=\"").append(escapeHtml(slot.getRange().toString())).append("\">")
                            .append(escapeHtml(slot.getDisplayName())).append("</td>");
                    } else if (!availability.isAvailable(staff.getName(), cell)) {
                        sb.append("<td class=\"unavailable\">Unavailable</td>");
                    } else {
                        sb.append("<td class=\"available\"></td>");
                    }
                }
                sb.append("</tr>\n");
            }
            sb.append("</tbody>\n</table>\n</div>\n");
        }
        sb.append("</div>\n");
        return sb.toString();
    }

    // Hours covering every weekday slot, at least 8:00-18:00
    private static int[] hourWindow(SchedulingProblem problem) {
        int first = DEFAULT_FIRST_HOUR;
        int last = DEFAULT_LAST_HOUR;
        for (Slot slot : problem.getSlots()) {
            if (!WEEK_DAYS.contains(slot.getDay())) continue;
            first = Math.min(first, slot.getStartMinute() / 60);
            last = Math.max(last, (slot.getEndMinute() + 59) / 60);
        }
        return new int[] {first, last};
    }

    private static String buildLegend() {
        return """
            <div class="section legend">
                <h2>Legend</h2>
                <div class="legend-items">
                    <span class="legend-item assigned">Assigned</span>
                    <span class="legend-item unavailable">Unavailable</span>
                    <span class="legend-item available">Available</span>
                </div>
            </div>
            """;
    }

    private static String buildChartScript(AssignmentReport report) {
        String labels = report.getStaffSummaries().stream()
            .map(s -> "'" + escapeJs(s.getName()) + "'")
            .collect(Collectors.joining(", "));
        String assigned = report.getStaffSummaries().stream()
            .map(s -> s.getHoursAssigned().toPlainString())
            .collect(Collectors.joining(", "));
        String hired = report.getStaffSummaries().stream()
            .map(s -> s.getHoursHired().stripTrailingZeros().toPlainString())
            .collect(Collectors.joining(", "));

        return "<script>\n"
            + "new Chart(document.getElementById('hoursChart'), {\n"
            + "  type: 'bar',\n"
            + "  data: {\n"
            + "    labels: [" + labels + "],\n"
            + "    datasets: [\n"
            + "      { label: 'Assigned', data: [" + assigned + "], backgroundColor: '#3f51b5' },\n"
            + "      { label: 'Hired for', data: [" + hired + "], backgroundColor: '#c5cae9' }\n"
            + "    ]\n"
            + "  },\n"
            + "  options: { responsive: true, scales: { y: { beginAtZero: true } } }\n"
            + "});\n"
            + "</script>\n";
    }

    private static String timeSpan(Slot slot) {
        return TimeLabels.format(slot.getStartMinute()) + " - " + TimeLabels.format(slot.getEndMinute());
    }

    private static String getCSS() {
        return """
            * { box-sizing: border-box; margin: 0; padding: 0; }
            body {
                font-family: 'Segoe UI', -apple-system, BlinkMacSystemFont, Roboto, sans-serif;
                background: linear-gradient(135deg, #3f51b5 0%, #5c6bc0 100%);
                min-height: 100vh;
                padding: 20px;
            }

            .header { text-align: center; color: white; padding: 30px 20px; }
            .header h1 { font-size: 2.4em; font-weight: 600; }
            .subtitle { font-size: 1.1em; opacity: 0.9; margin-top: 10px; }

            .score-banner {
                background: white;
                border-radius: 16px;
                padding: 25px 30px;
                margin: 20px auto;
                max-width: 900px;
                display: flex;
                justify-content: space-between;
                align-items: center;
                box-shadow: 0 10px 40px rgba(0,0,0,0.15);
            }
            .score-banner.good { border-left: 6px solid #4caf50; }
            .score-banner.warning { border-left: 6px solid #ff9800; }
            .score-banner.bad { border-left: 6px solid #f44336; }
            .score-label { display: block; color: #666; font-size: 0.9em; text-transform: uppercase; letter-spacing: 1px; }
            .score-value { font-family: 'Courier New', monospace; font-size: 1.4em; font-weight: bold; color: #333; }
            .score-stats { display: flex; gap: 30px; }
            .stat-item { text-align: center; }
            .stat-number { display: block; font-size: 1.8em; font-weight: bold; color: #1a237e; }
            .stat-label { display: block; font-size: 0.8em; color: #666; text-transform: uppercase; }

            .section {
                background: white;
                border-radius: 12px;
                padding: 25px;
                margin: 20px auto;
                max-width: 1400px;
                box-shadow: 0 4px 20px rgba(0,0,0,0.1);
            }
            .section h2 {
                color: #1a237e;
                margin-bottom: 20px;
                font-size: 1.3em;
                border-bottom: 2px solid #e8eaf6;
                padding-bottom: 10px;
            }

            .workload-table { width: 100%; border-collapse: collapse; font-size: 0.9em; }
            .workload-table th {
                background: #f5f5f5;
                padding: 12px 8px;
                text-align: left;
                font-weight: 600;
                color: #333;
                border-bottom: 2px solid #ddd;
            }
            .workload-table td { padding: 10px 8px; border-bottom: 1px solid #eee; }
            .workload-table .staff-name { font-weight: 500; }
            .workload-table .num { text-align: center; font-family: monospace; }
            .workload-table .total-cell { background: #e8eaf6; font-weight: bold; }
            tr.partial td { background: #fff8e1; }
            tr.unfilled td { background: #ffebee; }
            .badge { background: #ffcdd2; color: #b71c1c; border-radius: 8px; padding: 2px 6px; font-size: 0.75em; }
            .all-good { color: #2e7d32; font-weight: 500; }
            .muted { color: #888; font-style: italic; }

            .staff-card { background: #fafafa; border-radius: 8px; padding: 15px; margin-bottom: 15px; }
            .staff-card h3 { color: #333; margin-bottom: 10px; }
            .calendar-grid { width: 100%; border-collapse: collapse; font-size: 0.85em; table-layout: fixed; }
            .calendar-grid th { background: #e8eaf6; padding: 6px; }
            .calendar-grid td { border: 1px solid #e0e0e0; padding: 4px; height: 28px; text-align: center; }
            .calendar-grid .hour { font-family: monospace; color: #555; width: 70px; }
            .assigned { background: #c8e6c9; font-weight: 500; }
            .unavailable { background: #ffcdd2; color: #b71c1c; }
            .available { background: #ffffff; }

            .legend-items { display: flex; gap: 15px; }
            .legend-item { padding: 6px 14px; border-radius: 6px; border: 1px solid #ddd; }
            """;
    }

    private static String escapeHtml(String str) {
        if (str == null) return "";
        return str.replace("&", "&amp;")
                  .replace("<", "&lt;")
                  .replace(">", "&gt;")
                  .replace("\"", "&quot;");
    }

    private static String escapeJs(String str) {
        if (str == null) return "";
        return str.replace("\\", "\\\\").replace("'", "\\'").replace("\n", " ");
    }
}
