package com.labscheduler;

import com.labscheduler.config.SchedulerSettings;
import com.labscheduler.config.SettingsLoader;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.CoverageGap;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.StaffSummary;
import com.labscheduler.engine.SearchOrchestrator;
import com.labscheduler.exception.ConfigurationException;
import com.labscheduler.exception.InputParseException;
import com.labscheduler.exception.SolverFailureException;
import com.labscheduler.persistence.CsvScheduleRepository;
import com.labscheduler.report.CsvReportWriter;
import com.labscheduler.report.HtmlReportGenerator;
import com.labscheduler.report.JsonReportWriter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Command line entry point: {@code App <input-dir> [output-dir]}.
 *
 * Reads {@code Max Availability.csv}, {@code Responses.csv} and {@code Requirements.csv}
 * (and an optional {@code scheduler.json}) from the input directory, runs one scheduling
 * session and writes the CSV, JSON and HTML reports to the output directory.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        if (args.length < 1 || args.length > 2) {
            System.err.println("Usage: App <input-dir> [output-dir]");
            System.exit(64);
        }
        Path inputDir = Paths.get(args[0]);
        Path outputDir = args.length == 2 ? Paths.get(args[1]) : inputDir.resolve("output");
        System.exit(run(inputDir, outputDir));
    }

    /**
     * @return the process exit code
     */
    static int run(Path inputDir, Path outputDir) {
        try {
            log.info("=== Lab Scheduler Starting ===");
            SchedulerSettings settings = new SettingsLoader().load(inputDir.resolve(SettingsLoader.DEFAULT_FILE_NAME));

            SchedulingProblem problem = new CsvScheduleRepository().load(inputDir);
            log.info("Problem loaded:");
            log.info("  - {} staff members ({} with an availability response)",
                problem.getStaff().size(), problem.getSchedulableStaff().size());
            log.info("  - {} slots, {} positions to fill",
                problem.getSlots().size(), problem.getRequirements().getTotalRequired());
            log.info("  - {} unavailable periods", problem.getAvailability().getIntervalCount());

            AssignmentReport report = new SearchOrchestrator().solve(problem, settings,
                update -> log.info("  ... {} positions covered after {}ms",
                    update.getObjective(), update.getElapsed().toMillis()));

            logReport(report);

            Files.createDirectories(outputDir);
            new CsvReportWriter().write(report, outputDir);
            new JsonReportWriter().write(report, outputDir.resolve("report.json"));
            HtmlReportGenerator.generateReport(report, problem, outputDir.resolve("schedule.html"));
            log.info("Reports written to {}", outputDir.toAbsolutePath());
            return 0;
        } catch (InputParseException | ConfigurationException e) {
            log.error("Invalid input: {}", e.getMessage());
            return 1;
        } catch (SolverFailureException e) {
            log.error("Scheduling failed", e);
            return 2;
        } catch (IOException e) {
            log.error("I/O error: {}", e.getMessage(), e);
            return 3;
        }
    }

    private static void logReport(AssignmentReport report) {
        log.info("=== Scheduling Finished ===");
        log.info("Result: {}{}", report.getState(), report.isProvenOptimal() ? " (proven optimal)" : "");
        log.info("Positions filled: {}/{} (best possible {})",
            report.getTotalAssigned(), report.getTotalRequired(), report.getCoverageUpperBound());
        log.info("Fully covered slots: {}/{}", report.getFullyCoveredCount(), report.getSlotCoverage().size());

        if (!report.getGaps().isEmpty()) {
            log.warn("\n=== Under-covered slots ===");
            for (CoverageGap gap : report.getGaps()) {
                log.warn("  {}", gap);
            }
        }

        log.info("\n=== Staff ===");
        for (StaffSummary s : report.getStaffSummaries()) {
            log.info("  {}: {}h of {}h ({})", s.getName(), s.getHoursAssigned().toPlainString(),
                s.getHoursHired().stripTrailingZeros().toPlainString(), s.getDailyBreakdown());
        }
        if (!report.getUnscheduledStaff().isEmpty()) {
            log.warn("No availability response, not scheduled: {}", report.getUnscheduledStaff());
        }
    }
}
