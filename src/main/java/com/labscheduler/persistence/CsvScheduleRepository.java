package com.labscheduler.persistence;

import com.labscheduler.availability.AvailabilityIndex;
import com.labscheduler.domain.RequirementSet;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.Slot;
import com.labscheduler.domain.StaffMember;
import com.labscheduler.domain.UnavailabilityInterval;
import com.labscheduler.exception.ConfigurationException;
import com.labscheduler.exception.InputParseException;
import com.labscheduler.time.TimeLabels;
import com.labscheduler.time.TimeRange;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.DayOfWeek;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads a {@link SchedulingProblem} from the three CSV exports:
 * - staff hours ({@code TA}/{@code Name}, {@code Hired for}/{@code Hours})
 * - availability responses ({@code Name} plus one column per time range, e.g.
 *   {@code Unavailable [8am to 9am]}, whose cells list the unavailable days)
 * - requirements ({@code Day}, {@code Start}, {@code End}, {@code Required}, optional {@code Lab Section})
 */
public class CsvScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(CsvScheduleRepository.class);

    public static final String STAFF_FILE = "Max Availability.csv";
    public static final String RESPONSES_FILE = "Responses.csv";
    public static final String REQUIREMENTS_FILE = "Requirements.csv";

    private static final Pattern BRACKETED = Pattern.compile("\\[([^\\]]*)\\]");

    private final InputErrorHandler errorHandler;

    public CsvScheduleRepository() {
        this(InputErrorHandler.failFast());
    }

    public CsvScheduleRepository(InputErrorHandler errorHandler) {
        this.errorHandler = errorHandler;
    }

    /**
     * Loads the three input files from a directory, using their usual file names.
     */
    public SchedulingProblem load(Path directory) throws IOException {
        log.info("Loading input files from {}", directory);
        List<StaffMember> staff = loadStaff(requireFile(directory.resolve(STAFF_FILE)));
        AvailabilityIndex availability = loadAvailability(requireFile(directory.resolve(RESPONSES_FILE)));
        RequirementSet requirements = loadRequirements(requireFile(directory.resolve(REQUIREMENTS_FILE)));
        return new SchedulingProblem(staff, availability, requirements);
    }

    public List<StaffMember> loadStaff(Path file) throws IOException {
        return parseStaff(CsvTable.read(file));
    }

    public AvailabilityIndex loadAvailability(Path file) throws IOException {
        return parseAvailability(CsvTable.read(file));
    }

    public RequirementSet loadRequirements(Path file) throws IOException {
        return parseRequirements(CsvTable.read(file));
    }

    /**
     * @throws ConfigurationException on duplicate names
     */
    public List<StaffMember> parseStaff(CsvTable table) {
        int nameCol = table.requireColumn("TA", "Name");
        int hoursCol = table.requireColumn("Hired for", "Hours");
        String hoursHeader = table.getHeader().get(hoursCol);

        Map<String, StaffMember> staff = new LinkedHashMap<>();
        for (CsvTable.Row row : table.getRows()) {
            String name = row.get(nameCol);
            if (name.isEmpty()) {
                errorHandler.onError(new InputParseException("Blank staff name",
                    table.getSource(), row.getLineNumber(), table.getHeader().get(nameCol), null));
                continue;
            }
            BigDecimal hours;
            try {
                hours = new BigDecimal(row.get(hoursCol));
            } catch (NumberFormatException e) {
                errorHandler.onError(new InputParseException("Hired hours '" + row.get(hoursCol) + "' is not a number",
                    table.getSource(), row.getLineNumber(), hoursHeader, name, e));
                continue;
            }
            if (hours.signum() < 0) {
                errorHandler.onError(new InputParseException("Hired hours must not be negative, got " + hours,
                    table.getSource(), row.getLineNumber(), hoursHeader, name));
                continue;
            }
            if (staff.containsKey(name)) {
                throw new ConfigurationException("Duplicate staff member '" + name + "' in " + table.getSource()
                    + " row " + row.getLineNumber());
            }
            staff.put(name, new StaffMember(name, hours));
        }
        log.info("Loaded {} staff members from {}", staff.size(), table.getSource());
        return new ArrayList<>(staff.values());
    }

    public AvailabilityIndex parseAvailability(CsvTable table) {
        int nameCol = table.requireColumn("Name");

        // Columns carrying a bracketed time range; other columns (timestamps, e-mail...) are ignored
        Map<Integer, int[]> rangeColumns = new LinkedHashMap<>();
        boolean anyBracketed = false;
        for (int i = 0; i < table.getHeader().size(); i++) {
            String header = table.getHeader().get(i);
            Matcher m = BRACKETED.matcher(header);
            if (!m.find()) {
                continue;
            }
            anyBracketed = true;
            try {
                rangeColumns.put(i, TimeLabels.parseRange(m.group(1)));
            } catch (InputParseException e) {
                errorHandler.onError(e.at(table.getSource(), 1, header, null));
            }
        }
        if (!anyBracketed) {
            throw new InputParseException("No unavailability columns detected (expected headers such as 'Unavailable [8am to 9am]')",
                table.getSource(), 1, null, null);
        }

        Set<String> respondents = new LinkedHashSet<>();
        List<UnavailabilityInterval> intervals = new ArrayList<>();
        for (CsvTable.Row row : table.getRows()) {
            String name = row.get(nameCol);
            if (name.isEmpty()) {
                log.warn("{} row {}: response without a name, ignored", table.getSource(), row.getLineNumber());
                continue;
            }
            if (!respondents.add(name)) {
                log.warn("{} row {}: second response of '{}' ignored", table.getSource(), row.getLineNumber(), name);
                continue;
            }
            for (Map.Entry<Integer, int[]> column : rangeColumns.entrySet()) {
                String cell = row.get(column.getKey());
                if (cell.isEmpty()) {
                    continue;
                }
                String header = table.getHeader().get(column.getKey());
                for (String token : cell.split(",")) {
                    if (token.isBlank()) {
                        continue;
                    }
                    DayOfWeek day;
                    try {
                        day = TimeLabels.parseDay(token);
                    } catch (InputParseException e) {
                        errorHandler.onError(e.at(table.getSource(), row.getLineNumber(), header, name));
                        continue;
                    }
                    int[] range = column.getValue();
                    intervals.add(new UnavailabilityInterval(name, new TimeRange(day, range[0], range[1])));
                }
            }
        }
        log.info("Loaded {} responses with {} unavailable periods from {}", respondents.size(), intervals.size(),
            table.getSource());
        return AvailabilityIndex.of(respondents, intervals);
    }

    /**
     * @throws ConfigurationException on a non-positive requirement, a slot that does not end
     *         after it starts, or an empty result
     */
    public RequirementSet parseRequirements(CsvTable table) {
        int dayCol = table.requireColumn("Day");
        int startCol = table.requireColumn("Start");
        int endCol = table.requireColumn("End");
        int requiredCol = table.requireColumn("Required");
        int labelCol = table.columnIndex("Lab Section", "Section");

        List<Slot> slots = new ArrayList<>();
        for (CsvTable.Row row : table.getRows()) {
            int line = row.getLineNumber();
            String label = labelCol >= 0 ? row.get(labelCol) : "";
            DayOfWeek day;
            int start;
            int end;
            int required;
            try {
                day = cell(table, row, dayCol, TimeLabels::parseDay);
                start = cell(table, row, startCol, TimeLabels::hourCellToMinutes);
                end = cell(table, row, endCol, TimeLabels::hourCellToMinutes);
                required = cell(table, row, requiredCol, CsvScheduleRepository::parseCount);
            } catch (InputParseException e) {
                errorHandler.onError(e);
                continue;
            }
            String where = table.getSource() + " row " + line + (label.isEmpty() ? "" : " (" + label + ")");
            if (required <= 0) {
                throw new ConfigurationException(where + ": Required must be at least 1, got " + required);
            }
            if (start >= end) {
                throw new ConfigurationException(where + ": End " + TimeLabels.format(end)
                    + " is not after Start " + TimeLabels.format(start));
            }
            slots.add(new Slot("R" + line, day, start, end, required, label));
        }
        log.info("Loaded {} slots needing {} positions from {}", slots.size(),
            slots.stream().mapToInt(Slot::getRequired).sum(), table.getSource());
        return new RequirementSet(slots);
    }

    private static <T> T cell(CsvTable table, CsvTable.Row row, int column, CellParser<T> parser) {
        try {
            return parser.parse(row.get(column));
        } catch (InputParseException e) {
            throw e.at(table.getSource(), row.getLineNumber(), table.getHeader().get(column), null);
        }
    }

    private static int parseCount(String text) {
        try {
            return new BigDecimal(text).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new InputParseException("'" + text + "' is not a whole number", e);
        }
    }

    private static Path requireFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Input file not found: " + file);
        }
        return file;
    }

    @FunctionalInterface
    private interface CellParser<T> {
        T parse(String text);
    }
}
