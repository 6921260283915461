package com.labscheduler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.labscheduler.exception.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Map;

/**
 * Loads {@link SchedulerSettings}: defaults, then an optional JSON file, then
 * environment variables.
 *
 * <pre>
 * {
 *   "dailyHourCap": 4,
 *   "maxLabsPerStaff": 3,
 *   "timeBudget": "PT60S",
 *   "secondaryObjective": "BALANCE_HOURS",
 *   "randomSeed": 42
 * }
 * </pre>
 */
public class SettingsLoader {

    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    public static final String DEFAULT_FILE_NAME = "scheduler.json";

    public static final String ENV_DAILY_HOUR_CAP = "SCHEDULER_DAILY_HOUR_CAP";
    public static final String ENV_MAX_LABS = "SCHEDULER_MAX_LABS_PER_STAFF";
    public static final String ENV_TIME_BUDGET = "SCHEDULER_TIME_BUDGET";
    public static final String ENV_SECONDARY_OBJECTIVE = "SCHEDULER_SECONDARY_OBJECTIVE";

    private final ObjectMapper objectMapper;
    private final Map<String, String> environment;

    public SettingsLoader() {
        this(System.getenv());
    }

    public SettingsLoader(Map<String, String> environment) {
        this.environment = environment;
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    /**
     * @param settingsFile JSON file to read; ignored when {@code null} or missing
     * @throws ConfigurationException on unreadable JSON or invalid values
     */
    public SchedulerSettings load(Path settingsFile) {
        SchedulerSettings.Builder builder = SchedulerSettings.builder();
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            applyFile(builder, settingsFile);
        } else if (settingsFile != null) {
            log.debug("No settings file at {}, using defaults", settingsFile);
        }
        applyEnvironment(builder);
        SchedulerSettings settings = builder.build();
        log.info("Settings: {}", settings);
        return settings;
    }

    private void applyFile(SchedulerSettings.Builder builder, Path file) {
        SettingsFile values;
        try {
            values = objectMapper.readValue(file.toFile(), SettingsFile.class);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read settings file " + file + ": " + e.getMessage(), e);
        }
        log.info("Loaded settings from {}", file);
        if (values.dailyHourCap != null) builder.dailyHourCap(values.dailyHourCap);
        if (values.maxLabsPerStaff != null) builder.maxLabsPerStaff(values.maxLabsPerStaff);
        if (values.timeBudget != null) builder.timeBudget(values.timeBudget);
        if (values.baseTimeBudget != null) builder.baseTimeBudget(values.baseTimeBudget);
        if (values.perVariableBudget != null) builder.perVariableBudget(values.perVariableBudget);
        if (values.maxTimeBudget != null) builder.maxTimeBudget(values.maxTimeBudget);
        if (values.unimprovedTimeLimit != null) builder.unimprovedTimeLimit(values.unimprovedTimeLimit);
        if (values.secondaryObjective != null) builder.secondaryObjective(SecondaryObjective.parse(values.secondaryObjective));
        if (values.randomSeed != null) builder.randomSeed(values.randomSeed);
    }

    private void applyEnvironment(SchedulerSettings.Builder builder) {
        String cap = env(ENV_DAILY_HOUR_CAP);
        if (cap != null) {
            builder.dailyHourCap(parseNumber(ENV_DAILY_HOUR_CAP, cap));
        }
        String maxLabs = env(ENV_MAX_LABS);
        if (maxLabs != null) {
            try {
                builder.maxLabsPerStaff(Integer.parseInt(maxLabs));
            } catch (NumberFormatException e) {
                throw new ConfigurationException(ENV_MAX_LABS + " must be an integer, got '" + maxLabs + "'", e);
            }
        }
        String budget = env(ENV_TIME_BUDGET);
        if (budget != null) {
            builder.timeBudget(parseDuration(ENV_TIME_BUDGET, budget));
        }
        String secondary = env(ENV_SECONDARY_OBJECTIVE);
        if (secondary != null) {
            builder.secondaryObjective(SecondaryObjective.parse(secondary));
        }
    }

    private String env(String name) {
        String value = environment.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static double parseNumber(String name, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException(name + " must be a number, got '" + value + "'", e);
        }
    }

    /** Whole seconds ({@code "90"}) or ISO-8601 ({@code "PT1M30S"}). */
    static Duration parseDuration(String name, String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofSeconds(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (NumberFormatException | DateTimeParseException e) {
            throw new ConfigurationException(name + " must be seconds or an ISO-8601 duration, got '" + value + "'", e);
        }
    }

    static class SettingsFile {
        public Double dailyHourCap;
        public Integer maxLabsPerStaff;
        public Duration timeBudget;
        public Duration baseTimeBudget;
        public Duration perVariableBudget;
        public Duration maxTimeBudget;
        public Duration unimprovedTimeLimit;
        public String secondaryObjective;
        public Long randomSeed;
    }
}
