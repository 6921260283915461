package com.labscheduler.config;

import com.labscheduler.exception.ConfigurationException;

import java.time.Duration;
import java.util.Optional;

/**
 * Immutable tuning of one scheduling run.
 */
public final class SchedulerSettings {

    public static final int DEFAULT_DAILY_CAP_MINUTES = 4 * 60;
    public static final int DEFAULT_MAX_LABS_PER_STAFF = 3;
    public static final Duration DEFAULT_BASE_TIME_BUDGET = Duration.ofSeconds(10);
    public static final Duration DEFAULT_PER_VARIABLE_BUDGET = Duration.ofMillis(20);
    public static final Duration DEFAULT_MAX_TIME_BUDGET = Duration.ofMinutes(5);
    public static final Duration DEFAULT_UNIMPROVED_TIME_LIMIT = Duration.ofSeconds(30);

    private final int dailyCapMinutes;
    private final int maxLabsPerStaff;
    private final Duration timeBudget;
    private final Duration baseTimeBudget;
    private final Duration perVariableBudget;
    private final Duration maxTimeBudget;
    private final Duration unimprovedTimeLimit;
    private final SecondaryObjective secondaryObjective;
    private final long randomSeed;

    private SchedulerSettings(Builder b) {
        this.dailyCapMinutes = b.dailyCapMinutes;
        this.maxLabsPerStaff = b.maxLabsPerStaff;
        this.timeBudget = b.timeBudget;
        this.baseTimeBudget = b.baseTimeBudget;
        this.perVariableBudget = b.perVariableBudget;
        this.maxTimeBudget = b.maxTimeBudget;
        this.unimprovedTimeLimit = b.unimprovedTimeLimit;
        this.secondaryObjective = b.secondaryObjective;
        this.randomSeed = b.randomSeed;
    }

    public static SchedulerSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .dailyCapMinutes(dailyCapMinutes)
            .maxLabsPerStaff(maxLabsPerStaff)
            .timeBudget(timeBudget)
            .baseTimeBudget(baseTimeBudget)
            .perVariableBudget(perVariableBudget)
            .maxTimeBudget(maxTimeBudget)
            .unimprovedTimeLimit(unimprovedTimeLimit)
            .secondaryObjective(secondaryObjective)
            .randomSeed(randomSeed);
    }

    /**
     * The explicit time budget, or one scaled with the model size:
     * {@code base + perVariable * variables}, capped at the maximum.
     */
    public Duration effectiveTimeBudget(int variableCount) {
        if (timeBudget != null) {
            return timeBudget;
        }
        Duration scaled = baseTimeBudget.plus(perVariableBudget.multipliedBy(variableCount));
        return scaled.compareTo(maxTimeBudget) > 0 ? maxTimeBudget : scaled;
    }

    public int getDailyCapMinutes() { return dailyCapMinutes; }

    public int getMaxLabsPerStaff() { return maxLabsPerStaff; }

    public Optional<Duration> getTimeBudget() { return Optional.ofNullable(timeBudget); }

    public Duration getBaseTimeBudget() { return baseTimeBudget; }

    public Duration getPerVariableBudget() { return perVariableBudget; }

    public Duration getMaxTimeBudget() { return maxTimeBudget; }

    public Duration getUnimprovedTimeLimit() { return unimprovedTimeLimit; }

    public SecondaryObjective getSecondaryObjective() { return secondaryObjective; }

    public long getRandomSeed() { return randomSeed; }

    @Override
    public String toString() {
        return "SchedulerSettings{dailyCap=" + dailyCapMinutes + "min, maxLabs=" + maxLabsPerStaff
            + ", timeBudget=" + (timeBudget != null ? timeBudget : "scaled") + ", secondary=" + secondaryObjective
            + ", seed=" + randomSeed + "}";
    }

    public static final class Builder {
        private int dailyCapMinutes = DEFAULT_DAILY_CAP_MINUTES;
        private int maxLabsPerStaff = DEFAULT_MAX_LABS_PER_STAFF;
        private Duration timeBudget;
        private Duration baseTimeBudget = DEFAULT_BASE_TIME_BUDGET;
        private Duration perVariableBudget = DEFAULT_PER_VARIABLE_BUDGET;
        private Duration maxTimeBudget = DEFAULT_MAX_TIME_BUDGET;
        private Duration unimprovedTimeLimit = DEFAULT_UNIMPROVED_TIME_LIMIT;
        private SecondaryObjective secondaryObjective = SecondaryObjective.NONE;
        private long randomSeed;

        private Builder() {}

        public Builder dailyCapMinutes(int minutes) {
            this.dailyCapMinutes = minutes;
            return this;
        }

        public Builder dailyHourCap(double hours) {
            this.dailyCapMinutes = (int) Math.round(hours * 60);
            return this;
        }

        public Builder maxLabsPerStaff(int maxLabs) {
            this.maxLabsPerStaff = maxLabs;
            return this;
        }

        /** {@code null} scales the budget with the model size. */
        public Builder timeBudget(Duration timeBudget) {
            this.timeBudget = timeBudget;
            return this;
        }

        public Builder baseTimeBudget(Duration baseTimeBudget) {
            this.baseTimeBudget = baseTimeBudget;
            return this;
        }

        public Builder perVariableBudget(Duration perVariableBudget) {
            this.perVariableBudget = perVariableBudget;
            return this;
        }

        public Builder maxTimeBudget(Duration maxTimeBudget) {
            this.maxTimeBudget = maxTimeBudget;
            return this;
        }

        public Builder unimprovedTimeLimit(Duration unimprovedTimeLimit) {
            this.unimprovedTimeLimit = unimprovedTimeLimit;
            return this;
        }

        public Builder secondaryObjective(SecondaryObjective secondaryObjective) {
            this.secondaryObjective = secondaryObjective;
            return this;
        }

        public Builder randomSeed(long randomSeed) {
            this.randomSeed = randomSeed;
            return this;
        }

        /**
         * @throws ConfigurationException when a cap or duration is not positive
         */
        public SchedulerSettings build() {
            if (dailyCapMinutes <= 0) {
                throw new ConfigurationException("Daily hour cap must be positive, got " + dailyCapMinutes + " minutes");
            }
            if (dailyCapMinutes > 24 * 60) {
                throw new ConfigurationException("Daily hour cap cannot exceed 24 hours, got " + dailyCapMinutes + " minutes");
            }
            if (maxLabsPerStaff <= 0) {
                throw new ConfigurationException("Max labs per staff member must be positive, got " + maxLabsPerStaff);
            }
            requirePositive("timeBudget", timeBudget, true);
            requirePositive("baseTimeBudget", baseTimeBudget, false);
            requirePositive("perVariableBudget", perVariableBudget, false);
            requirePositive("maxTimeBudget", maxTimeBudget, false);
            requirePositive("unimprovedTimeLimit", unimprovedTimeLimit, false);
            if (secondaryObjective == null) {
                throw new ConfigurationException("Secondary objective must be set (use NONE to disable)");
            }
            return new SchedulerSettings(this);
        }

        private static void requirePositive(String name, Duration value, boolean optional) {
            if (value == null) {
                if (optional) return;
                throw new ConfigurationException(name + " must be set");
            }
            if (value.isNegative() || value.isZero()) {
                throw new ConfigurationException(name + " must be positive, got " + value);
            }
        }
    }
}
