package com.labscheduler.config;

import com.labscheduler.exception.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SettingsLoaderTest {

    @TempDir
    Path dir;

    @Test
    void missingFileGivesDefaults() {
        SchedulerSettings settings = new SettingsLoader(Map.of()).load(dir.resolve(SettingsLoader.DEFAULT_FILE_NAME));

        assertThat(settings.getDailyCapMinutes()).isEqualTo(240);
        assertThat(settings.getMaxLabsPerStaff()).isEqualTo(3);
        assertThat(settings.getTimeBudget()).isEmpty();
        assertThat(settings.getSecondaryObjective()).isEqualTo(SecondaryObjective.NONE);
        assertThat(settings.getRandomSeed()).isZero();
    }

    @Test
    void readsJsonFile() throws IOException {
        Path file = write("""
            {
              "dailyHourCap": 3.5,
              "maxLabsPerStaff": 2,
              "timeBudget": "PT45S",
              "unimprovedTimeLimit": "PT5S",
              "secondaryObjective": "balance-hours",
              "randomSeed": 7
            }
            """);

        SchedulerSettings settings = new SettingsLoader(Map.of()).load(file);

        assertThat(settings.getDailyCapMinutes()).isEqualTo(210);
        assertThat(settings.getMaxLabsPerStaff()).isEqualTo(2);
        assertThat(settings.getTimeBudget()).contains(Duration.ofSeconds(45));
        assertThat(settings.getUnimprovedTimeLimit()).isEqualTo(Duration.ofSeconds(5));
        assertThat(settings.getSecondaryObjective()).isEqualTo(SecondaryObjective.BALANCE_HOURS);
        assertThat(settings.getRandomSeed()).isEqualTo(7);
    }

    @Test
    void environmentOverridesFile() throws IOException {
        Path file = write("{\"dailyHourCap\": 3, \"maxLabsPerStaff\": 2}");
        Map<String, String> env = Map.of(
            SettingsLoader.ENV_DAILY_HOUR_CAP, "5",
            SettingsLoader.ENV_TIME_BUDGET, "90",
            SettingsLoader.ENV_SECONDARY_OBJECTIVE, "BALANCE_UTILIZATION");

        SchedulerSettings settings = new SettingsLoader(env).load(file);

        assertThat(settings.getDailyCapMinutes()).isEqualTo(300);
        assertThat(settings.getMaxLabsPerStaff()).isEqualTo(2);
        assertThat(settings.getTimeBudget()).contains(Duration.ofSeconds(90));
        assertThat(settings.getSecondaryObjective()).isEqualTo(SecondaryObjective.BALANCE_UTILIZATION);
    }

    @Test
    void invalidEnvironmentValueIsAConfigurationError() {
        SettingsLoader loader = new SettingsLoader(Map.of(SettingsLoader.ENV_MAX_LABS, "three"));

        assertThatThrownBy(() -> loader.load(null))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining(SettingsLoader.ENV_MAX_LABS);
    }

    @Test
    void unknownPropertyIsAConfigurationError() throws IOException {
        Path file = write("{\"dailyHourCapp\": 3}");

        assertThatThrownBy(() -> new SettingsLoader(Map.of()).load(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("dailyHourCapp");
    }

    @Test
    void nonPositiveCapIsRejected() throws IOException {
        Path file = write("{\"maxLabsPerStaff\": 0}");

        assertThatThrownBy(() -> new SettingsLoader(Map.of()).load(file))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("labs");
    }

    @Test
    void parsesSecondsAndIsoDurations() {
        assertThat(SettingsLoader.parseDuration("x", "30")).isEqualTo(Duration.ofSeconds(30));
        assertThat(SettingsLoader.parseDuration("x", "PT2M")).isEqualTo(Duration.ofMinutes(2));
        assertThatThrownBy(() -> SettingsLoader.parseDuration("x", "soon"))
            .isInstanceOf(ConfigurationException.class);
    }

    private Path write(String json) throws IOException {
        Path file = dir.resolve(SettingsLoader.DEFAULT_FILE_NAME);
        Files.writeString(file, json);
        return file;
    }
}
