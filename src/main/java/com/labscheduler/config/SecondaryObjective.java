package com.labscheduler.config;

import com.labscheduler.exception.ConfigurationException;

import java.util.Locale;

/**
 * Tie-breaker applied after maximizing coverage.
 */
public enum SecondaryObjective {
    NONE,
    /** Minimize the sum of squared assigned hours per staff member. */
    BALANCE_HOURS,
    /** Minimize the sum of squared per-mille utilization of hired hours. */
    BALANCE_UTILIZATION;

    /** Accepts {@code balance_hours}, {@code balance-hours}, any case. */
    public static SecondaryObjective parse(String text) {
        String normalized = text.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        try {
            return valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Unknown secondary objective '" + text.trim() + "'", e);
        }
    }
}
