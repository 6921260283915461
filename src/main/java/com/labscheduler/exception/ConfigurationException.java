package com.labscheduler.exception;

/**
 * Structurally invalid input or settings, detected before any search starts.
 * Examples: duplicate staff names, a requirement with a non-positive headcount,
 * an empty requirement set, caps that no slot can satisfy.
 */
public class ConfigurationException extends SchedulerException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
