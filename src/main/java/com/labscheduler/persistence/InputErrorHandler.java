package com.labscheduler.persistence;

import com.labscheduler.exception.InputParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Decides what happens to a malformed cell or row: abort the import, or record the
 * problem and skip the offending value.
 */
public interface InputErrorHandler {

    /**
     * Called for every problem found. Throwing aborts the import; returning skips the value.
     */
    void onError(InputParseException error);

    static InputErrorHandler failFast() {
        return error -> {
            throw error;
        };
    }

    static Collecting collecting() {
        return new Collecting();
    }

    /** Logs each problem at WARN and keeps it for the caller. */
    final class Collecting implements InputErrorHandler {

        private static final Logger log = LoggerFactory.getLogger(InputErrorHandler.class);

        private final List<InputParseException> problems = new ArrayList<>();

        private Collecting() {}

        @Override
        public void onError(InputParseException error) {
            log.warn("Skipped: {}", error.getMessage());
            problems.add(error);
        }

        public List<InputParseException> getProblems() {
            return Collections.unmodifiableList(problems);
        }

        public boolean hasProblems() {
            return !problems.isEmpty();
        }
    }
}
