package com.labscheduler.exception;

/**
 * The solver could not run (crash, resource exhaustion, invalid model).
 * Distinct from an infeasible outcome, which is a result state.
 */
public class SolverFailureException extends SchedulerException {

    public SolverFailureException(String message) {
        super(message);
    }

    public SolverFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
