package com.labscheduler.engine;

/**
 * Lifecycle of a scheduling run.
 *
 * IDLE -> BUILDING -> SEARCHING -> {OPTIMAL | FEASIBLE | INFEASIBLE | TIMED_OUT} -> DONE,
 * or FAILED when the solver breaks.
 */
public enum RunState {
    IDLE,
    BUILDING,
    SEARCHING,
    /** Every fillable position is covered and no tie-breaker remains. */
    OPTIMAL,
    /** A solution was found but not proven optimal. */
    FEASIBLE,
    INFEASIBLE,
    /** Cancelled or out of time; carries the best solution found so far. */
    TIMED_OUT,
    FAILED,
    DONE;

    public boolean isOutcome() {
        return this == OPTIMAL || this == FEASIBLE || this == INFEASIBLE || this == TIMED_OUT;
    }

    public boolean isFinished() {
        return this == DONE || this == FAILED;
    }
}
