package com.labscheduler.solver;

/**
 * Why a search stopped.
 */
public enum Termination {
    /** The primary objective reached its declared upper bound. */
    BOUND_REACHED,
    /** No improvement within the unimproved time limit. */
    CONVERGED,
    TIME_BUDGET,
    CANCELLED
}
