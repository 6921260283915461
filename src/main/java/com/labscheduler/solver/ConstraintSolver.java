package com.labscheduler.solver;

import java.time.Duration;
import java.util.List;

/**
 * Solver-neutral 0/1 linear model: boolean variables, upper-bounded linear constraints,
 * a maximized primary objective and an optional minimized balance objective.
 *
 * An instance holds one model and is solved once. Everything but {@link #terminateEarly()}
 * must be called from a single thread.
 */
public interface ConstraintSolver {

    BoolVar addBoolVar(String name);

    /**
     * @param hint value the search tries first for this variable
     */
    BoolVar addBoolVar(String name, boolean hint);

    /**
     * Adds {@code expr <= upperBound}.
     *
     * @throws IllegalArgumentException if {@code upperBound} is negative
     */
    void addLinearConstraint(String label, LinearExpression expr, long upperBound);

    /** Primary objective, maximized. */
    void setObjective(LinearExpression expr);

    /**
     * Secondary objective, minimized: the sum over the groups of the square of each
     * group's value. Only breaks ties of the primary objective.
     */
    void setBalanceObjective(List<LinearExpression> groups);

    /** A proven upper bound of the primary objective; reaching it ends the search. */
    void setObjectiveUpperBound(long bound);

    void setRandomSeed(long seed);

    /** Stops a search that found no better solution for this long. */
    void setUnimprovedTimeLimit(Duration limit);

    /**
     * Runs the search in the calling thread until the bound is reached, the budget is
     * spent, the search converges or {@link #terminateEarly()} is called.
     *
     * @throws com.labscheduler.exception.SolverFailureException if the backend fails
     */
    SolverResult solve(Duration timeBudget, ImprovementListener onImprovement);

    /** Asks a running (or not yet started) search to stop. Safe from any thread. */
    void terminateEarly();

    int getVariableCount();
}
