package com.labscheduler.solver;

/**
 * Receives each feasible improvement of the best solution, in order, on the solver thread.
 */
@FunctionalInterface
public interface ImprovementListener {

    ImprovementListener NONE = progress -> { };

    void onImprovement(SolverProgress progress);
}
