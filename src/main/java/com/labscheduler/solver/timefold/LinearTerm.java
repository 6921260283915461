package com.labscheduler.solver.timefold;

/**
 * {@code coefficient * variable} inside the constraint of a {@link LinearBound}.
 */
public class LinearTerm {

    private final LinearBound bound;
    private final int variableId;
    private final long coefficient;

    public LinearTerm(LinearBound bound, int variableId, long coefficient) {
        this.bound = bound;
        this.variableId = variableId;
        this.coefficient = coefficient;
    }

    public LinearBound getBound() { return bound; }

    public int getVariableId() { return variableId; }

    public long getCoefficient() { return coefficient; }
}
