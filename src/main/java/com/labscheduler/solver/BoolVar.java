package com.labscheduler.solver;

/**
 * Handle to a boolean decision variable owned by one {@link ConstraintSolver}.
 */
public final class BoolVar {

    private final int index;
    private final String name;
    private final boolean hint;

    BoolVar(int index, String name, boolean hint) {
        this.index = index;
        this.name = name;
        this.hint = hint;
    }

    /** Position of this variable in {@link SolverResult#getValues()}. */
    public int getIndex() { return index; }

    public String getName() { return name; }

    /** Value the search tries first. */
    public boolean getHint() { return hint; }

    @Override
    public String toString() {
        return name;
    }
}
