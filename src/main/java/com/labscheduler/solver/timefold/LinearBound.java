package com.labscheduler.solver.timefold;

/**
 * Right-hand side of one linear constraint: {@code sum(terms) <= upperBound}.
 */
public class LinearBound {

    private final int id;
    private final String label;
    private final long upperBound;

    public LinearBound(int id, String label, long upperBound) {
        this.id = id;
        this.label = label;
        this.upperBound = upperBound;
    }

    public int getId() { return id; }

    public String getLabel() { return label; }

    public long getUpperBound() { return upperBound; }

    @Override
    public String toString() {
        return label + " <= " + upperBound;
    }
}
