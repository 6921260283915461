package com.labscheduler.solver;

import java.time.Duration;

/**
 * Best solution of a finished search.
 */
public final class SolverResult {

    private final boolean[] values;
    private final long primary;
    private final long balance;
    private final boolean feasible;
    private final Duration elapsed;
    private final Termination termination;

    public SolverResult(boolean[] values, long primary, long balance, boolean feasible, Duration elapsed,
                        Termination termination) {
        this.values = values.clone();
        this.primary = primary;
        this.balance = balance;
        this.feasible = feasible;
        this.elapsed = elapsed;
        this.termination = termination;
    }

    public boolean value(BoolVar var) {
        return values[var.getIndex()];
    }

    public boolean[] getValues() { return values.clone(); }

    /** Primary objective value (maximized). */
    public long getPrimary() { return primary; }

    /** Balance objective value (minimized), 0 when none was set. */
    public long getBalance() { return balance; }

    public boolean isFeasible() { return feasible; }

    public Duration getElapsed() { return elapsed; }

    public Termination getTermination() { return termination; }

    @Override
    public String toString() {
        return "SolverResult{primary=" + primary + ", balance=" + balance + ", feasible=" + feasible
            + ", termination=" + termination + ", elapsed=" + elapsed.toMillis() + "ms}";
    }
}
