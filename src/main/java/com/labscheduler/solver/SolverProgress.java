package com.labscheduler.solver;

import java.time.Duration;

/**
 * An improved solution reported while the search runs.
 */
public final class SolverProgress {

    private final boolean[] values;
    private final long primary;
    private final long balance;
    private final Duration elapsed;

    public SolverProgress(boolean[] values, long primary, long balance, Duration elapsed) {
        this.values = values.clone();
        this.primary = primary;
        this.balance = balance;
        this.elapsed = elapsed;
    }

    public boolean[] getValues() { return values.clone(); }

    public long getPrimary() { return primary; }

    public long getBalance() { return balance; }

    public Duration getElapsed() { return elapsed; }
}
