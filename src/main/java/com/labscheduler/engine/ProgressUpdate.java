package com.labscheduler.engine;

import com.labscheduler.domain.SolutionSnapshot;

import java.time.Duration;

/**
 * A solution reported while a run searches. The last update of a run has
 * {@code isFinal() == true}.
 */
public final class ProgressUpdate {

    private final long objective;
    private final SolutionSnapshot snapshot;
    private final Duration elapsed;
    private final boolean isFinal;

    public ProgressUpdate(long objective, SolutionSnapshot snapshot, Duration elapsed, boolean isFinal) {
        this.objective = objective;
        this.snapshot = snapshot;
        this.elapsed = elapsed;
        this.isFinal = isFinal;
    }

    /** Covered headcount of the snapshot. */
    public long getObjective() { return objective; }

    public SolutionSnapshot getSnapshot() { return snapshot; }

    public Duration getElapsed() { return elapsed; }

    public boolean isFinal() { return isFinal; }

    @Override
    public String toString() {
        return "Progress{objective=" + objective + ", elapsed=" + elapsed.toMillis() + "ms"
            + (isFinal ? ", final" : "") + "}";
    }
}
