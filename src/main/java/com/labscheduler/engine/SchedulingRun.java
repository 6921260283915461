package com.labscheduler.engine;

import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.solver.ConstraintSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Handle to one scheduling run started by {@link SearchOrchestrator}.
 */
public class SchedulingRun {

    private static final Logger log = LoggerFactory.getLogger(SchedulingRun.class);

    private final int id;
    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.IDLE);
    private final AtomicBoolean cancelled = new AtomicBoolean();
    private final CompletableFuture<AssignmentReport> outcome = new CompletableFuture<>();
    private volatile ConstraintSolver solver;
    private volatile RunState result;

    SchedulingRun(int id) {
        this.id = id;
    }

    void attach(ConstraintSolver solver) {
        this.solver = solver;
        if (cancelled.get()) {
            solver.terminateEarly();
        }
    }

    void transition(RunState next) {
        RunState previous = state.getAndSet(next);
        if (next.isOutcome()) {
            result = next;
        }
        log.info("Run {}: {} -> {}", id, previous, next);
    }

    /**
     * Asks the search to stop; the run then ends as {@link RunState#TIMED_OUT} with the
     * best solution found so far. No effect once the run has ended.
     */
    public void cancel() {
        if (state.get().isFinished() || !cancelled.compareAndSet(false, true)) {
            return;
        }
        log.info("Run {}: cancel requested", id);
        ConstraintSolver current = solver;
        if (current != null) {
            current.terminateEarly();
        }
    }

    /**
     * Waits at most {@code timeout} for the report.
     *
     * @return the report, or empty if the run is still going
     * @throws com.labscheduler.exception.SolverFailureException if the run failed
     */
    public Optional<AssignmentReport> await(Duration timeout) {
        try {
            return Optional.of(outcome.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw SearchOrchestrator.unwrap(e.getCause());
        }
    }

    public RunState state() {
        return state.get();
    }

    /** The outcome state (OPTIMAL, FEASIBLE, INFEASIBLE or TIMED_OUT), once known. */
    public Optional<RunState> result() {
        return Optional.ofNullable(result);
    }

    public CompletableFuture<AssignmentReport> outcome() {
        return outcome;
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public int getId() {
        return id;
    }
}
