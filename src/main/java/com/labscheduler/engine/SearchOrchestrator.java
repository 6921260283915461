package com.labscheduler.engine;

import com.labscheduler.config.SchedulerSettings;
import com.labscheduler.config.SecondaryObjective;
import com.labscheduler.domain.AssignmentReport;
import com.labscheduler.domain.SchedulingProblem;
import com.labscheduler.domain.SolutionSnapshot;
import com.labscheduler.exception.SchedulerException;
import com.labscheduler.exception.SolverFailureException;
import com.labscheduler.model.AssignmentModel;
import com.labscheduler.model.AssignmentModelBuilder;
import com.labscheduler.solver.ConstraintSolver;
import com.labscheduler.solver.ImprovementListener;
import com.labscheduler.solver.SolverResult;
import com.labscheduler.solver.Termination;
import com.labscheduler.solver.timefold.TimefoldConstraintSolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Runs scheduling searches.
 *
 * The model is built on the caller's thread, so configuration errors surface from
 * {@link #start}. The search then runs on a dedicated worker thread per run; runs share
 * no mutable state.
 */
public class SearchOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SearchOrchestrator.class);

    private static final AtomicInteger RUN_IDS = new AtomicInteger();

    private final Supplier<ConstraintSolver> solverFactory;

    public SearchOrchestrator() {
        this(TimefoldConstraintSolver::new);
    }

    /**
     * @param solverFactory creates a fresh solver for every run
     */
    public SearchOrchestrator(Supplier<ConstraintSolver> solverFactory) {
        this.solverFactory = solverFactory;
    }

    /**
     * Builds the model and starts the search in the background.
     *
     * @throws com.labscheduler.exception.ConfigurationException if the problem or settings
     *         cannot be modelled; no search is started then
     */
    public SchedulingRun start(SchedulingProblem problem, SchedulerSettings settings, ProgressListener listener) {
        SchedulingRun run = new SchedulingRun(RUN_IDS.incrementAndGet());
        ProgressListener progress = listener != null ? listener : ProgressListener.NONE;

        run.transition(RunState.BUILDING);
        ConstraintSolver solver = solverFactory.get();
        AssignmentModel model = new AssignmentModelBuilder(settings).build(problem, solver);
        Duration budget = settings.effectiveTimeBudget(solver.getVariableCount());
        run.attach(solver);

        ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "schedule-run-" + run.getId());
            thread.setDaemon(true);
            return thread;
        });
        run.transition(RunState.SEARCHING);
        log.info("Run {}: searching {} variables with a budget of {}s", run.getId(), solver.getVariableCount(),
            budget.toMillis() / 1000.0);
        executor.execute(() -> search(run, model, settings, budget, progress));
        executor.shutdown();
        return run;
    }

    /**
     * Blocking variant of {@link #start}.
     *
     * @throws SolverFailureException if the search fails
     */
    public AssignmentReport solve(SchedulingProblem problem, SchedulerSettings settings, ProgressListener listener) {
        SchedulingRun run = start(problem, settings, listener);
        try {
            return run.outcome().join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    private void search(SchedulingRun run, AssignmentModel model, SchedulerSettings settings, Duration budget,
                        ProgressListener listener) {
        AtomicLong bestObjective = new AtomicLong(Long.MIN_VALUE);
        ImprovementListener onImprovement = p -> {
            // Only solutions at least as good as the last one reported are forwarded
            if (p.getPrimary() < bestObjective.get()) {
                return;
            }
            bestObjective.set(p.getPrimary());
            log.debug("Run {}: improved to {} covered (balance {}) after {}ms",
                run.getId(), p.getPrimary(), p.getBalance(), p.getElapsed().toMillis());
            SolutionSnapshot snapshot = model.toSnapshot(p.getValues(), p.getBalance(), p.getElapsed());
            notify(run, listener, new ProgressUpdate(p.getPrimary(), snapshot, p.getElapsed(), false));
        };

        try {
            SolverResult result = model.getSolver().solve(budget, onImprovement);
            finish(run, model, settings, result, listener);
        } catch (Throwable e) {
            SolverFailureException failure = e instanceof SolverFailureException sfe
                ? sfe
                : new SolverFailureException("Search failed: " + e, e);
            log.error("Run {} failed", run.getId(), failure);
            run.transition(RunState.FAILED);
            run.outcome().completeExceptionally(failure);
            // The run is settled; VM errors still reach the thread's uncaught handler
            if (e instanceof VirtualMachineError vme) {
                throw vme;
            }
        }
    }

    private void finish(SchedulingRun run, AssignmentModel model, SchedulerSettings settings, SolverResult result,
                        ProgressListener listener) {
        SchedulingProblem problem = model.getProblem();
        boolean tieBreaker = settings.getSecondaryObjective() != SecondaryObjective.NONE;

        RunState terminal;
        SolutionSnapshot snapshot;
        boolean provenOptimal = false;
        if (!result.isFeasible()) {
            terminal = RunState.INFEASIBLE;
            snapshot = SolutionSnapshot.empty(problem.getSlots(), result.getElapsed());
        } else {
            snapshot = model.toSnapshot(result.getValues(), result.getBalance(), result.getElapsed());
            if (result.getPrimary() >= model.getCoverageUpperBound() && !tieBreaker) {
                terminal = RunState.OPTIMAL;
                provenOptimal = true;
            } else if (result.getTermination() == Termination.CANCELLED
                || result.getTermination() == Termination.TIME_BUDGET) {
                terminal = RunState.TIMED_OUT;
            } else {
                terminal = RunState.FEASIBLE;
            }
        }
        run.transition(terminal);

        AssignmentReport report = new ResultExtractor(settings).extract(problem, model, snapshot, terminal, provenOptimal);
        log.info("Run {}: {} - covered {}/{} positions (bound {}), {} gap(s), {}ms, stopped by {}",
            run.getId(), terminal, report.getTotalAssigned(), report.getTotalRequired(),
            model.getCoverageUpperBound(), report.getGaps().size(), result.getElapsed().toMillis(),
            result.getTermination());

        notify(run, listener, new ProgressUpdate(snapshot.getCoveredHeadcount(), snapshot, result.getElapsed(), true));
        run.transition(RunState.DONE);
        run.outcome().complete(report);
    }

    private static void notify(SchedulingRun run, ProgressListener listener, ProgressUpdate update) {
        try {
            listener.onProgress(update);
        } catch (RuntimeException e) {
            log.warn("Run {}: progress listener threw, continuing", run.getId(), e);
        }
    }

    static SchedulerException unwrap(Throwable cause) {
        if (cause instanceof SchedulerException se) {
            return se;
        }
        return new SolverFailureException("Search failed: " + cause.getMessage(), cause);
    }
}
