package com.labscheduler.solver.timefold;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import ai.timefold.solver.core.api.solver.Solver;
import ai.timefold.solver.core.api.solver.SolverFactory;
import ai.timefold.solver.core.config.constructionheuristic.ConstructionHeuristicPhaseConfig;
import ai.timefold.solver.core.config.constructionheuristic.ConstructionHeuristicType;
import ai.timefold.solver.core.config.localsearch.LocalSearchPhaseConfig;
import ai.timefold.solver.core.config.localsearch.LocalSearchType;
import ai.timefold.solver.core.config.solver.EnvironmentMode;
import ai.timefold.solver.core.config.solver.SolverConfig;
import ai.timefold.solver.core.config.solver.termination.TerminationConfig;

import com.labscheduler.exception.SolverFailureException;
import com.labscheduler.solver.AbstractConstraintSolver;
import com.labscheduler.solver.BoolVar;
import com.labscheduler.solver.ImprovementListener;
import com.labscheduler.solver.LinearExpression;
import com.labscheduler.solver.SolverProgress;
import com.labscheduler.solver.SolverResult;
import com.labscheduler.solver.Termination;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link com.labscheduler.solver.ConstraintSolver} backed by Timefold Solver.
 *
 * Every boolean variable is a {@link BoolVariable} planning entity. Phases:
 * - Construction heuristic FIRST_FIT in variable creation order, hint value first
 * - Local search LATE_ACCEPTANCE
 *
 * The search ends at the objective upper bound (only when no balance objective is set,
 * since the soft level could still improve), after the time budget, after the
 * unimproved time limit, or on {@link #terminateEarly()}.
 */
public class TimefoldConstraintSolver extends AbstractConstraintSolver {

    private static final Logger log = LoggerFactory.getLogger(TimefoldConstraintSolver.class);

    private static final Duration DEFAULT_UNIMPROVED_LIMIT = Duration.ofSeconds(30);

    private volatile Solver<BooleanModelSolution> activeSolver;
    private volatile boolean cancelRequested;

    @Override
    public SolverResult solve(Duration timeBudget, ImprovementListener onImprovement) {
        long startNanos = System.nanoTime();
        ImprovementListener listener = onImprovement != null ? onImprovement : ImprovementListener.NONE;

        if (variables.isEmpty() || cancelRequested) {
            boolean[] none = new boolean[variables.size()];
            Termination termination = cancelRequested ? Termination.CANCELLED
                : reachedBound(0) ? Termination.BOUND_REACHED : Termination.CONVERGED;
            return new SolverResult(none, 0, 0, isFeasible(none), elapsedSince(startNanos), termination);
        }

        BooleanModelSolution problem = buildProblem();
        boolean stopAtBound = objectiveUpperBound != null && balanceGroups.isEmpty();
        BooleanModelSolution best;
        try {
            SolverFactory<BooleanModelSolution> solverFactory = SolverFactory.create(buildConfig(timeBudget, stopAtBound));
            Solver<BooleanModelSolution> solver = solverFactory.buildSolver();

            solver.addEventListener(event -> {
                // solve() clears any earlier terminateEarly(), so a cancel that arrived before
                // solving started takes effect at the first best-solution event
                if (cancelRequested) {
                    solver.terminateEarly();
                }
                HardMediumSoftLongScore score = event.getNewBestSolution().getScore();
                if (score == null || !score.isSolutionInitialized() || score.hardScore() < 0) {
                    return;
                }
                listener.onImprovement(new SolverProgress(
                    readValues(event.getNewBestSolution()),
                    score.mediumScore(),
                    -score.softScore(),
                    Duration.ofMillis(event.getTimeMillisSpent())));
            });

            activeSolver = solver;
            log.debug("Solving {} variables, {} constraints, budget {}", variables.size(), constraints.size(), timeBudget);
            best = solver.solve(problem);
        } catch (RuntimeException | LinkageError e) {
            throw new SolverFailureException("Timefold solver failed: " + e, e);
        } finally {
            activeSolver = null;
        }

        Duration elapsed = elapsedSince(startNanos);
        HardMediumSoftLongScore score = best.getScore();
        boolean[] values = readValues(best);
        boolean feasible = score != null && score.isSolutionInitialized() && score.hardScore() >= 0;
        long primary = objective.evaluate(values);
        long balance = balanceValue(values);

        Termination termination;
        if (cancelRequested) {
            termination = Termination.CANCELLED;
        } else if (stopAtBound && feasible && reachedBound(primary)) {
            termination = Termination.BOUND_REACHED;
        } else if (timeBudget != null && elapsed.compareTo(timeBudget) >= 0) {
            termination = Termination.TIME_BUDGET;
        } else {
            termination = Termination.CONVERGED;
        }
        log.debug("Timefold finished: score={}, termination={}, elapsed={}ms", score, termination, elapsed.toMillis());
        return new SolverResult(values, primary, balance, feasible, elapsed, termination);
    }

    @Override
    public void terminateEarly() {
        cancelRequested = true;
        Solver<BooleanModelSolution> solver = activeSolver;
        if (solver != null) {
            solver.terminateEarly();
        }
    }

    BooleanModelSolution buildProblem() {
        long[] weights = new long[variables.size()];
        for (LinearExpression.Term term : objective.getTerms()) {
            weights[term.var().getIndex()] += term.coefficient();
        }
        List<BoolVariable> entities = new ArrayList<>(variables.size());
        for (BoolVar var : variables) {
            entities.add(new BoolVariable(var.getIndex(), var.getName(), weights[var.getIndex()], var.getHint()));
        }

        List<LinearBound> bounds = new ArrayList<>(constraints.size());
        List<LinearTerm> terms = new ArrayList<>();
        for (LinearConstraint constraint : constraints) {
            LinearBound bound = new LinearBound(bounds.size(), constraint.label(), constraint.upperBound());
            bounds.add(bound);
            for (LinearExpression.Term term : constraint.expression().getTerms()) {
                terms.add(new LinearTerm(bound, term.var().getIndex(), term.coefficient()));
            }
        }

        List<BalanceTerm> balanceTerms = new ArrayList<>();
        for (int group = 0; group < balanceGroups.size(); group++) {
            for (LinearExpression.Term term : balanceGroups.get(group).getTerms()) {
                balanceTerms.add(new BalanceTerm(group, term.var().getIndex(), term.coefficient()));
            }
        }
        return new BooleanModelSolution(entities, bounds, terms, balanceTerms);
    }

    private SolverConfig buildConfig(Duration timeBudget, boolean stopAtBound) {
        TerminationConfig termination = new TerminationConfig()
            .withUnimprovedSpentLimit(unimprovedTimeLimit != null ? unimprovedTimeLimit : DEFAULT_UNIMPROVED_LIMIT);
        if (timeBudget != null) {
            termination.setSpentLimit(timeBudget);
        }
        if (stopAtBound) {
            termination.setBestScoreLimit("0hard/" + objectiveUpperBound + "medium/0soft");
        }

        return new SolverConfig()
            .withSolutionClass(BooleanModelSolution.class)
            .withEntityClasses(BoolVariable.class)
            .withConstraintProviderClass(BooleanModelConstraintProvider.class)
            .withEnvironmentMode(EnvironmentMode.REPRODUCIBLE)
            .withRandomSeed(randomSeed)
            .withPhases(
                new ConstructionHeuristicPhaseConfig()
                    .withConstructionHeuristicType(ConstructionHeuristicType.FIRST_FIT),
                new LocalSearchPhaseConfig()
                    .withLocalSearchType(LocalSearchType.LATE_ACCEPTANCE))
            .withTerminationConfig(termination);
    }

    private boolean[] readValues(BooleanModelSolution solution) {
        boolean[] values = new boolean[variables.size()];
        for (BoolVariable v : solution.getVariables()) {
            values[v.getId()] = v.isSelected();
        }
        return values;
    }

    private boolean reachedBound(long primary) {
        return objectiveUpperBound != null && primary >= objectiveUpperBound;
    }

    private static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }
}
