package com.labscheduler.solver.timefold;

import ai.timefold.solver.core.api.domain.solution.PlanningEntityCollectionProperty;
import ai.timefold.solver.core.api.domain.solution.PlanningScore;
import ai.timefold.solver.core.api.domain.solution.PlanningSolution;
import ai.timefold.solver.core.api.domain.solution.ProblemFactCollectionProperty;
import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Planning solution of the linear model.
 *
 * HARD: linear constraint violations (must be 0)
 * MEDIUM: primary objective
 * SOFT: negated balance penalty
 */
@PlanningSolution
public class BooleanModelSolution {

    @ProblemFactCollectionProperty
    private List<LinearBound> bounds = new ArrayList<>();

    @ProblemFactCollectionProperty
    private List<LinearTerm> terms = new ArrayList<>();

    @ProblemFactCollectionProperty
    private List<BalanceTerm> balanceTerms = new ArrayList<>();

    @PlanningEntityCollectionProperty
    private List<BoolVariable> variables = new ArrayList<>();

    @PlanningScore
    private HardMediumSoftLongScore score;

    public BooleanModelSolution() {}

    public BooleanModelSolution(List<BoolVariable> variables, List<LinearBound> bounds, List<LinearTerm> terms,
                                List<BalanceTerm> balanceTerms) {
        this.variables = variables;
        this.bounds = bounds;
        this.terms = terms;
        this.balanceTerms = balanceTerms;
    }

    public List<LinearBound> getBounds() { return bounds; }
    public void setBounds(List<LinearBound> bounds) { this.bounds = bounds; }

    public List<LinearTerm> getTerms() { return terms; }
    public void setTerms(List<LinearTerm> terms) { this.terms = terms; }

    public List<BalanceTerm> getBalanceTerms() { return balanceTerms; }
    public void setBalanceTerms(List<BalanceTerm> balanceTerms) { this.balanceTerms = balanceTerms; }

    public List<BoolVariable> getVariables() { return variables; }
    public void setVariables(List<BoolVariable> variables) { this.variables = variables; }

    public HardMediumSoftLongScore getScore() { return score; }
    public void setScore(HardMediumSoftLongScore score) { this.score = score; }
}
