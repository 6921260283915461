package com.labscheduler.solver;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Model storage shared by {@link ConstraintSolver} backends. Subclasses translate
 * the stored model into their own representation in {@link #solve}.
 */
public abstract class AbstractConstraintSolver implements ConstraintSolver {

    protected final List<BoolVar> variables = new ArrayList<>();
    protected final List<LinearConstraint> constraints = new ArrayList<>();
    protected LinearExpression objective = new LinearExpression();
    protected List<LinearExpression> balanceGroups = List.of();
    protected Long objectiveUpperBound;
    protected long randomSeed;
    protected Duration unimprovedTimeLimit;

    @Override
    public BoolVar addBoolVar(String name) {
        return addBoolVar(name, false);
    }

    @Override
    public BoolVar addBoolVar(String name, boolean hint) {
        BoolVar var = new BoolVar(variables.size(), name, hint);
        variables.add(var);
        return var;
    }

    @Override
    public void addLinearConstraint(String label, LinearExpression expr, long upperBound) {
        if (upperBound < 0) {
            throw new IllegalArgumentException("Constraint '" + label + "' has a negative upper bound " + upperBound);
        }
        checkOwned(expr);
        constraints.add(new LinearConstraint(label, expr, upperBound));
    }

    @Override
    public void setObjective(LinearExpression expr) {
        checkOwned(expr);
        this.objective = expr;
    }

    @Override
    public void setBalanceObjective(List<LinearExpression> groups) {
        groups.forEach(this::checkOwned);
        this.balanceGroups = List.copyOf(groups);
    }

    @Override
    public void setObjectiveUpperBound(long bound) {
        this.objectiveUpperBound = bound;
    }

    @Override
    public void setRandomSeed(long seed) {
        this.randomSeed = seed;
    }

    @Override
    public void setUnimprovedTimeLimit(Duration limit) {
        this.unimprovedTimeLimit = limit;
    }

    @Override
    public int getVariableCount() {
        return variables.size();
    }

    public List<BoolVar> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public List<LinearConstraint> getConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    public LinearExpression getObjective() {
        return objective;
    }

    public List<LinearExpression> getBalanceGroups() {
        return balanceGroups;
    }

    public Long getObjectiveUpperBound() {
        return objectiveUpperBound;
    }

    /** True when every constraint holds for the assignment. */
    public boolean isFeasible(boolean[] values) {
        for (LinearConstraint c : constraints) {
            if (c.expression().evaluate(values) > c.upperBound()) {
                return false;
            }
        }
        return true;
    }

    public long balanceValue(boolean[] values) {
        long total = 0;
        for (LinearExpression group : balanceGroups) {
            long v = group.evaluate(values);
            total += v * v;
        }
        return total;
    }

    private void checkOwned(LinearExpression expr) {
        for (LinearExpression.Term term : expr.getTerms()) {
            int index = term.var().getIndex();
            if (index >= variables.size() || variables.get(index) != term.var()) {
                throw new IllegalArgumentException("Variable '" + term.var().getName() + "' belongs to another model");
            }
        }
    }

    /** {@code expression <= upperBound}. */
    public static final class LinearConstraint {
        private final String label;
        private final LinearExpression expression;
        private final long upperBound;

        LinearConstraint(String label, LinearExpression expression, long upperBound) {
            this.label = label;
            this.expression = expression;
            this.upperBound = upperBound;
        }

        public String label() { return label; }

        public LinearExpression expression() { return expression; }

        public long upperBound() { return upperBound; }

        @Override
        public String toString() {
            return label + ": " + expression + " <= " + upperBound;
        }
    }
}
