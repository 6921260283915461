package com.labscheduler.solver;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Weighted sum of boolean variables. Mutable while a model is being built.
 */
public final class LinearExpression {

    private final List<Term> terms = new ArrayList<>();

    public static LinearExpression sum(Collection<BoolVar> vars) {
        LinearExpression expr = new LinearExpression();
        vars.forEach(v -> expr.add(v, 1));
        return expr;
    }

    public LinearExpression add(BoolVar var, long coefficient) {
        if (coefficient != 0) {
            terms.add(new Term(var, coefficient));
        }
        return this;
    }

    public LinearExpression add(BoolVar var) {
        return add(var, 1);
    }

    /** Value of this expression for the given assignment (indexed by {@link BoolVar#getIndex()}). */
    public long evaluate(boolean[] values) {
        long total = 0;
        for (Term term : terms) {
            if (values[term.var().getIndex()]) {
                total += term.coefficient();
            }
        }
        return total;
    }

    /** Largest value this expression can take. */
    public long maxValue() {
        return terms.stream().mapToLong(t -> Math.max(0, t.coefficient())).sum();
    }

    public boolean isEmpty() {
        return terms.isEmpty();
    }

    public List<Term> getTerms() {
        return Collections.unmodifiableList(terms);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Term t : terms) {
            if (sb.length() > 0) sb.append(t.coefficient() < 0 ? " - " : " + ");
            else if (t.coefficient() < 0) sb.append('-');
            long abs = Math.abs(t.coefficient());
            if (abs != 1) sb.append(abs).append('*');
            sb.append(t.var().getName());
        }
        return sb.length() == 0 ? "0" : sb.toString();
    }

    public static final class Term {
        private final BoolVar var;
        private final long coefficient;

        Term(BoolVar var, long coefficient) {
            this.var = var;
            this.coefficient = coefficient;
        }

        public BoolVar var() { return var; }

        public long coefficient() { return coefficient; }
    }
}
