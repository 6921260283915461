package com.labscheduler.solver.timefold;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoftlong.HardMediumSoftLongScore;
import ai.timefold.solver.core.api.score.stream.Constraint;
import ai.timefold.solver.core.api.score.stream.ConstraintCollectors;
import ai.timefold.solver.core.api.score.stream.ConstraintFactory;
import ai.timefold.solver.core.api.score.stream.ConstraintProvider;
import ai.timefold.solver.core.api.score.stream.Joiners;

/**
 * Score of the boolean linear model.
 *
 * HARD: every {@code sum(coef * x) <= bound} constraint, penalized by its excess
 * MEDIUM: primary objective, maximized
 * SOFT: sum of squared balance group totals, minimized
 */
public class BooleanModelConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
            // HARD
            linearBound(factory),

            // MEDIUM
            objectiveReward(factory),
            objectivePenalty(factory),

            // SOFT
            balance(factory),
        };
    }

    /**
     * Groups the selected variables' terms per constraint. A constraint with no selected
     * term sums to 0 and always holds because bounds are non-negative.
     */
    Constraint linearBound(ConstraintFactory factory) {
        return factory.forEach(BoolVariable.class)
            .filter(BoolVariable::isSelected)
            .join(LinearTerm.class, Joiners.equal(BoolVariable::getId, LinearTerm::getVariableId))
            .groupBy((v, t) -> t.getBound(),
                ConstraintCollectors.sumLong((v, t) -> t.getCoefficient()))
            .filter((bound, total) -> total > bound.getUpperBound())
            .penalizeLong(HardMediumSoftLongScore.ONE_HARD,
                (bound, total) -> total - bound.getUpperBound())
            .asConstraint("Linear bound");
    }

    Constraint objectiveReward(ConstraintFactory factory) {
        return factory.forEach(BoolVariable.class)
            .filter(v -> v.isSelected() && v.getObjectiveWeight() > 0)
            .rewardLong(HardMediumSoftLongScore.ONE_MEDIUM, BoolVariable::getObjectiveWeight)
            .asConstraint("Objective");
    }

    Constraint objectivePenalty(ConstraintFactory factory) {
        return factory.forEach(BoolVariable.class)
            .filter(v -> v.isSelected() && v.getObjectiveWeight() < 0)
            .penalizeLong(HardMediumSoftLongScore.ONE_MEDIUM, v -> -v.getObjectiveWeight())
            .asConstraint("Objective (negative weights)");
    }

    Constraint balance(ConstraintFactory factory) {
        return factory.forEach(BoolVariable.class)
            .filter(BoolVariable::isSelected)
            .join(BalanceTerm.class, Joiners.equal(BoolVariable::getId, BalanceTerm::getVariableId))
            .groupBy((v, t) -> t.getGroupId(),
                ConstraintCollectors.sumLong((v, t) -> t.getWeight()))
            .penalizeLong(HardMediumSoftLongScore.ONE_SOFT, (group, total) -> total * total)
            .asConstraint("Balance");
    }
}
