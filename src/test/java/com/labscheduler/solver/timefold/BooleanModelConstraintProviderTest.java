package com.labscheduler.solver.timefold;

import ai.timefold.solver.test.api.score.stream.ConstraintVerifier;
import org.junit.jupiter.api.Test;

class BooleanModelConstraintProviderTest {

    private final ConstraintVerifier<BooleanModelConstraintProvider, BooleanModelSolution> constraintVerifier =
        ConstraintVerifier.build(new BooleanModelConstraintProvider(), BooleanModelSolution.class, BoolVariable.class);

    @Test
    void boundExcessIsPenalized() {
        BoolVariable x0 = new BoolVariable(0, "x0", 1, true, true);
        BoolVariable x1 = new BoolVariable(1, "x1", 1, true, true);
        BoolVariable x2 = new BoolVariable(2, "x2", 1, true, false);
        LinearBound coverage = new LinearBound(0, "coverage", 1);

        constraintVerifier.verifyThat(BooleanModelConstraintProvider::linearBound)
            .given(x0, x1, x2,
                new LinearTerm(coverage, 0, 1), new LinearTerm(coverage, 1, 1), new LinearTerm(coverage, 2, 1))
            .penalizesBy(1);
    }

    @Test
    void weightedExcessCountsMinutes() {
        BoolVariable x0 = new BoolVariable(0, "x0", 1, true, true);
        BoolVariable x1 = new BoolVariable(1, "x1", 1, true, true);
        LinearBound daily = new LinearBound(0, "daily", 120);

        constraintVerifier.verifyThat(BooleanModelConstraintProvider::linearBound)
            .given(x0, x1, new LinearTerm(daily, 0, 90), new LinearTerm(daily, 1, 60))
            .penalizesBy(30);
    }

    @Test
    void boundWithinLimitIsNotPenalized() {
        BoolVariable x0 = new BoolVariable(0, "x0", 1, true, true);
        BoolVariable x1 = new BoolVariable(1, "x1", 1, true, false);
        LinearBound coverage = new LinearBound(0, "coverage", 1);

        constraintVerifier.verifyThat(BooleanModelConstraintProvider::linearBound)
            .given(x0, x1, new LinearTerm(coverage, 0, 1), new LinearTerm(coverage, 1, 1))
            .penalizesBy(0);
    }

    @Test
    void slotWithoutItsLabIndicatorIsPenalized() {
        // x - y <= 0
        BoolVariable y = new BoolVariable(0, "y", 0, true, false);
        BoolVariable x = new BoolVariable(1, "x", 1, true, true);
        LinearBound link = new LinearBound(0, "link", 0);

        constraintVerifier.verifyThat(BooleanModelConstraintProvider::linearBound)
            .given(y, x, new LinearTerm(link, 0, -1), new LinearTerm(link, 1, 1))
            .penalizesBy(1);
    }

    @Test
    void openLabWithoutSlotsIsAllowed() {
        BoolVariable y = new BoolVariable(0, "y", 0, true, true);
        BoolVariable x = new BoolVariable(1, "x", 1, true, false);
        LinearBound link = new LinearBound(0, "link", 0);

        constraintVerifier.verifyThat(BooleanModelConstraintProvider::linearBound)
            .given(y, x, new LinearTerm(link, 0, -1), new LinearTerm(link, 1, 1))
            .penalizesBy(0);
    }

    @Test
    void selectedVariablesRewardTheirWeight() {
        constraintVerifier.verifyThat(BooleanModelConstraintProvider::objectiveReward)
            .given(new BoolVariable(0, "x0", 1, true, true),
                new BoolVariable(1, "x1", 2, true, true),
                new BoolVariable(2, "x2", 5, true, false),
                new BoolVariable(3, "y", 0, true, true))
            .rewardsWith(3);
    }

    @Test
    void negativeWeightsArePenalized() {
        constraintVerifier.verifyThat(BooleanModelConstraintProvider::objectivePenalty)
            .given(new BoolVariable(0, "x0", -3, false, true),
                new BoolVariable(1, "x1", 4, true, true))
            .penalizesBy(3);
    }

    @Test
    void balancePenalizesSquaredGroupTotals() {
        BoolVariable a1 = new BoolVariable(0, "a1", 1, true, true);
        BoolVariable a2 = new BoolVariable(1, "a2", 1, true, true);
        BoolVariable b1 = new BoolVariable(2, "b1", 1, true, true);
        BoolVariable b2 = new BoolVariable(3, "b2", 1, true, false);

        // group 0: 2 + 3, group 1: 1
        constraintVerifier.verifyThat(BooleanModelConstraintProvider::balance)
            .given(a1, a2, b1, b2,
                new BalanceTerm(0, 0, 2), new BalanceTerm(0, 1, 3),
                new BalanceTerm(1, 2, 1), new BalanceTerm(1, 3, 1))
            .penalizesBy(26);
    }
}
