package com.labscheduler.solver.timefold;

/**
 * {@code weight * variable} inside one group of the balance objective.
 */
public class BalanceTerm {

    private final int groupId;
    private final int variableId;
    private final long weight;

    public BalanceTerm(int groupId, int variableId, long weight) {
        this.groupId = groupId;
        this.variableId = variableId;
        this.weight = weight;
    }

    public int getGroupId() { return groupId; }

    public int getVariableId() { return variableId; }

    public long getWeight() { return weight; }
}
