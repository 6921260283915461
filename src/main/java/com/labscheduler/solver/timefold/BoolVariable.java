package com.labscheduler.solver.timefold;

import ai.timefold.solver.core.api.domain.entity.PlanningEntity;
import ai.timefold.solver.core.api.domain.lookup.PlanningId;
import ai.timefold.solver.core.api.domain.valuerange.ValueRangeProvider;
import ai.timefold.solver.core.api.domain.variable.PlanningVariable;

import java.util.List;

/**
 * One boolean decision variable of the linear model.
 *
 * The value range is entity-specific so that the hint is tried first by the
 * construction heuristic (FIRST_FIT keeps the first of equally scored values).
 */
@PlanningEntity
public class BoolVariable {

    private static final List<Boolean> TRUE_FIRST = List.of(Boolean.TRUE, Boolean.FALSE);
    private static final List<Boolean> FALSE_FIRST = List.of(Boolean.FALSE, Boolean.TRUE);

    @PlanningId
    private Integer id;

    private String name;

    // Coefficient of this variable in the primary objective
    private long objectiveWeight;

    private boolean hint;

    @PlanningVariable(valueRangeProviderRefs = "booleanRange")
    private Boolean value;

    public BoolVariable() {}

    public BoolVariable(int id, String name, long objectiveWeight, boolean hint) {
        this.id = id;
        this.name = name;
        this.objectiveWeight = objectiveWeight;
        this.hint = hint;
    }

    public BoolVariable(int id, String name, long objectiveWeight, boolean hint, Boolean value) {
        this(id, name, objectiveWeight, hint);
        this.value = value;
    }

    @ValueRangeProvider(id = "booleanRange")
    public List<Boolean> getBooleanRange() {
        return hint ? TRUE_FIRST : FALSE_FIRST;
    }

    public boolean isSelected() {
        return Boolean.TRUE.equals(value);
    }

    public Integer getId() { return id; }
    public void setId(Integer id) { this.id = id; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public long getObjectiveWeight() { return objectiveWeight; }
    public void setObjectiveWeight(long objectiveWeight) { this.objectiveWeight = objectiveWeight; }

    public boolean isHint() { return hint; }
    public void setHint(boolean hint) { this.hint = hint; }

    public Boolean getValue() { return value; }
    public void setValue(Boolean value) { this.value = value; }

    @Override
    public String toString() {
        return name + "=" + value;
    }
}
