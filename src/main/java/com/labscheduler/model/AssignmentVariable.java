package com.labscheduler.model;

import com.labscheduler.domain.Slot;
import com.labscheduler.domain.StaffMember;
import com.labscheduler.solver.BoolVar;

/**
 * Decision "staff member works slot", for a pair that survived pruning.
 */
public final class AssignmentVariable {

    private final StaffMember staff;
    private final Slot slot;
    private final BoolVar var;

    AssignmentVariable(StaffMember staff, Slot slot, BoolVar var) {
        this.staff = staff;
        this.slot = slot;
        this.var = var;
    }

    public StaffMember getStaff() { return staff; }

    public Slot getSlot() { return slot; }

    public BoolVar getVar() { return var; }

    @Override
    public String toString() {
        return var.getName();
    }
}
