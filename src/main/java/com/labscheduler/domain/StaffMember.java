package com.labscheduler.domain;

import com.labscheduler.exception.ConfigurationException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Objects;

/**
 * A staff member (teaching assistant) with the total number of hours they were hired for.
 * Immutable; the name is the identifier.
 */
public final class StaffMember {

    private final String name;
    private final BigDecimal hoursHired;

    public StaffMember(String name, BigDecimal hoursHired) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Staff member name must not be blank");
        }
        if (hoursHired == null || hoursHired.signum() < 0) {
            throw new ConfigurationException("Hired hours of '" + name.trim() + "' must be a non-negative number");
        }
        this.name = name.trim();
        this.hoursHired = hoursHired;
    }

    public StaffMember(String name, double hoursHired) {
        this(name, BigDecimal.valueOf(hoursHired));
    }

    /** Hired hours as whole minutes, rounded down. */
    public long getHiredMinutes() {
        return hoursHired.multiply(BigDecimal.valueOf(60)).setScale(0, RoundingMode.FLOOR).longValueExact();
    }

    public String getName() { return name; }

    public BigDecimal getHoursHired() { return hoursHired; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StaffMember that)) return false;
        return name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return "Staff{" + name + ", hired=" + hoursHired.stripTrailingZeros().toPlainString() + "h}";
    }
}
