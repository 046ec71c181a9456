package com.groundstaff.model;

import java.util.Objects;

/**
 * Identity of one decision variable: "staff is assigned to service on flight".
 */
public final class AssignmentKey implements Comparable<AssignmentKey> {

    private final String flightNumber;
    private final String serviceId;
    private final String staffId;
    private final int hash;

    public AssignmentKey(String flightNumber, String serviceId, String staffId) {
        this.flightNumber = Objects.requireNonNull(flightNumber, "flightNumber");
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
        this.staffId = Objects.requireNonNull(staffId, "staffId");
        this.hash = Objects.hash(flightNumber, serviceId, staffId);
    }

    public String getFlightNumber() { return flightNumber; }
    public String getServiceId() { return serviceId; }
    public String getStaffId() { return staffId; }

    @Override
    public int compareTo(AssignmentKey o) {
        int c = flightNumber.compareTo(o.flightNumber);
        if (c != 0) return c;
        c = serviceId.compareTo(o.serviceId);
        if (c != 0) return c;
        return staffId.compareTo(o.staffId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        AssignmentKey that = (AssignmentKey) o;
        return hash == that.hash && flightNumber.equals(that.flightNumber)
                && serviceId.equals(that.serviceId) && staffId.equals(that.staffId);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return flightNumber + "/" + serviceId + "/" + staffId;
    }
}
