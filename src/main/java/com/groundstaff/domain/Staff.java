package com.groundstaff.domain;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a staff member with their certifications and shifts.
 * This is a ProblemFact (not a PlanningEntity).
 */
public final class Staff {

    private final String id;
    private final String name;
    private final Set<String> certifications;
    private final List<Shift> shifts;

    public Staff(String id, String name, Set<String> certifications, List<Shift> shifts) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.certifications = Set.copyOf(certifications);
        this.shifts = List.copyOf(shifts);
    }

    /**
     * Available iff a single shift fully covers the window. Two back-to-back shifts
     * do not combine to cover a service that straddles them.
     */
    public boolean isAvailableFor(TimeWindow serviceWindow) {
        for (Shift shift : shifts) {
            if (shift.covers(serviceWindow)) {
                return true;
            }
        }
        return false;
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public Set<String> getCertifications() { return certifications; }
    public List<Shift> getShifts() { return shifts; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Staff) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Staff{" + id + (name.equals(id) ? "" : " " + name) + ", certs=" + certifications + "}";
    }
}
