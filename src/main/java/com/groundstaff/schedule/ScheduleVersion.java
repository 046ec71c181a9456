package com.groundstaff.schedule;

import com.groundstaff.model.AssignmentKey;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of committed assignments.
 */
public final class ScheduleVersion {

    private final int number;
    private final LocalDateTime cutoff;
    private final Map<AssignmentKey, Boolean> assignments;
    private final Map<String, LocalDateTime> departures;

    ScheduleVersion(int number, LocalDateTime cutoff, Map<AssignmentKey, Boolean> assignments,
                    Map<String, LocalDateTime> departures) {
        this.number = number;
        this.cutoff = cutoff;
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.departures = Collections.unmodifiableMap(new LinkedHashMap<>(departures));
    }

    static ScheduleVersion initial() {
        return new ScheduleVersion(0, null, Map.of(), Map.of());
    }

    /** Committed value, or empty when the key was not part of any solved model kept in this version. */
    public Optional<Boolean> committed(AssignmentKey key) {
        return Optional.ofNullable(assignments.get(key));
    }

    public Optional<Boolean> committed(String flightNumber, String serviceId, String staffId) {
        return committed(new AssignmentKey(flightNumber, serviceId, staffId));
    }

    public List<AssignmentKey> assignedKeys() {
        List<AssignmentKey> result = new ArrayList<>();
        for (Map.Entry<AssignmentKey, Boolean> e : assignments.entrySet()) {
            if (e.getValue()) {
                result.add(e.getKey());
            }
        }
        return result;
    }

    /** Entries of one flight, in commit order. */
    public Map<AssignmentKey, Boolean> entriesOf(String flightNumber) {
        Map<AssignmentKey, Boolean> result = new LinkedHashMap<>();
        for (Map.Entry<AssignmentKey, Boolean> e : assignments.entrySet()) {
            if (e.getKey().getFlightNumber().equals(flightNumber)) {
                result.put(e.getKey(), e.getValue());
            }
        }
        return result;
    }

    public Optional<LocalDateTime> departureOf(String flightNumber) {
        return Optional.ofNullable(departures.get(flightNumber));
    }

    public int getNumber() { return number; }
    /** Cutoff of the commit that produced this version, null for the initial empty version. */
    public LocalDateTime getCutoff() { return cutoff; }
    public Map<AssignmentKey, Boolean> getAssignments() { return assignments; }
    public Map<String, LocalDateTime> getDepartures() { return departures; }

    @Override
    public String toString() {
        return "ScheduleVersion{" + number + ", cutoff=" + cutoff + ", " + departures.size() + " flights, "
                + assignedKeys().size() + "/" + assignments.size() + " assigned}";
    }
}
