package com.groundstaff.schedule;

import com.groundstaff.model.AssignmentKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Holds the authoritative committed schedule.
 *
 * Readers take the current version through a volatile reference and never observe a partial
 * commit. Commits are serialized. Only the version before the current one is retained, as the
 * hint source for the next incremental build.
 */
public class ScheduleStore {

    private static final Logger log = LoggerFactory.getLogger(ScheduleStore.class);

    private volatile ScheduleVersion current = ScheduleVersion.initial();
    private volatile ScheduleVersion previous;

    /**
     * Replaces everything after the cutoff with the new assignments and keeps entries of flights
     * departing at or before the cutoff unchanged. Earlier future entries that the new set does
     * not mention become unknown.
     *
     * @param departures departure of every flight the new assignments belong to
     * @throws IllegalArgumentException if a key belongs to a flight departing at or before the
     *                                  cutoff, or the cutoff moves backwards
     */
    public synchronized ScheduleVersion commit(Map<AssignmentKey, Boolean> newAssignments,
                                               Map<String, LocalDateTime> departures,
                                               LocalDateTime cutoff) {
        Objects.requireNonNull(newAssignments, "newAssignments");
        Objects.requireNonNull(departures, "departures");
        Objects.requireNonNull(cutoff, "cutoff");
        ScheduleVersion base = current;
        if (base.getCutoff() != null && cutoff.isBefore(base.getCutoff())) {
            throw new IllegalArgumentException("Cutoff " + cutoff + " is before committed cutoff " + base.getCutoff());
        }
        for (AssignmentKey key : newAssignments.keySet()) {
            LocalDateTime departure = departures.get(key.getFlightNumber());
            if (departure == null) {
                throw new IllegalArgumentException("No departure given for flight of " + key);
            }
            if (!departure.isAfter(cutoff)) {
                throw new IllegalArgumentException("Cannot commit " + key + ": flight departs at " + departure
                        + ", not after cutoff " + cutoff);
            }
        }

        Map<AssignmentKey, Boolean> merged = new LinkedHashMap<>();
        Map<String, LocalDateTime> mergedDepartures = new LinkedHashMap<>();
        int carried = 0;
        for (Map.Entry<AssignmentKey, Boolean> e : base.getAssignments().entrySet()) {
            String flight = e.getKey().getFlightNumber();
            LocalDateTime oldDeparture = base.getDepartures().get(flight);
            if (!departures.containsKey(flight) && oldDeparture != null && !oldDeparture.isAfter(cutoff)) {
                merged.put(e.getKey(), e.getValue());
                mergedDepartures.put(flight, oldDeparture);
                carried++;
            }
        }
        merged.putAll(newAssignments);
        for (Map.Entry<String, LocalDateTime> e : departures.entrySet()) {
            if (e.getValue().isAfter(cutoff)) {
                mergedDepartures.put(e.getKey(), e.getValue());
            }
        }

        ScheduleVersion next = new ScheduleVersion(base.getNumber() + 1, cutoff, merged, mergedDepartures);
        previous = base;
        current = next;
        log.info("Committed schedule version {} at cutoff {}: {} new entries, {} carried from past flights",
                next.getNumber(), cutoff, newAssignments.size(), carried);
        return next;
    }

    public ScheduleVersion current() {
        return current;
    }

    /** The version replaced by the last commit, if any. */
    public Optional<ScheduleVersion> previous() {
        return Optional.ofNullable(previous);
    }

    public int version() {
        return current.getNumber();
    }

    public Optional<Boolean> committed(AssignmentKey key) {
        return current.committed(key);
    }

    public Optional<Boolean> committed(String flightNumber, String serviceId, String staffId) {
        return current.committed(flightNumber, serviceId, staffId);
    }

    public Optional<FlightAllocation> allocation(String flightNumber) {
        ScheduleVersion v = current;
        return v.departureOf(flightNumber).map(departure -> toAllocation(v, flightNumber, departure));
    }

    /** Allocation of every flight in the current version, ordered by departure. */
    public List<FlightAllocation> allocations() {
        ScheduleVersion v = current;
        List<Map.Entry<String, LocalDateTime>> flights = new ArrayList<>(v.getDepartures().entrySet());
        flights.sort(Map.Entry.<String, LocalDateTime>comparingByValue().thenComparing(Map.Entry.<String, LocalDateTime>comparingByKey()));
        List<FlightAllocation> result = new ArrayList<>();
        for (Map.Entry<String, LocalDateTime> e : flights) {
            result.add(toAllocation(v, e.getKey(), e.getValue()));
        }
        return result;
    }

    private static FlightAllocation toAllocation(ScheduleVersion v, String flightNumber, LocalDateTime departure) {
        Map<String, List<String>> byService = new LinkedHashMap<>();
        for (Map.Entry<AssignmentKey, Boolean> e : v.entriesOf(flightNumber).entrySet()) {
            List<String> staff = byService.computeIfAbsent(e.getKey().getServiceId(), k -> new ArrayList<>());
            if (e.getValue()) {
                staff.add(e.getKey().getStaffId());
            }
        }
        return new FlightAllocation(flightNumber, departure, byService);
    }
}
