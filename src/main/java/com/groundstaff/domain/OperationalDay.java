package com.groundstaff.domain;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Read-only reference data for one day of operations: service catalog, flights, roster and bays.
 * Derivations (delays, cancellations, extra staff) return new instances.
 */
public final class OperationalDay {

    private final LocalDate date;
    private final Map<String, Service> services;
    private final Map<String, Flight> flights;
    private final Map<String, Staff> staff;
    private final Map<String, Bay> bays;

    public OperationalDay(LocalDate date, Collection<Service> services, Collection<Flight> flights,
                          Collection<Staff> roster, Collection<Bay> bays) {
        this.date = Objects.requireNonNull(date, "date");
        this.services = index(services, Service::getId, "service");
        this.flights = index(flights, Flight::getNumber, "flight");
        this.staff = index(roster, Staff::getId, "staff");
        this.bays = index(bays, Bay::getNumber, "bay");
        for (Flight flight : this.flights.values()) {
            for (FlightService fs : flight.getServices()) {
                if (!this.services.containsKey(fs.getServiceId())) {
                    throw new IllegalArgumentException("Flight " + flight.getNumber()
                            + " requires unknown service " + fs.getServiceId());
                }
            }
        }
    }

    private static <T> Map<String, T> index(Collection<T> items, Function<T, String> key, String kind) {
        Map<String, T> map = new LinkedHashMap<>();
        for (T item : items) {
            if (map.put(key.apply(item), item) != null) {
                throw new IllegalArgumentException("Duplicate " + kind + " id: " + key.apply(item));
            }
        }
        return Collections.unmodifiableMap(map);
    }

    // ========== Lookups ==========

    public Optional<Flight> findFlight(String number) {
        return Optional.ofNullable(flights.get(number));
    }

    public Service getService(String serviceId) {
        Service service = services.get(serviceId);
        if (service == null) {
            throw new IllegalArgumentException("Unknown service: " + serviceId);
        }
        return service;
    }

    public Optional<Staff> findStaff(String staffId) {
        return Optional.ofNullable(staff.get(staffId));
    }

    public List<Service> servicesOf(Flight flight) {
        List<Service> result = new ArrayList<>(flight.getServices().size());
        for (FlightService fs : flight.getServices()) {
            result.add(getService(fs.getServiceId()));
        }
        return result;
    }

    /**
     * Travel minutes between two bays. Looks up both directions, falls back to the default
     * when neither bay lists the other or a bay is unknown.
     */
    public int travelMinutes(String fromBay, String toBay, int defaultMinutes) {
        if (fromBay == null || toBay == null) {
            return defaultMinutes;
        }
        if (fromBay.equals(toBay)) {
            return 0;
        }
        Bay from = bays.get(fromBay);
        if (from != null && from.travelTimeTo(toBay) != null) {
            return from.travelTimeTo(toBay);
        }
        Bay to = bays.get(toBay);
        if (to != null && to.travelTimeTo(fromBay) != null) {
            return to.travelTimeTo(fromBay);
        }
        return defaultMinutes;
    }

    // ========== Copy-on-write derivations ==========

    /** Replaces flights with the same number; unknown numbers are added. */
    public OperationalDay withFlights(Collection<Flight> replacements) {
        if (replacements.isEmpty()) {
            return this;
        }
        Map<String, Flight> copy = new LinkedHashMap<>(flights);
        for (Flight f : replacements) {
            copy.put(f.getNumber(), f);
        }
        return new OperationalDay(date, services.values(), copy.values(), staff.values(), bays.values());
    }

    public OperationalDay withoutFlights(Set<String> numbers) {
        if (numbers.isEmpty()) {
            return this;
        }
        List<Flight> kept = new ArrayList<>();
        for (Flight f : flights.values()) {
            if (!numbers.contains(f.getNumber())) {
                kept.add(f);
            }
        }
        return new OperationalDay(date, services.values(), kept, staff.values(), bays.values());
    }

    /** Adds staff, replacing roster entries with the same id. */
    public OperationalDay withStaff(Collection<Staff> added) {
        if (added.isEmpty()) {
            return this;
        }
        Map<String, Staff> copy = new LinkedHashMap<>(staff);
        for (Staff s : added) {
            copy.put(s.getId(), s);
        }
        return new OperationalDay(date, services.values(), flights.values(), copy.values(), bays.values());
    }

    // Getters
    public LocalDate getDate() { return date; }
    public Collection<Service> getServices() { return services.values(); }
    public Collection<Flight> getFlights() { return flights.values(); }
    public Collection<Staff> getRoster() { return staff.values(); }
    public Collection<Bay> getBays() { return bays.values(); }

    @Override
    public String toString() {
        return "OperationalDay{" + date + ", " + flights.size() + " flights, " + staff.size()
                + " staff, " + services.size() + " services}";
    }
}
