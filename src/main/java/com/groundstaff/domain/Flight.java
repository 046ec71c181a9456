package com.groundstaff.domain;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A turnaround: arrival and departure at a bay, with the ordered services it requires.
 */
public final class Flight {

    private final String number;
    private final LocalDateTime arrival;
    private final LocalDateTime departure;
    private final String bay;
    private final List<FlightService> services;

    public Flight(String number, LocalDateTime arrival, LocalDateTime departure, String bay,
                  List<FlightService> services) {
        this.number = Objects.requireNonNull(number, "number");
        this.arrival = Objects.requireNonNull(arrival, "arrival");
        this.departure = Objects.requireNonNull(departure, "departure");
        if (departure.isBefore(arrival)) {
            throw new IllegalArgumentException("Flight " + number + " departs before it arrives");
        }
        this.bay = bay;
        this.services = List.copyOf(services);
        Set<String> seen = new HashSet<>();
        for (FlightService fs : this.services) {
            if (!seen.add(fs.getServiceId())) {
                throw new IllegalArgumentException("Flight " + number + " lists service " + fs.getServiceId() + " twice");
            }
        }
    }

    public TimeWindow serviceWindow(FlightService fs) {
        return new TimeWindow(fs.getStart().resolve(arrival, departure), fs.getEnd().resolve(arrival, departure));
    }

    public TimeWindow getTurnaround() {
        return new TimeWindow(arrival, departure);
    }

    public boolean departsAfter(LocalDateTime instant) {
        return departure.isAfter(instant);
    }

    /** Copy with new times, as produced by a delay. Services and bay stay the same. */
    public Flight reschedule(LocalDateTime newArrival, LocalDateTime newDeparture) {
        return new Flight(number, newArrival, newDeparture, bay, services);
    }

    /** Copy without the given services, or this flight when none of them is listed. */
    public Flight withoutServices(Set<String> serviceIds) {
        List<FlightService> kept = new ArrayList<>();
        for (FlightService fs : services) {
            if (!serviceIds.contains(fs.getServiceId())) {
                kept.add(fs);
            }
        }
        return kept.size() == services.size() ? this : new Flight(number, arrival, departure, bay, kept);
    }

    public String getNumber() { return number; }
    public LocalDateTime getArrival() { return arrival; }
    public LocalDateTime getDeparture() { return departure; }
    public String getBay() { return bay; }
    public List<FlightService> getServices() { return services; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Flight flight = (Flight) o;
        return number.equals(flight.number) && arrival.equals(flight.arrival)
                && departure.equals(flight.departure) && Objects.equals(bay, flight.bay)
                && services.equals(flight.services);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, arrival, departure);
    }

    @Override
    public String toString() {
        return "Flight{" + number + " " + arrival.toLocalTime() + "-" + departure.toLocalTime()
                + (bay != null ? " @" + bay : "") + "}";
    }
}
