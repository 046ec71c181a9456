package com.groundstaff.engine;

import com.groundstaff.domain.Flight;
import com.groundstaff.domain.Staff;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A validated disruption: the current time and what became invalid. Rescheduled flights
 * replace the flight records with the same number; added staff join the roster.
 */
public final class DisruptionEvent {

    private final String description;
    private final LocalDateTime currentTime;
    private final Set<String> invalidFlights;
    private final Set<String> invalidServices;
    private final Set<String> invalidStaff;
    private final List<Flight> rescheduledFlights;
    private final List<Staff> addedStaff;

    private DisruptionEvent(Builder b) {
        this.description = b.description;
        this.currentTime = Objects.requireNonNull(b.currentTime, "currentTime");
        this.invalidFlights = Set.copyOf(b.invalidFlights);
        this.invalidServices = Set.copyOf(b.invalidServices);
        this.invalidStaff = Set.copyOf(b.invalidStaff);
        this.rescheduledFlights = List.copyOf(b.rescheduledFlights);
        this.addedStaff = List.copyOf(b.addedStaff);
    }

    public static Builder at(LocalDateTime currentTime) {
        return new Builder(currentTime);
    }

    public boolean isRescheduled(String flightNumber) {
        for (Flight f : rescheduledFlights) {
            if (f.getNumber().equals(flightNumber)) {
                return true;
            }
        }
        return false;
    }

    public String getDescription() { return description; }
    public LocalDateTime getCurrentTime() { return currentTime; }
    public Set<String> getInvalidFlights() { return invalidFlights; }
    public Set<String> getInvalidServices() { return invalidServices; }
    public Set<String> getInvalidStaff() { return invalidStaff; }
    public List<Flight> getRescheduledFlights() { return rescheduledFlights; }
    public List<Staff> getAddedStaff() { return addedStaff; }

    @Override
    public String toString() {
        return "DisruptionEvent{" + (description != null ? description + ", " : "") + "at=" + currentTime
                + (invalidFlights.isEmpty() ? "" : ", flights=" + invalidFlights)
                + (invalidServices.isEmpty() ? "" : ", services=" + invalidServices)
                + (invalidStaff.isEmpty() ? "" : ", staff=" + invalidStaff)
                + (rescheduledFlights.isEmpty() ? "" : ", rescheduled=" + rescheduledFlights)
                + (addedStaff.isEmpty() ? "" : ", added=" + addedStaff.size()) + "}";
    }

    public static final class Builder {
        private final LocalDateTime currentTime;
        private String description;
        private final Set<String> invalidFlights = new LinkedHashSet<>();
        private final Set<String> invalidServices = new LinkedHashSet<>();
        private final Set<String> invalidStaff = new LinkedHashSet<>();
        private final List<Flight> rescheduledFlights = new ArrayList<>();
        private final List<Staff> addedStaff = new ArrayList<>();

        private Builder(LocalDateTime currentTime) {
            this.currentTime = currentTime;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder invalidFlights(String... numbers) {
            invalidFlights.addAll(List.of(numbers));
            return this;
        }

        public Builder invalidServices(String... serviceIds) {
            invalidServices.addAll(List.of(serviceIds));
            return this;
        }

        public Builder invalidStaff(String... staffIds) {
            invalidStaff.addAll(List.of(staffIds));
            return this;
        }

        public Builder rescheduled(Flight flight) {
            rescheduledFlights.add(flight);
            return this;
        }

        public Builder addStaff(Staff staff) {
            addedStaff.add(staff);
            return this;
        }

        public DisruptionEvent build() {
            return new DisruptionEvent(this);
        }
    }
}
