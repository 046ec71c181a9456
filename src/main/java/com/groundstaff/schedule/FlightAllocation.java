package com.groundstaff.schedule;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Read view of one flight's committed staffing: service id to assigned staff ids.
 */
public final class FlightAllocation {

    private final String flightNumber;
    private final LocalDateTime departure;
    private final Map<String, List<String>> staffByService;

    FlightAllocation(String flightNumber, LocalDateTime departure, Map<String, List<String>> staffByService) {
        this.flightNumber = flightNumber;
        this.departure = departure;
        this.staffByService = Collections.unmodifiableMap(staffByService);
    }

    public List<String> staffFor(String serviceId) {
        return staffByService.getOrDefault(serviceId, List.of());
    }

    public String getFlightNumber() { return flightNumber; }
    public LocalDateTime getDeparture() { return departure; }
    public Map<String, List<String>> getStaffByService() { return staffByService; }

    @Override
    public String toString() {
        return flightNumber + " " + staffByService;
    }
}
