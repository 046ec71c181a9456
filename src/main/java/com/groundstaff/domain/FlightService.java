package com.groundstaff.domain;

import java.util.Objects;

/**
 * Occurrence of a catalog service on one flight, with its required staffing count and
 * start/end relative to the flight's arrival or departure.
 */
public final class FlightService {

    private final String serviceId;
    private final int count;
    private final RelativeTime start;
    private final RelativeTime end;

    public FlightService(String serviceId, int count, RelativeTime start, RelativeTime end) {
        this.serviceId = Objects.requireNonNull(serviceId, "serviceId");
        if (count < 1) {
            throw new IllegalArgumentException("Staff count must be at least 1 for service " + serviceId);
        }
        this.count = count;
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
    }

    public static FlightService of(String serviceId, String start, String end) {
        return new FlightService(serviceId, 1, RelativeTime.parse(start), RelativeTime.parse(end));
    }

    public String getServiceId() { return serviceId; }
    public int getCount() { return count; }
    public RelativeTime getStart() { return start; }
    public RelativeTime getEnd() { return end; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        FlightService that = (FlightService) o;
        return count == that.count && serviceId.equals(that.serviceId)
                && start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(serviceId, count, start, end);
    }

    @Override
    public String toString() {
        return serviceId + "x" + count + " " + start + ".." + end;
    }
}
