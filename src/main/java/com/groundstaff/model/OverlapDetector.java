package com.groundstaff.model;

import com.groundstaff.domain.Flight;
import com.groundstaff.domain.TimeWindow;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Finds pairs of flights whose activity windows overlap. Flights are sorted by window start and
 * each one is compared forward until the first flight that starts after it ends.
 */
public final class OverlapDetector {

    private OverlapDetector() {}

    public static final class FlightPair {
        private final Flight first;
        private final Flight second;

        FlightPair(Flight first, Flight second) {
            this.first = first;
            this.second = second;
        }

        public Flight getFirst() { return first; }
        public Flight getSecond() { return second; }

        @Override
        public String toString() {
            return first.getNumber() + "~" + second.getNumber();
        }
    }

    /**
     * @param windows activity window per flight, keyed by flight number
     * @param marginMinutes extra minutes added to the end of each window before comparing
     */
    public static List<FlightPair> overlappingPairs(List<Flight> flights, Map<String, TimeWindow> windows, int marginMinutes) {
        List<Flight> sorted = new ArrayList<>(flights);
        sorted.sort(Comparator.comparing((Flight f) -> windows.get(f.getNumber()).getStart()).thenComparing(Flight::getNumber));
        List<FlightPair> pairs = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            TimeWindow a = windows.get(sorted.get(i).getNumber());
            for (int j = i + 1; j < sorted.size(); j++) {
                TimeWindow b = windows.get(sorted.get(j).getNumber());
                if (!b.getStart().isBefore(a.getEnd().plusMinutes(marginMinutes))) {
                    break;
                }
                pairs.add(new FlightPair(sorted.get(i), sorted.get(j)));
            }
        }
        return pairs;
    }
}
