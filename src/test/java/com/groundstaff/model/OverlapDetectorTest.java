package com.groundstaff.model;

import com.groundstaff.domain.Flight;
import com.groundstaff.domain.TimeWindow;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.groundstaff.Fixtures.flight;
import static org.junit.jupiter.api.Assertions.assertEquals;

class OverlapDetectorTest {

    private static Map<String, TimeWindow> turnarounds(List<Flight> flights) {
        Map<String, TimeWindow> windows = new LinkedHashMap<>();
        for (Flight f : flights) {
            windows.put(f.getNumber(), f.getTurnaround());
        }
        return windows;
    }

    private static List<String> pairs(List<Flight> flights, int margin) {
        return OverlapDetector.overlappingPairs(flights, turnarounds(flights), margin).stream()
                .map(OverlapDetector.FlightPair::toString)
                .collect(Collectors.toList());
    }

    @Test
    void findsOverlapsRegardlessOfInputOrder() {
        List<Flight> flights = List.of(
                flight("F3", "12:00", "13:00"),
                flight("F1", "10:00", "11:30"),
                flight("F2", "11:00", "12:30"));

        assertEquals(List.of("F1~F2", "F2~F3"), pairs(flights, 0));
    }

    @Test
    // touching windows only pair when the margin reaches the next start
    void marginExtendsWindows() {
        List<Flight> flights = List.of(flight("F1", "10:00", "11:00"), flight("F2", "11:05", "12:00"));

        assertEquals(List.of(), pairs(flights, 0));
        assertEquals(List.of(), pairs(flights, 5));
        assertEquals(List.of("F1~F2"), pairs(flights, 6));
    }
}
