package com.groundstaff.model;

import com.groundstaff.config.CoverageMode;
import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.Bay;
import com.groundstaff.domain.CertificationRequirement;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.FlightService;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.Service;
import com.groundstaff.domain.ServiceType;
import com.groundstaff.domain.Staff;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.groundstaff.Fixtures.at;
import static com.groundstaff.Fixtures.day;
import static com.groundstaff.Fixtures.flight;
import static com.groundstaff.Fixtures.service;
import static com.groundstaff.Fixtures.staff;
import static com.groundstaff.Fixtures.staffOnShift;
import static com.groundstaff.Fixtures.turnaround;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConstraintModelBuilderTest {

    private static final Service REFUEL = service("REFUEL", ServiceType.COMMON_LEVEL, "REF");
    private static final Service TOILET = service("TOILET", ServiceType.COMMON_LEVEL, "TOI");
    private static final Service GPU = service("GPU", ServiceType.MULTI_FLIGHT, "GPU");
    private static final Service BAGGAGE = service("BAGGAGE", ServiceType.FLIGHT_LEVEL, "BAG");

    private final SchedulerSettings settings = new SchedulerSettings();
    private final ConstraintModelBuilder builder = new ConstraintModelBuilder(settings);

    private AllocationModel buildAll(OperationalDay day) {
        return builder.build(day, day.getFlights(), day.getRoster(), day.getDate().atStartOfDay());
    }

    private static Map<AssignmentKey, Boolean> assign(String... keys) {
        Map<AssignmentKey, Boolean> result = new HashMap<>();
        for (String k : keys) {
            String[] parts = k.split("/");
            result.put(new AssignmentKey(parts[0], parts[1], parts[2]), true);
        }
        return result;
    }

    private static boolean violates(AllocationModel model, ConstraintKind kind, String... keys) {
        return model.violatedConstraints(assign(keys)).stream().anyMatch(c -> c.getKind() == kind);
    }

    @Test
    // only certified (flight, service, staff) triples become variables
    void certificationPrunesVariables() {
        OperationalDay day = day(List.of(REFUEL, TOILET),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL"), turnaround("TOILET"))),
                List.of(staff("A", "REF"), staff("B", "TOI"), staff("C", "REF", "TOI")));

        AllocationModel model = buildAll(day);

        assertEquals(4, model.variableCount());
        VariableTable table = model.getVariables();
        assertTrue(table.contains(new AssignmentKey("F1", "REFUEL", "A")));
        assertTrue(table.contains(new AssignmentKey("F1", "REFUEL", "C")));
        assertTrue(table.contains(new AssignmentKey("F1", "TOILET", "B")));
        assertTrue(table.contains(new AssignmentKey("F1", "TOILET", "C")));
        assertFalse(table.contains(new AssignmentKey("F1", "REFUEL", "B")));
        assertFalse(table.contains(new AssignmentKey("F1", "TOILET", "A")));
    }

    @Test
    void failsWhenNoStaffHoldsTheCertification() {
        OperationalDay day = day(List.of(REFUEL, GPU),
                List.of(flight("F7", "10:00", "11:00", turnaround("REFUEL"), turnaround("GPU"))),
                List.of(staff("A", "REF")));

        ModelBuildException e = assertThrows(ModelBuildException.class, () -> buildAll(day));
        assertEquals("F7", e.getFlightNumber());
        assertEquals("GPU", e.getServiceId());
    }

    @Test
    // a CommonLevel service excludes every other service of that staff on the flight
    void commonLevelIsExclusiveOnItsFlight() {
        OperationalDay day = day(List.of(REFUEL, TOILET, BAGGAGE),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL"), turnaround("TOILET"), turnaround("BAGGAGE"))),
                List.of(staff("A", "REF", "TOI", "BAG")));

        AllocationModel model = buildAll(day);

        assertTrue(violates(model, ConstraintKind.COMMON_LEVEL_EXCLUSIVITY, "F1/REFUEL/A", "F1/TOILET/A"));
        assertTrue(violates(model, ConstraintKind.COMMON_LEVEL_EXCLUSIVITY, "F1/REFUEL/A", "F1/BAGGAGE/A"));
        assertFalse(violates(model, ConstraintKind.COMMON_LEVEL_EXCLUSIVITY, "F1/REFUEL/A"));
    }

    @Test
    // GPU on two overlapping flights is fine, GPU plus Baggage is not
    void multiFlightRules() {
        Service pushback = service("PUSHBACK", ServiceType.MULTI_FLIGHT, "GPU");
        OperationalDay day = day(List.of(GPU, BAGGAGE, pushback),
                List.of(flight("F1", "10:00", "11:00", turnaround("GPU"), turnaround("BAGGAGE")),
                        flight("F2", "10:30", "11:30", "B1", turnaround("GPU")),
                        flight("F3", "10:45", "11:15", "C1", turnaround("BAGGAGE")),
                        flight("F4", "18:00", "19:00", turnaround("PUSHBACK"))),
                List.of(staff("M", "GPU", "BAG")));

        AllocationModel model = buildAll(day);

        assertTrue(model.violatedConstraints(assign("F1/GPU/M", "F2/GPU/M")).stream()
                .noneMatch(c -> c.getKind() == ConstraintKind.MULTI_FLIGHT_EXCLUSIVITY
                        || c.getKind() == ConstraintKind.MULTI_FLIGHT_IDENTITY));
        assertTrue(violates(model, ConstraintKind.MULTI_FLIGHT_EXCLUSIVITY, "F1/GPU/M", "F1/BAGGAGE/M"));
        assertTrue(violates(model, ConstraintKind.MULTI_FLIGHT_EXCLUSIVITY, "F2/GPU/M", "F3/BAGGAGE/M"));
        // identity holds across the whole window, not only overlapping flights
        assertTrue(violates(model, ConstraintKind.MULTI_FLIGHT_IDENTITY, "F1/GPU/M", "F4/PUSHBACK/M"));
    }

    @Test
    void excludedServicesAreExclusive() {
        Service loading = new Service("LOAD", "Loading", ServiceType.FLIGHT_LEVEL, List.of("BAG"),
                CertificationRequirement.ALL, 0, Set.of("WATER"));
        Service water = service("WATER", ServiceType.FLIGHT_LEVEL, "WAT");
        Service catering = service("CATERING", ServiceType.FLIGHT_LEVEL, "CAT");
        OperationalDay day = day(List.of(loading, water, catering),
                List.of(flight("F1", "10:00", "11:00", turnaround("LOAD"), turnaround("WATER"), turnaround("CATERING"))),
                List.of(staff("A", "BAG", "WAT", "CAT")));

        AllocationModel model = buildAll(day);

        assertTrue(violates(model, ConstraintKind.SERVICE_EXCLUSION, "F1/LOAD/A", "F1/WATER/A"));
        assertTrue(model.violatedConstraints(assign("F1/LOAD/A", "F1/CATERING/A", "F1/WATER/B")).stream()
                .noneMatch(c -> c.getKind() == ConstraintKind.SERVICE_EXCLUSION));
    }

    @Test
    // limit 2 on LOAD: holding LOAD allows one more FlightLevel service on the flight
    void crossUtilizationLimit() {
        Service loading = new Service("LOAD", "Loading", ServiceType.FLIGHT_LEVEL, List.of("BAG"),
                CertificationRequirement.ALL, 2, Set.of());
        Service water = service("WATER", ServiceType.FLIGHT_LEVEL, "WAT");
        Service catering = service("CATERING", ServiceType.FLIGHT_LEVEL, "CAT");
        OperationalDay day = day(List.of(loading, water, catering),
                List.of(flight("F1", "10:00", "11:00", turnaround("LOAD"), turnaround("WATER"), turnaround("CATERING"))),
                List.of(staff("A", "BAG", "WAT", "CAT")));

        AllocationModel model = buildAll(day);

        assertEquals(1, model.constraintsOf(ConstraintKind.CROSS_UTILIZATION).size());
        assertFalse(violates(model, ConstraintKind.CROSS_UTILIZATION, "F1/LOAD/A", "F1/WATER/A"));
        assertTrue(violates(model, ConstraintKind.CROSS_UTILIZATION, "F1/LOAD/A", "F1/WATER/A", "F1/CATERING/A"));
        // without LOAD the other two are unlimited
        assertFalse(violates(model, ConstraintKind.CROSS_UTILIZATION, "F1/WATER/A", "F1/CATERING/A"));
    }

    @Test
    void flightLevelOverlapIsOptional() {
        FlightService early = FlightService.of("BAGGAGE", "A", "A+40");
        FlightService late = FlightService.of("WATER", "A+20", "D");
        Service water = service("WATER", ServiceType.FLIGHT_LEVEL, "WAT");
        OperationalDay day = day(List.of(BAGGAGE, water),
                List.of(flight("F1", "10:00", "11:00", early, late)),
                List.of(staff("A", "BAG", "WAT")));

        assertTrue(buildAll(day).constraintsOf(ConstraintKind.FLIGHT_LEVEL_OVERLAP).isEmpty());

        settings.setFlightLevelOverlap(true);
        AllocationModel model = buildAll(day);
        assertTrue(violates(model, ConstraintKind.FLIGHT_LEVEL_OVERLAP, "F1/BAGGAGE/A", "F1/WATER/A"));
    }

    @Test
    // 11:00 + 20 min travel > 11:00 + 15 min buffer, 11:00 + 10 min is within it
    void flightTransitionsUseTravelTimeAndBuffer() {
        List<Bay> bays = List.of(new Bay("A1", Map.of("B1", 20, "C1", 10)));
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", "A1", turnaround("REFUEL")),
                        flight("F2", "11:00", "12:00", "B1", turnaround("REFUEL")),
                        flight("F3", "11:00", "12:00", "C1", turnaround("REFUEL"))),
                List.of(staff("A", "REF"), staff("B", "REF"), staff("C", "REF")),
                bays);

        AllocationModel model = buildAll(day);

        assertTrue(violates(model, ConstraintKind.FLIGHT_TRANSITION, "F1/REFUEL/A", "F2/REFUEL/A"));
        assertFalse(violates(model, ConstraintKind.FLIGHT_TRANSITION, "F1/REFUEL/A", "F3/REFUEL/A"));
        // F2 and F3 run at the same time on different bays
        assertTrue(violates(model, ConstraintKind.FLIGHT_TRANSITION, "F2/REFUEL/B", "F3/REFUEL/B"));

        settings.setFlightTransitions(false);
        assertTrue(buildAll(day).constraintsOf(ConstraintKind.FLIGHT_TRANSITION).isEmpty());
    }

    @Test
    // variables exist but are fixed false when no single shift covers the service
    void unavailableStaffIsFixedFalse() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL"))),
                List.of(staffOnShift("EARLY", "06:00", "10:30", "REF"), staffOnShift("DAY", "08:00", "16:00", "REF")));

        AllocationModel model = buildAll(day);

        int early = model.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "EARLY"));
        int dayShift = model.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "DAY"));
        assertTrue(model.isFixedFalse(early));
        assertFalse(model.isFixedFalse(dayShift));
        assertTrue(model.structuralViolations().isEmpty());
    }

    @Test
    void unreachableCoverageIsReportedBeforeSolving() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL", 2))),
                List.of(staff("A", "REF"), staffOnShift("B", "12:00", "20:00", "REF")));

        List<LinearConstraint> unreachable = buildAll(day).structuralViolations();

        assertEquals(1, unreachable.size());
        assertEquals(ConstraintKind.COVERAGE, unreachable.get(0).getKind());
    }

    @Test
    void softCoverageSplitsBounds() {
        settings.setCoverageMode(CoverageMode.SOFT);
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL", 2))),
                List.of(staff("A", "REF")));

        AllocationModel model = buildAll(day);

        List<LinearConstraint> coverage = model.constraintsOf(ConstraintKind.COVERAGE);
        assertEquals(2, coverage.size());
        assertTrue(coverage.stream().anyMatch(c -> c.getStrength() == Strength.MEDIUM && c.getMin() == 2));
        assertTrue(coverage.stream().anyMatch(c -> c.getStrength() == Strength.HARD && c.getMax() == 2 && !c.hasMin()));
        assertTrue(model.structuralViolations().isEmpty());
    }

    @Test
    // flights departing at or before the cutoff are not modelled
    void cutoffLimitsScope() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "08:00", "09:00", turnaround("REFUEL")),
                        flight("F2", "11:00", "12:00", turnaround("REFUEL"))),
                List.of(staff("A", "REF"), staff("B", "REF")));

        AllocationModel full = buildAll(day);
        AllocationModel future = builder.build(day, day.getFlights(), day.getRoster(), at("09:00"));

        assertEquals(4, full.variableCount());
        assertEquals(2, future.variableCount());
        assertEquals(Set.of("F2"), future.getDepartures().keySet());
        assertTrue(future.getVariables().keys().stream().allMatch(k -> k.getFlightNumber().equals("F2")));

        AllocationModel none = builder.build(day, day.getFlights(), day.getRoster(), at("12:00"));
        assertTrue(none.isEmpty());
    }

    @Test
    // a key that persists across rebuilds is the same instance
    void keysKeepIdentityAcrossRebuilds() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL"))),
                List.of(staff("A", "REF"), staff("B", "REF")));

        AllocationModel first = buildAll(day);
        List<Staff> reduced = List.of(day.findStaff("B").orElseThrow());
        AllocationModel second = builder.build(day, day.getFlights(), reduced, at("09:00"), first.getVariables());

        AssignmentKey before = first.key(first.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "B")));
        AssignmentKey after = second.key(second.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "B")));
        assertSame(before, after);
        assertEquals(1, second.variableCount());
    }

    @Test
    // least-certified eligible staff carry no excess
    void excessCertificationsAreRelativeToTheService() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", turnaround("REFUEL"))),
                List.of(staff("A", "REF"), staff("B", "REF", "TOI", "BAG")));
        Flight f1 = day.findFlight("F1").orElseThrow();

        AllocationModel model = builder.build(day, List.of(f1), day.getRoster(), at("00:00"));

        assertEquals(0, model.excessCertifications(model.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "A"))));
        assertEquals(2, model.excessCertifications(model.getVariables().indexOf(new AssignmentKey("F1", "REFUEL", "B"))));
    }
}
