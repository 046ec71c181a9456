package com.groundstaff.engine;

import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.Service;
import com.groundstaff.domain.ServiceType;
import com.groundstaff.domain.Staff;
import com.groundstaff.model.AllocationModel;
import com.groundstaff.model.AssignmentKey;
import com.groundstaff.model.ConstraintModelBuilder;
import com.groundstaff.schedule.ScheduleStore;
import com.groundstaff.schedule.ScheduleVersion;
import com.groundstaff.solver.TimefoldSolverAdapter;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.groundstaff.Fixtures.at;
import static com.groundstaff.Fixtures.day;
import static com.groundstaff.Fixtures.fastSettings;
import static com.groundstaff.Fixtures.flight;
import static com.groundstaff.Fixtures.service;
import static com.groundstaff.Fixtures.staff;
import static com.groundstaff.Fixtures.turnaround;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Disruption scenarios solved end to end with the Timefold adapter.
 */
class IncrementalUpdateEngineScenarioTest {

    private static final Service REFUEL = service("REFUEL", ServiceType.COMMON_LEVEL, "REF");

    private final SchedulerSettings settings = fastSettings();
    private final ScheduleStore store = new ScheduleStore();
    private final IncrementalUpdateEngine engine = new IncrementalUpdateEngine(
            new ConstraintModelBuilder(settings), new TimefoldSolverAdapter(settings), store, settings);

    @AfterEach
    void tearDown() {
        engine.close();
    }

    private static OperationalDay threeFlights() {
        return day(List.of(REFUEL),
                List.of(flight("F1", "08:00", "09:00", turnaround("REFUEL")),
                        flight("F2", "10:00", "11:00", turnaround("REFUEL")),
                        flight("F3", "12:00", "13:00", turnaround("REFUEL"))),
                List.of(staff("S456", "REF"), staff("S789", "REF")));
    }

    private static void assertCertified(OperationalDay day, ScheduleVersion version) {
        for (AssignmentKey key : version.assignedKeys()) {
            Staff staff = day.findStaff(key.getStaffId()).orElseThrow();
            assertTrue(day.getService(key.getServiceId()).isEligible(staff), key.toString());
        }
    }

    @Test
    // Sick staff disappears from every future variable; finished work stays as committed
    void sickStaffIsReplacedOnFutureFlights() {
        OperationalDay day = threeFlights();
        assertTrue(engine.createBaseline(day).isCommitted());
        Map<AssignmentKey, Boolean> firstFlight = store.current().entriesOf("F1");

        UpdateResult result = engine.apply(DisruptionEvent.at(at("09:30"))
                .description("S456 called in sick")
                .invalidStaff("S456")
                .build());

        assertEquals(UpdateStatus.COMMITTED, result.getStatus(), result.toString());
        AllocationModel model = engine.getLastModel();
        for (AssignmentKey key : model.getVariables().keys()) {
            assertNotEquals("S456", key.getStaffId());
            assertNotEquals("F1", key.getFlightNumber());
        }
        assertEquals(Optional.of(true), store.committed("F2", "REFUEL", "S789"));
        assertEquals(Optional.of(true), store.committed("F3", "REFUEL", "S789"));
        assertEquals(firstFlight, store.current().entriesOf("F1"));
        assertCertified(engine.getDay(), store.current());
    }

    @Test
    // The rebuilt model never holds more variables than a fresh model with the same cutoff
    void rebuiltScopeMatchesFreshModel() {
        OperationalDay day = threeFlights();
        engine.createBaseline(day);

        engine.apply(DisruptionEvent.at(at("09:30")).invalidStaff("S456").build());

        OperationalDay withoutSick = engine.getDay();
        List<Staff> roster = List.of(withoutSick.findStaff("S789").orElseThrow());
        AllocationModel fresh = new ConstraintModelBuilder(settings)
                .build(withoutSick, withoutSick.getFlights(), roster, at("09:30"));
        assertEquals(fresh.variableCount(), engine.getLastModel().variableCount());
        assertEquals(fresh.getDepartures().keySet(), engine.getLastModel().getDepartures().keySet());
    }

    @Test
    // F2 slips into F3's window, so one refueler can no longer do both
    void delayedFlightGetsDifferentStaff() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "08:00", "09:00", turnaround("REFUEL")),
                        flight("F2", "10:00", "11:00", "A1", turnaround("REFUEL")),
                        flight("F3", "12:00", "13:00", "B1", turnaround("REFUEL"))),
                List.of(staff("S456", "REF"), staff("S789", "REF")));
        engine.createBaseline(day);
        Flight delayed = day.findFlight("F2").orElseThrow().reschedule(at("12:30"), at("13:30"));

        UpdateResult result = engine.apply(DisruptionEvent.at(at("09:30"))
                .description("F2 delayed")
                .rescheduled(delayed)
                .build());

        assertEquals(UpdateStatus.COMMITTED, result.getStatus(), result.toString());
        List<String> second = store.allocation("F2").orElseThrow().staffFor("REFUEL");
        List<String> third = store.allocation("F3").orElseThrow().staffFor("REFUEL");
        assertEquals(1, second.size());
        assertEquals(1, third.size());
        assertNotEquals(second.get(0), third.get(0));
        assertEquals(Optional.of(at("13:30")), store.current().departureOf("F2"));
        assertCertified(engine.getDay(), store.current());
    }

    @Test
    // Two concurrent flights on distant bays cannot share the last refueler
    void unresolvedDisruptionKeepsScheduleUntilRelieved() {
        OperationalDay day = day(List.of(REFUEL),
                List.of(flight("F1", "10:00", "11:00", "A1", turnaround("REFUEL")),
                        flight("F2", "10:30", "11:30", "B1", turnaround("REFUEL"))),
                List.of(staff("S1", "REF"), staff("S2", "REF")));
        assertTrue(engine.createBaseline(day).isCommitted());
        ScheduleVersion baseline = store.current();

        UpdateResult unresolved = engine.apply(DisruptionEvent.at(at("09:00")).invalidStaff("S2").build());

        assertEquals(UpdateStatus.UNRESOLVED, unresolved.getStatus(), unresolved.toString());
        assertSame(baseline, store.current());
        assertFalse(engine.getDay().findStaff("S3").isPresent());

        UpdateResult relieved = engine.apply(DisruptionEvent.at(at("09:10"))
                .description("S2 out, S3 called in")
                .invalidStaff("S2")
                .addStaff(staff("S3", "REF"))
                .build());

        assertEquals(UpdateStatus.COMMITTED, relieved.getStatus(), relieved.toString());
        assertEquals(2, store.version());
        List<String> first = store.allocation("F1").orElseThrow().staffFor("REFUEL");
        List<String> second = store.allocation("F2").orElseThrow().staffFor("REFUEL");
        assertFalse(first.contains("S2"));
        assertFalse(second.contains("S2"));
        assertNotEquals(first, second);
        assertCertified(engine.getDay(), store.current());
    }
}
