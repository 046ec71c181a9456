package com.groundstaff;

import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.Bay;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.FlightService;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.RelativeTime;
import com.groundstaff.domain.Service;
import com.groundstaff.domain.ServiceType;
import com.groundstaff.domain.Shift;
import com.groundstaff.domain.Staff;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.List;
import java.util.Set;

/**
 * Small builders for scheduling test data. All times are on {@link #DATE}.
 */
public final class Fixtures {

    public static final LocalDate DATE = LocalDate.of(2025, 3, 14);

    private Fixtures() {}

    public static LocalDateTime at(String hhmm) {
        return DATE.atTime(LocalTime.parse(hhmm));
    }

    public static Service service(String id, ServiceType type, String certification) {
        return Service.of(id, type, certification);
    }

    /** Staff with one shift. */
    public static Staff staffOnShift(String id, String shiftStart, String shiftEnd, String... certifications) {
        return new Staff(id, id, Set.of(certifications), List.of(new Shift(at(shiftStart), at(shiftEnd))));
    }

    /** Staff on duty all day. */
    public static Staff staff(String id, String... certifications) {
        return staffOnShift(id, "00:00", "23:59", certifications);
    }

    /** Service from arrival to departure. */
    public static FlightService turnaround(String serviceId) {
        return FlightService.of(serviceId, "A", "D");
    }

    public static FlightService turnaround(String serviceId, int count) {
        return new FlightService(serviceId, count, RelativeTime.parse("A"), RelativeTime.parse("D"));
    }

    public static Flight flight(String number, String arrival, String departure, FlightService... services) {
        return flight(number, arrival, departure, "A1", services);
    }

    public static Flight flight(String number, String arrival, String departure, String bay, FlightService... services) {
        return new Flight(number, at(arrival), at(departure), bay, List.of(services));
    }

    public static OperationalDay day(List<Service> services, List<Flight> flights, List<Staff> roster) {
        return new OperationalDay(DATE, services, flights, roster, List.of());
    }

    public static OperationalDay day(List<Service> services, List<Flight> flights, List<Staff> roster, List<Bay> bays) {
        return new OperationalDay(DATE, services, flights, roster, bays);
    }

    /** Settings with short budgets for tests that run the real solver. */
    public static SchedulerSettings fastSettings() {
        SchedulerSettings settings = new SchedulerSettings();
        settings.setSolveBudget(Duration.ofSeconds(5));
        settings.setUnimprovedBudget(Duration.ofSeconds(1));
        return settings;
    }
}
