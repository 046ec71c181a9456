package com.groundstaff.model;

import com.groundstaff.config.CoverageMode;
import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.Bay;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.FlightService;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.Service;
import com.groundstaff.domain.ServiceType;
import com.groundstaff.domain.Staff;
import com.groundstaff.domain.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Translates flights and a roster into boolean decision variables and linear constraints.
 *
 * Only (flight, service, staff) triples where the staff meets the service's certification
 * requirement become variables. Variables whose service window no shift covers are kept
 * but fixed to false.
 */
public class ConstraintModelBuilder {

    private static final Logger log = LoggerFactory.getLogger(ConstraintModelBuilder.class);

    private final SchedulerSettings settings;

    public ConstraintModelBuilder(SchedulerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public AllocationModel build(OperationalDay day, Collection<Flight> flights, Collection<Staff> roster,
                                 LocalDateTime cutoff) {
        return build(day, flights, roster, cutoff, null);
    }

    /**
     * @param flights  candidate flights, those departing at or before the cutoff are skipped
     * @param previous variable table of the previous model, whose key instances are reused
     * @throws ModelBuildException when a flight service has no certified staff in the roster
     */
    public AllocationModel build(OperationalDay day, Collection<Flight> flights, Collection<Staff> roster,
                                 LocalDateTime cutoff, VariableTable previous) {
        Objects.requireNonNull(day, "day");
        Objects.requireNonNull(cutoff, "cutoff");

        List<Flight> scope = new ArrayList<>();
        for (Flight f : flights) {
            if (f.departsAfter(cutoff)) {
                scope.add(f);
            }
        }
        scope.sort(Comparator.comparing(Flight::getArrival).thenComparing(Flight::getNumber));
        if (scope.isEmpty()) {
            log.info("No flights depart after {}, model is empty", cutoff);
            return AllocationModel.empty(cutoff);
        }

        Build b = new Build(day, cutoff, previous);
        for (Flight flight : scope) {
            b.addFlight(flight, roster);
        }
        b.addStaffFlightConstraints();
        b.addCrossFlightConstraints(scope);

        AllocationModel model = b.finish(scope);
        log.info("Built model for {} flights after {}: {} variables ({} unavailable), {} constraints",
                scope.size(), cutoff.toLocalTime(), model.variableCount(), model.fixedCount(),
                model.getConstraints().size());
        if (log.isDebugEnabled()) {
            for (Map.Entry<ConstraintKind, Integer> e : b.countByKind().entrySet()) {
                log.debug("  - {}: {}", e.getKey(), e.getValue());
            }
        }
        return model;
    }

    private static final class Variable {
        final int index;
        final Flight flight;
        final Service service;
        final Staff staff;
        final TimeWindow window;

        Variable(int index, Flight flight, Service service, Staff staff, TimeWindow window) {
            this.index = index;
            this.flight = flight;
            this.service = service;
            this.staff = staff;
            this.window = window;
        }

        ServiceType type() {
            return service.getType();
        }
    }

    /** Mutable state of one build. */
    private final class Build {
        final OperationalDay day;
        final LocalDateTime cutoff;
        final VariableTable.Builder table;
        final List<Variable> variables = new ArrayList<>();
        final List<Boolean> fixed = new ArrayList<>();
        final List<Integer> excess = new ArrayList<>();
        final List<LinearConstraint> constraints = new ArrayList<>();
        final Set<Long> exclusivePairs = new HashSet<>();
        // staff id -> flight number -> variables, both in build order
        final Map<String, Map<String, List<Variable>>> byStaffFlight = new LinkedHashMap<>();
        final Map<String, TimeWindow> activity = new HashMap<>();

        Build(OperationalDay day, LocalDateTime cutoff, VariableTable previous) {
            this.day = day;
            this.cutoff = cutoff;
            this.table = VariableTable.builder(previous);
        }

        void addFlight(Flight flight, Collection<Staff> roster) {
            LocalDateTime start = flight.getArrival();
            LocalDateTime end = flight.getDeparture();
            for (FlightService fs : flight.getServices()) {
                Service service = day.getService(fs.getServiceId());
                TimeWindow window = flight.serviceWindow(fs);
                if (window.getStart().isBefore(start)) start = window.getStart();
                if (window.getEnd().isAfter(end)) end = window.getEnd();

                List<Staff> eligible = new ArrayList<>();
                int minCertifications = Integer.MAX_VALUE;
                for (Staff s : roster) {
                    if (service.isEligible(s)) {
                        eligible.add(s);
                        minCertifications = Math.min(minCertifications, s.getCertifications().size());
                    }
                }
                if (eligible.isEmpty()) {
                    throw new ModelBuildException(flight.getNumber(), service.getId(),
                            "No staff in roster meets certification " + service.getCertificationRequirement()
                                    + service.getCertifications() + " for service " + service.getId()
                                    + " on flight " + flight.getNumber());
                }

                int[] coverage = new int[eligible.size()];
                for (int i = 0; i < eligible.size(); i++) {
                    Staff s = eligible.get(i);
                    int index = table.add(flight.getNumber(), service.getId(), s.getId());
                    Variable v = new Variable(index, flight, service, s, window);
                    variables.add(v);
                    fixed.add(!s.isAvailableFor(window));
                    excess.add(s.getCertifications().size() - minCertifications);
                    byStaffFlight.computeIfAbsent(s.getId(), k -> new LinkedHashMap<>())
                            .computeIfAbsent(flight.getNumber(), k -> new ArrayList<>())
                            .add(v);
                    coverage[i] = index;
                }

                String label = flight.getNumber() + "/" + service.getId();
                if (settings.getCoverageMode() == CoverageMode.HARD) {
                    constraints.add(LinearConstraint.between(ConstraintKind.COVERAGE, label, coverage,
                            fs.getCount(), fs.getCount()));
                } else {
                    constraints.add(LinearConstraint.atMost(ConstraintKind.COVERAGE, label, coverage, fs.getCount()));
                    constraints.add(LinearConstraint.atLeast(ConstraintKind.COVERAGE, Strength.MEDIUM, label,
                            coverage, fs.getCount()));
                }
            }
            activity.put(flight.getNumber(), new TimeWindow(start, end));
        }

        void exclusive(ConstraintKind kind, Variable a, Variable b) {
            int lo = Math.min(a.index, b.index);
            int hi = Math.max(a.index, b.index);
            if (exclusivePairs.add(((long) lo << 32) | hi)) {
                constraints.add(LinearConstraint.exclusive(kind, a.staff.getId() + ":" + a.flight.getNumber() + "/"
                        + a.service.getId() + "|" + b.flight.getNumber() + "/" + b.service.getId(), lo, hi));
            }
        }

        /** Rules between services of the same staff on the same flight. */
        void addStaffFlightConstraints() {
            for (Map<String, List<Variable>> perFlight : byStaffFlight.values()) {
                for (List<Variable> vars : perFlight.values()) {
                    for (int i = 0; i < vars.size(); i++) {
                        for (int j = i + 1; j < vars.size(); j++) {
                            Variable a = vars.get(i);
                            Variable b = vars.get(j);
                            if (a.type() == ServiceType.COMMON_LEVEL || b.type() == ServiceType.COMMON_LEVEL) {
                                exclusive(ConstraintKind.COMMON_LEVEL_EXCLUSIVITY, a, b);
                            } else if (a.type() == ServiceType.MULTI_FLIGHT && b.type() == ServiceType.MULTI_FLIGHT) {
                                exclusive(ConstraintKind.MULTI_FLIGHT_IDENTITY, a, b);
                            } else if (a.type() == ServiceType.MULTI_FLIGHT || b.type() == ServiceType.MULTI_FLIGHT) {
                                exclusive(ConstraintKind.MULTI_FLIGHT_EXCLUSIVITY, a, b);
                            } else if (a.service.excludes(b.service.getId()) || b.service.excludes(a.service.getId())) {
                                exclusive(ConstraintKind.SERVICE_EXCLUSION, a, b);
                            } else if (settings.isFlightLevelOverlap() && a.window.overlaps(b.window)) {
                                exclusive(ConstraintKind.FLIGHT_LEVEL_OVERLAP, a, b);
                            }
                        }
                    }
                    addCrossUtilization(vars);
                }
            }
        }

        /**
         * Holding a FlightLevel service with limit L allows at most L-1 other compatible FlightLevel
         * services on the flight: {@code sum(others) + M*x <= M + L - 1} with M = number of others.
         */
        void addCrossUtilization(List<Variable> vars) {
            for (Variable v : vars) {
                int limit = v.service.getCrossUtilizationLimit();
                if (v.type() != ServiceType.FLIGHT_LEVEL || limit < 1) {
                    continue;
                }
                List<Variable> others = new ArrayList<>();
                for (Variable o : vars) {
                    if (o != v && o.type() == ServiceType.FLIGHT_LEVEL
                            && !v.service.excludes(o.service.getId()) && !o.service.excludes(v.service.getId())) {
                        others.add(o);
                    }
                }
                int bigM = others.size();
                if (bigM <= limit - 1) {
                    continue;
                }
                int[] idx = new int[bigM + 1];
                int[] coef = new int[bigM + 1];
                for (int i = 0; i < bigM; i++) {
                    idx[i] = others.get(i).index;
                    coef[i] = 1;
                }
                idx[bigM] = v.index;
                coef[bigM] = bigM;
                constraints.add(new LinearConstraint(ConstraintKind.CROSS_UTILIZATION, Strength.HARD,
                        v.staff.getId() + ":" + v.flight.getNumber() + "/" + v.service.getId(),
                        idx, coef, LinearConstraint.NO_MIN, bigM + limit - 1));
            }
        }

        /** MultiFlight identity and exclusivity over the whole scope, and travel between flights. */
        void addCrossFlightConstraints(List<Flight> scope) {
            for (Map<String, List<Variable>> perFlight : byStaffFlight.values()) {
                List<Variable> multi = new ArrayList<>();
                for (List<Variable> vars : perFlight.values()) {
                    for (Variable v : vars) {
                        if (v.type() == ServiceType.MULTI_FLIGHT) {
                            multi.add(v);
                        }
                    }
                }
                for (int i = 0; i < multi.size(); i++) {
                    for (int j = i + 1; j < multi.size(); j++) {
                        if (!multi.get(i).service.equals(multi.get(j).service)) {
                            exclusive(ConstraintKind.MULTI_FLIGHT_IDENTITY, multi.get(i), multi.get(j));
                        }
                    }
                }
            }

            int buffer = settings.getOverlapBufferMinutes();
            int margin = Math.max(maxTravelMinutes() - buffer, 0);
            for (OverlapDetector.FlightPair pair : OverlapDetector.overlappingPairs(scope, activity, margin)) {
                Flight f1 = pair.getFirst();
                Flight f2 = pair.getSecond();
                int travel = day.travelMinutes(f1.getBay(), f2.getBay(), settings.getDefaultTravelMinutes());
                for (Map<String, List<Variable>> perFlight : byStaffFlight.values()) {
                    List<Variable> on1 = perFlight.get(f1.getNumber());
                    List<Variable> on2 = perFlight.get(f2.getNumber());
                    if (on1 == null || on2 == null) {
                        continue;
                    }
                    for (Variable a : on1) {
                        for (Variable b : on2) {
                            boolean aMulti = a.type() == ServiceType.MULTI_FLIGHT;
                            boolean bMulti = b.type() == ServiceType.MULTI_FLIGHT;
                            if (aMulti != bMulti) {
                                if (a.window.overlaps(b.window)) {
                                    exclusive(ConstraintKind.MULTI_FLIGHT_EXCLUSIVITY, a, b);
                                }
                            } else if (!aMulti && settings.isFlightTransitions() && cannotReach(a, b, travel, buffer)) {
                                exclusive(ConstraintKind.FLIGHT_TRANSITION, a, b);
                            }
                        }
                    }
                }
            }
        }

        /** Whoever finishes the earlier-starting service cannot be at the other one in time. */
        boolean cannotReach(Variable a, Variable b, int travel, int buffer) {
            Variable first = a.window.getStart().isAfter(b.window.getStart()) ? b : a;
            Variable second = first == a ? b : a;
            return first.window.getEnd().plusMinutes(travel).isAfter(second.window.getStart().plusMinutes(buffer));
        }

        int maxTravelMinutes() {
            int max = settings.getDefaultTravelMinutes();
            for (Bay bay : day.getBays()) {
                for (int minutes : bay.getTravelTimes().values()) {
                    max = Math.max(max, minutes);
                }
            }
            return max;
        }

        Map<ConstraintKind, Integer> countByKind() {
            Map<ConstraintKind, Integer> counts = new EnumMap<>(ConstraintKind.class);
            for (LinearConstraint c : constraints) {
                counts.merge(c.getKind(), 1, Integer::sum);
            }
            return counts;
        }

        AllocationModel finish(List<Flight> scope) {
            VariableTable vt = table.build();
            boolean[] fixedFalse = new boolean[vt.size()];
            int[] excessCerts = new int[vt.size()];
            for (int i = 0; i < variables.size(); i++) {
                fixedFalse[variables.get(i).index] = fixed.get(i);
                excessCerts[variables.get(i).index] = excess.get(i);
            }
            return new AllocationModel(cutoff, vt, fixedFalse, excessCerts, constraints, scope);
        }
    }
}
