package com.groundstaff.engine;

import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.Flight;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.domain.Staff;
import com.groundstaff.model.AllocationModel;
import com.groundstaff.model.AssignmentKey;
import com.groundstaff.model.ConstraintModelBuilder;
import com.groundstaff.model.ModelBuildException;
import com.groundstaff.model.VariableTable;
import com.groundstaff.schedule.ScheduleStore;
import com.groundstaff.schedule.ScheduleVersion;
import com.groundstaff.solver.InfeasibilityReason;
import com.groundstaff.solver.SolveOutcome;
import com.groundstaff.solver.SolveStatus;
import com.groundstaff.solver.SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Re-optimizes the schedule after disruptions.
 *
 * Each update rebuilds the model for flights departing after the event time only, minus
 * everything invalidated so far, warm-starts the solver with the assignments committed in the
 * current version and commits at the event time. Updates run one at a time; {@link #submit}
 * queues them on a single worker thread.
 */
public class IncrementalUpdateEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(IncrementalUpdateEngine.class);

    private final ConstraintModelBuilder builder;
    private final SolverAdapter solver;
    private final ScheduleStore store;
    private final SchedulerSettings settings;

    private final ReentrantLock lock = new ReentrantLock();
    private final ExecutorService worker = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "schedule-updates");
        t.setDaemon(true);
        return t;
    });

    // Guarded by lock, replaced only when an update commits
    private OperationalDay day;
    private Set<String> cancelledFlights = Set.of();
    private Set<String> removedServices = Set.of();
    private Set<String> removedStaff = Set.of();
    private VariableTable lastTable;
    private AllocationModel lastModel;

    public IncrementalUpdateEngine(ConstraintModelBuilder builder, SolverAdapter solver, ScheduleStore store,
                                   SchedulerSettings settings) {
        this.builder = Objects.requireNonNull(builder, "builder");
        this.solver = Objects.requireNonNull(solver, "solver");
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    /**
     * Solves the whole day with its first instant as cutoff.
     *
     * @throws ModelBuildException when a service has no certified staff; the solver is not called
     */
    public UpdateResult createBaseline(OperationalDay operationalDay) {
        Objects.requireNonNull(operationalDay, "operationalDay");
        lock.lock();
        try {
            LocalDateTime cutoff = operationalDay.getDate().atStartOfDay();
            log.info("=== Baseline for {} ===", operationalDay);
            AllocationModel model = builder.build(operationalDay, operationalDay.getFlights(),
                    operationalDay.getRoster(), cutoff, null);
            UpdateResult result = solveAndCommit(model, Map.of(), cutoff);
            if (result.isCommitted()) {
                day = operationalDay;
                cancelledFlights = Set.of();
                removedServices = Set.of();
                removedStaff = Set.of();
                lastTable = model.getVariables();
                lastModel = model;
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies one disruption synchronously.
     *
     * @throws IllegalStateException    if no baseline was committed
     * @throws IllegalArgumentException if the event time is before the committed cutoff, or it
     *                                  reschedules a flight that departed or a replacement that
     *                                  departs at or before the event time
     * @throws ModelBuildException      when the remaining roster cannot serve a remaining service
     */
    public UpdateResult apply(DisruptionEvent event) {
        Objects.requireNonNull(event, "event");
        lock.lock();
        try {
            if (day == null) {
                throw new IllegalStateException("No baseline schedule has been committed");
            }
            LocalDateTime cutoff = event.getCurrentTime();
            ScheduleVersion committed = store.current();
            if (committed.getCutoff() != null && cutoff.isBefore(committed.getCutoff())) {
                throw new IllegalArgumentException("Event at " + cutoff + " is before committed cutoff "
                        + committed.getCutoff());
            }
            for (Flight f : event.getRescheduledFlights()) {
                checkReschedulable(f, cutoff);
            }
            log.info("Applying {}", event);

            OperationalDay candidate = day.withFlights(event.getRescheduledFlights()).withStaff(event.getAddedStaff());
            Set<String> cancelled = union(cancelledFlights, event.getInvalidFlights());
            Set<String> services = union(removedServices, event.getInvalidServices());
            Set<String> staffOut = union(removedStaff, event.getInvalidStaff());
            for (Staff s : event.getAddedStaff()) {
                staffOut.remove(s.getId());
            }

            List<Flight> futureFlights = new ArrayList<>();
            for (Flight f : candidate.getFlights()) {
                if (f.departsAfter(cutoff) && !cancelled.contains(f.getNumber())) {
                    futureFlights.add(f.withoutServices(services));
                }
            }
            List<Staff> roster = new ArrayList<>();
            for (Staff s : candidate.getRoster()) {
                if (!staffOut.contains(s.getId())) {
                    roster.add(s);
                }
            }
            log.info("  - {} future flights, {} staff on roster", futureFlights.size(), roster.size());

            AllocationModel model = builder.build(candidate, futureFlights, roster, cutoff, lastTable);
            Map<AssignmentKey, Boolean> hints = hintsFor(model, committed, event);
            UpdateResult result = solveAndCommit(model, hints, cutoff);
            if (result.isCommitted()) {
                day = candidate;
                cancelledFlights = Collections.unmodifiableSet(cancelled);
                removedServices = Collections.unmodifiableSet(services);
                removedStaff = Collections.unmodifiableSet(staffOut);
                lastTable = model.getVariables();
                lastModel = model;
            } else {
                log.warn("Disruption not absorbed ({}), schedule version {} stands", result.getStatus(), store.version());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /** Queues the event behind any update already running. */
    public CompletableFuture<UpdateResult> submit(DisruptionEvent event) {
        Objects.requireNonNull(event, "event");
        return CompletableFuture.supplyAsync(() -> apply(event), worker);
    }

    /**
     * True hints for model keys committed as true, unless the flight was rescheduled by this event.
     * Invalidated flights, services and staff have no variables in the model.
     */
    Map<AssignmentKey, Boolean> hintsFor(AllocationModel model, ScheduleVersion committed, DisruptionEvent event) {
        Map<AssignmentKey, Boolean> hints = new LinkedHashMap<>();
        for (AssignmentKey key : model.getVariables().keys()) {
            if (event.isRescheduled(key.getFlightNumber())
                    || event.getInvalidFlights().contains(key.getFlightNumber())
                    || event.getInvalidServices().contains(key.getServiceId())
                    || event.getInvalidStaff().contains(key.getStaffId())) {
                continue;
            }
            if (committed.committed(key).orElse(Boolean.FALSE)) {
                hints.put(key, Boolean.TRUE);
            }
        }
        return hints;
    }

    private UpdateResult solveAndCommit(AllocationModel model, Map<AssignmentKey, Boolean> hints, LocalDateTime cutoff) {
        SolveOutcome outcome;
        try {
            outcome = solver.solve(model, hints, settings.getObjective(), settings.getSolveBudget());
        } catch (RuntimeException e) {
            log.error("Solver adapter threw instead of reporting an outcome", e);
            outcome = SolveOutcome.error(e.getMessage());
        }
        log.info("Solver outcome: {}", outcome);

        if (outcome.isSolved()) {
            ScheduleVersion v = store.commit(outcome.getAssignments(), model.getDepartures(), cutoff);
            return new UpdateResult(UpdateStatus.COMMITTED, v.getNumber(), cutoff, model.variableCount(), hints.size(), outcome);
        }
        UpdateStatus status;
        if (outcome.getStatus() == SolveStatus.INFEASIBLE && outcome.getReason() != InfeasibilityReason.TIMEOUT) {
            status = UpdateStatus.UNRESOLVED;
        } else {
            status = UpdateStatus.FAILED;
            if (outcome.getStatus() == SolveStatus.ERROR) {
                log.error("Update failed: {}", outcome.getMessage());
            }
        }
        return new UpdateResult(status, store.version(), cutoff, model.variableCount(), hints.size(), outcome);
    }

    /** Only flights still ahead of the cutoff may move, and they must stay ahead of it. */
    private void checkReschedulable(Flight replacement, LocalDateTime cutoff) {
        Optional<Flight> current = day.findFlight(replacement.getNumber());
        if (current.isPresent() && !current.get().departsAfter(cutoff)) {
            throw new IllegalArgumentException("Flight " + replacement.getNumber() + " departed at "
                    + current.get().getDeparture() + " and cannot be rescheduled at " + cutoff);
        }
        if (!replacement.departsAfter(cutoff)) {
            throw new IllegalArgumentException("Rescheduled flight " + replacement.getNumber() + " departs at "
                    + replacement.getDeparture() + ", not after " + cutoff);
        }
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> result = new HashSet<>(a);
        result.addAll(b);
        return result;
    }

    public ScheduleStore getStore() {
        return store;
    }

    /** Domain state as of the last commit, null before the baseline. */
    public OperationalDay getDay() {
        lock.lock();
        try {
            return day;
        } finally {
            lock.unlock();
        }
    }

    /** Model of the last committed update, null before the baseline. */
    public AllocationModel getLastModel() {
        lock.lock();
        try {
            return lastModel;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(settings.getSolveBudget().toSeconds() + 5, TimeUnit.SECONDS)) {
                log.warn("Update worker did not stop, {} queued updates dropped", worker.shutdownNow().size());
            }
        } catch (InterruptedException e) {
            worker.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
