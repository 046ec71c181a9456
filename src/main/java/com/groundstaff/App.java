package com.groundstaff;

import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.domain.OperationalDay;
import com.groundstaff.engine.DisruptionEvent;
import com.groundstaff.engine.IncrementalUpdateEngine;
import com.groundstaff.engine.UpdateResult;
import com.groundstaff.model.ConstraintModelBuilder;
import com.groundstaff.model.ModelBuildException;
import com.groundstaff.persistence.JsonDataRepository;
import com.groundstaff.schedule.FlightAllocation;
import com.groundstaff.schedule.ScheduleStore;
import com.groundstaff.solver.TimefoldSolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Runs the baseline allocation for a day, then replays its disruption events.
 *
 * Usage: {@code App <dataDir> [yyyy-MM-dd]}. Tuning comes from SCHEDULER_* environment variables.
 */
public class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        if (args.length < 1) {
            log.error("Usage: App <dataDir> [yyyy-MM-dd]");
            System.exit(2);
        }
        try {
            log.info("=== Ground Staff Scheduler Starting ===");
            Path dataDir = Path.of(args[0]);
            LocalDate date = args.length > 1 ? LocalDate.parse(args[1]) : LocalDate.now();

            SchedulerSettings settings = SchedulerSettings.fromEnvironment();
            log.info("Settings: {}", settings);

            JsonDataRepository repository = new JsonDataRepository(dataDir);
            OperationalDay day = repository.loadDay(date);
            List<DisruptionEvent> events = repository.loadDisruptions(date);

            log.info("Problem loaded:");
            log.info("  - {} flights", day.getFlights().size());
            log.info("  - {} staff members", day.getRoster().size());
            log.info("  - {} services", day.getServices().size());
            log.info("  - {} disruption events", events.size());

            ScheduleStore store = new ScheduleStore();
            try (IncrementalUpdateEngine engine = new IncrementalUpdateEngine(
                    new ConstraintModelBuilder(settings), new TimefoldSolverAdapter(settings), store, settings)) {

                UpdateResult baseline = engine.createBaseline(day);
                log.info("Baseline: {}", baseline);
                if (!baseline.isCommitted()) {
                    log.error("No baseline schedule: {}", baseline.getMessage());
                    System.exit(1);
                }
                logAllocations(store);

                for (DisruptionEvent event : events) {
                    log.info("\n=== {} ===", event.getDescription() != null ? event.getDescription() : event);
                    UpdateResult result = engine.apply(event);
                    log.info("Result: {}", result);
                    if (result.isCommitted()) {
                        logAllocations(store);
                    }
                }
            }

            log.info("\n=== Done (schedule version {}) ===", store.version());

        } catch (ModelBuildException e) {
            log.error("Structurally infeasible input: {}", e.getMessage());
            System.exit(1);
        } catch (Exception e) {
            log.error("Error running scheduler", e);
            System.exit(1);
        }
    }

    private static void logAllocations(ScheduleStore store) {
        log.info("=== Allocations (version {}) ===", store.version());
        for (FlightAllocation allocation : store.allocations()) {
            log.info("  {} (dep {})", allocation.getFlightNumber(), allocation.getDeparture().toLocalTime());
            for (Map.Entry<String, List<String>> e : allocation.getStaffByService().entrySet()) {
                log.info("    {} -> {}", e.getKey(), e.getValue().isEmpty() ? "UNCOVERED" : e.getValue());
            }
        }
    }
}
