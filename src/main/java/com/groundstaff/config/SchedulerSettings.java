package com.groundstaff.config;

import com.groundstaff.solver.Objective;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;

/**
 * Scheduler tuning, read from environment variables with defaults.
 */
public class SchedulerSettings {

    public static final String SOLVE_SECONDS = "SCHEDULER_SOLVE_SECONDS";
    public static final String UNIMPROVED_SECONDS = "SCHEDULER_UNIMPROVED_SECONDS";
    public static final String OVERLAP_BUFFER_MINUTES = "SCHEDULER_OVERLAP_BUFFER_MINUTES";
    public static final String DEFAULT_TRAVEL_MINUTES = "SCHEDULER_DEFAULT_TRAVEL_MINUTES";
    public static final String COVERAGE_MODE = "SCHEDULER_COVERAGE_MODE";
    public static final String OBJECTIVE = "SCHEDULER_OBJECTIVE";
    public static final String CONTINUITY_WEIGHT = "SCHEDULER_CONTINUITY_WEIGHT";
    public static final String FLIGHT_LEVEL_OVERLAP = "SCHEDULER_FLIGHT_LEVEL_OVERLAP";
    public static final String FLIGHT_TRANSITIONS = "SCHEDULER_FLIGHT_TRANSITIONS";

    private Duration solveBudget = Duration.ofSeconds(10);
    private Duration unimprovedBudget = Duration.ofSeconds(2);
    private int overlapBufferMinutes = 15;
    private int defaultTravelMinutes = 5;
    private CoverageMode coverageMode = CoverageMode.HARD;
    private Objective objective = Objective.MINIMIZE_UNCOVERED;
    private int continuityWeight = 10;
    private boolean flightLevelOverlap = false;
    private boolean flightTransitions = true;

    public SchedulerSettings() {}

    public static SchedulerSettings fromEnvironment() {
        return from(System::getenv);
    }

    public static SchedulerSettings fromMap(Map<String, String> values) {
        return from(values::get);
    }

    private static SchedulerSettings from(Function<String, String> env) {
        SchedulerSettings settings = new SchedulerSettings();
        settings.setSolveBudget(Duration.ofSeconds(getLong(env, SOLVE_SECONDS, 10)));
        settings.setUnimprovedBudget(Duration.ofSeconds(getLong(env, UNIMPROVED_SECONDS, 2)));
        settings.setOverlapBufferMinutes(getInt(env, OVERLAP_BUFFER_MINUTES, 15));
        settings.setDefaultTravelMinutes(getInt(env, DEFAULT_TRAVEL_MINUTES, 5));
        settings.setCoverageMode(getEnum(env, COVERAGE_MODE, CoverageMode.class, CoverageMode.HARD));
        settings.setObjective(getEnum(env, OBJECTIVE, Objective.class, Objective.MINIMIZE_UNCOVERED));
        settings.setContinuityWeight(getInt(env, CONTINUITY_WEIGHT, 10));
        settings.setFlightLevelOverlap(getBoolean(env, FLIGHT_LEVEL_OVERLAP, false));
        settings.setFlightTransitions(getBoolean(env, FLIGHT_TRANSITIONS, true));
        return settings;
    }

    private static String getEnv(Function<String, String> env, String name, String defaultValue) {
        String value = env.apply(name);
        return value != null && !value.isBlank() ? value.trim() : defaultValue;
    }

    private static int getInt(Function<String, String> env, String name, int defaultValue) {
        long value = getLong(env, name, defaultValue);
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'");
        }
        return (int) value;
    }

    private static long getLong(Function<String, String> env, String name, long defaultValue) {
        String value = getEnv(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    private static boolean getBoolean(Function<String, String> env, String name, boolean defaultValue) {
        String value = getEnv(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
            return Boolean.parseBoolean(value);
        }
        throw new IllegalArgumentException(name + " must be true or false, got '" + value + "'");
    }

    private static <E extends Enum<E>> E getEnum(Function<String, String> env, String name, Class<E> type, E defaultValue) {
        String value = getEnv(env, name, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(name + " has unknown value '" + value + "'", e);
        }
    }

    // Getters and Setters
    public Duration getSolveBudget() { return solveBudget; }
    public void setSolveBudget(Duration solveBudget) {
        if (solveBudget == null || solveBudget.isZero() || solveBudget.isNegative()) {
            throw new IllegalArgumentException("Solve budget must be positive: " + solveBudget);
        }
        this.solveBudget = solveBudget;
    }

    public Duration getUnimprovedBudget() { return unimprovedBudget; }
    public void setUnimprovedBudget(Duration unimprovedBudget) {
        if (unimprovedBudget == null || unimprovedBudget.isZero() || unimprovedBudget.isNegative()) {
            throw new IllegalArgumentException("Unimproved budget must be positive: " + unimprovedBudget);
        }
        this.unimprovedBudget = unimprovedBudget;
    }

    public int getOverlapBufferMinutes() { return overlapBufferMinutes; }
    public void setOverlapBufferMinutes(int overlapBufferMinutes) {
        if (overlapBufferMinutes < 0) {
            throw new IllegalArgumentException("Overlap buffer must not be negative: " + overlapBufferMinutes);
        }
        this.overlapBufferMinutes = overlapBufferMinutes;
    }

    public int getDefaultTravelMinutes() { return defaultTravelMinutes; }
    public void setDefaultTravelMinutes(int defaultTravelMinutes) {
        if (defaultTravelMinutes <= 0) {
            throw new IllegalArgumentException("Default travel time must be positive: " + defaultTravelMinutes);
        }
        this.defaultTravelMinutes = defaultTravelMinutes;
    }

    public CoverageMode getCoverageMode() { return coverageMode; }
    public void setCoverageMode(CoverageMode coverageMode) {
        if (coverageMode == null) {
            throw new IllegalArgumentException("Coverage mode is required");
        }
        this.coverageMode = coverageMode;
    }

    public Objective getObjective() { return objective; }
    public void setObjective(Objective objective) {
        if (objective == null) {
            throw new IllegalArgumentException("Objective is required");
        }
        this.objective = objective;
    }

    public int getContinuityWeight() { return continuityWeight; }
    public void setContinuityWeight(int continuityWeight) {
        if (continuityWeight < 0) {
            throw new IllegalArgumentException("Continuity weight must not be negative: " + continuityWeight);
        }
        this.continuityWeight = continuityWeight;
    }

    public boolean isFlightLevelOverlap() { return flightLevelOverlap; }
    public void setFlightLevelOverlap(boolean flightLevelOverlap) { this.flightLevelOverlap = flightLevelOverlap; }

    public boolean isFlightTransitions() { return flightTransitions; }
    public void setFlightTransitions(boolean flightTransitions) { this.flightTransitions = flightTransitions; }

    @Override
    public String toString() {
        return "SchedulerSettings{budget=" + solveBudget.getSeconds() + "s, unimproved=" + unimprovedBudget.getSeconds()
                + "s, buffer=" + overlapBufferMinutes + "min, travel=" + defaultTravelMinutes
                + "min, coverage=" + coverageMode + ", objective=" + objective
                + ", continuityWeight=" + continuityWeight + ", flightLevelOverlap=" + flightLevelOverlap
                + ", transitions=" + flightTransitions + "}";
    }
}
