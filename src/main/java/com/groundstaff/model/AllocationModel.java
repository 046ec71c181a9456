package com.groundstaff.model;

import com.groundstaff.domain.Flight;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Solver-ready model: variable table, per-variable metadata and the linear constraints.
 * Immutable once built.
 */
public final class AllocationModel {

    private final LocalDateTime cutoff;
    private final VariableTable variables;
    private final boolean[] fixedFalse;
    private final int[] excessCertifications;
    private final List<LinearConstraint> constraints;
    private final Map<String, LocalDateTime> departures;

    AllocationModel(LocalDateTime cutoff, VariableTable variables, boolean[] fixedFalse, int[] excessCertifications,
                    List<LinearConstraint> constraints, List<Flight> flights) {
        this.cutoff = cutoff;
        this.variables = variables;
        this.fixedFalse = fixedFalse;
        this.excessCertifications = excessCertifications;
        this.constraints = Collections.unmodifiableList(new ArrayList<>(constraints));
        Map<String, LocalDateTime> deps = new LinkedHashMap<>();
        for (Flight f : flights) {
            deps.put(f.getNumber(), f.getDeparture());
        }
        this.departures = Collections.unmodifiableMap(deps);
    }

    public static AllocationModel empty(LocalDateTime cutoff) {
        return new AllocationModel(cutoff, VariableTable.empty(), new boolean[0], new int[0], List.of(), List.of());
    }

    public int variableCount() {
        return variables.size();
    }

    public boolean isEmpty() {
        return variables.size() == 0;
    }

    public AssignmentKey key(int variable) {
        return variables.key(variable);
    }

    public boolean isFixedFalse(int variable) {
        return fixedFalse[variable];
    }

    public int fixedCount() {
        int n = 0;
        for (boolean f : fixedFalse) {
            if (f) n++;
        }
        return n;
    }

    /**
     * Certifications the staff holds beyond the least-certified eligible staff of the same
     * flight service. Used to keep specialists free for work only they can do.
     */
    public int excessCertifications(int variable) {
        return excessCertifications[variable];
    }

    public List<LinearConstraint> constraintsOf(ConstraintKind kind) {
        List<LinearConstraint> result = new ArrayList<>();
        for (LinearConstraint c : constraints) {
            if (c.getKind() == kind) {
                result.add(c);
            }
        }
        return result;
    }

    /** Hard lower bounds that cannot be met even with every free variable set to true. */
    public List<LinearConstraint> structuralViolations() {
        List<LinearConstraint> result = new ArrayList<>();
        for (LinearConstraint c : constraints) {
            if (c.getStrength() == Strength.HARD && c.hasMin() && c.maxReachable(fixedFalse) < c.getMin()) {
                result.add(c);
            }
        }
        return result;
    }

    /** Constraints the assignment violates. Keys outside the model are ignored, missing keys read as false. */
    public List<LinearConstraint> violatedConstraints(Map<AssignmentKey, Boolean> assignment) {
        boolean[] values = new boolean[variables.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = Boolean.TRUE.equals(assignment.get(variables.key(i)));
        }
        List<LinearConstraint> result = new ArrayList<>();
        for (LinearConstraint c : constraints) {
            if (c.violation(c.evaluate(values)) > 0) {
                result.add(c);
            }
        }
        return result;
    }

    public LocalDateTime getCutoff() { return cutoff; }
    public VariableTable getVariables() { return variables; }
    public List<LinearConstraint> getConstraints() { return constraints; }
    /** Departure per flight in scope, in build order. */
    public Map<String, LocalDateTime> getDepartures() { return departures; }

    @Override
    public String toString() {
        return "AllocationModel{cutoff=" + cutoff + ", flights=" + departures.size() + ", variables="
                + variables.size() + " (" + fixedCount() + " fixed), constraints=" + constraints.size() + "}";
    }
}
