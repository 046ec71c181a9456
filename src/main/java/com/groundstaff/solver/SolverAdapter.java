package com.groundstaff.solver;

import com.groundstaff.model.AllocationModel;
import com.groundstaff.model.AssignmentKey;

import java.time.Duration;
import java.util.Map;

/**
 * Boundary to the combinatorial solver. Implementations must return within the time budget
 * and report failures as outcomes rather than exceptions.
 */
public interface SolverAdapter {

    /**
     * @param hints non-binding starting values; keys outside the model are ignored
     */
    SolveOutcome solve(AllocationModel model, Map<AssignmentKey, Boolean> hints, Objective objective, Duration timeBudget);
}
