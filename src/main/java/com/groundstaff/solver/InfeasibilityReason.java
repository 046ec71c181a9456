package com.groundstaff.solver;

/**
 * Why an outcome is {@link SolveStatus#INFEASIBLE}.
 */
public enum InfeasibilityReason {
    /** The model cannot be satisfied, found without search. */
    PROVEN,
    /** The time budget ran out before a feasible assignment was found. */
    TIMEOUT,
    /** Search stopped improving without reaching feasibility. */
    NO_SOLUTION_FOUND
}
