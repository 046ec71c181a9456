package com.groundstaff.solver;

import com.groundstaff.model.AssignmentKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one solver call. Assignments are present only for OPTIMAL and FEASIBLE outcomes.
 */
public final class SolveOutcome {

    private final SolveStatus status;
    private final Map<AssignmentKey, Boolean> assignments;
    private final String score;
    private final InfeasibilityReason reason;
    private final String message;

    private SolveOutcome(SolveStatus status, Map<AssignmentKey, Boolean> assignments, String score,
                         InfeasibilityReason reason, String message) {
        this.status = Objects.requireNonNull(status, "status");
        this.assignments = Collections.unmodifiableMap(new LinkedHashMap<>(assignments));
        this.score = score;
        this.reason = reason;
        this.message = message;
    }

    public static SolveOutcome optimal(Map<AssignmentKey, Boolean> assignments, String score) {
        return new SolveOutcome(SolveStatus.OPTIMAL, assignments, score, null, null);
    }

    public static SolveOutcome feasible(Map<AssignmentKey, Boolean> assignments, String score) {
        return new SolveOutcome(SolveStatus.FEASIBLE, assignments, score, null, null);
    }

    public static SolveOutcome infeasible(InfeasibilityReason reason, String score, String message) {
        return new SolveOutcome(SolveStatus.INFEASIBLE, Map.of(), score, Objects.requireNonNull(reason, "reason"), message);
    }

    public static SolveOutcome error(String message) {
        return new SolveOutcome(SolveStatus.ERROR, Map.of(), null, null, message);
    }

    public boolean isSolved() {
        return status == SolveStatus.OPTIMAL || status == SolveStatus.FEASIBLE;
    }

    public SolveStatus getStatus() { return status; }
    public Map<AssignmentKey, Boolean> getAssignments() { return assignments; }
    public String getScore() { return score; }
    public InfeasibilityReason getReason() { return reason; }
    public String getMessage() { return message; }

    @Override
    public String toString() {
        return "SolveOutcome{" + status + (reason != null ? "(" + reason + ")" : "")
                + (score != null ? ", score=" + score : "") + (message != null ? ", " + message : "") + "}";
    }
}
