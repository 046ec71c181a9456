package com.groundstaff.engine;

import com.groundstaff.solver.SolveOutcome;
import com.groundstaff.solver.SolveStatus;

import java.time.LocalDateTime;

/**
 * What one baseline or incremental update did.
 */
public final class UpdateResult {

    private final UpdateStatus status;
    private final int version;
    private final LocalDateTime cutoff;
    private final int variableCount;
    private final int hintedCount;
    private final SolveOutcome outcome;

    UpdateResult(UpdateStatus status, int version, LocalDateTime cutoff, int variableCount, int hintedCount,
                 SolveOutcome outcome) {
        this.status = status;
        this.version = version;
        this.cutoff = cutoff;
        this.variableCount = variableCount;
        this.hintedCount = hintedCount;
        this.outcome = outcome;
    }

    public boolean isCommitted() {
        return status == UpdateStatus.COMMITTED;
    }

    public UpdateStatus getStatus() { return status; }
    /** Store version after the update; unchanged unless committed. */
    public int getVersion() { return version; }
    public LocalDateTime getCutoff() { return cutoff; }
    public int getVariableCount() { return variableCount; }
    public int getHintedCount() { return hintedCount; }
    public SolveStatus getSolveStatus() { return outcome.getStatus(); }
    public SolveOutcome getOutcome() { return outcome; }
    public String getMessage() { return outcome.getMessage(); }

    @Override
    public String toString() {
        return "UpdateResult{" + status + ", version=" + version + ", cutoff=" + cutoff + ", variables="
                + variableCount + ", hinted=" + hintedCount + ", " + outcome + "}";
    }
}
