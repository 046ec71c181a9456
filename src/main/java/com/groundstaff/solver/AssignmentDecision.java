package com.groundstaff.solver;

import ai.timefold.solver.core.api.domain.entity.PlanningEntity;
import ai.timefold.solver.core.api.domain.entity.PlanningPin;
import ai.timefold.solver.core.api.domain.lookup.PlanningId;
import ai.timefold.solver.core.api.domain.variable.PlanningVariable;
import com.groundstaff.model.AssignmentKey;

/**
 * One boolean decision of the model: is the staff assigned to the service on the flight.
 *
 * - Pinned decisions (staff unavailable) stay false
 * - A hint is the starting value; the construction heuristic only fills decisions without one
 */
@PlanningEntity
public class AssignmentDecision {

    @PlanningId
    private Integer index;

    private AssignmentKey key;

    @PlanningVariable(valueRangeProviderRefs = "assignedRange")
    private Boolean assigned;

    @PlanningPin
    private boolean pinned;

    private Boolean hint;
    private int hintPenalty;            // soft penalty when the value differs from the hint
    private int excessCertifications;   // soft penalty when assigned

    public AssignmentDecision() {}

    public AssignmentDecision(int index, AssignmentKey key) {
        this.index = index;
        this.key = key;
    }

    public boolean isTrue() {
        return Boolean.TRUE.equals(assigned);
    }

    public boolean deviatesFromHint() {
        return hint != null && assigned != null && !hint.equals(assigned);
    }

    // Getters and Setters
    public Integer getIndex() { return index; }
    public void setIndex(Integer index) { this.index = index; }

    public AssignmentKey getKey() { return key; }
    public void setKey(AssignmentKey key) { this.key = key; }

    public Boolean getAssigned() { return assigned; }
    public void setAssigned(Boolean assigned) { this.assigned = assigned; }

    public boolean isPinned() { return pinned; }
    public void setPinned(boolean pinned) { this.pinned = pinned; }

    public Boolean getHint() { return hint; }
    public void setHint(Boolean hint) { this.hint = hint; }

    public int getHintPenalty() { return hintPenalty; }
    public void setHintPenalty(int hintPenalty) { this.hintPenalty = hintPenalty; }

    public int getExcessCertifications() { return excessCertifications; }
    public void setExcessCertifications(int excessCertifications) { this.excessCertifications = excessCertifications; }

    @Override
    public String toString() {
        return "Decision{" + key + "=" + assigned + (pinned ? " pinned" : "") + (hint != null ? " hint=" + hint : "") + "}";
    }
}
