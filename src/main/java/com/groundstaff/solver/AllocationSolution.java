package com.groundstaff.solver;

import ai.timefold.solver.core.api.domain.solution.PlanningEntityCollectionProperty;
import ai.timefold.solver.core.api.domain.solution.PlanningScore;
import ai.timefold.solver.core.api.domain.solution.PlanningSolution;
import ai.timefold.solver.core.api.domain.solution.ProblemFactCollectionProperty;
import ai.timefold.solver.core.api.domain.valuerange.CountableValueRange;
import ai.timefold.solver.core.api.domain.valuerange.ValueRangeFactory;
import ai.timefold.solver.core.api.domain.valuerange.ValueRangeProvider;
import ai.timefold.solver.core.api.score.buildin.hardmediumsoft.HardMediumSoftScore;

import java.util.ArrayList;
import java.util.List;

/**
 * Timefold view of an allocation model.
 *
 * HARD: constraint bounds
 * MEDIUM: uncovered staffing when coverage is soft
 * SOFT: objective penalties
 */
@PlanningSolution
public class AllocationSolution {

    @ProblemFactCollectionProperty
    private List<ConstraintFact> constraints = new ArrayList<>();

    @ProblemFactCollectionProperty
    private List<ConstraintTerm> terms = new ArrayList<>();

    @PlanningEntityCollectionProperty
    private List<AssignmentDecision> decisions = new ArrayList<>();

    @PlanningScore
    private HardMediumSoftScore score;

    public AllocationSolution() {}

    public AllocationSolution(List<ConstraintFact> constraints, List<ConstraintTerm> terms,
                              List<AssignmentDecision> decisions) {
        this.constraints = constraints;
        this.terms = terms;
        this.decisions = decisions;
    }

    @ValueRangeProvider(id = "assignedRange")
    public CountableValueRange<Boolean> getAssignedRange() {
        return ValueRangeFactory.createBooleanValueRange();
    }

    // Getters and Setters
    public List<ConstraintFact> getConstraints() { return constraints; }
    public void setConstraints(List<ConstraintFact> constraints) { this.constraints = constraints; }

    public List<ConstraintTerm> getTerms() { return terms; }
    public void setTerms(List<ConstraintTerm> terms) { this.terms = terms; }

    public List<AssignmentDecision> getDecisions() { return decisions; }
    public void setDecisions(List<AssignmentDecision> decisions) { this.decisions = decisions; }

    public HardMediumSoftScore getScore() { return score; }
    public void setScore(HardMediumSoftScore score) { this.score = score; }
}
