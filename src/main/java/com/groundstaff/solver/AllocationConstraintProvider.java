package com.groundstaff.solver;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoft.HardMediumSoftScore;
import ai.timefold.solver.core.api.score.stream.Constraint;
import ai.timefold.solver.core.api.score.stream.ConstraintCollectors;
import ai.timefold.solver.core.api.score.stream.ConstraintFactory;
import ai.timefold.solver.core.api.score.stream.ConstraintProvider;
import ai.timefold.solver.core.api.score.stream.Joiners;
import ai.timefold.solver.core.api.score.stream.bi.BiConstraintStream;
import com.groundstaff.model.Strength;

/**
 * Scores the linear constraints of an allocation model.
 *
 * Every term is joined to its decision and summed per constraint, so a constraint whose
 * decisions are all false still produces a group with sum 0 and its lower bound is checked.
 */
public class AllocationConstraintProvider implements ConstraintProvider {

    @Override
    public Constraint[] defineConstraints(ConstraintFactory factory) {
        return new Constraint[] {
            // HARD
            upperBound(factory),
            hardLowerBound(factory),

            // MEDIUM
            mediumLowerBound(factory),

            // SOFT
            specialistPreference(factory),
            hintDeviation(factory),
        };
    }

    // =========================================================================
    // HARD / MEDIUM: linear bounds
    // =========================================================================

    /**
     * Penalises the amount by which a constraint's sum exceeds its maximum.
     * Covers exclusivity pairs, over-staffing and cross utilization.
     */
    Constraint upperBound(ConstraintFactory factory) {
        return factory.forEach(ConstraintTerm.class)
            .filter(t -> t.getConstraint().hasMax())
            .join(AssignmentDecision.class,
                Joiners.equal(ConstraintTerm::getVariable, AssignmentDecision::getIndex))
            .groupBy((t, d) -> t.getConstraint(),
                ConstraintCollectors.sum((t, d) -> d.isTrue() ? t.getCoefficient() : 0))
            .filter((c, sum) -> sum > c.getMax())
            .penalize(HardMediumSoftScore.ONE_HARD, (c, sum) -> sum - c.getMax())
            .asConstraint("Upper bound");
    }

    /**
     * Shortfall below a hard minimum (staffing under hard coverage).
     */
    Constraint hardLowerBound(ConstraintFactory factory) {
        return lowerBound(factory, Strength.HARD)
            .penalize(HardMediumSoftScore.ONE_HARD, (c, sum) -> c.getMin() - sum)
            .asConstraint("Hard lower bound");
    }

    /**
     * Shortfall below a medium minimum: staff missing from a service under soft coverage.
     */
    Constraint mediumLowerBound(ConstraintFactory factory) {
        return lowerBound(factory, Strength.MEDIUM)
            .penalize(HardMediumSoftScore.ONE_MEDIUM, (c, sum) -> c.getMin() - sum)
            .asConstraint("Uncovered staffing");
    }

    private BiConstraintStream<ConstraintFact, Integer> lowerBound(
            ConstraintFactory factory, Strength strength) {
        return factory.forEach(ConstraintTerm.class)
            .filter(t -> t.getConstraint().hasMin() && t.getConstraint().getStrength() == strength)
            .join(AssignmentDecision.class,
                Joiners.equal(ConstraintTerm::getVariable, AssignmentDecision::getIndex))
            .groupBy((t, d) -> t.getConstraint(),
                ConstraintCollectors.sum((t, d) -> d.isTrue() ? t.getCoefficient() : 0))
            .filter((c, sum) -> sum < c.getMin());
    }

    // =========================================================================
    // SOFT: objective
    // =========================================================================

    /**
     * Prefer the least-certified eligible staff, keeping specialists free.
     */
    Constraint specialistPreference(ConstraintFactory factory) {
        return factory.forEach(AssignmentDecision.class)
            .filter(d -> d.isTrue() && d.getExcessCertifications() > 0)
            .penalize(HardMediumSoftScore.ONE_SOFT, AssignmentDecision::getExcessCertifications)
            .asConstraint("Specialist preference");
    }

    /**
     * Continuity with the previous schedule. Hint penalty is zero unless the objective asks for it.
     */
    Constraint hintDeviation(ConstraintFactory factory) {
        return factory.forEach(AssignmentDecision.class)
            .filter(d -> d.getHintPenalty() > 0 && d.deviatesFromHint())
            .penalize(HardMediumSoftScore.ONE_SOFT, AssignmentDecision::getHintPenalty)
            .asConstraint("Hint deviation");
    }
}
