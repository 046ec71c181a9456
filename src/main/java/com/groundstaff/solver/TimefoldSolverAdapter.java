package com.groundstaff.solver;

import ai.timefold.solver.core.api.score.buildin.hardmediumsoft.HardMediumSoftScore;
import ai.timefold.solver.core.api.solver.Solver;
import ai.timefold.solver.core.api.solver.SolverFactory;
import ai.timefold.solver.core.config.constructionheuristic.ConstructionHeuristicPhaseConfig;
import ai.timefold.solver.core.config.localsearch.LocalSearchPhaseConfig;
import ai.timefold.solver.core.config.localsearch.LocalSearchType;
import ai.timefold.solver.core.config.solver.SolverConfig;
import ai.timefold.solver.core.config.solver.termination.TerminationConfig;
import com.groundstaff.config.SchedulerSettings;
import com.groundstaff.model.AllocationModel;
import com.groundstaff.model.AssignmentKey;
import com.groundstaff.model.LinearConstraint;
import com.groundstaff.model.Strength;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Solves allocation models with Timefold: construction heuristic for decisions without a hint,
 * then late acceptance local search until the budget, the unimproved limit or a perfect score.
 */
public class TimefoldSolverAdapter implements SolverAdapter {

    private static final Logger log = LoggerFactory.getLogger(TimefoldSolverAdapter.class);

    private static final int MAX_LISTED_CONSTRAINTS = 5;

    private final SchedulerSettings settings;

    public TimefoldSolverAdapter(SchedulerSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    @Override
    public SolveOutcome solve(AllocationModel model, Map<AssignmentKey, Boolean> hints, Objective objective,
                              Duration timeBudget) {
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(objective, "objective");
        if (timeBudget == null || timeBudget.isZero() || timeBudget.isNegative()) {
            throw new IllegalArgumentException("Time budget must be positive: " + timeBudget);
        }
        Map<AssignmentKey, Boolean> safeHints = hints == null ? Map.of() : hints;

        if (model.isEmpty()) {
            return SolveOutcome.optimal(Map.of(), HardMediumSoftScore.ZERO.toString());
        }
        List<LinearConstraint> unsatisfiable = model.structuralViolations();
        if (!unsatisfiable.isEmpty()) {
            String message = "Unsatisfiable before search: " + describe(unsatisfiable);
            log.warn(message);
            return SolveOutcome.infeasible(InfeasibilityReason.PROVEN, null, message);
        }

        AllocationSolution problem = toSolution(model, safeHints, objective);
        long movable = problem.getDecisions().stream().filter(d -> !d.isPinned()).count();
        if (movable == 0) {
            return evaluateFixed(model);
        }

        SolverConfig solverConfig = new SolverConfig()
            .withSolutionClass(AllocationSolution.class)
            .withEntityClasses(AssignmentDecision.class)
            .withConstraintProviderClass(AllocationConstraintProvider.class)
            .withPhases(
                // Only decisions without a hint are uninitialized
                new ConstructionHeuristicPhaseConfig(),
                new LocalSearchPhaseConfig()
                    .withLocalSearchType(LocalSearchType.LATE_ACCEPTANCE)
            )
            .withTerminationConfig(
                new TerminationConfig()
                    .withSpentLimit(timeBudget)
                    .withUnimprovedSpentLimit(min(settings.getUnimprovedBudget(), timeBudget))
                    .withBestScoreLimit("0hard/0medium/0soft")
            );

        log.info("Solving {} decisions ({} movable, {} hinted) with {} in at most {}s",
                problem.getDecisions().size(), movable, countHinted(problem), objective, timeBudget.toSeconds());
        long startTime = System.currentTimeMillis();
        AllocationSolution solution;
        try {
            Solver<AllocationSolution> solver = SolverFactory.<AllocationSolution>create(solverConfig).buildSolver();
            solution = solver.solve(problem);
        } catch (RuntimeException e) {
            log.error("Solver failed", e);
            return SolveOutcome.error("Solver failed: " + e.getMessage());
        }
        long elapsed = System.currentTimeMillis() - startTime;

        HardMediumSoftScore score = solution.getScore();
        log.info("Solver finished in {} seconds, score {}", elapsed / 1000.0, score);
        if (score == null || !score.isSolutionInitialized()) {
            return SolveOutcome.infeasible(InfeasibilityReason.TIMEOUT, String.valueOf(score),
                    "Budget exhausted before every decision was initialized");
        }
        if (!score.isFeasible()) {
            InfeasibilityReason reason = elapsed >= timeBudget.toMillis()
                    ? InfeasibilityReason.TIMEOUT : InfeasibilityReason.NO_SOLUTION_FOUND;
            return SolveOutcome.infeasible(reason, score.toString(),
                    "Best score still breaks " + (-score.hardScore()) + " hard constraint units");
        }

        Map<AssignmentKey, Boolean> assignments = new LinkedHashMap<>();
        for (AssignmentDecision d : solution.getDecisions()) {
            assignments.put(d.getKey(), d.isTrue());
        }
        return score.equals(HardMediumSoftScore.ZERO)
                ? SolveOutcome.optimal(assignments, score.toString())
                : SolveOutcome.feasible(assignments, score.toString());
    }

    AllocationSolution toSolution(AllocationModel model, Map<AssignmentKey, Boolean> hints, Objective objective) {
        int hintPenalty = objective == Objective.MAXIMIZE_CONTINUITY ? settings.getContinuityWeight() : 0;
        List<AssignmentDecision> decisions = new ArrayList<>(model.variableCount());
        for (int i = 0; i < model.variableCount(); i++) {
            AssignmentDecision d = new AssignmentDecision(i, model.key(i));
            d.setExcessCertifications(model.excessCertifications(i));
            if (model.isFixedFalse(i)) {
                d.setPinned(true);
                d.setAssigned(Boolean.FALSE);
            } else {
                Boolean hint = hints.get(model.key(i));
                if (hint != null) {
                    d.setHint(hint);
                    d.setAssigned(hint);
                    d.setHintPenalty(hintPenalty);
                }
            }
            decisions.add(d);
        }

        List<ConstraintFact> facts = new ArrayList<>(model.getConstraints().size());
        List<ConstraintTerm> terms = new ArrayList<>();
        for (LinearConstraint c : model.getConstraints()) {
            ConstraintFact fact = new ConstraintFact(facts.size(), c);
            facts.add(fact);
            for (int t = 0; t < c.size(); t++) {
                terms.add(new ConstraintTerm(fact, c.variable(t), c.coefficient(t)));
            }
        }
        return new AllocationSolution(facts, terms, decisions);
    }

    /** Every decision is pinned to false, so the outcome follows from the bounds alone. */
    private SolveOutcome evaluateFixed(AllocationModel model) {
        Map<AssignmentKey, Boolean> assignments = new LinkedHashMap<>();
        for (int i = 0; i < model.variableCount(); i++) {
            assignments.put(model.key(i), Boolean.FALSE);
        }
        List<LinearConstraint> violated = model.violatedConstraints(assignments);
        long medium = 0;
        for (LinearConstraint c : violated) {
            if (c.getStrength() != Strength.MEDIUM) {
                return SolveOutcome.infeasible(InfeasibilityReason.PROVEN, null, "No staff available: " + describe(violated));
            }
            // every term is false
            medium += c.violation(0);
        }
        return medium == 0
                ? SolveOutcome.optimal(assignments, HardMediumSoftScore.ZERO.toString())
                : SolveOutcome.feasible(assignments, HardMediumSoftScore.ofMedium((int) -medium).toString());
    }

    private static long countHinted(AllocationSolution problem) {
        return problem.getDecisions().stream().filter(d -> d.getHint() != null).count();
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }

    private static String describe(List<LinearConstraint> constraints) {
        String listed = constraints.stream()
            .limit(MAX_LISTED_CONSTRAINTS)
            .map(LinearConstraint::toString)
            .collect(Collectors.joining(", "));
        return constraints.size() > MAX_LISTED_CONSTRAINTS
                ? listed + " and " + (constraints.size() - MAX_LISTED_CONSTRAINTS) + " more"
                : listed;
    }
}
