package com.groundstaff.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * {@code min <= sum(coefficient * x) <= max} over boolean decision variables.
 * {@link #NO_MIN} and {@link #NO_MAX} leave a side unbounded.
 */
public final class LinearConstraint {

    public static final int NO_MIN = Integer.MIN_VALUE;
    public static final int NO_MAX = Integer.MAX_VALUE;

    private final ConstraintKind kind;
    private final Strength strength;
    private final String label;
    private final int[] variables;
    private final int[] coefficients;
    private final int min;
    private final int max;

    public LinearConstraint(ConstraintKind kind, Strength strength, String label,
                            int[] variables, int[] coefficients, int min, int max) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.strength = Objects.requireNonNull(strength, "strength");
        this.label = label;
        if (variables.length != coefficients.length) {
            throw new IllegalArgumentException("Variables and coefficients differ in length for " + label);
        }
        if (min != NO_MIN && max != NO_MAX && min > max) {
            throw new IllegalArgumentException("Empty bound range " + min + ".." + max + " for " + label);
        }
        this.variables = variables.clone();
        this.coefficients = coefficients.clone();
        this.min = min;
        this.max = max;
    }

    /** At most one of the two variables may be true. */
    public static LinearConstraint exclusive(ConstraintKind kind, String label, int a, int b) {
        return new LinearConstraint(kind, Strength.HARD, label, new int[] {a, b}, new int[] {1, 1}, NO_MIN, 1);
    }

    public static LinearConstraint atMost(ConstraintKind kind, String label, int[] variables, int max) {
        return new LinearConstraint(kind, Strength.HARD, label, variables, ones(variables.length), NO_MIN, max);
    }

    public static LinearConstraint atLeast(ConstraintKind kind, Strength strength, String label, int[] variables, int min) {
        return new LinearConstraint(kind, strength, label, variables, ones(variables.length), min, NO_MAX);
    }

    public static LinearConstraint between(ConstraintKind kind, String label, int[] variables, int min, int max) {
        return new LinearConstraint(kind, Strength.HARD, label, variables, ones(variables.length), min, max);
    }

    private static int[] ones(int n) {
        int[] c = new int[n];
        Arrays.fill(c, 1);
        return c;
    }

    public long evaluate(boolean[] values) {
        long sum = 0;
        for (int i = 0; i < variables.length; i++) {
            if (values[variables[i]]) {
                sum += coefficients[i];
            }
        }
        return sum;
    }

    /** Distance of {@code lhs} from the bounds, 0 when satisfied. */
    public long violation(long lhs) {
        if (hasMin() && lhs < min) {
            return min - lhs;
        }
        if (hasMax() && lhs > max) {
            return lhs - max;
        }
        return 0;
    }

    /** Largest left-hand side reachable with the fixed-false variables held at false. */
    public long maxReachable(boolean[] fixedFalse) {
        long sum = 0;
        for (int i = 0; i < variables.length; i++) {
            if (!fixedFalse[variables[i]] && coefficients[i] > 0) {
                sum += coefficients[i];
            }
        }
        return sum;
    }

    public boolean hasMin() { return min != NO_MIN; }
    public boolean hasMax() { return max != NO_MAX; }

    public ConstraintKind getKind() { return kind; }
    public Strength getStrength() { return strength; }
    public String getLabel() { return label; }
    public int size() { return variables.length; }
    public int variable(int term) { return variables[term]; }
    public int coefficient(int term) { return coefficients[term]; }
    public int getMin() { return min; }
    public int getMax() { return max; }

    @Override
    public String toString() {
        return kind + "[" + label + "] " + (hasMin() ? min + " <= " : "") + "sum(" + variables.length + ")"
                + (hasMax() ? " <= " + max : "") + (strength == Strength.HARD ? "" : " (" + strength + ")");
    }
}
