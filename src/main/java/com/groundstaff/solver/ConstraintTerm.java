package com.groundstaff.solver;

/**
 * Problem fact: one {@code coefficient * x} term of a constraint, joined to its decision by index.
 */
public class ConstraintTerm {

    private ConstraintFact constraint;
    private int variable;
    private int coefficient;

    public ConstraintTerm() {}

    public ConstraintTerm(ConstraintFact constraint, int variable, int coefficient) {
        this.constraint = constraint;
        this.variable = variable;
        this.coefficient = coefficient;
    }

    public ConstraintFact getConstraint() { return constraint; }
    public int getVariable() { return variable; }
    public int getCoefficient() { return coefficient; }

    @Override
    public String toString() {
        return coefficient + "*x" + variable + " in #" + constraint.getId();
    }
}
