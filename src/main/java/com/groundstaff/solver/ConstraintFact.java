package com.groundstaff.solver;

import com.groundstaff.model.ConstraintKind;
import com.groundstaff.model.LinearConstraint;
import com.groundstaff.model.Strength;

/**
 * Problem fact wrapping one linear constraint of the model.
 */
public class ConstraintFact {

    private int id;
    private LinearConstraint constraint;

    public ConstraintFact() {}

    public ConstraintFact(int id, LinearConstraint constraint) {
        this.id = id;
        this.constraint = constraint;
    }

    public int getId() { return id; }
    public LinearConstraint getConstraint() { return constraint; }
    public ConstraintKind getKind() { return constraint.getKind(); }
    public Strength getStrength() { return constraint.getStrength(); }
    public boolean hasMin() { return constraint.hasMin(); }
    public boolean hasMax() { return constraint.hasMax(); }
    public int getMin() { return constraint.getMin(); }
    public int getMax() { return constraint.getMax(); }

    @Override
    public String toString() {
        return "#" + id + " " + constraint;
    }
}
