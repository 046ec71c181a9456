package com.groundstaff.solver;

/**
 * What the solver optimises once the hard constraints hold.
 */
public enum Objective {
    /** Cover every service; among equals prefer staff with fewer certifications. */
    MINIMIZE_UNCOVERED,
    /** As above, and additionally penalise every deviation from a warm-start hint. */
    MAXIMIZE_CONTINUITY
}
