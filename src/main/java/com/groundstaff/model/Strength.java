package com.groundstaff.model;

/**
 * Score level a violated constraint is charged to.
 */
public enum Strength {
    HARD,
    MEDIUM
}
