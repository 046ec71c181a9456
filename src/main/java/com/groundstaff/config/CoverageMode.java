package com.groundstaff.config;

/**
 * Whether the staffing lower bound of a flight service is a hard constraint or a
 * medium-level penalty that leaves services uncovered instead of failing the solve.
 */
public enum CoverageMode {
    HARD,
    SOFT
}
