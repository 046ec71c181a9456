package com.groundstaff.model;

public enum ConstraintKind {
    COVERAGE,
    COMMON_LEVEL_EXCLUSIVITY,
    MULTI_FLIGHT_IDENTITY,
    MULTI_FLIGHT_EXCLUSIVITY,
    SERVICE_EXCLUSION,
    CROSS_UTILIZATION,
    FLIGHT_LEVEL_OVERLAP,
    FLIGHT_TRANSITION
}
