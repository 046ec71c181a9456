package com.groundstaff.domain;

/**
 * Classification of a ground service, which decides how exclusively it occupies a staff member.
 *
 * FLIGHT_LEVEL (F): bound to one flight, several may be held at once.
 * COMMON_LEVEL (C): takes the staff member's exclusive attention for that flight.
 * MULTI_FLIGHT (M): performed identically across flights, to the exclusion of any other service.
 */
public enum ServiceType {
    FLIGHT_LEVEL("F"),
    COMMON_LEVEL("C"),
    MULTI_FLIGHT("M");

    private final String code;

    ServiceType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static ServiceType fromCode(String code) {
        for (ServiceType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown service type: " + code);
    }

    @Override
    public String toString() {
        return code;
    }
}
