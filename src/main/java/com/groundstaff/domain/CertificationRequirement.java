package com.groundstaff.domain;

import java.util.Collection;
import java.util.Set;

/**
 * How the certifications listed on a service must be matched by a staff member.
 */
public enum CertificationRequirement {
    ALL("All"),
    ANY("Any");

    private final String displayName;

    CertificationRequirement(String displayName) {
        this.displayName = displayName;
    }

    public boolean isSatisfiedBy(Set<String> held, Collection<String> required) {
        if (required.isEmpty()) {
            return true;
        }
        if (this == ALL) {
            return held.containsAll(required);
        }
        return required.stream().anyMatch(held::contains);
    }

    public static CertificationRequirement fromName(String name) {
        for (CertificationRequirement requirement : values()) {
            if (requirement.displayName.equalsIgnoreCase(name) || requirement.name().equalsIgnoreCase(name)) {
                return requirement;
            }
        }
        throw new IllegalArgumentException("Unknown certification requirement: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
