package com.groundstaff.domain;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Catalog entry for a ground service (Refueling, Toilet Cleaning, GPU, ...).
 * This is a ProblemFact; occurrences on a flight are {@link FlightService}s.
 */
public final class Service {

    private final String id;
    private final String name;
    private final ServiceType type;
    private final List<String> certifications;
    private final CertificationRequirement certificationRequirement;
    private final int crossUtilizationLimit;     // FlightLevel only, 0 = unlimited
    private final Set<String> excludeServices;   // service ids this one may not be combined with

    public Service(String id, String name, ServiceType type, List<String> certifications,
                   CertificationRequirement certificationRequirement,
                   int crossUtilizationLimit, Set<String> excludeServices) {
        this.id = Objects.requireNonNull(id, "id");
        this.name = name == null ? id : name;
        this.type = Objects.requireNonNull(type, "type");
        this.certifications = List.copyOf(certifications);
        this.certificationRequirement = Objects.requireNonNull(certificationRequirement, "certificationRequirement");
        if (crossUtilizationLimit < 0) {
            throw new IllegalArgumentException("Negative cross utilization limit for service " + id);
        }
        this.crossUtilizationLimit = crossUtilizationLimit;
        this.excludeServices = Set.copyOf(excludeServices);
    }

    /** Single required certification, matched with {@link CertificationRequirement#ALL}. */
    public static Service of(String id, ServiceType type, String certification) {
        return new Service(id, id, type, List.of(certification), CertificationRequirement.ALL, 0, Set.of());
    }

    public boolean isEligible(Staff staff) {
        return certificationRequirement.isSatisfiedBy(staff.getCertifications(), certifications);
    }

    public boolean excludes(String otherServiceId) {
        return excludeServices.contains(otherServiceId);
    }

    // Getters
    public String getId() { return id; }
    public String getName() { return name; }
    public ServiceType getType() { return type; }
    public List<String> getCertifications() { return certifications; }
    public CertificationRequirement getCertificationRequirement() { return certificationRequirement; }
    public int getCrossUtilizationLimit() { return crossUtilizationLimit; }
    public Set<String> getExcludeServices() { return excludeServices; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return id.equals(((Service) o).id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Service{" + id + " (" + type + ")}";
    }
}
