package com.groundstaff.model;

/**
 * Structural infeasibility found while building a model, before any solve is attempted.
 */
public class ModelBuildException extends RuntimeException {

    private final String flightNumber;
    private final String serviceId;

    public ModelBuildException(String flightNumber, String serviceId, String message) {
        super(message);
        this.flightNumber = flightNumber;
        this.serviceId = serviceId;
    }

    public String getFlightNumber() { return flightNumber; }
    public String getServiceId() { return serviceId; }
}
