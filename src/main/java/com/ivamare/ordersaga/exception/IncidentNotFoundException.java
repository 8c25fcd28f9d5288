package com.ivamare.ordersaga.exception;

/**
 * Raised when resolving an incident that does not exist or is already resolved.
 */
public class IncidentNotFoundException extends OrderSagaException {

    private final long incidentId;

    public IncidentNotFoundException(long incidentId) {
        super("No open incident with id " + incidentId);
        this.incidentId = incidentId;
    }

    public long getIncidentId() {
        return incidentId;
    }
}
