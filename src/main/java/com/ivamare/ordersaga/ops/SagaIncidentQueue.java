package com.ivamare.ordersaga.ops;

import com.ivamare.ordersaga.exception.IncidentNotFoundException;

import java.util.List;
import java.util.UUID;

/**
 * Incidents raised by the saga runtime and router for operators to follow up.
 *
 * <p>Example:
 * <pre>
 * // Look at what needs attention
 * List&lt;SagaIncident&gt; open = incidents.listOpen(50);
 *
 * // Mark one as handled
 * incidents.resolve(open.get(0).incidentId(), "admin");
 * </pre>
 */
public interface SagaIncidentQueue {

    /**
     * Raise a new incident.
     *
     * @param orderId Order (nullable when the message could not be decoded)
     * @param messageId Triggering message (nullable)
     * @param kind Incident category
     * @param detail Description
     * @return Incident id
     */
    long raise(UUID orderId, UUID messageId, IncidentKind kind, String detail);

    /**
     * List unresolved incidents, oldest first.
     *
     * @param limit Maximum number of incidents to return
     */
    List<SagaIncident> listOpen(int limit);

    int countOpen();

    /**
     * Mark an incident as resolved.
     *
     * @param incidentId Incident to resolve
     * @param operator Who resolved it
     * @throws IncidentNotFoundException if no open incident has this id
     */
    void resolve(long incidentId, String operator);
}
