package com.ivamare.ordersaga.ops;

import java.time.Instant;
import java.util.UUID;

/**
 * Operator-visible alert about one saga or message.
 *
 * @param incidentId Incident identity
 * @param orderId Order, when known
 * @param messageId Message that triggered the incident, when known
 * @param kind Incident category
 * @param detail Human readable description
 * @param raisedAt When the incident was raised
 * @param resolvedAt When an operator resolved it (null while open)
 * @param resolvedBy Operator who resolved it (null while open)
 */
public record SagaIncident(
    long incidentId,
    UUID orderId,
    UUID messageId,
    IncidentKind kind,
    String detail,
    Instant raisedAt,
    Instant resolvedAt,
    String resolvedBy
) {
    public boolean isOpen() {
        return resolvedAt == null;
    }
}
