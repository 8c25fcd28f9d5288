package com.ivamare.ordersaga.store;

import com.ivamare.ordersaga.domain.event.SagaEvent;

import java.time.Instant;
import java.util.UUID;

/**
 * An event as stored in a saga's stream.
 *
 * @param orderId Stream (order) identity
 * @param version Position in the stream, starting at 1
 * @param event The event
 * @param causationId Inbound message that caused the event
 * @param recordedAt When the event was appended
 */
public record RecordedEvent(
    UUID orderId,
    long version,
    SagaEvent event,
    UUID causationId,
    Instant recordedAt
) {
}
