package com.ivamare.ordersaga.store;

import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.exception.ConcurrencyConflictException;

import java.util.List;
import java.util.UUID;

/**
 * Append-only, per-order event streams with optimistic concurrency.
 */
public interface EventStore {

    /**
     * Load events after a given version, in version order.
     *
     * @param orderId Order identity
     * @param afterVersion Only events with a greater version are returned
     * @return Events (empty for an unknown order)
     */
    List<RecordedEvent> load(UUID orderId, long afterVersion);

    /**
     * Load the whole stream.
     */
    default List<RecordedEvent> load(UUID orderId) {
        return load(orderId, 0L);
    }

    /**
     * Append events to a stream whose head must be {@code expectedVersion}.
     *
     * @param orderId Order identity
     * @param expectedVersion Version the caller folded to (0 for a new stream)
     * @param events Events to append, numbered {@code expectedVersion + 1} onwards
     * @param causationId Message that caused the events
     * @return The appended events
     * @throws ConcurrencyConflictException if another writer already appended past {@code expectedVersion}
     */
    List<RecordedEvent> append(UUID orderId, long expectedVersion, List<SagaEvent> events, UUID causationId);

    /**
     * Current head version of a stream, 0 when the stream is empty.
     */
    long currentVersion(UUID orderId);
}
