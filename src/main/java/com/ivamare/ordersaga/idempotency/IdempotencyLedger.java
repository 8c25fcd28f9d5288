package com.ivamare.ordersaga.idempotency;

import com.ivamare.ordersaga.exception.ConcurrencyConflictException;

import java.util.UUID;

/**
 * Record of messages that have already been handled for each order.
 *
 * <p>Entries are written in the same transaction as the events a message produced,
 * so a message is either fully handled and recorded, or neither.
 */
public interface IdempotencyLedger {

    boolean hasProcessed(UUID orderId, UUID messageId);

    /**
     * Mark a message as handled.
     *
     * @param orderId Order identity
     * @param messageId Message idempotency id
     * @param messageType Wire name of the message type
     * @param streamVersion Saga version after handling
     * @throws ConcurrencyConflictException if a concurrent handler recorded the same message first
     */
    void record(UUID orderId, UUID messageId, String messageType, long streamVersion);
}
