package com.ivamare.ordersaga.exception;

import java.util.UUID;

/**
 * Raised when another writer appended to the same saga stream first.
 *
 * <p>The whole handling attempt is retried against freshly loaded state.
 */
public class ConcurrencyConflictException extends OrderSagaException {

    private final UUID orderId;
    private final long expectedVersion;

    public ConcurrencyConflictException(UUID orderId, long expectedVersion, String message) {
        super("Concurrent write on order " + orderId + " at version " + expectedVersion + ": " + message);
        this.orderId = orderId;
        this.expectedVersion = expectedVersion;
    }

    public ConcurrencyConflictException(UUID orderId, long expectedVersion, Throwable cause) {
        super("Concurrent write on order " + orderId + " at version " + expectedVersion, cause);
        this.orderId = orderId;
        this.expectedVersion = expectedVersion;
    }

    public UUID getOrderId() {
        return orderId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }
}
