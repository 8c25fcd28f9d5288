package com.ivamare.ordersaga.domain;

/**
 * Lifecycle status of an order saga.
 *
 * <p>{@link #NOT_PLACED} is the status of an empty event stream. Every status between
 * {@link #PLACED} and {@link #SHIPPED} waits for a response from another service.
 */
public enum OrderStatus {
    /** No events recorded yet */
    NOT_PLACED,

    /** Order accepted, waiting for payment authorization */
    PLACED,

    /** Payment authorized, waiting for inventory reservation */
    RESERVING_INVENTORY,

    /** Inventory reserved, waiting for payment capture */
    CAPTURING_PAYMENT,

    /** Payment captured, waiting for the shipment to be dispatched */
    FULFILLING,

    /** Shipment dispatched, waiting for delivery confirmation */
    SHIPPED,

    /** Delivery confirmed */
    DELIVERED,

    /** Order cancelled, compensations enqueued */
    CANCELLED;

    /**
     * Check if this is a terminal status.
     * Terminal statuses are: DELIVERED, CANCELLED.
     */
    public boolean isTerminal() {
        return this == DELIVERED || this == CANCELLED;
    }

    /**
     * Check if the saga is waiting for a response in this status.
     */
    public boolean isAwaiting() {
        return this != NOT_PLACED && !isTerminal();
    }
}
