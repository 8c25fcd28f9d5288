package com.ivamare.ordersaga.exception;

import java.util.UUID;

/**
 * Raised when a stored saga stream cannot be folded, for example a version gap
 * or an event recorded for a different order.
 */
public class ContractViolationException extends OrderSagaException {

    private final UUID orderId;

    public ContractViolationException(UUID orderId, String message) {
        super("Order " + orderId + ": " + message);
        this.orderId = orderId;
    }

    public UUID getOrderId() {
        return orderId;
    }
}
