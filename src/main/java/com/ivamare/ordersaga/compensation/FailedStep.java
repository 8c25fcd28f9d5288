package com.ivamare.ordersaga.compensation;

/**
 * Saga step whose failure ends the order.
 */
public enum FailedStep {
    PAYMENT_AUTHORIZATION,
    INVENTORY_RESERVATION,
    PAYMENT_CAPTURE,
    FULFILLMENT
}
