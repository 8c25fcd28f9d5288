package com.ivamare.ordersaga.domain;

/**
 * Progress of the payment leg of an order.
 */
public enum PaymentState {
    UNATTEMPTED,
    AUTHORIZED,
    CAPTURED,
    FAILED,
    REFUNDED
}
