package com.ivamare.ordersaga.domain;

/**
 * Progress of the fulfillment leg of an order.
 */
public enum FulfillmentState {
    NOT_STARTED,
    DISPATCHED,
    DELIVERED,
    FAILED
}
