package com.ivamare.ordersaga.domain;

/**
 * Progress of the inventory leg of an order.
 */
public enum InventoryState {
    UNRESERVED,
    RESERVED,
    COMMITTED,
    RELEASED,
    FAILED
}
