package com.ivamare.ordersaga.domain;

/**
 * Inventory leg of the saga.
 *
 * @param state Current inventory state
 * @param reservationId Reservation reference from Inventory (nullable)
 */
public record InventoryProgress(
    InventoryState state,
    String reservationId
) {
    public static InventoryProgress unreserved() {
        return new InventoryProgress(InventoryState.UNRESERVED, null);
    }

    public InventoryProgress withState(InventoryState newState) {
        return new InventoryProgress(newState, reservationId);
    }
}
