package com.ivamare.ordersaga.domain.event;

/**
 * Inventory reserved stock for the order; payment capture is requested next.
 */
public record InventoryReservationRecorded(String reservationId) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.INVENTORY_RESERVED;
    }
}
