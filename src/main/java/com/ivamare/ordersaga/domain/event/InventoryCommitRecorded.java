package com.ivamare.ordersaga.domain.event;

/**
 * Inventory committed the reserved stock.
 */
public record InventoryCommitRecorded(String reservationId) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.INVENTORY_COMMITTED;
    }
}
