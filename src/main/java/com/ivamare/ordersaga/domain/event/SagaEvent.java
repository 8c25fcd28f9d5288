package com.ivamare.ordersaga.domain.event;

/**
 * Event recorded in an order's append-only stream.
 *
 * <p>Events are serialized to JSON with Jackson; the concrete class is resolved
 * from the persisted {@link SagaEventType}.
 */
public sealed interface SagaEvent permits
        OrderPlaced,
        PaymentAuthorizationRecorded,
        InventoryReservationRecorded,
        PaymentCaptureRecorded,
        InventoryCommitRecorded,
        ShipmentDispatchRecorded,
        DeliveryAttemptFailed,
        OrderDelivered,
        OrderCancelled,
        LateCaptureRefunded {

    SagaEventType type();
}
