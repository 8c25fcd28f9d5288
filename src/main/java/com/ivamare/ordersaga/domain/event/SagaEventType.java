package com.ivamare.ordersaga.domain.event;

/**
 * Persisted event types and how each one affects the pending timeout.
 */
public enum SagaEventType {
    ORDER_PLACED(OrderPlaced.class, WaitEffect.BEGIN),
    PAYMENT_AUTHORIZED(PaymentAuthorizationRecorded.class, WaitEffect.BEGIN),
    INVENTORY_RESERVED(InventoryReservationRecorded.class, WaitEffect.BEGIN),
    PAYMENT_CAPTURED(PaymentCaptureRecorded.class, WaitEffect.BEGIN),
    INVENTORY_COMMITTED(InventoryCommitRecorded.class, WaitEffect.KEEP),
    SHIPMENT_DISPATCHED(ShipmentDispatchRecorded.class, WaitEffect.BEGIN),
    DELIVERY_ATTEMPT_FAILED(DeliveryAttemptFailed.class, WaitEffect.BEGIN),
    ORDER_DELIVERED(OrderDelivered.class, WaitEffect.CLEAR),
    ORDER_CANCELLED(OrderCancelled.class, WaitEffect.CLEAR),
    LATE_CAPTURE_REFUNDED(LateCaptureRefunded.class, WaitEffect.CLEAR);

    /**
     * Effect of an event on the saga's pending timeout token.
     */
    public enum WaitEffect {
        /** A new wait starts at this event's version */
        BEGIN,
        /** The current wait continues */
        KEEP,
        /** No wait is pending afterwards */
        CLEAR
    }

    private final Class<? extends SagaEvent> eventClass;
    private final WaitEffect waitEffect;

    SagaEventType(Class<? extends SagaEvent> eventClass, WaitEffect waitEffect) {
        this.eventClass = eventClass;
        this.waitEffect = waitEffect;
    }

    public Class<? extends SagaEvent> eventClass() {
        return eventClass;
    }

    public WaitEffect waitEffect() {
        return waitEffect;
    }
}
