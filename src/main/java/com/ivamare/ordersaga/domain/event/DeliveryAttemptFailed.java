package com.ivamare.ordersaga.domain.event;

/**
 * A delivery attempt failed and a redispatch was requested.
 *
 * @param attempt Number of the failed attempt (1-based)
 * @param shipmentId Shipment that failed (nullable when nothing was dispatched yet)
 * @param reason Failure reason reported by Fulfillment, or the timeout reason
 */
public record DeliveryAttemptFailed(int attempt, String shipmentId, String reason) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.DELIVERY_ATTEMPT_FAILED;
    }
}
