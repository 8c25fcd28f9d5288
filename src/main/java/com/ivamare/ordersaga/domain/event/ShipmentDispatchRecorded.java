package com.ivamare.ordersaga.domain.event;

/**
 * Fulfillment handed a shipment to a carrier.
 */
public record ShipmentDispatchRecorded(String shipmentId, String carrier, String trackingNumber) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.SHIPMENT_DISPATCHED;
    }
}
