package com.ivamare.ordersaga.domain;

/**
 * Fulfillment leg of the saga.
 *
 * @param state Current fulfillment state
 * @param shipmentId Latest shipment reference (nullable)
 * @param carrier Carrier of the latest shipment (nullable)
 * @param trackingNumber Tracking number of the latest shipment (nullable)
 * @param failedAttempts Number of failed delivery attempts so far
 * @param lastFailedShipmentId Shipment of the latest failed attempt (nullable)
 */
public record FulfillmentProgress(
    FulfillmentState state,
    String shipmentId,
    String carrier,
    String trackingNumber,
    int failedAttempts,
    String lastFailedShipmentId
) {
    public static FulfillmentProgress notStarted() {
        return new FulfillmentProgress(FulfillmentState.NOT_STARTED, null, null, null, 0, null);
    }

    public FulfillmentProgress dispatched(String shipmentId, String carrier, String trackingNumber) {
        return new FulfillmentProgress(FulfillmentState.DISPATCHED, shipmentId, carrier, trackingNumber,
            failedAttempts, lastFailedShipmentId);
    }

    public FulfillmentProgress failedAttempt(int attempts, String failedShipmentId) {
        return new FulfillmentProgress(state, shipmentId, carrier, trackingNumber, attempts, failedShipmentId);
    }

    public FulfillmentProgress withState(FulfillmentState newState) {
        return new FulfillmentProgress(newState, shipmentId, carrier, trackingNumber, failedAttempts,
            lastFailedShipmentId);
    }
}
