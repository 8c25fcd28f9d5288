package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * A delivery attempt failed.
 *
 * @param messageId Idempotency id
 * @param orderId Order identity
 * @param shipmentId Shipment that failed
 * @param attempt Number of the failed attempt, or 0 when Fulfillment does not track attempts
 * @param reason Failure reason
 */
public record ShipmentDeliveryFailed(
    UUID messageId,
    UUID orderId,
    String shipmentId,
    int attempt,
    String reason
) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.SHIPMENT_DELIVERY_FAILED;
    }
}
