package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Fulfillment handed the shipment to a carrier.
 */
public record ShipmentDispatched(UUID messageId, UUID orderId, String shipmentId, String carrier, String trackingNumber) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.SHIPMENT_DISPATCHED;
    }
}
