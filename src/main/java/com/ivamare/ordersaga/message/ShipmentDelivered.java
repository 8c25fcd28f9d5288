package com.ivamare.ordersaga.message;

import java.time.Instant;
import java.util.UUID;

/**
 * The carrier delivered the shipment.
 */
public record ShipmentDelivered(UUID messageId, UUID orderId, String shipmentId, Instant deliveredAt) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.SHIPMENT_DELIVERED;
    }
}
