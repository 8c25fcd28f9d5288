package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Inventory committed the reserved stock.
 */
public record ReservationCommitted(UUID messageId, UUID orderId, String reservationId) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.RESERVATION_COMMITTED;
    }
}
