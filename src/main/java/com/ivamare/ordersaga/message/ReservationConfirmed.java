package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Inventory reserved stock for the order.
 */
public record ReservationConfirmed(UUID messageId, UUID orderId, String reservationId) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.RESERVATION_CONFIRMED;
    }
}
