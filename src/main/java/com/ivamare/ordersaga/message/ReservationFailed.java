package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Inventory could not reserve (or lost) the stock for the order.
 */
public record ReservationFailed(UUID messageId, UUID orderId, String reservationId, String reason) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.RESERVATION_FAILED;
    }
}
