package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Inventory released a reservation.
 */
public record ReservationReleased(UUID messageId, UUID orderId, String reservationId) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.RESERVATION_RELEASED;
    }
}
