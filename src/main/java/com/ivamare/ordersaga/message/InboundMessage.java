package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Message delivered to the saga inbox.
 *
 * <p>Every message carries its own idempotency id and the order it belongs to.
 */
public sealed interface InboundMessage permits
        CheckoutCompleted,
        PaymentAuthorized,
        PaymentFailed,
        PaymentCaptured,
        PaymentCaptureFailed,
        RefundCompleted,
        RefundFailed,
        ReservationConfirmed,
        ReservationFailed,
        ReservationCommitted,
        ReservationReleased,
        ShipmentDispatched,
        ShipmentDelivered,
        ShipmentDeliveryFailed,
        Timeout {

    /** Idempotency id of this delivery */
    UUID messageId();

    /** Order (saga) the message is correlated with */
    UUID orderId();

    InboundMessageType type();
}
