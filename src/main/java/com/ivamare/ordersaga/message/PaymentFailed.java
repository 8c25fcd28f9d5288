package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Payments declined the authorization.
 */
public record PaymentFailed(UUID messageId, UUID orderId, String reason, boolean retriable) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.PAYMENT_FAILED;
    }
}
