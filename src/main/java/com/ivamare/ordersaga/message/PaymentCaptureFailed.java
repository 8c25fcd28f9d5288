package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Payments could not capture the authorized amount.
 */
public record PaymentCaptureFailed(UUID messageId, UUID orderId, String reason) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.PAYMENT_CAPTURE_FAILED;
    }
}
