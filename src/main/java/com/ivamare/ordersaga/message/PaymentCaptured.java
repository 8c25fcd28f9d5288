package com.ivamare.ordersaga.message;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payments captured the authorized amount.
 */
public record PaymentCaptured(UUID messageId, UUID orderId, String transactionId, BigDecimal amount) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.PAYMENT_CAPTURED;
    }
}
