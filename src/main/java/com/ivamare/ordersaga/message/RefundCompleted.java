package com.ivamare.ordersaga.message;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payments confirmed a refund.
 */
public record RefundCompleted(UUID messageId, UUID orderId, String transactionId, BigDecimal amount) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.REFUND_COMPLETED;
    }
}
