package com.ivamare.ordersaga.message;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Payments authorized the order amount.
 */
public record PaymentAuthorized(UUID messageId, UUID orderId, String authorizationId, BigDecimal amount) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.PAYMENT_AUTHORIZED;
    }
}
