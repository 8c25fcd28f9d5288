package com.ivamare.ordersaga.domain.event;

import java.math.BigDecimal;

/**
 * Payments authorized the order amount.
 */
public record PaymentAuthorizationRecorded(String authorizationId, BigDecimal amount) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.PAYMENT_AUTHORIZED;
    }
}
