package com.ivamare.ordersaga.domain.event;

import java.math.BigDecimal;

/**
 * Payments captured the authorized amount; fulfillment is requested next.
 */
public record PaymentCaptureRecorded(String transactionId, BigDecimal amount) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.PAYMENT_CAPTURED;
    }
}
