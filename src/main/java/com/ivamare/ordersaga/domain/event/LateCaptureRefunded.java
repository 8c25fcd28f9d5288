package com.ivamare.ordersaga.domain.event;

import java.math.BigDecimal;

/**
 * Payments captured money for an order that was already cancelled; a refund was enqueued.
 *
 * @param transactionId Capture transaction reference from Payments
 * @param amount Captured amount
 */
public record LateCaptureRefunded(String transactionId, BigDecimal amount) implements SagaEvent {

    @Override
    public SagaEventType type() {
        return SagaEventType.LATE_CAPTURE_REFUNDED;
    }
}
