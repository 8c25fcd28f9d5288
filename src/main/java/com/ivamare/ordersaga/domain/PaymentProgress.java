package com.ivamare.ordersaga.domain;

/**
 * Payment leg of the saga.
 *
 * @param state Current payment state
 * @param authorizationId Authorization reference from Payments (nullable)
 * @param transactionId Capture transaction reference from Payments (nullable)
 */
public record PaymentProgress(
    PaymentState state,
    String authorizationId,
    String transactionId
) {
    public static PaymentProgress unattempted() {
        return new PaymentProgress(PaymentState.UNATTEMPTED, null, null);
    }

    public PaymentProgress authorized(String authorizationId) {
        return new PaymentProgress(PaymentState.AUTHORIZED, authorizationId, transactionId);
    }

    public PaymentProgress captured(String transactionId) {
        return new PaymentProgress(PaymentState.CAPTURED, authorizationId, transactionId);
    }

    public PaymentProgress withState(PaymentState newState) {
        return new PaymentProgress(newState, authorizationId, transactionId);
    }
}
