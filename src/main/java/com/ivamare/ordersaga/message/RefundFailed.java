package com.ivamare.ordersaga.message;

import java.util.UUID;

/**
 * Payments could not refund; needs financial reconciliation.
 */
public record RefundFailed(UUID messageId, UUID orderId, String reason) implements InboundMessage {

    @Override
    public InboundMessageType type() {
        return InboundMessageType.REFUND_FAILED;
    }
}
