package com.ivamare.ordersaga.message;

import com.ivamare.ordersaga.domain.OrderStatus;

import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Fired when an awaited response did not arrive within its SLA window.
 *
 * @param messageId Idempotency id, derived from order and token
 * @param orderId Order identity
 * @param token Stream version at which the wait began
 * @param awaitedStatus Status the saga was in when the wait began
 */
public record Timeout(
    UUID messageId,
    UUID orderId,
    long token,
    OrderStatus awaitedStatus
) implements InboundMessage {

    /**
     * Create a timeout whose id is stable for the same order and token, so that
     * a timer scheduled twice is deduplicated by the idempotency ledger.
     */
    public static Timeout of(UUID orderId, long token, OrderStatus awaitedStatus) {
        UUID messageId = UUID.nameUUIDFromBytes(
            ("timeout:" + orderId + ":" + token).getBytes(StandardCharsets.UTF_8));
        return new Timeout(messageId, orderId, token, awaitedStatus);
    }

    @Override
    public InboundMessageType type() {
        return InboundMessageType.TIMEOUT;
    }
}
