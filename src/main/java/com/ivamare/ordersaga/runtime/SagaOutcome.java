package com.ivamare.ordersaga.runtime;

import com.ivamare.ordersaga.domain.OrderStatus;
import com.ivamare.ordersaga.message.InboundMessage;

import java.util.UUID;

/**
 * What handling one inbound message amounted to.
 *
 * @param orderId Order identity
 * @param messageId Message idempotency id
 * @param result Outcome category
 * @param status Saga status after handling
 * @param version Saga version after handling
 * @param attempts Number of handling attempts made
 * @param detail Reason for non-applied outcomes
 */
public record SagaOutcome(
    UUID orderId,
    UUID messageId,
    Result result,
    OrderStatus status,
    long version,
    int attempts,
    String detail
) {

    public enum Result {
        /** Events recorded and effects enqueued */
        APPLIED,
        /** Message id already in the idempotency ledger */
        DUPLICATE,
        /** Stale, duplicate placement or post-terminal message; recorded as handled */
        IGNORED,
        /** Checkout failed validation; no saga created */
        REJECTED,
        /** Message not allowed in the current state; incident raised */
        VIOLATION,
        /** Retries used up; nothing committed, message must be redelivered */
        RETRY_EXHAUSTED
    }

    static SagaOutcome of(InboundMessage message, Result result, OrderStatus status,
                          long version, int attempts, String detail) {
        return new SagaOutcome(message.orderId(), message.messageId(), result, status, version, attempts, detail);
    }

    /**
     * Whether the message was dealt with and can be removed from the inbox.
     */
    public boolean isSettled() {
        return result != Result.RETRY_EXHAUSTED;
    }
}
