package com.ivamare.ordersaga.pgmq;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message read from a PGMQ queue.
 *
 * @param msgId Unique message ID assigned by PGMQ
 * @param readCount Number of times this message has been read
 * @param enqueuedAt When the message was enqueued
 * @param visibilityTimeout When the message becomes visible again
 * @param message The message payload
 */
public record PgmqMessage(
    long msgId,
    int readCount,
    Instant enqueuedAt,
    Instant visibilityTimeout,
    Map<String, Object> message
) {
    /**
     * Payloads from other services may carry JSON nulls, so the copy tolerates null values.
     */
    public PgmqMessage {
        message = message != null
            ? Collections.unmodifiableMap(new LinkedHashMap<>(message))
            : Map.of();
    }
}
