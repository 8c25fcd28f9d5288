package com.ivamare.ordersaga.support;

import com.ivamare.ordersaga.exception.ConcurrencyConflictException;
import com.ivamare.ordersaga.idempotency.IdempotencyLedger;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryIdempotencyLedger implements IdempotencyLedger {

    private final Map<String, Long> entries = new ConcurrentHashMap<>();

    @Override
    public boolean hasProcessed(UUID orderId, UUID messageId) {
        return entries.containsKey(key(orderId, messageId));
    }

    @Override
    public void record(UUID orderId, UUID messageId, String messageType, long streamVersion) {
        if (entries.putIfAbsent(key(orderId, messageId), streamVersion) != null) {
            throw new ConcurrencyConflictException(orderId, streamVersion, "message " + messageId + " already recorded");
        }
    }

    public int size() {
        return entries.size();
    }

    private static String key(UUID orderId, UUID messageId) {
        return orderId + "/" + messageId;
    }
}
