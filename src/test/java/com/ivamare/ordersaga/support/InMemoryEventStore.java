package com.ivamare.ordersaga.support;

import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.exception.ConcurrencyConflictException;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.RecordedEvent;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * EventStore kept in memory, with hooks to simulate competing writers.
 */
public class InMemoryEventStore implements EventStore {

    private final Map<UUID, List<RecordedEvent>> streams = new ConcurrentHashMap<>();
    private final AtomicInteger forcedConflicts = new AtomicInteger();
    private final AtomicInteger appendCalls = new AtomicInteger();
    private volatile Runnable beforeNextAppend;

    @Override
    public List<RecordedEvent> load(UUID orderId, long afterVersion) {
        List<RecordedEvent> stream = streams.getOrDefault(orderId, List.of());
        synchronized (this) {
            return stream.stream().filter(e -> e.version() > afterVersion).toList();
        }
    }

    @Override
    public List<RecordedEvent> append(UUID orderId, long expectedVersion, List<SagaEvent> events, UUID causationId) {
        appendCalls.incrementAndGet();
        Runnable hook = beforeNextAppend;
        if (hook != null) {
            beforeNextAppend = null;
            hook.run();
        }
        if (forcedConflicts.get() > 0) {
            forcedConflicts.decrementAndGet();
            throw new ConcurrencyConflictException(orderId, expectedVersion, "forced conflict");
        }
        synchronized (this) {
            List<RecordedEvent> stream = streams.computeIfAbsent(orderId, id -> new ArrayList<>());
            if (stream.size() != expectedVersion) {
                throw new ConcurrencyConflictException(orderId, expectedVersion, "stream is at version " + stream.size());
            }
            List<RecordedEvent> recorded = new ArrayList<>();
            long version = expectedVersion;
            for (SagaEvent event : events) {
                recorded.add(new RecordedEvent(orderId, ++version, event, causationId, Instant.now()));
            }
            stream.addAll(recorded);
            return recorded;
        }
    }

    @Override
    public long currentVersion(UUID orderId) {
        return streams.getOrDefault(orderId, List.of()).size();
    }

    /**
     * Make the next {@code count} appends fail with a conflict.
     */
    public void failNextAppends(int count) {
        forcedConflicts.set(count);
    }

    /**
     * Run {@code competingWrite} right before the next append, as another writer would.
     */
    public void beforeNextAppend(Runnable competingWrite) {
        this.beforeNextAppend = competingWrite;
    }

    public List<SagaEvent> events(UUID orderId) {
        return load(orderId).stream().map(RecordedEvent::event).toList();
    }

    public int appendCalls() {
        return appendCalls.get();
    }
}
