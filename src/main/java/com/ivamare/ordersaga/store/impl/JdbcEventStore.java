package com.ivamare.ordersaga.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersaga.domain.event.SagaEvent;
import com.ivamare.ordersaga.domain.event.SagaEventType;
import com.ivamare.ordersaga.exception.ConcurrencyConflictException;
import com.ivamare.ordersaga.exception.OrderSagaException;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * JDBC implementation of EventStore over {@code ordersaga.saga_event}.
 *
 * <p>The primary key (order_id, version) is the concurrency guard: two writers that
 * folded the same version both try to insert the same next version and only one wins.
 */
public class JdbcEventStore implements EventStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcEventStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<RecordedEvent> eventMapper;

    public JdbcEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.eventMapper = createEventMapper();
    }

    private RowMapper<RecordedEvent> createEventMapper() {
        return (rs, rowNum) -> {
            SagaEventType type = SagaEventType.valueOf(rs.getString("event_type"));
            String causationId = rs.getString("causation_id");
            return new RecordedEvent(
                UUID.fromString(rs.getString("order_id")),
                rs.getLong("version"),
                deserializeEvent(type, rs.getString("payload")),
                causationId != null ? UUID.fromString(causationId) : null,
                rs.getTimestamp("recorded_at").toInstant()
            );
        };
    }

    @Override
    public List<RecordedEvent> load(UUID orderId, long afterVersion) {
        String sql = """
            SELECT order_id, version, event_type, payload, causation_id, recorded_at
            FROM ordersaga.saga_event
            WHERE order_id = ? AND version > ?
            ORDER BY version
            """;
        return jdbcTemplate.query(sql, eventMapper, orderId, afterVersion);
    }

    @Override
    public List<RecordedEvent> append(UUID orderId, long expectedVersion, List<SagaEvent> events, UUID causationId) {
        if (events.isEmpty()) {
            return List.of();
        }

        long current = currentVersion(orderId);
        if (current != expectedVersion) {
            throw new ConcurrencyConflictException(orderId, expectedVersion,
                "stream is at version " + current);
        }

        String sql = """
            INSERT INTO ordersaga.saga_event (
                order_id, version, event_type, payload, causation_id, recorded_at
            ) VALUES (?, ?, ?, ?::jsonb, ?, ?)
            """;

        Instant now = Instant.now();
        List<RecordedEvent> recorded = new ArrayList<>(events.size());
        List<Object[]> batchArgs = new ArrayList<>(events.size());
        long version = expectedVersion;
        for (SagaEvent event : events) {
            version++;
            recorded.add(new RecordedEvent(orderId, version, event, causationId, now));
            batchArgs.add(new Object[] {
                orderId,
                version,
                event.type().name(),
                serializeEvent(event),
                causationId,
                Timestamp.from(now)
            });
        }

        try {
            jdbcTemplate.batchUpdate(sql, batchArgs);
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(orderId, expectedVersion, e);
        }

        log.debug("Appended {} event(s) to order {} at versions {}..{}",
            events.size(), orderId, expectedVersion + 1, version);
        return recorded;
    }

    @Override
    public long currentVersion(UUID orderId) {
        Long version = jdbcTemplate.queryForObject(
            "SELECT COALESCE(MAX(version), 0) FROM ordersaga.saga_event WHERE order_id = ?",
            Long.class,
            orderId
        );
        return version != null ? version : 0L;
    }

    private String serializeEvent(SagaEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Failed to serialize " + event.type() + " event", e);
        }
    }

    private SagaEvent deserializeEvent(SagaEventType type, String json) {
        try {
            return objectMapper.readValue(json, type.eventClass());
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Failed to deserialize " + type + " event", e);
        }
    }
}
