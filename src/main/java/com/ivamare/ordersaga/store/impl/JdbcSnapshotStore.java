package com.ivamare.ordersaga.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersaga.domain.OrderSaga;
import com.ivamare.ordersaga.exception.OrderSagaException;
import com.ivamare.ordersaga.store.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC implementation of SnapshotStore over {@code ordersaga.saga_snapshot}.
 */
public class JdbcSnapshotStore implements SnapshotStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotStore.class);

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    public JdbcSnapshotStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public Optional<OrderSaga> load(UUID orderId) {
        List<String> states = jdbcTemplate.query(
            "SELECT state FROM ordersaga.saga_snapshot WHERE order_id = ?",
            (rs, rowNum) -> rs.getString("state"),
            orderId
        );
        return states.isEmpty() ? Optional.empty() : Optional.of(deserialize(states.get(0)));
    }

    @Override
    public void save(OrderSaga saga) {
        String sql = """
            INSERT INTO ordersaga.saga_snapshot (order_id, version, state, taken_at)
            VALUES (?, ?, ?::jsonb, NOW())
            ON CONFLICT (order_id) DO UPDATE
            SET version = EXCLUDED.version, state = EXCLUDED.state, taken_at = EXCLUDED.taken_at
            WHERE ordersaga.saga_snapshot.version < EXCLUDED.version
            """;
        jdbcTemplate.update(sql, saga.orderId(), saga.version(), serialize(saga));
        log.debug("Snapshot of order {} at version {}", saga.orderId(), saga.version());
    }

    private String serialize(OrderSaga saga) {
        try {
            return objectMapper.writeValueAsString(saga);
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Failed to serialize snapshot of order " + saga.orderId(), e);
        }
    }

    private OrderSaga deserialize(String json) {
        try {
            return objectMapper.readValue(json, OrderSaga.class);
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Failed to deserialize saga snapshot", e);
        }
    }
}
