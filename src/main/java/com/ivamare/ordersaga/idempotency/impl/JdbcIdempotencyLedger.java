package com.ivamare.ordersaga.idempotency.impl;

import com.ivamare.ordersaga.exception.ConcurrencyConflictException;
import com.ivamare.ordersaga.idempotency.IdempotencyLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.UUID;

/**
 * JDBC implementation of IdempotencyLedger over {@code ordersaga.processed_message}.
 */
public class JdbcIdempotencyLedger implements IdempotencyLedger {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdempotencyLedger.class);

    private final JdbcTemplate jdbcTemplate;

    public JdbcIdempotencyLedger(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public boolean hasProcessed(UUID orderId, UUID messageId) {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ordersaga.processed_message WHERE order_id = ? AND message_id = ?",
            Integer.class,
            orderId, messageId
        );
        return count != null && count > 0;
    }

    @Override
    public void record(UUID orderId, UUID messageId, String messageType, long streamVersion) {
        String sql = """
            INSERT INTO ordersaga.processed_message (
                order_id, message_id, message_type, stream_version, processed_at
            ) VALUES (?, ?, ?, ?, NOW())
            """;
        try {
            jdbcTemplate.update(sql, orderId, messageId, messageType, streamVersion);
        } catch (DuplicateKeyException e) {
            throw new ConcurrencyConflictException(orderId, streamVersion, e);
        }
        log.debug("Recorded {} {} for order {} at version {}", messageType, messageId, orderId, streamVersion);
    }
}
