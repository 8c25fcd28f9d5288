package com.ivamare.ordersaga.ops.impl;

import com.ivamare.ordersaga.exception.IncidentNotFoundException;
import com.ivamare.ordersaga.ops.IncidentKind;
import com.ivamare.ordersaga.ops.SagaIncident;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * JDBC implementation of SagaIncidentQueue over {@code ordersaga.saga_incident}.
 */
public class JdbcSagaIncidentQueue implements SagaIncidentQueue {

    private static final Logger log = LoggerFactory.getLogger(JdbcSagaIncidentQueue.class);

    private static final RowMapper<SagaIncident> INCIDENT_MAPPER = (rs, rowNum) -> {
        String orderId = rs.getString("order_id");
        String messageId = rs.getString("message_id");
        Timestamp resolvedAt = rs.getTimestamp("resolved_at");
        return new SagaIncident(
            rs.getLong("incident_id"),
            orderId != null ? UUID.fromString(orderId) : null,
            messageId != null ? UUID.fromString(messageId) : null,
            IncidentKind.valueOf(rs.getString("kind")),
            rs.getString("detail"),
            rs.getTimestamp("raised_at").toInstant(),
            resolvedAt != null ? resolvedAt.toInstant() : null,
            rs.getString("resolved_by")
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public JdbcSagaIncidentQueue(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    public long raise(UUID orderId, UUID messageId, IncidentKind kind, String detail) {
        String sql = """
            INSERT INTO ordersaga.saga_incident (order_id, message_id, kind, detail, raised_at)
            VALUES (?, ?, ?, ?, NOW())
            RETURNING incident_id
            """;
        Long id = jdbcTemplate.queryForObject(sql, Long.class, orderId, messageId, kind.name(), detail);
        log.debug("Raised {} incident {} for order {}", kind, id, orderId);
        return id != null ? id : 0L;
    }

    @Override
    public List<SagaIncident> listOpen(int limit) {
        String sql = """
            SELECT incident_id, order_id, message_id, kind, detail, raised_at, resolved_at, resolved_by
            FROM ordersaga.saga_incident
            WHERE resolved_at IS NULL
            ORDER BY raised_at, incident_id
            LIMIT ?
            """;
        return jdbcTemplate.query(sql, INCIDENT_MAPPER, limit);
    }

    @Override
    public int countOpen() {
        Integer count = jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM ordersaga.saga_incident WHERE resolved_at IS NULL",
            Integer.class
        );
        return count != null ? count : 0;
    }

    @Override
    public void resolve(long incidentId, String operator) {
        int updated = jdbcTemplate.update("""
            UPDATE ordersaga.saga_incident
            SET resolved_at = NOW(), resolved_by = ?
            WHERE incident_id = ? AND resolved_at IS NULL
            """,
            operator, incidentId
        );
        if (updated == 0) {
            throw new IncidentNotFoundException(incidentId);
        }
        log.info("Incident {} resolved by {}", incidentId, operator);
    }
}
