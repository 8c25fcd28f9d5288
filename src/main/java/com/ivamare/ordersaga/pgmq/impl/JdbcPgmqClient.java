package com.ivamare.ordersaga.pgmq.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.ordersaga.exception.OrderSagaException;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.PgmqMessage;
import com.ivamare.ordersaga.pgmq.QueueNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * PGMQ client issuing the extension's SQL functions through a {@link JdbcTemplate}.
 *
 * <p>Immediate sends also NOTIFY the queue's channel so a listening router wakes up.
 * Delayed sends (timeout timers) skip it; they become visible later and are found
 * by the router's regular poll.
 */
public class JdbcPgmqClient implements PgmqClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcPgmqClient.class);
    private static final TypeReference<Map<String, Object>> BODY_TYPE = new TypeReference<>() {};

    private static final String SEND_SQL = "SELECT pgmq.send(?, ?::jsonb, ?)";
    private static final String READ_SQL = "SELECT * FROM pgmq.read(?, ?, ?)";
    private static final String DELETE_SQL = "SELECT pgmq.delete(?, ?)";
    private static final String ARCHIVE_SQL = "SELECT pgmq.archive(?, ?)";

    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final RowMapper<PgmqMessage> messageMapper;

    public JdbcPgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.messageMapper = (rs, rowNum) -> new PgmqMessage(
            rs.getLong("msg_id"),
            rs.getInt("read_ct"),
            instant(rs.getTimestamp("enqueued_at")),
            instant(rs.getTimestamp("vt")),
            readBody(rs.getString("message"))
        );
    }

    @Override
    public long send(String queueName, Map<String, Object> message, int delaySeconds) {
        Long msgId = jdbcTemplate.queryForObject(SEND_SQL, Long.class, queueName, writeBody(message), delaySeconds);
        if (msgId == null) {
            throw new OrderSagaException("PGMQ returned no message id for a send to " + queueName);
        }
        if (delaySeconds == 0) {
            notify(queueName);
        }
        log.debug("Sent msg_id={} to {} (visible in {}s)", msgId, queueName, delaySeconds);
        return msgId;
    }

    @Override
    public void notify(String queueName) {
        jdbcTemplate.execute("NOTIFY " + QueueNames.notifyChannel(queueName));
    }

    @Override
    public List<PgmqMessage> read(String queueName, int visibilityTimeoutSeconds, int batchSize) {
        return jdbcTemplate.query(READ_SQL, messageMapper, queueName, visibilityTimeoutSeconds, batchSize);
    }

    @Override
    public boolean delete(String queueName, long msgId) {
        return settle(DELETE_SQL, queueName, msgId);
    }

    @Override
    public boolean archive(String queueName, long msgId) {
        return settle(ARCHIVE_SQL, queueName, msgId);
    }

    private boolean settle(String sql, String queueName, long msgId) {
        return Boolean.TRUE.equals(jdbcTemplate.queryForObject(sql, Boolean.class, queueName, msgId));
    }

    private static Instant instant(Timestamp timestamp) {
        return timestamp != null ? timestamp.toInstant() : null;
    }

    private String writeBody(Map<String, Object> body) {
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Cannot serialize PGMQ message body", e);
        }
    }

    private Map<String, Object> readBody(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, BODY_TYPE);
        } catch (JsonProcessingException e) {
            throw new OrderSagaException("Cannot parse PGMQ message body", e);
        }
    }
}
