package com.ivamare.ordersaga.health;

import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Health indicator for the order saga's database.
 *
 * <p>DOWN when the PGMQ extension or the ordersaga schema is missing. Otherwise UP with
 * the inbox backlog, the number of open incidents and, for Hikari pools, pool usage.
 * Open incidents do not make the service unhealthy; they need an operator, not a restart.
 */
public class OrderSagaHealthIndicator implements HealthIndicator {

    private final JdbcTemplate jdbcTemplate;
    private final SagaIncidentQueue incidents;
    private final String inboxQueue;
    private final DataSource dataSource;

    public OrderSagaHealthIndicator(JdbcTemplate jdbcTemplate, SagaIncidentQueue incidents,
                                    String inboxQueue, DataSource dataSource) {
        this.jdbcTemplate = jdbcTemplate;
        this.incidents = incidents;
        this.inboxQueue = inboxQueue;
        this.dataSource = dataSource;
    }

    @Override
    public Health health() {
        try {
            Boolean pgmqAvailable = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM pg_extension WHERE extname = 'pgmq')",
                Boolean.class
            );
            if (!Boolean.TRUE.equals(pgmqAvailable)) {
                return Health.down()
                    .withDetail("error", "PGMQ extension not installed")
                    .build();
            }

            Boolean schemaExists = jdbcTemplate.queryForObject(
                "SELECT EXISTS (SELECT 1 FROM information_schema.schemata WHERE schema_name = 'ordersaga')",
                Boolean.class
            );
            if (!Boolean.TRUE.equals(schemaExists)) {
                return Health.down()
                    .withDetail("error", "ordersaga schema not found")
                    .build();
            }

            Long backlog = jdbcTemplate.queryForObject(
                "SELECT queue_length FROM pgmq.metrics(?)",
                Long.class,
                inboxQueue
            );

            Health.Builder builder = Health.up()
                .withDetail("pgmq", "available")
                .withDetail("schema", "ordersaga")
                .withDetail("inbox", inboxQueue)
                .withDetail("inboxBacklog", backlog != null ? backlog : 0L)
                .withDetail("openIncidents", incidents.countOpen());

            addPoolStats(builder);
            return builder.build();

        } catch (Exception e) {
            return Health.down()
                .withDetail("error", e.getMessage())
                .build();
        }
    }

    private void addPoolStats(Health.Builder builder) {
        if (dataSource instanceof HikariDataSource hikari) {
            HikariPoolMXBean pool = hikari.getHikariPoolMXBean();
            if (pool != null) {
                builder.withDetail("pool.active", pool.getActiveConnections());
                builder.withDetail("pool.idle", pool.getIdleConnections());
                builder.withDetail("pool.pending", pool.getThreadsAwaitingConnection());
            }
        }
    }
}
