package com.ivamare.ordersaga;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.ivamare.ordersaga.compensation.CompensationPolicy;
import com.ivamare.ordersaga.decider.CheckoutValidator;
import com.ivamare.ordersaga.decider.Decider;
import com.ivamare.ordersaga.decider.DeciderSettings;
import com.ivamare.ordersaga.idempotency.IdempotencyLedger;
import com.ivamare.ordersaga.idempotency.impl.JdbcIdempotencyLedger;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.ivamare.ordersaga.ops.impl.JdbcSagaIncidentQueue;
import com.ivamare.ordersaga.outbox.Outbox;
import com.ivamare.ordersaga.outbox.impl.PgmqOutbox;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.pgmq.impl.JdbcPgmqClient;
import com.ivamare.ordersaga.policy.RetryPolicy;
import com.ivamare.ordersaga.runtime.SagaRuntime;
import com.ivamare.ordersaga.store.EventStore;
import com.ivamare.ordersaga.store.SnapshotStore;
import com.ivamare.ordersaga.store.impl.JdbcEventStore;
import com.ivamare.ordersaga.store.impl.JdbcSnapshotStore;
import com.ivamare.ordersaga.timeout.TimeoutScheduler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.transaction.TransactionAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Auto-configuration for the order saga.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>PGMQ client and the PGMQ-backed outbox</li>
 *   <li>Event store, snapshot store and idempotency ledger</li>
 *   <li>Decider with the default compensation table</li>
 *   <li>Timeout scheduler from the configured SLA windows</li>
 *   <li>Incident queue</li>
 *   <li>Saga runtime</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * ordersaga.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {DataSourceAutoConfiguration.class, TransactionAutoConfiguration.class})
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnProperty(prefix = "ordersaga", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(OrderSagaProperties.class)
public class OrderSagaAutoConfiguration {

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper orderSagaObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        return mapper;
    }

    // --- Messaging ---

    @Bean
    @ConditionalOnMissingBean
    public PgmqClient pgmqClient(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcPgmqClient(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public InboundMessageCodec inboundMessageCodec(ObjectMapper objectMapper) {
        return new InboundMessageCodec(objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public Outbox outbox(PgmqClient pgmqClient, InboundMessageCodec codec, OrderSagaProperties properties) {
        return new PgmqOutbox(pgmqClient, codec, properties.getInboxQueue());
    }

    // --- Persistence ---

    @Bean
    @ConditionalOnMissingBean
    public EventStore eventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcEventStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public SnapshotStore snapshotStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcSnapshotStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnMissingBean
    public IdempotencyLedger idempotencyLedger(JdbcTemplate jdbcTemplate) {
        return new JdbcIdempotencyLedger(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaIncidentQueue sagaIncidentQueue(JdbcTemplate jdbcTemplate) {
        return new JdbcSagaIncidentQueue(jdbcTemplate);
    }

    // --- Decisions ---

    @Bean
    @ConditionalOnMissingBean
    public CompensationPolicy compensationPolicy() {
        return CompensationPolicy.defaultPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public Decider decider(OrderSagaProperties properties, CompensationPolicy compensationPolicy) {
        return new Decider(
            new DeciderSettings(properties.getMaxDeliveryAttempts()),
            compensationPolicy,
            new CheckoutValidator()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public TimeoutScheduler timeoutScheduler(OrderSagaProperties properties) {
        return new TimeoutScheduler(properties.getTimeouts().asMap());
    }

    // --- Runtime ---

    @Bean
    @ConditionalOnMissingBean
    public RetryPolicy sagaRetryPolicy(OrderSagaProperties properties) {
        OrderSagaProperties.RetryProperties retry = properties.getRetry();
        return new RetryPolicy(
            retry.getMaxAttempts(),
            retry.getInitialBackoffMs(),
            retry.getMaxBackoffMs(),
            retry.getBackoffMultiplier()
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public SagaRuntime sagaRuntime(
            Decider decider,
            EventStore eventStore,
            SnapshotStore snapshotStore,
            IdempotencyLedger idempotencyLedger,
            Outbox outbox,
            TimeoutScheduler timeoutScheduler,
            SagaIncidentQueue incidents,
            TransactionTemplate transactionTemplate,
            RetryPolicy retryPolicy,
            OrderSagaProperties properties) {
        return new SagaRuntime(
            decider,
            eventStore,
            snapshotStore,
            idempotencyLedger,
            outbox,
            timeoutScheduler,
            incidents,
            transactionTemplate,
            retryPolicy,
            properties.getSnapshotInterval()
        );
    }
}
