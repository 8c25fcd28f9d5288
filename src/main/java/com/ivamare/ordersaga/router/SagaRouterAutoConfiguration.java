package com.ivamare.ordersaga.router;

import com.ivamare.ordersaga.OrderSagaAutoConfiguration;
import com.ivamare.ordersaga.OrderSagaProperties;
import com.ivamare.ordersaga.message.InboundMessageCodec;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import com.ivamare.ordersaga.pgmq.PgmqClient;
import com.ivamare.ordersaga.runtime.SagaRuntime;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.event.EventListener;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for the saga inbox router.
 *
 * <p>To run the router:
 * <pre>
 * ordersaga:
 *   router:
 *     enabled: true
 *     auto-start: true
 * </pre>
 */
@AutoConfiguration(after = OrderSagaAutoConfiguration.class)
@ConditionalOnProperty(prefix = "ordersaga.router", name = "enabled", havingValue = "true")
@ConditionalOnBean(SagaRuntime.class)
public class SagaRouterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(SagaRouterAutoConfiguration.class);

    private final OrderSagaProperties properties;

    public SagaRouterAutoConfiguration(OrderSagaProperties properties) {
        this.properties = properties;
    }

    @Bean(destroyMethod = "stopNow")
    @ConditionalOnMissingBean
    public SagaMessageRouter sagaMessageRouter(
            DataSource dataSource,
            TransactionTemplate transactionTemplate,
            SagaRuntime runtime,
            InboundMessageCodec codec,
            SagaIncidentQueue incidents,
            PgmqClient pgmqClient) {

        OrderSagaProperties.RouterProperties router = properties.getRouter();
        String inboxQueue = properties.getInboxQueue();

        if (inboxQueue == null || inboxQueue.isBlank()) {
            throw new IllegalStateException("ordersaga.inbox-queue must be configured");
        }
        if (router.getMaxReadCount() < 1) {
            throw new IllegalStateException("ordersaga.router.max-read-count must be at least 1");
        }
        if (router.getConcurrency() < 1) {
            throw new IllegalStateException("ordersaga.router.concurrency must be at least 1");
        }

        log.info("Creating SagaMessageRouter for inbox={}, concurrency={}", inboxQueue, router.getConcurrency());

        return new SagaMessageRouter(
            dataSource,
            transactionTemplate,
            runtime,
            codec,
            incidents,
            pgmqClient,
            inboxQueue,
            router.getVisibilityTimeout(),
            router.getConcurrency(),
            router.getPollIntervalMs(),
            router.isUseNotify(),
            router.isArchiveMessages(),
            router.getMaxReadCount()
        );
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady(ApplicationReadyEvent event) {
        if (properties.getRouter().isAutoStart()) {
            SagaMessageRouter router = event.getApplicationContext().getBean(SagaMessageRouter.class);
            log.info("Auto-starting SagaMessageRouter");
            router.start();
        }
    }
}
