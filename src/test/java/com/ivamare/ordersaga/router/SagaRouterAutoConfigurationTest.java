package com.ivamare.ordersaga.router;

import com.ivamare.ordersaga.OrderSagaAutoConfiguration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

@DisplayName("SagaRouterAutoConfiguration")
class SagaRouterAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(OrderSagaAutoConfiguration.class, SagaRouterAutoConfiguration.class))
        .withUserConfiguration(MockInfrastructureConfig.class);

    @Test
    @DisplayName("should not create router unless enabled")
    void shouldNotCreateRouterByDefault() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(SagaMessageRouter.class));
    }

    @Test
    @DisplayName("should create router on the configured inbox when enabled")
    void shouldCreateRouterWhenEnabled() {
        contextRunner
            .withPropertyValues(
                "ordersaga.router.enabled=true",
                "ordersaga.inbox-queue=shop__saga_inbox"
            )
            .run(context -> {
                assertThat(context).hasSingleBean(SagaMessageRouter.class);
                SagaMessageRouter router = context.getBean(SagaMessageRouter.class);
                assertThat(router.getInboxQueue()).isEqualTo("shop__saga_inbox");
                assertThat(router.isRunning()).isFalse();
            });
    }

    @Test
    @DisplayName("should refuse a router without workers")
    void shouldRefuseZeroConcurrency() {
        contextRunner
            .withPropertyValues(
                "ordersaga.router.enabled=true",
                "ordersaga.router.concurrency=0"
            )
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should refuse a read limit below one")
    void shouldRefuseZeroReadLimit() {
        contextRunner
            .withPropertyValues(
                "ordersaga.router.enabled=true",
                "ordersaga.router.max-read-count=0"
            )
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("should not create router when the saga is disabled")
    void shouldNotCreateRouterWhenSagaDisabled() {
        contextRunner
            .withPropertyValues(
                "ordersaga.enabled=false",
                "ordersaga.router.enabled=true"
            )
            .run(context -> assertThat(context).doesNotHaveBean(SagaMessageRouter.class));
    }

    @Configuration
    static class MockInfrastructureConfig {
        @Bean
        public DataSource dataSource() {
            return mock(DataSource.class);
        }

        @Bean
        public JdbcTemplate jdbcTemplate() {
            return mock(JdbcTemplate.class);
        }

        @Bean
        public TransactionTemplate transactionTemplate() {
            return mock(TransactionTemplate.class);
        }
    }
}
