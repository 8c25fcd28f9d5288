package com.ivamare.ordersaga.health;

import com.ivamare.ordersaga.OrderSagaAutoConfiguration;
import com.ivamare.ordersaga.OrderSagaProperties;
import com.ivamare.ordersaga.ops.SagaIncidentQueue;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import javax.sql.DataSource;

/**
 * Auto-configuration for the order saga health indicator.
 */
@AutoConfiguration(after = OrderSagaAutoConfiguration.class)
@ConditionalOnClass({HealthIndicator.class, JdbcTemplate.class})
@ConditionalOnProperty(prefix = "ordersaga", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SagaHealthAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(OrderSagaHealthIndicator.class)
    @ConditionalOnBean(SagaIncidentQueue.class)
    public OrderSagaHealthIndicator orderSagaHealthIndicator(
            JdbcTemplate jdbcTemplate,
            SagaIncidentQueue incidents,
            OrderSagaProperties properties,
            ObjectProvider<DataSource> dataSource) {
        return new OrderSagaHealthIndicator(jdbcTemplate, incidents, properties.getInboxQueue(),
            dataSource.getIfAvailable());
    }
}
