package net.tickwork.integration.spring;

import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.adapter.jdbc.repo.JdbcEventHandlerStore;
import net.tickwork.adapter.jdbc.repo.JdbcIdempotencyStore;
import net.tickwork.adapter.jdbc.repo.JdbcJobStore;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.EventHandlerStore;
import net.tickwork.core.spi.IdempotencyStore;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.TxRunner;
import net.tickwork.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

/**
 * JDBC stores over the application's {@link DataSource}, joined to Spring-managed transactions.
 * Expects a {@link Clock} and a {@link PlatformTransactionManager} bean.
 */
@Configuration(proxyBeanMethods = false)
public class TickworkSpringConfig {

    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    @Bean
    public JsonCodec tickworkJsonCodec() {
        return new JsonCodec();
    }

    @Bean
    public JobStore jobStore(JsonCodec json, Clock clock) {
        return new JdbcJobStore(json, clock);
    }

    @Bean
    public EventHandlerStore eventHandlerStore(JsonCodec json) {
        return new JdbcEventHandlerStore(json);
    }

    @Bean
    public IdempotencyStore idempotencyStore(JsonCodec json, Clock clock) {
        return new JdbcIdempotencyStore(json, clock);
    }
}
