package net.tickwork.bootstrap.autoconfigure;

import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.adapter.jdbc.bus.JdbcMessageBus;
import net.tickwork.bootstrap.catalog.CatalogRegistrar;
import net.tickwork.bootstrap.props.TickworkProperties;
import net.tickwork.core.handler.AgentDispatcher;
import net.tickwork.core.handler.HandlerRegistry;
import net.tickwork.core.handler.JobHandler;
import net.tickwork.core.handler.WorkflowTrigger;
import net.tickwork.core.maintenance.MaintenanceService;
import net.tickwork.core.memory.InMemoryEventHandlerStore;
import net.tickwork.core.memory.InMemoryIdempotencyStore;
import net.tickwork.core.memory.InMemoryJobStore;
import net.tickwork.core.memory.InMemoryMessageBus;
import net.tickwork.core.monitor.SchedulerMonitor;
import net.tickwork.core.service.DispatchTickService;
import net.tickwork.core.service.JobConsumerWorker;
import net.tickwork.core.service.JobDefaults;
import net.tickwork.core.service.JobExecutor;
import net.tickwork.core.service.RetryScheduler;
import net.tickwork.core.service.SchedulerService;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.CronCalculator;
import net.tickwork.core.spi.EventHandlerStore;
import net.tickwork.core.spi.IdempotencyStore;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.TxRunner;
import net.tickwork.integration.spring.ConsumerWorkerLifecycle;
import net.tickwork.integration.spring.TickworkSpringConfig;
import net.tickwork.integration.spring.cron.CronUtilsCalculator;
import net.tickwork.integration.spring.metrics.SchedulerMeterBinder;
import net.tickwork.integration.spring.sched.TickworkSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.core.annotation.Order;
import org.springframework.scheduling.annotation.EnableScheduling;

import javax.sql.DataSource;
import java.time.ZoneId;
import java.util.UUID;

/**
 * Wires the scheduler. With a {@link DataSource} in the context the JDBC stores and the JDBC stream
 * bus are used, otherwise the in-memory adapters. Every bean backs off when the application defines
 * its own.
 */
@AutoConfiguration(afterName = {
        "org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration",
        "org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration",
        "org.springframework.boot.autoconfigure.flyway.FlywayAutoConfiguration"
})
@EnableConfigurationProperties(TickworkProperties.class)
public class TickworkAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(TickworkAutoConfiguration.class);

    // --- stores and bus ---

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnBean(DataSource.class)
    @ConditionalOnMissingBean(JobStore.class)
    @Import(TickworkSpringConfig.class) // integration-spring: tx runner + JDBC stores
    static class JdbcStoreConfiguration {

        @Bean
        @ConditionalOnMissingBean(MessageBus.class)
        JdbcMessageBus messageBus(DataSource ds, JsonCodec json, Clock clock, TickworkProperties props) {
            return new JdbcMessageBus(ds, json, clock, props.getBus().getVisibilityTimeout());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnMissingBean(JobStore.class)
    static class InMemoryStoreConfiguration {

        @Bean
        TxRunner txRunner() {
            return TxRunner.direct();
        }

        @Bean
        JobStore jobStore(Clock clock) {
            log.info("No DataSource found; jobs are kept in memory");
            return new InMemoryJobStore(clock);
        }

        @Bean
        EventHandlerStore eventHandlerStore() {
            return new InMemoryEventHandlerStore();
        }

        @Bean
        IdempotencyStore idempotencyStore(Clock clock) {
            return new InMemoryIdempotencyStore(clock);
        }

        @Bean
        @ConditionalOnMissingBean(MessageBus.class)
        InMemoryMessageBus messageBus(Clock clock, TickworkProperties props) {
            return new InMemoryMessageBus(clock, props.getBus().getVisibilityTimeout());
        }
    }

    // --- SPI defaults ---

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock tickworkClock() {
        return Clock.system();
    }

    @Bean
    @ConditionalOnMissingBean(CronCalculator.class)
    public CronCalculator cronCalculator() {
        return new CronUtilsCalculator();
    }

    /** Every {@link JobHandler} bean becomes a function handler under its bean name. */
    @Bean
    @ConditionalOnMissingBean
    public HandlerRegistry handlerRegistry(ListableBeanFactory beans,
                                           ObjectProvider<AgentDispatcher> agents,
                                           ObjectProvider<WorkflowTrigger> workflows) {
        var registry = new HandlerRegistry();
        beans.getBeansOfType(JobHandler.class).forEach(registry::registerFunction);
        agents.ifAvailable(registry::agentDispatcher);
        workflows.ifAvailable(registry::workflowTrigger);
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public JobDefaults jobDefaults(TickworkProperties props) {
        var d = props.getDefaults();
        return new JobDefaults(d.getMaxRetries(), d.getRetryDelay().toMillis(), d.getTimeout().toMillis(), d.getConcurrency());
    }

    // --- core services ---

    @Bean
    @ConditionalOnMissingBean
    public DispatchTickService dispatchTickService(JobStore jobs, MessageBus bus, TxRunner tx, Clock clock,
                                                   CronCalculator cron, TickworkProperties props) {
        var s = props.getScheduler();
        return new DispatchTickService(jobs, bus, tx, clock, cron, s.getBatchSize(), s.getRedispatchGrace());
    }

    @Bean
    @ConditionalOnMissingBean
    public JobExecutor jobExecutor(JobStore jobs, IdempotencyStore idempotency, HandlerRegistry handlers,
                                   MessageBus bus, TxRunner tx, Clock clock, TickworkProperties props) {
        var e = props.getExecutor();
        String workerId = e.getWorkerId() != null ? e.getWorkerId()
                : "tickwork-" + UUID.randomUUID().toString().substring(0, 8);
        return new JobExecutor(jobs, idempotency, handlers, bus, tx, clock,
                new JobExecutor.Settings(workerId, e.getMaxRetryDelay(), e.getJitterFactor(), e.getIdempotencyTtlFloor()));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobConsumerWorker jobConsumerWorker(MessageBus bus, JobExecutor executor, TickworkProperties props) {
        var e = props.getExecutor();
        return new JobConsumerWorker(bus, executor, e.getBatchSize(), e.getPollTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerMonitor schedulerMonitor(JobStore jobs, MessageBus bus, TxRunner tx, Clock clock,
                                             DispatchTickService tick, JobExecutor executor) {
        return new SchedulerMonitor(jobs, bus, tx, clock, tick.stats(), executor.stats());
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerService schedulerService(JobStore jobs, EventHandlerStore eventHandlers, MessageBus bus,
                                             HandlerRegistry handlers, CronCalculator cron, TxRunner tx,
                                             Clock clock, JobDefaults defaults, SchedulerMonitor monitor) {
        return new SchedulerService(jobs, eventHandlers, bus, handlers, cron, tx, clock, defaults, monitor);
    }

    @Bean
    @ConditionalOnMissingBean
    public MaintenanceService maintenanceService(JobStore jobs, IdempotencyStore idempotency, MessageBus bus,
                                                 TxRunner tx, Clock clock, TickworkProperties props) {
        var e = props.getExecutor();
        return new MaintenanceService(jobs, idempotency, bus, tx, clock,
                new RetryScheduler(jobs, bus, tx, e.getMaxRetryDelay(), e.getJitterFactor()));
    }

    // --- runtime drivers ---

    @Configuration(proxyBeanMethods = false)
    @EnableScheduling
    @ConditionalOnProperty(prefix = "tickwork.scheduler", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class SchedulingConfiguration {

        @Bean
        @ConditionalOnMissingBean
        TickworkSchedulers tickworkSchedulers(DispatchTickService tick, MaintenanceService maintenance,
                                              Clock clock, MessageBus bus, TickworkProperties props) {
            var s = new TickworkSchedulers(tick, maintenance, bus, clock);
            s.setAbandonGrace(props.getExecutor().getAbandonGrace());
            s.setMaintenanceBatchSize(props.getScheduler().getBatchSize());
            s.setStreamRetention(props.getBus().getStreamRetention());
            return s;
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnProperty(prefix = "tickwork.executor", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class ExecutorConfiguration {

        @Bean
        @ConditionalOnMissingBean
        ConsumerWorkerLifecycle consumerWorkerLifecycle(JobConsumerWorker worker, TickworkProperties props) {
            var e = props.getExecutor();
            return new ConsumerWorkerLifecycle(worker, e.getWorkers(), e.getShutdownGrace());
        }
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnClass(name = "io.micrometer.core.instrument.binder.MeterBinder")
    static class MetricsConfiguration {

        @Bean
        @ConditionalOnMissingBean
        SchedulerMeterBinder schedulerMeterBinder(DispatchTickService tick, JobExecutor executor,
                                                  JobStore jobs, TxRunner tx) {
            return new SchedulerMeterBinder(tick.stats(), executor.stats(), jobs, tx);
        }
    }

    // --- startup ---

    @Bean
    @Order(0)
    public ApplicationRunner tickworkEventSubscriptionRunner(SchedulerService scheduler) {
        return args -> {
            int restored = scheduler.restoreEventSubscriptions();
            if (restored > 0) log.info("Restored {} event subscription(s)", restored);
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public CatalogRegistrar catalogRegistrar(SchedulerService scheduler, TickworkProperties props) {
        return new CatalogRegistrar(scheduler, ZoneId.of(props.getZone()));
    }

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "tickwork.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner tickworkCatalogRunner(CatalogRegistrar registrar, TickworkProperties props) {
        return args -> {
            if (props.getCatalog().getJobs().isEmpty()) return;
            log.info("Registering {} catalog job(s)", props.getCatalog().getJobs().size());
            registrar.register(props.getCatalog());
        };
    }
}
