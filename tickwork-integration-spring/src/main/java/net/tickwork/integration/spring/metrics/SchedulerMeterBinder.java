package net.tickwork.integration.spring.metrics;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import net.tickwork.core.model.Job;
import net.tickwork.core.service.ConsumerStats;
import net.tickwork.core.service.DispatchStats;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.ToDoubleFunction;

/**
 * Publishes dispatch and consumer counters as function counters ({@code tickwork.dispatch.*},
 * {@code tickwork.executor.*}) and the job count per status as the {@code tickwork.jobs} gauge.
 */
public class SchedulerMeterBinder implements MeterBinder {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMeterBinder.class);

    private final DispatchStats dispatch;
    private final ConsumerStats consumer;
    private final JobStore jobs;
    private final TxRunner tx;

    public SchedulerMeterBinder(DispatchStats dispatch, ConsumerStats consumer, JobStore jobs, TxRunner tx) {
        this.dispatch = dispatch;
        this.consumer = consumer;
        this.jobs = jobs;
        this.tx = tx;
    }

    @Override
    public void bindTo(MeterRegistry registry) {
        dispatchCounter(registry, "dispatched", "Executions handed to the bus", s -> s.dispatched());
        dispatchCounter(registry, "skipped", "Runs skipped by the overlap guard", s -> s.skipped());
        dispatchCounter(registry, "completed", "Jobs completed by the dispatch tick", s -> s.completed());
        dispatchCounter(registry, "redispatched", "Stranded executions published again", s -> s.redispatched());
        dispatchCounter(registry, "errors", "Per-job dispatch failures", s -> s.errors());

        consumerCounter(registry, "processed", "Deliveries handled", s -> s.processed());
        consumerCounter(registry, "succeeded", "Executions that succeeded", s -> s.succeeded());
        consumerCounter(registry, "failed", "Executions that failed", s -> s.failed());
        consumerCounter(registry, "timed.out", "Executions that hit their timeout", s -> s.timedOut());
        consumerCounter(registry, "retried", "Retry executions scheduled", s -> s.retried());
        consumerCounter(registry, "duplicates", "Duplicate deliveries discarded", s -> s.duplicates());

        for (Job.Status status : Job.Status.values()) {
            Gauge.builder("tickwork.jobs", this, b -> b.countJobs(status))
                    .tag("status", status.code())
                    .description("Jobs per status")
                    .register(registry);
        }
    }

    private void dispatchCounter(MeterRegistry registry, String name, String description,
                                 ToDoubleFunction<DispatchStats.Snapshot> f) {
        FunctionCounter.builder("tickwork.dispatch." + name, dispatch, d -> f.applyAsDouble(d.snapshot()))
                .description(description)
                .register(registry);
    }

    private void consumerCounter(MeterRegistry registry, String name, String description,
                                 ToDoubleFunction<ConsumerStats.Snapshot> f) {
        FunctionCounter.builder("tickwork.executor." + name, consumer, c -> f.applyAsDouble(c.snapshot()))
                .description(description)
                .register(registry);
    }

    private double countJobs(Job.Status status) {
        try {
            Map<Job.Status, Long> counts = tx.required(jobs::countJobsByStatus);
            return counts.getOrDefault(status, 0L);
        } catch (Exception e) {
            log.debug("Job count unavailable: {}", e.getMessage());
            return Double.NaN;
        }
    }
}
