package net.tickwork.core.monitor;

import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.service.ConsumerStats;
import net.tickwork.core.service.DispatchStats;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.LongSummaryStatistics;
import java.util.Map;
import java.util.Objects;

public final class SchedulerMonitor {
    private static final Logger log = LoggerFactory.getLogger(SchedulerMonitor.class);

    private final JobStore jobs;
    private final MessageBus bus;
    private final TxRunner tx;
    private final Clock clock;
    private final DispatchStats dispatchStats;
    private final ConsumerStats consumerStats;

    public SchedulerMonitor(JobStore jobs, MessageBus bus, TxRunner tx, Clock clock,
                            DispatchStats dispatchStats, ConsumerStats consumerStats) {
        this.jobs = jobs;
        this.bus = bus;
        this.tx = tx;
        this.clock = clock;
        this.dispatchStats = dispatchStats;
        this.consumerStats = consumerStats;
    }

    public SchedulerMetrics metrics() throws Exception {
        Map<Job.Status, Long> byJob = tx.required(jobs::countJobsByStatus);
        Map<JobExecution.Status, Long> byExecution = tx.required(jobs::countExecutionsByStatus);
        long ok = byExecution.getOrDefault(JobExecution.Status.SUCCESS, 0L);
        long bad = byExecution.getOrDefault(JobExecution.Status.FAILED, 0L)
                + byExecution.getOrDefault(JobExecution.Status.TIMEOUT, 0L);
        double rate = ok + bad == 0 ? 0.0 : (double) ok / (ok + bad);
        return new SchedulerMetrics(clock.now(), byJob, byExecution, rate,
                dispatchStats == null ? null : dispatchStats.snapshot(),
                consumerStats == null ? null : consumerStats.snapshot());
    }

    /**
     * Unhealthy when the store cannot be read; degraded when the bus is down or the last dispatch
     * tick could not publish.
     */
    public HealthStatus health() {
        Map<String, HealthStatus.Component> components = new LinkedHashMap<>();
        boolean storeUp;
        try {
            tx.required(jobs::countJobsByStatus);
            storeUp = true;
            components.put("store", new HealthStatus.Component(true, "ok"));
        } catch (Exception e) {
            storeUp = false;
            log.warn("Health check: job store unavailable: {}", e.getMessage());
            components.put("store", new HealthStatus.Component(false, String.valueOf(e.getMessage())));
        }

        MessageBus.BusHealth busHealth;
        try {
            busHealth = bus.health();
        } catch (RuntimeException e) {
            busHealth = MessageBus.BusHealth.down(String.valueOf(e.getMessage()));
        }
        components.put("bus", new HealthStatus.Component(busHealth.up(), busHealth.detail()));

        boolean dispatcherOk = true;
        if (dispatchStats != null) {
            var s = dispatchStats.snapshot();
            dispatcherOk = !s.lastTickTransportFailure();
            components.put("dispatcher", new HealthStatus.Component(dispatcherOk,
                    s.lastTickAt() == null ? "no tick yet" : "last tick " + s.lastTickAt()
                            + (dispatcherOk ? "" : " could not publish")));
        }

        HealthStatus.State state;
        if (!storeUp) state = HealthStatus.State.UNHEALTHY;
        else if (!busHealth.up() || !dispatcherOk) state = HealthStatus.State.DEGRADED;
        else state = HealthStatus.State.HEALTHY;
        return new HealthStatus(state, components, clock.now());
    }

    public JobStats jobStats(Job job) throws Exception {
        List<JobExecution> all = tx.required(() -> jobs.listExecutions(job.id(), ExecutionQuery.everything()));
        long succeeded = count(all, JobExecution.Status.SUCCESS);
        long failed = count(all, JobExecution.Status.FAILED);
        long timedOut = count(all, JobExecution.Status.TIMEOUT);
        long skipped = count(all, JobExecution.Status.SKIPPED);
        long active = all.stream().filter(e -> e.status().isActive()).count();
        long finished = succeeded + failed + timedOut;

        LongSummaryStatistics durations = all.stream()
                .filter(e -> e.status() != JobExecution.Status.SKIPPED)
                .map(JobExecution::durationMs)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .summaryStatistics();
        boolean any = durations.getCount() > 0;

        JobExecution last = all.stream()
                .filter(e -> e.status().isTerminal())
                .max(Comparator.comparing(e -> e.completedAt() == null ? e.scheduledAt() : e.completedAt()))
                .orElse(null);

        return new JobStats(job.id(), all.size(), succeeded, failed, timedOut, skipped, active,
                finished == 0 ? 0.0 : (double) succeeded / finished,
                any ? Math.round(durations.getAverage()) : null,
                any ? durations.getMin() : null,
                any ? durations.getMax() : null,
                last, job.nextRun());
    }

    private static long count(List<JobExecution> all, JobExecution.Status status) {
        return all.stream().filter(e -> e.status() == status).count();
    }
}
