package net.tickwork.adapter.jdbc;

import net.tickwork.adapter.jdbc.bus.JdbcMessageBus;
import net.tickwork.adapter.jdbc.repo.JdbcEventHandlerStore;
import net.tickwork.adapter.jdbc.repo.JdbcIdempotencyStore;
import net.tickwork.adapter.jdbc.repo.JdbcJobStore;
import net.tickwork.core.MutableClock;
import net.tickwork.core.StepCron;
import net.tickwork.core.handler.HandlerRegistry;
import net.tickwork.core.maintenance.MaintenanceService;
import net.tickwork.core.model.EventHandler;
import net.tickwork.core.model.EventHandlerOptions;
import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.monitor.HealthStatus;
import net.tickwork.core.monitor.SchedulerMonitor;
import net.tickwork.core.service.DispatchTickService;
import net.tickwork.core.service.JobConsumerWorker;
import net.tickwork.core.service.JobDefaults;
import net.tickwork.core.service.JobExecutor;
import net.tickwork.core.service.SchedulerEvents;
import net.tickwork.core.service.SchedulerService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** The whole engine against the database: two scheduler nodes share the tables and the dispatch stream. */
class JdbcSchedulingFlowAcceptanceTest extends TestSupport {
    static final Instant START = Instant.parse("2026-01-05T10:00:30Z");
    static final Instant T0505 = Instant.parse("2026-01-05T10:05:00Z");

    MutableClock clock;
    StepCron cron;
    JsonCodec json;
    JdbcJobStore jobs;
    JdbcMessageBus bus;
    Node a;
    Node b;

    /** Everything one scheduler process runs, over the shared stores. */
    final class Node {
        final HandlerRegistry handlers = new HandlerRegistry();
        final DispatchTickService tick;
        final JobExecutor executor;
        final JobConsumerWorker worker;
        final SchedulerService scheduler;
        final MaintenanceService maintenance;

        Node(String name) {
            this(name, bus);
        }

        Node(String name, JdbcMessageBus bus) {
            JdbcIdempotencyStore idempotency = new JdbcIdempotencyStore(json, clock);
            tick = new DispatchTickService(jobs, bus, tx, clock, cron, 100, Duration.ofSeconds(10));
            executor = new JobExecutor(jobs, idempotency, handlers, bus, tx, clock,
                    new JobExecutor.Settings(name, Duration.ofHours(1), 0.0, Duration.ofHours(1)));
            worker = new JobConsumerWorker(bus, executor, 10, Duration.ZERO);
            SchedulerMonitor monitor = new SchedulerMonitor(jobs, bus, tx, clock, tick.stats(), executor.stats());
            scheduler = new SchedulerService(jobs, new JdbcEventHandlerStore(json), bus, handlers, cron, tx, clock,
                    JobDefaults.standard(), monitor);
            maintenance = new MaintenanceService(jobs, idempotency, bus, tx, clock);
        }

        int drain() throws InterruptedException {
            int total = 0;
            int n;
            while ((n = worker.pollOnce(Duration.ZERO)) > 0) total += n;
            return total;
        }
    }

    @BeforeEach
    void setUp() {
        clock = new MutableClock(START);
        cron = new StepCron();
        json = new JsonCodec();
        jobs = new JdbcJobStore(json, clock);
        bus = new JdbcMessageBus(ds, json, clock, Duration.ofMinutes(5));
        a = new Node("node-a");
        b = new Node("node-b");
    }

    @AfterEach
    void tearDown() {
        a.executor.close();
        b.executor.close();
        bus.close();
    }

    private List<JobExecution> executions(String jobId) throws Exception {
        return tx.required(() -> jobs.listExecutions(jobId, ExecutionQuery.everything()));
    }

    @Test
    void cronJob_isDispatchedThroughTheStream_andRunOnce() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        a.handlers.registerFunction("report", (payload, ctx) -> Map.of("rows", calls.incrementAndGet(), "region", payload.get("region")));
        b.handlers.registerFunction("report", (payload, ctx) -> Map.of("rows", calls.incrementAndGet(), "region", payload.get("region")));

        Job job = a.scheduler.schedule(JobRequest.builder("nightly-report", "report")
                .schedule("*/5 * * * *")
                .payload(Map.of("region", "eu"))
                .tags(List.of("reports"))
                .build());
        assertEquals(T0505, job.nextRun());

        clock.set(T0505);
        assertEquals(1, a.tick.tickOnce().dispatched);
        assertEquals(0, b.tick.tickOnce().due);

        assertEquals(1, b.drain() + a.drain());

        JobExecution e = executions(job.id()).get(0);
        assertEquals(JobExecution.Status.SUCCESS, e.status());
        assertEquals(Map.of("rows", 1, "region", "eu"), e.result());
        assertEquals(1, calls.get());

        Job after = b.scheduler.getJob(job.id());
        assertEquals(Job.Status.ACTIVE, after.status());
        assertEquals(1, after.successCount());
        assertEquals(Instant.parse("2026-01-05T10:10:00Z"), after.nextRun());
        assertEquals(0, bus.pendingCount(SchedulerEvents.DISPATCH_STREAM, SchedulerEvents.EXECUTOR_GROUP));
        assertEquals(List.of(job.id()), b.scheduler.listJobs(JobFilter.builder().anyTags("reports").build())
                .stream().map(Job::id).toList());
    }

    @Test
    void competingTickRunners_dispatchEveryOccurrenceExactlyOnce() throws Exception {
        a.handlers.registerFunction("noop", (payload, ctx) -> null);
        List<String> ids = new ArrayList<>();
        for (int i = 0; i < 12; i++) {
            ids.add(a.scheduler.schedule(JobRequest.builder("job-" + i, "noop").schedule("*/5 * * * *").build()).id());
        }
        clock.set(T0505);

        ExecutorService pool = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        try {
            Future<DispatchTickService.TickReport> ra = pool.submit(() -> { start.await(); return a.tick.tickOnce(); });
            Future<DispatchTickService.TickReport> rb = pool.submit(() -> { start.await(); return b.tick.tickOnce(); });
            start.countDown();
            assertEquals(12, ra.get().dispatched + rb.get().dispatched);
        } finally {
            pool.shutdownNow();
        }

        for (String id : ids) assertEquals(1, executions(id).size());
        assertEquals(12, a.drain());
    }

    @Test
    void failingHandler_isRetriedAsNewExecutions_untilItSucceeds() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        a.handlers.registerFunction("flaky", (payload, ctx) -> {
            if (calls.incrementAndGet() < 3) throw new IllegalStateException("attempt " + ctx.retryCount() + " failed");
            return "ok";
        });
        Job job = a.scheduler.scheduleOnce(JobRequest.builder("flaky-once", "flaky")
                .executeAt(START.plusSeconds(30))
                .maxRetries(3)
                .retryDelayMs(0L)
                .build());

        clock.advance(Duration.ofSeconds(30));
        a.tick.tickOnce();
        a.drain();

        List<JobExecution> chain = executions(job.id());
        assertEquals(3, chain.size());
        assertEquals(List.of(JobExecution.Status.FAILED, JobExecution.Status.FAILED, JobExecution.Status.SUCCESS),
                chain.stream().map(JobExecution::status).toList());
        assertEquals(List.of(0, 1, 2), chain.stream().map(JobExecution::retryCount).toList());
        assertEquals(chain.get(1).id(), chain.get(2).parentExecutionId());
        assertEquals("attempt 0 failed", chain.get(0).errorMessage());
        assertEquals("ok", chain.get(2).result());

        Job after = a.scheduler.getJob(job.id());
        assertEquals(Job.Status.COMPLETED, after.status());
        assertEquals(2, after.failureCount());
        assertEquals(1, after.successCount());
    }

    @Test
    void persistedActionHandlers_surviveARestart() throws Exception {
        EventHandler h = a.scheduler.onEvent("ticket:opened", new EventHandler.Action(EventHandler.ActionType.CREATE_JOB,
                Map.of("handler_name", "escalate", "delay_ms", 60_000)), EventHandlerOptions.named("escalation").withPriority(5));
        a.executor.close();

        // a fresh process on the same database, with its own in-process subscribers
        JdbcMessageBus freshBus = new JdbcMessageBus(ds, json, clock, Duration.ofMinutes(5));
        Node restarted = new Node("node-c", freshBus);
        try {
            assertEquals(1, restarted.scheduler.restoreEventSubscriptions());
            EventHandler stored = restarted.scheduler.listEventHandlers("ticket:opened").get(0);
            assertEquals(h.id(), stored.id());
            assertEquals(5, stored.priority());
            assertEquals(60_000, ((Number) stored.action().config().get("delay_ms")).intValue());

            restarted.scheduler.triggerEvent("ticket:opened", Map.of("ticket", "T-9"));

            List<Job> created = restarted.scheduler.listJobs(JobFilter.builder().createdBy("event:" + h.id()).build());
            assertEquals(1, created.size());
            assertEquals(START.plusSeconds(60), created.get(0).nextRun());
            assertEquals(Map.of("ticket", "T-9"), created.get(0).payload().get("event_data"));
        } finally {
            restarted.executor.close();
            freshBus.close();
        }
    }

    @Test
    void maintenance_timesOutExecutionsOfDeadWorkers() throws Exception {
        a.handlers.registerFunction("noop", (payload, ctx) -> null);
        Job job = a.scheduler.scheduleOnce(JobRequest.builder("stuck", "noop")
                .executeAt(START.plusSeconds(10)).timeoutMs(60_000L).maxRetries(0).build());
        clock.advance(Duration.ofSeconds(10));
        a.tick.tickOnce();

        JobExecution pending = executions(job.id()).get(0);
        JobExecution running = pending.toBuilder().status(JobExecution.Status.RUNNING).startedAt(clock.now())
                .workerId("dead-worker").build();
        assertTrue(tx.required(() -> jobs.updateExecution(running, JobExecution.Status.PENDING)));

        clock.advance(Duration.ofMinutes(3));
        assertEquals(1, b.maintenance.runOnce(Duration.ofMinutes(1), 100).abandonedExecutions);

        assertEquals(JobExecution.Status.TIMEOUT, b.scheduler.getExecution(running.id()).status());
        assertEquals(Job.Status.COMPLETED, b.scheduler.getJob(job.id()).status());

        // the late delivery of the dispatch message is discarded
        assertEquals(1, a.drain());
        assertEquals(JobExecution.Status.TIMEOUT, a.scheduler.getExecution(running.id()).status());
    }

    @Test
    void maintenance_retriesAbandonedExecutionsWithAttemptsLeft() throws Exception {
        a.handlers.registerFunction("noop", (payload, ctx) -> "ran");
        Job job = a.scheduler.schedule(JobRequest.builder("cron-stuck", "noop").schedule("*/5 * * * *")
                .maxRetries(2).retryDelayMs(1_000L).timeoutMs(60_000L).build());
        clock.set(T0505);
        a.tick.tickOnce();

        JobExecution pending = executions(job.id()).get(0);
        JobExecution running = pending.toBuilder().status(JobExecution.Status.RUNNING).startedAt(clock.now())
                .workerId("dead-worker").build();
        assertTrue(tx.required(() -> jobs.updateExecution(running, JobExecution.Status.PENDING)));

        clock.advance(Duration.ofMinutes(3));
        assertEquals(1, b.maintenance.runOnce(Duration.ofMinutes(1), 100).abandonedExecutions);

        assertThat(executions(job.id()))
                .extracting(JobExecution::retryCount, JobExecution::status)
                .containsExactlyInAnyOrder(
                        tuple(0, JobExecution.Status.TIMEOUT),
                        tuple(1, JobExecution.Status.PENDING));
    }

    @Test
    void maintenance_releasesExecutionsClaimedByDeadWorkers() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        a.handlers.registerFunction("count", (payload, ctx) -> calls.incrementAndGet());
        Job job = a.scheduler.schedule(JobRequest.builder("cron-claimed", "count").schedule("*/5 * * * *")
                .timeoutMs(60_000L).build());
        clock.set(T0505);
        a.tick.tickOnce();
        JobExecution pending = executions(job.id()).get(0);

        JdbcIdempotencyStore markers = new JdbcIdempotencyStore(json, clock);
        assertTrue(tx.required(() -> markers.tryBegin(pending.id(), Duration.ofHours(3))));
        a.drain();
        assertThat(calls).hasValue(0);

        clock.set(Instant.parse("2026-01-05T10:07:30Z"));
        assertEquals(1, b.maintenance.runOnce(Duration.ofMinutes(1), 100).releasedExecutions);
        assertThat(tx.required(() -> markers.find(pending.id()))).isEmpty();

        assertEquals(1, b.tick.tickOnce().redispatched);
        assertEquals(1, a.drain());
        assertThat(calls).hasValue(1);
        assertEquals(JobExecution.Status.SUCCESS, a.scheduler.getExecution(pending.id()).status());
    }

    @Test
    void health_andMetrics_readTheDatabase() throws Exception {
        a.handlers.registerFunction("noop", (payload, ctx) -> null);
        a.scheduler.schedule(JobRequest.builder("one", "noop").schedule("*/5 * * * *").build());
        a.scheduler.schedule(JobRequest.builder("two", "noop").schedule("*/5 * * * *").disabled(true).build());

        assertEquals(HealthStatus.State.HEALTHY, a.scheduler.healthCheck().state());
        assertEquals(1L, a.scheduler.getMetrics().jobs(Job.Status.ACTIVE));
        assertEquals(1L, a.scheduler.getMetrics().jobs(Job.Status.PAUSED));
    }
}
