package net.tickwork.core.service;

import net.tickwork.core.FlakyBus;
import net.tickwork.core.SchedulerFixture;
import net.tickwork.core.model.DispatchEnvelope;
import net.tickwork.core.model.Envelope;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.monitor.HealthStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DispatchTickServiceTest {
    static final Instant T0505 = Instant.parse("2026-01-05T10:05:00Z");

    FlakyBus flaky;
    SchedulerFixture f;

    @BeforeEach
    void setUp() {
        f = new SchedulerFixture(FlakyBus::new);
        flaky = (FlakyBus) f.bus;
        f.handlers.registerFunction("noop", (payload, ctx) -> null);
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    private Job every5(String name) throws Exception {
        return f.scheduler.schedule(JobRequest.builder(name, "noop").schedule("*/5 * * * *").build());
    }

    @Test
    void dueJob_isDispatchedOnce_andNextRunAdvances() throws Exception {
        Job job = every5("tick");
        assertEquals(0, f.tick.tickOnce().due);

        f.clock.set(T0505);
        DispatchTickService.TickReport r = f.tick.tickOnce();

        assertEquals(1, r.due);
        assertEquals(1, r.dispatched);
        List<JobExecution> executions = f.executions(job.id());
        assertEquals(1, executions.size());
        JobExecution e = executions.get(0);
        assertEquals(JobExecution.Status.PENDING, e.status());
        assertEquals(T0505, e.scheduledAt());
        assertEquals(0, e.retryCount());
        assertNotNull(e.dispatchedAt());
        assertEquals(Instant.parse("2026-01-05T10:10:00Z"), f.scheduler.getJob(job.id()).nextRun());

        List<Envelope> stream = f.memoryBus.readStream(SchedulerEvents.DISPATCH_STREAM);
        assertEquals(1, stream.size());
        DispatchEnvelope d = DispatchEnvelope.from(stream.get(0));
        assertEquals(e.id(), d.executionId());
        assertEquals(job.id(), d.jobId());
        assertEquals("noop", d.handlerName());

        assertEquals(0, f.tick.tickOnce().dispatched);
    }

    @Test
    void claimedOneTimeJob_staysActiveWithoutNextRun_untilItsChainResolves() throws Exception {
        f.handlers.registerFunction("flaky", (payload, ctx) -> {
            if (ctx.retryCount() == 0) throw new IllegalStateException("first attempt fails");
            return "ok";
        });
        Job job = f.scheduler.scheduleOnce(JobRequest.builder("once", "flaky")
                .executeAt(f.clock.now().plusSeconds(30)).maxRetries(1).retryDelayMs(1_000L).build());
        f.clock.advance(Duration.ofSeconds(30));

        assertEquals(1, f.tick.tickOnce().dispatched);
        Job inFlight = f.scheduler.getJob(job.id());
        assertEquals(Job.Status.ACTIVE, inFlight.status());
        assertNull(inFlight.nextRun());
        assertEquals(0, f.tick.tickOnce().due);

        // the failed first attempt leaves a retry in flight
        f.drain();
        assertEquals(Job.Status.ACTIVE, f.scheduler.getJob(job.id()).status());
        assertNull(f.scheduler.getJob(job.id()).nextRun());

        f.clock.advance(Duration.ofSeconds(1));
        f.drain();
        Job done = f.scheduler.getJob(job.id());
        assertEquals(Job.Status.COMPLETED, done.status());
        assertNull(done.nextRun());
    }

    @Test
    void higherPriorityJobs_areDispatchedFirst() throws Exception {
        Job low = f.scheduler.schedule(JobRequest.builder("low", "noop").schedule("*/5 * * * *")
                .priority(Job.Priority.LOW).build());
        Job critical = f.scheduler.schedule(JobRequest.builder("critical", "noop").schedule("*/5 * * * *")
                .priority(Job.Priority.CRITICAL).build());
        f.clock.set(T0505);

        f.tick.tickOnce();

        List<Envelope> stream = f.memoryBus.readStream(SchedulerEvents.DISPATCH_STREAM);
        assertEquals(critical.id(), DispatchEnvelope.from(stream.get(0)).jobId());
        assertEquals(low.id(), DispatchEnvelope.from(stream.get(1)).jobId());
    }

    @Test
    void overlappingOccurrence_isRecordedAsSkipped() throws Exception {
        Job job = every5("slow");
        f.clock.set(T0505);
        f.tick.tickOnce();

        f.clock.set(Instant.parse("2026-01-05T10:10:00Z"));
        DispatchTickService.TickReport r = f.tick.tickOnce();

        assertEquals(1, r.skipped);
        assertEquals(0, r.dispatched);
        List<JobExecution> executions = f.executions(job.id());
        assertEquals(2, executions.size());
        JobExecution skipped = executions.get(1);
        assertEquals(JobExecution.Status.SKIPPED, skipped.status());
        assertNotNull(skipped.completedAt());
        assertNull(skipped.dispatchedAt());
        assertEquals(1, f.memoryBus.readStream(SchedulerEvents.DISPATCH_STREAM).size());
        assertEquals(Instant.parse("2026-01-05T10:15:00Z"), f.scheduler.getJob(job.id()).nextRun());
        assertEquals(1, f.events(SchedulerEvents.EXECUTION_SKIPPED).size());
    }

    @Test
    void allowOverlap_dispatchesConcurrentOccurrences() throws Exception {
        Job job = f.scheduler.schedule(JobRequest.builder("parallel", "noop").schedule("*/5 * * * *")
                .allowOverlap(true).build());
        f.clock.set(T0505);
        f.tick.tickOnce();
        f.clock.set(Instant.parse("2026-01-05T10:10:00Z"));
        f.tick.tickOnce();

        assertTrue(f.executions(job.id()).stream().allMatch(e -> e.status() == JobExecution.Status.PENDING));
        assertEquals(2, f.executions(job.id()).size());
    }

    @Test
    void concurrencyAboveOne_allowsThatManyActiveExecutions() throws Exception {
        Job job = f.scheduler.schedule(JobRequest.builder("two", "noop").schedule("*/5 * * * *")
                .concurrency(2).build());
        for (int i = 1; i <= 3; i++) {
            f.clock.set(Instant.parse("2026-01-05T10:00:00Z").plus(Duration.ofMinutes(5L * i)));
            f.tick.tickOnce();
        }

        List<JobExecution> executions = f.executions(job.id());
        assertEquals(2, executions.stream().filter(e -> e.status() == JobExecution.Status.PENDING).count());
        assertEquals(1, executions.stream().filter(e -> e.status() == JobExecution.Status.SKIPPED).count());
    }

    @Test
    void competingTickRunners_claimEachOccurrenceOnce() throws Exception {
        Job job = every5("contended");
        f.clock.set(T0505);
        int runners = 6;
        List<DispatchTickService> ticks = new ArrayList<>();
        for (int i = 0; i < runners; i++) {
            ticks.add(new DispatchTickService(f.jobs, f.bus, f.tx, f.clock, f.cron, 100, Duration.ofSeconds(10)));
        }

        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(runners);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (DispatchTickService t : ticks) {
                Callable<Integer> c = () -> {
                    go.await();
                    return t.tickOnce().dispatched;
                };
                results.add(pool.submit(c));
            }
            go.countDown();
            int dispatched = 0;
            for (Future<Integer> r : results) dispatched += r.get(5, TimeUnit.SECONDS);

            assertEquals(1, dispatched);
            assertEquals(1, f.executions(job.id()).size());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void recurringJob_completesAtMaxExecutions() throws Exception {
        Job job = f.scheduler.scheduleRecurring(JobRequest.builder("capped", "noop").schedule("*/5 * * * *")
                .maxExecutions(3).build());
        int completed = 0;
        for (int i = 1; i <= 5; i++) {
            f.clock.set(Instant.parse("2026-01-05T10:00:00Z").plus(Duration.ofMinutes(5L * i)));
            completed += f.tick.tickOnce().completed;
            f.drain();
        }

        Job done = f.scheduler.getJob(job.id());
        assertEquals(1, completed);
        assertEquals(Job.Status.COMPLETED, done.status());
        assertNull(done.nextRun());
        assertNotNull(done.completedAt());
        assertEquals(3, f.executions(job.id()).size());
        assertEquals(1, f.events(SchedulerEvents.JOB_COMPLETED).size());
    }

    @Test
    void recurringJob_completesWhenNoOccurrenceIsLeftBeforeEndDate() throws Exception {
        Job job = f.scheduler.scheduleRecurring(JobRequest.builder("window", "noop").schedule("*/5 * * * *")
                .endDate(Instant.parse("2026-01-05T10:12:00Z")).build());
        f.clock.set(T0505);
        f.tick.tickOnce();
        f.drain();
        f.clock.set(Instant.parse("2026-01-05T10:10:00Z"));
        f.tick.tickOnce();
        f.drain();

        assertEquals(Job.Status.COMPLETED, f.scheduler.getJob(job.id()).status());
        assertEquals(2, f.executions(job.id()).size());
    }

    @Test
    void pausedJobs_areIgnored() throws Exception {
        Job job = every5("paused");
        f.scheduler.pauseJob(job.id());
        f.clock.set(T0505);

        assertEquals(0, f.tick.tickOnce().due);
        assertTrue(f.executions(job.id()).isEmpty());
    }

    @Test
    void unreachableBus_leavesExecutionForRedispatch_andDegradesHealth() throws Exception {
        Job job = every5("flaky");
        f.clock.set(T0505);
        flaky.down(true);

        DispatchTickService.TickReport failed = f.tick.tickOnce();

        assertTrue(failed.transportFailure);
        assertEquals(1, failed.errors);
        JobExecution stranded = f.executions(job.id()).get(0);
        assertEquals(JobExecution.Status.PENDING, stranded.status());
        assertNull(stranded.dispatchedAt());
        assertEquals(Instant.parse("2026-01-05T10:10:00Z"), f.scheduler.getJob(job.id()).nextRun());
        assertEquals(HealthStatus.State.DEGRADED, f.scheduler.healthCheck().state());

        flaky.down(false);
        f.clock.advance(Duration.ofSeconds(5));
        assertEquals(0, f.tick.tickOnce().redispatched);

        f.clock.advance(Duration.ofSeconds(10));
        DispatchTickService.TickReport recovered = f.tick.tickOnce();
        assertEquals(1, recovered.redispatched);
        assertFalse(recovered.transportFailure);
        assertNotNull(f.scheduler.getExecution(stranded.id()).dispatchedAt());
        assertEquals(HealthStatus.State.HEALTHY, f.scheduler.healthCheck().state());

        f.drain();
        assertEquals(JobExecution.Status.SUCCESS, f.scheduler.getExecution(stranded.id()).status());
    }

    @Test
    void manuallyStrandedExecution_isRepublishedOnlyOnce() throws Exception {
        Job job = every5("orphan");
        Instant old = f.clock.now().minusSeconds(60);
        String id = UUID.randomUUID().toString();
        f.jobs.createExecution(JobExecution.builder().id(id).jobId(job.id()).scheduledAt(old).correlationId(id)
                .maxRetries(job.maxRetries()).createdAt(old).updatedAt(old).build());

        assertEquals(1, f.tick.tickOnce().redispatched);
        assertEquals(0, f.tick.tickOnce().redispatched);
        assertEquals(1, f.memoryBus.readStream(SchedulerEvents.DISPATCH_STREAM).size());
    }
}
