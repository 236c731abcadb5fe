package net.tickwork.core.service;

import net.tickwork.core.SchedulerFixture;
import net.tickwork.core.error.NotFoundException;
import net.tickwork.core.error.StateConflictException;
import net.tickwork.core.error.ValidationException;
import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.monitor.HealthStatus;
import net.tickwork.core.monitor.JobStats;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SchedulerServiceTest {

    SchedulerFixture f;
    SchedulerService scheduler;

    @BeforeEach
    void setUp() {
        f = new SchedulerFixture();
        scheduler = f.scheduler;
        f.handlers.registerFunction("noop", (payload, ctx) -> null);
    }

    @AfterEach
    void tearDown() {
        f.close();
    }

    private JobRequest.Builder cron(String name) {
        return JobRequest.builder(name, "noop").schedule("*/5 * * * *");
    }

    @Test
    void schedule_computesNextRunAfterNow_andAppliesDefaults() throws Exception {
        Job job = scheduler.schedule(cron("report").timezone("Asia/Seoul").tags(List.of("daily")).build());

        assertEquals(Job.Type.CRON, job.type());
        assertEquals(Job.Status.ACTIVE, job.status());
        assertEquals(Instant.parse("2026-01-05T10:05:00Z"), job.nextRun());
        assertTrue(job.nextRun().isAfter(f.clock.now()));
        assertEquals(3, job.maxRetries());
        assertEquals(60_000L, job.retryDelayMs());
        assertEquals(300_000L, job.timeoutMs());
        assertEquals(1, job.concurrency());
        assertEquals(Job.Priority.MEDIUM, job.priority());
        assertEquals("Asia/Seoul", job.timezone());
        assertEquals(List.of(SchedulerEvents.JOB_CREATED), f.eventTypes());
        assertEquals(job.id(), f.events.get(0).string("job_id"));
    }

    @Test
    void invalidInput_isRejectedWithTheOffendingField_andNothingIsStored() throws Exception {
        ValidationException badCron = assertThrows(ValidationException.class,
                () -> scheduler.schedule(JobRequest.builder("x", "noop").schedule("every tuesday").build()));
        assertEquals("schedule", badCron.field());
        assertEquals("VALIDATION_ERROR", badCron.code());

        ValidationException badZone = assertThrows(ValidationException.class,
                () -> scheduler.schedule(cron("x").timezone("Mars/Olympus").build()));
        assertEquals("timezone", badZone.field());

        ValidationException past = assertThrows(ValidationException.class,
                () -> scheduler.scheduleOnce(JobRequest.builder("x", "noop").executeAt(f.clock.now().minusSeconds(1)).build()));
        assertEquals("execute_at", past.field());

        ValidationException noName = assertThrows(ValidationException.class,
                () -> scheduler.schedule(JobRequest.builder(" ", "noop").schedule("*/5 * * * *").build()));
        assertEquals("name", noName.field());

        ValidationException badRetries = assertThrows(ValidationException.class,
                () -> scheduler.schedule(cron("x").maxRetries(-1).build()));
        assertEquals("max_retries", badRetries.field());

        assertTrue(scheduler.listJobs(JobFilter.all()).isEmpty());
    }

    @Test
    void recurring_startsAfterStartDate_andRejectsEmptyWindow() throws Exception {
        Instant start = Instant.parse("2026-01-06T00:00:00Z");
        Job job = scheduler.scheduleRecurring(cron("window").startDate(start).endDate(start.plus(Duration.ofDays(1)))
                .maxExecutions(3).build());
        assertEquals(Instant.parse("2026-01-06T00:05:00Z"), job.nextRun());
        assertEquals(3, job.maxExecutions());

        ValidationException reversed = assertThrows(ValidationException.class, () -> scheduler.scheduleRecurring(
                cron("reversed").startDate(start).endDate(start.minusSeconds(1)).build()));
        assertEquals("end_date", reversed.field());

        ValidationException tooShort = assertThrows(ValidationException.class, () -> scheduler.scheduleRecurring(
                cron("short").endDate(f.clock.now().plusSeconds(60)).build()));
        assertEquals("end_date", tooShort.field());
    }

    @Test
    void disabledRequest_startsPaused() throws Exception {
        Job job = scheduler.schedule(cron("off").disabled(true).build());
        assertEquals(Job.Status.PAUSED, job.status());
        assertNotNull(job.nextRun());
    }

    @Test
    void pause_keepsNextRun_andIllegalTransitionsConflict() throws Exception {
        Job job = scheduler.schedule(cron("p").build());

        Job paused = scheduler.pauseJob(job.id());
        assertEquals(Job.Status.PAUSED, paused.status());
        assertEquals(job.nextRun(), paused.nextRun());

        StateConflictException again = assertThrows(StateConflictException.class, () -> scheduler.pauseJob(job.id()));
        assertEquals("STATE_CONFLICT", again.code());
        assertEquals("paused", again.context().get("state"));

        scheduler.resumeJob(job.id());
        assertThrows(StateConflictException.class, () -> scheduler.resumeJob(job.id()));
    }

    @Test
    void resume_skipsMissedOccurrencesByDefault() throws Exception {
        Job job = scheduler.schedule(cron("skip").build());
        scheduler.pauseJob(job.id());
        f.clock.set(Instant.parse("2026-01-05T10:17:00Z"));

        Job resumed = scheduler.resumeJob(job.id());

        assertEquals(Job.Status.ACTIVE, resumed.status());
        assertEquals(Instant.parse("2026-01-05T10:20:00Z"), resumed.nextRun());
        assertEquals(0, f.tick.tickOnce().dispatched);
        assertTrue(f.executions(job.id()).isEmpty());
    }

    @Test
    void resume_withCatchUp_dispatchesOnlyTheMostRecentMissedOccurrence() throws Exception {
        Job job = scheduler.schedule(cron("catch-up").skipIfOverdue(false).build());
        scheduler.pauseJob(job.id());
        f.clock.set(Instant.parse("2026-01-05T10:17:00Z"));

        Job resumed = scheduler.resumeJob(job.id());
        assertEquals(Instant.parse("2026-01-05T10:15:00Z"), resumed.nextRun());

        assertEquals(1, f.tick.tickOnce().dispatched);
        assertEquals(1, f.executions(job.id()).size());
        assertEquals(Instant.parse("2026-01-05T10:20:00Z"), scheduler.getJob(job.id()).nextRun());
        assertEquals(0, f.tick.tickOnce().dispatched);
    }

    @Test
    void resumeOneTime_afterItsRunPassed_completesWithoutDispatch() throws Exception {
        Job job = scheduler.scheduleOnce(JobRequest.builder("once", "noop")
                .executeAt(f.clock.now().plusSeconds(60)).build());
        scheduler.pauseJob(job.id());
        f.clock.advance(Duration.ofHours(2));

        Job resumed = scheduler.resumeJob(job.id(), false);

        assertEquals(Job.Status.COMPLETED, resumed.status());
        assertNull(resumed.nextRun());
        assertEquals(0, f.tick.tickOnce().dispatched);
        f.drain();
        assertTrue(f.executions(job.id()).isEmpty());
        assertEquals(1, f.events(SchedulerEvents.JOB_COMPLETED).size());
    }

    @Test
    void resumeOneTime_withCatchUp_runsTheMissedRun() throws Exception {
        Job job = scheduler.scheduleOnce(JobRequest.builder("once-catch-up", "noop")
                .executeAt(f.clock.now().plusSeconds(60)).skipIfOverdue(false).build());
        scheduler.pauseJob(job.id());
        f.clock.advance(Duration.ofHours(2));

        Job resumed = scheduler.resumeJob(job.id());

        assertEquals(Job.Status.ACTIVE, resumed.status());
        assertEquals(job.nextRun(), resumed.nextRun());
        assertEquals(1, f.tick.tickOnce().dispatched);
        assertEquals(1, f.drain());
        assertEquals(Job.Status.COMPLETED, scheduler.getJob(job.id()).status());
    }

    @Test
    void resumeOneTime_beforeItsRun_keepsIt() throws Exception {
        Job job = scheduler.scheduleOnce(JobRequest.builder("once-early", "noop")
                .executeAt(f.clock.now().plusSeconds(600)).build());
        scheduler.pauseJob(job.id());
        f.clock.advance(Duration.ofSeconds(60));

        Job resumed = scheduler.resumeJob(job.id(), false);

        assertEquals(Job.Status.ACTIVE, resumed.status());
        assertEquals(job.nextRun(), resumed.nextRun());
    }

    @Test
    void explicitCatchUpFlag_overridesJobSetting() throws Exception {
        Job job = scheduler.schedule(cron("flag").build());
        scheduler.pauseJob(job.id());
        f.clock.set(Instant.parse("2026-01-05T10:17:00Z"));

        assertEquals(Instant.parse("2026-01-05T10:15:00Z"), scheduler.resumeJob(job.id(), true).nextRun());
    }

    @Test
    void cancel_clearsNextRun_andIsTerminal() throws Exception {
        Job job = scheduler.schedule(cron("c").build());

        Job cancelled = scheduler.cancelJob(job.id());

        assertEquals(Job.Status.CANCELLED, cancelled.status());
        assertNull(cancelled.nextRun());
        assertEquals(f.clock.now(), cancelled.cancelledAt());
        assertThrows(StateConflictException.class, () -> scheduler.cancelJob(job.id()));
        assertThrows(StateConflictException.class, () -> scheduler.resumeJob(job.id()));
        assertThrows(StateConflictException.class, () -> scheduler.reschedule(job.id(), "*/10 * * * *"));
    }

    @Test
    void reschedule_recomputesNextRun_butNotForOneTimeJobs() throws Exception {
        Job job = scheduler.schedule(cron("r").build());
        f.clock.set(Instant.parse("2026-01-05T10:07:00Z"));

        Job moved = scheduler.reschedule(job.id(), "*/30 * * * *");
        assertEquals("*/30 * * * *", moved.schedule());
        assertEquals(Instant.parse("2026-01-05T10:30:00Z"), moved.nextRun());
        assertTrue(f.eventTypes().contains(SchedulerEvents.JOB_UPDATED));

        Job once = scheduler.scheduleOnce(JobRequest.builder("o", "noop").executeAt(f.clock.now().plusSeconds(60)).build());
        StateConflictException e = assertThrows(StateConflictException.class, () -> scheduler.reschedule(once.id(), "*/5 * * * *"));
        assertEquals("one_time", e.context().get("state"));

        assertThrows(ValidationException.class, () -> scheduler.reschedule(job.id(), "nonsense"));
    }

    @Test
    void unschedule_removesJobAndExecutions() throws Exception {
        Job job = scheduler.schedule(cron("gone").build());
        f.clock.set(Instant.parse("2026-01-05T10:05:00Z"));
        f.tick.tickOnce();
        String executionId = f.executions(job.id()).get(0).id();

        scheduler.unschedule(job.id());

        assertThrows(NotFoundException.class, () -> scheduler.getJob(job.id()));
        assertThrows(NotFoundException.class, () -> scheduler.getExecution(executionId));
        assertThrows(NotFoundException.class, () -> scheduler.unschedule(job.id()));
        assertTrue(f.eventTypes().contains(SchedulerEvents.JOB_DELETED));
    }

    @Test
    void listJobs_filtersByTagsStatusAndName() throws Exception {
        Job a = scheduler.schedule(cron("alpha").tags(List.of("billing", "daily")).priority(Job.Priority.HIGH).build());
        scheduler.schedule(cron("beta").tags(List.of("daily")).build());
        Job c = scheduler.schedule(cron("gamma").build());
        scheduler.pauseJob(c.id());

        assertEquals(List.of(a.id()), ids(scheduler.listJobs(JobFilter.builder().allTags("billing", "daily").build())));
        assertEquals(2, scheduler.listJobs(JobFilter.builder().anyTags("daily").build()).size());
        assertEquals(List.of(c.id()), ids(scheduler.listJobs(JobFilter.builder().statuses(Job.Status.PAUSED).build())));
        assertEquals(1, scheduler.listJobs(JobFilter.builder().nameContains("ALP").build()).size());
        assertEquals(a.id(), scheduler.listJobs(JobFilter.builder().sortBy(JobFilter.SortBy.PRIORITY, true).build()).get(0).id());
        assertEquals(1, scheduler.listJobs(JobFilter.builder().limit(1).build()).size());
    }

    @Test
    void retryExecution_onlyForFailedOrTimedOut() throws Exception {
        f.handlers.registerFunction("flaky", (payload, ctx) -> { throw new IllegalStateException("down"); });
        Job job = scheduler.scheduleOnce(JobRequest.builder("once", "flaky").maxRetries(0)
                .executeAt(f.clock.now().plusSeconds(10)).build());
        f.clock.advance(Duration.ofSeconds(10));
        f.tick.tickOnce();
        f.drain();
        JobExecution failed = f.executions(job.id()).get(0);
        assertEquals(JobExecution.Status.FAILED, failed.status());

        f.handlers.registerFunction("flaky", (payload, ctx) -> "recovered");
        JobExecution retry = scheduler.retryExecution(failed.id());
        assertTrue(retry.manualRetry());
        assertEquals(failed.id(), retry.parentExecutionId());
        assertEquals(failed.correlationId(), retry.correlationId());
        assertEquals(0, retry.retryCount());

        f.drain();
        assertEquals(JobExecution.Status.SUCCESS, scheduler.getExecution(retry.id()).status());
        assertThrows(StateConflictException.class, () -> scheduler.retryExecution(retry.id()));
        assertThrows(NotFoundException.class, () -> scheduler.retryExecution("missing"));
    }

    @Test
    void history_statsMetricsAndHealth() throws Exception {
        f.handlers.registerFunction("count", (payload, ctx) -> Map.of("ok", true));
        Job job = scheduler.schedule(JobRequest.builder("stats", "count").schedule("*/5 * * * *").build());
        for (int i = 1; i <= 3; i++) {
            f.clock.set(Instant.parse("2026-01-05T10:00:00Z").plus(Duration.ofMinutes(5L * i)));
            f.tick.tickOnce();
            f.drain();
        }

        List<JobExecution> latest = scheduler.getJobHistory(job.id(), ExecutionQuery.latest());
        assertEquals(3, latest.size());
        assertTrue(latest.get(0).scheduledAt().isAfter(latest.get(2).scheduledAt()));
        assertThrows(NotFoundException.class, () -> scheduler.getJobHistory("nope", null));

        JobStats stats = scheduler.getJobStats(job.id());
        assertEquals(3, stats.total());
        assertEquals(3, stats.succeeded());
        assertEquals(1.0, stats.successRate());

        var metrics = scheduler.getMetrics();
        assertEquals(1, metrics.jobs(Job.Status.ACTIVE));
        assertEquals(3, metrics.executions(JobExecution.Status.SUCCESS));
        assertEquals(3, metrics.dispatch().dispatched());

        HealthStatus health = scheduler.healthCheck();
        assertEquals(HealthStatus.State.HEALTHY, health.state());
        assertThat(health.components()).containsKeys("store", "bus");
    }
}
