package net.tickwork.core.maintenance;

import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.IdempotencyRecord;
import net.tickwork.core.service.RetryScheduler;
import net.tickwork.core.service.SchedulerEventPublisher;
import net.tickwork.core.service.SchedulerEvents;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.IdempotencyStore;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MaintenanceService {
    private static final Logger log = LoggerFactory.getLogger(MaintenanceService.class);

    public static final String ABANDONED_REASON = "abandoned: no result reported within timeout";

    private final JobStore jobs;
    private final IdempotencyStore idempotency;
    private final TxRunner tx;
    private final Clock clock;
    private final SchedulerEventPublisher events;
    private final RetryScheduler retries;

    public MaintenanceService(JobStore jobs,
                              IdempotencyStore idempotency,
                              MessageBus bus,
                              TxRunner tx,
                              Clock clock) {
        this(jobs, idempotency, bus, tx, clock, new RetryScheduler(jobs, bus, tx, Duration.ofHours(1), 0.1));
    }

    public MaintenanceService(JobStore jobs,
                              IdempotencyStore idempotency,
                              MessageBus bus,
                              TxRunner tx,
                              Clock clock,
                              RetryScheduler retries) {
        this.jobs = jobs;
        this.idempotency = idempotency;
        this.tx = tx;
        this.clock = clock;
        this.events = new SchedulerEventPublisher(bus, clock);
        this.retries = retries;
    }

    /**
     * Periodic housekeeping.
     * - drop expired idempotency markers
     * - time out executions stuck in running past {@code timeout + abandonGrace} (their worker died);
     *   attempts left on the execution are used by a retry
     * - release dispatched executions whose worker claimed the marker but never started them, so
     *   the dispatch tick publishes them again
     */
    public MaintenanceReport runOnce(Duration abandonGrace, int batchSize) throws Exception {
        Instant now = clock.now();
        MaintenanceReport r = new MaintenanceReport();

        r.purgedIdempotencyKeys = tx.requiresNew(idempotency::purgeExpired);

        List<JobExecution> suspects = tx.required(() -> jobs.findRunningStartedBefore(now.minus(abandonGrace), batchSize));
        for (JobExecution e : suspects) {
            try {
                if (abandon(e, abandonGrace, now)) r.abandonedExecutions++;
            } catch (Exception ex) {
                log.error("Could not time out abandoned execution {}", e.id(), ex);
            }
        }

        List<JobExecution> unstarted = tx.required(() -> jobs.findPendingDispatchedBefore(now.minus(abandonGrace), batchSize));
        for (JobExecution e : unstarted) {
            try {
                if (release(e, abandonGrace, now)) r.releasedExecutions++;
            } catch (Exception ex) {
                log.error("Could not release stalled execution {}", e.id(), ex);
            }
        }

        r.timestamp = now;
        if (r.purgedIdempotencyKeys > 0 || r.abandonedExecutions > 0 || r.releasedExecutions > 0) log.info("{}", r);
        return r;
    }

    private boolean abandon(JobExecution e, Duration grace, Instant now) throws Exception {
        Optional<Job> job = tx.required(() -> jobs.getJob(e.jobId()));
        long timeoutMs = job.map(Job::timeoutMs).orElse(0L);
        if (e.startedAt().plusMillis(timeoutMs).plus(grace).isAfter(now)) return false;

        long duration = Duration.between(e.startedAt(), now).toMillis();
        boolean retry = job.isPresent() && retries.attemptsLeft(e);
        Instant retryAt = retry ? retries.retryAt(job.get(), e, now) : null;
        JobExecution timedOut = e.toBuilder()
                .status(JobExecution.Status.TIMEOUT)
                .completedAt(now)
                .durationMs(duration)
                .errorMessage(ABANDONED_REASON)
                .nextRetryAt(retryAt)
                .updatedAt(now)
                .build();
        JobExecution successor = retry ? retries.successorOf(e, retryAt, now) : null;
        boolean applied = tx.required(() -> {
            if (!jobs.updateExecution(timedOut, JobExecution.Status.RUNNING)) return false;
            jobs.recordOutcome(e.jobId(), false, duration, now);
            if (successor != null) jobs.createExecution(successor);
            return true;
        });
        if (!applied) return false;

        // a late redelivery must not run the handler again
        tx.requiresNew(() -> {
            idempotency.complete(e.id(), Map.of("execution_id", e.id(), "status", "timeout"), grace.plusHours(1));
            return null;
        });
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", "timeout");
        detail.put("error", ABANDONED_REASON);
        detail.put("error_code", "EXECUTION_TIMEOUT");
        detail.put("will_retry", retry);
        events.executionEvent(SchedulerEvents.EXECUTION_FAILED, e.jobId(), e.id(), detail);

        if (successor != null) {
            log.warn("Execution {} of job {} abandoned by worker {}; marked timeout, retry {} at {}",
                    e.id(), e.jobId(), e.workerId(), successor.id(), retryAt);
            events.executionEvent(SchedulerEvents.EXECUTION_RETRY_SCHEDULED, e.jobId(), successor.id(),
                    Map.of("parent_execution_id", e.id(), "retry_count", successor.retryCount()));
            retries.publish(job.get(), successor, now);
            return true;
        }

        log.warn("Execution {} of job {} abandoned by worker {}; marked timeout", e.id(), e.jobId(), e.workerId());
        if (job.isPresent() && job.get().type() == Job.Type.ONE_TIME) {
            boolean completed = tx.required(() -> jobs.updateJobStatus(e.jobId(),
                    EnumSet.of(Job.Status.PENDING, Job.Status.ACTIVE, Job.Status.PAUSED), Job.Status.COMPLETED, null, now));
            if (completed) events.jobEvent(SchedulerEvents.JOB_COMPLETED, e.jobId(), job.get().name());
        }
        return true;
    }

    // pending with an in_progress marker: the worker died between taking the marker and starting the run
    private boolean release(JobExecution e, Duration grace, Instant now) throws Exception {
        Optional<Job> job = tx.required(() -> jobs.getJob(e.jobId()));
        long timeoutMs = job.map(Job::timeoutMs).orElse(0L);
        Instant handedOut = e.scheduledAt().isAfter(e.dispatchedAt()) ? e.scheduledAt() : e.dispatchedAt();
        if (handedOut.plusMillis(timeoutMs).plus(grace).isAfter(now)) return false;

        Optional<IdempotencyRecord> marker = tx.required(() -> idempotency.find(e.id()));
        if (marker.isEmpty() || marker.get().status() != IdempotencyRecord.Status.IN_PROGRESS) return false;

        JobExecution undispatched = e.toBuilder().dispatchedAt(null).updatedAt(now).build();
        if (!tx.required(() -> jobs.updateExecution(undispatched, JobExecution.Status.PENDING))) return false;
        tx.requiresNew(() -> { idempotency.release(e.id()); return null; });
        log.warn("Execution {} of job {} was claimed but never started; released for re-dispatch", e.id(), e.jobId());
        return true;
    }

    public static final class MaintenanceReport {
        public Instant timestamp;
        public int purgedIdempotencyKeys;
        public int abandonedExecutions;
        public int releasedExecutions;

        @Override public String toString() {
            return "MaintenanceReport{" +
                    "timestamp=" + timestamp +
                    ", purgedIdempotencyKeys=" + purgedIdempotencyKeys +
                    ", abandonedExecutions=" + abandonedExecutions +
                    ", releasedExecutions=" + releasedExecutions +
                    '}';
        }
    }
}
