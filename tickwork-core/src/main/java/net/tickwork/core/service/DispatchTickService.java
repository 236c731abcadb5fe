package net.tickwork.core.service;

import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.DispatchEnvelope;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.CronCalculator;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.PublishOptions;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic scan for due jobs. Each due occurrence is claimed with a conditional update on
 * {@code next_run}, so concurrent tick runners dispatch it at most once.
 */
public final class DispatchTickService {
    private static final Logger log = LoggerFactory.getLogger(DispatchTickService.class);

    private final JobStore jobs;
    private final MessageBus bus;
    private final TxRunner tx;
    private final Clock clock;
    private final CronCalculator cron;
    private final SchedulerEventPublisher events;
    private final int batchSize;
    private final Duration redispatchGrace;

    private final AtomicBoolean ticking = new AtomicBoolean();
    private final DispatchStats stats = new DispatchStats();

    public DispatchTickService(JobStore jobs, MessageBus bus, TxRunner tx, Clock clock, CronCalculator cron,
                               int batchSize, Duration redispatchGrace) {
        this.jobs = jobs;
        this.bus = bus;
        this.tx = tx;
        this.clock = clock;
        this.cron = cron;
        this.events = new SchedulerEventPublisher(bus, clock);
        this.batchSize = batchSize;
        this.redispatchGrace = redispatchGrace;
    }

    public DispatchStats stats() { return stats; }

    /** One scan. Returns {@link TickReport#overlapped} when the previous scan is still running. */
    public TickReport tickOnce() throws Exception {
        if (!ticking.compareAndSet(false, true)) {
            log.debug("Previous dispatch tick still running; skipping this one");
            return TickReport.overlapped(clock.now());
        }
        try {
            return scan();
        } finally {
            ticking.set(false);
        }
    }

    private TickReport scan() throws Exception {
        Instant now = clock.now();
        TickReport r = new TickReport(now);

        List<Job> due = tx.required(() -> jobs.findDueJobs(now, batchSize));
        r.due = due.size();
        for (Job job : due) {
            try {
                dispatchOccurrence(job, now, r);
            } catch (TransportException e) {
                r.transportFailure = true;
                r.errors++;
                stats.error();
                log.warn("Dispatch of job {} ({}) not published: {}", job.id(), job.name(), e.getMessage());
            } catch (Exception e) {
                r.errors++;
                stats.error();
                log.error("Dispatch of job {} ({}) failed", job.id(), job.name(), e);
            }
        }

        redispatchStranded(now, r);

        stats.tick(now, r.transportFailure);
        if (r.dispatched + r.skipped + r.redispatched + r.errors > 0) {
            log.info("Dispatch tick: due={} dispatched={} skipped={} completed={} redispatched={} errors={}",
                    r.due, r.dispatched, r.skipped, r.completed, r.redispatched, r.errors);
        }
        return r;
    }

    private void dispatchOccurrence(Job job, Instant now, TickReport r) throws Exception {
        Instant expected = job.nextRun();
        Instant following = followingRun(job, now);
        boolean blocked = job.type().isCronDriven() && !job.allowOverlap()
                && tx.required(() -> jobs.countActiveExecutions(job.id())) >= job.concurrency();

        Claim claim = tx.requiresNew(() -> {
            if (!jobs.claimDueJob(job.id(), expected, following)) return null;

            JobExecution execution = jobs.createExecution(newExecution(job, now, blocked));
            boolean complete = false;
            if (job.type() == Job.Type.RECURRING) {
                complete = following == null
                        || (job.maxExecutions() != null && jobs.countOccurrences(job.id()) >= job.maxExecutions());
            }
            if (complete) {
                complete = jobs.updateJobStatus(job.id(), Set.of(Job.Status.ACTIVE), Job.Status.COMPLETED, null, now);
            }
            return new Claim(execution, complete);
        });

        if (claim == null) {
            log.debug("Job {} occurrence {} already claimed elsewhere", job.id(), expected);
            return;
        }
        if (claim.complete) {
            r.completed++;
            stats.completed();
            events.jobEvent(SchedulerEvents.JOB_COMPLETED, job.id(), job.name());
        }
        if (blocked) {
            r.skipped++;
            stats.skipped();
            log.info("Job {} ({}) still has {} active execution(s); occurrence {} skipped",
                    job.id(), job.name(), job.concurrency(), expected);
            events.executionEvent(SchedulerEvents.EXECUTION_SKIPPED, job.id(), claim.execution.id(), null);
            return;
        }

        publish(job, claim.execution, now);
        r.dispatched++;
        stats.dispatched();
    }

    // pending executions whose envelope never reached the bus
    private void redispatchStranded(Instant now, TickReport r) throws Exception {
        List<JobExecution> stranded = tx.required(() -> jobs.findUndispatched(now.minus(redispatchGrace), batchSize));
        for (JobExecution e : stranded) {
            try {
                Job job = tx.required(() -> jobs.getJob(e.jobId())).orElse(null);
                if (job == null) continue;
                publish(job, e, now);
                r.redispatched++;
                stats.redispatched();
                log.info("Re-published stranded execution {} of job {}", e.id(), job.id());
            } catch (TransportException ex) {
                r.transportFailure = true;
                r.errors++;
                stats.error();
                log.warn("Stranded execution {} still not published: {}", e.id(), ex.getMessage());
                return;
            }
        }
    }

    private void publish(Job job, JobExecution execution, Instant now) throws Exception {
        var envelope = DispatchEnvelope.forExecution(job, execution, now).toEnvelope();
        var options = PublishOptions.mirrorTo(SchedulerEvents.DISPATCH_STREAM);
        if (execution.scheduledAt().isAfter(now)) options = options.deliverAt(execution.scheduledAt());
        bus.publish(SchedulerEvents.DISPATCH_TOPIC, envelope, options);
        tx.required(() -> jobs.markDispatched(execution.id(), now));
    }

    private Instant followingRun(Job job, Instant now) {
        if (!job.type().isCronDriven()) return null;
        Instant next = cron.next(now, job.schedule(), job.zone());
        if (job.endDate() != null && next.isAfter(job.endDate())) return null;
        return next;
    }

    private static JobExecution newExecution(Job job, Instant now, boolean skipped) {
        String id = UUID.randomUUID().toString();
        var b = JobExecution.builder()
                .id(id)
                .jobId(job.id())
                .scheduledAt(now)
                .retryCount(0)
                .maxRetries(job.maxRetries())
                .correlationId(id)
                .traceId(UUID.randomUUID().toString())
                .spanId(UUID.randomUUID().toString())
                .createdAt(now)
                .updatedAt(now);
        if (skipped) {
            b.status(JobExecution.Status.SKIPPED)
                    .completedAt(now)
                    .errorMessage("skipped: previous execution still pending or running");
        } else {
            b.status(JobExecution.Status.PENDING);
        }
        return b.build();
    }

    private record Claim(JobExecution execution, boolean complete) {}

    public static final class TickReport {
        public final Instant at;
        public boolean overlapped;
        public int due;
        public int dispatched;
        public int skipped;
        public int completed;
        public int redispatched;
        public int errors;
        public boolean transportFailure;

        TickReport(Instant at) { this.at = at; }

        static TickReport overlapped(Instant at) {
            TickReport r = new TickReport(at);
            r.overlapped = true;
            return r;
        }

        @Override public String toString() {
            return "TickReport{" +
                    "at=" + at +
                    ", overlapped=" + overlapped +
                    ", due=" + due +
                    ", dispatched=" + dispatched +
                    ", skipped=" + skipped +
                    ", completed=" + completed +
                    ", redispatched=" + redispatched +
                    ", errors=" + errors +
                    '}';
        }
    }
}
