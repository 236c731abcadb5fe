package net.tickwork.core.service;

import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.DispatchEnvelope;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.PublishOptions;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * Successor executions for failed or timed-out attempts: backoff from the job's retry delay,
 * {@code retry_count + 1}, and an envelope held back until the retry is due.
 */
public final class RetryScheduler {
    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final JobStore jobs;
    private final MessageBus bus;
    private final TxRunner tx;
    private final Duration maxRetryDelay;
    private final double jitterFactor;

    public RetryScheduler(JobStore jobs, MessageBus bus, TxRunner tx, Duration maxRetryDelay, double jitterFactor) {
        this.jobs = jobs;
        this.bus = bus;
        this.tx = tx;
        this.maxRetryDelay = maxRetryDelay;
        this.jitterFactor = jitterFactor;
    }

    public boolean attemptsLeft(JobExecution attempt) {
        return attempt.retryCount() < attempt.maxRetries();
    }

    public Instant retryAt(Job job, JobExecution attempt, Instant now) {
        return now.plus(policyFor(job).nextBackoff(attempt.retryCount()));
    }

    public JobExecution successorOf(JobExecution failed, Instant retryAt, Instant now) {
        return JobExecution.builder()
                .id(UUID.randomUUID().toString())
                .jobId(failed.jobId())
                .status(JobExecution.Status.PENDING)
                .scheduledAt(retryAt)
                .retryCount(failed.retryCount() + 1)
                .maxRetries(failed.maxRetries())
                .correlationId(failed.correlationId())
                .parentExecutionId(failed.id())
                .traceId(failed.traceId())
                .spanId(UUID.randomUUID().toString())
                .parentSpanId(failed.spanId())
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /** Publishes the successor's envelope. On transport failure it stays undispatched for the tick to pick up. */
    public void publish(Job job, JobExecution successor, Instant now) throws Exception {
        var envelope = DispatchEnvelope.forExecution(job, successor, now).toEnvelope();
        try {
            bus.publish(SchedulerEvents.DISPATCH_TOPIC, envelope,
                    PublishOptions.mirrorTo(SchedulerEvents.DISPATCH_STREAM).deliverAt(successor.scheduledAt()));
            tx.required(() -> jobs.markDispatched(successor.id(), now));
        } catch (TransportException e) {
            log.warn("Retry {} of job {} not published: {}", successor.id(), job.id(), e.getMessage());
        }
    }

    private RetryPolicy policyFor(Job job) {
        Duration base = Duration.ofMillis(job.retryDelayMs());
        Duration max = maxRetryDelay.compareTo(base) < 0 ? base : maxRetryDelay;
        return RetryPolicy.exponential(base, max, jitterFactor);
    }
}
