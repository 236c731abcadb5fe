package net.tickwork.core.service;

import net.tickwork.core.error.ExecutionFailureException;
import net.tickwork.core.error.ExecutionTimeoutException;
import net.tickwork.core.error.HandlerResolutionException;
import net.tickwork.core.error.SchedulerException;
import net.tickwork.core.handler.HandlerRegistry;
import net.tickwork.core.handler.JobContext;
import net.tickwork.core.handler.JobHandler;
import net.tickwork.core.model.DispatchEnvelope;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.Delivery;
import net.tickwork.core.spi.IdempotencyStore;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs dispatched executions. The execution id is the idempotency key, so a redelivered envelope
 * never invokes the handler twice; failed attempts are retried as new executions with their own
 * envelopes.
 */
public final class JobExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);
    private static final int MAX_STACK_CHARS = 4000;

    private final JobStore jobs;
    private final IdempotencyStore idempotency;
    private final HandlerRegistry handlers;
    private final MessageBus bus;
    private final TxRunner tx;
    private final Clock clock;
    private final Settings settings;
    private final SchedulerEventPublisher events;
    private final ConsumerStats stats = new ConsumerStats();
    private final ExecutorService handlerPool;
    private final RetryScheduler retries;

    public JobExecutor(JobStore jobs, IdempotencyStore idempotency, HandlerRegistry handlers, MessageBus bus,
                       TxRunner tx, Clock clock, Settings settings) {
        this.jobs = jobs;
        this.idempotency = idempotency;
        this.handlers = handlers;
        this.bus = bus;
        this.tx = tx;
        this.clock = clock;
        this.settings = settings;
        this.events = new SchedulerEventPublisher(bus, clock);
        this.handlerPool = Executors.newCachedThreadPool(daemonThreads("tickwork-handler-"));
        this.retries = new RetryScheduler(jobs, bus, tx, settings.maxRetryDelay(), settings.jitterFactor());
    }

    /**
     * @param workerId            recorded on executions this executor runs
     * @param maxRetryDelay       cap of the exponential retry delay
     * @param jitterFactor        relative random perturbation of retry delays
     * @param idempotencyTtlFloor minimum lifetime of an execution's idempotency marker
     */
    public record Settings(String workerId, Duration maxRetryDelay, double jitterFactor, Duration idempotencyTtlFloor) {
        public static Settings defaults(String workerId) {
            return new Settings(workerId, Duration.ofHours(1), 0.1, Duration.ofHours(1));
        }
    }

    public enum Outcome { SUCCEEDED, RETRY_SCHEDULED, FAILED, TIMED_OUT, DUPLICATE, STALE, REJECTED, ERROR }

    public ConsumerStats stats() { return stats; }

    public String workerId() { return settings.workerId(); }

    /** Processes one delivery and acknowledges it, or returns it to the group when processing broke. */
    public Outcome handle(Delivery delivery) {
        DispatchEnvelope envelope;
        try {
            envelope = DispatchEnvelope.from(delivery.envelope());
        } catch (RuntimeException e) {
            log.warn("Dropping malformed dispatch envelope {}: {}", delivery.envelope().id(), e.getMessage());
            delivery.ack();
            return Outcome.REJECTED;
        }
        try {
            Outcome outcome = process(envelope);
            delivery.ack();
            return outcome;
        } catch (Exception e) {
            stats.error();
            log.error("Execution {} could not be processed (delivery {}); returning it to the group",
                    envelope.executionId(), delivery.deliveryCount(), e);
            delivery.nack(JobConsumerWorker.TRANSPORT_BACKOFF);
            return Outcome.ERROR;
        }
    }

    Outcome process(DispatchEnvelope envelope) throws Exception {
        Job job = tx.required(() -> jobs.getJob(envelope.jobId())).orElse(null);
        JobExecution execution = tx.required(() -> jobs.getExecution(envelope.executionId())).orElse(null);
        if (job == null || execution == null) {
            log.warn("Execution {} of job {} no longer exists; acknowledging", envelope.executionId(), envelope.jobId());
            return Outcome.STALE;
        }

        String key = envelope.id();
        Duration ttl = idempotencyTtl(job);
        if (!tx.requiresNew(() -> idempotency.tryBegin(key, ttl))) {
            stats.duplicate();
            log.warn("Duplicate delivery of execution {} ignored", key);
            return Outcome.DUPLICATE;
        }

        Instant startedAt = clock.now();
        JobExecution running = execution.toBuilder()
                .status(JobExecution.Status.RUNNING)
                .startedAt(startedAt)
                .workerId(settings.workerId())
                .updatedAt(startedAt)
                .build();
        try {
            if (execution.status() != JobExecution.Status.PENDING) {
                tx.requiresNew(() -> { idempotency.complete(key, snapshot(execution), ttl); return null; });
                log.warn("Execution {} is already {}; not running it again", execution.id(), execution.status().code());
                return Outcome.STALE;
            }
            if (!tx.required(() -> jobs.updateExecution(running, JobExecution.Status.PENDING))) {
                tx.requiresNew(() -> { idempotency.complete(key, Map.of("status", "stale"), ttl); return null; });
                return Outcome.STALE;
            }
        } catch (Exception e) {
            tx.requiresNew(() -> { idempotency.release(key); return null; });
            throw e;
        }

        stats.processed();
        log.debug("Execution {} of job {} started on {}", running.id(), job.id(), settings.workerId());
        events.executionEvent(SchedulerEvents.EXECUTION_STARTED, job.id(), running.id(),
                Map.of("worker_id", settings.workerId(), "retry_count", running.retryCount()));

        Attempt attempt = invoke(job, running);
        return attempt.error == null ? recordSuccess(job, running, attempt, key, ttl) : recordFailure(job, running, attempt, key, ttl);
    }

    private Attempt invoke(Job job, JobExecution running) {
        JobHandler handler;
        try {
            handler = handlers.resolve(job.handlerName(), job.handlerType());
        } catch (HandlerResolutionException e) {
            return Attempt.failed(JobExecution.Status.FAILED, e, false);
        }

        Instant deadline = running.startedAt().plusMillis(job.timeoutMs());
        JobContext ctx = new JobContext(job.id(), job.name(), running.id(), running.retryCount(), running.traceId(),
                running.spanId(), job.platformId(), deadline);
        Future<Object> future = handlerPool.submit(() -> handler.handle(job.payload(), ctx));
        try {
            return Attempt.succeeded(future.get(job.timeoutMs(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            // the handler thread is interrupted; if it ignores that, its late result is simply dropped
            future.cancel(true);
            return Attempt.failed(JobExecution.Status.TIMEOUT, new ExecutionTimeoutException(running.id(), job.timeoutMs()), true);
        } catch (ExecutionException e) {
            return Attempt.failed(JobExecution.Status.FAILED, new ExecutionFailureException(running.id(), e.getCause()), true);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return Attempt.failed(JobExecution.Status.FAILED, new ExecutionFailureException(running.id(), e), true);
        }
    }

    private Outcome recordSuccess(Job job, JobExecution running, Attempt attempt, String key, Duration ttl) throws Exception {
        Instant done = clock.now();
        long duration = Duration.between(running.startedAt(), done).toMillis();
        JobExecution finished = running.toBuilder()
                .status(JobExecution.Status.SUCCESS)
                .completedAt(done)
                .durationMs(duration)
                .result(attempt.result)
                .updatedAt(done)
                .build();

        Boolean applied = tx.required(() -> {
            if (!jobs.updateExecution(finished, JobExecution.Status.RUNNING)) return false;
            jobs.recordOutcome(job.id(), true, duration, done);
            return true;
        });
        tx.requiresNew(() -> { idempotency.complete(key, snapshot(finished), ttl); return null; });
        if (!applied) {
            log.warn("Execution {} was resolved elsewhere while running; result dropped", running.id());
            return Outcome.STALE;
        }

        stats.succeeded();
        log.debug("Execution {} of job {} succeeded in {}ms", running.id(), job.id(), duration);
        events.executionEvent(SchedulerEvents.EXECUTION_COMPLETED, job.id(), running.id(), Map.of("duration_ms", duration));
        if (job.type() == Job.Type.ONE_TIME) completeOneTime(job, done);
        return Outcome.SUCCEEDED;
    }

    private Outcome recordFailure(Job job, JobExecution running, Attempt attempt, String key, Duration ttl) throws Exception {
        Instant done = clock.now();
        long duration = Duration.between(running.startedAt(), done).toMillis();
        boolean retry = attempt.retryable && retries.attemptsLeft(running);
        Instant retryAt = retry ? retries.retryAt(job, running, done) : null;

        JobExecution finished = running.toBuilder()
                .status(attempt.status)
                .completedAt(done)
                .durationMs(duration)
                .errorMessage(attempt.error.getMessage())
                .errorStack(stackOf(attempt.error))
                .nextRetryAt(retryAt)
                .updatedAt(done)
                .build();
        JobExecution successor = retry ? retries.successorOf(running, retryAt, done) : null;

        Boolean applied = tx.required(() -> {
            if (!jobs.updateExecution(finished, JobExecution.Status.RUNNING)) return false;
            jobs.recordOutcome(job.id(), false, duration, done);
            if (successor != null) jobs.createExecution(successor);
            return true;
        });
        tx.requiresNew(() -> { idempotency.complete(key, snapshot(finished), ttl); return null; });
        if (!applied) {
            log.warn("Execution {} was resolved elsewhere while running; failure dropped", running.id());
            return Outcome.STALE;
        }

        if (attempt.status == JobExecution.Status.TIMEOUT) stats.timedOut(); else stats.failed();
        Map<String, Object> detail = new LinkedHashMap<>();
        detail.put("status", attempt.status.code());
        detail.put("error", String.valueOf(attempt.error.getMessage()));
        detail.put("error_code", attempt.error instanceof SchedulerException se ? se.code() : "EXECUTION_FAILED");
        detail.put("will_retry", retry);
        events.executionEvent(SchedulerEvents.EXECUTION_FAILED, job.id(), running.id(), detail);

        if (successor != null) {
            stats.retried();
            log.info("Execution {} of job {} {} (attempt {}/{}); retry {} at {}", running.id(), job.id(),
                    attempt.status.code(), running.retryCount() + 1, running.maxRetries() + 1, successor.id(), retryAt);
            events.executionEvent(SchedulerEvents.EXECUTION_RETRY_SCHEDULED, job.id(), successor.id(),
                    Map.of("parent_execution_id", running.id(), "retry_count", successor.retryCount()));
            retries.publish(job, successor, done);
            return Outcome.RETRY_SCHEDULED;
        }

        log.warn("Execution {} of job {} {} terminally: {}", running.id(), job.id(), attempt.status.code(),
                attempt.error.getMessage());
        if (job.type() == Job.Type.ONE_TIME) completeOneTime(job, done);
        return attempt.status == JobExecution.Status.TIMEOUT ? Outcome.TIMED_OUT : Outcome.FAILED;
    }

    private void completeOneTime(Job job, Instant at) throws Exception {
        boolean completed = tx.required(() -> jobs.updateJobStatus(job.id(),
                EnumSet.of(Job.Status.PENDING, Job.Status.ACTIVE, Job.Status.PAUSED), Job.Status.COMPLETED, null, at));
        if (completed) {
            log.info("One-time job {} ({}) completed", job.id(), job.name());
            events.jobEvent(SchedulerEvents.JOB_COMPLETED, job.id(), job.name());
        }
    }

    // outlives the whole retry chain of the execution
    private Duration idempotencyTtl(Job job) {
        long chainMs = job.timeoutMs() + (long) job.maxRetries() * Math.max(job.retryDelayMs(), settings.maxRetryDelay().toMillis());
        return settings.idempotencyTtlFloor().plusMillis(2 * chainMs);
    }

    private static Map<String, Object> snapshot(JobExecution e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("execution_id", e.id());
        m.put("status", e.status().code());
        if (e.result() != null) m.put("result", e.result());
        if (e.errorMessage() != null) m.put("error", e.errorMessage());
        return m;
    }

    static String stackOf(Throwable t) {
        Throwable root = t.getCause() != null ? t.getCause() : t;
        StringWriter sw = new StringWriter();
        root.printStackTrace(new PrintWriter(sw));
        String s = sw.toString();
        return s.length() > MAX_STACK_CHARS ? s.substring(0, MAX_STACK_CHARS) : s;
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        handlerPool.shutdownNow();
    }

    private static final class Attempt {
        final JobExecution.Status status;
        final Object result;
        final Exception error;
        final boolean retryable;

        private Attempt(JobExecution.Status status, Object result, Exception error, boolean retryable) {
            this.status = status;
            this.result = result;
            this.error = error;
            this.retryable = retryable;
        }

        static Attempt succeeded(Object result) {
            return new Attempt(JobExecution.Status.SUCCESS, result, null, false);
        }

        static Attempt failed(JobExecution.Status status, Exception error, boolean retryable) {
            return new Attempt(status, null, error, retryable);
        }
    }
}
