package net.tickwork.core.service;

import net.tickwork.core.error.NotFoundException;
import net.tickwork.core.error.StateConflictException;
import net.tickwork.core.error.TransportException;
import net.tickwork.core.error.ValidationException;
import net.tickwork.core.handler.EventCallback;
import net.tickwork.core.handler.HandlerRegistry;
import net.tickwork.core.model.DispatchEnvelope;
import net.tickwork.core.model.EventHandler;
import net.tickwork.core.model.EventHandlerOptions;
import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.HandlerType;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.model.JobRequest;
import net.tickwork.core.monitor.HealthStatus;
import net.tickwork.core.monitor.JobStats;
import net.tickwork.core.monitor.SchedulerMetrics;
import net.tickwork.core.monitor.SchedulerMonitor;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.CronCalculator;
import net.tickwork.core.spi.EventHandlerStore;
import net.tickwork.core.spi.JobStore;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.PublishOptions;
import net.tickwork.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Job lifecycle and the management surface over it.
 * <pre>
 *   pending -> active <-> paused
 *   active | paused -> completed | cancelled | failed   (terminal, next_run = null)
 * </pre>
 */
public final class SchedulerService {
    private static final Logger log = LoggerFactory.getLogger(SchedulerService.class);

    private static final Set<Job.Status> NON_TERMINAL = EnumSet.of(Job.Status.PENDING, Job.Status.ACTIVE, Job.Status.PAUSED);

    private final JobStore jobs;
    private final MessageBus bus;
    private final CronCalculator cron;
    private final TxRunner tx;
    private final Clock clock;
    private final JobDefaults defaults;
    private final SchedulerMonitor monitor;
    private final SchedulerEventPublisher events;
    private final EventTriggerService triggers;

    public SchedulerService(JobStore jobs,
                            EventHandlerStore eventHandlers,
                            MessageBus bus,
                            HandlerRegistry handlers,
                            CronCalculator cron,
                            TxRunner tx,
                            Clock clock,
                            JobDefaults defaults,
                            SchedulerMonitor monitor) {
        this.jobs = jobs;
        this.bus = bus;
        this.cron = cron;
        this.tx = tx;
        this.clock = clock;
        this.defaults = defaults;
        this.monitor = monitor;
        this.events = new SchedulerEventPublisher(bus, clock);
        this.triggers = new EventTriggerService(eventHandlers, bus, handlers, tx, clock, this::scheduleOnce);
    }

    // --- creation ---

    /** Cron job running indefinitely. */
    public Job schedule(JobRequest req) throws Exception {
        return createCronDriven(req, Job.Type.CRON);
    }

    /** Cron job bounded by start/end dates and an optional execution cap. */
    public Job scheduleRecurring(JobRequest req) throws Exception {
        return createCronDriven(req, Job.Type.RECURRING);
    }

    /** Runs once at {@code execute_at}, which must lie in the future. */
    public Job scheduleOnce(JobRequest req) throws Exception {
        Instant now = clock.now();
        validateCommon(req);
        if (req.executeAt() == null) throw new ValidationException("execute_at", "execute_at is required");
        if (!req.executeAt().isAfter(now)) {
            throw new ValidationException("execute_at", "execute_at must be in the future: " + req.executeAt());
        }
        Job job = baseJob(req, Job.Type.ONE_TIME, now)
                .concurrency(1)
                .allowOverlap(false)
                .nextRun(req.executeAt())
                .build();
        return persistNew(job);
    }

    private Job createCronDriven(JobRequest req, Job.Type type) throws Exception {
        Instant now = clock.now();
        validateCommon(req);
        validateCron(req.schedule());
        ZoneId zone = zoneOf(req.timezone());
        if (type == Job.Type.RECURRING && req.startDate() != null && req.endDate() != null
                && !req.endDate().isAfter(req.startDate())) {
            throw new ValidationException("end_date", "end_date must be after start_date");
        }

        Instant from = type == Job.Type.RECURRING && req.startDate() != null && req.startDate().isAfter(now)
                ? req.startDate() : now;
        Instant next = cron.next(from, req.schedule(), zone);
        if (type == Job.Type.RECURRING && req.endDate() != null && next.isAfter(req.endDate())) {
            throw new ValidationException("end_date", "no occurrence of '" + req.schedule() + "' before " + req.endDate());
        }

        Job job = baseJob(req, type, now)
                .schedule(req.schedule())
                .startDate(type == Job.Type.RECURRING ? req.startDate() : null)
                .endDate(type == Job.Type.RECURRING ? req.endDate() : null)
                .maxExecutions(type == Job.Type.RECURRING ? req.maxExecutions() : null)
                .nextRun(next)
                .build();
        return persistNew(job);
    }

    private Job.Builder baseJob(JobRequest req, Job.Type type, Instant now) {
        return Job.builder()
                .id(req.id() == null ? UUID.randomUUID().toString() : req.id())
                .name(req.name())
                .description(req.description())
                .type(type)
                .status(req.disabled() ? Job.Status.PAUSED : Job.Status.ACTIVE)
                .timezone(req.timezone() == null ? "UTC" : req.timezone())
                .handlerName(req.handlerName())
                .handlerType(req.handlerType() == null ? HandlerType.FUNCTION : req.handlerType())
                .payload(req.payload())
                .maxRetries(req.maxRetries() == null ? defaults.maxRetries() : req.maxRetries())
                .retryDelayMs(req.retryDelayMs() == null ? defaults.retryDelayMs() : req.retryDelayMs())
                .timeoutMs(req.timeoutMs() == null ? defaults.timeoutMs() : req.timeoutMs())
                .priority(req.priority() == null ? Job.Priority.MEDIUM : req.priority())
                .concurrency(req.concurrency() == null ? defaults.concurrency() : req.concurrency())
                .allowOverlap(Boolean.TRUE.equals(req.allowOverlap()))
                .skipIfOverdue(req.skipIfOverdue() == null || req.skipIfOverdue())
                .tags(req.tags())
                .platformId(req.platformId())
                .createdBy(req.createdBy())
                .createdAt(now)
                .updatedAt(now);
    }

    private Job persistNew(Job job) throws Exception {
        Job saved = tx.required(() -> {
            if (jobs.getJob(job.id()).isPresent()) throw new ValidationException("id", "job already exists: " + job.id());
            return jobs.createJob(job);
        });
        log.info("Job {} ({}) created: type={} status={} next_run={}", saved.id(), saved.name(),
                saved.type().code(), saved.status().code(), saved.nextRun());
        events.jobEvent(SchedulerEvents.JOB_CREATED, saved.id(), saved.name());
        return saved;
    }

    // --- lifecycle ---

    public Job reschedule(String jobId, String newSchedule) throws Exception {
        Job job = getJob(jobId);
        if (!job.type().isCronDriven()) throw new StateConflictException(jobId, job.type().code(), "reschedule");
        if (job.isTerminal()) throw new StateConflictException(jobId, job.status().code(), "reschedule");
        validateCron(newSchedule);

        Instant now = clock.now();
        Instant from = job.startDate() != null && job.startDate().isAfter(now) ? job.startDate() : now;
        Instant next = cron.next(from, newSchedule, job.zone());
        if (job.endDate() != null && next.isAfter(job.endDate())) {
            throw new ValidationException("schedule", "no occurrence of '" + newSchedule + "' before " + job.endDate());
        }
        if (!tx.required(() -> jobs.updateSchedule(jobId, newSchedule, next, now))) throw NotFoundException.job(jobId);

        log.info("Job {} rescheduled to '{}' (next_run={})", jobId, newSchedule, next);
        events.jobEvent(SchedulerEvents.JOB_UPDATED, jobId, job.name());
        return getJob(jobId);
    }

    public Job pauseJob(String jobId) throws Exception {
        Job job = getJob(jobId);
        if (job.status() != Job.Status.ACTIVE) throw new StateConflictException(jobId, job.status().code(), "pause");
        transition(job, EnumSet.of(Job.Status.ACTIVE), Job.Status.PAUSED, job.nextRun(), "pause");
        events.jobEvent(SchedulerEvents.JOB_PAUSED, jobId, job.name());
        return getJob(jobId);
    }

    /** Resumes with the job's own {@code skip_if_overdue} setting. */
    public Job resumeJob(String jobId) throws Exception {
        Job job = getJob(jobId);
        return resume(job, !job.skipIfOverdue());
    }

    /**
     * @param catchUp when true and an occurrence was missed while paused, the most recent missed
     *                occurrence is dispatched on the next tick; older ones are never replayed
     */
    public Job resumeJob(String jobId, boolean catchUp) throws Exception {
        return resume(getJob(jobId), catchUp);
    }

    private Job resume(Job job, boolean catchUp) throws Exception {
        if (job.status() != Job.Status.PAUSED) throw new StateConflictException(job.id(), job.status().code(), "resume");
        Instant now = clock.now();

        if (!job.type().isCronDriven()) {
            boolean missed = job.nextRun() != null && !job.nextRun().isAfter(now);
            if (missed && !catchUp) {
                transition(job, EnumSet.of(Job.Status.PAUSED), Job.Status.COMPLETED, null, "resume");
                log.info("Job {} missed its run at {} while paused; completed on resume", job.id(), job.nextRun());
                events.jobEvent(SchedulerEvents.JOB_COMPLETED, job.id(), job.name());
                return getJob(job.id());
            }
            // kept as is; a run missed during the pause is due now
            transition(job, EnumSet.of(Job.Status.PAUSED), Job.Status.ACTIVE, job.nextRun(), "resume");
        } else {
            Instant next = cron.next(now, job.schedule(), job.zone());
            if (catchUp && job.nextRun() != null && !job.nextRun().isAfter(now)) {
                Instant missed = cron.previous(now, job.schedule(), job.zone())
                        .filter(p -> !p.isBefore(job.nextRun()))
                        .orElse(job.nextRun());
                log.info("Job {} resumes with catch-up of occurrence {}", job.id(), missed);
                next = missed;
            }
            if (job.endDate() != null && next.isAfter(job.endDate())) {
                transition(job, EnumSet.of(Job.Status.PAUSED), Job.Status.COMPLETED, null, "resume");
                log.info("Job {} has no occurrence left before {}; completed on resume", job.id(), job.endDate());
                events.jobEvent(SchedulerEvents.JOB_COMPLETED, job.id(), job.name());
                return getJob(job.id());
            }
            transition(job, EnumSet.of(Job.Status.PAUSED), Job.Status.ACTIVE, next, "resume");
        }
        events.jobEvent(SchedulerEvents.JOB_RESUMED, job.id(), job.name());
        return getJob(job.id());
    }

    /** Stops future dispatch. Executions already pending or running are left alone. */
    public Job cancelJob(String jobId) throws Exception {
        Job job = getJob(jobId);
        if (job.isTerminal()) throw new StateConflictException(jobId, job.status().code(), "cancel");
        transition(job, NON_TERMINAL, Job.Status.CANCELLED, null, "cancel");
        events.jobEvent(SchedulerEvents.JOB_CANCELLED, jobId, job.name());
        return getJob(jobId);
    }

    /** Deletes the job and all of its executions. */
    public void unschedule(String jobId) throws Exception {
        Job job = getJob(jobId);
        if (!tx.required(() -> jobs.deleteJob(jobId))) throw NotFoundException.job(jobId);
        log.info("Job {} ({}) unscheduled", jobId, job.name());
        events.jobEvent(SchedulerEvents.JOB_DELETED, jobId, job.name());
    }

    private void transition(Job job, Set<Job.Status> from, Job.Status to, Instant nextRun, String operation) throws Exception {
        Instant now = clock.now();
        if (!tx.required(() -> jobs.updateJobStatus(job.id(), from, to, nextRun, now))) {
            Job current = getJob(job.id());
            throw new StateConflictException(job.id(), current.status().code(), operation);
        }
        log.info("Job {} ({}): {} -> {}", job.id(), job.name(), job.status().code(), to.code());
    }

    // --- queries ---

    public Job getJob(String jobId) throws Exception {
        return findJob(jobId).orElseThrow(() -> NotFoundException.job(jobId));
    }

    public Optional<Job> findJob(String jobId) throws Exception {
        return tx.required(() -> jobs.getJob(jobId));
    }

    public List<Job> listJobs(JobFilter filter) throws Exception {
        return tx.required(() -> jobs.listJobs(filter == null ? JobFilter.all() : filter));
    }

    public List<JobExecution> getJobHistory(String jobId, ExecutionQuery query) throws Exception {
        getJob(jobId);
        return tx.required(() -> jobs.listExecutions(jobId, query == null ? ExecutionQuery.latest() : query));
    }

    public JobExecution getExecution(String executionId) throws Exception {
        return tx.required(() -> jobs.getExecution(executionId)).orElseThrow(() -> NotFoundException.execution(executionId));
    }

    public JobStats getJobStats(String jobId) throws Exception {
        return monitor.jobStats(getJob(jobId));
    }

    public SchedulerMetrics getMetrics() throws Exception {
        return monitor.metrics();
    }

    public HealthStatus healthCheck() {
        return monitor.health();
    }

    // --- manual retry ---

    /** Re-runs a failed or timed-out execution as a new attempt in the same chain. */
    public JobExecution retryExecution(String executionId) throws Exception {
        JobExecution failed = getExecution(executionId);
        if (failed.status() != JobExecution.Status.FAILED && failed.status() != JobExecution.Status.TIMEOUT) {
            throw new StateConflictException(executionId, failed.status().code(), "retry");
        }
        Job job = getJob(failed.jobId());
        Instant now = clock.now();
        JobExecution retry = JobExecution.builder()
                .id(UUID.randomUUID().toString())
                .jobId(job.id())
                .status(JobExecution.Status.PENDING)
                .scheduledAt(now)
                .retryCount(0)
                .maxRetries(job.maxRetries())
                .correlationId(failed.correlationId())
                .parentExecutionId(failed.id())
                .manualRetry(true)
                .traceId(failed.traceId())
                .spanId(UUID.randomUUID().toString())
                .parentSpanId(failed.spanId())
                .createdAt(now)
                .updatedAt(now)
                .build();
        JobExecution saved = tx.required(() -> jobs.createExecution(retry));
        try {
            bus.publish(SchedulerEvents.DISPATCH_TOPIC, DispatchEnvelope.forExecution(job, saved, now).toEnvelope(),
                    PublishOptions.mirrorTo(SchedulerEvents.DISPATCH_STREAM));
            tx.required(() -> jobs.markDispatched(saved.id(), now));
        } catch (TransportException e) {
            log.warn("Manual retry {} of execution {} not published yet: {}", saved.id(), executionId, e.getMessage());
        }
        log.info("Manual retry {} created for execution {} of job {}", saved.id(), executionId, job.id());
        events.executionEvent(SchedulerEvents.EXECUTION_RETRY_SCHEDULED, job.id(), saved.id(),
                Map.of("parent_execution_id", executionId, "manual", true));
        return saved;
    }

    // --- events ---

    public EventHandler onEvent(String eventName, EventCallback callback, EventHandlerOptions options) throws Exception {
        return triggers.register(eventName, callback, options);
    }

    public EventHandler onEvent(String eventName, EventHandler.Action action, EventHandlerOptions options) throws Exception {
        return triggers.register(eventName, action, options);
    }

    public void triggerEvent(String eventName, Map<String, Object> data) {
        triggers.trigger(eventName, data);
    }

    public List<EventHandler> listEventHandlers(String eventName) throws Exception {
        return triggers.list(eventName);
    }

    public EventHandler setEventHandlerEnabled(String handlerId, boolean enabled) throws Exception {
        return triggers.setEnabled(handlerId, enabled);
    }

    public void removeEventHandler(String handlerId) throws Exception {
        triggers.remove(handlerId);
    }

    public int restoreEventSubscriptions() throws Exception {
        int n = triggers.restore();
        if (n > 0) log.info("Restored {} event handler subscription(s)", n);
        return n;
    }

    // --- validation ---

    private void validateCommon(JobRequest req) {
        if (req == null) throw new ValidationException(null, "job request is required");
        if (req.name() == null || req.name().isBlank()) throw new ValidationException("name", "name is required");
        if (req.handlerName() == null || req.handlerName().isBlank()) {
            throw new ValidationException("handler_name", "handler_name is required");
        }
        zoneOf(req.timezone());
        if (req.maxRetries() != null && req.maxRetries() < 0) throw new ValidationException("max_retries", "max_retries must be >= 0");
        if (req.retryDelayMs() != null && req.retryDelayMs() < 0) throw new ValidationException("retry_delay_ms", "retry_delay_ms must be >= 0");
        if (req.timeoutMs() != null && req.timeoutMs() <= 0) throw new ValidationException("timeout_ms", "timeout_ms must be > 0");
        if (req.concurrency() != null && req.concurrency() < 1) throw new ValidationException("concurrency", "concurrency must be >= 1");
        if (req.maxExecutions() != null && req.maxExecutions() < 1) throw new ValidationException("max_executions", "max_executions must be >= 1");
    }

    private void validateCron(String expr) {
        if (expr == null || expr.isBlank()) throw new ValidationException("schedule", "schedule is required");
        try {
            cron.validate(expr);
        } catch (IllegalArgumentException e) {
            throw new ValidationException("schedule", "invalid cron expression '" + expr + "': " + e.getMessage(), e);
        }
    }

    private static ZoneId zoneOf(String timezone) {
        if (timezone == null) return ZoneId.of("UTC");
        try {
            return ZoneId.of(timezone);
        } catch (DateTimeException e) {
            throw new ValidationException("timezone", "unknown timezone: " + timezone, e);
        }
    }
}
