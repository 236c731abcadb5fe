package net.tickwork.core.service;

/** Topic, stream and group names used on the message bus. */
public final class SchedulerEvents {
    private SchedulerEvents() {}

    public static final String JOB_CREATED = "scheduler:job.created";
    public static final String JOB_UPDATED = "scheduler:job.updated";
    public static final String JOB_DELETED = "scheduler:job.deleted";
    public static final String JOB_PAUSED = "scheduler:job.paused";
    public static final String JOB_RESUMED = "scheduler:job.resumed";
    public static final String JOB_CANCELLED = "scheduler:job.cancelled";
    public static final String JOB_COMPLETED = "scheduler:job.completed";

    public static final String EXECUTION_STARTED = "scheduler:execution.started";
    public static final String EXECUTION_COMPLETED = "scheduler:execution.completed";
    public static final String EXECUTION_FAILED = "scheduler:execution.failed";
    public static final String EXECUTION_SKIPPED = "scheduler:execution.skipped";
    public static final String EXECUTION_RETRY_SCHEDULED = "scheduler:execution.retry_scheduled";

    public static final String DISPATCH_TOPIC = "scheduler:job.dispatch";
    public static final String DISPATCH_STREAM = "stream:scheduler:job.dispatch";
    public static final String EXECUTOR_GROUP = "scheduler:job-executor";
}
