package net.tickwork.core.model;

import java.time.Instant;
import java.util.Comparator;
import java.util.Set;

/** Options for reading a job's execution history. Results are ordered by scheduled time. */
public record ExecutionQuery(
        Set<JobExecution.Status> statuses,
        Instant since,
        Instant until,
        int limit,
        int offset,
        boolean ascending
) {
    public static final int DEFAULT_LIMIT = 50;

    public ExecutionQuery {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
        if (limit <= 0) limit = DEFAULT_LIMIT;
        if (offset < 0) offset = 0;
    }

    /** Newest first, default page size. */
    public static ExecutionQuery latest() {
        return new ExecutionQuery(null, null, null, DEFAULT_LIMIT, 0, false);
    }

    /** Every execution of the job, oldest first. */
    public static ExecutionQuery everything() {
        return new ExecutionQuery(null, null, null, Integer.MAX_VALUE, 0, true);
    }

    public static ExecutionQuery withStatuses(JobExecution.Status... statuses) {
        return new ExecutionQuery(Set.of(statuses), null, null, DEFAULT_LIMIT, 0, false);
    }

    public boolean matches(JobExecution e) {
        if (!statuses.isEmpty() && !statuses.contains(e.status())) return false;
        if (since != null && e.scheduledAt().isBefore(since)) return false;
        return until == null || e.scheduledAt().isBefore(until);
    }

    public Comparator<JobExecution> comparator() {
        Comparator<JobExecution> c = Comparator.comparing(JobExecution::scheduledAt)
                .thenComparing(JobExecution::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
                .thenComparingInt(JobExecution::retryCount);
        return ascending ? c : c.reversed();
    }
}
