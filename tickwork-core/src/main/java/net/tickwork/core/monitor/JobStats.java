package net.tickwork.core.monitor;

import net.tickwork.core.model.JobExecution;

import java.time.Instant;

/** Aggregates over every execution recorded for one job. Durations are null without finished executions. */
public record JobStats(
        String jobId,
        long total,
        long succeeded,
        long failed,
        long timedOut,
        long skipped,
        long active,
        double successRate,
        Long avgDurationMs,
        Long minDurationMs,
        Long maxDurationMs,
        JobExecution lastExecution,
        Instant nextRun
) {
}
