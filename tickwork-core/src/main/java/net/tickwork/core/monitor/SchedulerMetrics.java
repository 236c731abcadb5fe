package net.tickwork.core.monitor;

import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.service.ConsumerStats;
import net.tickwork.core.service.DispatchStats;

import java.time.Instant;
import java.util.Map;

public record SchedulerMetrics(
        Instant generatedAt,
        Map<Job.Status, Long> jobsByStatus,
        Map<JobExecution.Status, Long> executionsByStatus,
        double successRate,
        DispatchStats.Snapshot dispatch,
        ConsumerStats.Snapshot consumer
) {
    public long jobs(Job.Status status) { return jobsByStatus.getOrDefault(status, 0L); }

    public long executions(JobExecution.Status status) { return executionsByStatus.getOrDefault(status, 0L); }
}
