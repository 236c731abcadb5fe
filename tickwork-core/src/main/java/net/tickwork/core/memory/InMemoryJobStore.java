package net.tickwork.core.memory;

import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.JobStore;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/** Single-process {@link JobStore}. All methods lock the store, so conditional updates are atomic. */
public final class InMemoryJobStore implements JobStore {
    private final Map<String, Job> jobs = new LinkedHashMap<>();
    private final Map<String, JobExecution> executions = new LinkedHashMap<>();
    private final Clock clock;

    public InMemoryJobStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Job createJob(Job job) {
        if (jobs.containsKey(job.id())) throw new IllegalStateException("duplicate job id: " + job.id());
        jobs.put(job.id(), job);
        return job;
    }

    @Override
    public synchronized Optional<Job> getJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    public synchronized List<Job> listJobs(JobFilter filter) {
        return jobs.values().stream()
                .filter(filter::matches)
                .sorted(filter.comparator())
                .skip(filter.offset())
                .limit(filter.limit())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<Job> findDueJobs(Instant now, int limit) {
        return jobs.values().stream()
                .filter(j -> j.status() == Job.Status.ACTIVE && j.nextRun() != null && !j.nextRun().isAfter(now))
                .sorted(Comparator.comparingInt((Job j) -> j.priority().weight()).reversed()
                        .thenComparing(Job::nextRun)
                        .thenComparing(Job::id))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized boolean updateJobStatus(String jobId, Set<Job.Status> expected, Job.Status status,
                                                Instant nextRun, Instant at) {
        Job j = jobs.get(jobId);
        if (j == null || !expected.contains(j.status())) return false;
        Job.Builder b = j.toBuilder().status(status).nextRun(nextRun).updatedAt(at);
        if (status == Job.Status.COMPLETED || status == Job.Status.FAILED) b.completedAt(at);
        if (status == Job.Status.CANCELLED) b.cancelledAt(at);
        jobs.put(jobId, b.build());
        return true;
    }

    @Override
    public synchronized boolean updateSchedule(String jobId, String schedule, Instant nextRun, Instant at) {
        Job j = jobs.get(jobId);
        if (j == null) return false;
        jobs.put(jobId, j.toBuilder().schedule(schedule).nextRun(nextRun).updatedAt(at).build());
        return true;
    }

    @Override
    public synchronized boolean claimDueJob(String jobId, Instant expectedNextRun, Instant newNextRun) {
        Job j = jobs.get(jobId);
        if (j == null || j.status() != Job.Status.ACTIVE || !Objects.equals(j.nextRun(), expectedNextRun)) return false;
        jobs.put(jobId, j.toBuilder().nextRun(newNextRun).updatedAt(clock.now()).build());
        return true;
    }

    @Override
    public synchronized void recordOutcome(String jobId, boolean success, long durationMs, Instant at) {
        Job j = jobs.get(jobId);
        if (j == null) return;
        long n = j.executionsCount() + 1;
        long avg = j.avgDurationMs() == null ? durationMs : (j.avgDurationMs() * (n - 1) + durationMs) / n;
        jobs.put(jobId, j.toBuilder()
                .executionsCount(n)
                .successCount(j.successCount() + (success ? 1 : 0))
                .failureCount(j.failureCount() + (success ? 0 : 1))
                .avgDurationMs(avg)
                .lastRun(at)
                .updatedAt(at)
                .build());
    }

    @Override
    public synchronized boolean deleteJob(String jobId) {
        if (jobs.remove(jobId) == null) return false;
        executions.values().removeIf(e -> e.jobId().equals(jobId));
        return true;
    }

    @Override
    public synchronized JobExecution createExecution(JobExecution execution) {
        if (!jobs.containsKey(execution.jobId())) {
            throw new IllegalStateException("unknown job for execution: " + execution.jobId());
        }
        if (executions.containsKey(execution.id())) {
            throw new IllegalStateException("duplicate execution id: " + execution.id());
        }
        executions.put(execution.id(), execution);
        return execution;
    }

    @Override
    public synchronized Optional<JobExecution> getExecution(String executionId) {
        return Optional.ofNullable(executions.get(executionId));
    }

    @Override
    public synchronized boolean updateExecution(JobExecution execution, JobExecution.Status expected) {
        JobExecution current = executions.get(execution.id());
        if (current == null || current.status() != expected) return false;
        executions.put(execution.id(), execution);
        return true;
    }

    @Override
    public synchronized boolean markDispatched(String executionId, Instant at) {
        JobExecution e = executions.get(executionId);
        if (e == null || e.dispatchedAt() != null) return false;
        executions.put(executionId, e.toBuilder().dispatchedAt(at).updatedAt(at).build());
        return true;
    }

    @Override
    public synchronized List<JobExecution> listExecutions(String jobId, ExecutionQuery query) {
        return executions.values().stream()
                .filter(e -> e.jobId().equals(jobId))
                .filter(query::matches)
                .sorted(query.comparator())
                .skip(query.offset())
                .limit(query.limit())
                .collect(Collectors.toList());
    }

    @Override
    public synchronized int countActiveExecutions(String jobId) {
        return (int) executions.values().stream()
                .filter(e -> e.jobId().equals(jobId) && e.status().isActive())
                .count();
    }

    @Override
    public synchronized int countOccurrences(String jobId) {
        return (int) executions.values().stream()
                .filter(e -> e.jobId().equals(jobId))
                .filter(e -> e.retryCount() == 0 && !e.manualRetry() && e.status() != JobExecution.Status.SKIPPED)
                .count();
    }

    @Override
    public synchronized List<JobExecution> findUndispatched(Instant scheduledBefore, int limit) {
        return executions.values().stream()
                .filter(e -> e.status() == JobExecution.Status.PENDING && e.dispatchedAt() == null)
                .filter(e -> !e.scheduledAt().isAfter(scheduledBefore))
                .sorted(Comparator.comparing(JobExecution::scheduledAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<JobExecution> findRunningStartedBefore(Instant startedBefore, int limit) {
        return executions.values().stream()
                .filter(e -> e.status() == JobExecution.Status.RUNNING && e.startedAt() != null)
                .filter(e -> e.startedAt().isBefore(startedBefore))
                .sorted(Comparator.comparing(JobExecution::startedAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized List<JobExecution> findPendingDispatchedBefore(Instant before, int limit) {
        return executions.values().stream()
                .filter(e -> e.status() == JobExecution.Status.PENDING && e.dispatchedAt() != null)
                .filter(e -> e.dispatchedAt().isBefore(before) && e.scheduledAt().isBefore(before))
                .sorted(Comparator.comparing(JobExecution::dispatchedAt))
                .limit(limit)
                .collect(Collectors.toList());
    }

    @Override
    public synchronized Map<Job.Status, Long> countJobsByStatus() {
        Map<Job.Status, Long> out = new EnumMap<>(Job.Status.class);
        for (Job j : jobs.values()) out.merge(j.status(), 1L, Long::sum);
        return out;
    }

    @Override
    public synchronized Map<JobExecution.Status, Long> countExecutionsByStatus() {
        Map<JobExecution.Status, Long> out = new EnumMap<>(JobExecution.Status.class);
        for (JobExecution e : executions.values()) out.merge(e.status(), 1L, Long::sum);
        return out;
    }

    /** Everything stored, for tests and diagnostics. */
    public synchronized List<JobExecution> allExecutions() {
        return new ArrayList<>(executions.values());
    }
}
