package net.tickwork.core.spi;

import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Persistence of jobs and their executions. Every state change that can race is a conditional
 * update returning whether it applied.
 */
public interface JobStore {
    Job createJob(Job job) throws Exception;
    Optional<Job> getJob(String jobId) throws Exception;
    List<Job> listJobs(JobFilter filter) throws Exception;

    /** Active jobs with {@code next_run <= now}, highest priority first, then earliest next_run. */
    List<Job> findDueJobs(Instant now, int limit) throws Exception;

    /**
     * Moves a job to {@code status} if its current status is one of {@code expected}. Also stamps
     * {@code completed_at}/{@code cancelled_at} when entering those states.
     */
    boolean updateJobStatus(String jobId, Set<Job.Status> expected, Job.Status status, Instant nextRun, Instant at) throws Exception;

    boolean updateSchedule(String jobId, String schedule, Instant nextRun, Instant at) throws Exception;

    /** Advances next_run only while the job is active and next_run still equals {@code expectedNextRun}. */
    boolean claimDueJob(String jobId, Instant expectedNextRun, Instant newNextRun) throws Exception;

    /** Bumps execution counters, the running duration average and last_run. */
    void recordOutcome(String jobId, boolean success, long durationMs, Instant at) throws Exception;

    /** Removes the job together with all of its executions. */
    boolean deleteJob(String jobId) throws Exception;

    JobExecution createExecution(JobExecution execution) throws Exception;
    Optional<JobExecution> getExecution(String executionId) throws Exception;

    /** Replaces the execution row if its stored status still equals {@code expected}. */
    boolean updateExecution(JobExecution execution, JobExecution.Status expected) throws Exception;

    boolean markDispatched(String executionId, Instant at) throws Exception;

    List<JobExecution> listExecutions(String jobId, ExecutionQuery query) throws Exception;

    /** Executions of the job in pending or running state. */
    int countActiveExecutions(String jobId) throws Exception;

    /** Original (non-retry, non-manual) executions that were dispatched rather than skipped. */
    int countOccurrences(String jobId) throws Exception;

    /** Pending executions never handed to the bus, scheduled at or before {@code scheduledBefore}. */
    List<JobExecution> findUndispatched(Instant scheduledBefore, int limit) throws Exception;

    List<JobExecution> findRunningStartedBefore(Instant startedBefore, int limit) throws Exception;

    /** Pending executions handed to the bus before {@code before} and due before it as well. */
    List<JobExecution> findPendingDispatchedBefore(Instant before, int limit) throws Exception;

    Map<Job.Status, Long> countJobsByStatus() throws Exception;
    Map<JobExecution.Status, Long> countExecutionsByStatus() throws Exception;
}
