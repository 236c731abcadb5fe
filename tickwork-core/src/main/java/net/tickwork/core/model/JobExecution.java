package net.tickwork.core.model;

import java.time.Instant;
import java.util.Locale;

/**
 * One attempt to run a job. Retries are separate rows sharing {@link #correlationId} with the
 * original attempt; {@link #parentExecutionId} points at the attempt they follow.
 */
public record JobExecution(
        String id,
        String jobId,
        Status status,
        Instant scheduledAt,
        Instant startedAt,
        Instant completedAt,
        Long durationMs,
        Object result,
        String errorMessage,
        String errorStack,
        int retryCount,
        int maxRetries,
        Instant nextRetryAt,
        String workerId,
        String correlationId,
        String parentExecutionId,
        boolean manualRetry,
        Instant dispatchedAt,
        String traceId,
        String spanId,
        String parentSpanId,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Status {
        PENDING, RUNNING, SUCCESS, FAILED, TIMEOUT, CANCELLED, SKIPPED;

        public static Status from(String s) {
            if (s == null) return null;
            return Status.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
        public boolean isTerminal() { return this != PENDING && this != RUNNING; }
        public boolean isActive() { return this == PENDING || this == RUNNING; }
    }

    public Builder toBuilder() { return new Builder(this); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String jobId;
        private Status status = Status.PENDING;
        private Instant scheduledAt;
        private Instant startedAt;
        private Instant completedAt;
        private Long durationMs;
        private Object result;
        private String errorMessage;
        private String errorStack;
        private int retryCount;
        private int maxRetries;
        private Instant nextRetryAt;
        private String workerId;
        private String correlationId;
        private String parentExecutionId;
        private boolean manualRetry;
        private Instant dispatchedAt;
        private String traceId;
        private String spanId;
        private String parentSpanId;
        private Instant createdAt;
        private Instant updatedAt;

        private Builder() {}

        private Builder(JobExecution e) {
            id = e.id; jobId = e.jobId; status = e.status; scheduledAt = e.scheduledAt;
            startedAt = e.startedAt; completedAt = e.completedAt; durationMs = e.durationMs;
            result = e.result; errorMessage = e.errorMessage; errorStack = e.errorStack;
            retryCount = e.retryCount; maxRetries = e.maxRetries; nextRetryAt = e.nextRetryAt;
            workerId = e.workerId; correlationId = e.correlationId; parentExecutionId = e.parentExecutionId;
            manualRetry = e.manualRetry; dispatchedAt = e.dispatchedAt; traceId = e.traceId;
            spanId = e.spanId; parentSpanId = e.parentSpanId; createdAt = e.createdAt; updatedAt = e.updatedAt;
        }

        public Builder id(String v) { id = v; return this; }
        public Builder jobId(String v) { jobId = v; return this; }
        public Builder status(Status v) { status = v; return this; }
        public Builder scheduledAt(Instant v) { scheduledAt = v; return this; }
        public Builder startedAt(Instant v) { startedAt = v; return this; }
        public Builder completedAt(Instant v) { completedAt = v; return this; }
        public Builder durationMs(Long v) { durationMs = v; return this; }
        public Builder result(Object v) { result = v; return this; }
        public Builder errorMessage(String v) { errorMessage = v; return this; }
        public Builder errorStack(String v) { errorStack = v; return this; }
        public Builder retryCount(int v) { retryCount = v; return this; }
        public Builder maxRetries(int v) { maxRetries = v; return this; }
        public Builder nextRetryAt(Instant v) { nextRetryAt = v; return this; }
        public Builder workerId(String v) { workerId = v; return this; }
        public Builder correlationId(String v) { correlationId = v; return this; }
        public Builder parentExecutionId(String v) { parentExecutionId = v; return this; }
        public Builder manualRetry(boolean v) { manualRetry = v; return this; }
        public Builder dispatchedAt(Instant v) { dispatchedAt = v; return this; }
        public Builder traceId(String v) { traceId = v; return this; }
        public Builder spanId(String v) { spanId = v; return this; }
        public Builder parentSpanId(String v) { parentSpanId = v; return this; }
        public Builder createdAt(Instant v) { createdAt = v; return this; }
        public Builder updatedAt(Instant v) { updatedAt = v; return this; }

        public JobExecution build() {
            return new JobExecution(id, jobId, status, scheduledAt, startedAt, completedAt, durationMs,
                    result, errorMessage, errorStack, retryCount, maxRetries, nextRetryAt, workerId,
                    correlationId, parentExecutionId, manualRetry, dispatchedAt, traceId, spanId,
                    parentSpanId, createdAt, updatedAt);
        }
    }
}
