package net.tickwork.core.model;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of a dispatch message. {@link #id()} equals the execution id and is the
 * idempotency key the executor deduplicates on.
 */
public record DispatchEnvelope(
        String id,
        String jobId,
        String executionId,
        String handlerName,
        HandlerType handlerType,
        long timeoutMs,
        int retryCount,
        String traceId,
        String correlationId,
        Instant timestamp,
        int attempts
) {
    public static final String TYPE = "scheduler:job.dispatch";

    public static DispatchEnvelope forExecution(Job job, JobExecution execution, Instant at) {
        return new DispatchEnvelope(execution.id(), job.id(), execution.id(), job.handlerName(),
                job.handlerType(), job.timeoutMs(), execution.retryCount(), execution.traceId(),
                execution.correlationId(), at, 0);
    }

    public Envelope toEnvelope() {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("job_id", jobId);
        p.put("execution_id", executionId);
        p.put("handler_name", handlerName);
        p.put("handler_type", handlerType.code());
        p.put("timeout_ms", timeoutMs);
        p.put("retry_count", retryCount);
        if (traceId != null) p.put("trace_id", traceId);
        return new Envelope(id, TYPE, timestamp, correlationId, p, attempts);
    }

    public static DispatchEnvelope from(Envelope e) {
        var p = e.payload();
        String executionId = e.string("execution_id");
        if (executionId == null || e.string("job_id") == null) {
            throw new IllegalArgumentException("not a dispatch envelope: " + e.id());
        }
        return new DispatchEnvelope(
                e.id(),
                e.string("job_id"),
                executionId,
                e.string("handler_name"),
                HandlerType.from(e.string("handler_type")),
                p.get("timeout_ms") instanceof Number n ? n.longValue() : 0L,
                p.get("retry_count") instanceof Number n ? n.intValue() : 0,
                e.string("trace_id"),
                e.correlationId(),
                e.timestamp(),
                e.attempts());
    }
}
