package net.tickwork.core.handler;

import java.time.Instant;

public record JobContext(
        String jobId,
        String jobName,
        String executionId,
        int retryCount,
        String traceId,
        String spanId,
        String platformId,
        Instant deadline
) {
}
