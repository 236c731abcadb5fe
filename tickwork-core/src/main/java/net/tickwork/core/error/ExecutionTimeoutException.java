package net.tickwork.core.error;

import java.util.Map;

public class ExecutionTimeoutException extends SchedulerException {
    public ExecutionTimeoutException(String executionId, long timeoutMs) {
        super("EXECUTION_TIMEOUT", "execution " + executionId + " exceeded " + timeoutMs + "ms",
                Map.of("execution_id", executionId, "timeout_ms", timeoutMs));
    }
}
