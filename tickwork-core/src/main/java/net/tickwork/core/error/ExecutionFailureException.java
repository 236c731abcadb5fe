package net.tickwork.core.error;

import java.util.Map;

/** The handler itself threw. Retryable up to the job's {@code max_retries}. */
public class ExecutionFailureException extends SchedulerException {
    public ExecutionFailureException(String executionId, Throwable cause) {
        super("EXECUTION_FAILED", "execution " + executionId + " failed: " + describe(cause),
                Map.of("execution_id", executionId), cause);
    }

    private static String describe(Throwable t) {
        if (t == null) return "unknown error";
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
