package net.tickwork.core.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the scheduler's typed errors. {@link #code()} is stable and safe to expose to callers;
 * {@link #context()} carries the ids and fields needed to act on the error.
 */
public class SchedulerException extends RuntimeException {
    private final String code;
    private final Map<String, Object> context;

    public SchedulerException(String code, String message, Map<String, ?> context) {
        this(code, message, context, null);
    }

    public SchedulerException(String code, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.code = code;
        this.context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    public String code() { return code; }

    public Map<String, Object> context() { return context; }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + code + "]: " + getMessage() + (context.isEmpty() ? "" : " " + context);
    }
}
