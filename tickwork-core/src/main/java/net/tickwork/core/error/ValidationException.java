package net.tickwork.core.error;

import java.util.Map;

/** Rejected input: bad cron expression, timezone, date range or policy value. Never retried. */
public class ValidationException extends SchedulerException {
    private final String field;

    public ValidationException(String field, String message) {
        this(field, message, null);
    }

    public ValidationException(String field, String message, Throwable cause) {
        super("VALIDATION_ERROR", message, field == null ? Map.of() : Map.of("field", field), cause);
        this.field = field;
    }

    public String field() { return field; }
}
