package net.tickwork.core.error;

import java.util.Map;

public class NotFoundException extends SchedulerException {
    public NotFoundException(String entity, String id) {
        super("NOT_FOUND", entity + " not found: " + id, Map.of("entity", entity, "id", String.valueOf(id)));
    }

    public static NotFoundException job(String jobId) { return new NotFoundException("job", jobId); }

    public static NotFoundException execution(String executionId) { return new NotFoundException("execution", executionId); }

    public static NotFoundException eventHandler(String handlerId) { return new NotFoundException("event_handler", handlerId); }
}
