package net.tickwork.core.error;

import java.util.LinkedHashMap;
import java.util.Map;

/** Illegal lifecycle transition, e.g. pausing a job that is not active. */
public class StateConflictException extends SchedulerException {
    public StateConflictException(String id, String currentState, String operation) {
        super("STATE_CONFLICT", "cannot " + operation + " " + id + " in state " + currentState,
                context(id, currentState, operation));
    }

    private static Map<String, Object> context(String id, String state, String operation) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", id);
        m.put("state", state);
        m.put("operation", operation);
        return m;
    }
}
