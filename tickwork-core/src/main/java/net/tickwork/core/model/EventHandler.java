package net.tickwork.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public record EventHandler(
        String id,
        String eventName,
        String handlerName,
        Type handlerType,
        boolean enabled,
        int priority,
        Action action,
        String platformId,
        long triggerCount,
        long successCount,
        long failureCount,
        Instant lastTriggered,
        Instant createdAt,
        Instant updatedAt
) {
    public enum Type {
        FUNCTION, JOB_CREATOR;

        public static Type from(String s) {
            if (s == null) return null;
            return Type.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public enum ActionType {
        CREATE_JOB, TRIGGER_WORKFLOW, DISPATCH_AGENT;

        public static ActionType from(String s) {
            if (s == null) return null;
            return ActionType.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    /** A declarative reaction that survives restarts, unlike an in-process callback. */
    public record Action(ActionType type, Map<String, Object> config) {
        public Action {
            config = config == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(config));
        }

        public String string(String key) {
            Object v = config.get(key);
            return v == null ? null : v.toString();
        }
    }

    public boolean appliesTo(String eventPlatformId) {
        return platformId == null || platformId.equals(eventPlatformId);
    }

    public EventHandler withEnabled(boolean enabled, Instant at) {
        return new EventHandler(id, eventName, handlerName, handlerType, enabled, priority, action, platformId,
                triggerCount, successCount, failureCount, lastTriggered, createdAt, at);
    }
}
