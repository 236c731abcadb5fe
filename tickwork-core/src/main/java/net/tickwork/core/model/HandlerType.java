package net.tickwork.core.model;

import java.util.Locale;

/** How a job's {@code handler_name} is resolved into something invocable. */
public enum HandlerType {
    FUNCTION, AGENT, WORKFLOW;

    public static HandlerType from(String s) {
        if (s == null) return null;
        return HandlerType.valueOf(s.toUpperCase(Locale.ROOT));
    }
    public String code() { return name().toLowerCase(Locale.ROOT); }
}
