package net.tickwork.core.monitor;

import java.time.Instant;
import java.util.Locale;
import java.util.Map;

public record HealthStatus(State state, Map<String, Component> components, Instant checkedAt) {
    public enum State {
        HEALTHY, DEGRADED, UNHEALTHY;

        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public record Component(boolean up, String detail) {}
}
