package net.tickwork.core.model;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * A schedulable unit of work. An {@code active} job carries its {@code nextRun}, except a one-time
 * job whose occurrence was claimed: it stays {@code active} with no {@code nextRun} until its
 * execution chain resolves, then becomes {@code completed}.
 */
public record Job(
        String id,
        String name,
        String description,
        Type type,
        Status status,
        String schedule,
        String timezone,
        Instant nextRun,
        Instant lastRun,
        Instant startDate,
        Instant endDate,
        Integer maxExecutions,
        String handlerName,
        HandlerType handlerType,
        Map<String, Object> payload,
        int maxRetries,
        long retryDelayMs,
        long timeoutMs,
        Priority priority,
        int concurrency,
        boolean allowOverlap,
        boolean skipIfOverdue,
        long executionsCount,
        long successCount,
        long failureCount,
        Long avgDurationMs,
        List<String> tags,
        String platformId,
        String createdBy,
        Instant createdAt,
        Instant updatedAt,
        Instant completedAt,
        Instant cancelledAt
) {
    public Job {
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
        tags = tags == null ? List.of() : List.copyOf(tags);
        if (timezone == null) timezone = "UTC";
        if (priority == null) priority = Priority.MEDIUM;
    }

    public enum Type {
        CRON, ONE_TIME, RECURRING;

        public static Type from(String s) {
            if (s == null) return null;
            return Type.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
        public boolean isCronDriven() { return this != ONE_TIME; }
    }

    public enum Status {
        PENDING, ACTIVE, PAUSED, COMPLETED, FAILED, CANCELLED;

        public static Status from(String s) {
            if (s == null) return null;
            return Status.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
        public boolean isTerminal() { return this == COMPLETED || this == FAILED || this == CANCELLED; }
    }

    public enum Priority {
        LOW(1), MEDIUM(2), HIGH(3), CRITICAL(4);

        private final int weight;
        Priority(int weight) { this.weight = weight; }
        public int weight() { return weight; }

        public static Priority from(String s) {
            if (s == null) return null;
            return Priority.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public static Priority fromWeight(int w) {
            for (Priority p : values()) if (p.weight == w) return p;
            throw new IllegalArgumentException("unknown priority weight: " + w);
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public ZoneId zone() { return ZoneId.of(timezone); }

    public boolean isTerminal() { return status != null && status.isTerminal(); }

    public Builder toBuilder() { return new Builder(this); }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private Type type;
        private Status status = Status.PENDING;
        private String schedule;
        private String timezone = "UTC";
        private Instant nextRun;
        private Instant lastRun;
        private Instant startDate;
        private Instant endDate;
        private Integer maxExecutions;
        private String handlerName;
        private HandlerType handlerType = HandlerType.FUNCTION;
        private Map<String, Object> payload = Map.of();
        private int maxRetries;
        private long retryDelayMs;
        private long timeoutMs;
        private Priority priority = Priority.MEDIUM;
        private int concurrency = 1;
        private boolean allowOverlap;
        private boolean skipIfOverdue = true;
        private long executionsCount;
        private long successCount;
        private long failureCount;
        private Long avgDurationMs;
        private List<String> tags = List.of();
        private String platformId;
        private String createdBy;
        private Instant createdAt;
        private Instant updatedAt;
        private Instant completedAt;
        private Instant cancelledAt;

        private Builder() {}

        private Builder(Job j) {
            id = j.id; name = j.name; description = j.description; type = j.type; status = j.status;
            schedule = j.schedule; timezone = j.timezone; nextRun = j.nextRun; lastRun = j.lastRun;
            startDate = j.startDate; endDate = j.endDate; maxExecutions = j.maxExecutions;
            handlerName = j.handlerName; handlerType = j.handlerType; payload = j.payload;
            maxRetries = j.maxRetries; retryDelayMs = j.retryDelayMs; timeoutMs = j.timeoutMs;
            priority = j.priority; concurrency = j.concurrency; allowOverlap = j.allowOverlap;
            skipIfOverdue = j.skipIfOverdue; executionsCount = j.executionsCount;
            successCount = j.successCount; failureCount = j.failureCount; avgDurationMs = j.avgDurationMs;
            tags = j.tags; platformId = j.platformId; createdBy = j.createdBy; createdAt = j.createdAt;
            updatedAt = j.updatedAt; completedAt = j.completedAt; cancelledAt = j.cancelledAt;
        }

        public Builder id(String v) { id = v; return this; }
        public Builder name(String v) { name = v; return this; }
        public Builder description(String v) { description = v; return this; }
        public Builder type(Type v) { type = v; return this; }
        public Builder status(Status v) { status = v; return this; }
        public Builder schedule(String v) { schedule = v; return this; }
        public Builder timezone(String v) { timezone = v; return this; }
        public Builder nextRun(Instant v) { nextRun = v; return this; }
        public Builder lastRun(Instant v) { lastRun = v; return this; }
        public Builder startDate(Instant v) { startDate = v; return this; }
        public Builder endDate(Instant v) { endDate = v; return this; }
        public Builder maxExecutions(Integer v) { maxExecutions = v; return this; }
        public Builder handlerName(String v) { handlerName = v; return this; }
        public Builder handlerType(HandlerType v) { handlerType = v; return this; }
        public Builder payload(Map<String, Object> v) { payload = v; return this; }
        public Builder maxRetries(int v) { maxRetries = v; return this; }
        public Builder retryDelayMs(long v) { retryDelayMs = v; return this; }
        public Builder timeoutMs(long v) { timeoutMs = v; return this; }
        public Builder priority(Priority v) { priority = v; return this; }
        public Builder concurrency(int v) { concurrency = v; return this; }
        public Builder allowOverlap(boolean v) { allowOverlap = v; return this; }
        public Builder skipIfOverdue(boolean v) { skipIfOverdue = v; return this; }
        public Builder executionsCount(long v) { executionsCount = v; return this; }
        public Builder successCount(long v) { successCount = v; return this; }
        public Builder failureCount(long v) { failureCount = v; return this; }
        public Builder avgDurationMs(Long v) { avgDurationMs = v; return this; }
        public Builder tags(List<String> v) { tags = v; return this; }
        public Builder platformId(String v) { platformId = v; return this; }
        public Builder createdBy(String v) { createdBy = v; return this; }
        public Builder createdAt(Instant v) { createdAt = v; return this; }
        public Builder updatedAt(Instant v) { updatedAt = v; return this; }
        public Builder completedAt(Instant v) { completedAt = v; return this; }
        public Builder cancelledAt(Instant v) { cancelledAt = v; return this; }

        public Job build() {
            return new Job(id, name, description, type, status, schedule, timezone, nextRun, lastRun,
                    startDate, endDate, maxExecutions, handlerName, handlerType, payload, maxRetries,
                    retryDelayMs, timeoutMs, priority, concurrency, allowOverlap, skipIfOverdue,
                    executionsCount, successCount, failureCount, avgDurationMs, tags, platformId,
                    createdBy, createdAt, updatedAt, completedAt, cancelledAt);
        }
    }
}
