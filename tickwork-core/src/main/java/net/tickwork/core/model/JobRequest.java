package net.tickwork.core.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Caller input for creating a job. Unset execution-policy fields fall back to the scheduler's
 * configured defaults.
 */
public record JobRequest(
        String id,
        String name,
        String description,
        String schedule,
        String timezone,
        Instant executeAt,
        Instant startDate,
        Instant endDate,
        Integer maxExecutions,
        String handlerName,
        HandlerType handlerType,
        Map<String, Object> payload,
        Integer maxRetries,
        Long retryDelayMs,
        Long timeoutMs,
        Job.Priority priority,
        Integer concurrency,
        Boolean allowOverlap,
        Boolean skipIfOverdue,
        boolean disabled,
        List<String> tags,
        String platformId,
        String createdBy
) {
    public static Builder builder(String name, String handlerName) {
        return new Builder().name(name).handlerName(handlerName);
    }

    public static final class Builder {
        private String id;
        private String name;
        private String description;
        private String schedule;
        private String timezone;
        private Instant executeAt;
        private Instant startDate;
        private Instant endDate;
        private Integer maxExecutions;
        private String handlerName;
        private HandlerType handlerType;
        private Map<String, Object> payload;
        private Integer maxRetries;
        private Long retryDelayMs;
        private Long timeoutMs;
        private Job.Priority priority;
        private Integer concurrency;
        private Boolean allowOverlap;
        private Boolean skipIfOverdue;
        private boolean disabled;
        private List<String> tags;
        private String platformId;
        private String createdBy;

        private Builder() {}

        public Builder id(String v) { id = v; return this; }
        public Builder name(String v) { name = v; return this; }
        public Builder description(String v) { description = v; return this; }
        public Builder schedule(String v) { schedule = v; return this; }
        public Builder timezone(String v) { timezone = v; return this; }
        public Builder executeAt(Instant v) { executeAt = v; return this; }
        public Builder startDate(Instant v) { startDate = v; return this; }
        public Builder endDate(Instant v) { endDate = v; return this; }
        public Builder maxExecutions(Integer v) { maxExecutions = v; return this; }
        public Builder handlerName(String v) { handlerName = v; return this; }
        public Builder handlerType(HandlerType v) { handlerType = v; return this; }
        public Builder payload(Map<String, Object> v) { payload = v; return this; }
        public Builder maxRetries(Integer v) { maxRetries = v; return this; }
        public Builder retryDelayMs(Long v) { retryDelayMs = v; return this; }
        public Builder timeoutMs(Long v) { timeoutMs = v; return this; }
        public Builder priority(Job.Priority v) { priority = v; return this; }
        public Builder concurrency(Integer v) { concurrency = v; return this; }
        public Builder allowOverlap(Boolean v) { allowOverlap = v; return this; }
        public Builder skipIfOverdue(Boolean v) { skipIfOverdue = v; return this; }
        public Builder disabled(boolean v) { disabled = v; return this; }
        public Builder tags(List<String> v) { tags = v; return this; }
        public Builder platformId(String v) { platformId = v; return this; }
        public Builder createdBy(String v) { createdBy = v; return this; }

        public JobRequest build() {
            return new JobRequest(id, name, description, schedule, timezone, executeAt, startDate, endDate,
                    maxExecutions, handlerName, handlerType, payload, maxRetries, retryDelayMs, timeoutMs,
                    priority, concurrency, allowOverlap, skipIfOverdue, disabled, tags, platformId, createdBy);
        }
    }
}
