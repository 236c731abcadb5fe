package net.tickwork.adapter.jdbc.mapper;

import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.core.model.EventHandler;
import net.tickwork.core.model.HandlerType;
import net.tickwork.core.model.IdempotencyRecord;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import static net.tickwork.adapter.jdbc.JdbcUtil.instant;
import static net.tickwork.adapter.jdbc.JdbcUtil.nullableInt;
import static net.tickwork.adapter.jdbc.JdbcUtil.nullableLong;
import static net.tickwork.adapter.jdbc.JdbcUtil.yn;

public final class RowMappers {
    private RowMappers() {}

    // --- Job ---
    public static Job toJob(ResultSet rs, JsonCodec json) throws SQLException {
        return Job.builder()
                .id(rs.getString("ID"))
                .name(rs.getString("NAME"))
                .description(rs.getString("DESCRIPTION"))
                .type(Job.Type.from(rs.getString("JOB_TYPE")))
                .status(Job.Status.from(rs.getString("STATUS")))
                .schedule(rs.getString("SCHEDULE"))
                .timezone(rs.getString("TIMEZONE"))
                .nextRun(instant(rs, "NEXT_RUN"))
                .lastRun(instant(rs, "LAST_RUN"))
                .startDate(instant(rs, "START_DATE"))
                .endDate(instant(rs, "END_DATE"))
                .maxExecutions(nullableInt(rs, "MAX_EXECUTIONS"))
                .handlerName(rs.getString("HANDLER_NAME"))
                .handlerType(HandlerType.from(rs.getString("HANDLER_TYPE")))
                .payload(json.readMap(rs.getString("PAYLOAD_JSON")))
                .maxRetries(rs.getInt("MAX_RETRIES"))
                .retryDelayMs(rs.getLong("RETRY_DELAY_MS"))
                .timeoutMs(rs.getLong("TIMEOUT_MS"))
                .priority(Job.Priority.fromWeight(rs.getInt("PRIORITY")))
                .concurrency(rs.getInt("CONCURRENCY"))
                .allowOverlap(yn(rs, "ALLOW_OVERLAP"))
                .skipIfOverdue(yn(rs, "SKIP_IF_OVERDUE"))
                .executionsCount(rs.getLong("EXECUTIONS_COUNT"))
                .successCount(rs.getLong("SUCCESS_COUNT"))
                .failureCount(rs.getLong("FAILURE_COUNT"))
                .avgDurationMs(nullableLong(rs, "AVG_DURATION_MS"))
                .tags(splitTags(rs.getString("TAGS")))
                .platformId(rs.getString("PLATFORM_ID"))
                .createdBy(rs.getString("CREATED_BY"))
                .createdAt(instant(rs, "CREATED_AT"))
                .updatedAt(instant(rs, "UPDATED_AT"))
                .completedAt(instant(rs, "COMPLETED_AT"))
                .cancelledAt(instant(rs, "CANCELLED_AT"))
                .build();
    }

    // --- JobExecution ---
    public static JobExecution toExecution(ResultSet rs, JsonCodec json) throws SQLException {
        return JobExecution.builder()
                .id(rs.getString("ID"))
                .jobId(rs.getString("JOB_ID"))
                .status(JobExecution.Status.from(rs.getString("STATUS")))
                .scheduledAt(instant(rs, "SCHEDULED_AT"))
                .startedAt(instant(rs, "STARTED_AT"))
                .completedAt(instant(rs, "COMPLETED_AT"))
                .durationMs(nullableLong(rs, "DURATION_MS"))
                .result(json.readValue(rs.getString("RESULT_JSON")))
                .errorMessage(rs.getString("ERROR_MESSAGE"))
                .errorStack(rs.getString("ERROR_STACK"))
                .retryCount(rs.getInt("RETRY_COUNT"))
                .maxRetries(rs.getInt("MAX_RETRIES"))
                .nextRetryAt(instant(rs, "NEXT_RETRY_AT"))
                .workerId(rs.getString("WORKER_ID"))
                .correlationId(rs.getString("CORRELATION_ID"))
                .parentExecutionId(rs.getString("PARENT_EXECUTION_ID"))
                .manualRetry(yn(rs, "MANUAL_RETRY"))
                .dispatchedAt(instant(rs, "DISPATCHED_AT"))
                .traceId(rs.getString("TRACE_ID"))
                .spanId(rs.getString("SPAN_ID"))
                .parentSpanId(rs.getString("PARENT_SPAN_ID"))
                .createdAt(instant(rs, "CREATED_AT"))
                .updatedAt(instant(rs, "UPDATED_AT"))
                .build();
    }

    // --- EventHandler ---
    public static EventHandler toEventHandler(ResultSet rs, JsonCodec json) throws SQLException {
        String actionType = rs.getString("ACTION_TYPE");
        EventHandler.Action action = actionType == null ? null
                : new EventHandler.Action(EventHandler.ActionType.from(actionType), json.readMap(rs.getString("ACTION_JSON")));
        return new EventHandler(
                rs.getString("ID"),
                rs.getString("EVENT_NAME"),
                rs.getString("HANDLER_NAME"),
                EventHandler.Type.from(rs.getString("HANDLER_TYPE")),
                yn(rs, "ENABLED"),
                rs.getInt("PRIORITY"),
                action,
                rs.getString("PLATFORM_ID"),
                rs.getLong("TRIGGER_COUNT"),
                rs.getLong("SUCCESS_COUNT"),
                rs.getLong("FAILURE_COUNT"),
                instant(rs, "LAST_TRIGGERED"),
                instant(rs, "CREATED_AT"),
                instant(rs, "UPDATED_AT")
        );
    }

    // --- Idempotency ---
    public static IdempotencyRecord toIdempotency(ResultSet rs, JsonCodec json) throws SQLException {
        return new IdempotencyRecord(
                rs.getString("IDEMPOTENCY_KEY"),
                IdempotencyRecord.Status.from(rs.getString("STATUS")),
                json.readValue(rs.getString("RESULT_JSON")),
                instant(rs, "EXPIRES_AT"),
                instant(rs, "CREATED_AT")
        );
    }

    public static String joinTags(List<String> tags) {
        return tags == null || tags.isEmpty() ? null : String.join(",", tags);
    }

    public static List<String> splitTags(String tags) {
        if (tags == null || tags.isBlank()) return List.of();
        return Arrays.stream(tags.split(",")).map(String::trim).filter(s -> !s.isEmpty()).collect(Collectors.toList());
    }
}
