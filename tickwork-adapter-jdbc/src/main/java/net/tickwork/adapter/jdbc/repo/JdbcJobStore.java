package net.tickwork.adapter.jdbc.repo;

import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.adapter.jdbc.mapper.RowMappers;
import net.tickwork.core.model.ExecutionQuery;
import net.tickwork.core.model.Job;
import net.tickwork.core.model.JobExecution;
import net.tickwork.core.model.JobFilter;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.JobStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static net.tickwork.adapter.jdbc.JdbcUtil.setNullableInt;
import static net.tickwork.adapter.jdbc.JdbcUtil.setNullableLong;
import static net.tickwork.adapter.jdbc.JdbcUtil.ts;
import static net.tickwork.adapter.jdbc.JdbcUtil.yn;
import static net.tickwork.adapter.jdbc.TxContext.mustConn;

/**
 * {@link JobStore} over {@code TB_JOB} / {@code TB_JOB_EXECUTION}. Every call runs on the
 * connection bound by the surrounding {@code JdbcTxRunner}; races are settled by conditional
 * updates rather than row locks.
 */
public final class JdbcJobStore implements JobStore {
    private final JsonCodec json;
    private final Clock clock;

    public JdbcJobStore(JsonCodec json, Clock clock) {
        this.json = json;
        this.clock = clock;
    }

    // ---------------------------------------------------------------- jobs

    @Override
    public Job createJob(Job job) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            INSERT INTO TB_JOB (
                ID, NAME, DESCRIPTION, JOB_TYPE, STATUS, SCHEDULE, TIMEZONE, NEXT_RUN, LAST_RUN,
                START_DATE, END_DATE, MAX_EXECUTIONS, HANDLER_NAME, HANDLER_TYPE, PAYLOAD_JSON,
                MAX_RETRIES, RETRY_DELAY_MS, TIMEOUT_MS, PRIORITY, CONCURRENCY, ALLOW_OVERLAP,
                SKIP_IF_OVERDUE, EXECUTIONS_COUNT, SUCCESS_COUNT, FAILURE_COUNT, AVG_DURATION_MS,
                TAGS, PLATFORM_ID, CREATED_BY, CREATED_AT, UPDATED_AT, COMPLETED_AT, CANCELLED_AT
            ) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """)) {
            int i = 1;
            ps.setString(i++, job.id());
            ps.setString(i++, job.name());
            ps.setString(i++, job.description());
            ps.setString(i++, job.type().code());
            ps.setString(i++, job.status().code());
            ps.setString(i++, job.schedule());
            ps.setString(i++, job.timezone());
            ps.setTimestamp(i++, ts(job.nextRun()));
            ps.setTimestamp(i++, ts(job.lastRun()));
            ps.setTimestamp(i++, ts(job.startDate()));
            ps.setTimestamp(i++, ts(job.endDate()));
            setNullableInt(ps, i++, job.maxExecutions());
            ps.setString(i++, job.handlerName());
            ps.setString(i++, job.handlerType().code());
            ps.setString(i++, json.write(job.payload()));
            ps.setInt(i++, job.maxRetries());
            ps.setLong(i++, job.retryDelayMs());
            ps.setLong(i++, job.timeoutMs());
            ps.setInt(i++, job.priority().weight());
            ps.setInt(i++, job.concurrency());
            ps.setString(i++, yn(job.allowOverlap()));
            ps.setString(i++, yn(job.skipIfOverdue()));
            ps.setLong(i++, job.executionsCount());
            ps.setLong(i++, job.successCount());
            ps.setLong(i++, job.failureCount());
            setNullableLong(ps, i++, job.avgDurationMs());
            ps.setString(i++, RowMappers.joinTags(job.tags()));
            ps.setString(i++, job.platformId());
            ps.setString(i++, job.createdBy());
            ps.setTimestamp(i++, ts(job.createdAt()));
            ps.setTimestamp(i++, ts(job.updatedAt() == null ? job.createdAt() : job.updatedAt()));
            ps.setTimestamp(i++, ts(job.completedAt()));
            ps.setTimestamp(i, ts(job.cancelledAt()));
            ps.executeUpdate();
        }
        return getJob(job.id()).orElseThrow();
    }

    @Override
    public Optional<Job> getJob(String jobId) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM TB_JOB WHERE ID = ?")) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toJob(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public List<Job> listJobs(JobFilter f) throws Exception {
        Connection c = mustConn();
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM TB_JOB WHERE 1=1");
        if (!f.types().isEmpty()) {
            sql.append(" AND JOB_TYPE IN (").append(marks(f.types().size())).append(')');
            f.types().forEach(t -> args.add(t.code()));
        }
        if (!f.statuses().isEmpty()) {
            sql.append(" AND STATUS IN (").append(marks(f.statuses().size())).append(')');
            f.statuses().forEach(s -> args.add(s.code()));
        }
        if (f.name() != null) { sql.append(" AND NAME = ?"); args.add(f.name()); }
        if (f.nameContains() != null) {
            sql.append(" AND LOWER(NAME) LIKE ? ESCAPE '!'");
            args.add("%" + likeEscape(f.nameContains().toLowerCase(Locale.ROOT)) + "%");
        }
        if (f.platformId() != null) { sql.append(" AND PLATFORM_ID = ?"); args.add(f.platformId()); }
        if (f.createdBy() != null) { sql.append(" AND CREATED_BY = ?"); args.add(f.createdBy()); }
        if (f.nextRunAfter() != null) { sql.append(" AND NEXT_RUN > ?"); args.add(ts(f.nextRunAfter())); }
        if (f.nextRunBefore() != null) { sql.append(" AND NEXT_RUN < ?"); args.add(ts(f.nextRunBefore())); }

        String dir = f.descending() ? " DESC" : " ASC";
        sql.append(" ORDER BY ").append(sortColumn(f.sortBy())).append(dir).append(", ID").append(dir);

        // tags live in one column; page in SQL only when no tag criteria narrow the rows afterwards
        boolean pageInSql = !f.hasTagCriteria();
        if (pageInSql) {
            sql.append(" OFFSET ? ROWS FETCH NEXT ? ROWS ONLY");
            args.add(f.offset());
            args.add(f.limit());
        }

        List<Job> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toJob(rs, json));
            }
        }
        if (pageInSql) return out;
        return out.stream()
                .filter(f::matchesTags)
                .skip(f.offset())
                .limit(f.limit())
                .collect(Collectors.toList());
    }

    @Override
    public List<Job> findDueJobs(Instant now, int limit) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            SELECT *
              FROM TB_JOB
             WHERE STATUS = 'active'
               AND NEXT_RUN <= ?
             ORDER BY PRIORITY DESC, NEXT_RUN ASC, ID ASC
             FETCH FIRST ? ROWS ONLY
        """)) {
            ps.setTimestamp(1, ts(now));
            ps.setInt(2, limit);
            List<Job> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toJob(rs, json));
            }
            return out;
        }
    }

    @Override
    public boolean updateJobStatus(String jobId, Set<Job.Status> expected, Job.Status status,
                                   Instant nextRun, Instant at) throws Exception {
        if (expected.isEmpty()) return false;
        Connection c = mustConn();
        StringBuilder sql = new StringBuilder("UPDATE TB_JOB SET STATUS = ?, NEXT_RUN = ?, UPDATED_AT = ?");
        if (status == Job.Status.COMPLETED || status == Job.Status.FAILED) sql.append(", COMPLETED_AT = ?");
        if (status == Job.Status.CANCELLED) sql.append(", CANCELLED_AT = ?");
        sql.append(" WHERE ID = ? AND STATUS IN (").append(marks(expected.size())).append(')');

        List<Object> args = new ArrayList<>();
        args.add(status.code());
        args.add(ts(nextRun));
        args.add(ts(at));
        if (status.isTerminal()) args.add(ts(at));
        args.add(jobId);
        expected.forEach(s -> args.add(s.code()));
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, args);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean updateSchedule(String jobId, String schedule, Instant nextRun, Instant at) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            UPDATE TB_JOB
               SET SCHEDULE = ?, NEXT_RUN = ?, UPDATED_AT = ?
             WHERE ID = ?
        """)) {
            ps.setString(1, schedule);
            ps.setTimestamp(2, ts(nextRun));
            ps.setTimestamp(3, ts(at));
            ps.setString(4, jobId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean claimDueJob(String jobId, Instant expectedNextRun, Instant newNextRun) throws Exception {
        Connection c = mustConn();
        String sql = expectedNextRun == null
                ? "UPDATE TB_JOB SET NEXT_RUN = ?, UPDATED_AT = ? WHERE ID = ? AND STATUS = 'active' AND NEXT_RUN IS NULL"
                : "UPDATE TB_JOB SET NEXT_RUN = ?, UPDATED_AT = ? WHERE ID = ? AND STATUS = 'active' AND NEXT_RUN = ?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setTimestamp(1, ts(newNextRun));
            ps.setTimestamp(2, ts(clock.now()));
            ps.setString(3, jobId);
            if (expectedNextRun != null) ps.setTimestamp(4, ts(expectedNextRun));
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void recordOutcome(String jobId, boolean success, long durationMs, Instant at) throws Exception {
        Connection c = mustConn();
        // right-hand column references see the values before the update
        try (PreparedStatement ps = c.prepareStatement("""
            UPDATE TB_JOB
               SET EXECUTIONS_COUNT = EXECUTIONS_COUNT + 1,
                   SUCCESS_COUNT    = SUCCESS_COUNT + ?,
                   FAILURE_COUNT    = FAILURE_COUNT + ?,
                   AVG_DURATION_MS  = CASE WHEN AVG_DURATION_MS IS NULL THEN ?
                                           ELSE (AVG_DURATION_MS * EXECUTIONS_COUNT + ?) / (EXECUTIONS_COUNT + 1) END,
                   LAST_RUN         = ?,
                   UPDATED_AT       = ?
             WHERE ID = ?
        """)) {
            ps.setInt(1, success ? 1 : 0);
            ps.setInt(2, success ? 0 : 1);
            ps.setLong(3, durationMs);
            ps.setLong(4, durationMs);
            ps.setTimestamp(5, ts(at));
            ps.setTimestamp(6, ts(at));
            ps.setString(7, jobId);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean deleteJob(String jobId) throws Exception {
        Connection c = mustConn();
        // executions go with the job (ON DELETE CASCADE)
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM TB_JOB WHERE ID = ?")) {
            ps.setString(1, jobId);
            return ps.executeUpdate() == 1;
        }
    }

    // ---------------------------------------------------------------- executions

    @Override
    public JobExecution createExecution(JobExecution e) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            INSERT INTO TB_JOB_EXECUTION (
                ID, JOB_ID, STATUS, SCHEDULED_AT, STARTED_AT, COMPLETED_AT, DURATION_MS, RESULT_JSON,
                ERROR_MESSAGE, ERROR_STACK, RETRY_COUNT, MAX_RETRIES, NEXT_RETRY_AT, WORKER_ID,
                CORRELATION_ID, PARENT_EXECUTION_ID, MANUAL_RETRY, DISPATCHED_AT, TRACE_ID, SPAN_ID,
                PARENT_SPAN_ID, CREATED_AT, UPDATED_AT
            ) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """)) {
            int i = 1;
            ps.setString(i++, e.id());
            ps.setString(i++, e.jobId());
            ps.setString(i++, e.status().code());
            ps.setTimestamp(i++, ts(e.scheduledAt()));
            ps.setTimestamp(i++, ts(e.startedAt()));
            ps.setTimestamp(i++, ts(e.completedAt()));
            setNullableLong(ps, i++, e.durationMs());
            ps.setString(i++, json.write(e.result()));
            ps.setString(i++, e.errorMessage());
            ps.setString(i++, e.errorStack());
            ps.setInt(i++, e.retryCount());
            ps.setInt(i++, e.maxRetries());
            ps.setTimestamp(i++, ts(e.nextRetryAt()));
            ps.setString(i++, e.workerId());
            ps.setString(i++, e.correlationId());
            ps.setString(i++, e.parentExecutionId());
            ps.setString(i++, yn(e.manualRetry()));
            ps.setTimestamp(i++, ts(e.dispatchedAt()));
            ps.setString(i++, e.traceId());
            ps.setString(i++, e.spanId());
            ps.setString(i++, e.parentSpanId());
            Instant created = e.createdAt() == null ? clock.now() : e.createdAt();
            ps.setTimestamp(i++, ts(created));
            ps.setTimestamp(i, ts(e.updatedAt() == null ? created : e.updatedAt()));
            ps.executeUpdate();
        }
        return getExecution(e.id()).orElseThrow();
    }

    @Override
    public Optional<JobExecution> getExecution(String executionId) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("SELECT * FROM TB_JOB_EXECUTION WHERE ID = ?")) {
            ps.setString(1, executionId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toExecution(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public boolean updateExecution(JobExecution e, JobExecution.Status expected) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            UPDATE TB_JOB_EXECUTION
               SET STATUS = ?, STARTED_AT = ?, COMPLETED_AT = ?, DURATION_MS = ?, RESULT_JSON = ?,
                   ERROR_MESSAGE = ?, ERROR_STACK = ?, NEXT_RETRY_AT = ?, WORKER_ID = ?,
                   DISPATCHED_AT = ?, SPAN_ID = ?, PARENT_SPAN_ID = ?, UPDATED_AT = ?
             WHERE ID = ? AND STATUS = ?
        """)) {
            int i = 1;
            ps.setString(i++, e.status().code());
            ps.setTimestamp(i++, ts(e.startedAt()));
            ps.setTimestamp(i++, ts(e.completedAt()));
            setNullableLong(ps, i++, e.durationMs());
            ps.setString(i++, json.write(e.result()));
            ps.setString(i++, e.errorMessage());
            ps.setString(i++, e.errorStack());
            ps.setTimestamp(i++, ts(e.nextRetryAt()));
            ps.setString(i++, e.workerId());
            ps.setTimestamp(i++, ts(e.dispatchedAt()));
            ps.setString(i++, e.spanId());
            ps.setString(i++, e.parentSpanId());
            ps.setTimestamp(i++, ts(e.updatedAt() == null ? clock.now() : e.updatedAt()));
            ps.setString(i++, e.id());
            ps.setString(i, expected.code());
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public boolean markDispatched(String executionId, Instant at) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            UPDATE TB_JOB_EXECUTION
               SET DISPATCHED_AT = ?, UPDATED_AT = ?
             WHERE ID = ? AND DISPATCHED_AT IS NULL
        """)) {
            ps.setTimestamp(1, ts(at));
            ps.setTimestamp(2, ts(at));
            ps.setString(3, executionId);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public List<JobExecution> listExecutions(String jobId, ExecutionQuery q) throws Exception {
        Connection c = mustConn();
        List<Object> args = new ArrayList<>();
        StringBuilder sql = new StringBuilder("SELECT * FROM TB_JOB_EXECUTION WHERE JOB_ID = ?");
        args.add(jobId);
        if (!q.statuses().isEmpty()) {
            sql.append(" AND STATUS IN (").append(marks(q.statuses().size())).append(')');
            q.statuses().forEach(s -> args.add(s.code()));
        }
        if (q.since() != null) { sql.append(" AND SCHEDULED_AT >= ?"); args.add(ts(q.since())); }
        if (q.until() != null) { sql.append(" AND SCHEDULED_AT < ?"); args.add(ts(q.until())); }
        String dir = q.ascending() ? " ASC" : " DESC";
        sql.append(" ORDER BY SCHEDULED_AT").append(dir)
                .append(", CREATED_AT").append(dir)
                .append(", RETRY_COUNT").append(dir)
                .append(" OFFSET ? ROWS FETCH NEXT ? ROWS ONLY");
        args.add(q.offset());
        args.add(q.limit());

        List<JobExecution> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(sql.toString())) {
            bind(ps, args);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(RowMappers.toExecution(rs, json));
            }
        }
        return out;
    }

    @Override
    public int countActiveExecutions(String jobId) throws Exception {
        return count("""
            SELECT COUNT(*) FROM TB_JOB_EXECUTION
             WHERE JOB_ID = ? AND STATUS IN ('pending', 'running')
        """, jobId);
    }

    @Override
    public int countOccurrences(String jobId) throws Exception {
        return count("""
            SELECT COUNT(*) FROM TB_JOB_EXECUTION
             WHERE JOB_ID = ? AND RETRY_COUNT = 0 AND MANUAL_RETRY = 'N' AND STATUS <> 'skipped'
        """, jobId);
    }

    @Override
    public List<JobExecution> findUndispatched(Instant scheduledBefore, int limit) throws Exception {
        return executions("""
            SELECT * FROM TB_JOB_EXECUTION
             WHERE STATUS = 'pending' AND DISPATCHED_AT IS NULL AND SCHEDULED_AT <= ?
             ORDER BY SCHEDULED_AT ASC
             FETCH FIRST ? ROWS ONLY
        """, scheduledBefore, limit);
    }

    @Override
    public List<JobExecution> findRunningStartedBefore(Instant startedBefore, int limit) throws Exception {
        return executions("""
            SELECT * FROM TB_JOB_EXECUTION
             WHERE STATUS = 'running' AND STARTED_AT < ?
             ORDER BY STARTED_AT ASC
             FETCH FIRST ? ROWS ONLY
        """, startedBefore, limit);
    }

    @Override
    public List<JobExecution> findPendingDispatchedBefore(Instant before, int limit) throws Exception {
        return executions("""
            SELECT * FROM TB_JOB_EXECUTION
             WHERE STATUS = 'pending' AND DISPATCHED_AT < ? AND SCHEDULED_AT < ?
             ORDER BY DISPATCHED_AT ASC
             FETCH FIRST ? ROWS ONLY
        """, before, before, limit);
    }

    @Override
    public Map<Job.Status, Long> countJobsByStatus() throws Exception {
        Map<Job.Status, Long> out = new EnumMap<>(Job.Status.class);
        for (Map.Entry<String, Long> e : groupCounts("SELECT STATUS, COUNT(*) FROM TB_JOB GROUP BY STATUS").entrySet()) {
            out.put(Job.Status.from(e.getKey()), e.getValue());
        }
        return out;
    }

    @Override
    public Map<JobExecution.Status, Long> countExecutionsByStatus() throws Exception {
        Map<JobExecution.Status, Long> out = new EnumMap<>(JobExecution.Status.class);
        for (Map.Entry<String, Long> e : groupCounts("SELECT STATUS, COUNT(*) FROM TB_JOB_EXECUTION GROUP BY STATUS").entrySet()) {
            out.put(JobExecution.Status.from(e.getKey()), e.getValue());
        }
        return out;
    }

    // ---------------------------------------------------------------- helpers

    private int count(String sql, String jobId) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            ps.setString(1, jobId);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return rs.getInt(1);
            }
        }
    }

    private List<JobExecution> executions(String sql, Instant before, int limit) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            ps.setTimestamp(1, ts(before));
            ps.setInt(2, limit);
            return executions(ps);
        }
    }

    private List<JobExecution> executions(String sql, Instant before, Instant alsoBefore, int limit) throws SQLException {
        try (PreparedStatement ps = mustConn().prepareStatement(sql)) {
            ps.setTimestamp(1, ts(before));
            ps.setTimestamp(2, ts(alsoBefore));
            ps.setInt(3, limit);
            return executions(ps);
        }
    }

    private List<JobExecution> executions(PreparedStatement ps) throws SQLException {
        List<JobExecution> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toExecution(rs, json));
        }
        return out;
    }

    private Map<String, Long> groupCounts(String sql) throws SQLException {
        Map<String, Long> out = new LinkedHashMap<>();
        try (PreparedStatement ps = mustConn().prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.put(rs.getString(1), rs.getLong(2));
        }
        return out;
    }

    private static String sortColumn(JobFilter.SortBy sortBy) {
        switch (sortBy) {
            case NEXT_RUN: return "NEXT_RUN";
            case NAME: return "NAME";
            case PRIORITY: return "PRIORITY";
            default: return "CREATED_AT";
        }
    }

    static String marks(int n) {
        return String.join(", ", Collections.nCopies(n, "?"));
    }

    private static String likeEscape(String s) {
        return s.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    static void bind(PreparedStatement ps, Collection<Object> args) throws SQLException {
        int i = 1;
        for (Object a : args) {
            // only timestamps are ever bound as null
            if (a == null) ps.setNull(i++, Types.TIMESTAMP); else ps.setObject(i++, a);
        }
    }
}
