package net.tickwork.adapter.jdbc.repo;

import net.tickwork.adapter.jdbc.JdbcUtil;
import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.adapter.jdbc.mapper.RowMappers;
import net.tickwork.core.model.IdempotencyRecord;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.IdempotencyStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static net.tickwork.adapter.jdbc.JdbcUtil.ts;
import static net.tickwork.adapter.jdbc.TxContext.mustConn;

/**
 * Markers keyed by the primary key of {@code TB_IDEMPOTENCY}. A concurrent {@link #tryBegin} loses
 * on the unique constraint; the insert runs under a savepoint so the loser's transaction stays usable.
 */
public final class JdbcIdempotencyStore implements IdempotencyStore {
    private final JsonCodec json;
    private final Clock clock;

    public JdbcIdempotencyStore(JsonCodec json, Clock clock) {
        this.json = json;
        this.clock = clock;
    }

    @Override
    public boolean tryBegin(String key, Duration ttl) throws Exception {
        Connection c = mustConn();
        Instant now = clock.now();
        try (PreparedStatement del = c.prepareStatement(
                "DELETE FROM TB_IDEMPOTENCY WHERE IDEMPOTENCY_KEY = ? AND EXPIRES_AT <= ?")) {
            del.setString(1, key);
            del.setTimestamp(2, ts(now));
            del.executeUpdate();
        }
        Savepoint sp = c.setSavepoint();
        try (PreparedStatement ins = c.prepareStatement("""
            INSERT INTO TB_IDEMPOTENCY (IDEMPOTENCY_KEY, STATUS, RESULT_JSON, EXPIRES_AT, CREATED_AT)
            VALUES (?, ?, NULL, ?, ?)
        """)) {
            ins.setString(1, key);
            ins.setString(2, IdempotencyRecord.Status.IN_PROGRESS.code());
            ins.setTimestamp(3, ts(now.plus(ttl)));
            ins.setTimestamp(4, ts(now));
            ins.executeUpdate();
            c.releaseSavepoint(sp);
            return true;
        } catch (SQLException e) {
            if (!JdbcUtil.isConstraintViolation(e)) throw e;
            c.rollback(sp);
            return false;
        }
    }

    @Override
    public void complete(String key, Object result, Duration ttl) throws Exception {
        Connection c = mustConn();
        Instant now = clock.now();
        try (PreparedStatement upd = c.prepareStatement("""
            UPDATE TB_IDEMPOTENCY
               SET STATUS = ?, RESULT_JSON = ?, EXPIRES_AT = ?
             WHERE IDEMPOTENCY_KEY = ?
        """)) {
            upd.setString(1, IdempotencyRecord.Status.DONE.code());
            upd.setString(2, json.write(result));
            upd.setTimestamp(3, ts(now.plus(ttl)));
            upd.setString(4, key);
            if (upd.executeUpdate() == 1) return;
        }
        try (PreparedStatement ins = c.prepareStatement("""
            INSERT INTO TB_IDEMPOTENCY (IDEMPOTENCY_KEY, STATUS, RESULT_JSON, EXPIRES_AT, CREATED_AT)
            VALUES (?, ?, ?, ?, ?)
        """)) {
            ins.setString(1, key);
            ins.setString(2, IdempotencyRecord.Status.DONE.code());
            ins.setString(3, json.write(result));
            ins.setTimestamp(4, ts(now.plus(ttl)));
            ins.setTimestamp(5, ts(now));
            ins.executeUpdate();
        }
    }

    @Override
    public void release(String key) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_IDEMPOTENCY WHERE IDEMPOTENCY_KEY = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_IDEMPOTENCY WHERE IDEMPOTENCY_KEY = ? AND EXPIRES_AT > ?")) {
            ps.setString(1, key);
            ps.setTimestamp(2, ts(clock.now()));
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toIdempotency(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public int purgeExpired() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_IDEMPOTENCY WHERE EXPIRES_AT <= ?")) {
            ps.setTimestamp(1, ts(clock.now()));
            return ps.executeUpdate();
        }
    }
}
