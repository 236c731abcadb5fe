package net.tickwork.adapter.jdbc.repo;

import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.adapter.jdbc.mapper.RowMappers;
import net.tickwork.core.model.EventHandler;
import net.tickwork.core.spi.EventHandlerStore;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static net.tickwork.adapter.jdbc.JdbcUtil.ts;
import static net.tickwork.adapter.jdbc.JdbcUtil.yn;
import static net.tickwork.adapter.jdbc.TxContext.mustConn;

public final class JdbcEventHandlerStore implements EventHandlerStore {
    private final JsonCodec json;

    public JdbcEventHandlerStore(JsonCodec json) { this.json = json; }

    @Override
    public EventHandler create(EventHandler h) throws Exception {
        Connection c = mustConn();
        try (PreparedStatement ps = c.prepareStatement("""
            INSERT INTO TB_EVENT_HANDLER (
                ID, EVENT_NAME, HANDLER_NAME, HANDLER_TYPE, ENABLED, PRIORITY, ACTION_TYPE, ACTION_JSON,
                PLATFORM_ID, TRIGGER_COUNT, SUCCESS_COUNT, FAILURE_COUNT, LAST_TRIGGERED, CREATED_AT, UPDATED_AT
            ) VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """)) {
            int i = 1;
            ps.setString(i++, h.id());
            ps.setString(i++, h.eventName());
            ps.setString(i++, h.handlerName());
            ps.setString(i++, h.handlerType().code());
            ps.setString(i++, yn(h.enabled()));
            ps.setInt(i++, h.priority());
            ps.setString(i++, h.action() == null ? null : h.action().type().code());
            ps.setString(i++, h.action() == null ? null : json.write(h.action().config()));
            ps.setString(i++, h.platformId());
            ps.setLong(i++, h.triggerCount());
            ps.setLong(i++, h.successCount());
            ps.setLong(i++, h.failureCount());
            ps.setTimestamp(i++, ts(h.lastTriggered()));
            ps.setTimestamp(i++, ts(h.createdAt()));
            ps.setTimestamp(i, ts(h.updatedAt() == null ? h.createdAt() : h.updatedAt()));
            ps.executeUpdate();
        }
        return get(h.id()).orElseThrow();
    }

    @Override
    public Optional<EventHandler> get(String id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("SELECT * FROM TB_EVENT_HANDLER WHERE ID = ?")) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(RowMappers.toEventHandler(rs, json)) : Optional.empty();
            }
        }
    }

    @Override
    public List<EventHandler> findByEvent(String eventName) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
            SELECT *
              FROM TB_EVENT_HANDLER
             WHERE EVENT_NAME = ?
             ORDER BY PRIORITY DESC, CREATED_AT ASC, ID ASC
        """)) {
            ps.setString(1, eventName);
            return read(ps);
        }
    }

    @Override
    public List<EventHandler> listAll() throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "SELECT * FROM TB_EVENT_HANDLER ORDER BY CREATED_AT ASC, ID ASC")) {
            return read(ps);
        }
    }

    @Override
    public boolean setEnabled(String id, boolean enabled, Instant at) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement(
                "UPDATE TB_EVENT_HANDLER SET ENABLED = ?, UPDATED_AT = ? WHERE ID = ?")) {
            ps.setString(1, yn(enabled));
            ps.setTimestamp(2, ts(at));
            ps.setString(3, id);
            return ps.executeUpdate() == 1;
        }
    }

    @Override
    public void recordTrigger(String id, boolean success, Instant at) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("""
            UPDATE TB_EVENT_HANDLER
               SET TRIGGER_COUNT  = TRIGGER_COUNT + 1,
                   SUCCESS_COUNT  = SUCCESS_COUNT + ?,
                   FAILURE_COUNT  = FAILURE_COUNT + ?,
                   LAST_TRIGGERED = ?,
                   UPDATED_AT     = ?
             WHERE ID = ?
        """)) {
            ps.setInt(1, success ? 1 : 0);
            ps.setInt(2, success ? 0 : 1);
            ps.setTimestamp(3, ts(at));
            ps.setTimestamp(4, ts(at));
            ps.setString(5, id);
            ps.executeUpdate();
        }
    }

    @Override
    public boolean delete(String id) throws Exception {
        try (PreparedStatement ps = mustConn().prepareStatement("DELETE FROM TB_EVENT_HANDLER WHERE ID = ?")) {
            ps.setString(1, id);
            return ps.executeUpdate() == 1;
        }
    }

    private List<EventHandler> read(PreparedStatement ps) throws Exception {
        List<EventHandler> out = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) out.add(RowMappers.toEventHandler(rs, json));
        }
        return out;
    }
}
