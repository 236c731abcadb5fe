package net.tickwork.adapter.jdbc.bus;

import net.tickwork.adapter.jdbc.JdbcUtil;
import net.tickwork.adapter.jdbc.JsonCodec;
import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.Envelope;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.Delivery;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.MessageListener;
import net.tickwork.core.spi.PublishOptions;
import net.tickwork.core.spi.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import static net.tickwork.adapter.jdbc.JdbcUtil.ts;

/**
 * {@link MessageBus} whose durable streams live in {@code TB_STREAM_*} tables, so several
 * scheduler nodes sharing a database compete for the same dispatch messages. Each group keeps one
 * delivery row per unacknowledged message; receiving moves its {@code VISIBLE_AT} forward by the
 * visibility window and stamps a fresh receipt handle, acknowledging deletes the row.
 * <p>
 * Pub/sub subscribers are process-local. The bus commits on its own connections and never joins
 * the caller's transaction.
 */
public final class JdbcMessageBus implements MessageBus, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(JdbcMessageBus.class);

    private static final long WAIT_SLICE_MS = 100;

    private final DataSource ds;
    private final JsonCodec json;
    private final Clock clock;
    private final Duration visibilityTimeout;
    private final Executor listenerExecutor;

    private final Map<String, List<MessageListener>> topics = new ConcurrentHashMap<>();
    private final Object signal = new Object();
    private volatile boolean closed;

    public JdbcMessageBus(DataSource ds, JsonCodec json, Clock clock, Duration visibilityTimeout) {
        this(ds, json, clock, visibilityTimeout, Runnable::run);
    }

    public JdbcMessageBus(DataSource ds, JsonCodec json, Clock clock, Duration visibilityTimeout,
                          Executor listenerExecutor) {
        this.ds = ds;
        this.json = json;
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.listenerExecutor = listenerExecutor;
    }

    @FunctionalInterface
    private interface Work<T> {
        T run(Connection c) throws SQLException;
    }

    private <T> T inTx(String topic, Work<T> work) {
        try (Connection c = ds.getConnection()) {
            c.setAutoCommit(false);
            try {
                T r = work.run(c);
                c.commit();
                return r;
            } catch (SQLException | RuntimeException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TransportException("stream storage failed: " + e.getMessage(), topic, e);
        }
    }

    // ---------------------------------------------------------------- pub/sub

    @Override
    public void publish(String topic, Envelope envelope, PublishOptions options) throws TransportException {
        ensureOpen(topic);
        if (options != null && options.mirrorToStream() != null) {
            append(options.mirrorToStream(), envelope, options.deliverAt());
        }
        for (MessageListener l : topics.getOrDefault(topic, List.of())) {
            listenerExecutor.execute(() -> {
                try {
                    l.onMessage(envelope);
                } catch (Exception e) {
                    log.warn("Listener on '{}' failed for message {}: {}", topic, envelope.id(), e.toString());
                }
            });
        }
    }

    @Override
    public Subscription subscribe(String topic, MessageListener listener) throws TransportException {
        ensureOpen(topic);
        List<MessageListener> listeners = topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    // ---------------------------------------------------------------- streams

    private void append(String stream, Envelope envelope, Instant deliverAt) {
        Instant now = clock.now();
        Instant availableAt = deliverAt == null ? now : deliverAt;
        long id = inTx(stream, c -> {
            long messageId;
            try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_STREAM_MESSAGE (STREAM_NAME, ENVELOPE_JSON, AVAILABLE_AT, CREATED_AT)
                VALUES (?, ?, ?, ?)
            """, Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, stream);
                ps.setString(2, json.write(envelope));
                ps.setTimestamp(3, ts(availableAt));
                ps.setTimestamp(4, ts(now));
                ps.executeUpdate();
                try (ResultSet keys = ps.getGeneratedKeys()) {
                    keys.next();
                    messageId = keys.getLong(1);
                }
            }
            try (PreparedStatement ps = c.prepareStatement("""
                INSERT INTO TB_STREAM_DELIVERY (MESSAGE_ID, STREAM_NAME, GROUP_NAME, VISIBLE_AT, DELIVERY_COUNT)
                SELECT ?, STREAM_NAME, GROUP_NAME, ?, 0
                  FROM TB_STREAM_GROUP
                 WHERE STREAM_NAME = ?
            """)) {
                ps.setLong(1, messageId);
                ps.setTimestamp(2, ts(availableAt));
                ps.setString(3, stream);
                ps.executeUpdate();
            }
            return messageId;
        });
        log.trace("Appended message {} ({}) to stream '{}'", id, envelope.id(), stream);
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    @Override
    public void createGroup(String stream, String group) throws TransportException {
        ensureOpen(stream);
        Integer backlog;
        try {
            backlog = inTx(stream, c -> {
                if (groupExists(c, stream, group)) return null;
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO TB_STREAM_GROUP (STREAM_NAME, GROUP_NAME, CREATED_AT) VALUES (?, ?, ?)")) {
                    ps.setString(1, stream);
                    ps.setString(2, group);
                    ps.setTimestamp(3, ts(clock.now()));
                    ps.executeUpdate();
                }
                // a new group starts from the beginning of the stream
                try (PreparedStatement ps = c.prepareStatement("""
                    INSERT INTO TB_STREAM_DELIVERY (MESSAGE_ID, STREAM_NAME, GROUP_NAME, VISIBLE_AT, DELIVERY_COUNT)
                    SELECT ID, STREAM_NAME, ?, AVAILABLE_AT, 0
                      FROM TB_STREAM_MESSAGE
                     WHERE STREAM_NAME = ?
                """)) {
                    ps.setString(1, group);
                    ps.setString(2, stream);
                    return ps.executeUpdate();
                }
            });
        } catch (TransportException e) {
            // another node created the same group concurrently
            if (e.getCause() instanceof SQLException sql && JdbcUtil.isConstraintViolation(sql)) return;
            throw e;
        }
        if (backlog != null) {
            log.debug("Consumer group '{}' created on '{}' with {} backlog message(s)", group, stream, backlog);
        }
    }

    private static boolean groupExists(Connection c, String stream, String group) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT 1 FROM TB_STREAM_GROUP WHERE STREAM_NAME = ? AND GROUP_NAME = ?")) {
            ps.setString(1, stream);
            ps.setString(2, group);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public List<Delivery> receive(String stream, String group, String consumer, int max, Duration wait)
            throws TransportException, InterruptedException {
        long deadline = System.nanoTime() + (wait == null ? 0 : wait.toNanos());
        while (true) {
            ensureOpen(stream);
            List<Delivery> out = claim(stream, group, consumer, max);
            if (!out.isEmpty()) return out;

            long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
            if (remainingMs <= 0) return List.of();
            synchronized (signal) {
                signal.wait(Math.min(WAIT_SLICE_MS, remainingMs));
            }
        }
    }

    private List<Delivery> claim(String stream, String group, String consumer, int max) {
        Instant now = clock.now();
        Instant invisibleUntil = now.plus(visibilityTimeout);
        return inTx(stream, c -> {
            if (!groupExists(c, stream, group)) {
                throw new TransportException("no consumer group '" + group + "' on stream", stream, null);
            }
            List<Long> candidates = new ArrayList<>();
            try (PreparedStatement ps = c.prepareStatement("""
                SELECT MESSAGE_ID
                  FROM TB_STREAM_DELIVERY
                 WHERE STREAM_NAME = ? AND GROUP_NAME = ? AND VISIBLE_AT <= ?
                 ORDER BY MESSAGE_ID
                 FETCH FIRST ? ROWS ONLY
            """)) {
                ps.setString(1, stream);
                ps.setString(2, group);
                ps.setTimestamp(3, ts(now));
                ps.setInt(4, max);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) candidates.add(rs.getLong(1));
                }
            }

            List<Delivery> out = new ArrayList<>();
            for (long messageId : candidates) {
                String receipt = UUID.randomUUID().toString();
                // competing consumers: only the update that still sees the row visible wins it
                try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE TB_STREAM_DELIVERY
                       SET VISIBLE_AT = ?, DELIVERY_COUNT = DELIVERY_COUNT + 1,
                           RECEIPT_HANDLE = ?, CONSUMER_NAME = ?
                     WHERE MESSAGE_ID = ? AND GROUP_NAME = ? AND VISIBLE_AT <= ?
                """)) {
                    ps.setTimestamp(1, ts(invisibleUntil));
                    ps.setString(2, receipt);
                    ps.setString(3, consumer);
                    ps.setLong(4, messageId);
                    ps.setString(5, group);
                    ps.setTimestamp(6, ts(now));
                    if (ps.executeUpdate() != 1) continue;
                }
                try (PreparedStatement ps = c.prepareStatement("""
                    SELECT m.ENVELOPE_JSON, d.DELIVERY_COUNT
                      FROM TB_STREAM_DELIVERY d
                      JOIN TB_STREAM_MESSAGE m ON m.ID = d.MESSAGE_ID
                     WHERE d.MESSAGE_ID = ? AND d.GROUP_NAME = ?
                """)) {
                    ps.setLong(1, messageId);
                    ps.setString(2, group);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) continue;
                        int count = rs.getInt(2);
                        Envelope env = json.read(rs.getString(1), Envelope.class).withAttempts(count);
                        out.add(new RowDelivery(stream, group, messageId, receipt, env, count));
                    }
                }
            }
            return out;
        });
    }

    private final class RowDelivery implements Delivery {
        private final String stream;
        private final String group;
        private final long messageId;
        private final String receipt;
        private final Envelope envelope;
        private final int deliveryCount;

        RowDelivery(String stream, String group, long messageId, String receipt, Envelope envelope, int deliveryCount) {
            this.stream = stream;
            this.group = group;
            this.messageId = messageId;
            this.receipt = receipt;
            this.envelope = envelope;
            this.deliveryCount = deliveryCount;
        }

        @Override public Envelope envelope() { return envelope; }
        @Override public int deliveryCount() { return deliveryCount; }

        @Override
        public void ack() {
            int deleted = inTx(stream, c -> {
                try (PreparedStatement ps = c.prepareStatement("""
                    DELETE FROM TB_STREAM_DELIVERY
                     WHERE MESSAGE_ID = ? AND GROUP_NAME = ? AND RECEIPT_HANDLE = ?
                """)) {
                    ps.setLong(1, messageId);
                    ps.setString(2, group);
                    ps.setString(3, receipt);
                    return ps.executeUpdate();
                }
            });
            // a receipt is stale once the message was redelivered to someone else
            if (deleted == 0) log.debug("Stale ack for message {} in group '{}' ignored", messageId, group);
        }

        @Override
        public void nack(Duration redeliverAfter) {
            Instant visibleAt = clock.now().plus(redeliverAfter == null ? Duration.ZERO : redeliverAfter);
            inTx(stream, c -> {
                try (PreparedStatement ps = c.prepareStatement("""
                    UPDATE TB_STREAM_DELIVERY
                       SET VISIBLE_AT = ?, RECEIPT_HANDLE = NULL, CONSUMER_NAME = NULL
                     WHERE MESSAGE_ID = ? AND GROUP_NAME = ? AND RECEIPT_HANDLE = ?
                """)) {
                    ps.setTimestamp(1, ts(visibleAt));
                    ps.setLong(2, messageId);
                    ps.setString(3, group);
                    ps.setString(4, receipt);
                    return ps.executeUpdate();
                }
            });
            synchronized (signal) {
                signal.notifyAll();
            }
        }
    }

    /** Unacknowledged messages of a group, in flight or waiting. */
    public int pendingCount(String stream, String group) {
        return inTx(stream, c -> {
            try (PreparedStatement ps = c.prepareStatement(
                    "SELECT COUNT(*) FROM TB_STREAM_DELIVERY WHERE STREAM_NAME = ? AND GROUP_NAME = ?")) {
                ps.setString(1, stream);
                ps.setString(2, group);
                try (ResultSet rs = ps.executeQuery()) {
                    rs.next();
                    return rs.getInt(1);
                }
            }
        });
    }

    @Override
    public int purgeConsumed(Instant before) {
        int purged = inTx(null, c -> {
            try (PreparedStatement ps = c.prepareStatement("""
                DELETE FROM TB_STREAM_MESSAGE m
                 WHERE m.CREATED_AT < ?
                   AND NOT EXISTS (SELECT 1 FROM TB_STREAM_DELIVERY d WHERE d.MESSAGE_ID = m.ID)
            """)) {
                ps.setTimestamp(1, ts(before));
                return ps.executeUpdate();
            }
        });
        if (purged > 0) log.debug("Purged {} consumed stream message(s) created before {}", purged, before);
        return purged;
    }

    @Override
    public BusHealth health() {
        if (closed) return BusHealth.down("closed");
        try (Connection c = ds.getConnection()) {
            return c.isValid(2) ? BusHealth.up("jdbc streams") : BusHealth.down("connection not valid");
        } catch (SQLException e) {
            return BusHealth.down(e.getMessage());
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (signal) {
            signal.notifyAll();
        }
    }

    private void ensureOpen(String topic) {
        if (closed) throw new TransportException("message bus is closed", topic, null);
    }
}
