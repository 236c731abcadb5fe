package net.tickwork.core.memory;

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

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * Process-local {@link MessageBus}. Pub/sub listeners run on the given executor; stream messages
 * are kept in a log per stream until {@link #purgeConsumed} drops the ones every group has
 * acknowledged, and each consumer group tracks its own unacknowledged slots with a visibility deadline.
 */
public final class InMemoryMessageBus implements MessageBus, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(InMemoryMessageBus.class);

    private static final long WAIT_SLICE_MS = 50;

    private final Clock clock;
    private final Duration visibilityTimeout;
    private final Executor listenerExecutor;

    private final Map<String, List<MessageListener>> topics = new ConcurrentHashMap<>();

    private final Object lock = new Object();
    private final Map<String, List<StreamEntry>> streams = new HashMap<>();
    private final Map<String, Map<String, List<Slot>>> groups = new HashMap<>();
    private long sequence;

    private volatile boolean closed;

    public InMemoryMessageBus(Clock clock, Duration visibilityTimeout) {
        this(clock, visibilityTimeout, Runnable::run);
    }

    public InMemoryMessageBus(Clock clock, Duration visibilityTimeout, Executor listenerExecutor) {
        this.clock = clock;
        this.visibilityTimeout = visibilityTimeout;
        this.listenerExecutor = listenerExecutor;
    }

    private record StreamEntry(long sequence, Envelope envelope, Instant availableAt, Instant createdAt) {}

    private static final class Slot {
        final StreamEntry entry;
        Instant visibleAt;
        int deliveryCount;
        String receipt;
        String consumer;

        Slot(StreamEntry entry) {
            this.entry = entry;
            this.visibleAt = entry.availableAt();
        }
    }

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

    private void append(String stream, Envelope envelope, Instant deliverAt) {
        synchronized (lock) {
            Instant now = clock.now();
            Instant availableAt = deliverAt == null ? now : deliverAt;
            StreamEntry entry = new StreamEntry(++sequence, envelope, availableAt, now);
            streams.computeIfAbsent(stream, s -> new ArrayList<>()).add(entry);
            for (List<Slot> slots : groups.getOrDefault(stream, Map.of()).values()) slots.add(new Slot(entry));
            lock.notifyAll();
        }
    }

    @Override
    public Subscription subscribe(String topic, MessageListener listener) throws TransportException {
        ensureOpen(topic);
        List<MessageListener> listeners = topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @Override
    public void createGroup(String stream, String group) throws TransportException {
        ensureOpen(stream);
        synchronized (lock) {
            Map<String, List<Slot>> byName = groups.computeIfAbsent(stream, s -> new LinkedHashMap<>());
            if (byName.containsKey(group)) return;
            List<Slot> slots = new ArrayList<>();
            for (StreamEntry e : streams.getOrDefault(stream, List.of())) slots.add(new Slot(e));
            byName.put(group, slots);
            log.debug("Consumer group '{}' created on '{}' with {} backlog message(s)", group, stream, slots.size());
        }
    }

    @Override
    public List<Delivery> receive(String stream, String group, String consumer, int max, Duration wait)
            throws TransportException, InterruptedException {
        long deadline = System.nanoTime() + (wait == null ? 0 : wait.toNanos());
        synchronized (lock) {
            while (true) {
                ensureOpen(stream);
                List<Slot> slots = groups.getOrDefault(stream, Map.of()).get(group);
                if (slots == null) {
                    throw new TransportException("no consumer group '" + group + "' on stream", stream, null);
                }
                List<Delivery> out = claim(slots, consumer, max);
                if (!out.isEmpty()) return out;

                long remainingMs = TimeUnit.NANOSECONDS.toMillis(deadline - System.nanoTime());
                if (remainingMs <= 0) return List.of();
                lock.wait(Math.min(WAIT_SLICE_MS, remainingMs));
            }
        }
    }

    private List<Delivery> claim(List<Slot> slots, String consumer, int max) {
        Instant now = clock.now();
        List<Delivery> out = new ArrayList<>();
        for (Slot s : slots) {
            if (out.size() >= max) break;
            if (s.visibleAt.isAfter(now)) continue;
            s.deliveryCount++;
            s.receipt = UUID.randomUUID().toString();
            s.consumer = consumer;
            s.visibleAt = now.plus(visibilityTimeout);
            out.add(new SlotDelivery(slots, s, s.receipt, s.entry.envelope().withAttempts(s.deliveryCount), s.deliveryCount));
        }
        return out;
    }

    private final class SlotDelivery implements Delivery {
        private final List<Slot> slots;
        private final Slot slot;
        private final String receipt;
        private final Envelope envelope;
        private final int deliveryCount;

        SlotDelivery(List<Slot> slots, Slot slot, String receipt, Envelope envelope, int deliveryCount) {
            this.slots = slots;
            this.slot = slot;
            this.receipt = receipt;
            this.envelope = envelope;
            this.deliveryCount = deliveryCount;
        }

        @Override public Envelope envelope() { return envelope; }
        @Override public int deliveryCount() { return deliveryCount; }

        @Override
        public void ack() {
            synchronized (lock) {
                // a receipt is stale once the slot was redelivered to someone else
                if (!receipt.equals(slot.receipt)) return;
                slots.remove(slot);
            }
        }

        @Override
        public void nack(Duration redeliverAfter) {
            synchronized (lock) {
                if (!receipt.equals(slot.receipt)) return;
                slot.receipt = null;
                slot.consumer = null;
                slot.visibleAt = clock.now().plus(redeliverAfter == null ? Duration.ZERO : redeliverAfter);
                lock.notifyAll();
            }
        }
    }

    @Override
    public int purgeConsumed(Instant before) {
        int purged = 0;
        synchronized (lock) {
            for (Map.Entry<String, List<StreamEntry>> stream : streams.entrySet()) {
                Set<Long> owed = new HashSet<>();
                for (List<Slot> slots : groups.getOrDefault(stream.getKey(), Map.of()).values()) {
                    for (Slot s : slots) owed.add(s.entry.sequence());
                }
                Iterator<StreamEntry> it = stream.getValue().iterator();
                while (it.hasNext()) {
                    StreamEntry e = it.next();
                    if (e.createdAt().isBefore(before) && !owed.contains(e.sequence())) {
                        it.remove();
                        purged++;
                    }
                }
            }
        }
        if (purged > 0) log.debug("Purged {} consumed stream message(s) created before {}", purged, before);
        return purged;
    }

    /** Unacknowledged messages of a group, in flight or waiting. */
    public int pendingCount(String stream, String group) {
        synchronized (lock) {
            List<Slot> slots = groups.getOrDefault(stream, Map.of()).get(group);
            return slots == null ? 0 : slots.size();
        }
    }

    /** The full replay log of a stream, oldest first. */
    public List<Envelope> readStream(String stream) {
        synchronized (lock) {
            List<Envelope> out = new ArrayList<>();
            for (StreamEntry e : streams.getOrDefault(stream, List.of())) out.add(e.envelope());
            return out;
        }
    }

    @Override
    public BusHealth health() {
        if (closed) return BusHealth.down("closed");
        synchronized (lock) {
            return BusHealth.up("in-memory: " + topics.size() + " topic(s), " + streams.size() + " stream(s)");
        }
    }

    @Override
    public void close() {
        closed = true;
        synchronized (lock) {
            lock.notifyAll();
        }
    }

    private void ensureOpen(String topic) {
        if (closed) throw new TransportException("message bus is closed", topic, null);
    }
}
