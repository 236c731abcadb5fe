package net.tickwork.core.spi;

import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.Envelope;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Two delivery modes: fire-and-forget pub/sub to in-process subscribers, and, when a publish is
 * mirrored, a durable stream consumed through named consumer groups with competing consumers and
 * explicit acknowledgement.
 */
public interface MessageBus {
    void publish(String topic, Envelope envelope, PublishOptions options) throws TransportException;

    default void publish(String topic, Envelope envelope) throws TransportException {
        publish(topic, envelope, PublishOptions.none());
    }

    Subscription subscribe(String topic, MessageListener listener) throws TransportException;

    /** Idempotent. A new group starts from the beginning of the stream. */
    void createGroup(String stream, String group) throws TransportException;

    /**
     * Up to {@code max} visible messages for {@code consumer}, waiting at most {@code wait} for the
     * first one.
     */
    List<Delivery> receive(String stream, String group, String consumer, int max, Duration wait)
            throws TransportException, InterruptedException;

    /** Drops stream history created before {@code before} that no group still has to consume. */
    int purgeConsumed(Instant before) throws TransportException;

    BusHealth health();

    record BusHealth(boolean up, String detail) {
        public static BusHealth up(String detail) { return new BusHealth(true, detail); }
        public static BusHealth down(String detail) { return new BusHealth(false, detail); }
    }
}
