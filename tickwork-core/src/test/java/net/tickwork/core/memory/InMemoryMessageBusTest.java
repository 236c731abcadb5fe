package net.tickwork.core.memory;

import net.tickwork.core.MutableClock;
import net.tickwork.core.error.TransportException;
import net.tickwork.core.model.Envelope;
import net.tickwork.core.spi.Delivery;
import net.tickwork.core.spi.MessageBus;
import net.tickwork.core.spi.PublishOptions;
import net.tickwork.core.spi.Subscription;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class InMemoryMessageBusTest {
    static final String STREAM = "stream:test";
    static final String GROUP = "workers";

    MutableClock clock;
    InMemoryMessageBus bus;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-02-01T12:00:00Z"));
        bus = new InMemoryMessageBus(clock, Duration.ofMinutes(5));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    private Envelope msg(String n) {
        return Envelope.of("test.msg", Map.of("n", n), clock.now());
    }

    @Test
    void pubSub_reachesEverySubscriber_untilUnsubscribed() {
        List<String> a = new CopyOnWriteArrayList<>();
        List<String> b = new CopyOnWriteArrayList<>();
        Subscription sa = bus.subscribe("topic", e -> a.add(e.string("n")));
        bus.subscribe("topic", e -> b.add(e.string("n")));

        bus.publish("topic", msg("1"));
        sa.unsubscribe();
        bus.publish("topic", msg("2"));

        assertEquals(List.of("1"), a);
        assertEquals(List.of("1", "2"), b);
    }

    @Test
    void failingSubscriber_doesNotBreakOthers() {
        List<String> seen = new CopyOnWriteArrayList<>();
        bus.subscribe("topic", e -> { throw new IllegalStateException("bad listener"); });
        bus.subscribe("topic", e -> seen.add(e.id()));

        bus.publish("topic", msg("1"));

        assertEquals(1, seen.size());
    }

    @Test
    void plainPublish_isNotMirrored() throws Exception {
        bus.createGroup(STREAM, GROUP);
        bus.publish("topic", msg("1"));

        assertTrue(bus.receive(STREAM, GROUP, "c1", 10, Duration.ZERO).isEmpty());
        assertTrue(bus.readStream(STREAM).isEmpty());
    }

    @Test
    void competingConsumers_eachMessageGoesToOne() throws Exception {
        bus.createGroup(STREAM, GROUP);
        for (int i = 0; i < 4; i++) bus.publish("topic", msg("m" + i), PublishOptions.mirrorTo(STREAM));

        List<Delivery> c1 = bus.receive(STREAM, GROUP, "c1", 3, Duration.ZERO);
        List<Delivery> c2 = bus.receive(STREAM, GROUP, "c2", 3, Duration.ZERO);

        assertEquals(3, c1.size());
        assertEquals(1, c2.size());
        assertEquals("m3", c2.get(0).envelope().string("n"));
        assertTrue(bus.receive(STREAM, GROUP, "c3", 3, Duration.ZERO).isEmpty());
    }

    @Test
    void eachGroup_getsItsOwnCopy_andNewGroupsStartFromTheBeginning() throws Exception {
        bus.createGroup(STREAM, "g1");
        bus.publish("topic", msg("early"), PublishOptions.mirrorTo(STREAM));
        bus.createGroup(STREAM, "g2");
        bus.createGroup(STREAM, "g2");

        assertEquals(1, bus.receive(STREAM, "g1", "c", 10, Duration.ZERO).size());
        assertEquals(1, bus.receive(STREAM, "g2", "c", 10, Duration.ZERO).size());
    }

    @Test
    void unacknowledged_isRedeliveredAfterVisibilityWindow() throws Exception {
        bus.createGroup(STREAM, GROUP);
        bus.publish("topic", msg("x"), PublishOptions.mirrorTo(STREAM));

        Delivery first = bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).get(0);
        assertEquals(1, first.deliveryCount());

        clock.advance(Duration.ofMinutes(4));
        assertTrue(bus.receive(STREAM, GROUP, "c2", 1, Duration.ZERO).isEmpty());

        clock.advance(Duration.ofMinutes(2));
        Delivery second = bus.receive(STREAM, GROUP, "c2", 1, Duration.ZERO).get(0);
        assertEquals(2, second.deliveryCount());
        assertEquals(first.envelope().id(), second.envelope().id());
        assertEquals(2, second.envelope().attempts());

        // the first consumer's late ack no longer counts
        first.ack();
        assertEquals(1, bus.pendingCount(STREAM, GROUP));
        second.ack();
        assertEquals(0, bus.pendingCount(STREAM, GROUP));
    }

    @Test
    void nack_makesMessageVisibleAfterDelay() throws Exception {
        bus.createGroup(STREAM, GROUP);
        bus.publish("topic", msg("x"), PublishOptions.mirrorTo(STREAM));

        bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).get(0).nack(Duration.ofSeconds(30));
        assertTrue(bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).isEmpty());

        clock.advance(Duration.ofSeconds(30));
        assertEquals(1, bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).size());
    }

    @Test
    void deliverAt_holdsMessageBack() throws Exception {
        bus.createGroup(STREAM, GROUP);
        bus.publish("topic", msg("later"),
                PublishOptions.mirrorTo(STREAM).deliverAt(clock.now().plus(Duration.ofMinutes(1))));

        assertTrue(bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).isEmpty());
        clock.advance(Duration.ofMinutes(1));
        assertEquals(1, bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).size());
    }

    @Test
    void receive_waitsForAPublishFromAnotherThread() throws Exception {
        bus.createGroup(STREAM, GROUP);
        Thread publisher = new Thread(() -> {
            try {
                Thread.sleep(100);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            bus.publish("topic", msg("late"), PublishOptions.mirrorTo(STREAM));
        });
        publisher.start();

        List<Delivery> got = bus.receive(STREAM, GROUP, "c1", 1, Duration.ofSeconds(5));
        publisher.join();

        assertEquals(1, got.size());
    }

    @Test
    void unknownGroup_isATransportError() {
        TransportException e = assertThrows(TransportException.class,
                () -> bus.receive(STREAM, "nope", "c1", 1, Duration.ZERO));
        assertEquals("TRANSPORT_ERROR", e.code());
    }

    @Test
    void closedBus_rejectsPublish_andReportsDown() {
        bus.close();

        assertThrows(TransportException.class, () -> bus.publish("topic", msg("x")));
        MessageBus.BusHealth health = bus.health();
        assertFalse(health.up());
        assertThat(health.detail()).contains("closed");
    }

    @Test
    void purgeConsumed_dropsAcknowledgedHistoryOnly() throws Exception {
        bus.createGroup(STREAM, GROUP);
        for (int i = 0; i < 1000; i++) {
            bus.publish("topic", msg(String.valueOf(i)), PublishOptions.mirrorTo(STREAM));
        }
        List<Delivery> batch;
        while (!(batch = bus.receive(STREAM, GROUP, "c1", 100, Duration.ZERO)).isEmpty()) {
            batch.forEach(Delivery::ack);
        }
        bus.publish("topic", msg("owed"), PublishOptions.mirrorTo(STREAM));
        // no group reads this stream
        bus.publish("topic", msg("orphan"), PublishOptions.mirrorTo("stream:unread"));

        assertEquals(0, bus.purgeConsumed(clock.now()));

        clock.advance(Duration.ofMinutes(1));
        assertEquals(1001, bus.purgeConsumed(clock.now()));

        assertThat(bus.readStream(STREAM)).extracting(e -> e.string("n")).containsExactly("owed");
        assertThat(bus.readStream("stream:unread")).isEmpty();
        assertEquals(1, bus.pendingCount(STREAM, GROUP));
        assertEquals("owed", bus.receive(STREAM, GROUP, "c1", 1, Duration.ZERO).get(0).envelope().string("n"));
    }
}
