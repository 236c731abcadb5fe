package net.tickwork.core.service;

import net.tickwork.core.MutableClock;
import net.tickwork.core.memory.InMemoryIdempotencyStore;
import net.tickwork.core.model.IdempotencyRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IdempotencyTest {

    MutableClock clock;
    InMemoryIdempotencyStore store;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2026-03-01T00:00:00Z"));
        store = new InMemoryIdempotencyStore(clock);
    }

    @Test
    void secondCallWithinTtl_doesNotInvoke() throws Exception {
        AtomicInteger calls = new AtomicInteger();

        var first = Idempotency.once(store, "exec-1", calls::incrementAndGet, Duration.ofMinutes(10));
        var second = Idempotency.once(store, "exec-1", calls::incrementAndGet, Duration.ofMinutes(10));

        assertTrue(first.executed());
        assertEquals(1, first.value());
        assertTrue(second.alreadyDone());
        assertEquals(1, calls.get());
        assertEquals(IdempotencyRecord.Status.DONE, second.previous().orElseThrow().status());
        assertEquals(1, second.previous().orElseThrow().result());
    }

    @Test
    void expiredMarker_allowsAnotherRun() throws Exception {
        AtomicInteger calls = new AtomicInteger();
        Idempotency.once(store, "k", calls::incrementAndGet, Duration.ofSeconds(30));

        clock.advance(Duration.ofSeconds(31));
        var again = Idempotency.once(store, "k", calls::incrementAndGet, Duration.ofSeconds(30));

        assertTrue(again.executed());
        assertEquals(2, calls.get());
    }

    @Test
    void failingFunction_releasesKey() throws Exception {
        assertThrows(IllegalStateException.class, () -> Idempotency.once(store, "k", () -> {
            throw new IllegalStateException("boom");
        }, Duration.ofMinutes(1)));

        var retry = Idempotency.once(store, "k", () -> "ok", Duration.ofMinutes(1));
        assertTrue(retry.executed());
        assertEquals("ok", retry.value());
    }

    @Test
    void concurrentCallers_exactlyOneRuns() throws Exception {
        int threads = 8;
        AtomicInteger calls = new AtomicInteger();
        CountDownLatch go = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<Boolean> c = () -> {
                    go.await();
                    return Idempotency.once(store, "shared", calls::incrementAndGet, Duration.ofMinutes(1)).executed();
                };
                results.add(pool.submit(c));
            }
            go.countDown();
            int winners = 0;
            for (Future<Boolean> f : results) if (f.get(5, TimeUnit.SECONDS)) winners++;

            assertEquals(1, winners);
            assertEquals(1, calls.get());
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void purgeExpired_dropsOnlyDeadMarkers() throws Exception {
        store.tryBegin("short", Duration.ofSeconds(5));
        store.tryBegin("long", Duration.ofHours(1));
        clock.advance(Duration.ofSeconds(10));

        assertEquals(1, store.purgeExpired());
        assertFalse(store.find("short").isPresent());
        assertTrue(store.find("long").isPresent());
    }
}
