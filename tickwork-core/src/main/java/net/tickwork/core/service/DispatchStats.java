package net.tickwork.core.service;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

public final class DispatchStats {
    private final AtomicLong ticks = new AtomicLong();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong skipped = new AtomicLong();
    private final AtomicLong completed = new AtomicLong();
    private final AtomicLong redispatched = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();
    private volatile Instant lastTickAt;
    private volatile boolean lastTickTransportFailure;

    void tick(Instant at, boolean transportFailure) {
        ticks.incrementAndGet();
        lastTickAt = at;
        lastTickTransportFailure = transportFailure;
    }
    void dispatched() { dispatched.incrementAndGet(); }
    void skipped() { skipped.incrementAndGet(); }
    void completed() { completed.incrementAndGet(); }
    void redispatched() { redispatched.incrementAndGet(); }
    void error() { errors.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(ticks.get(), dispatched.get(), skipped.get(), completed.get(), redispatched.get(),
                errors.get(), lastTickAt, lastTickTransportFailure);
    }

    public record Snapshot(long ticks, long dispatched, long skipped, long completed, long redispatched,
                           long errors, Instant lastTickAt, boolean lastTickTransportFailure) {
    }
}
