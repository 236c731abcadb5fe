package net.tickwork.core.service;

import java.util.concurrent.atomic.AtomicLong;

public final class ConsumerStats {
    private final AtomicLong processed = new AtomicLong();
    private final AtomicLong succeeded = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();
    private final AtomicLong timedOut = new AtomicLong();
    private final AtomicLong retried = new AtomicLong();
    private final AtomicLong duplicates = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    void processed() { processed.incrementAndGet(); }
    void succeeded() { succeeded.incrementAndGet(); }
    void failed() { failed.incrementAndGet(); }
    void timedOut() { timedOut.incrementAndGet(); }
    void retried() { retried.incrementAndGet(); }
    void duplicate() { duplicates.incrementAndGet(); }
    void error() { errors.incrementAndGet(); }

    public Snapshot snapshot() {
        return new Snapshot(processed.get(), succeeded.get(), failed.get(), timedOut.get(), retried.get(),
                duplicates.get(), errors.get());
    }

    public record Snapshot(long processed, long succeeded, long failed, long timedOut, long retried,
                           long duplicates, long errors) {
    }
}
