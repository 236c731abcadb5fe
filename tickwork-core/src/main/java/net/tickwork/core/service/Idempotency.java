package net.tickwork.core.service;

import net.tickwork.core.model.IdempotencyRecord;
import net.tickwork.core.spi.IdempotencyStore;
import net.tickwork.core.spi.TxRunner;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;

public final class Idempotency {
    private Idempotency() {}

    /**
     * Runs {@code fn} only for the first caller of {@code key} within {@code ttl}. A throwing
     * {@code fn} releases the key so a later caller may try again.
     */
    public static <T> Once<T> once(IdempotencyStore store, String key, Callable<T> fn, Duration ttl) throws Exception {
        return once(store, TxRunner.direct(), key, fn, ttl);
    }

    /** As above, with every marker read and write committed on its own through {@code tx}. */
    public static <T> Once<T> once(IdempotencyStore store, TxRunner tx, String key, Callable<T> fn, Duration ttl)
            throws Exception {
        if (!tx.requiresNew(() -> store.tryBegin(key, ttl))) {
            return Once.alreadyDone(tx.requiresNew(() -> store.find(key)).orElse(null));
        }
        T value;
        try {
            value = fn.call();
        } catch (Exception e) {
            tx.requiresNew(() -> { store.release(key); return null; });
            throw e;
        }
        tx.requiresNew(() -> { store.complete(key, value, ttl); return null; });
        return Once.executed(value);
    }

    /** Either the value produced by this caller, or the marker left by an earlier one. */
    public static final class Once<T> {
        private final boolean executed;
        private final T value;
        private final IdempotencyRecord previous;

        private Once(boolean executed, T value, IdempotencyRecord previous) {
            this.executed = executed;
            this.value = value;
            this.previous = previous;
        }

        static <T> Once<T> executed(T value) { return new Once<>(true, value, null); }

        static <T> Once<T> alreadyDone(IdempotencyRecord previous) { return new Once<>(false, null, previous); }

        public boolean executed() { return executed; }

        public boolean alreadyDone() { return !executed; }

        public T value() { return value; }

        /** Empty when executed, or when the earlier marker expired between the check and the read. */
        public Optional<IdempotencyRecord> previous() { return Optional.ofNullable(previous); }
    }
}
