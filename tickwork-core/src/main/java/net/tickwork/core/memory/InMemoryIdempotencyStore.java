package net.tickwork.core.memory;

import net.tickwork.core.model.IdempotencyRecord;
import net.tickwork.core.spi.Clock;
import net.tickwork.core.spi.IdempotencyStore;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

public final class InMemoryIdempotencyStore implements IdempotencyStore {
    private final ConcurrentMap<String, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryIdempotencyStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean tryBegin(String key, Duration ttl) {
        Instant now = clock.now();
        AtomicBoolean won = new AtomicBoolean(false);
        records.compute(key, (k, existing) -> {
            if (existing != null && !existing.isExpired(now)) return existing;
            won.set(true);
            return new IdempotencyRecord(k, IdempotencyRecord.Status.IN_PROGRESS, null, now.plus(ttl), now);
        });
        return won.get();
    }

    @Override
    public void complete(String key, Object result, Duration ttl) {
        Instant now = clock.now();
        records.compute(key, (k, existing) -> new IdempotencyRecord(k, IdempotencyRecord.Status.DONE, result,
                now.plus(ttl), existing == null ? now : existing.createdAt()));
    }

    @Override
    public void release(String key) {
        records.remove(key);
    }

    @Override
    public Optional<IdempotencyRecord> find(String key) {
        IdempotencyRecord r = records.get(key);
        if (r == null || r.isExpired(clock.now())) return Optional.empty();
        return Optional.of(r);
    }

    @Override
    public int purgeExpired() {
        Instant now = clock.now();
        int before = records.size();
        records.values().removeIf(r -> r.isExpired(now));
        return Math.max(0, before - records.size());
    }
}
