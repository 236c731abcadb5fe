package net.tickwork.core.spi;

import net.tickwork.core.model.IdempotencyRecord;

import java.time.Duration;
import java.util.Optional;

/** Keyed markers with expiry. {@link #tryBegin} must be an atomic check-and-set. */
public interface IdempotencyStore {
    /** Sets {@code key} to in_progress if absent or expired. Returns false when a live record exists. */
    boolean tryBegin(String key, Duration ttl) throws Exception;

    /** Marks {@code key} done with a snapshot of the outcome, renewing its expiry. */
    void complete(String key, Object result, Duration ttl) throws Exception;

    /** Drops the marker so the work can be attempted again. */
    void release(String key) throws Exception;

    /** Live (unexpired) record for the key. */
    Optional<IdempotencyRecord> find(String key) throws Exception;

    int purgeExpired() throws Exception;
}
