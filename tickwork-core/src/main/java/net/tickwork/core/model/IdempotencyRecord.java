package net.tickwork.core.model;

import java.time.Instant;
import java.util.Locale;

public record IdempotencyRecord(
        String key,
        Status status,
        Object result,
        Instant expiresAt,
        Instant createdAt
) {
    public enum Status {
        IN_PROGRESS, DONE;

        public static Status from(String s) {
            if (s == null) return null;
            return Status.valueOf(s.toUpperCase(Locale.ROOT));
        }
        public String code() { return name().toLowerCase(Locale.ROOT); }
    }

    public boolean isExpired(Instant now) { return !expiresAt.isAfter(now); }
}
