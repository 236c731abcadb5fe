package net.tickwork.core.spi;

import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

public interface CronCalculator {
    /** First occurrence strictly after {@code from}. */
    Instant next(Instant from, String cronExpr, ZoneId zone);

    /** Latest occurrence at or before {@code from}, if the expression has one. */
    default Optional<Instant> previous(Instant from, String cronExpr, ZoneId zone) {
        return Optional.empty();
    }

    /** Throws {@link IllegalArgumentException} when the expression cannot be parsed. */
    default void validate(String cronExpr) {
        next(Instant.now(), cronExpr, ZoneId.of("UTC"));
    }
}
