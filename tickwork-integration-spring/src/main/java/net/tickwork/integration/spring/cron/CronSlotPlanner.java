package net.tickwork.integration.spring.cron;

import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * cron-utils slot arithmetic with a small LRU of parsed expressions.
 * The field count picks the dialect: 5 fields Unix (minute precision), 6 fields Spring
 * (leading seconds), 7 fields Quartz (trailing year).
 */
public final class CronSlotPlanner {
    private static final CronParser UNIX =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));
    private static final CronParser SECONDS =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.SPRING));
    private static final CronParser QUARTZ =
            new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    private static final Map<String, ExecutionTime> CACHE = new LruMap<>(256);

    private CronSlotPlanner() {}

    public static SlotInfo compute(String cronExpr, ZoneId zone, Instant now) {
        Objects.requireNonNull(zone); Objects.requireNonNull(now);
        ExecutionTime et = executionTime(cronExpr);

        var base = now.atZone(zone);
        var next = et.nextExecution(base)
                .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] after " + base));
        // cron-utils may answer the base itself when it sits exactly on a slot
        if (!next.toInstant().isAfter(now)) {
            next = et.nextExecution(next)
                    .orElseThrow(() -> new IllegalStateException("No next execution for [" + cronExpr + "] after " + base));
        }
        Instant slotStart = latestAtOrBefore(et, base).orElse(null);
        return new SlotInfo(slotStart, next.toInstant());
    }

    public static Optional<Instant> previous(String cronExpr, ZoneId zone, Instant at) {
        Objects.requireNonNull(zone); Objects.requireNonNull(at);
        return latestAtOrBefore(executionTime(cronExpr), at.atZone(zone));
    }

    /** Parses without evaluating. Throws {@link IllegalArgumentException} on a malformed expression. */
    public static void validate(String cronExpr) {
        executionTime(cronExpr);
    }

    public static void invalidate(String expr) { synchronized (CACHE) { CACHE.remove(normalize(expr)); } }
    public static void invalidateAll() { synchronized (CACHE) { CACHE.clear(); } }

    private static Optional<Instant> latestAtOrBefore(ExecutionTime et, ZonedDateTime base) {
        // lastExecution is strictly before its argument
        var upper = base.truncatedTo(ChronoUnit.SECONDS).plusSeconds(1);
        return et.lastExecution(upper).map(ZonedDateTime::toInstant);
    }

    private static ExecutionTime executionTime(String cronExpr) {
        String expr = normalize(cronExpr);
        synchronized (CACHE) {
            ExecutionTime cached = CACHE.get(expr);
            if (cached != null) return cached;
        }
        ExecutionTime et = ExecutionTime.forCron(parserFor(expr).parse(expr));
        synchronized (CACHE) {
            CACHE.put(expr, et);
        }
        return et;
    }

    private static CronParser parserFor(String expr) {
        int fields = expr.split(" ").length;
        switch (fields) {
            case 5:
                return UNIX;
            case 6:
                return SECONDS;
            case 7:
                return QUARTZ;
            default:
                throw new IllegalArgumentException("expected 5, 6 or 7 fields but got " + fields);
        }
    }

    private static String normalize(String expr) {
        if (expr == null || expr.isBlank()) throw new IllegalArgumentException("cron expression is empty");
        return expr.trim().replaceAll("\\s+", " ");
    }

    /** {@code slotStartUtc} is the latest occurrence at or before the base instant, if any. */
    public record SlotInfo(Instant slotStartUtc, Instant nextUtc) {
        public String key(String ns) { return ns + ":" + slotStartUtc; }
    }

    private static final class LruMap<K, V> extends LinkedHashMap<K, V> {
        private final int max;
        LruMap(int max) { super(16, 0.75f, true); this.max = max; }
        @Override protected boolean removeEldestEntry(Map.Entry<K, V> eldest) { return size() > max; }
    }
}
