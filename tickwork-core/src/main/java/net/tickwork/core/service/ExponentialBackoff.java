package net.tickwork.core.service;

import java.time.Duration;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/** {@code min(maxDelay, baseDelay * 2^attempt)}, perturbed by up to {@code ±jitterFactor} of itself. */
public final class ExponentialBackoff implements RetryPolicy {
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    public ExponentialBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        check(baseDelayMs, maxDelayMs, jitterFactor);
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    @Override
    public Duration nextBackoff(long attempt) {
        return Duration.ofMillis(computeBackoff(attempt, baseDelayMs, maxDelayMs, jitterFactor));
    }

    public static long computeBackoff(long attempt, long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return computeBackoff(attempt, baseDelayMs, maxDelayMs, jitterFactor, ThreadLocalRandom.current());
    }

    public static long computeBackoff(long attempt, long baseDelayMs, long maxDelayMs, double jitterFactor, Random random) {
        if (attempt < 0) throw new IllegalArgumentException("attempt must be >= 0: " + attempt);
        check(baseDelayMs, maxDelayMs, jitterFactor);

        long capped = uncappedExceeds(attempt, baseDelayMs, maxDelayMs) ? maxDelayMs : Math.min(maxDelayMs, baseDelayMs << attempt);
        if (jitterFactor == 0.0 || capped == 0) return capped;

        double spread = capped * jitterFactor;
        double jittered = capped + (random.nextDouble() * 2.0 - 1.0) * spread;
        return Math.max(0L, Math.round(jittered));
    }

    // base << attempt would overflow or pass the cap anyway
    private static boolean uncappedExceeds(long attempt, long base, long max) {
        if (base == 0) return false;
        if (attempt >= 62) return true;
        return base > (max >> attempt);
    }

    private static void check(long base, long max, double jitter) {
        if (base < 0) throw new IllegalArgumentException("baseDelayMs must be >= 0: " + base);
        if (max < base) throw new IllegalArgumentException("maxDelayMs must be >= baseDelayMs");
        if (jitter < 0.0 || jitter > 1.0) throw new IllegalArgumentException("jitterFactor must be within [0, 1]: " + jitter);
    }
}
