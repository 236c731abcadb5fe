package net.tickwork.core.service;

/** Execution policy applied to jobs created without an explicit value. */
public record JobDefaults(int maxRetries, long retryDelayMs, long timeoutMs, int concurrency) {
    public static JobDefaults standard() {
        return new JobDefaults(3, 60_000L, 300_000L, 1);
    }
}
