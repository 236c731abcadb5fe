package net.tickwork.core.service;

import java.time.Duration;

public interface RetryPolicy {
    /** Delay before attempt {@code attempt + 1}, where 0 is the original attempt. */
    Duration nextBackoff(long attempt);

    static RetryPolicy exponential(Duration base, Duration max, double jitterFactor) {
        return new ExponentialBackoff(base.toMillis(), max.toMillis(), jitterFactor);
    }
}
