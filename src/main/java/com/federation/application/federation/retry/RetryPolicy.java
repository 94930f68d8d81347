package com.federation.application.federation.retry;

import java.time.Duration;

/**
 * Attempt budget for establishing something remote. Attempt {@code n} (1-based) gets the shrinking timeout
 * {@code max(minTimeout, initialTimeout - timeoutStep * (n - 1))}, so the first attempt has the full initial
 * timeout, and failed attempts are spaced by {@code backoff}.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialTimeout,
    Duration timeoutStep,
    Duration minTimeout,
    ExponentialBackoff backoff
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
    }

    public Duration timeoutFor(int attemptNumber) {
        Duration shrunk = initialTimeout.minus(timeoutStep.multipliedBy(attemptNumber - 1L));
        return shrunk.compareTo(minTimeout) < 0 ? minTimeout : shrunk;
    }
}
