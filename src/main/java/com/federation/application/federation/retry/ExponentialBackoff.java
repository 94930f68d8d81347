package com.federation.application.federation.retry;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Delay before retry number {@code n} (1-based): {@code min(base * 2^(n-1), cap)}, spread by
 * {@code ±jitter} of the computed value and never above {@code cap}.
 */
public final class ExponentialBackoff {

    private final Duration base;
    private final Duration cap;
    private final double jitter;
    private final DoubleSupplier random;

    public ExponentialBackoff(Duration base, Duration cap, double jitter) {
        this(base, cap, jitter, () -> ThreadLocalRandom.current().nextDouble());
    }

    ExponentialBackoff(Duration base, Duration cap, double jitter, DoubleSupplier random) {
        if (base.isNegative() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Backoff requires 0 <= base <= cap, was base=" + base + " cap=" + cap);
        }
        if (jitter < 0.0 || jitter > 1.0) {
            throw new IllegalArgumentException("Jitter must be within [0, 1], was " + jitter);
        }
        this.base = base;
        this.cap = cap;
        this.jitter = jitter;
        this.random = random;
    }

    public Duration delayFor(int attempt) {
        int n = Math.max(attempt, 1);
        // 2^30 already exceeds any sane cap expressed in millis
        long factor = 1L << Math.min(n - 1, 30);
        long raw = Math.min(saturatedMultiply(base.toMillis(), factor), cap.toMillis());
        if (jitter == 0.0 || raw == 0) {
            return Duration.ofMillis(raw);
        }
        double spread = (random.getAsDouble() * 2.0 - 1.0) * jitter;
        long jittered = Math.round(raw * (1.0 + spread));
        return Duration.ofMillis(Math.max(0, Math.min(jittered, cap.toMillis())));
    }

    public Duration base() {
        return base;
    }

    public Duration cap() {
        return cap;
    }

    private static long saturatedMultiply(long a, long b) {
        long hi = Math.multiplyHigh(a, b);
        long lo = a * b;
        if ((hi == 0 && lo >= 0) || (hi == -1 && lo < 0)) {
            return lo;
        }
        return Long.MAX_VALUE;
    }
}
