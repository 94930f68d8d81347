package com.federation.application.port.out;

import java.time.Duration;
import java.time.Instant;

/**
 * Delayed and periodic task execution for session timers and retries.
 */
public interface TaskTimer {

    Instant now();

    Cancellable schedule(Runnable task, Duration delay);

    Cancellable scheduleAtFixedRate(Runnable task, Duration period);

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
