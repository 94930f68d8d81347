package com.federation.application.federation.session;

import com.federation.application.federation.retry.ExponentialBackoff;
import com.federation.application.federation.retry.RetryPolicy;

import java.time.Duration;

/**
 * Timing knobs of the session state machine.
 */
public record SessionSettings(
    int maxConnectAttempts,
    Duration connectTimeoutInitial,
    Duration connectTimeoutStep,
    Duration connectTimeoutMin,
    Duration connectBackoffBase,
    Duration connectBackoffCap,
    Duration backgroundRetryInterval,
    Duration healthCheckInterval,
    Duration idleThreshold,
    Duration reconnectBackoffBase,
    Duration reconnectBackoffCap,
    double jitter
) {

    public RetryPolicy connectPolicy() {
        return new RetryPolicy(maxConnectAttempts, connectTimeoutInitial, connectTimeoutStep, connectTimeoutMin,
            new ExponentialBackoff(connectBackoffBase, connectBackoffCap, jitter));
    }

    public ExponentialBackoff reconnectBackoff() {
        return new ExponentialBackoff(reconnectBackoffBase, reconnectBackoffCap, jitter);
    }
}
