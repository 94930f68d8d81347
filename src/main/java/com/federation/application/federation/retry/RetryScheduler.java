package com.federation.application.federation.retry;

import com.federation.application.port.out.TaskTimer;
import com.federation.application.port.out.TaskTimer.Cancellable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs an attempt on the task timer until it succeeds, the policy's attempts run out, or the token is cancelled.
 * Nothing thrown by an attempt escapes; failures are logged and retried.
 */
public class RetryScheduler {

    private static final Logger log = LoggerFactory.getLogger(RetryScheduler.class);

    private final TaskTimer timer;

    public RetryScheduler(TaskTimer timer) {
        this.timer = timer;
    }

    @FunctionalInterface
    public interface Attempt {
        void run(int attemptNumber, Duration timeout) throws Exception;
    }

    public interface Outcome {
        void succeeded(int attemptNumber);

        void exhausted(Exception lastFailure);
    }

    public void run(String label, RetryPolicy policy, CancellationToken token, Attempt attempt, Outcome outcome) {
        run(label, policy, token, attempt, outcome, Duration.ZERO);
    }

    public void run(String label, RetryPolicy policy, CancellationToken token, Attempt attempt,
                    Outcome outcome, Duration initialDelay) {
        Execution execution = new Execution(label, policy, token, attempt, outcome);
        token.onCancel(execution::cancelPending);
        execution.schedule(1, initialDelay);
    }

    private final class Execution {
        private final String label;
        private final RetryPolicy policy;
        private final CancellationToken token;
        private final Attempt attempt;
        private final Outcome outcome;
        private final AtomicReference<Cancellable> pending = new AtomicReference<>();

        private Execution(String label, RetryPolicy policy, CancellationToken token, Attempt attempt, Outcome outcome) {
            this.label = label;
            this.policy = policy;
            this.token = token;
            this.attempt = attempt;
            this.outcome = outcome;
        }

        private void schedule(int attemptNumber, Duration delay) {
            if (token.isCancelled()) {
                return;
            }
            pending.set(timer.schedule(() -> execute(attemptNumber), delay));
        }

        private void execute(int attemptNumber) {
            if (token.isCancelled()) {
                return;
            }
            Duration timeout = policy.timeoutFor(attemptNumber);
            Exception failure = null;
            try {
                log.debug("{}: attempt {}/{} (timeout={})", label, attemptNumber, policy.maxAttempts(), timeout);
                attempt.run(attemptNumber, timeout);
            } catch (Exception e) {
                failure = e;
            }
            if (failure == null) {
                // Reported even when cancelled meanwhile so the caller can release what the attempt acquired
                outcome.succeeded(attemptNumber);
                return;
            }
            if (token.isCancelled()) {
                log.debug("{}: cancelled after attempt {}", label, attemptNumber);
                return;
            }
            if (attemptNumber >= policy.maxAttempts()) {
                log.warn("{}: giving up after {} attempts: {}", label, attemptNumber, failure.getMessage());
                outcome.exhausted(failure);
                return;
            }
            Duration backoff = policy.backoff().delayFor(attemptNumber);
            log.warn("{}: attempt {} failed, retrying in {} ms: {}",
                label, attemptNumber, backoff.toMillis(), failure.getMessage());
            schedule(attemptNumber + 1, backoff);
        }

        private void cancelPending() {
            Cancellable current = pending.getAndSet(null);
            if (current != null) {
                current.cancel();
            }
        }
    }
}
