package com.federation.application.federation.retry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Cooperative cancellation signal. Cancelling is idempotent; callbacks run once, on the cancelling thread,
 * or immediately if registered after cancellation.
 */
public final class CancellationToken {

    private static final Logger log = LoggerFactory.getLogger(CancellationToken.class);

    private final List<Runnable> callbacks = new ArrayList<>();
    private boolean cancelled;

    public void cancel() {
        List<Runnable> toRun;
        synchronized (this) {
            if (cancelled) {
                return;
            }
            cancelled = true;
            toRun = new ArrayList<>(callbacks);
            callbacks.clear();
        }
        toRun.forEach(CancellationToken::runQuietly);
    }

    public synchronized boolean isCancelled() {
        return cancelled;
    }

    public void onCancel(Runnable callback) {
        synchronized (this) {
            if (!cancelled) {
                callbacks.add(callback);
                return;
            }
        }
        runQuietly(callback);
    }

    /**
     * A token cancelled together with this one that can also be cancelled on its own.
     * Cancelling the child detaches it from this token.
     */
    public CancellationToken child() {
        CancellationToken child = new CancellationToken();
        Runnable propagate = child::cancel;
        onCancel(propagate);
        child.onCancel(() -> detach(propagate));
        return child;
    }

    private synchronized void detach(Runnable callback) {
        callbacks.remove(callback);
    }

    private static void runQuietly(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            log.warn("Cancellation callback failed: {}", e.getMessage(), e);
        }
    }
}
