package com.federation.application.federation.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs one edge's delivery tasks in arrival order on a shared executor. At most one task of the edge
 * runs at a time; different edges drain in parallel.
 */
final class EdgeDeliveryQueue {

    private static final Logger log = LoggerFactory.getLogger(EdgeDeliveryQueue.class);

    private final String name;
    private final Executor executor;
    private final Deque<Runnable> tasks = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;

    EdgeDeliveryQueue(String name, Executor executor) {
        this.name = name;
        this.executor = executor;
    }

    void submit(Runnable task) {
        synchronized (this) {
            if (closed) {
                return;
            }
            tasks.addLast(task);
            if (draining) {
                return;
            }
            draining = true;
        }
        try {
            executor.execute(this::drain);
        } catch (RejectedExecutionException e) {
            log.warn("Delivery executor rejected work for {}: {}", name, e.getMessage());
            synchronized (this) {
                draining = false;
            }
        }
    }

    void close() {
        synchronized (this) {
            closed = true;
            tasks.clear();
        }
    }

    private void drain() {
        while (true) {
            Runnable next;
            synchronized (this) {
                next = closed ? null : tasks.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.error("Delivery task for {} failed: {}", name, e.getMessage(), e);
            }
        }
    }
}
