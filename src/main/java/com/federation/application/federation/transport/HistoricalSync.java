package com.federation.application.federation.transport;

import com.federation.application.federation.retry.CancellationToken;
import com.federation.application.federation.retry.ExponentialBackoff;
import com.federation.application.federation.retry.RetryPolicy;
import com.federation.application.federation.retry.RetryScheduler;
import com.federation.application.port.out.SiteConnector;
import com.federation.application.port.out.SiteConnector.OpenMode;
import com.federation.application.port.out.SiteConnector.RemoteSite;
import com.federation.application.port.out.TaskTimer;
import com.federation.application.port.out.TaskTimer.Cancellable;
import com.federation.domain.model.ContentBatch;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Time-boxed catch-up for the message-bus transport: opens the followed site, pulls its head state
 * every {@code pollInterval} and hands it to the sink, then stops when {@code window} elapses.
 * The window is an abort, not a success condition.
 */
public class HistoricalSync {

    private static final Logger log = LoggerFactory.getLogger(HistoricalSync.class);

    private static final int OPEN_ATTEMPTS = 3;

    private final SiteConnector connector;
    private final TaskTimer timer;
    private final RetryScheduler retries;
    private final Duration window;
    private final Duration pollInterval;
    private final RetryPolicy openPolicy;

    public HistoricalSync(
            SiteConnector connector,
            TaskTimer timer,
            RetryScheduler retries,
            Duration window,
            Duration pollInterval,
            Duration openTimeout) {
        this.connector = connector;
        this.timer = timer;
        this.retries = retries;
        this.window = window;
        this.pollInterval = pollInterval;
        this.openPolicy = new RetryPolicy(OPEN_ATTEMPTS, openTimeout, Duration.ZERO, openTimeout,
            new ExponentialBackoff(Duration.ofSeconds(1), pollInterval.compareTo(Duration.ofSeconds(1)) < 0
                ? Duration.ofSeconds(1) : pollInterval, 0.1));
    }

    /**
     * Starts the catch-up. Cancelling {@code cancellation} ends it early and releases the remote handle.
     */
    public void run(FollowEdge edge, DeliverySink sink, CancellationToken cancellation) {
        Run run = new Run(edge, sink);
        cancellation.onCancel(run.token::cancel);
        Cancellable windowTimer = timer.schedule(() -> {
            if (!run.token.isCancelled()) {
                log.info("Historical sync window for {} elapsed after {} polls", edge.targetAddress(), run.polls.get());
            }
            run.token.cancel();
        }, window);
        run.token.onCancel(windowTimer::cancel);
        run.token.onCancel(run::release);

        retries.run("Historical sync open of " + edge.targetAddress(), openPolicy, run.token,
            (attempt, timeout) -> run.open(timeout),
            new RetryScheduler.Outcome() {
                @Override
                public void succeeded(int attemptNumber) {
                    run.startPolling();
                }

                @Override
                public void exhausted(Exception lastFailure) {
                    log.warn("Historical sync of {} skipped: {}", edge.targetAddress(), lastFailure.getMessage());
                    run.token.cancel();
                }
            });
    }

    private final class Run {
        private final FollowEdge edge;
        private final DeliverySink sink;
        private final CancellationToken token = new CancellationToken();
        private final AtomicReference<RemoteSite> remote = new AtomicReference<>();
        private final AtomicReference<Cancellable> poller = new AtomicReference<>();
        private final AtomicInteger polls = new AtomicInteger();

        private Run(FollowEdge edge, DeliverySink sink) {
            this.edge = edge;
            this.sink = sink;
        }

        private void open(Duration timeout) throws Exception {
            RemoteSite opened = connector.open(edge.targetAddress(), OpenMode.OBSERVE, timeout);
            remote.set(opened);
            if (token.isCancelled()) {
                release();
            }
        }

        private void startPolling() {
            poll();
            poller.set(timer.scheduleAtFixedRate(this::poll, pollInterval));
            if (token.isCancelled()) {
                release();
            }
        }

        private void poll() {
            RemoteSite site = remote.get();
            if (token.isCancelled() || site == null) {
                return;
            }
            try {
                List<ContentItem> head = site.content().search(AbstractContentTransport.queryFor(edge));
                polls.incrementAndGet();
                if (!head.isEmpty()) {
                    sink.delivered(ContentBatch.snapshot(head));
                }
            } catch (RuntimeException e) {
                log.warn("Historical sync poll of {} failed: {}", edge.targetAddress(), e.getMessage());
            }
        }

        private void release() {
            Cancellable pending = poller.getAndSet(null);
            if (pending != null) {
                pending.cancel();
            }
            RemoteSite site = remote.getAndSet(null);
            if (site != null) {
                site.close();
            }
        }
    }
}
