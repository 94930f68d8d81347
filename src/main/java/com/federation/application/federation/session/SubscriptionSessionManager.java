package com.federation.application.federation.session;

import com.federation.application.federation.ReconciliationEngine;
import com.federation.application.federation.retry.CancellationToken;
import com.federation.application.federation.retry.RetryScheduler;
import com.federation.application.federation.transport.ContentTransport;
import com.federation.application.port.in.GetSessionStatusUseCase;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.TaskTimer;
import com.federation.domain.model.ContentBatch;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.SessionSnapshot;
import com.federation.domain.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Owns one session per active follow edge and drives it through
 * CONNECTING -> ACTIVE -> DEGRADED -> RECONNECTING -> (ACTIVE | FAILED).
 *
 * <p>Transport deliveries only touch session state through {@link #onDelivery}; reconciliation of an
 * edge's deliveries happens in arrival order on that edge's queue. Sessions are transient and are rebuilt
 * from persisted edges on start.
 */
public class SubscriptionSessionManager implements GetSessionStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSessionManager.class);

    private final Map<UUID, Session> sessions = new ConcurrentHashMap<>();

    private final ContentTransport transport;
    private final ReconciliationEngine engine;
    private final TaskTimer timer;
    private final RetryScheduler retries;
    private final Executor deliveryExecutor;
    private final SessionSettings settings;
    private final MetricsPort metrics;

    public SubscriptionSessionManager(
            ContentTransport transport,
            ReconciliationEngine engine,
            TaskTimer timer,
            RetryScheduler retries,
            Executor deliveryExecutor,
            SessionSettings settings,
            MetricsPort metrics) {
        this.transport = transport;
        this.engine = engine;
        this.timer = timer;
        this.retries = retries;
        this.deliveryExecutor = deliveryExecutor;
        this.settings = settings;
        this.metrics = metrics;
    }

    /**
     * Opens a session for the edge unless one exists. Connection happens in the background.
     */
    public SessionSnapshot open(FollowEdge edge) {
        Session created = new Session(edge,
            new EdgeDeliveryQueue("edge " + edge.id(), deliveryExecutor), timer.now());
        Session existing = sessions.putIfAbsent(edge.id(), created);
        if (existing != null) {
            return existing.snapshot(transport.kind());
        }
        log.info("Opening {} session for {} ({})", transport.kind(), edge.targetAddress(), edge.id());
        synchronized (created) {
            connect(created);
        }
        return created.snapshot(transport.kind());
    }

    /**
     * Tears the edge's session down: cancels pending retries and the health timer, stops the transport,
     * drops queued deliveries, then forgets the session. Returns false if there was no session.
     */
    public boolean close(UUID edgeId) {
        Session session = sessions.get(edgeId);
        if (session == null) {
            return false;
        }
        synchronized (session) {
            if (session.closed) {
                return false;
            }
            session.closed = true;
            session.status = SessionStatus.CLOSED;
            session.cancelHealthTimer();
            session.lifetime.cancel();
            session.queue.close();
        }
        stopTransport(session);
        sessions.remove(edgeId, session);
        log.info("Closed session for {} ({})", session.edge.targetAddress(), edgeId);
        return true;
    }

    public void closeAll() {
        List<UUID> ids = List.copyOf(sessions.keySet());
        ids.forEach(this::close);
        log.info("Closed {} federation sessions", ids.size());
    }

    @Override
    public Optional<SessionSnapshot> getSession(UUID edgeId) {
        return Optional.ofNullable(sessions.get(edgeId)).map(s -> s.snapshot(transport.kind()));
    }

    // Caller holds the session monitor
    private void connect(Session session) {
        CancellationToken token = session.renewPending();
        FollowEdge edge = session.edge;
        retries.run("Connecting to " + edge.targetAddress(), settings.connectPolicy(), token,
            (attempt, timeout) -> transport.start(edge, batch -> onDelivery(session, batch), timeout),
            new RetryScheduler.Outcome() {
                @Override
                public void succeeded(int attemptNumber) {
                    onEstablished(session, attemptNumber);
                }

                @Override
                public void exhausted(Exception lastFailure) {
                    onConnectFailed(session, lastFailure);
                }
            });
    }

    private void onEstablished(Session session, int attemptNumber) {
        boolean closedMeanwhile;
        synchronized (session) {
            closedMeanwhile = session.closed;
            if (!closedMeanwhile) {
                session.status = SessionStatus.ACTIVE;
                session.lastActivity = timer.now();
                session.reconnectAttempts = 0;
                session.cancelPending();
                if (session.healthTimer == null) {
                    session.healthTimer = timer.scheduleAtFixedRate(() -> healthCheck(session),
                        settings.healthCheckInterval());
                }
            }
        }
        if (closedMeanwhile) {
            stopTransport(session);
            return;
        }
        log.info("Session for {} is ACTIVE after {} attempt(s)", session.edge.targetAddress(), attemptNumber);
        session.queue.submit(() -> initialSync(session));
    }

    private void onConnectFailed(Session session, Exception lastFailure) {
        synchronized (session) {
            if (session.closed) {
                return;
            }
            session.status = SessionStatus.FAILED;
            metrics.incrementSessionFailures();
            CancellationToken token = session.renewPending();
            var retry = timer.schedule(() -> backgroundRetry(session), settings.backgroundRetryInterval());
            token.onCancel(retry::cancel);
        }
        log.warn("Session for {} FAILED ({}); retrying every {}s", session.edge.targetAddress(),
            lastFailure.getMessage(), settings.backgroundRetryInterval().toSeconds());
    }

    private void backgroundRetry(Session session) {
        synchronized (session) {
            if (session.closed || session.status != SessionStatus.FAILED) {
                return;
            }
            log.info("Background retry for {}", session.edge.targetAddress());
            session.status = SessionStatus.CONNECTING;
            connect(session);
        }
    }

    void healthCheck(Session session) {
        synchronized (session) {
            if (session.closed) {
                return;
            }
            Instant now = timer.now();
            switch (session.status) {
                case ACTIVE -> {
                    Duration idle = Duration.between(session.lastActivity, now);
                    if (idle.compareTo(settings.idleThreshold()) > 0) {
                        session.status = SessionStatus.DEGRADED;
                        log.warn("Session for {} DEGRADED: idle for {}s", session.edge.targetAddress(), idle.toSeconds());
                    }
                }
                case DEGRADED -> scheduleReconnect(session);
                default -> {
                    // CONNECTING, RECONNECTING and FAILED are driven by their own timers
                }
            }
        }
    }

    // Caller holds the session monitor
    private void scheduleReconnect(Session session) {
        session.status = SessionStatus.RECONNECTING;
        session.reconnectAttempts++;
        metrics.incrementSessionReconnects();
        Duration delay = settings.reconnectBackoff().delayFor(session.reconnectAttempts);
        CancellationToken token = session.renewPending();
        var reconnect = timer.schedule(() -> reconnect(session, token), delay);
        token.onCancel(reconnect::cancel);
        log.info("Session for {} RECONNECTING in {} ms (attempt {})", session.edge.targetAddress(),
            delay.toMillis(), session.reconnectAttempts);
    }

    private void reconnect(Session session, CancellationToken token) {
        synchronized (session) {
            if (session.closed || token.isCancelled() || session.status != SessionStatus.RECONNECTING) {
                return;
            }
        }
        // Stopping may wait on the transport's delivery threads, which need the session monitor
        stopTransport(session);
        synchronized (session) {
            if (session.closed) {
                return;
            }
            // The old link is gone even if a late delivery revived the session meanwhile
            session.status = SessionStatus.RECONNECTING;
            connect(session);
        }
    }

    private void stopTransport(Session session) {
        try {
            transport.stop(session.edge);
        } catch (RuntimeException e) {
            log.warn("Error stopping transport for {}: {}", session.edge.targetAddress(), e.getMessage());
        }
    }

    /**
     * Single entry point for transport deliveries: records activity, then queues reconciliation.
     */
    void onDelivery(Session session, ContentBatch batch) {
        synchronized (session) {
            if (session.closed) {
                return;
            }
            session.lastActivity = timer.now();
            session.reconnectAttempts = 0;
            if (session.status == SessionStatus.DEGRADED || session.status == SessionStatus.RECONNECTING) {
                session.cancelPending();
                session.status = SessionStatus.ACTIVE;
                log.info("Session for {} back to ACTIVE on delivery", session.edge.targetAddress());
            }
        }
        session.queue.submit(() -> reconcile(session, batch));
    }

    private void initialSync(Session session) {
        if (isClosed(session)) {
            return;
        }
        try {
            List<ContentItem> existing = transport.initialSnapshot(session.edge);
            if (!existing.isEmpty()) {
                log.info("Initial sync of {}: {} items", session.edge.targetAddress(), existing.size());
                engine.reconcile(session.edge, ContentBatch.snapshot(existing));
            }
        } catch (RuntimeException e) {
            log.warn("Initial sync of {} failed: {}", session.edge.targetAddress(), e.getMessage(), e);
        }
    }

    private void reconcile(Session session, ContentBatch batch) {
        if (isClosed(session)) {
            return;
        }
        engine.reconcile(session.edge, batch);
    }

    private static boolean isClosed(Session session) {
        synchronized (session) {
            return session.closed;
        }
    }
}
