package com.federation.application.federation.session;

import com.federation.application.federation.retry.CancellationToken;
import com.federation.application.port.out.TaskTimer.Cancellable;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.SessionSnapshot;
import com.federation.domain.model.SessionStatus;
import com.federation.domain.model.TransportKind;

import java.time.Instant;

/**
 * Runtime state of one edge. Mutated only by {@link SubscriptionSessionManager} while holding the
 * session's monitor.
 */
final class Session {

    final FollowEdge edge;
    final EdgeDeliveryQueue queue;
    final CancellationToken lifetime = new CancellationToken();

    SessionStatus status = SessionStatus.CONNECTING;
    Instant lastActivity;
    int reconnectAttempts;
    Cancellable healthTimer;
    CancellationToken pending;
    boolean closed;

    Session(FollowEdge edge, EdgeDeliveryQueue queue, Instant now) {
        this.edge = edge;
        this.queue = queue;
        this.lastActivity = now;
    }

    /**
     * Replaces the token guarding in-flight connect, reconnect or background retry work.
     */
    CancellationToken renewPending() {
        cancelPending();
        pending = lifetime.child();
        return pending;
    }

    void cancelPending() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    void cancelHealthTimer() {
        if (healthTimer != null) {
            healthTimer.cancel();
            healthTimer = null;
        }
    }

    synchronized SessionSnapshot snapshot(TransportKind transport) {
        return new SessionSnapshot(edge.id(), edge.targetAddress(), status, lastActivity, reconnectAttempts, transport);
    }
}
