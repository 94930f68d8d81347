package com.federation.infrastructure.bootstrap;

import com.federation.application.federation.session.SubscriptionSessionManager;
import com.federation.application.port.out.FollowEdgeRepository;
import com.federation.domain.model.FollowEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Reopens a session for every persisted follow edge once the application is ready.
 * Sessions are torn down by the session manager's destroy callback.
 */
@Component
public class FederationLifecycle {

    private static final Logger log = LoggerFactory.getLogger(FederationLifecycle.class);

    private final FollowEdgeRepository followEdgeRepository;
    private final SubscriptionSessionManager sessionManager;

    public FederationLifecycle(FollowEdgeRepository followEdgeRepository, SubscriptionSessionManager sessionManager) {
        this.followEdgeRepository = followEdgeRepository;
        this.sessionManager = sessionManager;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void resumeSessions() {
        List<FollowEdge> edges = followEdgeRepository.findAll();
        for (FollowEdge edge : edges) {
            try {
                sessionManager.open(edge);
            } catch (RuntimeException e) {
                log.error("Could not resume session for {}: {}", edge.targetAddress(), e.getMessage(), e);
            }
        }
        log.info("Resumed {} federation sessions", edges.size());
    }
}
