package com.federation.application.service;

import com.federation.application.federation.session.SubscriptionSessionManager;
import com.federation.application.port.in.AddFollowEdgeUseCase;
import com.federation.application.port.in.GetFollowEdgesUseCase;
import com.federation.application.port.in.RemoveFollowEdgeUseCase;
import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.ContentStore.ContentQuery;
import com.federation.application.port.out.FederationIndexRepository;
import com.federation.application.port.out.FollowEdgeRepository;
import com.federation.application.port.out.IdGenerator;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.OutboxRepository;
import com.federation.domain.error.FollowError;
import com.federation.domain.event.FollowEdgeAdded;
import com.federation.domain.event.FollowEdgeRemoved;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.Page;
import com.federation.domain.model.Result;
import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.config.AppProperties;
import com.federation.infrastructure.context.RequestContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class FollowService implements AddFollowEdgeUseCase, RemoveFollowEdgeUseCase, GetFollowEdgesUseCase {

    private static final Logger log = LoggerFactory.getLogger(FollowService.class);

    private final FollowEdgeRepository followEdgeRepository;
    private final ContentStore localStore;
    private final FederationIndexRepository indexRepository;
    private final SubscriptionSessionManager sessionManager;
    private final OutboxRepository outboxRepository;
    private final IdGenerator idGenerator;
    private final MetricsPort metrics;
    private final NodeIdentity localNode;
    private final AppProperties appProperties;
    private final Clock clock;

    public FollowService(
            FollowEdgeRepository followEdgeRepository,
            ContentStore localStore,
            FederationIndexRepository indexRepository,
            SubscriptionSessionManager sessionManager,
            OutboxRepository outboxRepository,
            IdGenerator idGenerator,
            MetricsPort metrics,
            NodeIdentity localNode,
            AppProperties appProperties,
            Clock clock) {
        this.followEdgeRepository = followEdgeRepository;
        this.localStore = localStore;
        this.indexRepository = indexRepository;
        this.sessionManager = sessionManager;
        this.outboxRepository = outboxRepository;
        this.idGenerator = idGenerator;
        this.metrics = metrics;
        this.localNode = localNode;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @Override
    @Transactional
    public Result<FollowEdge, FollowError> addFollowEdge(SiteAddress targetAddress, String displayName,
                                                         boolean recursive, List<SiteAddress> followChain) {
        log.debug("Processing follow request: target={}, recursive={}", targetAddress, recursive);

        // Domain validation via FollowEdge.create()
        var edgeResult = FollowEdge.create(idGenerator.generate(), localNode.address(), targetAddress,
            displayName, recursive, followChain, clock.instant());
        if (edgeResult.isFailure()) {
            log.warn("Follow validation failed: {}", edgeResult.errorOrNull().message());
            return Result.failure(new FollowError.ValidationFailed(edgeResult.errorOrNull()));
        }

        // Application-level validation (requires repository lookup)
        if (followEdgeRepository.existsByTarget(targetAddress)) {
            log.debug("Already following {}", targetAddress);
            return Result.failure(new FollowError.AlreadyFollowing(targetAddress));
        }

        FollowEdge edge = edgeResult.getOrThrow();
        followEdgeRepository.save(edge);
        outboxRepository.save(
            FollowEdgeAdded.from(idGenerator.generate(), edge.id(), targetAddress, recursive),
            RequestContext.getRequestId());

        afterCommit(() -> sessionManager.open(edge));

        metrics.incrementFollowEdgesAdded();
        log.info("Follow edge {} added: {} -> {} (recursive={})", edge.id(), localNode.address(), targetAddress, recursive);

        return Result.success(edge);
    }

    @Override
    @Transactional
    public Result<Void, FollowError> removeFollowEdge(UUID edgeId) {
        log.debug("Processing unfollow request: edge={}", edgeId);

        var found = followEdgeRepository.findById(edgeId);
        if (found.isEmpty()) {
            log.debug("No follow edge {}", edgeId);
            return Result.failure(new FollowError.NotFollowing(edgeId.toString()));
        }
        FollowEdge edge = found.get();

        // Stop reconciliation before anything is purged so nothing re-imports behind us
        sessionManager.close(edgeId);
        followEdgeRepository.delete(edgeId);

        if (appProperties.getFederation().isPurgeOnUnfollow()) {
            purgeFederatedFrom(edge.targetAddress());
        }

        outboxRepository.save(
            FollowEdgeRemoved.from(idGenerator.generate(), edgeId, edge.targetAddress()),
            RequestContext.getRequestId());

        metrics.incrementFollowEdgesRemoved();
        log.info("Follow edge {} removed: {} -> {}", edgeId, localNode.address(), edge.targetAddress());

        return Result.ok();
    }

    @Override
    public Page<FollowEdge> getFollowEdges(String cursor, int limit) {
        var edges = followEdgeRepository.findPage(cursor, limit + 1);

        boolean hasMore = edges.size() > limit;
        if (hasMore) {
            edges = edges.subList(0, limit);
        }

        String nextCursor = hasMore
            ? edges.get(edges.size() - 1).createdAt().toString()
            : null;

        return Page.of(edges, nextCursor);
    }

    private void purgeFederatedFrom(SiteAddress target) {
        List<ContentItem> federated = localStore.search(ContentQuery.federatedFrom(target.value()));
        federated.forEach(item -> localStore.del(item.id()));
        int entries = indexRepository.deleteBySourceSite(target.value());
        log.info("Purged {} items and {} index entries federated from {}", federated.size(), entries, target);
    }

    private static void afterCommit(Runnable action) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            action.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                action.run();
            }
        });
    }
}
