package com.federation.application.federation;

import com.federation.application.port.out.MetricsPort;
import com.federation.domain.model.ContentBatch;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.ReconcileOutcome;
import com.federation.infrastructure.exception.WriteDeniedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Decides what a delivery from a followed site changes locally.
 *
 * <p>Additions pass the self-loop guard and the edge's recursion rule, are skipped when already present,
 * and are written with provenance preserved from earlier hops. Removals evict only copies that came from
 * the edge's target. Work runs in chunks of {@code batchSize}: items within a chunk run concurrently,
 * chunks run one after another. One item failing never aborts the rest.
 */
public class ReconciliationEngine {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationEngine.class);

    private final NodeIdentity localNode;
    private final ImportTarget target;
    private final Executor executor;
    private final int batchSize;
    private final Clock clock;
    private final MetricsPort metrics;

    public ReconciliationEngine(
            NodeIdentity localNode,
            ImportTarget target,
            Executor executor,
            int batchSize,
            Clock clock,
            MetricsPort metrics) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be positive, was " + batchSize);
        }
        this.localNode = localNode;
        this.target = target;
        this.executor = executor;
        this.batchSize = batchSize;
        this.clock = clock;
        this.metrics = metrics;
    }

    public ReconcileOutcome reconcile(FollowEdge edge, List<ContentItem> added, List<ContentItem> removed) {
        return reconcile(edge, new ContentBatch(added, removed, false));
    }

    public ReconcileOutcome reconcile(FollowEdge edge, ContentBatch batch) {
        if (batch.isEmpty()) {
            return ReconcileOutcome.NONE;
        }
        ReconcileOutcome outcome = metrics.recordReconcileDuration(() -> {
            ReconcileOutcome additions = reconcileAdditions(edge, batch);
            ReconcileOutcome removals = inChunks(distinctById(batch.removed()), item -> evictOne(edge, item));
            return additions.plus(removals);
        });
        metrics.recordReconcile(outcome.imported(), outcome.evicted(), outcome.skipped(), outcome.failed());
        if (outcome.changedAnything() || outcome.failed() > 0) {
            log.info("Reconciled {} from {}: imported={}, evicted={}, skipped={}, failed={}",
                batch.realtime() ? "live batch" : "snapshot", edge.targetAddress(),
                outcome.imported(), outcome.evicted(), outcome.skipped(), outcome.failed());
        }
        return outcome;
    }

    private ReconcileOutcome reconcileAdditions(FollowEdge edge, ContentBatch batch) {
        List<ContentItem> accepted = new ArrayList<>();
        int rejected = 0;
        for (ContentItem item : distinctById(batch.added())) {
            if (localNode.address().matches(item.federatedFrom())) {
                log.debug("Rejecting {}: originated here", item.id());
                rejected++;
            } else if (!edge.accepts(item)) {
                log.debug("Rejecting {}: federated from {} and edge to {} is not recursive",
                    item.id(), item.federatedFrom(), edge.targetAddress());
                rejected++;
            } else {
                accepted.add(item);
            }
        }
        ReconcileOutcome imports = inChunks(accepted, item -> importOne(edge, item, batch.realtime()));
        return imports.plus(new ReconcileOutcome(0, 0, rejected, 0));
    }

    private ReconcileOutcome importOne(FollowEdge edge, ContentItem item, boolean realtime) {
        try {
            if (target.contains(item, edge)) {
                log.debug("Skipping {}: already present", item.id());
                return new ReconcileOutcome(0, 0, 1, 0);
            }
            ContentItem federated = item.federate(edge.targetAddress(), clock.instant(), realtime);
            if (!target.write(federated, edge)) {
                return new ReconcileOutcome(0, 0, 1, 0);
            }
            log.debug("Imported {} (federatedFrom={})", federated.id(), federated.federatedFrom());
            return new ReconcileOutcome(1, 0, 0, 0);
        } catch (WriteDeniedException e) {
            log.warn("Write of {} denied for {}: {}", item.id(), e.getActorKey(), e.getMessage());
            return new ReconcileOutcome(0, 0, 1, 0);
        } catch (RuntimeException e) {
            log.error("Failed to import {} from {}: {}", item.id(), edge.targetAddress(), e.getMessage(), e);
            return new ReconcileOutcome(0, 0, 0, 1);
        }
    }

    private ReconcileOutcome evictOne(FollowEdge edge, ContentItem item) {
        try {
            if (target.evict(item, edge)) {
                log.debug("Evicted {}", item.id());
                return new ReconcileOutcome(0, 1, 0, 0);
            }
            return new ReconcileOutcome(0, 0, 1, 0);
        } catch (WriteDeniedException e) {
            log.warn("Eviction of {} denied for {}: {}", item.id(), e.getActorKey(), e.getMessage());
            return new ReconcileOutcome(0, 0, 1, 0);
        } catch (RuntimeException e) {
            log.error("Failed to evict {} for {}: {}", item.id(), edge.targetAddress(), e.getMessage(), e);
            return new ReconcileOutcome(0, 0, 0, 1);
        }
    }

    private ReconcileOutcome inChunks(List<ContentItem> items, Function<ContentItem, ReconcileOutcome> work) {
        ReconcileOutcome total = ReconcileOutcome.NONE;
        for (int from = 0; from < items.size(); from += batchSize) {
            List<ContentItem> chunk = items.subList(from, Math.min(from + batchSize, items.size()));
            List<CompletableFuture<ReconcileOutcome>> futures = chunk.stream()
                .map(item -> CompletableFuture.supplyAsync(() -> work.apply(item), executor))
                .toList();
            for (CompletableFuture<ReconcileOutcome> future : futures) {
                total = total.plus(future.join());
            }
        }
        return total;
    }

    // Last occurrence wins so a re-sent item within one delivery is handled once
    private static List<ContentItem> distinctById(List<ContentItem> items) {
        Map<String, ContentItem> byId = new LinkedHashMap<>();
        for (ContentItem item : items) {
            byId.put(item.id(), item);
        }
        return new ArrayList<>(byId.values());
    }
}
