package com.federation.application.service;

import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.ContentStore.ChangeSubscription;
import com.federation.application.port.out.IdGenerator;
import com.federation.application.port.out.OutboxRepository;
import com.federation.domain.event.SiteContentChanged;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.NodeIdentity;
import com.federation.infrastructure.config.AppProperties;
import com.federation.infrastructure.context.RequestContext;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Queues every change of the local collection, originals and federated copies alike, as an update
 * for this site's topic. The outbox poller delivers it to the bus.
 */
@Component
public class FederationPublisher {

    private static final Logger log = LoggerFactory.getLogger(FederationPublisher.class);

    private final ContentStore localStore;
    private final OutboxRepository outboxRepository;
    private final IdGenerator idGenerator;
    private final NodeIdentity localNode;
    private final AppProperties appProperties;
    private final Clock clock;

    private ChangeSubscription subscription;

    public FederationPublisher(
            ContentStore localStore,
            OutboxRepository outboxRepository,
            IdGenerator idGenerator,
            NodeIdentity localNode,
            AppProperties appProperties,
            Clock clock) {
        this.localStore = localStore;
        this.outboxRepository = outboxRepository;
        this.idGenerator = idGenerator;
        this.localNode = localNode;
        this.appProperties = appProperties;
        this.clock = clock;
    }

    @PostConstruct
    public void start() {
        if (!appProperties.getFederation().isPublishUpdates()) {
            log.info("Update publishing disabled for {}", localNode.address());
            return;
        }
        subscription = localStore.onChange(this::publish);
        log.info("Publishing updates of {}", localNode.address());
    }

    @PreDestroy
    public void stop() {
        if (subscription != null) {
            subscription.close();
            subscription = null;
        }
    }

    void publish(List<ContentItem> added, List<ContentItem> removed) {
        if (added.isEmpty() && removed.isEmpty()) {
            return;
        }
        SiteContentChanged event = SiteContentChanged.from(idGenerator.generate(), localNode.address(),
            localNode.name(), added, removed, clock.instant());
        outboxRepository.save(event, RequestContext.getRequestId());
        log.debug("Queued update of {}: {} added, {} removed", localNode.address(), added.size(), removed.size());
    }
}
