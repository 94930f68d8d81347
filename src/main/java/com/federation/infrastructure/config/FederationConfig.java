package com.federation.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.federation.adapter.out.messaging.UpdateLogSiteConnector;
import com.federation.adapter.out.store.InMemoryContentStore;
import com.federation.application.federation.ContentStoreTarget;
import com.federation.application.federation.FederationIndexTarget;
import com.federation.application.federation.ImportTarget;
import com.federation.application.federation.IndexEntryMapper;
import com.federation.application.federation.ReconciliationEngine;
import com.federation.application.federation.retry.RetryScheduler;
import com.federation.application.federation.session.SessionSettings;
import com.federation.application.federation.session.SubscriptionSessionManager;
import com.federation.application.federation.transport.ContentTransport;
import com.federation.application.federation.transport.FullMirrorTransport;
import com.federation.application.federation.transport.HistoricalSync;
import com.federation.application.federation.transport.MessageBusTransport;
import com.federation.application.federation.transport.RealTimeEventTransport;
import com.federation.application.federation.transport.SyncUpdateCodec;
import com.federation.application.federation.transport.UpdateTopics;
import com.federation.application.port.in.WriteFederationIndexUseCase;
import com.federation.application.port.out.ContentStore;
import com.federation.application.port.out.FederationIndexRepository;
import com.federation.application.port.out.IdGenerator;
import com.federation.application.port.out.MessageBus;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.SiteConnector;
import com.federation.application.port.out.TaskTimer;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.SiteAddress;
import com.federation.infrastructure.scheduling.SpringTaskTimer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Wires the federation engine: node identity, timers and pools, the import target and the transport
 * selected by {@code app.federation.*}.
 */
@Configuration
public class FederationConfig {

    private static final Logger log = LoggerFactory.getLogger(FederationConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public NodeIdentity nodeIdentity(AppProperties appProperties) {
        AppProperties.Node node = appProperties.getNode();
        var address = SiteAddress.parse(node.getAddress());
        if (address.isFailure()) {
            throw new IllegalStateException("app.node.address: " + address.errorOrNull().message());
        }
        String name = node.getName() != null && !node.getName().isBlank() ? node.getName() : node.getAddress();
        String publicKey = node.getPublicKey() != null && !node.getPublicKey().isBlank()
            ? node.getPublicKey()
            : node.getAddress();
        log.info("Node identity: address={}, name={}", node.getAddress(), name);
        return new NodeIdentity(address.getOrThrow(), name, publicKey);
    }

    @Bean
    public ThreadPoolTaskScheduler federationTaskScheduler(AppProperties appProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(appProperties.getFederation().getTimerThreads());
        scheduler.setThreadNamePrefix("federation-timer-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public TaskTimer taskTimer(ThreadPoolTaskScheduler federationTaskScheduler, Clock clock) {
        return new SpringTaskTimer(federationTaskScheduler, clock);
    }

    @Bean
    public RetryScheduler retryScheduler(TaskTimer taskTimer) {
        return new RetryScheduler(taskTimer);
    }

    @Bean
    public ThreadPoolTaskExecutor reconcileExecutor(AppProperties appProperties) {
        return executor("federation-reconcile-", appProperties.getFederation().getReconcileThreads());
    }

    @Bean
    public ThreadPoolTaskExecutor deliveryExecutor(AppProperties appProperties) {
        return executor("federation-delivery-", appProperties.getFederation().getDeliveryThreads());
    }

    @Bean
    public UpdateTopics updateTopics(AppProperties appProperties) {
        AppProperties.MessageBus bus = appProperties.getFederation().getMessageBus();
        return new UpdateTopics(bus.getTopicPrefix(), bus.getConsumerGroupPrefix());
    }

    @Bean
    public SyncUpdateCodec syncUpdateCodec(ObjectMapper objectMapper) {
        return new SyncUpdateCodec(objectMapper);
    }

    @Bean
    public IndexEntryMapper indexEntryMapper(ObjectMapper objectMapper) {
        return new IndexEntryMapper(objectMapper);
    }

    @Bean
    public SiteConnector siteConnector(
            MessageBus messageBus,
            UpdateTopics updateTopics,
            SyncUpdateCodec syncUpdateCodec,
            NodeIdentity nodeIdentity,
            IdGenerator idGenerator,
            MetricsPort metrics) {
        return new UpdateLogSiteConnector(messageBus, updateTopics, syncUpdateCodec, nodeIdentity, idGenerator,
            metrics);
    }

    @Bean
    public ImportTarget importTarget(
            AppProperties appProperties,
            ContentStore localStore,
            WriteFederationIndexUseCase indexWriter,
            FederationIndexRepository indexRepository,
            IndexEntryMapper indexEntryMapper,
            Clock clock) {
        return switch (appProperties.getFederation().getImportMode()) {
            case CONTENT -> new ContentStoreTarget(localStore);
            case INDEX -> new FederationIndexTarget(indexWriter, indexRepository, indexEntryMapper, clock);
        };
    }

    @Bean
    public ReconciliationEngine reconciliationEngine(
            NodeIdentity nodeIdentity,
            ImportTarget importTarget,
            ThreadPoolTaskExecutor reconcileExecutor,
            AppProperties appProperties,
            Clock clock,
            MetricsPort metrics) {
        return new ReconciliationEngine(nodeIdentity, importTarget, reconcileExecutor,
            appProperties.getFederation().getBatchSize(), clock, metrics);
    }

    @Bean
    public ContentTransport contentTransport(
            AppProperties appProperties,
            SiteConnector siteConnector,
            MessageBus messageBus,
            UpdateTopics updateTopics,
            SyncUpdateCodec syncUpdateCodec,
            TaskTimer taskTimer,
            RetryScheduler retryScheduler,
            NodeIdentity nodeIdentity,
            MetricsPort metrics) {
        AppProperties.Federation federation = appProperties.getFederation();
        log.info("Federation transport: {}, import mode: {}", federation.getTransport(), federation.getImportMode());
        return switch (federation.getTransport()) {
            case REAL_TIME -> new RealTimeEventTransport(siteConnector);
            case FULL_MIRROR -> new FullMirrorTransport(siteConnector, InMemoryContentStore::new,
                federation.getMirror().getScanBatchSize());
            case MESSAGE_BUS -> {
                AppProperties.MessageBus bus = federation.getMessageBus();
                HistoricalSync historicalSync = new HistoricalSync(siteConnector, taskTimer, retryScheduler,
                    bus.getHistoricalWindow(), bus.getHistoricalPollInterval(), bus.getHistoricalOpenTimeout());
                yield new MessageBusTransport(messageBus, updateTopics, syncUpdateCodec, historicalSync,
                    nodeIdentity, metrics);
            }
        };
    }

    @Bean
    public SessionSettings sessionSettings(AppProperties appProperties) {
        AppProperties.Session session = appProperties.getFederation().getSession();
        return new SessionSettings(
            session.getMaxConnectAttempts(),
            session.getConnectTimeoutInitial(),
            session.getConnectTimeoutStep(),
            session.getConnectTimeoutMin(),
            session.getConnectBackoffBase(),
            session.getConnectBackoffCap(),
            session.getBackgroundRetryInterval(),
            session.getHealthCheckInterval(),
            session.getIdleThreshold(),
            session.getReconnectBackoffBase(),
            session.getReconnectBackoffCap(),
            session.getJitter()
        );
    }

    @Bean(destroyMethod = "closeAll")
    public SubscriptionSessionManager subscriptionSessionManager(
            ContentTransport contentTransport,
            ReconciliationEngine reconciliationEngine,
            TaskTimer taskTimer,
            RetryScheduler retryScheduler,
            ThreadPoolTaskExecutor deliveryExecutor,
            SessionSettings sessionSettings,
            MetricsPort metrics) {
        return new SubscriptionSessionManager(contentTransport, reconciliationEngine, taskTimer, retryScheduler,
            deliveryExecutor, sessionSettings, metrics);
    }

    private static ThreadPoolTaskExecutor executor(String prefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setThreadNamePrefix(prefix);
        return executor;
    }
}
