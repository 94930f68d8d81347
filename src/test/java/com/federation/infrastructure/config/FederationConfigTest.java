package com.federation.infrastructure.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.federation.adapter.out.store.InMemoryContentStore;
import com.federation.application.federation.ContentStoreTarget;
import com.federation.application.federation.ReconciliationEngine;
import com.federation.application.federation.retry.RetryScheduler;
import com.federation.application.federation.session.SubscriptionSessionManager;
import com.federation.application.federation.transport.ContentTransport;
import com.federation.application.federation.transport.MessageBusTransport;
import com.federation.application.federation.transport.RealTimeEventTransport;
import com.federation.application.federation.transport.SyncUpdateCodec;
import com.federation.application.federation.transport.SyncUpdateMessage;
import com.federation.application.federation.transport.UpdateTopics;
import com.federation.application.port.out.SiteConnector;
import com.federation.domain.model.ContentItem;
import com.federation.domain.model.FollowEdge;
import com.federation.domain.model.NodeIdentity;
import com.federation.domain.model.SessionSnapshot;
import com.federation.domain.model.SessionStatus;
import com.federation.domain.model.TransportKind;
import com.federation.infrastructure.id.UUIDv7Generator;
import com.federation.infrastructure.metrics.AppMetrics;
import com.federation.support.InMemoryMessageBus;
import com.federation.support.ManualTaskTimer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.federation.support.TestData.NOW;
import static com.federation.support.TestData.edge;
import static com.federation.support.TestData.node;
import static com.federation.support.TestData.original;
import static com.federation.support.TestData.site;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Follows a peer that is reachable only through its update topic, with the transport and site connector
 * built by the production configuration.
 */
@DisplayName("FederationConfig")
class FederationConfigTest {

    private static final String TOPIC_A = "federation.site.A.updates";

    private final FederationConfig config = new FederationConfig();
    private final AppProperties properties = new AppProperties();
    private final NodeIdentity localNode = node("B");
    private final SyncUpdateCodec codec = config.syncUpdateCodec(new ObjectMapper().findAndRegisterModules());

    private ManualTaskTimer timer;
    private InMemoryMessageBus bus;
    private InMemoryContentStore localStore;
    private ContentTransport transport;
    private SubscriptionSessionManager sessions;

    @BeforeEach
    void setUp() {
        timer = new ManualTaskTimer(NOW);
        bus = new InMemoryMessageBus();
        localStore = new InMemoryContentStore();
        properties.getFederation().getSession().setJitter(0.0);
    }

    @AfterEach
    void tearDown() {
        if (sessions != null) {
            sessions.closeAll();
        }
    }

    private void startEngine() {
        AppMetrics metrics = new AppMetrics(new SimpleMeterRegistry());
        UpdateTopics topics = config.updateTopics(properties);
        RetryScheduler retries = config.retryScheduler(timer);
        SiteConnector connector = config.siteConnector(bus, topics, codec, localNode, new UUIDv7Generator(), metrics);
        transport = config.contentTransport(properties, connector, bus, topics, codec, timer, retries, localNode,
            metrics);
        ReconciliationEngine engine = new ReconciliationEngine(localNode, new ContentStoreTarget(localStore),
            Runnable::run, properties.getFederation().getBatchSize(), Clock.fixed(NOW, ZoneOffset.UTC), metrics);
        sessions = new SubscriptionSessionManager(transport, engine, timer, retries, Runnable::run,
            config.sessionSettings(properties), metrics);
    }

    private void publishFromA(List<ContentItem> added, List<ContentItem> removed) {
        bus.publish(TOPIC_A, codec.encode(new SyncUpdateMessage("A", "Site A", added, removed, NOW)));
    }

    private SessionStatus follow(FollowEdge edge) {
        sessions.open(edge);
        timer.runDue();
        return sessions.getSession(edge.id()).map(SessionSnapshot::status).orElse(null);
    }

    @Test
    @DisplayName("Should follow over the message bus by default")
    void shouldDefaultToMessageBus() {
        // When
        startEngine();

        // Then
        assertEquals(TransportKind.MESSAGE_BUS, properties.getFederation().getTransport());
        assertInstanceOf(MessageBusTransport.class, transport);
    }

    @Test
    @DisplayName("Should rebuild a peer's head state from its update log through the historical sync")
    void shouldCatchUpFromUpdateLog() {
        // Given
        publishFromA(List.of(original("r1"), original("r2")), List.of());
        publishFromA(List.of(), List.of(original("r2")));
        UpdateTopics topics = config.updateTopics(properties);
        bus.subscribe(TOPIC_A, topics.consumerGroup(site("B"), site("A")), payload -> {}).close();
        startEngine();

        // When
        SessionStatus status = follow(edge("B", "A", false));

        // Then
        assertEquals(SessionStatus.ACTIVE, status);
        assertEquals(2, bus.subscriberCount(TOPIC_A));
        assertEquals(1, localStore.size());
        ContentItem imported = localStore.get("r1").orElseThrow();
        assertEquals("A", imported.federatedFrom());
        assertFalse(imported.federatedRealtime());

        // When
        timer.advance(properties.getFederation().getMessageBus().getHistoricalWindow().plusSeconds(1));
        publishFromA(List.of(original("r3")), List.of());

        // Then
        assertEquals(1, bus.subscriberCount(TOPIC_A));
        assertTrue(localStore.get("r3").orElseThrow().federatedRealtime());
    }

    @Test
    @DisplayName("Should follow a peer known only by its update topic with the real-time transport")
    void shouldObservePeerThroughUpdateLog() {
        // Given
        properties.getFederation().setTransport(TransportKind.REAL_TIME);
        publishFromA(List.of(original("r1")), List.of());
        startEngine();

        // When
        SessionStatus status = follow(edge("B", "A", false));

        // Then
        assertInstanceOf(RealTimeEventTransport.class, transport);
        assertEquals(SessionStatus.ACTIVE, status);
        assertEquals("A", localStore.get("r1").orElseThrow().federatedFrom());

        // When
        publishFromA(List.of(original("r2")), List.of());
        publishFromA(List.of(), List.of(original("r1")));

        // Then
        assertTrue(localStore.get("r2").orElseThrow().federatedRealtime());
        assertTrue(localStore.get("r1").isEmpty());
    }

    @Test
    @DisplayName("Should mirror a peer known only by its update topic")
    void shouldMirrorPeerThroughUpdateLog() {
        // Given
        properties.getFederation().setTransport(TransportKind.FULL_MIRROR);
        publishFromA(List.of(original("r1"), original("r2")), List.of());
        startEngine();

        // When
        SessionStatus status = follow(edge("B", "A", false));

        // Then
        assertEquals(SessionStatus.ACTIVE, status);
        assertEquals(2, localStore.size());

        // When
        publishFromA(List.of(original("r3")), List.of());

        // Then
        assertEquals(3, localStore.size());
    }
}
