package com.federation.adapter.out.messaging;

import com.federation.application.federation.transport.UpdateTopics;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.OutboxRepository;
import com.federation.application.port.out.OutboxRepository.OutboxEntry;
import com.federation.domain.event.SiteContentChanged;
import com.federation.infrastructure.config.AppProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

import static com.federation.support.TestData.NOW;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Unit tests for OutboxPoller.
 * Tests the outbox polling and Kafka publishing logic.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("OutboxPoller")
@SuppressWarnings("unchecked")
class OutboxPollerTest {

    @Mock
    private OutboxRepository outboxRepository;

    @Mock
    private KafkaTemplate<String, String> kafkaTemplate;

    @Mock
    private SubscriberDiscovery subscriberDiscovery;

    @Mock
    private MetricsPort metrics;

    private OutboxPoller outboxPoller;

    @BeforeEach
    void setUp() {
        AppProperties appProperties = new AppProperties();
        appProperties.setOutbox(new AppProperties.Outbox());
        appProperties.getOutbox().setBatchSize(100);
        appProperties.setKafka(new AppProperties.Kafka());
        appProperties.getKafka().setTopic("federation.events");

        outboxPoller = new OutboxPoller(outboxRepository, kafkaTemplate, subscriberDiscovery,
                new UpdateTopics("federation.site.", "federation-"), appProperties, metrics,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private ProducerRecord<String, String> sentRecord() {
        ArgumentCaptor<ProducerRecord<String, String>> captor = ArgumentCaptor.forClass(ProducerRecord.class);
        verify(kafkaTemplate).send(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("pollAndPublish")
    class PollAndPublishTests {

        @Test
        @DisplayName("Should do nothing when no entries")
        void shouldDoNothingWhenNoEntries() {
            // Given
            when(outboxRepository.findUnprocessedWithLock(100)).thenReturn(List.of());

            // When
            outboxPoller.pollAndPublish();

            // Then
            verifyNoInteractions(kafkaTemplate, subscriberDiscovery);
            verify(outboxRepository, never()).markAsProcessed(any());
        }

        @Test
        @DisplayName("Should publish follow events to the shared events topic")
        void shouldPublishFollowEventsToEventsTopic() {
            // Given
            OutboxEntry entry = new OutboxEntry(
                    UUID.randomUUID(), "FOLLOW_EDGE_ADDED", "edge-123",
                    "{\"edgeId\":\"edge-123\"}", "request-1"
            );
            when(outboxRepository.findUnprocessedWithLock(100)).thenReturn(List.of(entry));

            // When
            outboxPoller.pollAndPublish();

            // Then
            ProducerRecord<String, String> record = sentRecord();
            assertEquals("federation.events", record.topic());
            assertEquals("edge-123", record.key());
            assertEquals("{\"edgeId\":\"edge-123\"}", record.value());
            verifyNoInteractions(subscriberDiscovery);
        }

        @Test
        @DisplayName("Should publish content updates to the site's update topic after discovery")
        void shouldPublishContentUpdatesToSiteTopic() {
            // Given
            OutboxEntry entry = new OutboxEntry(
                    UUID.randomUUID(), SiteContentChanged.TYPE, "A", "{\"siteId\":\"A\"}", null
            );
            when(outboxRepository.findUnprocessedWithLock(100)).thenReturn(List.of(entry));
            when(subscriberDiscovery.awaitSubscribers("federation.site.A.updates")).thenReturn(0);

            // When
            outboxPoller.pollAndPublish();

            // Then
            ProducerRecord<String, String> record = sentRecord();
            assertEquals("federation.site.A.updates", record.topic());
            assertNull(record.headers().lastHeader("requestId"));
        }

        @Test
        @DisplayName("Should add headers to Kafka record")
        void shouldAddHeadersToKafkaRecord() {
            // Given
            OutboxEntry entry = new OutboxEntry(
                    UUID.randomUUID(), "FOLLOW_EDGE_REMOVED", "edge-123", "{}", "request-1"
            );
            when(outboxRepository.findUnprocessedWithLock(100)).thenReturn(List.of(entry));

            // When
            outboxPoller.pollAndPublish();

            // Then
            ProducerRecord<String, String> record = sentRecord();
            assertNotNull(record.headers().lastHeader("eventType"));
            assertNotNull(record.headers().lastHeader("eventId"));
            assertNotNull(record.headers().lastHeader("requestId"));
        }

        @Test
        @DisplayName("Should mark entries as processed and count them")
        void shouldMarkEntriesAsProcessed() {
            // Given
            UUID entryId1 = UUID.randomUUID();
            UUID entryId2 = UUID.randomUUID();
            List<OutboxEntry> entries = List.of(
                    new OutboxEntry(entryId1, "FOLLOW_EDGE_ADDED", "edge-1", "{}", "req-1"),
                    new OutboxEntry(entryId2, "FOLLOW_EDGE_REMOVED", "edge-2", "{}", "req-2")
            );
            when(outboxRepository.findUnprocessedWithLock(100)).thenReturn(entries);

            // When
            outboxPoller.pollAndPublish();

            // Then
            verify(kafkaTemplate, times(2)).send(any(ProducerRecord.class));
            verify(outboxRepository).markAsProcessed(List.of(entryId1, entryId2));
            verify(metrics).incrementOutboxEventsPublished(2);
        }
    }

    @Test
    @DisplayName("Should clean up entries processed more than a day ago")
    void shouldCleanUpOldEvents() {
        // When
        outboxPoller.cleanupOldEvents();

        // Then
        verify(outboxRepository).deleteProcessedOlderThan(NOW.minusSeconds(24 * 3600));
    }
}
