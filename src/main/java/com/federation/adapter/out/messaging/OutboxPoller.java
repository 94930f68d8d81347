package com.federation.adapter.out.messaging;

import com.federation.application.federation.transport.UpdateTopics;
import com.federation.application.port.out.MetricsPort;
import com.federation.application.port.out.OutboxRepository;
import com.federation.application.port.out.OutboxRepository.OutboxEntry;
import com.federation.domain.event.SiteContentChanged;
import com.federation.infrastructure.config.AppProperties;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.header.internals.RecordHeader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

/**
 * Relays outbox rows to Kafka. Content updates go to the authoring site's update topic,
 * follow graph events to the shared events topic.
 */
@Component
public class OutboxPoller {

    private static final Logger log = LoggerFactory.getLogger(OutboxPoller.class);

    private final OutboxRepository outboxRepository;
    private final KafkaTemplate<String, String> kafkaTemplate;
    private final SubscriberDiscovery subscriberDiscovery;
    private final UpdateTopics updateTopics;
    private final AppProperties appProperties;
    private final MetricsPort metrics;
    private final Clock clock;

    public OutboxPoller(
            OutboxRepository outboxRepository,
            KafkaTemplate<String, String> kafkaTemplate,
            SubscriberDiscovery subscriberDiscovery,
            UpdateTopics updateTopics,
            AppProperties appProperties,
            MetricsPort metrics,
            Clock clock) {
        this.outboxRepository = outboxRepository;
        this.kafkaTemplate = kafkaTemplate;
        this.subscriberDiscovery = subscriberDiscovery;
        this.updateTopics = updateTopics;
        this.appProperties = appProperties;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.outbox.poll-interval-ms:1000}")
    @Transactional
    public void pollAndPublish() {
        List<OutboxEntry> entries = outboxRepository.findUnprocessedWithLock(
            appProperties.getOutbox().getBatchSize()
        );

        if (entries.isEmpty()) {
            return;
        }

        log.debug("Processing {} outbox entries", entries.size());

        for (OutboxEntry entry : entries) {
            publishToKafka(entry);
        }

        List<UUID> processedIds = entries.stream()
            .map(OutboxEntry::id)
            .toList();
        outboxRepository.markAsProcessed(processedIds);

        metrics.incrementOutboxEventsPublished(entries.size());
        log.info("Published {} events to Kafka", entries.size());
    }

    private void publishToKafka(OutboxEntry entry) {
        String topic = topicFor(entry);
        ProducerRecord<String, String> record = new ProducerRecord<>(
            topic,
            null,
            entry.aggregateId(),
            entry.payload()
        );

        record.headers().add(new RecordHeader("eventType", entry.eventType().getBytes(StandardCharsets.UTF_8)));
        record.headers().add(new RecordHeader("eventId", entry.id().toString().getBytes(StandardCharsets.UTF_8)));
        if (entry.requestId() != null) {
            record.headers().add(new RecordHeader("requestId", entry.requestId().getBytes(StandardCharsets.UTF_8)));
        }

        kafkaTemplate.send(record);
        log.debug("Published event: type={}, aggregateId={}, topic={}", entry.eventType(), entry.aggregateId(), topic);
    }

    private String topicFor(OutboxEntry entry) {
        if (!SiteContentChanged.TYPE.equals(entry.eventType())) {
            return appProperties.getKafka().getTopic();
        }
        String topic = updateTopics.updatesTopic(entry.aggregateId());
        if (subscriberDiscovery.awaitSubscribers(topic) == 0) {
            log.debug("Publishing to {} with no known subscribers", topic);
        }
        return topic;
    }

    @Scheduled(cron = "0 0 * * * *") // Every hour
    @Transactional
    public void cleanupOldEvents() {
        outboxRepository.deleteProcessedOlderThan(clock.instant().minus(24, ChronoUnit.HOURS));
        log.info("Cleaned up processed outbox events older than 24 hours");
    }
}
