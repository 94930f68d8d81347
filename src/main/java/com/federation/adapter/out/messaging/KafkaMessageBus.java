package com.federation.adapter.out.messaging;

import com.federation.application.port.out.MessageBus;
import com.federation.infrastructure.config.AppProperties;
import org.apache.kafka.clients.admin.AdminClient;
import org.apache.kafka.clients.admin.ConsumerGroupDescription;
import org.apache.kafka.clients.admin.ConsumerGroupListing;
import org.apache.kafka.clients.admin.NewTopic;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.errors.TopicExistsException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.listener.ConcurrentMessageListenerContainer;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.MessageListener;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Kafka-backed message bus. Each subscription gets its own listener container under the given group;
 * subscriber counts come from the broker's view of the federation consumer groups.
 */
@Component
public class KafkaMessageBus implements MessageBus {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageBus.class);
    private static final long TIMEOUT_SECONDS = 30;

    private final ConsumerFactory<String, String> consumerFactory;
    private final KafkaAdmin kafkaAdmin;
    private final AppProperties appProperties;

    public KafkaMessageBus(
            ConsumerFactory<String, String> consumerFactory,
            KafkaAdmin kafkaAdmin,
            AppProperties appProperties) {
        this.consumerFactory = consumerFactory;
        this.kafkaAdmin = kafkaAdmin;
        this.appProperties = appProperties;
    }

    @Override
    public BusSubscription subscribe(String topic, String groupId, Consumer<String> handler) {
        ContainerProperties properties = new ContainerProperties(topic);
        properties.setGroupId(groupId);
        properties.setMessageListener((MessageListener<String, String>) record -> consume(record, handler));

        ConcurrentMessageListenerContainer<String, String> container =
            new ConcurrentMessageListenerContainer<>(consumerFactory, properties);
        container.setBeanName(groupId);
        container.start();
        log.info("Started listener on {} for group {}", topic, groupId);
        return () -> {
            container.stop();
            log.info("Stopped listener on {} for group {}", topic, groupId);
        };
    }

    @Override
    public int subscriberCount(String topic) {
        String prefix = appProperties.getFederation().getMessageBus().getConsumerGroupPrefix();
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            List<String> groupIds = adminClient.listConsumerGroups()
                .all()
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS)
                .stream()
                .map(ConsumerGroupListing::groupId)
                .filter(groupId -> groupId.startsWith(prefix))
                .toList();
            if (groupIds.isEmpty()) {
                return 0;
            }
            Map<String, ConsumerGroupDescription> groups = adminClient.describeConsumerGroups(groupIds)
                .all()
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            return (int) groups.values().stream()
                .filter(group -> readsTopic(group, topic))
                .count();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while counting subscribers of {}", topic, e);
            return 0;
        } catch (ExecutionException | TimeoutException e) {
            log.warn("Failed to count subscribers of {}: {}", topic, e.getMessage());
            return 0;
        }
    }

    @Override
    public void requestSubscriberDiscovery(String topic) {
        try (AdminClient adminClient = AdminClient.create(kafkaAdmin.getConfigurationProperties())) {
            adminClient.createTopics(List.of(new NewTopic(topic, 1, (short) 1)))
                .all()
                .get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            log.info("Created update topic {}", topic);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Interrupted while preparing topic {}", topic, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TopicExistsException) {
                log.debug("Topic {} already exists", topic);
            } else {
                log.warn("Failed to prepare topic {}: {}", topic, e.getMessage());
            }
        } catch (TimeoutException e) {
            log.warn("Timed out preparing topic {}", topic);
        }
    }

    private static boolean readsTopic(ConsumerGroupDescription group, String topic) {
        return group.members().stream()
            .flatMap(member -> member.assignment().topicPartitions().stream())
            .anyMatch(partition -> partition.topic().equals(topic));
    }

    private void consume(ConsumerRecord<String, String> record, Consumer<String> handler) {
        String requestId = extractHeader(record, "requestId");
        if (requestId != null) {
            MDC.put("requestId", requestId);
        }
        try {
            handler.accept(record.value());
        } catch (Exception e) {
            log.error("Failed to handle message from {}: {}", record.topic(), e.getMessage(), e);
        } finally {
            MDC.remove("requestId");
        }
    }

    private String extractHeader(ConsumerRecord<String, String> record, String headerName) {
        var header = record.headers().lastHeader(headerName);
        return header != null ? new String(header.value(), StandardCharsets.UTF_8) : null;
    }
}
