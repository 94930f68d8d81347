package com.federation.application.port.out;

import java.util.function.Consumer;

/**
 * Topic subscriptions used by the message-bus transport. Updates reach the topics through the outbox.
 */
public interface MessageBus {

    BusSubscription subscribe(String topic, String groupId, Consumer<String> handler);

    /**
     * Number of consumer groups currently attached to the topic. Zero when unknown.
     */
    int subscriberCount(String topic);

    /**
     * Asks the broker to refresh its view of who is subscribed to the topic.
     */
    void requestSubscriberDiscovery(String topic);

    @FunctionalInterface
    interface BusSubscription extends AutoCloseable {
        @Override
        void close();
    }
}
