package com.federation.support;

import com.federation.application.port.out.MessageBus;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Synchronous bus: a publish hands the payload to every current subscriber of the topic on the caller's thread.
 * Each topic keeps its log; a group subscribing to a topic for the first time is handed the log first, the way
 * a new consumer group starts from the earliest offset.
 */
public class InMemoryMessageBus implements MessageBus {

    private final Map<String, List<Subscriber>> subscribers = new ConcurrentHashMap<>();
    private final Map<String, List<String>> logs = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> knownGroups = new ConcurrentHashMap<>();
    private final List<String> discoveryRequests = new CopyOnWriteArrayList<>();

    private record Subscriber(String groupId, Consumer<String> handler) {}

    /**
     * Appends to the topic's log and delivers to the current subscribers, as a producer on the broker would.
     */
    public void publish(String topic, String payload) {
        logs.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(payload);
        for (Subscriber subscriber : subscribers.getOrDefault(topic, List.of())) {
            subscriber.handler().accept(payload);
        }
    }

    @Override
    public BusSubscription subscribe(String topic, String groupId, Consumer<String> handler) {
        Subscriber subscriber = new Subscriber(groupId, handler);
        if (knownGroups.computeIfAbsent(topic, t -> ConcurrentHashMap.newKeySet()).add(groupId)) {
            logs.getOrDefault(topic, List.of()).forEach(handler);
        }
        subscribers.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> subscribers.getOrDefault(topic, new ArrayList<>()).remove(subscriber);
    }

    @Override
    public int subscriberCount(String topic) {
        return (int) subscribers.getOrDefault(topic, List.of()).stream()
            .map(Subscriber::groupId)
            .distinct()
            .count();
    }

    @Override
    public void requestSubscriberDiscovery(String topic) {
        discoveryRequests.add(topic);
    }

    public List<String> discoveryRequests() {
        return List.copyOf(discoveryRequests);
    }
}
