package com.federation.adapter.out.messaging;

import com.federation.application.port.out.MessageBus;
import com.federation.infrastructure.config.AppProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Waits briefly for an update topic to have subscribers before the first publish to it.
 * A positive count is cached per topic; publishing goes ahead whatever the outcome.
 */
@Component
public class SubscriberDiscovery {

    private static final Logger log = LoggerFactory.getLogger(SubscriberDiscovery.class);

    private final MessageBus bus;
    private final AppProperties.MessageBus settings;
    private final Clock clock;
    private final Map<String, Instant> knownUntil = new ConcurrentHashMap<>();

    public SubscriberDiscovery(MessageBus bus, AppProperties appProperties, Clock clock) {
        this.bus = bus;
        this.settings = appProperties.getFederation().getMessageBus();
        this.clock = clock;
    }

    /**
     * Returns the number of subscribers seen, zero if none showed up within the discovery wait.
     */
    public int awaitSubscribers(String topic) {
        Instant cached = knownUntil.get(topic);
        if (cached != null && clock.instant().isBefore(cached)) {
            return 1;
        }

        bus.requestSubscriberDiscovery(topic);
        long deadline = System.nanoTime() + settings.getDiscoveryWait().toNanos();
        int count = bus.subscriberCount(topic);
        while (count == 0 && System.nanoTime() < deadline) {
            if (!pause(settings.getDiscoveryPollInterval())) {
                break;
            }
            count = bus.subscriberCount(topic);
        }

        if (count > 0) {
            knownUntil.put(topic, clock.instant().plus(settings.getDiscoveryCacheTtl()));
        } else {
            log.debug("No subscribers on {} after {}", topic, settings.getDiscoveryWait());
        }
        return count;
    }

    private static boolean pause(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
