package com.federation.infrastructure.config;

import com.federation.domain.model.ImportMode;
import com.federation.domain.model.TransportKind;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Node node = new Node();
    private Federation federation = new Federation();
    private Outbox outbox = new Outbox();
    private Kafka kafka = new Kafka();
    private Access access = new Access();

    public Node getNode() {
        return node;
    }

    public void setNode(Node node) {
        this.node = node;
    }

    public Federation getFederation() {
        return federation;
    }

    public void setFederation(Federation federation) {
        this.federation = federation;
    }

    public Outbox getOutbox() {
        return outbox;
    }

    public void setOutbox(Outbox outbox) {
        this.outbox = outbox;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public void setKafka(Kafka kafka) {
        this.kafka = kafka;
    }

    public Access getAccess() {
        return access;
    }

    public void setAccess(Access access) {
        this.access = access;
    }

    public static class Node {
        private String address;
        private String name;
        private String publicKey;

        public String getAddress() {
            return address;
        }

        public void setAddress(String address) {
            this.address = address;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getPublicKey() {
            return publicKey;
        }

        public void setPublicKey(String publicKey) {
            this.publicKey = publicKey;
        }
    }

    public static class Federation {
        private TransportKind transport = TransportKind.MESSAGE_BUS;
        private ImportMode importMode = ImportMode.CONTENT;
        private int batchSize = 20;
        private boolean purgeOnUnfollow = true;
        private boolean publishUpdates = true;
        private int reconcileThreads = 8;
        private int deliveryThreads = 4;
        private int timerThreads = 4;
        private Session session = new Session();
        private MessageBus messageBus = new MessageBus();
        private Mirror mirror = new Mirror();

        public TransportKind getTransport() {
            return transport;
        }

        public void setTransport(TransportKind transport) {
            this.transport = transport;
        }

        public ImportMode getImportMode() {
            return importMode;
        }

        public void setImportMode(ImportMode importMode) {
            this.importMode = importMode;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public boolean isPurgeOnUnfollow() {
            return purgeOnUnfollow;
        }

        public void setPurgeOnUnfollow(boolean purgeOnUnfollow) {
            this.purgeOnUnfollow = purgeOnUnfollow;
        }

        public boolean isPublishUpdates() {
            return publishUpdates;
        }

        public void setPublishUpdates(boolean publishUpdates) {
            this.publishUpdates = publishUpdates;
        }

        public int getReconcileThreads() {
            return reconcileThreads;
        }

        public void setReconcileThreads(int reconcileThreads) {
            this.reconcileThreads = reconcileThreads;
        }

        public int getDeliveryThreads() {
            return deliveryThreads;
        }

        public void setDeliveryThreads(int deliveryThreads) {
            this.deliveryThreads = deliveryThreads;
        }

        public int getTimerThreads() {
            return timerThreads;
        }

        public void setTimerThreads(int timerThreads) {
            this.timerThreads = timerThreads;
        }

        public Session getSession() {
            return session;
        }

        public void setSession(Session session) {
            this.session = session;
        }

        public MessageBus getMessageBus() {
            return messageBus;
        }

        public void setMessageBus(MessageBus messageBus) {
            this.messageBus = messageBus;
        }

        public Mirror getMirror() {
            return mirror;
        }

        public void setMirror(Mirror mirror) {
            this.mirror = mirror;
        }
    }

    public static class Session {
        private int maxConnectAttempts = 5;
        private Duration connectTimeoutInitial = Duration.ofSeconds(15);
        private Duration connectTimeoutStep = Duration.ofSeconds(2);
        private Duration connectTimeoutMin = Duration.ofSeconds(5);
        private Duration connectBackoffBase = Duration.ofSeconds(2);
        private Duration connectBackoffCap = Duration.ofSeconds(30);
        private Duration backgroundRetryInterval = Duration.ofSeconds(30);
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private Duration idleThreshold = Duration.ofMinutes(5);
        private Duration reconnectBackoffBase = Duration.ofSeconds(1);
        private Duration reconnectBackoffCap = Duration.ofSeconds(60);
        private double jitter = 0.1;

        public int getMaxConnectAttempts() {
            return maxConnectAttempts;
        }

        public void setMaxConnectAttempts(int maxConnectAttempts) {
            this.maxConnectAttempts = maxConnectAttempts;
        }

        public Duration getConnectTimeoutInitial() {
            return connectTimeoutInitial;
        }

        public void setConnectTimeoutInitial(Duration connectTimeoutInitial) {
            this.connectTimeoutInitial = connectTimeoutInitial;
        }

        public Duration getConnectTimeoutStep() {
            return connectTimeoutStep;
        }

        public void setConnectTimeoutStep(Duration connectTimeoutStep) {
            this.connectTimeoutStep = connectTimeoutStep;
        }

        public Duration getConnectTimeoutMin() {
            return connectTimeoutMin;
        }

        public void setConnectTimeoutMin(Duration connectTimeoutMin) {
            this.connectTimeoutMin = connectTimeoutMin;
        }

        public Duration getConnectBackoffBase() {
            return connectBackoffBase;
        }

        public void setConnectBackoffBase(Duration connectBackoffBase) {
            this.connectBackoffBase = connectBackoffBase;
        }

        public Duration getConnectBackoffCap() {
            return connectBackoffCap;
        }

        public void setConnectBackoffCap(Duration connectBackoffCap) {
            this.connectBackoffCap = connectBackoffCap;
        }

        public Duration getBackgroundRetryInterval() {
            return backgroundRetryInterval;
        }

        public void setBackgroundRetryInterval(Duration backgroundRetryInterval) {
            this.backgroundRetryInterval = backgroundRetryInterval;
        }

        public Duration getHealthCheckInterval() {
            return healthCheckInterval;
        }

        public void setHealthCheckInterval(Duration healthCheckInterval) {
            this.healthCheckInterval = healthCheckInterval;
        }

        public Duration getIdleThreshold() {
            return idleThreshold;
        }

        public void setIdleThreshold(Duration idleThreshold) {
            this.idleThreshold = idleThreshold;
        }

        public Duration getReconnectBackoffBase() {
            return reconnectBackoffBase;
        }

        public void setReconnectBackoffBase(Duration reconnectBackoffBase) {
            this.reconnectBackoffBase = reconnectBackoffBase;
        }

        public Duration getReconnectBackoffCap() {
            return reconnectBackoffCap;
        }

        public void setReconnectBackoffCap(Duration reconnectBackoffCap) {
            this.reconnectBackoffCap = reconnectBackoffCap;
        }

        public double getJitter() {
            return jitter;
        }

        public void setJitter(double jitter) {
            this.jitter = jitter;
        }
    }

    public static class MessageBus {
        private Duration historicalWindow = Duration.ofSeconds(60);
        private Duration historicalPollInterval = Duration.ofSeconds(3);
        private Duration historicalOpenTimeout = Duration.ofSeconds(15);
        private Duration discoveryWait = Duration.ofSeconds(2);
        private Duration discoveryPollInterval = Duration.ofMillis(100);
        private Duration discoveryCacheTtl = Duration.ofSeconds(30);
        private String topicPrefix = "federation.site.";
        private String consumerGroupPrefix = "federation-";

        public Duration getHistoricalWindow() {
            return historicalWindow;
        }

        public void setHistoricalWindow(Duration historicalWindow) {
            this.historicalWindow = historicalWindow;
        }

        public Duration getHistoricalPollInterval() {
            return historicalPollInterval;
        }

        public void setHistoricalPollInterval(Duration historicalPollInterval) {
            this.historicalPollInterval = historicalPollInterval;
        }

        public Duration getHistoricalOpenTimeout() {
            return historicalOpenTimeout;
        }

        public void setHistoricalOpenTimeout(Duration historicalOpenTimeout) {
            this.historicalOpenTimeout = historicalOpenTimeout;
        }

        public Duration getDiscoveryWait() {
            return discoveryWait;
        }

        public void setDiscoveryWait(Duration discoveryWait) {
            this.discoveryWait = discoveryWait;
        }

        public Duration getDiscoveryPollInterval() {
            return discoveryPollInterval;
        }

        public void setDiscoveryPollInterval(Duration discoveryPollInterval) {
            this.discoveryPollInterval = discoveryPollInterval;
        }

        public Duration getDiscoveryCacheTtl() {
            return discoveryCacheTtl;
        }

        public void setDiscoveryCacheTtl(Duration discoveryCacheTtl) {
            this.discoveryCacheTtl = discoveryCacheTtl;
        }

        public String getTopicPrefix() {
            return topicPrefix;
        }

        public void setTopicPrefix(String topicPrefix) {
            this.topicPrefix = topicPrefix;
        }

        public String getConsumerGroupPrefix() {
            return consumerGroupPrefix;
        }

        public void setConsumerGroupPrefix(String consumerGroupPrefix) {
            this.consumerGroupPrefix = consumerGroupPrefix;
        }
    }

    public static class Mirror {
        private int scanBatchSize = 100;

        public int getScanBatchSize() {
            return scanBatchSize;
        }

        public void setScanBatchSize(int scanBatchSize) {
            this.scanBatchSize = scanBatchSize;
        }
    }

    public static class Outbox {
        private long pollIntervalMs = 1000;
        private int batchSize = 100;

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }
    }

    public static class Kafka {
        private String topic = "federation.follow-events";

        public String getTopic() {
            return topic;
        }

        public void setTopic(String topic) {
            this.topic = topic;
        }
    }

    public static class Access {
        private List<String> deniedKeys = new ArrayList<>();

        public List<String> getDeniedKeys() {
            return deniedKeys;
        }

        public void setDeniedKeys(List<String> deniedKeys) {
            this.deniedKeys = deniedKeys;
        }
    }
}
