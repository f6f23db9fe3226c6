package io.twingraph.events.config;

import io.twingraph.events.sink.kafka.KafkaSinkProperties;
import io.twingraph.events.sink.kusto.KustoSinkProperties;
import io.twingraph.events.sink.mqtt.MqttSinkProperties;
import io.twingraph.events.sink.webhook.WebhookSinkProperties;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "events")
public class EventsProperties {

    private String sourceUri = "http://localhost";
    private long shutdownTimeoutMs = 10000L;
    private final Replication replication = new Replication();
    private final Queue queue = new Queue();
    private final Consumer consumer = new Consumer();
    private final Resilience resilience = new Resilience();
    private final DeadLetter deadLetter = new DeadLetter();
    private final Telemetry telemetry = new Telemetry();
    private final Sinks sinks = new Sinks();
    private List<Route> routes = new ArrayList<>();

    public String getSourceUri() {
        return sourceUri;
    }

    public void setSourceUri(String sourceUri) {
        this.sourceUri = sourceUri;
    }

    public long getShutdownTimeoutMs() {
        return shutdownTimeoutMs;
    }

    public void setShutdownTimeoutMs(long shutdownTimeoutMs) {
        this.shutdownTimeoutMs = shutdownTimeoutMs;
    }

    public Replication getReplication() {
        return replication;
    }

    public Queue getQueue() {
        return queue;
    }

    public Consumer getConsumer() {
        return consumer;
    }

    public Resilience getResilience() {
        return resilience;
    }

    public DeadLetter getDeadLetter() {
        return deadLetter;
    }

    public Telemetry getTelemetry() {
        return telemetry;
    }

    public Sinks getSinks() {
        return sinks;
    }

    public List<Route> getRoutes() {
        return routes;
    }

    public void setRoutes(List<Route> routes) {
        this.routes = routes;
    }

    public static class Replication {
        private boolean enabled = true;
        private String jdbcUrl;
        private String username;
        private String password;
        private String publication = "age_pub";
        private String slot = "age_slot";
        private int maxBatchSize = 50;
        private long flushIntervalMs = 1000L;
        private int walReceiverTimeoutSeconds = 30;
        private long reconnectDelayMs = 5000L;
        private int statusIntervalSeconds = 10;
        private CheckpointStoreType checkpointStore = CheckpointStoreType.SLOT;
        private String checkpointFilePath = "./state/replication-checkpoint.txt";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getJdbcUrl() {
            return jdbcUrl;
        }

        public void setJdbcUrl(String jdbcUrl) {
            this.jdbcUrl = jdbcUrl;
        }

        public String getUsername() {
            return username;
        }

        public void setUsername(String username) {
            this.username = username;
        }

        public String getPassword() {
            return password;
        }

        public void setPassword(String password) {
            this.password = password;
        }

        public String getPublication() {
            return publication;
        }

        public void setPublication(String publication) {
            this.publication = publication;
        }

        public String getSlot() {
            return slot;
        }

        public void setSlot(String slot) {
            this.slot = slot;
        }

        public int getMaxBatchSize() {
            return maxBatchSize;
        }

        public void setMaxBatchSize(int maxBatchSize) {
            this.maxBatchSize = maxBatchSize;
        }

        public long getFlushIntervalMs() {
            return flushIntervalMs;
        }

        public void setFlushIntervalMs(long flushIntervalMs) {
            this.flushIntervalMs = flushIntervalMs;
        }

        public int getWalReceiverTimeoutSeconds() {
            return walReceiverTimeoutSeconds;
        }

        public void setWalReceiverTimeoutSeconds(int walReceiverTimeoutSeconds) {
            this.walReceiverTimeoutSeconds = walReceiverTimeoutSeconds;
        }

        /**
         * Idle bound for the replication connection; non-positive values fall back to 30 seconds.
         */
        public int effectiveWalReceiverTimeoutSeconds() {
            return walReceiverTimeoutSeconds > 0 ? walReceiverTimeoutSeconds : 30;
        }

        public long getReconnectDelayMs() {
            return reconnectDelayMs;
        }

        public void setReconnectDelayMs(long reconnectDelayMs) {
            this.reconnectDelayMs = reconnectDelayMs;
        }

        public int getStatusIntervalSeconds() {
            return statusIntervalSeconds;
        }

        public void setStatusIntervalSeconds(int statusIntervalSeconds) {
            this.statusIntervalSeconds = statusIntervalSeconds;
        }

        public CheckpointStoreType getCheckpointStore() {
            return checkpointStore;
        }

        public void setCheckpointStore(CheckpointStoreType checkpointStore) {
            this.checkpointStore = checkpointStore;
        }

        public String getCheckpointFilePath() {
            return checkpointFilePath;
        }

        public void setCheckpointFilePath(String checkpointFilePath) {
            this.checkpointFilePath = checkpointFilePath;
        }
    }

    public enum CheckpointStoreType {
        SLOT,
        POSTGRES,
        FILE
    }

    public static class Queue {
        private int capacity = 10000;

        public int getCapacity() {
            return capacity;
        }

        public void setCapacity(int capacity) {
            this.capacity = capacity;
        }
    }

    public static class Consumer {
        private int batchSize = 100;
        private long pollTimeoutMs = 1000L;
        private int laneCapacity = 16;

        public int getBatchSize() {
            return batchSize;
        }

        public void setBatchSize(int batchSize) {
            this.batchSize = batchSize;
        }

        public long getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(long pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }

        public int getLaneCapacity() {
            return laneCapacity;
        }

        public void setLaneCapacity(int laneCapacity) {
            this.laneCapacity = laneCapacity;
        }
    }

    public static class Resilience {
        private int maxAttempts = 3;
        private long initialDelayMs = 2000L;
        private long maxDelayMs = 60000L;
        private double multiplier = 2.0d;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getInitialDelayMs() {
            return initialDelayMs;
        }

        public void setInitialDelayMs(long initialDelayMs) {
            this.initialDelayMs = initialDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public double getMultiplier() {
            return multiplier;
        }

        public void setMultiplier(double multiplier) {
            this.multiplier = multiplier;
        }
    }

    public static class DeadLetter {
        private boolean enabled = true;
        private String schema = "digitaltwins_eventing";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getSchema() {
            return schema;
        }

        public void setSchema(String schema) {
            this.schema = schema;
        }
    }

    public static class Telemetry {
        private boolean enabled = true;
        private String channel = "digitaltwins_telemetry";
        private int pollTimeoutMs = 1000;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getChannel() {
            return channel;
        }

        public void setChannel(String channel) {
            this.channel = channel;
        }

        public int getPollTimeoutMs() {
            return pollTimeoutMs;
        }

        public void setPollTimeoutMs(int pollTimeoutMs) {
            this.pollTimeoutMs = pollTimeoutMs;
        }
    }

    public static class Sinks {
        private List<KafkaSinkProperties> kafka = new ArrayList<>();
        private List<KustoSinkProperties> kusto = new ArrayList<>();
        private List<MqttSinkProperties> mqtt = new ArrayList<>();
        private List<WebhookSinkProperties> webhook = new ArrayList<>();

        public List<KafkaSinkProperties> getKafka() {
            return kafka;
        }

        public void setKafka(List<KafkaSinkProperties> kafka) {
            this.kafka = kafka;
        }

        public List<KustoSinkProperties> getKusto() {
            return kusto;
        }

        public void setKusto(List<KustoSinkProperties> kusto) {
            this.kusto = kusto;
        }

        public List<MqttSinkProperties> getMqtt() {
            return mqtt;
        }

        public void setMqtt(List<MqttSinkProperties> mqtt) {
            this.mqtt = mqtt;
        }

        public List<WebhookSinkProperties> getWebhook() {
            return webhook;
        }

        public void setWebhook(List<WebhookSinkProperties> webhook) {
            this.webhook = webhook;
        }
    }

    public static class Route {
        private String sinkName;
        private String eventFormat;
        private List<String> eventTypes = new ArrayList<>();
        private Map<String, String> typeMappings = new LinkedHashMap<>();

        public String getSinkName() {
            return sinkName;
        }

        public void setSinkName(String sinkName) {
            this.sinkName = sinkName;
        }

        public String getEventFormat() {
            return eventFormat;
        }

        public void setEventFormat(String eventFormat) {
            this.eventFormat = eventFormat;
        }

        public List<String> getEventTypes() {
            return eventTypes;
        }

        public void setEventTypes(List<String> eventTypes) {
            this.eventTypes = eventTypes;
        }

        public Map<String, String> getTypeMappings() {
            return typeMappings;
        }

        public void setTypeMappings(Map<String, String> typeMappings) {
            this.typeMappings = typeMappings;
        }
    }
}
