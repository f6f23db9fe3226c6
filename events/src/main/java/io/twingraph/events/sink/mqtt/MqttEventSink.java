package io.twingraph.events.sink.mqtt;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.CloudEventJson;
import io.twingraph.events.sink.EventSink;
import java.util.List;
import java.util.UUID;
import org.eclipse.paho.client.mqttv3.IMqttClient;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttConnectOptions;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.MqttMessage;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes each event as a structured CloudEvent JSON message on a fixed topic.
 */
public class MqttEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(MqttEventSink.class);

    private final String name;
    private final String topic;
    private final int qos;
    private final ObjectMapper objectMapper;
    private final IMqttClient client;
    private final MqttConnectOptions connectOptions;
    private volatile boolean healthy = true;

    public MqttEventSink(MqttSinkProperties properties, ObjectMapper objectMapper) throws MqttException {
        this(properties, objectMapper, new MqttClient(properties.serverUri(), clientId(properties), new MemoryPersistence()));
    }

    MqttEventSink(MqttSinkProperties properties, ObjectMapper objectMapper, IMqttClient client) {
        if (isBlank(properties.getBroker()) || isBlank(properties.getTopic())) {
            throw new IllegalArgumentException("MQTT sink " + properties.getName() + " requires broker and topic");
        }
        if (properties.getQos() < 0 || properties.getQos() > 2) {
            throw new IllegalArgumentException("MQTT sink " + properties.getName() + " has invalid qos " + properties.getQos());
        }
        this.name = properties.getName();
        this.topic = properties.getTopic();
        this.qos = properties.getQos();
        this.objectMapper = objectMapper;
        this.client = client;
        this.connectOptions = connectOptions(properties);
    }

    static MqttConnectOptions connectOptions(MqttSinkProperties properties) {
        MqttConnectOptions options = new MqttConnectOptions();
        options.setCleanSession(true);
        options.setAutomaticReconnect(false);
        options.setMqttVersion(mqttVersion(properties));
        if (!isBlank(properties.getUsername())) {
            options.setUserName(properties.getUsername());
            options.setPassword(properties.getPassword() == null ? new char[0] : properties.getPassword().toCharArray());
        }
        return options;
    }

    static int mqttVersion(MqttSinkProperties properties) {
        String version = properties.getProtocolVersion() == null ? "" : properties.getProtocolVersion().trim();
        switch (version) {
            case "3.1":
            case "3.1.0":
                return MqttConnectOptions.MQTT_VERSION_3_1;
            case "":
            case "3.1.1":
                return MqttConnectOptions.MQTT_VERSION_3_1_1;
            default:
                log.warn(
                    "MQTT sink '{}' requested protocol version {}; only 3.1 and 3.1.1 are supported, using 3.1.1",
                    properties.getName(),
                    version
                );
                return MqttConnectOptions.MQTT_VERSION_3_1_1;
        }
    }

    private static String clientId(MqttSinkProperties properties) {
        return isBlank(properties.getClientId())
            ? "twingraph-events-" + UUID.randomUUID()
            : properties.getClientId();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isHealthy() {
        return healthy && client.isConnected();
    }

    @Override
    public void send(List<DomainEvent> events) throws Exception {
        if (events.isEmpty()) {
            return;
        }
        try {
            ensureConnected();
            for (DomainEvent event : events) {
                MqttMessage message = new MqttMessage(CloudEventJson.toStructuredBytes(objectMapper, event));
                message.setQos(qos);
                client.publish(topic, message);
            }
        } catch (MqttException e) {
            healthy = false;
            log.error("MQTT sink '{}' failed to publish to {} (reasonCode={})", name, topic, e.getReasonCode(), e);
            throw e;
        }
        healthy = true;
        log.info("Published {} events to MQTT sink '{}' (topic={})", events.size(), name, topic);
    }

    /**
     * Connects eagerly so health reflects the broker before the first publish.
     */
    public void start() {
        try {
            ensureConnected();
        } catch (MqttException e) {
            healthy = false;
            log.warn("MQTT sink '{}' could not connect to {}; will retry on next publish", name, client.getServerURI(), e);
        }
    }

    private void ensureConnected() throws MqttException {
        if (client.isConnected()) {
            return;
        }
        log.info("Connecting MQTT sink '{}' to {}", name, client.getServerURI());
        client.connect(connectOptions);
    }

    @Override
    public void close() {
        try {
            if (client.isConnected()) {
                client.disconnect();
            }
            client.close();
        } catch (MqttException e) {
            log.warn("Failed to close MQTT client for sink '{}'", name, e);
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
