package io.twingraph.events.sink.kafka;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.EventSink;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.header.internals.RecordHeaders;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes events in CloudEvents Kafka binary content mode: attributes travel as
 * {@code ce_*} headers and the record value is the event data.
 */
public class KafkaEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(KafkaEventSink.class);

    static final String OAUTH_LOGIN_CALLBACK_HANDLER =
        "org.apache.kafka.common.security.oauthbearer.OAuthBearerLoginCallbackHandler";

    private final String name;
    private final String topic;
    private final long sendTimeoutMs;
    private final ObjectMapper objectMapper;
    private final Producer<String, byte[]> producer;
    private volatile boolean healthy = true;

    public KafkaEventSink(KafkaSinkProperties properties, ObjectMapper objectMapper) {
        this(properties, objectMapper, new KafkaProducer<>(producerProperties(properties)));
    }

    KafkaEventSink(KafkaSinkProperties properties, ObjectMapper objectMapper, Producer<String, byte[]> producer) {
        if (isBlank(properties.getTopic())) {
            throw new IllegalArgumentException("Kafka sink " + properties.getName() + " requires a topic");
        }
        this.name = properties.getName();
        this.topic = properties.getTopic();
        this.sendTimeoutMs = properties.getSendTimeoutMs();
        this.objectMapper = objectMapper;
        this.producer = producer;
    }

    static Properties producerProperties(KafkaSinkProperties properties) {
        if (isBlank(properties.getBootstrapServers())) {
            throw new IllegalArgumentException("Kafka sink " + properties.getName() + " requires bootstrap-servers");
        }
        Properties props = new Properties();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, properties.getBootstrapServers());
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class.getName());
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, ByteArraySerializer.class.getName());
        props.put(ProducerConfig.ACKS_CONFIG, "all");
        props.put(ProducerConfig.REQUEST_TIMEOUT_MS_CONFIG, Integer.toString(properties.getRequestTimeoutMs()));
        props.put(ProducerConfig.DELIVERY_TIMEOUT_MS_CONFIG, Integer.toString(properties.getDeliveryTimeoutMs()));
        props.put(ProducerConfig.LINGER_MS_CONFIG, Integer.toString(properties.getLingerMs()));
        props.put(ProducerConfig.BATCH_SIZE_CONFIG, Integer.toString(properties.getBatchSize()));
        props.put(ProducerConfig.CLIENT_ID_CONFIG, "twingraph-events-" + properties.getName());
        putIfNotBlank(props, ProducerConfig.COMPRESSION_TYPE_CONFIG, properties.getCompressionType());

        String mechanism = saslMechanism(properties);
        if (mechanism == null) {
            putIfNotBlank(props, CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, properties.getSecurityProtocol());
            return props;
        }

        props.put(
            CommonClientConfigs.SECURITY_PROTOCOL_CONFIG,
            isBlank(properties.getSecurityProtocol()) ? "SASL_SSL" : properties.getSecurityProtocol()
        );
        props.put(SaslConfigs.SASL_MECHANISM, mechanism);
        switch (mechanism) {
            case "PLAIN" -> props.put(SaslConfigs.SASL_JAAS_CONFIG, jaas(
                "org.apache.kafka.common.security.plain.PlainLoginModule",
                "username", properties.getSaslUsername(),
                "password", properties.getSaslPassword()
            ));
            case "SCRAM-SHA-256", "SCRAM-SHA-512" -> props.put(SaslConfigs.SASL_JAAS_CONFIG, jaas(
                "org.apache.kafka.common.security.scram.ScramLoginModule",
                "username", properties.getSaslUsername(),
                "password", properties.getSaslPassword()
            ));
            case "OAUTHBEARER" -> {
                if (isBlank(properties.getTokenEndpoint())
                    || isBlank(properties.getClientId())
                    || isBlank(properties.getClientSecret())) {
                    throw new IllegalArgumentException(
                        "Kafka sink " + properties.getName()
                            + " with OAUTHBEARER requires token-endpoint, client-id and client-secret"
                    );
                }
                props.put(SaslConfigs.SASL_LOGIN_CALLBACK_HANDLER_CLASS, OAUTH_LOGIN_CALLBACK_HANDLER);
                props.put(SaslConfigs.SASL_OAUTHBEARER_TOKEN_ENDPOINT_URL, properties.getTokenEndpoint());
                String jaas = "org.apache.kafka.common.security.oauthbearer.OAuthBearerLoginModule required"
                    + " clientId=\"" + properties.getClientId() + "\""
                    + " clientSecret=\"" + properties.getClientSecret() + "\""
                    + (isBlank(properties.getScope()) ? "" : " scope=\"" + properties.getScope() + "\"")
                    + ";";
                props.put(SaslConfigs.SASL_JAAS_CONFIG, jaas);
            }
            default -> throw new IllegalArgumentException(
                "Unsupported SASL mechanism for Kafka sink " + properties.getName() + ": " + mechanism
            );
        }
        return props;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void send(List<DomainEvent> events) throws Exception {
        if (events.isEmpty()) {
            return;
        }
        log.debug("Sending {} events to Kafka sink '{}'", events.size(), name);

        List<Future<RecordMetadata>> futures = new ArrayList<>(events.size());
        try {
            for (DomainEvent event : events) {
                futures.add(producer.send(toRecord(event)));
            }
            producer.flush();

            long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(sendTimeoutMs);
            for (int i = 0; i < futures.size(); i++) {
                long remaining = Math.max(0L, deadline - System.nanoTime());
                RecordMetadata metadata = futures.get(i).get(remaining, TimeUnit.NANOSECONDS);
                log.debug(
                    "Delivered event {} of type {} to partition {}, offset {}",
                    events.get(i).id(),
                    events.get(i).type(),
                    metadata.partition(),
                    metadata.offset()
                );
            }
        } catch (ExecutionException e) {
            healthy = false;
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.error("Kafka sink '{}' failed to deliver batch: {}", name, cause.getMessage());
            throw e;
        } catch (TimeoutException e) {
            healthy = false;
            log.error("Kafka sink '{}' timed out after {} ms waiting for acknowledgements", name, sendTimeoutMs);
            throw e;
        } catch (RuntimeException e) {
            healthy = false;
            log.error("Kafka sink '{}' failed to enqueue batch", name, e);
            throw e;
        }

        healthy = true;
        log.info(
            "Sent {} events with source {} to Kafka sink '{}' (topic={})",
            events.size(),
            events.get(0).source(),
            name,
            topic
        );
    }

    ProducerRecord<String, byte[]> toRecord(DomainEvent event) throws Exception {
        RecordHeaders headers = new RecordHeaders();
        header(headers, "ce_specversion", DomainEvent.SPEC_VERSION);
        header(headers, "ce_id", event.id());
        header(headers, "ce_source", event.source());
        header(headers, "ce_type", event.type());
        header(headers, "ce_subject", event.subject());
        header(headers, "ce_time", event.time() == null ? null : event.time().toString());
        header(headers, "ce_dataschema", event.dataSchema());
        header(headers, "content-type", event.dataContentType());

        byte[] value = event.data() == null ? null : objectMapper.writeValueAsBytes(event.data());
        return new ProducerRecord<>(topic, null, event.subject(), value, headers);
    }

    @Override
    public void close() {
        producer.flush();
        producer.close();
    }

    private static void header(RecordHeaders headers, String key, String value) {
        if (value != null) {
            headers.add(key, value.getBytes(StandardCharsets.UTF_8));
        }
    }

    private static String saslMechanism(KafkaSinkProperties properties) {
        if (!isBlank(properties.getSaslMechanism())) {
            return properties.getSaslMechanism().trim().toUpperCase(Locale.ROOT);
        }
        if (!isBlank(properties.getSaslUsername())) {
            return "PLAIN";
        }
        return null;
    }

    private static String jaas(String module, String userKey, String user, String passwordKey, String password) {
        return module + " required " + userKey + "=\"" + nullToEmpty(user) + "\" "
            + passwordKey + "=\"" + nullToEmpty(password) + "\";";
    }

    private static void putIfNotBlank(Properties props, String key, String value) {
        if (!isBlank(value)) {
            props.put(key, value);
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
