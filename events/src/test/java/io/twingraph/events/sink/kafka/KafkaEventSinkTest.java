package io.twingraph.events.sink.kafka;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.model.SinkEventType;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.Producer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KafkaEventSinkTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    @DisplayName("send: binary mode record carries ce_* headers, subject key and data value")
    void send_publishesBinaryModeRecords() throws Exception {
        MockProducer<String, byte[]> producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        KafkaEventSink sink = new KafkaEventSink(properties(), objectMapper, producer);

        sink.send(List.of(event("e-1", "room1"), event("e-2", "room2")));

        List<ProducerRecord<String, byte[]>> records = producer.history();
        assertThat(records).hasSize(2);
        ProducerRecord<String, byte[]> first = records.get(0);
        assertThat(first.topic()).isEqualTo("twin-events");
        assertThat(first.key()).isEqualTo("room1");
        assertThat(header(first, "ce_specversion")).isEqualTo("1.0");
        assertThat(header(first, "ce_id")).isEqualTo("e-1");
        assertThat(header(first, "ce_type")).isEqualTo("Microsoft.DigitalTwins.Twin.Create");
        assertThat(header(first, "ce_source")).isEqualTo("https://graph.example/events");
        assertThat(header(first, "ce_time")).isEqualTo("2024-05-01T10:00:00Z");
        assertThat(header(first, "content-type")).isEqualTo("application/json");
        assertThat(first.headers().lastHeader("ce_dataschema")).isNull();
        assertThat(objectMapper.readTree(first.value()).get("$dtId").asText()).isEqualTo("room1");
        assertThat(sink.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("send: empty batch touches nothing")
    void send_emptyBatch() throws Exception {
        MockProducer<String, byte[]> producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());
        KafkaEventSink sink = new KafkaEventSink(properties(), objectMapper, producer);

        sink.send(List.of());

        assertThat(producer.history()).isEmpty();
    }

    @Test
    @DisplayName("send: broker failure marks sink unhealthy and propagates")
    @SuppressWarnings("unchecked")
    void send_failureMarksUnhealthy() {
        Producer<String, byte[]> producer = mock(Producer.class);
        CompletableFuture<RecordMetadata> failed = new CompletableFuture<>();
        failed.completeExceptionally(new KafkaException("broker down"));
        when(producer.send(any(ProducerRecord.class))).thenReturn(failed);
        KafkaEventSink sink = new KafkaEventSink(properties(), objectMapper, producer);

        assertThatThrownBy(() -> sink.send(List.of(event("e-1", "room1"))))
            .isInstanceOf(ExecutionException.class)
            .hasCauseInstanceOf(KafkaException.class);
        assertThat(sink.isHealthy()).isFalse();
    }

    @Test
    @DisplayName("constructor: topic is required")
    void constructor_requiresTopic() {
        KafkaSinkProperties props = properties();
        props.setTopic(" ");
        MockProducer<String, byte[]> producer = new MockProducer<>(true, new StringSerializer(), new ByteArraySerializer());

        assertThatThrownBy(() -> new KafkaEventSink(props, objectMapper, producer))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("requires a topic");
    }

    @Test
    @DisplayName("producerProperties: plain connection keeps acks=all and no SASL")
    void producerProperties_plain() {
        Properties props = KafkaEventSink.producerProperties(properties());

        assertThat(props.getProperty(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG)).isEqualTo("broker:9092");
        assertThat(props.getProperty(ProducerConfig.ACKS_CONFIG)).isEqualTo("all");
        assertThat(props.getProperty(ProducerConfig.CLIENT_ID_CONFIG)).isEqualTo("twingraph-events-kafka-main");
        assertThat(props).doesNotContainKey(SaslConfigs.SASL_MECHANISM);
        assertThat(props).doesNotContainKey(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG);
    }

    @Test
    @DisplayName("producerProperties: username alone selects PLAIN over SASL_SSL")
    void producerProperties_plainSasl() {
        KafkaSinkProperties sinkProps = properties();
        sinkProps.setSaslUsername("$ConnectionString");
        sinkProps.setSaslPassword("secret");

        Properties props = KafkaEventSink.producerProperties(sinkProps);

        assertThat(props.getProperty(SaslConfigs.SASL_MECHANISM)).isEqualTo("PLAIN");
        assertThat(props.getProperty(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG)).isEqualTo("SASL_SSL");
        assertThat(props.getProperty(SaslConfigs.SASL_JAAS_CONFIG))
            .startsWith("org.apache.kafka.common.security.plain.PlainLoginModule required")
            .contains("username=\"$ConnectionString\"")
            .contains("password=\"secret\"");
    }

    @Test
    @DisplayName("producerProperties: OAUTHBEARER wires token endpoint and callback handler")
    void producerProperties_oauth() {
        KafkaSinkProperties sinkProps = properties();
        sinkProps.setSaslMechanism("oauthbearer");
        sinkProps.setTokenEndpoint("https://login.example/token");
        sinkProps.setClientId("client");
        sinkProps.setClientSecret("secret");
        sinkProps.setScope("https://eventhubs.example/.default");

        Properties props = KafkaEventSink.producerProperties(sinkProps);

        assertThat(props.getProperty(SaslConfigs.SASL_MECHANISM)).isEqualTo("OAUTHBEARER");
        assertThat(props.getProperty(SaslConfigs.SASL_LOGIN_CALLBACK_HANDLER_CLASS))
            .isEqualTo(KafkaEventSink.OAUTH_LOGIN_CALLBACK_HANDLER);
        assertThat(props.getProperty(SaslConfigs.SASL_OAUTHBEARER_TOKEN_ENDPOINT_URL)).isEqualTo("https://login.example/token");
        assertThat(props.getProperty(SaslConfigs.SASL_JAAS_CONFIG))
            .contains("clientId=\"client\"")
            .contains("scope=\"https://eventhubs.example/.default\"");
    }

    @Test
    @DisplayName("producerProperties: OAUTHBEARER without credentials is rejected")
    void producerProperties_oauthRequiresCredentials() {
        KafkaSinkProperties sinkProps = properties();
        sinkProps.setSaslMechanism("OAUTHBEARER");

        assertThatThrownBy(() -> KafkaEventSink.producerProperties(sinkProps))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("token-endpoint");
    }

    @Test
    @DisplayName("producerProperties: bootstrap servers are required")
    void producerProperties_requiresBootstrap() {
        KafkaSinkProperties sinkProps = properties();
        sinkProps.setBootstrapServers(null);

        assertThatThrownBy(() -> KafkaEventSink.producerProperties(sinkProps))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("bootstrap-servers");
    }

    private static KafkaSinkProperties properties() {
        KafkaSinkProperties props = new KafkaSinkProperties();
        props.setName("kafka-main");
        props.setBootstrapServers("broker:9092");
        props.setTopic("twin-events");
        props.setSendTimeoutMs(5000L);
        return props;
    }

    private DomainEvent event(String id, String subject) {
        ObjectNode data = objectMapper.createObjectNode().put("$dtId", subject);
        return new DomainEvent(
            id,
            "https://graph.example/events",
            "Microsoft.DigitalTwins.Twin.Create",
            subject,
            Instant.parse("2024-05-01T10:00:00Z"),
            DomainEvent.JSON_CONTENT_TYPE,
            null,
            data,
            SinkEventType.TWIN_CREATE
        );
    }

    private static String header(ProducerRecord<String, byte[]> record, String key) {
        return new String(record.headers().lastHeader(key).value(), StandardCharsets.UTF_8);
    }
}
