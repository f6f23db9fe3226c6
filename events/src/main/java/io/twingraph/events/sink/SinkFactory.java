package io.twingraph.events.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.config.EventsProperties;
import io.twingraph.events.metrics.PipelineMetrics;
import io.twingraph.events.resilience.DeadLetterStore;
import io.twingraph.events.resilience.ResilientEventSink;
import io.twingraph.events.sink.kafka.KafkaEventSink;
import io.twingraph.events.sink.kafka.KafkaSinkProperties;
import io.twingraph.events.sink.kusto.KustoEventSink;
import io.twingraph.events.sink.kusto.KustoSinkProperties;
import io.twingraph.events.sink.kusto.SdkKustoIngestGateway;
import io.twingraph.events.sink.mqtt.MqttEventSink;
import io.twingraph.events.sink.mqtt.MqttSinkProperties;
import io.twingraph.events.sink.webhook.WebhookEventSink;
import io.twingraph.events.sink.webhook.WebhookSinkProperties;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.client.RestClient;

/**
 * Builds the enabled sinks from configuration, each wrapped with retry and dead-lettering.
 */
public class SinkFactory {

    private static final Logger log = LoggerFactory.getLogger(SinkFactory.class);

    private final ObjectMapper objectMapper;
    private final RestClient.Builder restClientBuilder;
    private final DeadLetterStore deadLetterStore;
    private final PipelineMetrics metrics;
    private final ResilientEventSink.RetrySettings retrySettings;

    public SinkFactory(
        ObjectMapper objectMapper,
        RestClient.Builder restClientBuilder,
        DeadLetterStore deadLetterStore,
        PipelineMetrics metrics,
        EventsProperties.Resilience resilience
    ) {
        this.objectMapper = objectMapper;
        this.restClientBuilder = restClientBuilder;
        this.deadLetterStore = deadLetterStore;
        this.metrics = metrics;
        this.retrySettings = new ResilientEventSink.RetrySettings(
            resilience.getMaxAttempts(),
            Duration.ofMillis(resilience.getInitialDelayMs()),
            Duration.ofMillis(resilience.getMaxDelayMs()),
            resilience.getMultiplier()
        );
    }

    public List<EventSink> createSinks(EventsProperties.Sinks config) {
        List<EventSink> raw = new ArrayList<>();
        try {
            for (KafkaSinkProperties kafka : enabled(config.getKafka())) {
                raw.add(new KafkaEventSink(kafka, objectMapper));
            }
            for (KustoSinkProperties kusto : enabled(config.getKusto())) {
                raw.add(new KustoEventSink(kusto, new SdkKustoIngestGateway(kusto), objectMapper));
            }
            for (MqttSinkProperties mqtt : enabled(config.getMqtt())) {
                MqttEventSink sink = new MqttEventSink(mqtt, objectMapper);
                sink.start();
                raw.add(sink);
            }
            for (WebhookSinkProperties webhook : enabled(config.getWebhook())) {
                raw.add(WebhookEventSink.create(webhook, restClientBuilder, objectMapper));
            }
            checkUniqueNames(raw);
        } catch (MqttException e) {
            closeQuietly(raw);
            throw new IllegalStateException("Failed to create MQTT sink", e);
        } catch (RuntimeException e) {
            closeQuietly(raw);
            throw e;
        }

        List<EventSink> sinks = new ArrayList<>(raw.size());
        for (EventSink sink : raw) {
            sinks.add(wrap(sink));
            log.info("Configured sink '{}' ({})", sink.getName(), sink.getClass().getSimpleName());
        }
        if (sinks.isEmpty()) {
            log.warn("No sinks are enabled; changes will be consumed and discarded");
        }
        return sinks;
    }

    public EventSink wrap(EventSink sink) {
        return new ResilientEventSink(sink, retrySettings, deadLetterStore, metrics);
    }

    static void checkUniqueNames(List<EventSink> sinks) {
        Set<String> names = new HashSet<>();
        for (EventSink sink : sinks) {
            if (sink.getName() == null || sink.getName().isBlank()) {
                throw new IllegalArgumentException("Every sink requires a name (" + sink.getClass().getSimpleName() + ")");
            }
            if (!names.add(sink.getName())) {
                throw new IllegalArgumentException("Duplicate sink name: " + sink.getName());
            }
        }
    }

    private static <T extends SinkProperties> List<T> enabled(List<T> sinks) {
        return sinks.stream().filter(SinkProperties::isEnabled).toList();
    }

    private static void closeQuietly(List<EventSink> sinks) {
        for (EventSink sink : sinks) {
            try {
                sink.close();
            } catch (Exception e) {
                log.warn("Failed to close sink '{}' after setup error", sink.getName(), e);
            }
        }
    }
}
