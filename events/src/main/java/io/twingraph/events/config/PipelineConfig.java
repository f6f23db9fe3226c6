package io.twingraph.events.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import io.twingraph.events.capture.ChangeAssembler;
import io.twingraph.events.capture.ReplicationSubscriber;
import io.twingraph.events.checkpoint.CheckpointStore;
import io.twingraph.events.checkpoint.FileCheckpointStore;
import io.twingraph.events.checkpoint.PostgresCheckpointStore;
import io.twingraph.events.checkpoint.SlotCheckpointStore;
import io.twingraph.events.consumer.EventRoutes;
import io.twingraph.events.consumer.SharedEventConsumer;
import io.twingraph.events.consumer.SinkDispatchLane;
import io.twingraph.events.factory.DomainEventFactory;
import io.twingraph.events.health.EventSinksHealthIndicator;
import io.twingraph.events.health.ReplicationHealthIndicator;
import io.twingraph.events.health.TelemetryHealthIndicator;
import io.twingraph.events.metrics.PipelineMetrics;
import io.twingraph.events.queue.BoundedEventQueue;
import io.twingraph.events.queue.EventQueue;
import io.twingraph.events.resilience.DeadLetterRepository;
import io.twingraph.events.resilience.DeadLetterStore;
import io.twingraph.events.resilience.LoggingDeadLetterStore;
import io.twingraph.events.sink.EventSink;
import io.twingraph.events.sink.SinkFactory;
import io.twingraph.events.telemetry.TelemetryListener;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.sql.DataSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

@Configuration
public class PipelineConfig {

    @Bean
    public EventQueue eventQueue(EventsProperties properties) {
        return new BoundedEventQueue(properties.getQueue().getCapacity());
    }

    @Bean
    public DomainEventFactory domainEventFactory() {
        return new DomainEventFactory();
    }

    @Bean
    public PipelineMetrics pipelineMetrics(MeterRegistry meterRegistry, EventQueue eventQueue) {
        PipelineMetrics metrics = new PipelineMetrics(meterRegistry);
        metrics.bindQueue(eventQueue);
        return metrics;
    }

    @Bean
    public DeadLetterStore deadLetterStore(
        EventsProperties properties,
        NamedParameterJdbcTemplate jdbcTemplate,
        ObjectMapper objectMapper
    ) {
        if (!properties.getDeadLetter().isEnabled()) {
            return new LoggingDeadLetterStore();
        }
        return new DeadLetterRepository(jdbcTemplate, objectMapper, properties.getDeadLetter().getSchema());
    }

    @Bean
    public CheckpointStore checkpointStore(EventsProperties properties, NamedParameterJdbcTemplate jdbcTemplate) {
        EventsProperties.Replication cfg = properties.getReplication();
        return switch (cfg.getCheckpointStore()) {
            case SLOT -> new SlotCheckpointStore();
            case POSTGRES -> new PostgresCheckpointStore(jdbcTemplate, properties.getDeadLetter().getSchema());
            case FILE -> new FileCheckpointStore(Path.of(cfg.getCheckpointFilePath()));
        };
    }

    @Bean
    public SinkFactory sinkFactory(
        EventsProperties properties,
        ObjectMapper objectMapper,
        RestClient.Builder restClientBuilder,
        DeadLetterStore deadLetterStore,
        PipelineMetrics metrics
    ) {
        return new SinkFactory(objectMapper, restClientBuilder, deadLetterStore, metrics, properties.getResilience());
    }

    @Bean
    public List<EventSink> eventSinks(SinkFactory sinkFactory, EventsProperties properties) {
        return sinkFactory.createSinks(properties.getSinks());
    }

    @Bean
    public Map<String, SinkDispatchLane> sinkDispatchLanes(List<EventSink> eventSinks, EventsProperties properties) {
        Map<String, SinkDispatchLane> lanes = new LinkedHashMap<>();
        for (EventSink sink : eventSinks) {
            lanes.put(sink.getName(), new SinkDispatchLane(sink, properties.getConsumer().getLaneCapacity()));
        }
        return lanes;
    }

    @Bean
    public SharedEventConsumer sharedEventConsumer(
        EventsProperties properties,
        EventQueue eventQueue,
        DomainEventFactory domainEventFactory,
        Map<String, SinkDispatchLane> sinkDispatchLanes,
        PipelineMetrics metrics
    ) {
        EventsProperties.Consumer cfg = properties.getConsumer();
        SharedEventConsumer consumer = new SharedEventConsumer(
            eventQueue,
            domainEventFactory,
            EventRoutes.fromProperties(properties.getRoutes()),
            sinkDispatchLanes,
            properties.getSourceUri(),
            cfg.getBatchSize(),
            Duration.ofMillis(cfg.getPollTimeoutMs()),
            metrics
        );
        metrics.bindLastProcessed(consumer::lastProcessedAt);
        return consumer;
    }

    @Bean
    @ConditionalOnProperty(prefix = "events.replication", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReplicationSubscriber replicationSubscriber(
        EventsProperties properties,
        EventQueue eventQueue,
        CheckpointStore checkpointStore,
        ObjectMapper objectMapper
    ) {
        return new ReplicationSubscriber(
            properties.getReplication(),
            eventQueue,
            checkpointStore,
            new ChangeAssembler(objectMapper)
        );
    }

    @Bean
    @ConditionalOnProperty(prefix = "events.telemetry", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TelemetryListener telemetryListener(
        EventsProperties properties,
        DataSource dataSource,
        EventQueue eventQueue,
        ObjectMapper objectMapper
    ) {
        EventsProperties.Telemetry cfg = properties.getTelemetry();
        return new TelemetryListener(
            dataSource,
            eventQueue,
            objectMapper,
            cfg.getChannel(),
            cfg.getPollTimeoutMs(),
            properties.getReplication().getReconnectDelayMs()
        );
    }

    @Bean(name = "replicationHealthIndicator")
    @ConditionalOnProperty(prefix = "events.replication", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ReplicationHealthIndicator replicationHealthIndicator(ReplicationSubscriber replicationSubscriber) {
        return new ReplicationHealthIndicator(replicationSubscriber);
    }

    @Bean(name = "event_sinksHealthIndicator")
    public EventSinksHealthIndicator eventSinksHealthIndicator(List<EventSink> eventSinks) {
        return new EventSinksHealthIndicator(eventSinks);
    }

    @Bean(name = "telemetryHealthIndicator")
    @ConditionalOnProperty(prefix = "events.telemetry", name = "enabled", havingValue = "true", matchIfMissing = true)
    public TelemetryHealthIndicator telemetryHealthIndicator(TelemetryListener telemetryListener) {
        return new TelemetryHealthIndicator(telemetryListener);
    }

    @Bean(name = "pipelineExecutor")
    public ThreadPoolTaskExecutor pipelineExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(3);
        executor.setMaxPoolSize(3);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("pipeline-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        // stop after PipelineRunner has drained the pipeline
        executor.setPhase(SmartLifecycle.DEFAULT_PHASE - 1);
        executor.initialize();
        return executor;
    }
}
