package io.twingraph.events.consumer;

import io.twingraph.events.factory.DomainEventFactory;
import io.twingraph.events.metrics.PipelineMetrics;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.model.EventData;
import io.twingraph.events.model.EventFormat;
import io.twingraph.events.model.EventRoute;
import io.twingraph.events.model.EventType;
import io.twingraph.events.model.SinkEventType;
import io.twingraph.events.queue.EventQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single consumer of the event queue. Generates each required event family once per change and
 * hands every sink the events it subscribes to through that sink's dispatch lane.
 */
public class SharedEventConsumer {

    private static final Logger log = LoggerFactory.getLogger(SharedEventConsumer.class);

    private static final List<EventFormat> GRAPH_FORMATS = List.of(EventFormat.EVENT_NOTIFICATION, EventFormat.DATA_HISTORY);
    private static final List<EventFormat> TELEMETRY_FORMATS = List.of(EventFormat.TELEMETRY);

    private final EventQueue queue;
    private final DomainEventFactory factory;
    private final List<EventRoute> routes;
    private final Map<String, SinkDispatchLane> lanes;
    private final String sourceUri;
    private final int batchSize;
    private final Duration pollTimeout;
    private final PipelineMetrics metrics;
    private final AtomicLong processedCount = new AtomicLong();
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile long drainDeadlineNanos;
    private volatile Instant lastProcessedAt;

    public SharedEventConsumer(
        EventQueue queue,
        DomainEventFactory factory,
        List<EventRoute> routes,
        Map<String, SinkDispatchLane> lanes,
        String sourceUri,
        int batchSize,
        Duration pollTimeout,
        PipelineMetrics metrics
    ) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("Consumer batch size must be at least 1");
        }
        this.queue = queue;
        this.factory = factory;
        this.routes = List.copyOf(EventRoutes.forKnownSinks(routes, lanes.keySet()));
        this.lanes = Map.copyOf(lanes);
        this.sourceUri = sourceUri;
        this.batchSize = batchSize;
        this.pollTimeout = pollTimeout;
        this.metrics = metrics;
    }

    public void run() {
        log.info("Event consumer started. routes={}, sinks={}, batchSize={}", routes.size(), lanes.keySet(), batchSize);
        try {
            while (!Thread.currentThread().isInterrupted()) {
                if (!running && (queue.size() == 0 || System.nanoTime() >= drainDeadlineNanos)) {
                    break;
                }
                try {
                    List<EventData> batch = queue.takeBatch(batchSize, pollTimeout);
                    if (!batch.isEmpty()) {
                        process(batch);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Event consumer interrupted");
                } catch (RuntimeException e) {
                    log.error("Event consumer failed to process batch", e);
                }
            }
        } finally {
            if (queue.size() > 0) {
                log.warn("Event consumer stopped with {} changes still queued", queue.size());
            }
            stopped.countDown();
            log.info("Event consumer stopped. processed={}", processedCount.get());
        }
    }

    /**
     * Lets the consumer drain the queue for up to {@code timeout}, then waits for the loop to exit.
     */
    public void stop(Duration timeout) {
        drainDeadlineNanos = System.nanoTime() + timeout.toNanos();
        running = false;
        try {
            if (!stopped.await(timeout.toMillis() + pollTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Event consumer did not stop within {} ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void process(List<EventData> batch) throws InterruptedException {
        Map<String, List<DomainEvent>> bySink = new LinkedHashMap<>();
        for (EventData eventData : batch) {
            route(eventData, bySink);
        }
        for (Map.Entry<String, List<DomainEvent>> entry : bySink.entrySet()) {
            lanes.get(entry.getKey()).submit(entry.getValue());
        }
        processedCount.addAndGet(batch.size());
        lastProcessedAt = Instant.now();
        metrics.recordProcessed(batch.size());
    }

    private void route(EventData eventData, Map<String, List<DomainEvent>> bySink) {
        Map<GenerationKey, List<DomainEvent>> generated = new HashMap<>();
        Map<String, List<DomainEvent>> selected = new LinkedHashMap<>();
        try {
            for (EventRoute route : routes) {
                for (EventFormat format : formatsFor(eventData)) {
                    if (!route.needs(format)) {
                        continue;
                    }
                    GenerationKey key = new GenerationKey(format, route.typeMappingsFor(format));
                    List<DomainEvent> events = generated.get(key);
                    if (events == null) {
                        events = factory.create(format, eventData, sourceUri, key.typeMappings());
                        generated.put(key, events);
                    }
                    for (DomainEvent event : events) {
                        if (route.subscribes(event.kind())) {
                            selected.computeIfAbsent(route.sinkName(), name -> new ArrayList<>()).add(event);
                        }
                    }
                }
            }
        } catch (IllegalArgumentException e) {
            metrics.recordRejected();
            log.warn(
                "Skipping change the event factory rejected (type={}, entityId={}, table={}.{}): {}",
                eventData.eventType(),
                eventData.entityId(),
                eventData.graphName(),
                eventData.tableName(),
                e.getMessage()
            );
            return;
        }
        selected.forEach((sink, events) -> bySink.computeIfAbsent(sink, name -> new ArrayList<>()).addAll(events));
    }

    private static List<EventFormat> formatsFor(EventData eventData) {
        return eventData.eventType() == EventType.TELEMETRY ? TELEMETRY_FORMATS : GRAPH_FORMATS;
    }

    public long processedCount() {
        return processedCount.get();
    }

    public Instant lastProcessedAt() {
        return lastProcessedAt;
    }

    private record GenerationKey(EventFormat format, Map<SinkEventType, String> typeMappings) {
    }
}
