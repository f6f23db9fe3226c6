package io.twingraph.events.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.twingraph.events.queue.EventQueue;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Application meters for the capture, consume and deliver stages.
 */
public class PipelineMetrics {

    static final String QUEUE_DEPTH = "events.queue.depth";
    static final String QUEUE_ENQUEUED = "events.queue.enqueued";
    static final String CONSUMER_PROCESSED = "events.consumer.processed";
    static final String CONSUMER_LAST_PROCESSED = "events.consumer.last_processed";
    static final String CONSUMER_REJECTED = "events.consumer.rejected";
    static final String SINK_DELIVERED = "events.sink.delivered";
    static final String SINK_FAILURES = "events.sink.failures";
    static final String SINK_DEAD_LETTERED = "events.sink.dead_lettered";
    static final String SINK_SEND_DURATION = "events.sink.send.duration";

    private final MeterRegistry meterRegistry;
    private final Counter processed;
    private final Counter rejected;
    private final ConcurrentMap<String, Counter> delivered = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> failures = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Counter> deadLettered = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Timer> sendDurations = new ConcurrentHashMap<>();

    public PipelineMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.processed = Counter.builder(CONSUMER_PROCESSED)
            .description("Captured changes taken off the queue and turned into events")
            .register(meterRegistry);
        this.rejected = Counter.builder(CONSUMER_REJECTED)
            .description("Captured changes the event factory rejected")
            .register(meterRegistry);
    }

    public void bindQueue(EventQueue queue) {
        Gauge.builder(QUEUE_DEPTH, queue, EventQueue::size)
            .description("Captured changes waiting for the consumer")
            .register(meterRegistry);
        Gauge.builder(QUEUE_ENQUEUED, queue, q -> (double) q.totalEnqueued())
            .description("Captured changes enqueued since start")
            .register(meterRegistry);
    }

    /**
     * Epoch seconds of the last processed batch, NaN until the first one.
     */
    public void bindLastProcessed(Supplier<Instant> lastProcessedAt) {
        Gauge.builder(CONSUMER_LAST_PROCESSED, () -> {
                Instant last = lastProcessedAt.get();
                return last == null ? Double.NaN : last.toEpochMilli() / 1000.0;
            })
            .description("Time the consumer last finished a batch")
            .baseUnit("seconds")
            .register(meterRegistry);
    }

    public void recordProcessed(int count) {
        processed.increment(count);
    }

    public void recordRejected() {
        rejected.increment();
    }

    public void recordDelivered(String sinkName, int count) {
        counter(delivered, SINK_DELIVERED, "Events delivered per sink", sinkName).increment(count);
    }

    public void recordFailure(String sinkName) {
        counter(failures, SINK_FAILURES, "Batches a sink failed to deliver after retries", sinkName).increment();
    }

    public void recordDeadLettered(String sinkName, int count) {
        counter(deadLettered, SINK_DEAD_LETTERED, "Events written to the dead letter store", sinkName).increment(count);
    }

    public void recordSendDuration(String sinkName, Duration duration) {
        sendDurations.computeIfAbsent(
            sinkName,
            name -> Timer.builder(SINK_SEND_DURATION)
                .description("Time spent delivering one batch including retries")
                .tags(Tags.of("sink", name))
                .register(meterRegistry)
        ).record(duration);
    }

    private Counter counter(ConcurrentMap<String, Counter> counters, String metric, String description, String sinkName) {
        return counters.computeIfAbsent(
            sinkName,
            name -> Counter.builder(metric)
                .description(description)
                .tags(Tags.of("sink", name))
                .register(meterRegistry)
        );
    }
}
