package io.twingraph.events.resilience;

import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.twingraph.events.metrics.PipelineMetrics;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.EventSink;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Retries a sink with exponential backoff and dead-letters the batch once attempts are exhausted.
 * Never throws from {@link #send(List)}, so one failing sink does not stall the others.
 */
public class ResilientEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(ResilientEventSink.class);

    private final EventSink delegate;
    private final DeadLetterStore deadLetterStore;
    private final PipelineMetrics metrics;
    private final int maxAttempts;
    private final Retry retry;
    private volatile boolean lastSucceeded = true;

    public ResilientEventSink(
        EventSink delegate,
        RetrySettings settings,
        DeadLetterStore deadLetterStore,
        PipelineMetrics metrics
    ) {
        if (settings.maxAttempts() < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        this.delegate = delegate;
        this.deadLetterStore = deadLetterStore;
        this.metrics = metrics;
        this.maxAttempts = settings.maxAttempts();
        this.retry = Retry.of("sink-" + delegate.getName(), RetryConfig.custom()
            .maxAttempts(settings.maxAttempts())
            .intervalFunction(IntervalFunction.ofExponentialBackoff(
                settings.initialDelay().toMillis(),
                settings.multiplier(),
                settings.maxDelay().toMillis()
            ))
            .retryExceptions(Exception.class)
            .build());
        this.retry.getEventPublisher().onRetry(event -> log.warn(
            "Retrying sink '{}' (attempt={}/{}, wait={}ms): {}",
            delegate.getName(),
            event.getNumberOfRetryAttempts(),
            maxAttempts,
            event.getWaitInterval().toMillis(),
            event.getLastThrowable() == null ? null : event.getLastThrowable().getMessage()
        ));
    }

    /**
     * Backoff settings for one wrapped sink.
     */
    public record RetrySettings(int maxAttempts, Duration initialDelay, Duration maxDelay, double multiplier) {
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isHealthy() {
        return lastSucceeded && delegate.isHealthy();
    }

    public EventSink delegate() {
        return delegate;
    }

    @Override
    public void send(List<DomainEvent> events) {
        if (events.isEmpty()) {
            return;
        }
        long started = System.nanoTime();
        try {
            retry.executeCallable(() -> {
                delegate.send(events);
                return null;
            });
            lastSucceeded = true;
            metrics.recordDelivered(delegate.getName(), events.size());
        } catch (Exception e) {
            lastSucceeded = false;
            metrics.recordFailure(delegate.getName());
            log.error(
                "Sink '{}' failed after {} attempts; dead-lettering {} events",
                delegate.getName(),
                maxAttempts,
                events.size(),
                e
            );
            deadLetter(events, e);
        } finally {
            metrics.recordSendDuration(delegate.getName(), Duration.ofNanos(System.nanoTime() - started));
        }
    }

    private void deadLetter(List<DomainEvent> events, Exception failure) {
        int stored = 0;
        for (DomainEvent event : events) {
            try {
                deadLetterStore.save(event, delegate.getName(), failure, maxAttempts);
                stored++;
            } catch (RuntimeException e) {
                log.error(
                    "Failed to write dead letter record (sink={}, eventId={}, type={})",
                    delegate.getName(),
                    event.id(),
                    event.type(),
                    e
                );
            }
        }
        metrics.recordDeadLettered(delegate.getName(), stored);
    }

    @Override
    public void close() {
        delegate.close();
    }
}
