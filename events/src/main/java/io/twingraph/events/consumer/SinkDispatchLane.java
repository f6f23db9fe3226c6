package io.twingraph.events.consumer;

import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.EventSink;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Single-threaded, bounded delivery lane for one sink. Batches are sent in submission order;
 * {@link #submit(List)} blocks while the lane is full.
 */
public class SinkDispatchLane implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SinkDispatchLane.class);

    private final EventSink sink;
    private final ThreadPoolTaskExecutor executor;
    private final Semaphore slots;

    public SinkDispatchLane(EventSink sink, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Lane capacity must be at least 1");
        }
        this.sink = sink;
        this.slots = new Semaphore(capacity);
        this.executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(capacity);
        executor.setThreadNamePrefix("sink-" + sink.getName() + "-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
    }

    public String sinkName() {
        return sink.getName();
    }

    public EventSink sink() {
        return sink;
    }

    public void submit(List<DomainEvent> events) throws InterruptedException {
        if (events.isEmpty()) {
            return;
        }
        slots.acquire();
        try {
            executor.execute(() -> deliver(events));
        } catch (RuntimeException e) {
            slots.release();
            throw e;
        }
    }

    private void deliver(List<DomainEvent> events) {
        try {
            sink.send(events);
        } catch (Exception e) {
            log.error("Sink '{}' failed to handle {} events", sink.getName(), events.size(), e);
        } finally {
            slots.release();
        }
    }

    /**
     * Stops accepting batches and waits for queued ones to be delivered.
     *
     * @return true if the lane drained within {@code timeout}
     */
    public boolean shutdown(Duration timeout) {
        ThreadPoolExecutor pool = executor.getThreadPoolExecutor();
        pool.shutdown();
        try {
            boolean drained = pool.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!drained) {
                log.warn("Sink '{}' lane still had {} batches after {} ms", sink.getName(), pool.getQueue().size(), timeout.toMillis());
                pool.shutdownNow();
            }
            return drained;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            pool.shutdownNow();
            return false;
        }
    }

    @Override
    public void close() {
        shutdown(Duration.ZERO);
    }
}
