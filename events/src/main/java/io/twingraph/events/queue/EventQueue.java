package io.twingraph.events.queue;

import io.twingraph.events.model.EventData;
import java.time.Duration;
import java.util.List;

/**
 * Bounded hand-off between change producers and the shared consumer.
 * Producers block while the queue is full.
 */
public interface EventQueue {

    void put(EventData eventData) throws InterruptedException;

    default void putAll(List<EventData> batch) throws InterruptedException {
        for (EventData eventData : batch) {
            put(eventData);
        }
    }

    /**
     * Waits up to {@code timeout} for the first item, then drains without waiting up to {@code maxItems}.
     */
    List<EventData> takeBatch(int maxItems, Duration timeout) throws InterruptedException;

    int size();

    long totalEnqueued();
}
