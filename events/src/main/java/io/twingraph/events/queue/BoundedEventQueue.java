package io.twingraph.events.queue;

import io.twingraph.events.model.EventData;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

public class BoundedEventQueue implements EventQueue {

    private final BlockingQueue<EventData> queue;
    private final AtomicLong enqueued = new AtomicLong();

    public BoundedEventQueue(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Queue capacity must be > 0");
        }
        this.queue = new LinkedBlockingQueue<>(capacity);
    }

    @Override
    public void put(EventData eventData) throws InterruptedException {
        if (eventData == null) {
            throw new IllegalArgumentException("eventData must not be null");
        }
        queue.put(eventData);
        enqueued.incrementAndGet();
    }

    @Override
    public List<EventData> takeBatch(int maxItems, Duration timeout) throws InterruptedException {
        List<EventData> batch = new ArrayList<>();
        EventData first = queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (first == null) {
            return batch;
        }
        batch.add(first);
        queue.drainTo(batch, Math.max(0, maxItems - 1));
        return batch;
    }

    @Override
    public int size() {
        return queue.size();
    }

    @Override
    public long totalEnqueued() {
        return enqueued.get();
    }
}
