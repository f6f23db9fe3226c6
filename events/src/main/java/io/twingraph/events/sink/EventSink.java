package io.twingraph.events.sink;

import io.twingraph.events.model.DomainEvent;
import java.util.List;

/**
 * Delivery target for generated events. {@link #send} is best effort and may throw;
 * callers decide whether to retry.
 */
public interface EventSink extends AutoCloseable {

    String getName();

    boolean isHealthy();

    void send(List<DomainEvent> events) throws Exception;

    @Override
    default void close() {
    }
}
