package io.twingraph.events.resilience;

import io.twingraph.events.model.DomainEvent;

/**
 * Durable parking place for events whose delivery failed terminally.
 */
public interface DeadLetterStore {

    void save(DomainEvent event, String sinkName, Throwable error, int retryCount);
}
