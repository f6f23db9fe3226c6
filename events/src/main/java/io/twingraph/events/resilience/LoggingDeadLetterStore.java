package io.twingraph.events.resilience;

import io.twingraph.events.model.DomainEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Used when the dead letter table is disabled: failed events are only logged.
 */
public class LoggingDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(LoggingDeadLetterStore.class);

    @Override
    public void save(DomainEvent event, String sinkName, Throwable error, int retryCount) {
        log.error(
            "Dropping undeliverable event (deadLetter=disabled, sink={}, eventId={}, type={}, subject={}, attempts={}): {}",
            sinkName,
            event.id(),
            event.type(),
            event.subject(),
            retryCount,
            error == null ? null : error.getMessage()
        );
    }
}
