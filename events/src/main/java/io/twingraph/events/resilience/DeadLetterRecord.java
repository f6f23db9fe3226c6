package io.twingraph.events.resilience;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;
import java.util.UUID;

/**
 * An event a sink could not deliver after all retry attempts.
 */
public record DeadLetterRecord(
    UUID id,
    String eventId,
    String sinkName,
    String eventType,
    JsonNode payload,
    String errorMessage,
    String errorStack,
    int retryCount,
    Instant failedAt,
    Instant lastAttemptAt,
    DeadLetterStatus status
) {
}
