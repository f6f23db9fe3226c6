package io.twingraph.events.model;

import com.fasterxml.jackson.databind.JsonNode;
import java.time.Instant;

/**
 * CloudEvents v1.0 shaped event. {@code kind} is used for routing only and is never serialized.
 */
public record DomainEvent(
    String id,
    String source,
    String type,
    String subject,
    Instant time,
    String dataContentType,
    String dataSchema,
    JsonNode data,
    SinkEventType kind
) {

    public static final String SPEC_VERSION = "1.0";
    public static final String JSON_CONTENT_TYPE = "application/json";
}
