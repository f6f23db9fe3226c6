package io.twingraph.events.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.time.Instant;

/**
 * One captured change: the entity snapshot before and after a mutation.
 * Create carries only {@code newValue}, Delete only {@code oldValue}, Update both.
 */
public record EventData(
    EventType eventType,
    String graphName,
    String tableName,
    String entityId,
    ObjectNode oldValue,
    ObjectNode newValue,
    Instant timestamp
) {

    public static EventData telemetry(String graphName, ObjectNode payload, Instant timestamp) {
        String twinId = payload.path("digitalTwinId").asText(null);
        return new EventData(EventType.TELEMETRY, graphName, "telemetry", twinId, null, payload, timestamp);
    }

    public boolean isValid() {
        if (eventType == null) {
            return false;
        }
        return switch (eventType) {
            case TWIN_CREATE, RELATIONSHIP_CREATE, TELEMETRY -> newValue != null;
            case TWIN_UPDATE, RELATIONSHIP_UPDATE -> newValue != null && oldValue != null;
            case TWIN_DELETE, RELATIONSHIP_DELETE -> oldValue != null;
        };
    }
}
