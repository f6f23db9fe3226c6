package io.twingraph.events.model;

import java.util.Locale;

/**
 * Routing taxonomy shared by event generation and sink subscriptions.
 */
public enum SinkEventType {
    TWIN_CREATE,
    TWIN_UPDATE,
    TWIN_DELETE,
    RELATIONSHIP_CREATE,
    RELATIONSHIP_UPDATE,
    RELATIONSHIP_DELETE,
    PROPERTY_EVENT,
    TWIN_LIFECYCLE,
    RELATIONSHIP_LIFECYCLE,
    TELEMETRY;

    /**
     * Accepts both {@code PropertyEvent} and {@code PROPERTY_EVENT} spellings.
     */
    public static SinkEventType parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Sink event type must not be blank");
        }
        String normalized = raw.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (SinkEventType type : values()) {
            if (type.name().replace("_", "").equals(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown sink event type: " + raw);
    }
}
