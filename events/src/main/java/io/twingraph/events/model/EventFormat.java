package io.twingraph.events.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum EventFormat {
    EVENT_NOTIFICATION(EnumSet.of(
        SinkEventType.TWIN_CREATE,
        SinkEventType.TWIN_UPDATE,
        SinkEventType.TWIN_DELETE,
        SinkEventType.RELATIONSHIP_CREATE,
        SinkEventType.RELATIONSHIP_UPDATE,
        SinkEventType.RELATIONSHIP_DELETE
    )),
    DATA_HISTORY(EnumSet.of(
        SinkEventType.PROPERTY_EVENT,
        SinkEventType.TWIN_LIFECYCLE,
        SinkEventType.RELATIONSHIP_LIFECYCLE
    )),
    TELEMETRY(EnumSet.of(SinkEventType.TELEMETRY));

    private final Set<SinkEventType> eventTypes;

    EventFormat(Set<SinkEventType> eventTypes) {
        this.eventTypes = eventTypes;
    }

    public Set<SinkEventType> eventTypes() {
        return EnumSet.copyOf(eventTypes);
    }

    public boolean produces(SinkEventType type) {
        return eventTypes.contains(type);
    }

    public static EventFormat of(SinkEventType type) {
        for (EventFormat format : values()) {
            if (format.produces(type)) {
                return format;
            }
        }
        throw new IllegalArgumentException("No event format produces " + type);
    }

    public static EventFormat parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EVENT_NOTIFICATION;
        }
        String normalized = raw.trim().replace("_", "").replace("-", "").toUpperCase(Locale.ROOT);
        for (EventFormat format : values()) {
            if (format.name().replace("_", "").equals(normalized)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown event format: " + raw);
    }
}
