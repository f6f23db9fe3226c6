package io.twingraph.events.model;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Subscription of one sink to a set of event types, with optional type string overrides.
 */
public record EventRoute(
    String sinkName,
    Set<SinkEventType> eventTypes,
    Map<SinkEventType, String> typeMappings
) {

    public EventRoute {
        if (sinkName == null || sinkName.isBlank()) {
            throw new IllegalArgumentException("Event route requires a sink name");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("Event route for sink " + sinkName + " subscribes to no event types");
        }
        eventTypes = Set.copyOf(EnumSet.copyOf(eventTypes));
        typeMappings = typeMappings == null || typeMappings.isEmpty()
            ? Map.of()
            : Map.copyOf(new EnumMap<>(typeMappings));
    }

    public static EventRoute forFormat(String sinkName, EventFormat format) {
        return new EventRoute(sinkName, format.eventTypes(), Map.of());
    }

    public boolean subscribes(SinkEventType type) {
        return eventTypes.contains(type);
    }

    public boolean needs(EventFormat format) {
        for (SinkEventType type : eventTypes) {
            if (format.produces(type)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Overrides restricted to the types a format produces.
     */
    public Map<SinkEventType, String> typeMappingsFor(EventFormat format) {
        Map<SinkEventType, String> result = new EnumMap<>(SinkEventType.class);
        typeMappings.forEach((type, value) -> {
            if (format.produces(type)) {
                result.put(type, value);
            }
        });
        return result;
    }
}
