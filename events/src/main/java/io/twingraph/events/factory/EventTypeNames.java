package io.twingraph.events.factory;

import io.twingraph.events.model.SinkEventType;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

public final class EventTypeNames {

    private static final Map<SinkEventType, String> DEFAULTS;

    static {
        Map<SinkEventType, String> defaults = new EnumMap<>(SinkEventType.class);
        defaults.put(SinkEventType.TWIN_CREATE, "Konnektr.DigitalTwins.Twin.Create");
        defaults.put(SinkEventType.TWIN_UPDATE, "Konnektr.DigitalTwins.Twin.Update");
        defaults.put(SinkEventType.TWIN_DELETE, "Konnektr.DigitalTwins.Twin.Delete");
        defaults.put(SinkEventType.RELATIONSHIP_CREATE, "Konnektr.DigitalTwins.Relationship.Create");
        defaults.put(SinkEventType.RELATIONSHIP_UPDATE, "Konnektr.DigitalTwins.Relationship.Update");
        defaults.put(SinkEventType.RELATIONSHIP_DELETE, "Konnektr.DigitalTwins.Relationship.Delete");
        defaults.put(SinkEventType.PROPERTY_EVENT, "Konnektr.DigitalTwins.Property.Event");
        defaults.put(SinkEventType.TWIN_LIFECYCLE, "Konnektr.DigitalTwins.Twin.Lifecycle");
        defaults.put(SinkEventType.RELATIONSHIP_LIFECYCLE, "Konnektr.DigitalTwins.Relationship.Lifecycle");
        defaults.put(SinkEventType.TELEMETRY, "Konnektr.IoT.Telemetry");
        DEFAULTS = Collections.unmodifiableMap(defaults);
    }

    private EventTypeNames() {
    }

    public static Map<SinkEventType, String> defaults() {
        return DEFAULTS;
    }

    public static String resolve(SinkEventType kind, Map<SinkEventType, String> overrides) {
        if (overrides != null) {
            String override = overrides.get(kind);
            if (override != null && !override.isBlank()) {
                return override;
            }
        }
        return DEFAULTS.get(kind);
    }
}
