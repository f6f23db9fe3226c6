package io.twingraph.events.consumer;

import io.twingraph.events.config.EventsProperties;
import io.twingraph.events.model.EventFormat;
import io.twingraph.events.model.EventRoute;
import io.twingraph.events.model.SinkEventType;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds routes from {@code events.routes} configuration.
 */
public final class EventRoutes {

    private static final Logger log = LoggerFactory.getLogger(EventRoutes.class);

    private EventRoutes() {
    }

    public static List<EventRoute> fromProperties(List<EventsProperties.Route> configured) {
        List<EventRoute> routes = new ArrayList<>();
        for (EventsProperties.Route route : configured) {
            routes.add(toRoute(route));
        }
        return routes;
    }

    static EventRoute toRoute(EventsProperties.Route route) {
        Set<SinkEventType> eventTypes;
        if (route.getEventTypes() != null && !route.getEventTypes().isEmpty()) {
            eventTypes = EnumSet.noneOf(SinkEventType.class);
            for (String type : route.getEventTypes()) {
                eventTypes.add(SinkEventType.parse(type));
            }
        } else {
            eventTypes = EventFormat.parse(route.getEventFormat()).eventTypes();
        }

        Map<SinkEventType, String> typeMappings = new EnumMap<>(SinkEventType.class);
        if (route.getTypeMappings() != null) {
            route.getTypeMappings().forEach((type, value) -> {
                if (value == null || value.isBlank()) {
                    throw new IllegalArgumentException(
                        "Type mapping for " + type + " on route to " + route.getSinkName() + " is blank"
                    );
                }
                typeMappings.put(SinkEventType.parse(type), value);
            });
        }
        return new EventRoute(route.getSinkName(), eventTypes, typeMappings);
    }

    /**
     * Drops routes whose sink is not configured, logging each one.
     */
    public static List<EventRoute> forKnownSinks(List<EventRoute> routes, Collection<String> sinkNames) {
        List<EventRoute> known = new ArrayList<>();
        for (EventRoute route : routes) {
            if (sinkNames.contains(route.sinkName())) {
                known.add(route);
            } else {
                log.warn("Ignoring route to unknown sink '{}' (configured sinks={})", route.sinkName(), sinkNames);
            }
        }
        return known;
    }
}
