package io.twingraph.events.health;

import io.twingraph.events.sink.EventSink;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Reports every configured sink; DOWN as soon as one of them is unhealthy.
 */
public class EventSinksHealthIndicator implements HealthIndicator {

    private final List<EventSink> sinks;

    public EventSinksHealthIndicator(List<EventSink> sinks) {
        this.sinks = List.copyOf(sinks);
    }

    @Override
    public Health health() {
        Map<String, String> status = new TreeMap<>();
        List<String> unhealthy = new ArrayList<>();
        for (EventSink sink : sinks) {
            boolean healthy = sink.isHealthy();
            status.put(sink.getName(), healthy ? "UP" : "DOWN");
            if (!healthy) {
                unhealthy.add(sink.getName());
            }
        }
        Health.Builder builder = unhealthy.isEmpty() ? Health.up() : Health.down();
        return builder
            .withDetail("totalSinks", sinks.size())
            .withDetail("healthySinks", sinks.size() - unhealthy.size())
            .withDetail("unhealthySinks", unhealthy)
            .withDetail("sinks", status)
            .build();
    }
}
