package io.twingraph.events.health;

import io.twingraph.events.telemetry.TelemetryListener;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

public class TelemetryHealthIndicator implements HealthIndicator {

    private final TelemetryListener listener;

    public TelemetryHealthIndicator(TelemetryListener listener) {
        this.listener = listener;
    }

    @Override
    public Health health() {
        Health.Builder builder = listener.isHealthy() ? Health.up() : Health.down();
        return builder.withDetail("channel", listener.channel()).build();
    }
}
