package io.twingraph.events.health;

import io.twingraph.events.capture.ReplicationSubscriber;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * UP while the replication stream is connected and receiving within its idle bound.
 */
public class ReplicationHealthIndicator implements HealthIndicator {

    private final ReplicationSubscriber subscriber;

    public ReplicationHealthIndicator(ReplicationSubscriber subscriber) {
        this.subscriber = subscriber;
    }

    @Override
    public Health health() {
        Health.Builder builder = subscriber.isHealthy() ? Health.up() : Health.down();
        builder.withDetail("slot", subscriber.slotName())
            .withDetail("publication", subscriber.publication());
        if (subscriber.lastMessageAt() != null) {
            builder.withDetail("lastMessageAt", subscriber.lastMessageAt().toString());
        }
        if (subscriber.lastFlushedLsn() != null) {
            builder.withDetail("lastFlushedLsn", subscriber.lastFlushedLsn().asString());
        }
        return builder.build();
    }
}
