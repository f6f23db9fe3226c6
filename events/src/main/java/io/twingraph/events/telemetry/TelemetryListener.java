package io.twingraph.events.telemetry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.twingraph.events.model.EventData;
import io.twingraph.events.queue.EventQueue;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.regex.Pattern;
import javax.sql.DataSource;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives telemetry published with {@code NOTIFY} and enqueues it as Telemetry changes.
 */
public class TelemetryListener {

    private static final Logger log = LoggerFactory.getLogger(TelemetryListener.class);
    private static final Pattern CHANNEL = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    static final String DEFAULT_GRAPH_NAME = "digitaltwins";

    private final DataSource dataSource;
    private final EventQueue queue;
    private final ObjectMapper objectMapper;
    private final String channel;
    private final int pollTimeoutMs;
    private final long reconnectDelayMs;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile boolean healthy;

    public TelemetryListener(
        DataSource dataSource,
        EventQueue queue,
        ObjectMapper objectMapper,
        String channel,
        int pollTimeoutMs,
        long reconnectDelayMs
    ) {
        if (channel == null || !CHANNEL.matcher(channel).matches()) {
            throw new IllegalArgumentException("Invalid telemetry channel name: " + channel);
        }
        this.dataSource = dataSource;
        this.queue = queue;
        this.objectMapper = objectMapper;
        this.channel = channel;
        this.pollTimeoutMs = Math.max(1, pollTimeoutMs);
        this.reconnectDelayMs = reconnectDelayMs;
    }

    public void run() {
        log.info("Telemetry listener starting. channel={}", channel);
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    listen();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Telemetry listener interrupted");
                } catch (SQLException | RuntimeException e) {
                    healthy = false;
                    if (!running) {
                        break;
                    }
                    log.error("Error in telemetry listener. Retrying in {} ms", reconnectDelayMs, e);
                    try {
                        Thread.sleep(reconnectDelayMs);
                    } catch (InterruptedException interruptedException) {
                        Thread.currentThread().interrupt();
                        log.info("Telemetry listener interrupted while waiting to reconnect");
                    }
                }
            }
        } finally {
            healthy = false;
            stopped.countDown();
            log.info("Telemetry listener stopped");
        }
    }

    public void stop(Duration timeout) {
        running = false;
        try {
            if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Telemetry listener did not stop within {} ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public boolean isHealthy() {
        return healthy;
    }

    public String channel() {
        return channel;
    }

    private void listen() throws SQLException, InterruptedException {
        try (Connection connection = dataSource.getConnection()) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("LISTEN " + channel);
            }
            PGConnection pgConnection = connection.unwrap(PGConnection.class);
            healthy = true;
            log.info("Listening for telemetry on channel {}", channel);

            while (running && !Thread.currentThread().isInterrupted()) {
                PGNotification[] notifications = pgConnection.getNotifications(pollTimeoutMs);
                if (notifications == null) {
                    continue;
                }
                for (PGNotification notification : notifications) {
                    Optional<EventData> eventData = toEventData(notification.getParameter());
                    if (eventData.isPresent()) {
                        queue.put(eventData.get());
                    }
                }
            }

            try (Statement statement = connection.createStatement()) {
                statement.execute("UNLISTEN " + channel);
            }
        }
    }

    Optional<EventData> toEventData(String payload) {
        JsonNode node;
        try {
            node = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Received invalid telemetry payload: {}", payload);
            return Optional.empty();
        }
        if (!(node instanceof ObjectNode telemetry)) {
            log.warn("Received invalid telemetry payload: {}", payload);
            return Optional.empty();
        }
        String digitalTwinId = telemetry.path("digitalTwinId").asText("");
        if (digitalTwinId.isBlank()) {
            log.warn("Telemetry event missing digitalTwinId: {}", payload);
            return Optional.empty();
        }
        String graphName = telemetry.path("graphName").asText("");
        EventData eventData = EventData.telemetry(
            graphName.isBlank() ? DEFAULT_GRAPH_NAME : graphName,
            telemetry,
            Instant.now()
        );
        log.debug(
            "Enqueuing telemetry (twinId={}, messageId={}, component={})",
            digitalTwinId,
            telemetry.path("messageId").asText(null),
            telemetry.path("componentName").asText(null)
        );
        return Optional.of(eventData);
    }
}
