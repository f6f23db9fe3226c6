package io.twingraph.events.capture;

import io.twingraph.events.capture.pgoutput.DecodeResult;
import io.twingraph.events.capture.pgoutput.PgOutputDecoder;
import io.twingraph.events.capture.pgoutput.PgOutputMessage;
import io.twingraph.events.checkpoint.CheckpointStore;
import io.twingraph.events.config.EventsProperties;
import io.twingraph.events.model.EventData;
import io.twingraph.events.queue.EventQueue;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Properties;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.postgresql.PGConnection;
import org.postgresql.PGProperty;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;
import org.postgresql.replication.fluent.logical.ChainedLogicalStreamBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams pgoutput changes from a logical replication slot into the event queue.
 *
 * <p>Completed changes are batched and enqueued before the slot position is confirmed, so a
 * restart replays at most the unconfirmed tail (at-least-once).
 */
public class ReplicationSubscriber {

    private static final Logger log = LoggerFactory.getLogger(ReplicationSubscriber.class);

    private static final long IDLE_POLL_MS = 10L;
    private static final long WATCHDOG_PERIOD_SECONDS = 5L;

    private final EventsProperties.Replication config;
    private final EventQueue queue;
    private final CheckpointStore checkpointStore;
    private final ChangeAssembler assembler;
    private final PgOutputDecoder decoder = new PgOutputDecoder();
    private final ScheduledExecutorService watchdog;
    private final CountDownLatch stopped = new CountDownLatch(1);

    private volatile boolean running = true;
    private volatile boolean healthy;
    private volatile boolean watchdogTripped;
    private volatile Instant lastMessageAt;
    private volatile LogSequenceNumber lastFlushedLsn;
    private volatile Connection replicationConnection;

    public ReplicationSubscriber(
        EventsProperties.Replication config,
        EventQueue queue,
        CheckpointStore checkpointStore,
        ChangeAssembler assembler
    ) {
        if (isBlank(config.getJdbcUrl())) {
            throw new IllegalArgumentException("events.replication.jdbc-url is required");
        }
        this.config = config;
        this.queue = queue;
        this.checkpointStore = checkpointStore;
        this.assembler = assembler;
        this.watchdog = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "replication-watchdog");
            thread.setDaemon(true);
            return thread;
        });
    }

    public void run() {
        log.info(
            "Replication subscriber started. slot={}, publication={}, maxBatchSize={}, flushIntervalMs={}, walReceiverTimeoutSeconds={}",
            config.getSlot(),
            config.getPublication(),
            config.getMaxBatchSize(),
            config.getFlushIntervalMs(),
            config.effectiveWalReceiverTimeoutSeconds()
        );
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    ensureSlotExists();
                    stream();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    log.info("Replication loop interrupted");
                } catch (Exception e) {
                    healthy = false;
                    closeConnection();
                    if (!running) {
                        break;
                    }
                    if (handleFailure(e)) {
                        continue;
                    }
                    try {
                        Thread.sleep(config.getReconnectDelayMs());
                    } catch (InterruptedException interruptedException) {
                        Thread.currentThread().interrupt();
                        log.info("Replication subscriber interrupted while waiting to reconnect");
                    }
                }
            }
        } finally {
            healthy = false;
            closeConnection();
            watchdog.shutdownNow();
            stopped.countDown();
            log.info("Replication subscriber stopped. lastFlushedLsn={}", lastFlushedLsn);
        }
    }

    /**
     * Stops reading, lets the loop flush its pending batch and confirm the position, and waits for it to exit.
     */
    public void stop(Duration timeout) {
        halt();
        try {
            if (!stopped.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Replication subscriber did not stop within {} ms", timeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    void halt() {
        running = false;
    }

    public boolean isHealthy() {
        return healthy;
    }

    public Instant lastMessageAt() {
        return lastMessageAt;
    }

    public LogSequenceNumber lastFlushedLsn() {
        return lastFlushedLsn;
    }

    public String slotName() {
        return config.getSlot();
    }

    public String publication() {
        return config.getPublication();
    }

    private void stream() throws SQLException, InterruptedException {
        Connection connection = openConnection(true);
        replicationConnection = connection;
        PGConnection pgConnection = connection.unwrap(PGConnection.class);

        ChainedLogicalStreamBuilder builder = pgConnection.getReplicationAPI()
            .replicationStream()
            .logical()
            .withSlotName(config.getSlot())
            .withSlotOption("proto_version", 1)
            .withSlotOption("publication_names", config.getPublication())
            .withStatusInterval(config.getStatusIntervalSeconds(), TimeUnit.SECONDS);
        Optional<LogSequenceNumber> checkpoint = checkpointStore.loadCheckpoint(config.getSlot());
        checkpoint.ifPresent(builder::withStartPosition);

        PGReplicationStream stream = builder.start();
        log.info(
            "Started replication on slot {} for publication {} (startLsn={})",
            config.getSlot(),
            config.getPublication(),
            checkpoint.map(LogSequenceNumber::asString).orElse("slot")
        );

        healthy = true;
        watchdogTripped = false;
        lastMessageAt = Instant.now();
        ScheduledFuture<?> watchdogTask = startWatchdog(connection);
        try {
            consume(stream);
        } finally {
            watchdogTask.cancel(false);
        }
    }

    /**
     * Reads the stream until stopped. The server replays every unconfirmed transaction on a new
     * session, so assembly state left over from a previous session is discarded first.
     */
    void consume(PGReplicationStream stream) throws SQLException, InterruptedException {
        assembler.reset();
        Batch batch = new Batch();
        LogSequenceNumber lastReceived = stream.getLastReceiveLSN();
        while (running && !Thread.currentThread().isInterrupted()) {
            if (watchdogTripped) {
                throw new ReplicationTimeoutException(
                    "No replication message for " + config.effectiveWalReceiverTimeoutSeconds() + " s"
                );
            }
            ByteBuffer payload = stream.readPending();
            LogSequenceNumber received = stream.getLastReceiveLSN();
            if (received != null && (lastReceived == null || received.compareTo(lastReceived) > 0)) {
                lastReceived = received;
                lastMessageAt = Instant.now();
            }
            if (payload == null) {
                if (batch.isDue(config.getFlushIntervalMs())) {
                    flush(stream, batch);
                }
                Thread.sleep(IDLE_POLL_MS);
                continue;
            }

            lastMessageAt = Instant.now();
            handle(payload, batch);
            if (batch.size() >= config.getMaxBatchSize() || batch.isDue(config.getFlushIntervalMs())) {
                flush(stream, batch);
            }
        }
        flush(stream, batch);
    }

    private void handle(ByteBuffer payload, Batch batch) {
        DecodeResult result = decoder.decode(payload);
        if (result instanceof DecodeResult.Skipped skipped) {
            log.debug("Skipping replication message '{}': {}", skipped.tag(), skipped.reason());
            return;
        }
        PgOutputMessage message = ((DecodeResult.Decoded) result).message();
        List<EventData> completed = assembler.accept(message);
        batch.add(completed);
        if (message instanceof PgOutputMessage.Commit commit) {
            batch.commit(commit.endLsn());
        }
    }

    private void flush(PGReplicationStream stream, Batch batch) throws SQLException, InterruptedException {
        if (!batch.events.isEmpty()) {
            queue.putAll(List.copyOf(batch.events));
            log.debug("Enqueued {} changes (queueDepth={})", batch.events.size(), queue.size());
        }
        LogSequenceNumber commitLsn = batch.lastCommitLsn;
        batch.reset();
        if (commitLsn == null || (lastFlushedLsn != null && commitLsn.compareTo(lastFlushedLsn) <= 0)) {
            return;
        }
        stream.setAppliedLSN(commitLsn);
        stream.setFlushedLSN(commitLsn);
        stream.forceUpdateStatus();
        checkpointStore.saveCheckpoint(config.getSlot(), commitLsn);
        lastFlushedLsn = commitLsn;
        log.debug("Confirmed replication position {}", commitLsn.asString());
    }

    private ScheduledFuture<?> startWatchdog(Connection connection) {
        long timeoutSeconds = config.effectiveWalReceiverTimeoutSeconds();
        long period = Math.min(WATCHDOG_PERIOD_SECONDS, timeoutSeconds);
        return watchdog.scheduleAtFixedRate(() -> {
            Instant last = lastMessageAt;
            if (last == null) {
                return;
            }
            Duration silence = Duration.between(last, Instant.now());
            if (silence.getSeconds() >= timeoutSeconds && !watchdogTripped) {
                log.warn(
                    "No replication message received for {} s (timeout: {} s). Closing connection.",
                    silence.getSeconds(),
                    timeoutSeconds
                );
                healthy = false;
                watchdogTripped = true;
                abort(connection);
            }
        }, period, period, TimeUnit.SECONDS);
    }

    /**
     * @return true when the loop should retry immediately
     */
    boolean handleFailure(Exception e) {
        if (watchdogTripped || e instanceof ReplicationTimeoutException) {
            log.warn("Replication watchdog triggered: {}. Reconnecting in {} ms", e.getMessage(), config.getReconnectDelayMs());
            return false;
        }
        if (isSlotInvalidated(e)) {
            log.error("Replication slot invalidation detected: {}. Recreating slot {}", e.getMessage(), config.getSlot(), e);
            try {
                recreateSlot();
                log.info("Replication slot {} recreated; retrying immediately", config.getSlot());
                return true;
            } catch (SQLException recreateFailure) {
                log.error("Failed to recreate replication slot {}", config.getSlot(), recreateFailure);
                return false;
            }
        }
        if (isConnectionError(e)) {
            log.warn("Connection error during replication: {}. Retrying in {} ms", e.getMessage(), config.getReconnectDelayMs());
            return false;
        }
        log.error("Error during replication. Retrying in {} ms", config.getReconnectDelayMs(), e);
        return false;
    }

    static boolean isConnectionError(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            if (current instanceof IOException) {
                return true;
            }
            if (current instanceof SQLException sqlException) {
                String state = sqlException.getSQLState();
                if (state != null && state.startsWith("08")) {
                    return true;
                }
            }
            String message = current.getMessage();
            if (message != null) {
                String normalized = message.toLowerCase(Locale.ROOT);
                if (normalized.contains("connection has been closed")
                    || normalized.contains("connection is closed")
                    || normalized.contains("connection refused")
                    || normalized.contains("connection reset")
                    || normalized.contains("connection terminated")
                    || normalized.contains("server closed the connection")
                    || normalized.contains("end of stream")
                    || normalized.contains("eof")
                    || normalized.contains("timed out")
                    || normalized.contains("timeout")) {
                    return true;
                }
            }
        }
        return false;
    }

    static boolean isSlotInvalidated(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message == null) {
                continue;
            }
            if (message.contains("can no longer get changes from replication slot")
                || (message.contains("replication slot") && message.contains("invalidated"))) {
                return true;
            }
        }
        return false;
    }

    private void ensureSlotExists() throws SQLException {
        try (Connection connection = openConnection(false)) {
            try (PreparedStatement ps = connection.prepareStatement(
                "SELECT slot_name FROM pg_replication_slots WHERE slot_name = ?"
            )) {
                ps.setString(1, config.getSlot());
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        log.debug("Replication slot {} exists", config.getSlot());
                        return;
                    }
                }
            }
            log.warn("Replication slot {} does not exist. Creating it now", config.getSlot());
            createSlot(connection);
        }
    }

    private void recreateSlot() throws SQLException {
        try (Connection connection = openConnection(false)) {
            try (PreparedStatement ps = connection.prepareStatement("SELECT pg_drop_replication_slot(?)")) {
                ps.setString(1, config.getSlot());
                ps.execute();
                log.info("Dropped invalidated replication slot {}", config.getSlot());
            } catch (SQLException dropFailure) {
                log.warn("Failed to drop replication slot {}; it may not exist: {}", config.getSlot(), dropFailure.getMessage());
            }
            createSlot(connection);
        }
    }

    private void createSlot(Connection connection) throws SQLException {
        try (PreparedStatement ps = connection.prepareStatement(
            "SELECT * FROM pg_create_logical_replication_slot(?, 'pgoutput')"
        )) {
            ps.setString(1, config.getSlot());
            ps.execute();
        }
        log.info("Created replication slot {}", config.getSlot());
    }

    private Connection openConnection(boolean replication) throws SQLException {
        Properties props = new Properties();
        if (!isBlank(config.getUsername())) {
            PGProperty.USER.set(props, config.getUsername());
        }
        if (config.getPassword() != null) {
            PGProperty.PASSWORD.set(props, config.getPassword());
        }
        PGProperty.TCP_KEEP_ALIVE.set(props, true);
        PGProperty.CONNECT_TIMEOUT.set(props, 30);
        if (replication) {
            PGProperty.ASSUME_MIN_SERVER_VERSION.set(props, "10");
            PGProperty.REPLICATION.set(props, "database");
            PGProperty.PREFER_QUERY_MODE.set(props, "simple");
        }
        return DriverManager.getConnection(config.getJdbcUrl(), props);
    }

    private void abort(Connection connection) {
        try {
            connection.abort(Runnable::run);
        } catch (SQLException e) {
            log.debug("Failed to abort replication connection: {}", e.getMessage());
        }
    }

    private void closeConnection() {
        Connection connection = replicationConnection;
        replicationConnection = null;
        if (connection == null) {
            return;
        }
        try {
            connection.close();
        } catch (SQLException e) {
            log.debug("Error closing replication connection: {}", e.getMessage());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class Batch {
        private final List<EventData> events = new ArrayList<>();
        private LogSequenceNumber lastCommitLsn;
        private long lastFlushNanos = System.nanoTime();

        private void add(List<EventData> completed) {
            events.addAll(completed);
        }

        private void commit(LogSequenceNumber lsn) {
            lastCommitLsn = lsn;
        }

        private int size() {
            return events.size();
        }

        private boolean isDue(long flushIntervalMs) {
            if (events.isEmpty() && lastCommitLsn == null) {
                return false;
            }
            return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - lastFlushNanos) >= flushIntervalMs;
        }

        private void reset() {
            events.clear();
            lastCommitLsn = null;
            lastFlushNanos = System.nanoTime();
        }
    }

    static final class ReplicationTimeoutException extends RuntimeException {
        ReplicationTimeoutException(String message) {
            super(message);
        }
    }
}
