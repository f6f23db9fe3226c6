package io.twingraph.events.resilience;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.sink.CloudEventJson;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/**
 * PostgreSQL dead letter table. The schema, table and indexes are created on first use.
 */
public class DeadLetterRepository implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterRepository.class);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final int MAX_STACK_LENGTH = 8000;

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;
    private final String schema;
    private final String table;
    private volatile boolean initialized;

    public DeadLetterRepository(NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper, String schema) {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid dead letter schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.objectMapper = objectMapper;
        this.schema = schema;
        this.table = schema + ".dead_letter_queue";
    }

    @Override
    public void save(DomainEvent event, String sinkName, Throwable error, int retryCount) {
        ensureSchema();
        Instant now = Instant.now();
        String sql = """
            INSERT INTO %s(id, event_id, sink_name, event_type, payload, error_message, error_stack,
                           retry_count, failed_at, last_attempt_at, status)
            VALUES (:id, :eventId, :sinkName, :eventType, CAST(:payload AS jsonb), :errorMessage, :errorStack,
                    :retryCount, :failedAt, :lastAttemptAt, :status)
            """.formatted(table);

        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("id", UUID.randomUUID())
            .addValue("eventId", event.id())
            .addValue("sinkName", sinkName)
            .addValue("eventType", event.type())
            .addValue("payload", CloudEventJson.toStructured(objectMapper, event).toString())
            .addValue("errorMessage", error == null ? null : String.valueOf(error.getMessage()))
            .addValue("errorStack", stackTrace(error))
            .addValue("retryCount", retryCount)
            .addValue("failedAt", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("lastAttemptAt", Timestamp.from(now), Types.TIMESTAMP)
            .addValue("status", DeadLetterStatus.PENDING.dbValue());

        jdbcTemplate.update(sql, params);
        log.warn(
            "Dead-lettered event (sink={}, eventId={}, type={}, attempts={})",
            sinkName,
            event.id(),
            event.type(),
            retryCount
        );
    }

    public long countByStatus(DeadLetterStatus status) {
        ensureSchema();
        String sql = "SELECT count(*) FROM " + table + " WHERE status = :status";
        Long count = jdbcTemplate.queryForObject(sql, Map.of("status", status.dbValue()), Long.class);
        return count == null ? 0L : count;
    }

    public List<DeadLetterRecord> findPending(int limit) {
        ensureSchema();
        String sql = """
            SELECT id, event_id, sink_name, event_type, payload, error_message, error_stack,
                   retry_count, failed_at, last_attempt_at, status
            FROM %s
            WHERE status = :status
            ORDER BY failed_at
            LIMIT :limit
            """.formatted(table);
        return jdbcTemplate.query(
            sql,
            new MapSqlParameterSource()
                .addValue("status", DeadLetterStatus.PENDING.dbValue())
                .addValue("limit", limit),
            this::toRecord
        );
    }

    public boolean updateStatus(UUID id, DeadLetterStatus status) {
        ensureSchema();
        String sql = """
            UPDATE %s
            SET status = :status,
                last_attempt_at = now()
            WHERE id = :id
            """.formatted(table);
        return jdbcTemplate.update(sql, new MapSqlParameterSource()
            .addValue("id", id)
            .addValue("status", status.dbValue())) > 0;
    }

    void ensureSchema() {
        if (initialized) {
            return;
        }
        synchronized (this) {
            if (initialized) {
                return;
            }
            jdbcTemplate.getJdbcOperations().execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            jdbcTemplate.getJdbcOperations().execute("""
                CREATE TABLE IF NOT EXISTS %s (
                    id UUID PRIMARY KEY,
                    event_id TEXT NOT NULL,
                    sink_name TEXT NOT NULL,
                    event_type TEXT NOT NULL,
                    payload JSONB NOT NULL,
                    error_message TEXT,
                    error_stack TEXT,
                    retry_count INT NOT NULL DEFAULT 0,
                    failed_at TIMESTAMPTZ NOT NULL,
                    last_attempt_at TIMESTAMPTZ,
                    status TEXT NOT NULL DEFAULT 'pending'
                )
                """.formatted(table));
            jdbcTemplate.getJdbcOperations().execute(
                "CREATE INDEX IF NOT EXISTS idx_dlq_status ON " + table + " (status)"
            );
            jdbcTemplate.getJdbcOperations().execute(
                "CREATE INDEX IF NOT EXISTS idx_dlq_sink ON " + table + " (sink_name)"
            );
            initialized = true;
            log.info("Dead letter table ready: {}", table);
        }
    }

    private DeadLetterRecord toRecord(ResultSet rs, int rowNum) throws SQLException {
        String payloadText = rs.getString("payload");
        JsonNode payload;
        try {
            payload = objectMapper.readTree(payloadText);
        } catch (Exception e) {
            payload = objectMapper.createObjectNode().put("raw", payloadText);
        }
        Timestamp lastAttempt = rs.getTimestamp("last_attempt_at");
        return new DeadLetterRecord(
            rs.getObject("id", UUID.class),
            rs.getString("event_id"),
            rs.getString("sink_name"),
            rs.getString("event_type"),
            payload,
            rs.getString("error_message"),
            rs.getString("error_stack"),
            rs.getInt("retry_count"),
            rs.getTimestamp("failed_at").toInstant(),
            lastAttempt == null ? null : lastAttempt.toInstant(),
            DeadLetterStatus.fromDb(rs.getString("status"))
        );
    }

    private static String stackTrace(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter out = new StringWriter();
        error.printStackTrace(new PrintWriter(out));
        String trace = out.toString();
        return trace.length() > MAX_STACK_LENGTH ? trace.substring(0, MAX_STACK_LENGTH) : trace;
    }
}
