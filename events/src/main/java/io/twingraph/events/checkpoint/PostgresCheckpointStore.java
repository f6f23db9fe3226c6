package io.twingraph.events.checkpoint;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.postgresql.replication.LogSequenceNumber;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

public class PostgresCheckpointStore implements CheckpointStore {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final NamedParameterJdbcTemplate jdbcTemplate;
    private final String schema;
    private final String table;
    private volatile boolean initialized;

    public PostgresCheckpointStore(NamedParameterJdbcTemplate jdbcTemplate, String schema) {
        if (schema == null || !IDENTIFIER.matcher(schema).matches()) {
            throw new IllegalArgumentException("Invalid checkpoint schema name: " + schema);
        }
        this.jdbcTemplate = jdbcTemplate;
        this.schema = schema;
        this.table = schema + ".replication_checkpoint";
    }

    @Override
    public synchronized Optional<LogSequenceNumber> loadCheckpoint(String slotName) {
        initializeTable();
        String sql = "SELECT lsn FROM " + table + " WHERE slot_name = :slotName";
        try {
            List<String> values = jdbcTemplate.queryForList(sql, Map.of("slotName", slotName), String.class);
            if (values.isEmpty() || values.get(0) == null || values.get(0).isBlank()) {
                return Optional.empty();
            }
            return Optional.of(LogSequenceNumber.valueOf(values.get(0).trim()));
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to load checkpoint for slot " + slotName + " from " + table, e);
        }
    }

    @Override
    public synchronized void saveCheckpoint(String slotName, LogSequenceNumber lsn) {
        initializeTable();
        String sql = """
            INSERT INTO %s(slot_name, lsn, updated_at)
            VALUES (:slotName, :lsn, now())
            ON CONFLICT (slot_name) DO UPDATE SET lsn = EXCLUDED.lsn, updated_at = EXCLUDED.updated_at
            """.formatted(table);
        try {
            jdbcTemplate.update(sql, new MapSqlParameterSource()
                .addValue("slotName", slotName)
                .addValue("lsn", lsn.asString()));
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to save checkpoint for slot " + slotName + " into " + table, e);
        }
    }

    private void initializeTable() {
        if (initialized) {
            return;
        }
        try {
            jdbcTemplate.getJdbcOperations().execute("CREATE SCHEMA IF NOT EXISTS " + schema);
            jdbcTemplate.getJdbcOperations().execute("""
                CREATE TABLE IF NOT EXISTS %s (
                  slot_name TEXT PRIMARY KEY,
                  lsn TEXT NOT NULL,
                  updated_at TIMESTAMPTZ NOT NULL
                )
                """.formatted(table));
        } catch (DataAccessException e) {
            throw new IllegalStateException("Failed to initialize " + table, e);
        }
        initialized = true;
    }
}
