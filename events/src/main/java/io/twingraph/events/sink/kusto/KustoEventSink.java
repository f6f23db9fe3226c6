package io.twingraph.events.sink.kusto;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.model.SinkEventType;
import io.twingraph.events.sink.EventSink;
import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Ingests data-history events into Kusto, one table per event type.
 * Each row is the event data; columns are extracted by JSON path mappings.
 */
public class KustoEventSink implements EventSink {

    private static final Logger log = LoggerFactory.getLogger(KustoEventSink.class);

    private final String name;
    private final String database;
    private final KustoIngestGateway gateway;
    private final ObjectMapper objectMapper;
    private final Map<SinkEventType, KustoTableMapping> mappings = new EnumMap<>(SinkEventType.class);
    private volatile boolean healthy = true;

    public KustoEventSink(KustoSinkProperties properties, KustoIngestGateway gateway, ObjectMapper objectMapper) {
        this.name = properties.getName();
        this.database = properties.getDatabase();
        this.gateway = gateway;
        this.objectMapper = objectMapper;
        register(KustoTableMapping.propertyEvents(properties.getPropertyEventsTable()));
        register(KustoTableMapping.twinLifecycleEvents(properties.getTwinLifecycleEventsTable()));
        register(KustoTableMapping.relationshipLifecycleEvents(properties.getRelationshipLifecycleEventsTable()));
    }

    private void register(KustoTableMapping mapping) {
        mappings.put(mapping.kind(), mapping);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean isHealthy() {
        return healthy;
    }

    @Override
    public void send(List<DomainEvent> events) throws Exception {
        Map<SinkEventType, List<DomainEvent>> byKind = new LinkedHashMap<>();
        for (DomainEvent event : events) {
            KustoTableMapping mapping = event.kind() == null ? null : mappings.get(event.kind());
            if (mapping == null) {
                log.warn("Kusto sink '{}' has no table for event type {} (kind={}); skipping", name, event.type(), event.kind());
                continue;
            }
            byKind.computeIfAbsent(event.kind(), k -> new ArrayList<>()).add(event);
        }

        boolean degraded = false;
        for (Map.Entry<SinkEventType, List<DomainEvent>> group : byKind.entrySet()) {
            KustoTableMapping mapping = mappings.get(group.getKey());
            List<DomainEvent> rows = group.getValue();
            List<KustoIngestGateway.Status> statuses;
            try {
                statuses = gateway.ingest(database, mapping, toJsonLines(rows));
            } catch (Exception e) {
                healthy = false;
                log.error("Kusto sink '{}' failed to ingest {} rows into {}", name, rows.size(), mapping.table(), e);
                throw e;
            }

            for (KustoIngestGateway.Status status : statuses) {
                if (status == KustoIngestGateway.Status.FAILED
                    || status == KustoIngestGateway.Status.PARTIALLY_SUCCEEDED) {
                    degraded = true;
                    log.error("Kusto sink '{}' ingestion into {} reported {}", name, mapping.table(), status);
                }
            }
            log.info("Queued {} rows for ingestion into {}.{} (sink={})", rows.size(), database, mapping.table(), name);
        }
        healthy = !degraded;
    }

    byte[] toJsonLines(List<DomainEvent> events) throws Exception {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        for (DomainEvent event : events) {
            out.write(objectMapper.writeValueAsBytes(event.data()));
            out.write('\n');
        }
        return out.toByteArray();
    }

    @Override
    public void close() {
        try {
            gateway.close();
        } catch (Exception e) {
            log.warn("Failed to close Kusto ingest client for sink '{}'", name, e);
        }
    }
}
