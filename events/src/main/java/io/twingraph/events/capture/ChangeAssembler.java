package io.twingraph.events.capture;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.twingraph.events.capture.pgoutput.PgOutputMessage;
import io.twingraph.events.model.EventData;
import io.twingraph.events.model.EventType;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns decoded row changes of graph label tables into {@link EventData}.
 *
 * <p>Consecutive changes to the same entity within one transaction are coalesced: the first
 * observed old snapshot is kept and the latest new snapshot wins. An entity's change is
 * completed when a different entity is touched or the transaction commits. Not thread-safe;
 * owned by the replication thread.
 */
public class ChangeAssembler {

    private static final Logger log = LoggerFactory.getLogger(ChangeAssembler.class);

    static final String AGE_CATALOG = "ag_catalog";
    static final String TWIN_TABLE = "Twin";
    static final String ID_COLUMN = "id";
    static final String PROPERTIES_COLUMN = "properties";
    static final String DT_ID = "$dtId";
    static final String RELATIONSHIP_ID = "$relationshipId";

    private final ObjectMapper objectMapper;
    private final Map<Integer, PgOutputMessage.Relation> relations = new HashMap<>();
    private Instant transactionTime;
    private Pending pending;

    public ChangeAssembler(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Feeds one message and returns the changes it completed, in order.
     */
    public List<EventData> accept(PgOutputMessage message) {
        if (message instanceof PgOutputMessage.Begin begin) {
            transactionTime = begin.commitTime();
            return completePending();
        }
        if (message instanceof PgOutputMessage.Commit) {
            List<EventData> completed = completePending();
            transactionTime = null;
            return completed;
        }
        if (message instanceof PgOutputMessage.Relation relation) {
            relations.put(relation.relationId(), relation);
            return List.of();
        }
        if (message instanceof PgOutputMessage.Insert insert) {
            return onInsert(insert);
        }
        if (message instanceof PgOutputMessage.Update update) {
            return onUpdate(update);
        }
        if (message instanceof PgOutputMessage.Delete delete) {
            return onDelete(delete);
        }
        return List.of();
    }

    /**
     * Discards the open transaction state. Called before a new replication session starts,
     * since the server replays every transaction that was not confirmed.
     */
    public void reset() {
        if (pending != null) {
            log.debug("Discarding uncommitted change of entity {}", pending.entityId);
        }
        pending = null;
        transactionTime = null;
    }

    public boolean hasPending() {
        return pending != null;
    }

    private List<EventData> onInsert(PgOutputMessage.Insert insert) {
        PgOutputMessage.Relation relation = graphRelation(insert.relationId());
        if (relation == null) {
            return List.of();
        }
        Row row = toRow(relation, insert.newTuple(), null);
        if (row.id() == null) {
            log.info("Skipping insert without an id (table={}.{})", relation.namespace(), relation.name());
            return List.of();
        }

        if (pending != null && pending.matches(row.id(), relation.name())) {
            if (pending.deleted) {
                // re-created within the transaction
                pending.type = pending.cancelled
                    ? createType(relation.name(), row.properties())
                    : updateType(relation.name(), row.properties(), pending.oldValue);
                pending.cancelled = false;
                pending.deleted = false;
            }
            pending.newValue = row.properties();
            return List.of();
        }

        List<EventData> completed = completePending();
        pending = new Pending(row.id(), relation.namespace(), relation.name(), timestamp());
        pending.type = createType(relation.name(), row.properties());
        pending.newValue = row.properties();
        return completed;
    }

    private List<EventData> onUpdate(PgOutputMessage.Update update) {
        PgOutputMessage.Relation relation = graphRelation(update.relationId());
        if (relation == null) {
            return List.of();
        }
        Row oldRow = update.oldTuple() == null || update.oldTupleIsKeyOnly()
            ? null
            : toRow(relation, update.oldTuple(), null);
        ObjectNode previous = oldRow != null ? oldRow.properties() : null;
        if (previous == null && pending != null) {
            previous = pending.newValue;
        }
        Row newRow = toRow(relation, update.newTuple(), previous);
        if (newRow.id() == null || (oldRow != null && oldRow.id() != null && !oldRow.id().equals(newRow.id()))) {
            log.info(
                "Skipping update without a stable id (table={}.{}, oldId={}, newId={})",
                relation.namespace(),
                relation.name(),
                oldRow == null ? null : oldRow.id(),
                newRow.id()
            );
            return List.of();
        }

        if (pending != null && pending.matches(newRow.id(), relation.name())) {
            boolean created = pending.type != null && pending.type.isCreate();
            if (pending.oldValue == null && !created) {
                pending.oldValue = oldRow == null ? null : oldRow.properties();
            }
            if (pending.type == null) {
                pending.type = created
                    ? createType(relation.name(), newRow.properties())
                    : updateType(relation.name(), newRow.properties(), pending.oldValue);
            }
            pending.newValue = newRow.properties();
            return List.of();
        }

        List<EventData> completed = completePending();
        ObjectNode oldValue = oldRow == null ? null : oldRow.properties();
        pending = new Pending(newRow.id(), relation.namespace(), relation.name(), timestamp());
        pending.type = updateType(relation.name(), newRow.properties(), oldValue);
        pending.oldValue = oldValue;
        pending.newValue = newRow.properties();
        return completed;
    }

    private List<EventData> onDelete(PgOutputMessage.Delete delete) {
        PgOutputMessage.Relation relation = graphRelation(delete.relationId());
        if (relation == null) {
            return List.of();
        }
        Row row = toRow(relation, delete.oldTuple(), null);
        if (row.id() == null) {
            log.info("Skipping delete without an id (table={}.{})", relation.namespace(), relation.name());
            return List.of();
        }

        if (pending != null && pending.matches(row.id(), relation.name())) {
            if (pending.type != null && pending.type.isCreate()) {
                pending.cancelled = true;
            } else if (pending.oldValue == null) {
                pending.oldValue = row.properties();
            }
            pending.deleted = true;
            pending.type = deleteType(relation.name(), pending.oldValue);
            pending.newValue = null;
            return List.of();
        }

        List<EventData> completed = completePending();
        ObjectNode oldValue = delete.oldTupleIsKeyOnly() ? null : row.properties();
        pending = new Pending(row.id(), relation.namespace(), relation.name(), timestamp());
        pending.deleted = true;
        pending.type = deleteType(relation.name(), oldValue);
        pending.oldValue = oldValue;
        return completed;
    }

    private List<EventData> completePending() {
        Pending completed = pending;
        pending = null;
        if (completed == null) {
            return List.of();
        }
        if (completed.cancelled) {
            log.debug("Dropping entity {} created and deleted in one transaction", completed.entityId);
            return List.of();
        }
        if (completed.type == null) {
            log.warn(
                "Skipping change that is neither twin nor relationship (entityId={}, table={}.{})",
                completed.entityId,
                completed.graphName,
                completed.tableName
            );
            return List.of();
        }
        EventData eventData = new EventData(
            completed.type,
            completed.graphName,
            completed.tableName,
            completed.entityId,
            completed.type.isCreate() ? null : completed.oldValue,
            completed.type.isDelete() ? null : completed.newValue,
            completed.timestamp
        );
        if (!eventData.isValid()) {
            log.warn(
                "Skipping invalid change (type={}, entityId={}, table={}.{}, hasOld={}, hasNew={})",
                eventData.eventType(),
                eventData.entityId(),
                eventData.graphName(),
                eventData.tableName(),
                eventData.oldValue() != null,
                eventData.newValue() != null
            );
            return List.of();
        }
        log.debug(
            "Completed change (type={}, entityId={}, table={}.{})",
            eventData.eventType(),
            eventData.entityId(),
            eventData.graphName(),
            eventData.tableName()
        );
        return List.of(eventData);
    }

    private PgOutputMessage.Relation graphRelation(int relationId) {
        PgOutputMessage.Relation relation = relations.get(relationId);
        if (relation == null) {
            log.warn("Skipping change for unknown relation id {}", relationId);
            return null;
        }
        if (AGE_CATALOG.equals(relation.namespace())) {
            return null;
        }
        return relation;
    }

    private Row toRow(PgOutputMessage.Relation relation, PgOutputMessage.TupleData tuple, ObjectNode unchangedFallback) {
        PgOutputMessage.ColumnValue idValue = tuple.get(relation.indexOf(ID_COLUMN));
        PgOutputMessage.ColumnValue propertiesValue = tuple.get(relation.indexOf(PROPERTIES_COLUMN));

        String id = idValue.kind() == PgOutputMessage.ValueKind.TEXT ? idValue.text() : null;
        ObjectNode properties = switch (propertiesValue.kind()) {
            case TEXT -> parseAgtype(propertiesValue.text(), relation);
            case UNCHANGED_TOAST -> unchangedFallback == null ? null : unchangedFallback.deepCopy();
            case NULL -> null;
        };
        return new Row(id, properties);
    }

    private ObjectNode parseAgtype(String text, PgOutputMessage.Relation relation) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node instanceof ObjectNode objectNode) {
                return objectNode;
            }
            log.warn("Properties of {}.{} are not a JSON object; ignoring", relation.namespace(), relation.name());
            return null;
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse properties of {}.{}: {}", relation.namespace(), relation.name(), e.getOriginalMessage());
            return null;
        }
    }

    private Instant timestamp() {
        return transactionTime != null ? transactionTime : Instant.now();
    }

    private static EventType createType(String table, ObjectNode value) {
        if (isTwin(table, value, null)) {
            return EventType.TWIN_CREATE;
        }
        return isRelationship(value, null) ? EventType.RELATIONSHIP_CREATE : null;
    }

    private static EventType updateType(String table, ObjectNode newValue, ObjectNode oldValue) {
        if (isTwin(table, newValue, oldValue)) {
            return EventType.TWIN_UPDATE;
        }
        return isRelationship(newValue, oldValue) ? EventType.RELATIONSHIP_UPDATE : null;
    }

    private static EventType deleteType(String table, ObjectNode oldValue) {
        if (isTwin(table, oldValue, null)) {
            return EventType.TWIN_DELETE;
        }
        return isRelationship(oldValue, null) ? EventType.RELATIONSHIP_DELETE : null;
    }

    private static boolean isTwin(String table, ObjectNode first, ObjectNode second) {
        return TWIN_TABLE.equals(table) || has(first, DT_ID) || has(second, DT_ID);
    }

    private static boolean isRelationship(ObjectNode first, ObjectNode second) {
        return has(first, RELATIONSHIP_ID) || has(second, RELATIONSHIP_ID);
    }

    private static boolean has(ObjectNode node, String field) {
        return node != null && node.has(field);
    }

    private record Row(String id, ObjectNode properties) {
    }

    private static final class Pending {
        private final String entityId;
        private final String graphName;
        private final String tableName;
        private final Instant timestamp;
        private EventType type;
        private ObjectNode oldValue;
        private ObjectNode newValue;
        private boolean deleted;
        private boolean cancelled;

        private Pending(String entityId, String graphName, String tableName, Instant timestamp) {
            this.entityId = entityId;
            this.graphName = graphName;
            this.tableName = tableName;
            this.timestamp = timestamp;
        }

        private boolean matches(String id, String table) {
            return Objects.equals(entityId, id) && Objects.equals(tableName, table);
        }
    }
}
