package io.twingraph.events.factory;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.model.EventData;
import io.twingraph.events.model.EventFormat;
import io.twingraph.events.model.EventType;
import io.twingraph.events.model.SinkEventType;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Turns one captured change into the domain events of an output family.
 * Holds no state and performs no I/O; every event gets a fresh id.
 */
public class DomainEventFactory {

    static final String DT_ID = "$dtId";
    static final String ETAG = "$etag";
    static final String METADATA = "$metadata";
    static final String MODEL = "$model";
    static final String RELATIONSHIP_ID = "$relationshipId";
    static final String RELATIONSHIP_NAME = "$relationshipName";
    static final String SOURCE_ID = "$sourceId";
    static final String TARGET_ID = "$targetId";
    static final String LAST_UPDATE_TIME = "lastUpdateTime";
    static final String SOURCE_TIME = "sourceTime";

    private static final Set<String> SYSTEM_FIELDS = Set.of(
        DT_ID, ETAG, RELATIONSHIP_ID, RELATIONSHIP_NAME, SOURCE_ID, TARGET_ID
    );

    private final JsonNodeFactory nodes = JsonNodeFactory.instance;

    public List<DomainEvent> create(
        EventFormat format,
        EventData eventData,
        String source,
        Map<SinkEventType, String> typeMappings
    ) {
        return switch (format) {
            case EVENT_NOTIFICATION -> createNotificationEvents(eventData, source, typeMappings);
            case DATA_HISTORY -> createDataHistoryEvents(eventData, source, typeMappings);
            case TELEMETRY -> createTelemetryEvents(eventData, source, typeMappings);
        };
    }

    public List<DomainEvent> createNotificationEvents(
        EventData eventData,
        String source,
        Map<SinkEventType, String> typeMappings
    ) {
        EventType eventType = eventData.eventType();
        Instant time = timeOf(eventData);
        return switch (eventType) {
            case TWIN_CREATE -> List.of(event(
                SinkEventType.TWIN_CREATE, source, twinSubject(eventData.newValue()), time,
                eventData.newValue().deepCopy(), typeMappings
            ));
            case TWIN_DELETE -> List.of(event(
                SinkEventType.TWIN_DELETE, source, twinSubject(eventData.oldValue()), time,
                eventData.oldValue().deepCopy(), typeMappings
            ));
            case RELATIONSHIP_CREATE -> List.of(event(
                SinkEventType.RELATIONSHIP_CREATE, source, relationshipSubject(eventData.newValue()), time,
                eventData.newValue().deepCopy(), typeMappings
            ));
            case RELATIONSHIP_DELETE -> List.of(event(
                SinkEventType.RELATIONSHIP_DELETE, source, relationshipSubject(eventData.oldValue()), time,
                eventData.oldValue().deepCopy(), typeMappings
            ));
            case TWIN_UPDATE -> {
                requireUpdateSnapshots(eventData);
                List<JsonPatchOperation> patch = withoutSystemFields(
                    enhancedPatch(eventData.oldValue(), eventData.newValue())
                );
                yield List.of(event(
                    SinkEventType.TWIN_UPDATE, source, twinSubject(eventData.newValue()), time,
                    updateBody(eventData.newValue(), patch), typeMappings
                ));
            }
            case RELATIONSHIP_UPDATE -> {
                requireUpdateSnapshots(eventData);
                List<JsonPatchOperation> patch = withoutSystemFields(
                    JsonDiff.diff(eventData.oldValue(), eventData.newValue())
                );
                yield List.of(event(
                    SinkEventType.RELATIONSHIP_UPDATE, source, relationshipSubject(eventData.newValue()), time,
                    updateBody(eventData.newValue(), patch), typeMappings
                ));
            }
            case TELEMETRY -> List.of();
        };
    }

    public List<DomainEvent> createDataHistoryEvents(
        EventData eventData,
        String source,
        Map<SinkEventType, String> typeMappings
    ) {
        EventType eventType = eventData.eventType();
        if (eventType == EventType.TELEMETRY) {
            return List.of();
        }
        Instant time = timeOf(eventData);
        List<DomainEvent> events = new ArrayList<>();
        ObjectNode empty = nodes.objectNode();

        if (eventType.isCreate() || eventType.isDelete()) {
            String action = eventType.isCreate() ? "Create" : "Delete";
            ObjectNode snapshot = eventType.isCreate() ? eventData.newValue() : eventData.oldValue();
            if (snapshot == null) {
                throw new IllegalArgumentException(eventType + " requires a snapshot");
            }
            if (eventType.isTwin()) {
                events.add(twinLifecycle(snapshot, action, source, time, typeMappings));
            } else {
                events.add(relationshipLifecycle(snapshot, action, source, time, typeMappings));
            }
            ObjectNode before = eventType.isCreate() ? empty : snapshot;
            ObjectNode after = eventType.isCreate() ? snapshot : empty;
            List<JsonPatchOperation> patch = JsonDiff.diff(before, after);
            events.addAll(propertyEvents(eventData, patch, patch, source, time, typeMappings));
            return events;
        }

        requireUpdateSnapshots(eventData);
        ObjectNode oldValue = eventData.oldValue();
        ObjectNode newValue = eventData.newValue();
        if (eventType == EventType.TWIN_UPDATE && !Objects.equals(modelId(oldValue), modelId(newValue))) {
            events.add(twinLifecycle(newValue, "Update", source, time, typeMappings));
        }
        List<JsonPatchOperation> plainPatch = JsonDiff.diff(oldValue, newValue);
        List<JsonPatchOperation> enhanced = enhancedPatch(oldValue, newValue);
        events.addAll(propertyEvents(eventData, enhanced, plainPatch, source, time, typeMappings));
        return events;
    }

    public List<DomainEvent> createTelemetryEvents(
        EventData eventData,
        String source,
        Map<SinkEventType, String> typeMappings
    ) {
        if (eventData.eventType() != EventType.TELEMETRY) {
            return List.of();
        }
        ObjectNode payload = eventData.newValue();
        if (payload == null) {
            throw new IllegalArgumentException("Telemetry event requires a payload");
        }
        String twinId = text(payload, "digitalTwinId");
        if (twinId == null) {
            throw new IllegalArgumentException("Telemetry payload is missing digitalTwinId");
        }
        String messageId = text(payload, "messageId");
        String componentName = text(payload, "componentName");
        String subject = componentName == null ? twinId : twinId + "/components/" + componentName;
        JsonNode data = payload.has("telemetry") ? payload.get("telemetry").deepCopy() : payload.deepCopy();

        return List.of(new DomainEvent(
            messageId == null ? UUID.randomUUID().toString() : messageId,
            source,
            EventTypeNames.resolve(SinkEventType.TELEMETRY, typeMappings),
            subject,
            telemetryTime(payload, eventData),
            DomainEvent.JSON_CONTENT_TYPE,
            text(payload, "modelId"),
            data,
            SinkEventType.TELEMETRY
        ));
    }

    /**
     * Diff that also reports properties whose value stayed the same while their
     * {@code $metadata/<prop>/lastUpdateTime} moved.
     */
    public List<JsonPatchOperation> enhancedPatch(ObjectNode oldValue, ObjectNode newValue) {
        List<JsonPatchOperation> operations = new ArrayList<>(JsonDiff.diff(oldValue, newValue));
        Set<String> touched = new HashSet<>();
        for (JsonPatchOperation operation : operations) {
            String first = operation.firstSegment();
            if (!METADATA.equals(first)) {
                touched.add(first);
            }
        }

        List<JsonPatchOperation> refreshed = new ArrayList<>();
        for (JsonPatchOperation operation : operations) {
            List<String> segments = operation.segments();
            if (segments.size() != 3 || !METADATA.equals(segments.get(0)) || !LAST_UPDATE_TIME.equals(segments.get(2))) {
                continue;
            }
            String property = segments.get(1);
            JsonNode current = newValue.get(property);
            if (touched.contains(property) || current == null || current.isNull()) {
                continue;
            }
            refreshed.add(JsonPatchOperation.replace(JsonPointer.append("", property), current.deepCopy()));
            touched.add(property);
        }
        operations.addAll(refreshed);
        return operations;
    }

    private List<DomainEvent> propertyEvents(
        EventData eventData,
        List<JsonPatchOperation> operations,
        List<JsonPatchOperation> plainPatch,
        String source,
        Instant time,
        Map<SinkEventType, String> typeMappings
    ) {
        ObjectNode newValue = eventData.newValue();
        ObjectNode snapshot = newValue != null ? newValue : eventData.oldValue();
        boolean relationship = eventData.eventType().isRelationship();
        String id = relationship ? text(snapshot, SOURCE_ID) : text(snapshot, DT_ID);
        if (id == null) {
            throw new IllegalArgumentException("Snapshot is missing " + (relationship ? SOURCE_ID : DT_ID));
        }
        String relationshipId = relationship ? text(snapshot, RELATIONSHIP_ID) : null;
        String relationshipTarget = relationship ? text(snapshot, TARGET_ID) : null;
        String subject = relationship ? id + "/relationships/" + relationshipId : id;
        String modelId = modelId(snapshot);
        SourceTimes sourceTimes = SourceTimes.from(plainPatch);

        List<DomainEvent> events = new ArrayList<>();
        for (JsonPatchOperation operation : operations) {
            List<String> segments = operation.segments();
            if (segments.isEmpty() || segments.get(0).startsWith("$")) {
                continue;
            }
            String key = String.join("_", segments);
            ObjectNode body = nodes.objectNode();
            body.put("timeStamp", time.toString());
            String sourceTime = sourceTimes.lookup(segments.get(0), newValue);
            if (sourceTime != null) {
                body.put("sourceTimeStamp", sourceTime);
            }
            body.put("serviceId", source);
            body.put("id", id);
            body.put("modelId", modelId);
            body.put("key", key);
            body.set("value", operation.value() == null ? nodes.nullNode() : operation.value().deepCopy());
            if (relationship) {
                body.put("relationshipTarget", relationshipTarget);
                body.put("relationshipId", relationshipId);
            }
            body.put("action", action(operation.op()));
            events.add(event(SinkEventType.PROPERTY_EVENT, source, subject, time, body, typeMappings));
        }
        return events;
    }

    private DomainEvent twinLifecycle(
        ObjectNode snapshot,
        String action,
        String source,
        Instant time,
        Map<SinkEventType, String> typeMappings
    ) {
        String twinId = twinSubject(snapshot);
        ObjectNode body = nodes.objectNode();
        body.put("twinId", twinId);
        body.put("action", action);
        body.put("timeStamp", time.toString());
        body.put("serviceId", source);
        body.put("modelId", modelId(snapshot));
        return event(SinkEventType.TWIN_LIFECYCLE, source, twinId, time, body, typeMappings);
    }

    private DomainEvent relationshipLifecycle(
        ObjectNode snapshot,
        String action,
        String source,
        Instant time,
        Map<SinkEventType, String> typeMappings
    ) {
        String subject = relationshipSubject(snapshot);
        ObjectNode body = nodes.objectNode();
        body.put("relationshipId", text(snapshot, RELATIONSHIP_ID));
        body.put("action", action);
        body.put("timeStamp", time.toString());
        body.put("serviceId", source);
        body.put("name", text(snapshot, RELATIONSHIP_NAME));
        body.put("source", text(snapshot, SOURCE_ID));
        body.put("target", text(snapshot, TARGET_ID));
        return event(SinkEventType.RELATIONSHIP_LIFECYCLE, source, subject, time, body, typeMappings);
    }

    private ObjectNode updateBody(ObjectNode newValue, List<JsonPatchOperation> patch) {
        ObjectNode body = nodes.objectNode();
        body.put("modelId", modelId(newValue));
        ArrayNode operations = body.putArray("patch");
        for (JsonPatchOperation operation : patch) {
            operations.add(operation.toJson());
        }
        return body;
    }

    private DomainEvent event(
        SinkEventType kind,
        String source,
        String subject,
        Instant time,
        JsonNode data,
        Map<SinkEventType, String> typeMappings
    ) {
        return new DomainEvent(
            UUID.randomUUID().toString(),
            source,
            EventTypeNames.resolve(kind, typeMappings),
            subject,
            time,
            DomainEvent.JSON_CONTENT_TYPE,
            null,
            data,
            kind
        );
    }

    private List<JsonPatchOperation> withoutSystemFields(List<JsonPatchOperation> operations) {
        List<JsonPatchOperation> filtered = new ArrayList<>(operations.size());
        for (JsonPatchOperation operation : operations) {
            if (!SYSTEM_FIELDS.contains(operation.firstSegment())) {
                filtered.add(operation);
            }
        }
        return filtered;
    }

    private void requireUpdateSnapshots(EventData eventData) {
        if (eventData.oldValue() == null || eventData.newValue() == null) {
            throw new IllegalArgumentException(eventData.eventType() + " requires both old and new snapshots");
        }
    }

    private String twinSubject(ObjectNode snapshot) {
        String twinId = text(snapshot, DT_ID);
        if (twinId == null) {
            throw new IllegalArgumentException("Twin snapshot is missing " + DT_ID);
        }
        return twinId;
    }

    private String relationshipSubject(ObjectNode snapshot) {
        String sourceId = text(snapshot, SOURCE_ID);
        String relationshipId = text(snapshot, RELATIONSHIP_ID);
        if (sourceId == null || relationshipId == null) {
            throw new IllegalArgumentException(
                "Relationship snapshot requires " + SOURCE_ID + " and " + RELATIONSHIP_ID
            );
        }
        return sourceId + "/relationships/" + relationshipId;
    }

    private static String modelId(ObjectNode snapshot) {
        if (snapshot == null) {
            return null;
        }
        JsonNode model = snapshot.path(METADATA).path(MODEL);
        return model.isTextual() ? model.asText() : null;
    }

    private static String text(ObjectNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isEmpty() ? null : text;
    }

    private static String action(String op) {
        return switch (op) {
            case JsonPatchOperation.ADD -> "Create";
            case JsonPatchOperation.REMOVE -> "Delete";
            default -> "Update";
        };
    }

    private static Instant timeOf(EventData eventData) {
        return eventData.timestamp() == null ? Instant.now() : eventData.timestamp();
    }

    private static Instant telemetryTime(ObjectNode payload, EventData eventData) {
        String raw = text(payload, "timestamp");
        if (raw == null) {
            return timeOf(eventData);
        }
        try {
            return Instant.parse(raw);
        } catch (DateTimeParseException e) {
            return timeOf(eventData);
        }
    }

    /**
     * Properties whose {@code $metadata/<prop>/sourceTime} was written by the change.
     */
    private record SourceTimes(boolean all, Set<String> properties) {

        static SourceTimes from(List<JsonPatchOperation> plainPatch) {
            boolean all = false;
            Set<String> properties = new HashSet<>();
            for (JsonPatchOperation operation : plainPatch) {
                List<String> segments = operation.segments();
                if (segments.isEmpty() || !METADATA.equals(segments.get(0))) {
                    continue;
                }
                if (segments.size() == 1) {
                    all = true;
                } else if (segments.size() == 2 || SOURCE_TIME.equals(segments.get(2))) {
                    properties.add(segments.get(1));
                }
            }
            return new SourceTimes(all, properties);
        }

        String lookup(String property, ObjectNode newValue) {
            if (newValue == null || (!all && !properties.contains(property))) {
                return null;
            }
            JsonNode sourceTime = newValue.path(METADATA).path(property).path(SOURCE_TIME);
            return sourceTime.isTextual() ? sourceTime.asText() : null;
        }
    }
}
