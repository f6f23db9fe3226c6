package io.twingraph.events.sink.kusto;

import io.twingraph.events.model.SinkEventType;
import java.util.List;

/**
 * Target table and JSON column mapping for one data-history event type.
 */
public record KustoTableMapping(SinkEventType kind, String table, List<KustoColumn> columns) {

    public KustoTableMapping {
        if (table == null || table.isBlank()) {
            throw new IllegalArgumentException("Kusto table for " + kind + " must not be blank");
        }
        columns = List.copyOf(columns);
    }

    static KustoTableMapping propertyEvents(String table) {
        return new KustoTableMapping(SinkEventType.PROPERTY_EVENT, table, List.of(
            KustoColumn.of("TimeStamp", "datetime", "$.timeStamp"),
            KustoColumn.of("SourceTimeStamp", "datetime", "$.sourceTimeStamp"),
            KustoColumn.of("ServiceId", "string", "$.serviceId"),
            KustoColumn.of("Id", "string", "$.id"),
            KustoColumn.of("ModelId", "string", "$.modelId"),
            KustoColumn.of("Key", "string", "$.key"),
            KustoColumn.of("Value", "dynamic", "$.value"),
            KustoColumn.of("RelationshipTarget", "string", "$.relationshipTarget"),
            KustoColumn.of("RelationshipId", "string", "$.relationshipId"),
            KustoColumn.of("Action", "string", "$.action")
        ));
    }

    static KustoTableMapping twinLifecycleEvents(String table) {
        return new KustoTableMapping(SinkEventType.TWIN_LIFECYCLE, table, List.of(
            KustoColumn.of("TimeStamp", "datetime", "$.timeStamp"),
            KustoColumn.of("ServiceId", "string", "$.serviceId"),
            KustoColumn.of("TwinId", "string", "$.twinId"),
            KustoColumn.of("Action", "string", "$.action"),
            KustoColumn.of("ModelId", "string", "$.modelId")
        ));
    }

    static KustoTableMapping relationshipLifecycleEvents(String table) {
        return new KustoTableMapping(SinkEventType.RELATIONSHIP_LIFECYCLE, table, List.of(
            KustoColumn.of("TimeStamp", "datetime", "$.timeStamp"),
            KustoColumn.of("ServiceId", "string", "$.serviceId"),
            KustoColumn.of("RelationshipId", "string", "$.relationshipId"),
            KustoColumn.of("Action", "string", "$.action"),
            KustoColumn.of("Name", "string", "$.name"),
            KustoColumn.of("Source", "string", "$.source"),
            KustoColumn.of("Target", "string", "$.target")
        ));
    }
}
