package io.twingraph.events.sink.kusto;

/**
 * One column of a JSON ingestion mapping: target column, Kusto type and JSON path in the row.
 */
public record KustoColumn(String name, String type, String path) {

    static KustoColumn of(String name, String type, String path) {
        return new KustoColumn(name, type, path);
    }
}
