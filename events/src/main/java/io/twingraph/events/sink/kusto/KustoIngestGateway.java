package io.twingraph.events.sink.kusto;

import java.util.List;

/**
 * Seam over the Kusto ingest client so the sink can be exercised without a cluster.
 */
public interface KustoIngestGateway extends AutoCloseable {

    enum Status {
        QUEUED,
        PENDING,
        SUCCEEDED,
        SKIPPED,
        PARTIALLY_SUCCEEDED,
        FAILED
    }

    /**
     * Ingests newline-delimited JSON rows into {@code mapping.table()}.
     *
     * @return the per-source statuses reported by the service
     */
    List<Status> ingest(String database, KustoTableMapping mapping, byte[] rows) throws Exception;

    @Override
    default void close() throws Exception {
    }
}
