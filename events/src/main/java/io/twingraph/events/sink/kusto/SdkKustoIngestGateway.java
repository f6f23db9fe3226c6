package io.twingraph.events.sink.kusto;

import com.microsoft.azure.kusto.data.auth.ConnectionStringBuilder;
import com.microsoft.azure.kusto.ingest.ColumnMapping;
import com.microsoft.azure.kusto.ingest.IngestClientFactory;
import com.microsoft.azure.kusto.ingest.IngestionMapping;
import com.microsoft.azure.kusto.ingest.IngestionProperties;
import com.microsoft.azure.kusto.ingest.QueuedIngestClient;
import com.microsoft.azure.kusto.ingest.result.IngestionResult;
import com.microsoft.azure.kusto.ingest.result.IngestionStatus;
import com.microsoft.azure.kusto.ingest.source.StreamSourceInfo;
import java.io.ByteArrayInputStream;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Queued ingestion through the Azure Data Explorer Java SDK.
 */
public class SdkKustoIngestGateway implements KustoIngestGateway {

    private static final Logger log = LoggerFactory.getLogger(SdkKustoIngestGateway.class);

    private final QueuedIngestClient client;

    public SdkKustoIngestGateway(KustoSinkProperties properties) {
        if (isBlank(properties.getIngestionUri()) || isBlank(properties.getDatabase())) {
            throw new IllegalArgumentException("Kusto sink " + properties.getName() + " requires ingestion-uri and database");
        }
        ConnectionStringBuilder connection;
        if (!isBlank(properties.getClientId()) && !isBlank(properties.getClientSecret())) {
            connection = ConnectionStringBuilder.createWithAadApplicationCredentials(
                properties.getIngestionUri(),
                properties.getClientId(),
                properties.getClientSecret(),
                properties.getTenantId()
            );
        } else {
            log.info("Kusto sink '{}' has no client credentials; using managed identity", properties.getName());
            connection = ConnectionStringBuilder.createWithAadManagedIdentity(properties.getIngestionUri());
        }
        try {
            this.client = IngestClientFactory.createClient(connection);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid Kusto ingestion uri: " + properties.getIngestionUri(), e);
        }
    }

    @Override
    public List<Status> ingest(String database, KustoTableMapping mapping, byte[] rows) throws Exception {
        StreamSourceInfo source = new StreamSourceInfo(new ByteArrayInputStream(rows));
        IngestionResult result = client.ingestFromStream(source, ingestionProperties(database, mapping));

        List<Status> statuses = new ArrayList<>();
        for (IngestionStatus status : result.getIngestionStatusCollection()) {
            statuses.add(toStatus(status.getStatus()));
        }
        return statuses;
    }

    /**
     * Failures and successes are reported to the status table, so the returned statuses move
     * past {@code Queued}.
     */
    static IngestionProperties ingestionProperties(String database, KustoTableMapping mapping) {
        IngestionProperties ingestionProperties = new IngestionProperties(database, mapping.table());
        ingestionProperties.setDataFormat(IngestionProperties.DataFormat.JSON);
        ingestionProperties.setReportLevel(IngestionProperties.IngestionReportLevel.FAILURES_AND_SUCCESSES);
        ingestionProperties.setReportMethod(IngestionProperties.IngestionReportMethod.TABLE);

        ColumnMapping[] columns = new ColumnMapping[mapping.columns().size()];
        for (int i = 0; i < columns.length; i++) {
            KustoColumn column = mapping.columns().get(i);
            ColumnMapping columnMapping = new ColumnMapping(column.name(), column.type());
            columnMapping.setPath(column.path());
            columns[i] = columnMapping;
        }
        ingestionProperties.setIngestionMapping(columns, IngestionMapping.IngestionMappingKind.JSON);
        return ingestionProperties;
    }

    /**
     * Maps the service's operation status name.
     */
    static Status toStatus(String status) {
        if (status == null) {
            return Status.PENDING;
        }
        return switch (status) {
            case "Queued" -> Status.QUEUED;
            case "Succeeded" -> Status.SUCCEEDED;
            case "Skipped" -> Status.SKIPPED;
            case "PartiallySucceeded" -> Status.PARTIALLY_SUCCEEDED;
            case "Failed" -> Status.FAILED;
            default -> Status.PENDING;
        };
    }

    @Override
    public void close() throws Exception {
        client.close();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
