package io.twingraph.events.sink.kusto;

import static org.assertj.core.api.Assertions.assertThat;

import com.microsoft.azure.kusto.ingest.IngestionProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SdkKustoIngestGatewayTest {

    @Test
    @DisplayName("ingestionProperties: JSON into the mapped table with failures and successes reported to the status table")
    void ingestionProperties_reportToTable() {
        IngestionProperties properties = SdkKustoIngestGateway.ingestionProperties(
            "history",
            KustoTableMapping.propertyEvents("AdtPropertyEvents")
        );

        assertThat(properties.getDatabaseName()).isEqualTo("history");
        assertThat(properties.getTableName()).isEqualTo("AdtPropertyEvents");
        assertThat(properties.getDataFormat()).isEqualTo(IngestionProperties.DataFormat.JSON);
        assertThat(properties.getReportLevel()).isEqualTo(IngestionProperties.IngestionReportLevel.FAILURES_AND_SUCCESSES);
        assertThat(properties.getReportMethod()).isEqualTo(IngestionProperties.IngestionReportMethod.TABLE);
    }

    @Test
    @DisplayName("toStatus: service status names map to gateway statuses")
    void toStatus_mapsNames() {
        assertThat(SdkKustoIngestGateway.toStatus("Queued")).isEqualTo(KustoIngestGateway.Status.QUEUED);
        assertThat(SdkKustoIngestGateway.toStatus("Succeeded")).isEqualTo(KustoIngestGateway.Status.SUCCEEDED);
        assertThat(SdkKustoIngestGateway.toStatus("Skipped")).isEqualTo(KustoIngestGateway.Status.SKIPPED);
        assertThat(SdkKustoIngestGateway.toStatus("PartiallySucceeded")).isEqualTo(KustoIngestGateway.Status.PARTIALLY_SUCCEEDED);
        assertThat(SdkKustoIngestGateway.toStatus("Failed")).isEqualTo(KustoIngestGateway.Status.FAILED);
        assertThat(SdkKustoIngestGateway.toStatus("Pending")).isEqualTo(KustoIngestGateway.Status.PENDING);
        assertThat(SdkKustoIngestGateway.toStatus(null)).isEqualTo(KustoIngestGateway.Status.PENDING);
    }
}
