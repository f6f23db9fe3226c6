package io.twingraph.events.sink.kusto;

import io.twingraph.events.sink.SinkProperties;

public class KustoSinkProperties extends SinkProperties {

    private String ingestionUri;
    private String database;
    private String propertyEventsTable = "AdtPropertyEvents";
    private String twinLifecycleEventsTable = "AdtTwinLifeCycleEvents";
    private String relationshipLifecycleEventsTable = "AdtRelationshipLifeCycleEvents";
    private String tenantId;
    private String clientId;
    private String clientSecret;

    public String getIngestionUri() {
        return ingestionUri;
    }

    public void setIngestionUri(String ingestionUri) {
        this.ingestionUri = ingestionUri;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getPropertyEventsTable() {
        return propertyEventsTable;
    }

    public void setPropertyEventsTable(String propertyEventsTable) {
        this.propertyEventsTable = propertyEventsTable;
    }

    public String getTwinLifecycleEventsTable() {
        return twinLifecycleEventsTable;
    }

    public void setTwinLifecycleEventsTable(String twinLifecycleEventsTable) {
        this.twinLifecycleEventsTable = twinLifecycleEventsTable;
    }

    public String getRelationshipLifecycleEventsTable() {
        return relationshipLifecycleEventsTable;
    }

    public void setRelationshipLifecycleEventsTable(String relationshipLifecycleEventsTable) {
        this.relationshipLifecycleEventsTable = relationshipLifecycleEventsTable;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getClientId() {
        return clientId;
    }

    public void setClientId(String clientId) {
        this.clientId = clientId;
    }

    public String getClientSecret() {
        return clientSecret;
    }

    public void setClientSecret(String clientSecret) {
        this.clientSecret = clientSecret;
    }
}
