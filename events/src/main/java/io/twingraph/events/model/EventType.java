package io.twingraph.events.model;

public enum EventType {
    TWIN_CREATE,
    TWIN_UPDATE,
    TWIN_DELETE,
    RELATIONSHIP_CREATE,
    RELATIONSHIP_UPDATE,
    RELATIONSHIP_DELETE,
    TELEMETRY;

    public boolean isTwin() {
        return this == TWIN_CREATE || this == TWIN_UPDATE || this == TWIN_DELETE;
    }

    public boolean isRelationship() {
        return this == RELATIONSHIP_CREATE || this == RELATIONSHIP_UPDATE || this == RELATIONSHIP_DELETE;
    }

    public boolean isCreate() {
        return this == TWIN_CREATE || this == RELATIONSHIP_CREATE;
    }

    public boolean isDelete() {
        return this == TWIN_DELETE || this == RELATIONSHIP_DELETE;
    }
}
