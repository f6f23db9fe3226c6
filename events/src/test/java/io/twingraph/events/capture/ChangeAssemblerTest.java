package io.twingraph.events.capture;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.capture.pgoutput.PgOutputMessage;
import io.twingraph.events.capture.pgoutput.PgOutputMessage.ColumnValue;
import io.twingraph.events.capture.pgoutput.PgOutputMessage.ValueKind;
import io.twingraph.events.model.EventData;
import io.twingraph.events.model.EventType;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.postgresql.replication.LogSequenceNumber;

class ChangeAssemblerTest {

    private static final int TWIN = 1;
    private static final int EDGE = 2;
    private static final int CATALOG = 3;
    private static final Instant COMMIT_TIME = Instant.parse("2024-05-01T10:00:00Z");

    private ChangeAssembler assembler;

    @BeforeEach
    void setUp() {
        assembler = new ChangeAssembler(new ObjectMapper());
        assembler.accept(relation(TWIN, "digitaltwins", "Twin"));
        assembler.accept(relation(EDGE, "digitaltwins", "isPartOf"));
        assembler.accept(relation(CATALOG, "ag_catalog", "ag_label"));
    }

    @Test
    void insertBecomesTwinCreateOnCommit() {
        List<EventData> changes = transaction(
            insert(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}")
        );

        assertThat(changes).hasSize(1);
        EventData change = changes.get(0);
        assertThat(change.eventType()).isEqualTo(EventType.TWIN_CREATE);
        assertThat(change.graphName()).isEqualTo("digitaltwins");
        assertThat(change.tableName()).isEqualTo("Twin");
        assertThat(change.entityId()).isEqualTo("1");
        assertThat(change.oldValue()).isNull();
        assertThat(change.newValue().get("temp").asInt()).isEqualTo(20);
        assertThat(change.timestamp()).isEqualTo(COMMIT_TIME);
    }

    @Test
    @DisplayName("Consecutive updates keep the first old snapshot and the latest new snapshot")
    void updatesAreCoalesced() {
        List<EventData> changes = transaction(
            update(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}", "{\"$dtId\":\"room1\",\"temp\":21}"),
            update(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":21}", "{\"$dtId\":\"room1\",\"temp\":22}")
        );

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).eventType()).isEqualTo(EventType.TWIN_UPDATE);
        assertThat(changes.get(0).oldValue().get("temp").asInt()).isEqualTo(20);
        assertThat(changes.get(0).newValue().get("temp").asInt()).isEqualTo(22);
    }

    @Test
    void insertFollowedByUpdateStaysCreate() {
        List<EventData> changes = transaction(
            insert(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}"),
            update(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}", "{\"$dtId\":\"room1\",\"temp\":25}")
        );

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).eventType()).isEqualTo(EventType.TWIN_CREATE);
        assertThat(changes.get(0).oldValue()).isNull();
        assertThat(changes.get(0).newValue().get("temp").asInt()).isEqualTo(25);
    }

    @Test
    void createThenDeleteInOneTransactionIsDropped() {
        List<EventData> changes = transaction(
            insert(TWIN, "1", "{\"$dtId\":\"room1\"}"),
            delete(TWIN, "1", "{\"$dtId\":\"room1\"}")
        );

        assertThat(changes).isEmpty();
    }

    @Test
    void updateThenDeleteKeepsFirstOldSnapshot() {
        List<EventData> changes = transaction(
            update(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}", "{\"$dtId\":\"room1\",\"temp\":21}"),
            delete(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":21}")
        );

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).eventType()).isEqualTo(EventType.TWIN_DELETE);
        assertThat(changes.get(0).oldValue().get("temp").asInt()).isEqualTo(20);
        assertThat(changes.get(0).newValue()).isNull();
    }

    @Test
    @DisplayName("Touching another entity completes the pending change")
    void entityTransitionEmitsPendingChange() {
        assembler.accept(begin());
        assertThat(assembler.accept(insert(TWIN, "1", "{\"$dtId\":\"room1\"}"))).isEmpty();

        List<EventData> completed = assembler.accept(
            insert(EDGE, "9", "{\"$relationshipId\":\"r1\",\"$sourceId\":\"room1\",\"$targetId\":\"floor1\"}")
        );

        assertThat(completed).extracting(EventData::entityId).containsExactly("1");
        assertThat(assembler.hasPending()).isTrue();
        List<EventData> atCommit = assembler.accept(commit());
        assertThat(atCommit).extracting(EventData::eventType).containsExactly(EventType.RELATIONSHIP_CREATE);
        assertThat(assembler.hasPending()).isFalse();
    }

    @Test
    @DisplayName("Uncommitted change from a dropped session is not emitted when the transaction is replayed")
    void resetDiscardsUncommittedChange() {
        assembler.accept(begin());
        assembler.accept(insert(TWIN, "1", "{\"$dtId\":\"ghost\"}"));

        assembler.reset();
        List<EventData> replayed = transaction(
            insert(TWIN, "1", "{\"$dtId\":\"ghost\"}"),
            delete(TWIN, "1", "{\"$dtId\":\"ghost\"}")
        );

        assertThat(replayed).isEmpty();
        assertThat(assembler.hasPending()).isFalse();
    }

    @Test
    void resetKeepsKnownRelations() {
        assembler.reset();

        List<EventData> changes = transaction(insert(TWIN, "1", "{\"$dtId\":\"room1\"}"));

        assertThat(changes).extracting(EventData::eventType).containsExactly(EventType.TWIN_CREATE);
    }

    @Test
    void unclassifiedAndCatalogRowsAreSkipped() {
        List<EventData> changes = transaction(
            insert(TWIN + 10, "5", "{\"x\":1}"),
            insert(EDGE, "6", "{\"weight\":1}"),
            insert(CATALOG, "7", "{\"$dtId\":\"meta\"}")
        );

        assertThat(changes).isEmpty();
    }

    @Test
    void twinTableWithoutDtIdIsStillTwin() {
        List<EventData> changes = transaction(insert(TWIN, "1", "{\"name\":\"plain\"}"));

        assertThat(changes).extracting(EventData::eventType).containsExactly(EventType.TWIN_CREATE);
    }

    @Test
    void unchangedToastFallsBackToPreviousProperties() {
        PgOutputMessage.Update toastUpdate = new PgOutputMessage.Update(
            TWIN,
            null,
            false,
            new PgOutputMessage.TupleData(List.of(text("1"), new ColumnValue(ValueKind.UNCHANGED_TOAST, null)))
        );

        List<EventData> changes = transaction(
            insert(TWIN, "1", "{\"$dtId\":\"room1\",\"temp\":20}"),
            toastUpdate
        );

        assertThat(changes).hasSize(1);
        assertThat(changes.get(0).newValue().get("temp").asInt()).isEqualTo(20);
    }

    @Test
    void unparseablePropertiesProduceNoEvent() {
        List<EventData> changes = transaction(insert(EDGE, "1", "not json"));

        assertThat(changes).isEmpty();
    }

    private List<EventData> transaction(PgOutputMessage... messages) {
        List<EventData> out = new ArrayList<>(assembler.accept(begin()));
        for (PgOutputMessage message : messages) {
            out.addAll(assembler.accept(message));
        }
        out.addAll(assembler.accept(commit()));
        return out;
    }

    private static PgOutputMessage.Begin begin() {
        return new PgOutputMessage.Begin(LogSequenceNumber.valueOf(100L), COMMIT_TIME, 7);
    }

    private static PgOutputMessage.Commit commit() {
        return new PgOutputMessage.Commit(LogSequenceNumber.valueOf(100L), LogSequenceNumber.valueOf(120L), COMMIT_TIME);
    }

    private static PgOutputMessage.Relation relation(int id, String namespace, String name) {
        return new PgOutputMessage.Relation(id, namespace, name, 'f', List.of(
            new PgOutputMessage.Column(true, "id", 20, -1),
            new PgOutputMessage.Column(false, "properties", 7000, -1)
        ));
    }

    private static PgOutputMessage.Insert insert(int relationId, String id, String properties) {
        return new PgOutputMessage.Insert(relationId, tuple(id, properties));
    }

    private static PgOutputMessage.Update update(int relationId, String id, String before, String after) {
        return new PgOutputMessage.Update(relationId, tuple(id, before), false, tuple(id, after));
    }

    private static PgOutputMessage.Delete delete(int relationId, String id, String properties) {
        return new PgOutputMessage.Delete(relationId, tuple(id, properties), false);
    }

    private static PgOutputMessage.TupleData tuple(String id, String properties) {
        return new PgOutputMessage.TupleData(List.of(text(id), text(properties)));
    }

    private static ColumnValue text(String value) {
        return new ColumnValue(ValueKind.TEXT, value);
    }
}
