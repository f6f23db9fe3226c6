package io.twingraph.events.capture.pgoutput;

import java.time.Instant;
import java.util.List;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Logical replication messages of the pgoutput plugin (protocol version 1) that the pipeline acts on.
 */
public interface PgOutputMessage {

    record Begin(LogSequenceNumber finalLsn, Instant commitTime, int xid) implements PgOutputMessage {
    }

    record Commit(LogSequenceNumber commitLsn, LogSequenceNumber endLsn, Instant commitTime) implements PgOutputMessage {
    }

    record Relation(int relationId, String namespace, String name, char replicaIdentity, List<Column> columns)
        implements PgOutputMessage {

        public Relation {
            columns = List.copyOf(columns);
        }

        public int indexOf(String columnName) {
            for (int i = 0; i < columns.size(); i++) {
                if (columns.get(i).name().equals(columnName)) {
                    return i;
                }
            }
            return -1;
        }
    }

    record Column(boolean key, String name, int typeOid, int typeModifier) {
    }

    record Insert(int relationId, TupleData newTuple) implements PgOutputMessage {
    }

    /**
     * {@code oldTuple} is present only with REPLICA IDENTITY FULL or when the key changed.
     */
    record Update(int relationId, TupleData oldTuple, boolean oldTupleIsKeyOnly, TupleData newTuple)
        implements PgOutputMessage {
    }

    record Delete(int relationId, TupleData oldTuple, boolean oldTupleIsKeyOnly) implements PgOutputMessage {
    }

    record TupleData(List<ColumnValue> values) {

        public TupleData {
            values = List.copyOf(values);
        }

        public ColumnValue get(int index) {
            return index >= 0 && index < values.size() ? values.get(index) : ColumnValue.NULL;
        }
    }

    enum ValueKind {
        NULL,
        UNCHANGED_TOAST,
        TEXT
    }

    record ColumnValue(ValueKind kind, String text) {

        static final ColumnValue NULL = new ColumnValue(ValueKind.NULL, null);
        static final ColumnValue UNCHANGED_TOAST = new ColumnValue(ValueKind.UNCHANGED_TOAST, null);

        static ColumnValue text(String value) {
            return new ColumnValue(ValueKind.TEXT, value);
        }
    }
}
