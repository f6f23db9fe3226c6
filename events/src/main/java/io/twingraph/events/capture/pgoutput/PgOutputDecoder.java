package io.twingraph.events.capture.pgoutput;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Decodes pgoutput protocol version 1 payloads. Malformed or unsupported input yields
 * {@link DecodeResult.Skipped}; it never throws.
 */
public class PgOutputDecoder {

    private static final long POSTGRES_EPOCH_SECONDS = 946_684_800L;

    public DecodeResult decode(ByteBuffer payload) {
        ByteBuffer buffer = payload.duplicate();
        if (!buffer.hasRemaining()) {
            return new DecodeResult.Skipped('?', "empty payload");
        }
        char tag = (char) buffer.get();
        try {
            return switch (tag) {
                case 'B' -> decoded(new PgOutputMessage.Begin(lsn(buffer), timestamp(buffer), buffer.getInt()));
                case 'C' -> decodeCommit(buffer);
                case 'R' -> decoded(decodeRelation(buffer));
                case 'I' -> decodeInsert(buffer);
                case 'U' -> decodeUpdate(buffer);
                case 'D' -> decodeDelete(buffer);
                case 'Y', 'O', 'T', 'M' -> new DecodeResult.Skipped(tag, "message type ignored");
                default -> new DecodeResult.Skipped(tag, "unknown message type");
            };
        } catch (BufferUnderflowException | IndexOutOfBoundsException | IllegalArgumentException e) {
            return new DecodeResult.Skipped(tag, "malformed message: " + e.getClass().getSimpleName());
        }
    }

    private static DecodeResult decoded(PgOutputMessage message) {
        return new DecodeResult.Decoded(message);
    }

    private DecodeResult decodeCommit(ByteBuffer buffer) {
        buffer.get(); // flags
        LogSequenceNumber commitLsn = lsn(buffer);
        LogSequenceNumber endLsn = lsn(buffer);
        return decoded(new PgOutputMessage.Commit(commitLsn, endLsn, timestamp(buffer)));
    }

    private PgOutputMessage.Relation decodeRelation(ByteBuffer buffer) {
        int relationId = buffer.getInt();
        String namespace = string(buffer);
        String name = string(buffer);
        char replicaIdentity = (char) buffer.get();
        int columnCount = buffer.getShort();
        if (columnCount < 0) {
            throw new IllegalArgumentException("negative column count");
        }
        List<PgOutputMessage.Column> columns = new ArrayList<>(columnCount);
        for (int i = 0; i < columnCount; i++) {
            boolean key = (buffer.get() & 1) == 1;
            String columnName = string(buffer);
            int typeOid = buffer.getInt();
            int typeModifier = buffer.getInt();
            columns.add(new PgOutputMessage.Column(key, columnName, typeOid, typeModifier));
        }
        // pgoutput sends an empty namespace for pg_catalog
        return new PgOutputMessage.Relation(
            relationId,
            namespace.isEmpty() ? "pg_catalog" : namespace,
            name,
            replicaIdentity,
            columns
        );
    }

    private DecodeResult decodeInsert(ByteBuffer buffer) {
        int relationId = buffer.getInt();
        char marker = (char) buffer.get();
        if (marker != 'N') {
            return new DecodeResult.Skipped('I', "expected new tuple marker, got " + marker);
        }
        return decoded(new PgOutputMessage.Insert(relationId, tuple(buffer)));
    }

    private DecodeResult decodeUpdate(ByteBuffer buffer) {
        int relationId = buffer.getInt();
        char marker = (char) buffer.get();
        PgOutputMessage.TupleData oldTuple = null;
        boolean keyOnly = false;
        if (marker == 'K' || marker == 'O') {
            keyOnly = marker == 'K';
            oldTuple = tuple(buffer);
            marker = (char) buffer.get();
        }
        if (marker != 'N') {
            return new DecodeResult.Skipped('U', "expected new tuple marker, got " + marker);
        }
        return decoded(new PgOutputMessage.Update(relationId, oldTuple, keyOnly, tuple(buffer)));
    }

    private DecodeResult decodeDelete(ByteBuffer buffer) {
        int relationId = buffer.getInt();
        char marker = (char) buffer.get();
        if (marker != 'K' && marker != 'O') {
            return new DecodeResult.Skipped('D', "expected old tuple marker, got " + marker);
        }
        return decoded(new PgOutputMessage.Delete(relationId, tuple(buffer), marker == 'K'));
    }

    private PgOutputMessage.TupleData tuple(ByteBuffer buffer) {
        int count = buffer.getShort();
        if (count < 0) {
            throw new IllegalArgumentException("negative tuple column count");
        }
        List<PgOutputMessage.ColumnValue> values = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            char kind = (char) buffer.get();
            switch (kind) {
                case 'n' -> values.add(PgOutputMessage.ColumnValue.NULL);
                case 'u' -> values.add(PgOutputMessage.ColumnValue.UNCHANGED_TOAST);
                case 't' -> {
                    int length = buffer.getInt();
                    if (length < 0 || length > buffer.remaining()) {
                        throw new IllegalArgumentException("invalid column length " + length);
                    }
                    byte[] bytes = new byte[length];
                    buffer.get(bytes);
                    values.add(PgOutputMessage.ColumnValue.text(new String(bytes, StandardCharsets.UTF_8)));
                }
                default -> throw new IllegalArgumentException("unknown tuple value kind " + kind);
            }
        }
        return new PgOutputMessage.TupleData(values);
    }

    private static LogSequenceNumber lsn(ByteBuffer buffer) {
        return LogSequenceNumber.valueOf(buffer.getLong());
    }

    private static Instant timestamp(ByteBuffer buffer) {
        long micros = buffer.getLong();
        return Instant.ofEpochSecond(POSTGRES_EPOCH_SECONDS, 0)
            .plusSeconds(Math.floorDiv(micros, 1_000_000L))
            .plusNanos(Math.floorMod(micros, 1_000_000L) * 1_000L);
    }

    private static String string(ByteBuffer buffer) {
        int start = buffer.position();
        int end = start;
        while (buffer.get(end) != 0) {
            end++;
        }
        byte[] bytes = new byte[end - start];
        buffer.get(bytes);
        buffer.get(); // terminator
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
