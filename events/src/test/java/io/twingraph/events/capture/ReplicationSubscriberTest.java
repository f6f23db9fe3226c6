package io.twingraph.events.capture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.twingraph.events.checkpoint.CheckpointStore;
import io.twingraph.events.checkpoint.SlotCheckpointStore;
import io.twingraph.events.config.EventsProperties;
import io.twingraph.events.model.EventData;
import io.twingraph.events.model.EventType;
import io.twingraph.events.queue.BoundedEventQueue;
import io.twingraph.events.queue.EventQueue;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.sql.SQLException;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.stubbing.OngoingStubbing;
import org.postgresql.replication.LogSequenceNumber;
import org.postgresql.replication.PGReplicationStream;

class ReplicationSubscriberTest {

    private static final int TWIN_RELATION = 16400;

    @Test
    @DisplayName("isConnectionError: IO failures, 08xxx states and closed-connection messages")
    void isConnectionError() {
        assertThat(ReplicationSubscriber.isConnectionError(new SQLException("wrapped", new EOFException()))).isTrue();
        assertThat(ReplicationSubscriber.isConnectionError(new SQLException("lost", "08006"))).isTrue();
        assertThat(ReplicationSubscriber.isConnectionError(new SQLException("This connection has been closed."))).isTrue();
        assertThat(ReplicationSubscriber.isConnectionError(new IllegalStateException("Connection reset by peer"))).isTrue();

        assertThat(ReplicationSubscriber.isConnectionError(new SQLException("syntax error", "42601"))).isFalse();
        assertThat(ReplicationSubscriber.isConnectionError(new IllegalArgumentException("bad input"))).isFalse();
    }

    @Test
    @DisplayName("isSlotInvalidated: recognizes invalidated slots anywhere in the cause chain")
    void isSlotInvalidated() {
        assertThat(ReplicationSubscriber.isSlotInvalidated(
            new SQLException("ERROR: can no longer get changes from replication slot \"age_slot\"")
        )).isTrue();
        assertThat(ReplicationSubscriber.isSlotInvalidated(
            new IllegalStateException("stream failed", new SQLException("replication slot \"age_slot\" was invalidated"))
        )).isTrue();

        assertThat(ReplicationSubscriber.isSlotInvalidated(new SQLException("replication slot \"age_slot\" is active"))).isFalse();
        assertThat(ReplicationSubscriber.isSlotInvalidated(new SQLException((String) null))).isFalse();
    }

    @Test
    @DisplayName("handleFailure: watchdog timeouts and connection errors wait before reconnecting")
    void handleFailure_waitsBeforeReconnect() {
        ReplicationSubscriber subscriber = subscriber(config("jdbc:postgresql://localhost:5432/graph"));

        assertThat(subscriber.handleFailure(new ReplicationSubscriber.ReplicationTimeoutException("idle for 30 s"))).isFalse();
        assertThat(subscriber.handleFailure(new SQLException("lost", "08006"))).isFalse();
        assertThat(subscriber.handleFailure(new IllegalStateException("unexpected"))).isFalse();
    }

    @Test
    @DisplayName("new subscriber reports its slot and is not healthy before streaming")
    void initialState() {
        ReplicationSubscriber subscriber = subscriber(config("jdbc:postgresql://localhost:5432/graph"));

        assertThat(subscriber.slotName()).isEqualTo("age_slot");
        assertThat(subscriber.publication()).isEqualTo("age_pub");
        assertThat(subscriber.isHealthy()).isFalse();
        assertThat(subscriber.lastFlushedLsn()).isNull();
    }

    @Test
    @DisplayName("constructor: jdbc url is required")
    void constructor_requiresJdbcUrl() {
        assertThatThrownBy(() -> subscriber(config(" ")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("jdbc-url");
    }

    @Test
    @DisplayName("consume: committed changes are enqueued before the commit position is confirmed")
    void consume_enqueuesBeforeConfirming() throws Exception {
        EventQueue queue = mock(EventQueue.class);
        CheckpointStore checkpointStore = mock(CheckpointStore.class);
        ReplicationSubscriber subscriber = streamingSubscriber(queue, checkpointStore, 100);
        PGReplicationStream stream = stream(subscriber,
            relation(),
            begin(),
            insert("1", "{\"$dtId\":\"room1\"}"),
            commit(200L)
        );

        subscriber.consume(stream);

        LogSequenceNumber commitLsn = LogSequenceNumber.valueOf(200L);
        InOrder order = inOrder(queue, stream, checkpointStore);
        order.verify(queue).putAll(anyList());
        order.verify(stream).setAppliedLSN(commitLsn);
        order.verify(stream).setFlushedLSN(commitLsn);
        order.verify(stream).forceUpdateStatus();
        order.verify(checkpointStore).saveCheckpoint("age_slot", commitLsn);
        assertThat(subscriber.lastFlushedLsn()).isEqualTo(commitLsn);
    }

    @Test
    @DisplayName("consume: a full batch is flushed mid-transaction without confirming a position")
    @SuppressWarnings("unchecked")
    void consume_flushesAtMaxBatchSize() throws Exception {
        EventQueue queue = mock(EventQueue.class);
        CheckpointStore checkpointStore = mock(CheckpointStore.class);
        ReplicationSubscriber subscriber = streamingSubscriber(queue, checkpointStore, 2);
        PGReplicationStream stream = stream(subscriber,
            relation(),
            begin(),
            insert("1", "{\"$dtId\":\"room1\"}"),
            insert("2", "{\"$dtId\":\"room2\"}"),
            insert("3", "{\"$dtId\":\"room3\"}"),
            commit(300L)
        );

        subscriber.consume(stream);

        ArgumentCaptor<List<EventData>> batches = ArgumentCaptor.forClass(List.class);
        InOrder order = inOrder(queue, stream);
        order.verify(queue).putAll(batches.capture());
        order.verify(queue).putAll(batches.capture());
        order.verify(stream).setFlushedLSN(LogSequenceNumber.valueOf(300L));
        assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 1);
        assertThat(batches.getAllValues().get(0)).extracting(EventData::eventType)
            .containsExactly(EventType.TWIN_CREATE, EventType.TWIN_CREATE);
        verify(stream, times(1)).setFlushedLSN(any(LogSequenceNumber.class));
        verify(checkpointStore, times(1)).saveCheckpoint(anyString(), any(LogSequenceNumber.class));
    }

    @Test
    @DisplayName("consume: without a commit nothing is confirmed")
    void consume_noCommitNoConfirmation() throws Exception {
        EventQueue queue = mock(EventQueue.class);
        CheckpointStore checkpointStore = mock(CheckpointStore.class);
        ReplicationSubscriber subscriber = streamingSubscriber(queue, checkpointStore, 100);
        PGReplicationStream stream = stream(subscriber,
            relation(),
            begin(),
            insert("1", "{\"$dtId\":\"room1\"}"),
            insert("2", "{\"$dtId\":\"room2\"}")
        );

        subscriber.consume(stream);

        verify(queue).putAll(anyList());
        verify(stream, never()).setAppliedLSN(any(LogSequenceNumber.class));
        verify(stream, never()).setFlushedLSN(any(LogSequenceNumber.class));
        verify(checkpointStore, never()).saveCheckpoint(anyString(), any(LogSequenceNumber.class));
        assertThat(subscriber.lastFlushedLsn()).isNull();
    }

    @Test
    @DisplayName("consume: a new session does not emit the unfinished transaction of a dropped one")
    void consume_newSessionDiscardsUnfinishedTransaction() throws Exception {
        EventQueue queue = mock(EventQueue.class);
        CheckpointStore checkpointStore = mock(CheckpointStore.class);
        ReplicationSubscriber subscriber = streamingSubscriber(queue, checkpointStore, 100);
        PGReplicationStream dropped = mock(PGReplicationStream.class);
        when(dropped.getLastReceiveLSN()).thenReturn(LogSequenceNumber.valueOf(1L));
        when(dropped.readPending())
            .thenReturn(relation(), begin(), insert("1", "{\"$dtId\":\"ghost\"}"))
            .thenThrow(new SQLException("connection lost", "08006"));

        assertThatThrownBy(() -> subscriber.consume(dropped)).isInstanceOf(SQLException.class);

        PGReplicationStream replay = stream(subscriber,
            relation(),
            begin(),
            insert("1", "{\"$dtId\":\"ghost\"}"),
            delete("1", "{\"$dtId\":\"ghost\"}"),
            commit(400L)
        );
        subscriber.consume(replay);

        verify(queue, never()).putAll(anyList());
        verify(replay).setFlushedLSN(LogSequenceNumber.valueOf(400L));
    }

    private static EventsProperties.Replication config(String jdbcUrl) {
        EventsProperties.Replication config = new EventsProperties.Replication();
        config.setJdbcUrl(jdbcUrl);
        config.setReconnectDelayMs(10L);
        return config;
    }

    private static ReplicationSubscriber subscriber(EventsProperties.Replication config) {
        return new ReplicationSubscriber(
            config,
            new BoundedEventQueue(10),
            new SlotCheckpointStore(),
            new ChangeAssembler(new ObjectMapper())
        );
    }

    private static ReplicationSubscriber streamingSubscriber(EventQueue queue, CheckpointStore checkpointStore, int maxBatchSize) {
        EventsProperties.Replication config = config("jdbc:postgresql://localhost:5432/graph");
        config.setMaxBatchSize(maxBatchSize);
        config.setFlushIntervalMs(60_000L);
        return new ReplicationSubscriber(config, queue, checkpointStore, new ChangeAssembler(new ObjectMapper()));
    }

    /**
     * Serves the payloads in order, then stops the subscriber on the next read.
     */
    private static PGReplicationStream stream(ReplicationSubscriber subscriber, ByteBuffer... payloads) throws SQLException {
        PGReplicationStream stream = mock(PGReplicationStream.class);
        when(stream.getLastReceiveLSN()).thenReturn(LogSequenceNumber.valueOf(1L));
        OngoingStubbing<ByteBuffer> reads = when(stream.readPending());
        for (ByteBuffer payload : payloads) {
            reads = reads.thenReturn(payload);
        }
        reads.thenAnswer(invocation -> {
            subscriber.halt();
            return null;
        });
        return stream;
    }

    private static ByteBuffer relation() throws IOException {
        return new Bytes().tag('R').int32(TWIN_RELATION).cstring("digitaltwins").cstring("Twin").int8('f').int16(2)
            .int8(1).cstring("id").int32(20).int32(-1)
            .int8(0).cstring("properties").int32(7000).int32(-1)
            .buffer();
    }

    private static ByteBuffer begin() throws IOException {
        return new Bytes().tag('B').int64(100L).int64(0L).int32(7).buffer();
    }

    private static ByteBuffer insert(String id, String properties) throws IOException {
        return new Bytes().tag('I').int32(TWIN_RELATION).int8('N').int16(2)
            .int8('t').text(id)
            .int8('t').text(properties)
            .buffer();
    }

    private static ByteBuffer delete(String id, String properties) throws IOException {
        return new Bytes().tag('D').int32(TWIN_RELATION).int8('O').int16(2)
            .int8('t').text(id)
            .int8('t').text(properties)
            .buffer();
    }

    private static ByteBuffer commit(long endLsn) throws IOException {
        return new Bytes().tag('C').int8(0).int64(endLsn - 10).int64(endLsn).int64(0L).buffer();
    }

    private static final class Bytes {
        private final ByteArrayOutputStream out = new ByteArrayOutputStream();
        private final DataOutputStream data = new DataOutputStream(out);

        Bytes tag(char tag) throws IOException {
            data.writeByte(tag);
            return this;
        }

        Bytes int8(int value) throws IOException {
            data.writeByte(value);
            return this;
        }

        Bytes int16(int value) throws IOException {
            data.writeShort(value);
            return this;
        }

        Bytes int32(int value) throws IOException {
            data.writeInt(value);
            return this;
        }

        Bytes int64(long value) throws IOException {
            data.writeLong(value);
            return this;
        }

        Bytes cstring(String value) throws IOException {
            data.write(value.getBytes(StandardCharsets.UTF_8));
            data.writeByte(0);
            return this;
        }

        Bytes text(String value) throws IOException {
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            data.writeInt(bytes.length);
            data.write(bytes);
            return this;
        }

        ByteBuffer buffer() throws IOException {
            data.flush();
            return ByteBuffer.wrap(out.toByteArray());
        }
    }
}
