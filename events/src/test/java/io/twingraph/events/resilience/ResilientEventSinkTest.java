package io.twingraph.events.resilience;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.twingraph.events.metrics.PipelineMetrics;
import io.twingraph.events.model.DomainEvent;
import io.twingraph.events.model.SinkEventType;
import io.twingraph.events.sink.EventSink;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ResilientEventSinkTest {

    @Mock
    private EventSink delegate;

    @Mock
    private DeadLetterStore deadLetterStore;

    private SimpleMeterRegistry meterRegistry;
    private ResilientEventSink sink;

    @BeforeEach
    void setUp() {
        when(delegate.getName()).thenReturn("hook");
        meterRegistry = new SimpleMeterRegistry();
        sink = new ResilientEventSink(
            delegate,
            new ResilientEventSink.RetrySettings(3, Duration.ofMillis(1), Duration.ofMillis(2), 2.0),
            deadLetterStore,
            new PipelineMetrics(meterRegistry)
        );
    }

    @Test
    void successfulSendIsDeliveredOnce() throws Exception {
        List<DomainEvent> events = List.of(event("1"), event("2"));
        when(delegate.isHealthy()).thenReturn(true);

        sink.send(events);

        verify(delegate, times(1)).send(events);
        verify(deadLetterStore, never()).save(any(), any(), any(), anyInt());
        assertThat(sink.isHealthy()).isTrue();
        assertThat(meterRegistry.get("events.sink.delivered").tag("sink", "hook").counter().count()).isEqualTo(2.0);
    }

    @Test
    void transientFailureIsRetried() throws Exception {
        List<DomainEvent> events = List.of(event("1"));
        doThrow(new IOException("connection reset")).doNothing().when(delegate).send(events);
        when(delegate.isHealthy()).thenReturn(true);

        sink.send(events);

        verify(delegate, times(2)).send(events);
        verify(deadLetterStore, never()).save(any(), any(), any(), anyInt());
        assertThat(sink.isHealthy()).isTrue();
    }

    @Test
    @DisplayName("Exhausted retries write one dead letter record per event with the attempt count")
    void exhaustedRetriesDeadLetterEveryEvent() throws Exception {
        List<DomainEvent> events = List.of(event("1"), event("2"));
        IOException failure = new IOException("503 from endpoint");
        doThrow(failure).when(delegate).send(anyList());

        sink.send(events);

        verify(delegate, times(3)).send(events);
        ArgumentCaptor<DomainEvent> captor = ArgumentCaptor.forClass(DomainEvent.class);
        verify(deadLetterStore, times(2)).save(captor.capture(), eq("hook"), eq(failure), eq(3));
        assertThat(captor.getAllValues()).extracting(DomainEvent::id).containsExactly("1", "2");
        assertThat(sink.isHealthy()).isFalse();
        assertThat(meterRegistry.get("events.sink.failures").tag("sink", "hook").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("events.sink.dead_lettered").tag("sink", "hook").counter().count()).isEqualTo(2.0);
    }

    @Test
    void deadLetterWriteFailureDoesNotEscape() throws Exception {
        List<DomainEvent> events = List.of(event("1"), event("2"));
        doThrow(new IOException("down")).when(delegate).send(anyList());
        doThrow(new IllegalStateException("db down")).doNothing()
            .when(deadLetterStore).save(any(), eq("hook"), any(), eq(3));

        sink.send(events);

        verify(deadLetterStore, times(2)).save(any(), eq("hook"), any(), eq(3));
        assertThat(meterRegistry.get("events.sink.dead_lettered").tag("sink", "hook").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recoversHealthAfterNextSuccess() throws Exception {
        List<DomainEvent> failing = List.of(event("1"));
        List<DomainEvent> passing = List.of(event("2"));
        doThrow(new IOException("down")).when(delegate).send(failing);
        doNothing().when(delegate).send(passing);
        when(delegate.isHealthy()).thenReturn(true);

        sink.send(failing);
        assertThat(sink.isHealthy()).isFalse();

        sink.send(passing);
        assertThat(sink.isHealthy()).isTrue();
    }

    private static DomainEvent event(String id) {
        return new DomainEvent(
            id,
            "http://twins.example",
            "Konnektr.DigitalTwins.Twin.Create",
            "room" + id,
            Instant.EPOCH,
            DomainEvent.JSON_CONTENT_TYPE,
            null,
            JsonNodeFactory.instance.objectNode().put("$dtId", "room" + id),
            SinkEventType.TWIN_CREATE
        );
    }
}
