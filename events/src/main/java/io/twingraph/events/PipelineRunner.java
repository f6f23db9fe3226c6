package io.twingraph.events;

import io.twingraph.events.capture.ReplicationSubscriber;
import io.twingraph.events.checkpoint.CheckpointStore;
import io.twingraph.events.consumer.SharedEventConsumer;
import io.twingraph.events.consumer.SinkDispatchLane;
import io.twingraph.events.config.EventsProperties;
import io.twingraph.events.telemetry.TelemetryListener;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;

/**
 * Starts the long-running pipeline tasks and stops them producer first so queued changes drain
 * before the sinks close.
 */
@Component
public class PipelineRunner implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(PipelineRunner.class);

    private final ApplicationContext applicationContext;
    private final ThreadPoolTaskExecutor executor;
    private final SharedEventConsumer consumer;
    private final ReplicationSubscriber subscriber;
    private final TelemetryListener telemetryListener;
    private final Map<String, SinkDispatchLane> lanes;
    private final CheckpointStore checkpointStore;
    private final Duration shutdownTimeout;
    private final AtomicBoolean exiting = new AtomicBoolean();
    private volatile boolean running;

    public PipelineRunner(
        ApplicationContext applicationContext,
        @Qualifier("pipelineExecutor") ThreadPoolTaskExecutor executor,
        SharedEventConsumer consumer,
        ObjectProvider<ReplicationSubscriber> subscriber,
        ObjectProvider<TelemetryListener> telemetryListener,
        Map<String, SinkDispatchLane> sinkDispatchLanes,
        CheckpointStore checkpointStore,
        EventsProperties properties
    ) {
        this.applicationContext = applicationContext;
        this.executor = executor;
        this.consumer = consumer;
        this.subscriber = subscriber.getIfAvailable();
        this.telemetryListener = telemetryListener.getIfAvailable();
        this.lanes = sinkDispatchLanes;
        this.checkpointStore = checkpointStore;
        this.shutdownTimeout = Duration.ofMillis(properties.getShutdownTimeoutMs());
    }

    @Override
    public void start() {
        running = true;
        launch("consumer", consumer::run);
        if (telemetryListener != null) {
            launch("telemetry listener", telemetryListener::run);
        }
        if (subscriber != null) {
            launch("replication subscriber", subscriber::run);
        } else {
            log.info("Replication is disabled; only telemetry notifications will be processed");
        }
        log.info("Event pipeline started. sinks={}", lanes.keySet());
    }

    private void launch(String name, Runnable task) {
        executor.execute(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Pipeline task '{}' failed", name, e);
            } finally {
                if (running) {
                    log.error("Pipeline task '{}' exited unexpectedly; shutting down", name);
                    exit();
                }
            }
        });
    }

    void exit() {
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        Thread exiter = new Thread(() -> System.exit(SpringApplication.exit(applicationContext, () -> 1)), "pipeline-exit");
        exiter.start();
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping event pipeline (timeout={} ms)", shutdownTimeout.toMillis());
        if (subscriber != null) {
            subscriber.stop(shutdownTimeout);
        }
        if (telemetryListener != null) {
            telemetryListener.stop(shutdownTimeout);
        }
        consumer.stop(shutdownTimeout);
        for (SinkDispatchLane lane : lanes.values()) {
            lane.shutdown(shutdownTimeout);
        }
        for (SinkDispatchLane lane : lanes.values()) {
            try {
                lane.sink().close();
            } catch (Exception e) {
                log.warn("Failed to close sink '{}'", lane.sinkName(), e);
            }
        }
        try {
            checkpointStore.close();
        } catch (Exception e) {
            log.warn("Failed to close checkpoint store", e);
        }
        log.info("Event pipeline stopped. processed={}", consumer.processedCount());
    }

    @Override
    public boolean isRunning() {
        return running;
    }
}
