package io.twingraph.events.checkpoint;

import java.util.Optional;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Last WAL position whose changes were fully handed to the event queue, per replication slot.
 */
public interface CheckpointStore extends AutoCloseable {

    Optional<LogSequenceNumber> loadCheckpoint(String slotName);

    void saveCheckpoint(String slotName, LogSequenceNumber lsn);

    @Override
    default void close() {
    }
}
