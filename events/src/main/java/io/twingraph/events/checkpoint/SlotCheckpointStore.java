package io.twingraph.events.checkpoint;

import java.util.Optional;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Relies on the slot's confirmed_flush_lsn alone; the server resumes from it when no start position is given.
 */
public class SlotCheckpointStore implements CheckpointStore {

    @Override
    public Optional<LogSequenceNumber> loadCheckpoint(String slotName) {
        return Optional.empty();
    }

    @Override
    public void saveCheckpoint(String slotName, LogSequenceNumber lsn) {
        // confirmed through the replication stream's flushed LSN
    }
}
