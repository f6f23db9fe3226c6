package io.twingraph.events.checkpoint;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;
import org.postgresql.replication.LogSequenceNumber;

/**
 * Keeps the checkpoint in a local text file of {@code slot=lsn}.
 */
public class FileCheckpointStore implements CheckpointStore {

    private final Path checkpointFilePath;

    public FileCheckpointStore(Path checkpointFilePath) {
        this.checkpointFilePath = checkpointFilePath;
    }

    @Override
    public synchronized Optional<LogSequenceNumber> loadCheckpoint(String slotName) {
        if (!Files.exists(checkpointFilePath)) {
            return Optional.empty();
        }
        try {
            String value = Files.readString(checkpointFilePath, StandardCharsets.UTF_8).trim();
            if (value.isEmpty()) {
                return Optional.empty();
            }
            int separator = value.indexOf('=');
            if (separator <= 0 || !value.substring(0, separator).equals(slotName)) {
                return Optional.empty();
            }
            LogSequenceNumber lsn = LogSequenceNumber.valueOf(value.substring(separator + 1).trim());
            if (LogSequenceNumber.INVALID_LSN.equals(lsn)) {
                throw new IllegalStateException("Invalid LSN in checkpoint file: " + checkpointFilePath);
            }
            return Optional.of(lsn);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read checkpoint file: " + checkpointFilePath, e);
        }
    }

    @Override
    public synchronized void saveCheckpoint(String slotName, LogSequenceNumber lsn) {
        try {
            Path parent = checkpointFilePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path temp = checkpointFilePath.resolveSibling(checkpointFilePath.getFileName() + ".tmp");
            Files.writeString(temp, slotName + "=" + lsn.asString(), StandardCharsets.UTF_8);
            Files.move(temp, checkpointFilePath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to persist checkpoint file: " + checkpointFilePath, e);
        }
    }
}
