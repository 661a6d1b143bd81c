package com.example.chunkstream.checkpoint;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Storage backend for checkpoints, keyed by the normalized source file path. Retention and validation
 * live in {@link CheckpointManager}; a store only saves, lists, reads and deletes.
 */
public interface CheckpointStore {
    void save(Checkpoint checkpoint) throws IOException;

    /**
     * Checkpoint ids stored for the file, newest first.
     */
    List<String> listIds(String filePath) throws IOException;

    /**
     * @throws com.example.chunkstream.CheckpointCorruptionException when the stored data cannot be decoded
     */
    Optional<Checkpoint> read(String filePath, String id) throws IOException;

    boolean delete(String filePath, String id) throws IOException;

    void deleteAll(String filePath) throws IOException;
}
