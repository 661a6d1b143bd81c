package com.example.chunkstream.checkpoint;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Persisted progress snapshot for one source file. The checksum covers every other component.
 */
public record Checkpoint(
        String id,
        String version,
        Instant timestamp,
        String filePath,
        CheckpointState state,
        Map<String, Double> metrics,
        List<Integer> processedChunks,
        CheckpointMetadata metadata,
        String checksum
) {
    public static final String CURRENT_VERSION = "1.0";

    public Checkpoint {
        metrics = metrics == null ? null : Map.copyOf(metrics);
        processedChunks = processedChunks == null ? null : List.copyOf(processedChunks);
    }

    public Checkpoint withChecksum(String value) {
        return new Checkpoint(id, version, timestamp, filePath, state, metrics, processedChunks, metadata, value);
    }

    public Path sourcePath() {
        return Path.of(filePath);
    }
}
