package com.example.chunkstream.checkpoint;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Input to {@link CheckpointManager#createCheckpoint(CheckpointRequest)}.
 *
 * @param persistToDisk false to keep the checkpoint in memory only
 */
public record CheckpointRequest(
        Path filePath,
        CheckpointState state,
        Map<String, Double> metrics,
        List<Integer> processedChunks,
        CheckpointMetadata metadata,
        boolean persistToDisk
) {
    public CheckpointRequest {
        if (filePath == null || state == null) {
            throw new IllegalArgumentException("filePath and state are required.");
        }
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
        processedChunks = processedChunks == null ? List.of() : List.copyOf(processedChunks);
        metadata = metadata == null ? CheckpointMetadata.empty() : metadata;
    }

    public static CheckpointRequest of(Path filePath, CheckpointState state) {
        return new CheckpointRequest(filePath, state, Map.of(), List.of(), CheckpointMetadata.empty(), true);
    }
}
