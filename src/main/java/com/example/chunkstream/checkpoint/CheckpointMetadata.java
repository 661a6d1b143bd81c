package com.example.chunkstream.checkpoint;

public record CheckpointMetadata(
        int chunksSuccessful,
        int chunksFailed,
        double averageChunkTimeMs,
        String lastError
) {
    public static CheckpointMetadata empty() {
        return new CheckpointMetadata(0, 0, 0, null);
    }
}
