package com.example.chunkstream.checkpoint;

import java.time.Instant;

/**
 * Progress snapshot stored inside a {@link Checkpoint}. {@code currentChunk} is the index of the next
 * chunk to process and {@code currentLine} the number of kept lines already completed.
 */
public record CheckpointState(
        long currentChunk,
        long totalChunks,
        long currentLine,
        long totalLines,
        long bytesProcessed,
        long totalBytes,
        Instant startTime,
        Instant pauseTime
) {
}
