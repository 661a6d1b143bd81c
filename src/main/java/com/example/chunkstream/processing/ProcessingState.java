package com.example.chunkstream.processing;

import java.time.Instant;

/**
 * Snapshot of the processor's run state. {@code processedChunks + failedChunks} never exceeds
 * {@code totalChunks}; {@code failedChunks} counts chunks that ran out of retries.
 */
public record ProcessingState(
        boolean processing,
        boolean paused,
        int currentChunkIndex,
        int totalChunks,
        int processedChunks,
        int failedChunks,
        Instant startTime
) {
}
