package com.example.chunkstream.processing;

public record ProcessingStatus(
        boolean processing,
        boolean paused,
        int currentChunk,
        int totalChunks,
        int processedChunks,
        int failedChunks,
        int activeChunks,
        int queuedChunks,
        int retryQueueSize,
        double progress
) {
}
