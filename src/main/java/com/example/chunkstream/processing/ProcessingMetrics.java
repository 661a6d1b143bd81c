package com.example.chunkstream.processing;

import java.time.Duration;

/**
 * Attempt-level counters: {@code chunksFailed} counts failed attempts, including ones later retried.
 */
public record ProcessingMetrics(
        long chunksProcessed,
        long chunksSuccessful,
        long chunksFailed,
        long chunksRetried,
        long linesSent,
        long linesFailed,
        double successRate,
        double failureRate,
        double retryRate,
        Duration averageChunkTime,
        Duration totalChunkTime,
        int maxConcurrentReached
) {
}
