package com.example.chunkstream.processing;

import java.time.Instant;

/**
 * One failed attempt at a chunk.
 */
public class RetryAttempt {
    private final int chunkIndex;
    private final int attempt;
    private final Instant timestamp;
    private final String error;

    public RetryAttempt(int chunkIndex, int attempt, Instant timestamp, String error) {
        this.chunkIndex = chunkIndex;
        this.attempt = attempt;
        this.timestamp = timestamp;
        this.error = error;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getAttempt() {
        return attempt;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getError() {
        return error;
    }
}
