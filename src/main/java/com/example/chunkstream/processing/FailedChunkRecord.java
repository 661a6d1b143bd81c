package com.example.chunkstream.processing;

import java.time.Instant;
import java.util.List;

/**
 * Failure history of one chunk. {@code permanent} is set once the chunk ran out of retries.
 */
public class FailedChunkRecord {
    private final int chunkIndex;
    private final int failedAttempts;
    private final int maxRetries;
    private final Instant lastAttemptTime;
    private final String lastError;
    private final boolean permanent;
    private final List<RetryAttempt> attempts;

    public FailedChunkRecord(int chunkIndex,
                             int failedAttempts,
                             int maxRetries,
                             Instant lastAttemptTime,
                             String lastError,
                             boolean permanent,
                             List<RetryAttempt> attempts) {
        this.chunkIndex = chunkIndex;
        this.failedAttempts = failedAttempts;
        this.maxRetries = maxRetries;
        this.lastAttemptTime = lastAttemptTime;
        this.lastError = lastError;
        this.permanent = permanent;
        this.attempts = List.copyOf(attempts);
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getFailedAttempts() {
        return failedAttempts;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public Instant getLastAttemptTime() {
        return lastAttemptTime;
    }

    public String getLastError() {
        return lastError;
    }

    public boolean isPermanent() {
        return permanent;
    }

    public List<RetryAttempt> getAttempts() {
        return attempts;
    }
}
