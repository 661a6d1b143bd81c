package com.example.chunkstream;

import java.time.Duration;

/**
 * A chunk attempt did not finish within the configured chunk timeout. Recoverable: drives a retry.
 */
public class ChunkTimeoutException extends StreamingException {

    private final int chunkIndex;
    private final Duration timeout;

    public ChunkTimeoutException(int chunkIndex, Duration timeout) {
        super("Chunk " + chunkIndex + " processing timeout after " + timeout.toMillis() + "ms");
        this.chunkIndex = chunkIndex;
        this.timeout = timeout;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
