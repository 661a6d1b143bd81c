package com.example.chunkstream;

/**
 * Aggregates the line failures of one chunk attempt. Recoverable up to the retry limit.
 */
public class ChunkExecutionException extends StreamingException {

    private final int chunkIndex;
    private final int failedLines;
    private final int totalLines;

    public ChunkExecutionException(int chunkIndex, int failedLines, int totalLines, String firstError) {
        super(String.format("Chunk %d failed: %d of %d lines failed (first error: %s)",
                chunkIndex, failedLines, totalLines, firstError));
        this.chunkIndex = chunkIndex;
        this.failedLines = failedLines;
        this.totalLines = totalLines;
    }

    public ChunkExecutionException(int chunkIndex, String message, Throwable cause) {
        super("Chunk " + chunkIndex + " failed: " + message, cause);
        this.chunkIndex = chunkIndex;
        this.failedLines = 0;
        this.totalLines = 0;
    }

    public int getChunkIndex() {
        return chunkIndex;
    }

    public int getFailedLines() {
        return failedLines;
    }

    public int getTotalLines() {
        return totalLines;
    }
}
