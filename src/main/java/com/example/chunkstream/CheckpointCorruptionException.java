package com.example.chunkstream;

/**
 * A stored checkpoint failed validation (unparseable, missing field, checksum mismatch or stale).
 * Never fatal: loaders skip the candidate and move on.
 */
public class CheckpointCorruptionException extends StreamingException {

    private final String checkpointId;

    public CheckpointCorruptionException(String checkpointId, String message) {
        super("Checkpoint " + checkpointId + " rejected: " + message);
        this.checkpointId = checkpointId;
    }

    public CheckpointCorruptionException(String checkpointId, String message, Throwable cause) {
        super("Checkpoint " + checkpointId + " rejected: " + message, cause);
        this.checkpointId = checkpointId;
    }

    public String getCheckpointId() {
        return checkpointId;
    }
}
