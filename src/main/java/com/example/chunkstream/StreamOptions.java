package com.example.chunkstream;

/**
 * Per-call options for {@link ChunkedFileStreamer#stream(java.nio.file.Path, StreamOptions)}.
 *
 * @param resumeFromCheckpoint continue from the latest valid checkpoint of the file, if there is one
 */
public record StreamOptions(boolean resumeFromCheckpoint) {
    public static StreamOptions from(StreamingConfig config) {
        return new StreamOptions(config.resumeFromCheckpoint());
    }

    public static StreamOptions fresh() {
        return new StreamOptions(false);
    }

    public static StreamOptions resuming() {
        return new StreamOptions(true);
    }
}
