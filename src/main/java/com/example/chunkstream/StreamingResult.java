package com.example.chunkstream;

import com.example.chunkstream.processing.ProcessingSummary;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome of one {@link ChunkedFileStreamer#stream(Path, StreamOptions)} call.
 *
 * @param startChunk         index processing started from, non-zero when resumed
 * @param resumedFrom        id of the checkpoint the run resumed from
 * @param finalCheckpointId  id of the checkpoint written when the run ended
 */
public record StreamingResult(
        Path filePath,
        int startChunk,
        Optional<String> resumedFrom,
        Optional<String> finalCheckpointId,
        ProcessingSummary summary
) {
    public boolean completed() {
        return !summary.stopped() && summary.failedChunks() == 0;
    }
}
