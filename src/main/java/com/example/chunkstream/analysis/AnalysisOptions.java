package com.example.chunkstream.analysis;

import java.util.Optional;

/**
 * Per-call overrides for {@link FileAnalyzer#analyze(java.nio.file.Path, AnalysisOptions)}.
 */
public record AnalysisOptions(Optional<Integer> chunkSize) {
    public AnalysisOptions {
        chunkSize.ifPresent(size -> {
            if (size <= 0) {
                throw new IllegalArgumentException("chunkSize must be positive.");
            }
        });
    }

    public static AnalysisOptions defaults() {
        return new AnalysisOptions(Optional.empty());
    }

    public static AnalysisOptions withChunkSize(int chunkSize) {
        return new AnalysisOptions(Optional.of(chunkSize));
    }
}
