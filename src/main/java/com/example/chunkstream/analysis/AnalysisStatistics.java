package com.example.chunkstream.analysis;

import java.time.Duration;

public record AnalysisStatistics(
        long totalFiles,
        long totalLines,
        long totalBytes,
        Duration totalAnalysisTime,
        Duration averageAnalysisTime,
        long averageLinesPerFile,
        long averageBytesPerFile
) {
}
