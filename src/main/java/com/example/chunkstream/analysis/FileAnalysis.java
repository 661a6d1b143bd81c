package com.example.chunkstream.analysis;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

public record FileAnalysis(
        Path filePath,
        long fileSize,
        Instant fileModified,
        long totalLines,
        long totalBytes,
        List<Chunk> chunks,
        ProgramMetadata metadata,
        ChunkStatistics chunkStatistics,
        Duration analysisTime
) {
    public FileAnalysis {
        chunks = List.copyOf(chunks);
    }
}
