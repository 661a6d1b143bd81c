package com.example.chunkstream.analysis;

import java.util.List;

public record ChunkStatistics(
        int totalChunks,
        long averageChunkSize,
        int largestChunk,
        int smallestChunk,
        double totalComplexity
) {
    public static ChunkStatistics of(List<Chunk> chunks, long totalLines) {
        if (chunks.isEmpty()) {
            return new ChunkStatistics(0, 0, 0, 0, 0);
        }
        int largest = Integer.MIN_VALUE;
        int smallest = Integer.MAX_VALUE;
        double complexity = 0;
        for (Chunk chunk : chunks) {
            largest = Math.max(largest, chunk.lineCount());
            smallest = Math.min(smallest, chunk.lineCount());
            complexity += chunk.metadata().complexity();
        }
        long average = Math.round((double) totalLines / chunks.size());
        return new ChunkStatistics(chunks.size(), average, largest, smallest, Math.round(complexity * 10) / 10.0);
    }
}
