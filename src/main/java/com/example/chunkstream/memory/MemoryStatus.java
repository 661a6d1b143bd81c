package com.example.chunkstream.memory;

public record MemoryStatus(
        long current,
        long peak,
        long baseline,
        double percentage,
        long limit,
        long available,
        MemoryPressure pressure,
        int trackedChunks,
        boolean monitoring
) {
}
