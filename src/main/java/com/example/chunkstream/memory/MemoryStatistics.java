package com.example.chunkstream.memory;

import java.time.Instant;
import java.util.Optional;

public record MemoryStatistics(
        long currentUsage,
        long peakUsage,
        long baselineUsage,
        double averageUsage,
        long memoryWarnings,
        long memoryCriticals,
        long optimizationsTriggered,
        long garbageCollections,
        long totalAllocations,
        long totalDeallocations,
        int trackedChunks,
        int historyEntries,
        Optional<Instant> lastGcTime
) {
}
