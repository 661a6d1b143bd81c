package com.example.chunkstream.checkpoint;

import java.time.Duration;

public record CheckpointStatistics(
        long checkpointsCreated,
        long checkpointsLoaded,
        long checkpointsSaved,
        long checkpointsCorrupted,
        int activeCheckpoints,
        long totalCheckpointBytes,
        double averageCheckpointSize,
        Duration averageAge
) {
}
