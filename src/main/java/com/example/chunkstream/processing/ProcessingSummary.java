package com.example.chunkstream.processing;

import java.time.Duration;
import java.util.List;

public record ProcessingSummary(
        int totalChunks,
        int processedChunks,
        int failedChunks,
        boolean stopped,
        Duration processingTime,
        List<Integer> completedChunks,
        List<Integer> permanentlyFailedChunks
) {
    public ProcessingSummary {
        completedChunks = List.copyOf(completedChunks);
        permanentlyFailedChunks = List.copyOf(permanentlyFailedChunks);
    }
}
