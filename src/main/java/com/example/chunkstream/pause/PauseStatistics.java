package com.example.chunkstream.pause;

import java.time.Duration;

public record PauseStatistics(
        long totalPauses,
        long totalResumes,
        long failedPauses,
        long failedResumes,
        double pauseSuccessRate,
        double resumeSuccessRate,
        Duration averagePauseDuration,
        Duration longestPause,
        Duration shortestPause
) {
}
