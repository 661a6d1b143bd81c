package com.example.chunkstream.pause;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of the pause controller. {@code pauseTime} is set exactly when {@code paused} is.
 */
public record PauseState(
        boolean paused,
        boolean resuming,
        Instant pauseTime,
        Instant resumeTime,
        Duration pauseDuration,
        Duration totalPauseDuration,
        String pauseReason,
        PausedStateSnapshot savedState
) {
}
