package com.example.chunkstream.pause;

import java.time.Instant;
import java.util.Optional;

public record PauseResult(boolean success, Optional<Instant> pauseTime, Optional<String> reason, Optional<String> error) {
    public static final String ALREADY_PAUSED = "already_paused";
    public static final String DISABLED = "disabled";
    public static final String PAUSE_FAILED = "pause_failed";

    public static PauseResult paused(Instant pauseTime) {
        return new PauseResult(true, Optional.of(pauseTime), Optional.empty(), Optional.empty());
    }

    public static PauseResult failed(String reason) {
        return new PauseResult(false, Optional.empty(), Optional.of(reason), Optional.empty());
    }

    public static PauseResult failed(String reason, String error) {
        return new PauseResult(false, Optional.empty(), Optional.of(reason), Optional.ofNullable(error));
    }
}
