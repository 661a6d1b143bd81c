package com.example.chunkstream.pause;

import java.time.Instant;
import java.util.Map;

public record PausedStateSnapshot(Instant timestamp, String pauseReason, Map<String, Object> participantState) {
    public PausedStateSnapshot {
        participantState = participantState == null ? Map.of() : Map.copyOf(participantState);
    }
}
