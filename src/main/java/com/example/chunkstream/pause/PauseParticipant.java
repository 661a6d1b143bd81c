package com.example.chunkstream.pause;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * A component that {@link StreamPauseResume} suspends and resumes.
 */
public interface PauseParticipant {
    /**
     * Starts moving towards a safe point. The returned future completes once the participant can be
     * paused without cutting an operation short. Called only for graceful pauses.
     */
    default CompletableFuture<Void> prepareForPause(String reason) {
        return CompletableFuture.completedFuture(null);
    }

    void onPause(String reason);

    void onResume();

    /**
     * State worth keeping while paused, merged into the saved snapshot.
     */
    default Map<String, Object> captureState() {
        return Map.of();
    }
}
