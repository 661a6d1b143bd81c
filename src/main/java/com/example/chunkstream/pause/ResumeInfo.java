package com.example.chunkstream.pause;

import java.time.Duration;
import java.time.Instant;

/**
 * Passed to resume callbacks once a pause has ended.
 */
public record ResumeInfo(Duration pauseDuration, Instant resumeTime, boolean forced) {
}
