package com.example.chunkstream.pause;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public record ResumeResult(
        boolean success,
        Optional<Instant> resumeTime,
        Optional<Duration> pauseDuration,
        Optional<String> reason,
        Optional<String> error
) {
    public static final String NOT_PAUSED = "not_paused";
    public static final String RESUME_IN_PROGRESS = "resume_in_progress";
    public static final String RESUME_FAILED = "resume_failed";

    public static ResumeResult resumed(Instant resumeTime, Duration pauseDuration) {
        return new ResumeResult(true, Optional.of(resumeTime), Optional.of(pauseDuration), Optional.empty(),
                Optional.empty());
    }

    public static ResumeResult failed(String reason) {
        return new ResumeResult(false, Optional.empty(), Optional.empty(), Optional.of(reason), Optional.empty());
    }

    public static ResumeResult failed(String reason, String error) {
        return new ResumeResult(false, Optional.empty(), Optional.empty(), Optional.of(reason),
                Optional.ofNullable(error));
    }
}
