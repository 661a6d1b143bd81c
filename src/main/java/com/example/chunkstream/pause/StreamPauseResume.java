package com.example.chunkstream.pause;

import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;

/**
 * Coordinates pausing and resuming of the registered {@link PauseParticipant}s. Expected refusals
 * (already paused, disabled, not paused, resume underway) are reported through the result objects,
 * never thrown. A watchdog forces a resume once a pause outlives
 * {@link StreamingConfig#maxPauseDuration()}.
 */
public final class StreamPauseResume implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(StreamPauseResume.class);

    private final StreamingConfig config;
    private final EventChannel events;
    private final Clock clock;
    private final List<PauseParticipant> participants = new CopyOnWriteArrayList<>();
    private final List<Consumer<ResumeInfo>> resumeCallbacks = new ArrayList<>();
    private final Object lock = new Object();

    private ScheduledExecutorService watchdogScheduler;
    private ScheduledFuture<?> watchdog;
    private long pauseGeneration;

    private boolean pausing;
    private boolean paused;
    private boolean resuming;
    private Instant pauseTime;
    private Instant resumeTime;
    private Duration pauseDuration = Duration.ZERO;
    private Duration totalPauseDuration = Duration.ZERO;
    private String pauseReason;
    private PausedStateSnapshot savedState;

    private long totalPauses;
    private long totalResumes;
    private long failedPauses;
    private long failedResumes;
    private Duration longestPause = Duration.ZERO;
    private Duration shortestPause;

    public StreamPauseResume(StreamingConfig config) {
        this(config, new EventChannel("StreamPauseResume"), Clock.systemUTC());
    }

    public StreamPauseResume(StreamingConfig config, EventChannel events, Clock clock) {
        this.config = config;
        this.events = events;
        this.clock = clock;
    }

    public EventChannel events() {
        return events;
    }

    public void registerParticipant(PauseParticipant participant) {
        if (participant != null) {
            participants.add(participant);
        }
    }

    public void unregisterParticipant(PauseParticipant participant) {
        participants.remove(participant);
    }

    /**
     * Queues a callback that runs once, after the next successful resume.
     */
    public void addResumeCallback(Consumer<ResumeInfo> callback) {
        if (callback != null) {
            synchronized (lock) {
                resumeCallbacks.add(callback);
            }
        }
    }

    public PauseResult requestPause(String reason) {
        return requestPause(reason, PauseOptions.defaults());
    }

    public PauseResult requestPause(String reason, PauseOptions options) {
        synchronized (lock) {
            if (paused || pausing) {
                LOGGER.warn("Pause requested ({}) while already paused", reason);
                return PauseResult.failed(PauseResult.ALREADY_PAUSED);
            }
            if (!config.enablePauseResume()) {
                LOGGER.warn("Pause requested ({}) but pause/resume is disabled", reason);
                return PauseResult.failed(PauseResult.DISABLED);
            }
            pausing = true;
        }

        boolean graceful = config.enableGracefulPause() && options.graceful();
        try {
            if (graceful) {
                awaitPauseReadiness(reason);
            }
            events.publish(StreamingEventType.PAUSE_EXECUTE, EventChannel.details(
                    "reason", reason,
                    "graceful", graceful
            ));
            for (PauseParticipant participant : participants) {
                participant.onPause(reason);
            }
        } catch (PauseNotReadyException | RuntimeException ex) {
            return pauseFailed(reason, ex.getMessage());
        }

        boolean preserve = options.preserveState() && config.saveStateOnPause();
        Instant pausedAt = clock.instant();
        PausedStateSnapshot snapshot = preserve ? captureState(reason, pausedAt) : null;
        synchronized (lock) {
            pausing = false;
            paused = true;
            resuming = false;
            pauseTime = pausedAt;
            resumeTime = null;
            pauseDuration = Duration.ZERO;
            pauseReason = reason;
            savedState = snapshot;
            totalPauses++;
            armWatchdog();
        }

        LOGGER.info("Stream paused ({}, graceful={})", reason, graceful);
        events.publish(StreamingEventType.STREAM_PAUSED, EventChannel.details(
                "reason", reason,
                "pauseTime", pausedAt,
                "graceful", graceful
        ));
        return PauseResult.paused(pausedAt);
    }

    private void awaitPauseReadiness(String reason) throws PauseNotReadyException {
        events.publish(StreamingEventType.PAUSE_REQUESTED, EventChannel.details(
                "reason", reason,
                "graceful", true,
                "timeoutMs", config.pauseTimeout().toMillis()
        ));
        List<CompletableFuture<Void>> readiness = new ArrayList<>();
        for (PauseParticipant participant : participants) {
            readiness.add(participant.prepareForPause(reason));
        }
        try {
            CompletableFuture.allOf(readiness.toArray(new CompletableFuture[0]))
                    .get(config.pauseTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            throw new PauseNotReadyException("Pause readiness timeout after " + config.pauseTimeout().toMillis() + "ms");
        } catch (ExecutionException ex) {
            throw new PauseNotReadyException("Participant failed to reach a safe point: " + ex.getCause().getMessage());
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new PauseNotReadyException("Interrupted while waiting for pause readiness");
        }
    }

    private PauseResult pauseFailed(String reason, String error) {
        synchronized (lock) {
            pausing = false;
            failedPauses++;
        }
        for (PauseParticipant participant : participants) {
            try {
                participant.onResume();
            } catch (RuntimeException ex) {
                LOGGER.warn("Participant failed to roll back an aborted pause", ex);
            }
        }
        LOGGER.warn("Failed to pause stream ({}): {}", reason, error);
        events.publish(StreamingEventType.PAUSE_FAILED, EventChannel.details(
                "reason", reason,
                "error", error
        ));
        return PauseResult.failed(PauseResult.PAUSE_FAILED, error);
    }

    private PausedStateSnapshot captureState(String reason, Instant timestamp) {
        Map<String, Object> state = new LinkedHashMap<>();
        for (PauseParticipant participant : participants) {
            state.putAll(participant.captureState());
        }
        LOGGER.debug("Captured {} state entries for pause", state.size());
        return new PausedStateSnapshot(timestamp, reason, state);
    }

    private void armWatchdog() {
        if (config.maxPauseDuration().isZero()) {
            return;
        }
        if (watchdogScheduler == null) {
            watchdogScheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "pause-watchdog");
                thread.setDaemon(true);
                return thread;
            });
        }
        long generation = ++pauseGeneration;
        watchdog = watchdogScheduler.schedule(() -> onPauseTimeout(generation),
                config.maxPauseDuration().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void onPauseTimeout(long generation) {
        Duration elapsed;
        synchronized (lock) {
            if (!paused || generation != pauseGeneration) {
                return;
            }
            elapsed = Duration.between(pauseTime, clock.instant());
        }
        LOGGER.warn("Pause exceeded {} ms, forcing resume", config.maxPauseDuration().toMillis());
        events.publish(StreamingEventType.PAUSE_TIMEOUT_EXCEEDED, EventChannel.details(
                "pauseDurationMs", elapsed.toMillis(),
                "maxDurationMs", config.maxPauseDuration().toMillis()
        ));
        requestResume(new ResumeOptions(true));
    }

    public ResumeResult requestResume() {
        return requestResume(ResumeOptions.defaults());
    }

    public ResumeResult requestResume(ResumeOptions options) {
        Duration duration;
        PausedStateSnapshot snapshot;
        String reason;
        synchronized (lock) {
            if (!paused) {
                LOGGER.warn("Resume requested while not paused");
                return ResumeResult.failed(ResumeResult.NOT_PAUSED);
            }
            if (resuming) {
                LOGGER.warn("Resume requested while a resume is already in progress");
                return ResumeResult.failed(ResumeResult.RESUME_IN_PROGRESS);
            }
            resuming = true;
            duration = Duration.between(pauseTime, clock.instant());
            snapshot = savedState;
            reason = pauseReason;
        }

        try {
            if (config.validateStateOnResume() && snapshot != null) {
                validateSavedState(snapshot, duration);
            }
            events.publish(StreamingEventType.RESUME_EXECUTE, EventChannel.details(
                    "pauseDurationMs", duration.toMillis(),
                    "pauseReason", reason,
                    "forced", options.forced()
            ));
            for (PauseParticipant participant : participants) {
                participant.onResume();
            }
        } catch (RuntimeException ex) {
            synchronized (lock) {
                resuming = false;
                failedResumes++;
            }
            LOGGER.warn("Failed to resume stream: {}", ex.getMessage());
            events.publish(StreamingEventType.RESUME_FAILED, EventChannel.details(
                    "error", ex.getMessage(),
                    "pauseDurationMs", duration.toMillis()
            ));
            return ResumeResult.failed(ResumeResult.RESUME_FAILED, ex.getMessage());
        }

        Instant resumedAt = clock.instant();
        List<Consumer<ResumeInfo>> callbacks;
        synchronized (lock) {
            paused = false;
            resuming = false;
            pauseTime = null;
            resumeTime = resumedAt;
            pauseDuration = duration;
            totalPauseDuration = totalPauseDuration.plus(duration);
            savedState = null;
            totalResumes++;
            if (duration.compareTo(longestPause) > 0) {
                longestPause = duration;
            }
            if (shortestPause == null || duration.compareTo(shortestPause) < 0) {
                shortestPause = duration;
            }
            cancelWatchdog();
            callbacks = new ArrayList<>(resumeCallbacks);
            resumeCallbacks.clear();
        }

        LOGGER.info("Stream resumed after {} ms{}", duration.toMillis(), options.forced() ? " (forced)" : "");
        events.publish(StreamingEventType.STREAM_RESUMED, EventChannel.details(
                "pauseDurationMs", duration.toMillis(),
                "resumeTime", resumedAt,
                "pauseReason", reason,
                "forced", options.forced()
        ));

        ResumeInfo info = new ResumeInfo(duration, resumedAt, options.forced());
        for (Consumer<ResumeInfo> callback : callbacks) {
            try {
                callback.accept(info);
            } catch (RuntimeException ex) {
                LOGGER.warn("Resume callback failed", ex);
            }
        }
        return ResumeResult.resumed(resumedAt, duration);
    }

    private void validateSavedState(PausedStateSnapshot snapshot, Duration duration) {
        if (snapshot.timestamp() == null) {
            throw new IllegalStateException("Saved pause state has no timestamp");
        }
        if (duration.compareTo(config.maxPauseDuration()) > 0 && !config.maxPauseDuration().isZero()) {
            LOGGER.warn("Pause lasted {} ms, longer than the {} ms limit",
                    duration.toMillis(), config.maxPauseDuration().toMillis());
        }
    }

    private void cancelWatchdog() {
        if (watchdog != null) {
            watchdog.cancel(false);
            watchdog = null;
        }
    }

    public boolean isPaused() {
        synchronized (lock) {
            return paused;
        }
    }

    public boolean canPause() {
        synchronized (lock) {
            return config.enablePauseResume() && !paused && !pausing && !resuming;
        }
    }

    public boolean canResume() {
        synchronized (lock) {
            return config.enablePauseResume() && paused && !resuming;
        }
    }

    public PauseState getPauseState() {
        synchronized (lock) {
            Duration current = paused ? Duration.between(pauseTime, clock.instant()) : pauseDuration;
            return new PauseState(paused, resuming, pauseTime, resumeTime, current, totalPauseDuration,
                    pauseReason, savedState);
        }
    }

    public PauseStatistics getStatistics() {
        synchronized (lock) {
            long pauseAttempts = totalPauses + failedPauses;
            long resumeAttempts = totalResumes + failedResumes;
            return new PauseStatistics(
                    totalPauses,
                    totalResumes,
                    failedPauses,
                    failedResumes,
                    pauseAttempts == 0 ? 0 : 100.0 * totalPauses / pauseAttempts,
                    resumeAttempts == 0 ? 0 : 100.0 * totalResumes / resumeAttempts,
                    totalResumes == 0 ? Duration.ZERO : totalPauseDuration.dividedBy(totalResumes),
                    longestPause,
                    shortestPause == null ? Duration.ZERO : shortestPause
            );
        }
    }

    public void resetStatistics() {
        synchronized (lock) {
            totalPauses = 0;
            totalResumes = 0;
            failedPauses = 0;
            failedResumes = 0;
            longestPause = Duration.ZERO;
            shortestPause = null;
            totalPauseDuration = Duration.ZERO;
        }
        LOGGER.debug("Pause/resume statistics reset");
        events.publish(StreamingEventType.STATISTICS_RESET, EventChannel.details("component", "StreamPauseResume"));
    }

    @Override
    public void close() {
        synchronized (lock) {
            cancelWatchdog();
            if (watchdogScheduler != null) {
                watchdogScheduler.shutdownNow();
                watchdogScheduler = null;
            }
            resumeCallbacks.clear();
            paused = false;
            resuming = false;
            pausing = false;
            pauseTime = null;
            savedState = null;
        }
        participants.clear();
        LOGGER.debug("Pause/resume controller closed");
    }

    private static final class PauseNotReadyException extends Exception {
        PauseNotReadyException(String message) {
            super(message);
        }
    }
}
