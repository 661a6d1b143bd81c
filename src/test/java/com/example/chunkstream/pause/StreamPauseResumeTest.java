package com.example.chunkstream.pause;

import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEvent;
import com.example.chunkstream.event.StreamingEventType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamPauseResumeTest {
    private final List<StreamingEvent> events = new CopyOnWriteArrayList<>();

    private StreamPauseResume controller(StreamingConfig config) {
        EventChannel channel = new EventChannel("StreamPauseResume");
        channel.addListener(events::add);
        return new StreamPauseResume(config, channel, Clock.systemUTC());
    }

    @Test
    void pausesAndResumesParticipants() {
        StreamPauseResume controller = controller(StreamingConfig.defaults());
        RecordingParticipant participant = new RecordingParticipant(CompletableFuture.completedFuture(null));
        controller.registerParticipant(participant);

        PauseResult paused = controller.requestPause("operator");
        assertTrue(paused.success());
        assertTrue(paused.pauseTime().isPresent());
        assertTrue(controller.isPaused());
        assertTrue(controller.canResume());
        assertFalse(controller.canPause());
        assertEquals(1, participant.pauses.get());
        assertEquals("operator", controller.getPauseState().pauseReason());
        assertEquals(4, controller.getPauseState().savedState().participantState().get("nextChunk"));

        PauseResult again = controller.requestPause("operator");
        assertFalse(again.success());
        assertEquals(PauseResult.ALREADY_PAUSED, again.reason().orElseThrow());

        ResumeResult resumed = controller.requestResume();
        assertTrue(resumed.success());
        assertFalse(controller.isPaused());
        assertEquals(1, participant.resumes.get());
        assertEquals(ResumeResult.NOT_PAUSED, controller.requestResume().reason().orElseThrow());

        PauseStatistics statistics = controller.getStatistics();
        assertEquals(1, statistics.totalPauses());
        assertEquals(1, statistics.totalResumes());
        assertEquals(100.0, statistics.pauseSuccessRate());
        assertTrue(hasEvent(StreamingEventType.PAUSE_REQUESTED));
        assertTrue(hasEvent(StreamingEventType.STREAM_PAUSED));
        assertTrue(hasEvent(StreamingEventType.STREAM_RESUMED));
        controller.close();
    }

    @Test
    void refusesWhenDisabled() {
        StreamPauseResume controller = controller(StreamingConfig.builder().enablePauseResume(false).build());

        PauseResult result = controller.requestPause("operator");

        assertFalse(result.success());
        assertEquals(PauseResult.DISABLED, result.reason().orElseThrow());
        assertFalse(controller.isPaused());
    }

    @Test
    void gracefulPauseFailsWhenParticipantNeverSettles() {
        StreamingConfig config = StreamingConfig.builder().pauseTimeout(Duration.ofMillis(50)).build();
        StreamPauseResume controller = controller(config);
        RecordingParticipant participant = new RecordingParticipant(new CompletableFuture<>());
        controller.registerParticipant(participant);

        PauseResult result = controller.requestPause("operator");

        assertFalse(result.success());
        assertEquals(PauseResult.PAUSE_FAILED, result.reason().orElseThrow());
        assertTrue(result.error().orElseThrow().contains("timeout"));
        assertFalse(controller.isPaused());
        assertEquals(0, participant.pauses.get());
        assertEquals(1, participant.resumes.get());
        assertEquals(1, controller.getStatistics().failedPauses());
        assertTrue(hasEvent(StreamingEventType.PAUSE_FAILED));
        assertTrue(controller.canPause());
    }

    @Test
    void immediatePauseSkipsReadiness() {
        StreamPauseResume controller = controller(StreamingConfig.defaults());
        RecordingParticipant participant = new RecordingParticipant(new CompletableFuture<>());
        controller.registerParticipant(participant);

        assertTrue(controller.requestPause("emergency", PauseOptions.immediate()).success());
        assertEquals(1, participant.pauses.get());
        assertFalse(hasEvent(StreamingEventType.PAUSE_REQUESTED));
        controller.close();
    }

    @Test
    void watchdogForcesResume() throws Exception {
        StreamingConfig config = StreamingConfig.builder().maxPauseDuration(Duration.ofMillis(100)).build();
        StreamPauseResume controller = controller(config);
        CompletableFuture<ResumeInfo> resumed = new CompletableFuture<>();
        controller.addResumeCallback(resumed::complete);

        assertTrue(controller.requestPause("operator").success());

        ResumeInfo info = resumed.get(5, TimeUnit.SECONDS);
        assertTrue(info.forced());
        assertFalse(controller.isPaused());
        assertTrue(hasEvent(StreamingEventType.PAUSE_TIMEOUT_EXCEEDED));
        controller.close();
    }

    @Test
    void resumeCallbacksRunOnce() {
        StreamPauseResume controller = controller(StreamingConfig.defaults());
        AtomicInteger calls = new AtomicInteger();
        controller.addResumeCallback(info -> calls.incrementAndGet());

        controller.requestPause("first");
        controller.requestResume();
        controller.requestPause("second");
        controller.requestResume();

        assertEquals(1, calls.get());
        assertEquals(2, controller.getStatistics().totalResumes());
        controller.close();
    }

    private boolean hasEvent(StreamingEventType type) {
        return events.stream().anyMatch(event -> event.type() == type);
    }

    private static final class RecordingParticipant implements PauseParticipant {
        private final CompletableFuture<Void> readiness;
        private final AtomicInteger pauses = new AtomicInteger();
        private final AtomicInteger resumes = new AtomicInteger();

        private RecordingParticipant(CompletableFuture<Void> readiness) {
            this.readiness = readiness;
        }

        @Override
        public CompletableFuture<Void> prepareForPause(String reason) {
            return readiness;
        }

        @Override
        public void onPause(String reason) {
            pauses.incrementAndGet();
        }

        @Override
        public void onResume() {
            resumes.incrementAndGet();
        }

        @Override
        public Map<String, Object> captureState() {
            return Map.of("nextChunk", 4);
        }
    }
}
