package com.example.chunkstream;

import com.example.chunkstream.analysis.FileAnalyzer;
import com.example.chunkstream.checkpoint.Checkpoint;
import com.example.chunkstream.checkpoint.CheckpointManager;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEvent;
import com.example.chunkstream.event.StreamingEventType;
import com.example.chunkstream.memory.MemoryManager;
import com.example.chunkstream.pause.PauseResult;
import com.example.chunkstream.pause.StreamPauseResume;
import com.example.chunkstream.processing.ChunkProcessor;
import com.example.chunkstream.processing.StreamingManager;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ChunkedFileStreamerTest {
    private static Path program(int lines) throws Exception {
        Path file = Files.createTempDirectory("streamer").resolve("program.gcode");
        StringBuilder content = new StringBuilder("; generated program\n");
        for (int i = 1; i <= lines; i++) {
            content.append("G1 X").append(i).append(" F1200\n");
        }
        Files.writeString(file, content.toString());
        return file;
    }

    @Test
    void streamsWholeFileWithPeriodicCheckpoints() throws Exception {
        Path file = program(2500);
        StreamingConfig config = StreamingConfig.builder().chunkSize(1000).checkpointInterval(1000).build();
        List<String> sent = new CopyOnWriteArrayList<>();
        List<StreamingEvent> checkpoints = new CopyOnWriteArrayList<>();
        List<StreamingEvent> events = new CopyOnWriteArrayList<>();

        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, (line, context) -> sent.add(line))) {
            streamer.events().addListener(events::add);
            streamer.checkpointManager().events().addListener(checkpoints::add);

            StreamingResult result = streamer.stream(file, StreamOptions.fresh());

            assertTrue(result.completed());
            assertEquals(0, result.startChunk());
            assertEquals(3, result.summary().processedChunks());
            assertEquals(2500, sent.size());
            assertEquals("G1 X1 F1200", sent.get(0));
            assertEquals(3, checkpoints.stream().filter(e -> e.type() == StreamingEventType.CHECKPOINT_CREATED).count());

            Checkpoint last = streamer.checkpointManager().loadCheckpoint(file).orElseThrow();
            assertEquals(result.finalCheckpointId().orElseThrow(), last.id());
            assertEquals(3, last.state().currentChunk());
            assertEquals(2500, last.state().currentLine());
            assertEquals(List.of(0, 1, 2), last.processedChunks());

            assertEquals(StreamingEventType.CHUNKED_STREAMING_STARTED, events.get(0).type());
            assertEquals(StreamingEventType.CHUNKED_STREAMING_COMPLETED, events.get(events.size() - 1).type());
            assertFalse(streamer.memoryManager().isMonitoring());
            assertEquals(0, streamer.memoryManager().getStatistics().trackedChunks());
            assertEquals(100.0, streamer.getProgress().percentComplete());
        }
    }

    @Test
    void resumesAfterTheLastCompletedChunk() throws Exception {
        Path file = program(50);
        StreamingConfig config = StreamingConfig.builder().chunkSize(10).maxChunkRetries(0).build();

        try (ChunkedFileStreamer failing = new ChunkedFileStreamer(config, (line, context) -> {
            if (context.chunkIndex() == 2) {
                throw new IllegalStateException("controller offline");
            }
            return "ok";
        })) {
            StreamingResult first = failing.stream(file, StreamOptions.fresh());
            assertFalse(first.completed());
            assertEquals(List.of(2), first.summary().permanentlyFailedChunks());
            assertEquals(4, first.summary().processedChunks());
        }

        List<Long> lineNumbers = new CopyOnWriteArrayList<>();
        try (ChunkedFileStreamer healthy = new ChunkedFileStreamer(config, (line, context) -> lineNumbers.add(context.lineNumber()))) {
            StreamingResult second = healthy.stream(file, StreamOptions.resuming());

            assertEquals(2, second.startChunk());
            assertTrue(second.resumedFrom().isPresent());
            assertTrue(second.completed());
            assertEquals(30, lineNumbers.size());
            assertEquals(21L, lineNumbers.get(0));
            assertEquals(5, healthy.checkpointManager().loadCheckpoint(file).orElseThrow().state().currentChunk());
        }
    }

    @Test
    void gracefulPauseCheckpointsAtAChunkBoundary() throws Exception {
        Path file = program(15);
        StreamingConfig config = StreamingConfig.builder().chunkSize(5).build();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        StreamingManager manager = (line, context) -> {
            if (context.chunkIndex() == 0 && context.lineNumber() == 1) {
                entered.countDown();
                release.await();
            }
            return "ok";
        };

        ExecutorService background = Executors.newFixedThreadPool(2);
        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, manager)) {
            Future<StreamingResult> running = background.submit(() -> streamer.stream(file, StreamOptions.fresh()));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            Future<PauseResult> pausing = background.submit(() -> streamer.pause("tool inspection"));
            Thread.sleep(100);
            assertFalse(pausing.isDone());
            release.countDown();

            assertTrue(pausing.get(5, TimeUnit.SECONDS).success());
            StreamingProgress progress = streamer.getProgress();
            assertTrue(progress.paused());
            assertEquals(5, progress.completedLines());
            Checkpoint paused = streamer.checkpointManager().loadCheckpoint(file).orElseThrow();
            assertEquals(1, paused.state().currentChunk());
            assertNotNull(paused.state().pauseTime());

            assertTrue(streamer.resume().success());
            StreamingResult result = running.get(5, TimeUnit.SECONDS);
            assertTrue(result.completed());
            assertEquals(3, result.summary().processedChunks());
        } finally {
            background.shutdownNow();
        }
    }

    @Test
    void stopEndsTheStreamEarly() throws Exception {
        Path file = program(30);
        StreamingConfig config = StreamingConfig.builder().chunkSize(10).build();
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        List<StreamingEvent> events = new CopyOnWriteArrayList<>();

        ExecutorService background = Executors.newSingleThreadExecutor();
        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, (line, context) -> {
            entered.countDown();
            release.await();
            return "ok";
        })) {
            streamer.events().addListener(events::add);
            Future<StreamingResult> running = background.submit(() -> streamer.stream(file, StreamOptions.fresh()));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            streamer.stop("operator abort");
            StreamingResult result = running.get(5, TimeUnit.SECONDS);

            assertTrue(result.summary().stopped());
            assertFalse(result.completed());
            StreamingEvent stopped = events.get(events.size() - 1);
            assertEquals(StreamingEventType.CHUNKED_STREAMING_STOPPED, stopped.type());
            assertEquals("operator abort", stopped.detail("reason", String.class));
            assertFalse(streamer.isStreaming());
        } finally {
            background.shutdownNow();
        }
    }

    @Test
    void streamingAFinishedFileAgainStartsOver() throws Exception {
        Path file = program(20);
        StreamingConfig config = StreamingConfig.builder().chunkSize(5).build();

        List<String> firstRun = new CopyOnWriteArrayList<>();
        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, (line, context) -> firstRun.add(line))) {
            assertTrue(streamer.stream(file).completed());
        }

        List<Long> secondRun = new CopyOnWriteArrayList<>();
        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, (line, context) -> secondRun.add(context.lineNumber()))) {
            assertEquals(4, streamer.checkpointManager().loadCheckpoint(file).orElseThrow().state().currentChunk());

            StreamingResult result = streamer.stream(file);

            assertEquals(20, firstRun.size());
            assertEquals(20, secondRun.size());
            assertEquals(1L, secondRun.get(0));
            assertEquals(0, result.startChunk());
            assertTrue(result.resumedFrom().isEmpty());
            assertTrue(result.completed());
        }
    }

    @Test
    void pauseRequestedFromAChunkListenerCompletes() throws Exception {
        Path file = program(20);
        StreamingConfig config = StreamingConfig.builder()
                .chunkSize(5)
                .maxConcurrentChunks(2)
                .pauseTimeout(Duration.ofSeconds(2))
                .build();
        CountDownLatch secondChunk = new CountDownLatch(1);
        StreamingManager manager = (line, context) -> {
            if (context.chunkIndex() == 1 && context.lineNumber() == 6) {
                secondChunk.await();
            }
            return "ok";
        };

        ExecutorService background = Executors.newSingleThreadExecutor();
        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, manager)) {
            AtomicBoolean requested = new AtomicBoolean();
            AtomicReference<PauseResult> pauseResult = new AtomicReference<>();
            CountDownLatch pauseReturned = new CountDownLatch(1);
            streamer.processor().events().addListener(event -> {
                if (event.type() == StreamingEventType.CHUNK_COMPLETED
                        && event.detail("chunkIndex", Integer.class) == 0
                        && requested.compareAndSet(false, true)) {
                    secondChunk.countDown();
                    pauseResult.set(streamer.pause("chunk review"));
                    pauseReturned.countDown();
                }
            });

            Future<StreamingResult> running = background.submit(() -> streamer.stream(file, StreamOptions.fresh()));

            assertTrue(pauseReturned.await(5, TimeUnit.SECONDS));
            assertTrue(pauseResult.get().success(), () -> "pause failed: " + pauseResult.get());
            assertTrue(streamer.pauseResume().isPaused());

            assertTrue(streamer.resume().success());
            StreamingResult result = running.get(5, TimeUnit.SECONDS);
            assertTrue(result.completed());
            assertEquals(4, result.summary().processedChunks());
        } finally {
            background.shutdownNow();
        }
    }

    @Test
    void shrinksChunksUnderMemoryPressure() throws Exception {
        Path file = program(40);
        StreamingConfig config = StreamingConfig.builder()
                .chunkSize(10)
                .maxMemoryUsage(1000)
                .adaptiveChunkSizing(true)
                .enableCheckpointing(false)
                .build();
        MemoryManager memory = new MemoryManager(config, new EventChannel("MemoryManager"), () -> 950L, () -> false,
                Clock.systemUTC());
        ChunkProcessor processor = new ChunkProcessor(config, (line, context) -> "ok");

        try (ChunkedFileStreamer streamer = new ChunkedFileStreamer(config, new FileAnalyzer(config), memory,
                new CheckpointManager(config), new StreamPauseResume(config), processor,
                new EventChannel("ChunkedFileStreamer"), Clock.systemUTC())) {
            StreamingResult result = streamer.stream(file, StreamOptions.fresh());

            assertEquals(8, result.summary().totalChunks());
            assertTrue(result.completed());
            assertTrue(result.finalCheckpointId().isEmpty());
            assertEquals(8, memory.getStatistics().totalAllocations());
            assertEquals(8, memory.getStatistics().totalDeallocations());
        }
    }
}
