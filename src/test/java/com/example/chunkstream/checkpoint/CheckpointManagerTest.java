package com.example.chunkstream.checkpoint;

import com.example.chunkstream.CheckpointCorruptionException;
import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import org.junit.jupiter.api.Test;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CheckpointManagerTest {
    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");
    private static final Instant STARTED = Instant.parse("2026-03-01T07:30:00Z");

    private static CheckpointManager manager(StreamingConfig config, Instant now) {
        return new CheckpointManager(config, new EventChannel("CheckpointManager"), new CheckpointCodec(),
                Clock.fixed(now, ZoneOffset.UTC));
    }

    private static CheckpointRequest request(Path file, long chunk) {
        CheckpointState state = new CheckpointState(chunk, 10, chunk * 100, 1000, chunk * 800, 8000, STARTED, null);
        return new CheckpointRequest(file, state, Map.of("linesSent", chunk * 100.0, "successRate", 100.0),
                List.of(0, 1, 2), new CheckpointMetadata(3, 0, 12.5, null), true);
    }

    private static Path sourceFile() throws Exception {
        Path file = Files.createTempDirectory("checkpoints").resolve("part.gcode");
        Files.writeString(file, "G1 X1\n");
        return file;
    }

    private static Path checkpointDirectory(StreamingConfig config, Path file) {
        return new FileSystemCheckpointStore(config.checkpointDirectory(), new CheckpointCodec(), false)
                .directoryFor(CheckpointManager.keyOf(file));
    }

    @Test
    void persistedCheckpointSurvivesRestart() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.defaults();
        Checkpoint created = manager(config, NOW).createCheckpoint(request(file, 3)).orElseThrow();

        assertTrue(Files.exists(checkpointDirectory(config, file).resolve(created.id() + ".json")));
        assertTrue(created.id().matches("cp_\\d{13}_\\d{6}_[0-9a-z]{6}"));

        CheckpointManager restarted = manager(config, NOW);
        Checkpoint loaded = restarted.loadCheckpoint(file).orElseThrow();

        assertEquals(created, loaded);
        assertEquals(3, loaded.state().currentChunk());
        assertEquals(file.toAbsolutePath().normalize(), loaded.sourcePath());
        assertEquals(1, restarted.getStatistics().checkpointsLoaded());
    }

    @Test
    void tamperedCheckpointIsRejected() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.defaults();
        CheckpointManager manager = manager(config, NOW);
        Checkpoint created = manager.createCheckpoint(request(file, 3)).orElseThrow();

        CheckpointState moved = new CheckpointState(7, 10, 700, 1000, 5600, 8000, STARTED, null);
        Checkpoint tampered = new Checkpoint(created.id(), created.version(), created.timestamp(), created.filePath(),
                moved, created.metrics(), created.processedChunks(), created.metadata(), created.checksum());
        assertThrows(CheckpointCorruptionException.class, () -> manager.validate(tampered));

        CheckpointCodec codec = new CheckpointCodec();
        Path stored = checkpointDirectory(config, file).resolve(created.id() + ".json");
        Files.writeString(stored, codec.encode(tampered, false));

        CheckpointManager restarted = manager(config, NOW);
        assertTrue(restarted.loadCheckpoint(file).isEmpty());
        assertEquals(1, restarted.getStatistics().checkpointsCorrupted());
    }

    @Test
    void compressedCheckpointsRoundTrip() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.builder().compressionEnabled(true).build();
        Checkpoint created = manager(config, NOW).createCheckpoint(request(file, 5)).orElseThrow();

        String stored = Files.readString(checkpointDirectory(config, file).resolve(created.id() + ".json"));
        assertTrue(stored.startsWith("compressed:"));

        assertEquals(created, manager(config, NOW).loadCheckpoint(file).orElseThrow());
    }

    @Test
    void prunesToTheNewestCheckpoints() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.builder().maxCheckpoints(3).build();
        CheckpointManager manager = manager(config, NOW);
        Checkpoint newest = null;
        for (int chunk = 1; chunk <= 5; chunk++) {
            newest = manager.createCheckpoint(request(file, chunk)).orElseThrow();
        }

        try (var files = Files.list(checkpointDirectory(config, file))) {
            assertEquals(3, files.count());
        }
        assertEquals(3, manager.getCheckpointsForFile(file).size());
        assertEquals(newest.id(), manager.loadCheckpoint(file).orElseThrow().id());
        assertEquals(5, manager.getStatistics().checkpointsCreated());
        assertEquals(3, manager.getStatistics().activeCheckpoints());
    }

    @Test
    void staleCheckpointIsRejected() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.builder().retentionDays(7).build();
        manager(config, NOW).createCheckpoint(request(file, 2)).orElseThrow();

        CheckpointManager later = manager(config, NOW.plus(Duration.ofDays(8)));

        assertTrue(later.loadCheckpoint(file).isEmpty());
        assertTrue(manager(config, NOW.plus(Duration.ofDays(6))).loadCheckpoint(file).isPresent());
    }

    @Test
    void fallsBackToOlderValidCheckpoint() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.defaults();
        CheckpointManager manager = manager(config, NOW);
        Checkpoint older = manager.createCheckpoint(request(file, 2)).orElseThrow();
        Checkpoint newer = manager.createCheckpoint(request(file, 4)).orElseThrow();

        Files.writeString(checkpointDirectory(config, file).resolve(newer.id() + ".json"), "{ not json");

        CheckpointManager restarted = manager(config, NOW);
        Optional<Checkpoint> loaded = restarted.loadCheckpoint(file);
        assertEquals(older.id(), loaded.orElseThrow().id());
        assertEquals(1, restarted.getStatistics().checkpointsCorrupted());
    }

    @Test
    void memoryOnlyLoadIgnoresDisk() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.defaults();
        manager(config, NOW).createCheckpoint(request(file, 2)).orElseThrow();

        CheckpointManager restarted = manager(config, NOW);

        assertTrue(restarted.loadCheckpoint(file, false).isEmpty());
        assertTrue(restarted.loadCheckpoint(file, true).isPresent());
    }

    @Test
    void disabledCheckpointingCreatesNothing() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.builder().enableCheckpointing(false).build();

        assertTrue(manager(config, NOW).createCheckpoint(request(file, 1)).isEmpty());
        assertFalse(Files.exists(checkpointDirectory(config, file)));
    }

    @Test
    void removesAndClearsCheckpoints() throws Exception {
        Path file = sourceFile();
        StreamingConfig config = StreamingConfig.defaults();
        CheckpointManager manager = manager(config, NOW);
        Checkpoint first = manager.createCheckpoint(request(file, 1)).orElseThrow();
        manager.createCheckpoint(request(file, 2)).orElseThrow();

        assertTrue(manager.removeCheckpoint(first.id()));
        assertFalse(manager.removeCheckpoint(first.id()));
        assertFalse(Files.exists(checkpointDirectory(config, file).resolve(first.id() + ".json")));

        manager.clearCheckpoints(file);
        assertTrue(manager.getCheckpointsForFile(file).isEmpty());
        assertTrue(manager(config, NOW).loadCheckpoint(file).isEmpty());
    }

    @Test
    void persistFailureIsSurfaced() throws Exception {
        Path file = sourceFile();
        Files.writeString(file.resolveSibling(".checkpoints"), "not a directory");
        CheckpointManager manager = manager(StreamingConfig.defaults(), NOW);

        assertThrows(UncheckedIOException.class, () -> manager.createCheckpoint(request(file, 1)));
    }
}
