package com.example.chunkstream.checkpoint;

import com.example.chunkstream.CheckpointCorruptionException;
import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates, persists and reloads progress checkpoints. Snapshots are kept in an in-memory store and,
 * unless suppressed per request, in a persistent store; both are pruned to the newest
 * {@link StreamingConfig#maxCheckpoints()} per source file.
 */
public final class CheckpointManager {
    private static final Logger LOGGER = LoggerFactory.getLogger(CheckpointManager.class);
    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";

    private final StreamingConfig config;
    private final EventChannel events;
    private final InMemoryCheckpointStore memoryStore;
    private final CheckpointStore persistentStore;
    private final CheckpointCodec codec;
    private final Clock clock;
    private final AtomicInteger idSequence = new AtomicInteger();

    private final AtomicLong checkpointsCreated = new AtomicLong();
    private final AtomicLong checkpointsLoaded = new AtomicLong();
    private final AtomicLong checkpointsSaved = new AtomicLong();
    private final AtomicLong checkpointsCorrupted = new AtomicLong();
    private final AtomicLong totalCheckpointBytes = new AtomicLong();

    public CheckpointManager(StreamingConfig config) {
        this(config, new EventChannel("CheckpointManager"), new CheckpointCodec(), Clock.systemUTC());
    }

    public CheckpointManager(StreamingConfig config, EventChannel events, CheckpointCodec codec, Clock clock) {
        this(config, events, codec, new InMemoryCheckpointStore(),
                new FileSystemCheckpointStore(config.checkpointDirectory(), codec, config.compressionEnabled()), clock);
    }

    public CheckpointManager(StreamingConfig config,
                             EventChannel events,
                             CheckpointCodec codec,
                             InMemoryCheckpointStore memoryStore,
                             CheckpointStore persistentStore,
                             Clock clock) {
        this.config = config;
        this.events = events;
        this.codec = codec;
        this.memoryStore = memoryStore;
        this.persistentStore = persistentStore;
        this.clock = clock;
    }

    public EventChannel events() {
        return events;
    }

    /**
     * Builds, stores and (unless the request says otherwise) persists a checkpoint. Returns empty when
     * checkpointing is disabled.
     *
     * @throws UncheckedIOException when the checkpoint cannot be written to the persistent store
     */
    public Optional<Checkpoint> createCheckpoint(CheckpointRequest request) {
        if (!config.enableCheckpointing()) {
            LOGGER.debug("Checkpointing disabled; skipping checkpoint for {}", request.filePath());
            return Optional.empty();
        }
        String filePath = keyOf(request.filePath());
        Checkpoint checkpoint = new Checkpoint(
                nextId(),
                Checkpoint.CURRENT_VERSION,
                clock.instant(),
                filePath,
                request.state(),
                request.metrics(),
                request.processedChunks(),
                request.metadata(),
                null
        );
        if (config.validateChecksums()) {
            checkpoint = checkpoint.withChecksum(codec.checksum(checkpoint));
        }

        memoryStore.save(checkpoint);
        if (request.persistToDisk()) {
            try {
                persistentStore.save(checkpoint);
                checkpointsSaved.incrementAndGet();
            } catch (IOException ex) {
                LOGGER.error("Failed to persist checkpoint {} for {}", checkpoint.id(), filePath, ex);
                throw new UncheckedIOException("Failed to persist checkpoint " + checkpoint.id(), ex);
            }
        }
        if (config.autoCleanup()) {
            prune(memoryStore, filePath);
            prune(persistentStore, filePath);
        }

        checkpointsCreated.incrementAndGet();
        totalCheckpointBytes.addAndGet(codec.sizeOf(checkpoint));
        LOGGER.info("Checkpoint {} created for {} at chunk {} line {}",
                checkpoint.id(), filePath, checkpoint.state().currentChunk(), checkpoint.state().currentLine());
        events.publish(StreamingEventType.CHECKPOINT_CREATED, EventChannel.details(
                "checkpointId", checkpoint.id(),
                "filePath", filePath,
                "currentChunk", checkpoint.state().currentChunk(),
                "currentLine", checkpoint.state().currentLine()
        ));
        return Optional.of(checkpoint);
    }

    public Optional<Checkpoint> loadCheckpoint(Path filePath) {
        return loadCheckpoint(filePath, true);
    }

    /**
     * Returns the newest valid checkpoint for the file: the in-memory one if it validates, otherwise the
     * first persisted candidate that does. Invalid candidates are logged and skipped.
     */
    public Optional<Checkpoint> loadCheckpoint(Path filePath, boolean loadFromDisk) {
        String key = keyOf(filePath);
        Optional<Checkpoint> loaded = memoryStore.listIds(key).stream()
                .findFirst()
                .flatMap(id -> memoryStore.read(key, id))
                .filter(this::isValid);
        if (loaded.isEmpty() && loadFromDisk) {
            loaded = loadFromPersistentStore(key);
        }
        if (loaded.isEmpty()) {
            LOGGER.debug("No valid checkpoint found for {}", key);
            return Optional.empty();
        }

        Checkpoint checkpoint = loaded.get();
        checkpointsLoaded.incrementAndGet();
        LOGGER.info("Checkpoint {} loaded for {} (chunk {}, line {})",
                checkpoint.id(), key, checkpoint.state().currentChunk(), checkpoint.state().currentLine());
        events.publish(StreamingEventType.CHECKPOINT_LOADED, EventChannel.details(
                "checkpointId", checkpoint.id(),
                "filePath", key,
                "currentChunk", checkpoint.state().currentChunk(),
                "currentLine", checkpoint.state().currentLine()
        ));
        return loaded;
    }

    private Optional<Checkpoint> loadFromPersistentStore(String key) {
        List<String> ids;
        try {
            ids = persistentStore.listIds(key);
        } catch (IOException ex) {
            LOGGER.warn("Failed to list persisted checkpoints for {}", key, ex);
            return Optional.empty();
        }
        for (String id : ids) {
            try {
                Optional<Checkpoint> candidate = persistentStore.read(key, id);
                if (candidate.isPresent() && isValid(candidate.get())) {
                    memoryStore.save(candidate.get());
                    return candidate;
                }
            } catch (CheckpointCorruptionException ex) {
                checkpointsCorrupted.incrementAndGet();
                LOGGER.warn("Skipping checkpoint {} for {}: {}", id, key, ex.getMessage());
            } catch (IOException ex) {
                LOGGER.warn("Failed to read checkpoint {} for {}", id, key, ex);
            }
        }
        if (!ids.isEmpty()) {
            LOGGER.warn("None of the {} persisted checkpoints for {} is valid", ids.size(), key);
        }
        return Optional.empty();
    }

    private boolean isValid(Checkpoint checkpoint) {
        try {
            validate(checkpoint);
            return true;
        } catch (CheckpointCorruptionException ex) {
            checkpointsCorrupted.incrementAndGet();
            LOGGER.warn("Rejected checkpoint for {}: {}", checkpoint.filePath(), ex.getMessage());
            return false;
        }
    }

    /**
     * Checks required fields, the checksum (when enabled) and the retention window.
     *
     * @throws CheckpointCorruptionException describing the first problem found
     */
    public void validate(Checkpoint checkpoint) {
        String id = checkpoint.id() == null ? "<unknown>" : checkpoint.id();
        requireField(id, "id", checkpoint.id() != null && !checkpoint.id().isBlank());
        requireField(id, "version", checkpoint.version() != null);
        requireField(id, "timestamp", checkpoint.timestamp() != null);
        requireField(id, "filePath", checkpoint.filePath() != null);
        requireField(id, "state", checkpoint.state() != null);
        requireField(id, "metrics", checkpoint.metrics() != null);
        requireField(id, "processedChunks", checkpoint.processedChunks() != null);
        requireField(id, "metadata", checkpoint.metadata() != null);

        if (config.validateChecksums()) {
            requireField(id, "checksum", checkpoint.checksum() != null);
            String expected = codec.checksum(checkpoint);
            if (!expected.equals(checkpoint.checksum())) {
                throw new CheckpointCorruptionException(id, "checksum mismatch (stored "
                        + checkpoint.checksum() + ", computed " + expected + ")");
            }
        }

        Duration age = Duration.between(checkpoint.timestamp(), clock.instant());
        if (age.compareTo(Duration.ofDays(config.retentionDays())) > 0) {
            throw new CheckpointCorruptionException(id, "older than " + config.retentionDays() + " days");
        }
    }

    private static void requireField(String id, String field, boolean present) {
        if (!present) {
            throw new CheckpointCorruptionException(id, "missing required field " + field);
        }
    }

    /**
     * Removes a checkpoint known to this manager from both stores.
     */
    public boolean removeCheckpoint(String checkpointId) {
        Optional<Checkpoint> checkpoint = memoryStore.findById(checkpointId);
        if (checkpoint.isEmpty()) {
            return false;
        }
        String filePath = checkpoint.get().filePath();
        memoryStore.delete(filePath, checkpointId);
        try {
            persistentStore.delete(filePath, checkpointId);
        } catch (IOException ex) {
            LOGGER.warn("Failed to remove persisted checkpoint {}", checkpointId, ex);
        }
        events.publish(StreamingEventType.CHECKPOINT_REMOVED, EventChannel.details(
                "checkpointId", checkpointId,
                "filePath", filePath
        ));
        return true;
    }

    /**
     * Removes every checkpoint of the file from both stores.
     */
    public void clearCheckpoints(Path filePath) {
        String key = keyOf(filePath);
        memoryStore.deleteAll(key);
        try {
            persistentStore.deleteAll(key);
        } catch (IOException ex) {
            LOGGER.warn("Failed to clear persisted checkpoints for {}", key, ex);
        }
        LOGGER.info("Cleared checkpoints for {}", key);
        events.publish(StreamingEventType.CHECKPOINTS_CLEARED, EventChannel.details("filePath", key));
    }

    /**
     * Drops every in-memory checkpoint. Persisted files are left alone.
     */
    public void clearAllCheckpoints() {
        memoryStore.clear();
        LOGGER.info("Cleared all in-memory checkpoints");
        events.publish(StreamingEventType.CHECKPOINTS_CLEARED);
    }

    public List<Checkpoint> getCheckpointsForFile(Path filePath) {
        return memoryStore.listCheckpoints(keyOf(filePath));
    }

    public CheckpointStatistics getStatistics() {
        List<Checkpoint> active = memoryStore.all();
        Instant now = clock.instant();
        Duration averageAge = Duration.ZERO;
        if (!active.isEmpty()) {
            Duration total = Duration.ZERO;
            for (Checkpoint checkpoint : active) {
                total = total.plus(Duration.between(checkpoint.timestamp(), now));
            }
            averageAge = total.dividedBy(active.size());
        }
        long created = checkpointsCreated.get();
        long bytes = totalCheckpointBytes.get();
        return new CheckpointStatistics(
                created,
                checkpointsLoaded.get(),
                checkpointsSaved.get(),
                checkpointsCorrupted.get(),
                active.size(),
                bytes,
                created == 0 ? 0 : (double) bytes / created,
                averageAge
        );
    }

    private void prune(CheckpointStore store, String filePath) {
        try {
            List<String> ids = store.listIds(filePath);
            for (String id : ids.subList(Math.min(ids.size(), config.maxCheckpoints()), ids.size())) {
                store.delete(filePath, id);
                LOGGER.debug("Pruned checkpoint {} for {}", id, filePath);
            }
        } catch (IOException ex) {
            LOGGER.warn("Failed to prune checkpoints for {}", filePath, ex);
        }
    }

    private String nextId() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        int sequence = Math.floorMod(idSequence.getAndIncrement(), 1_000_000);
        return String.format("cp_%013d_%06d_%s", clock.millis(), sequence, suffix);
    }

    static String keyOf(Path filePath) {
        return filePath.toAbsolutePath().normalize().toString();
    }
}
