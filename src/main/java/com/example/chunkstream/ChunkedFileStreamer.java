package com.example.chunkstream;

import com.example.chunkstream.analysis.AnalysisOptions;
import com.example.chunkstream.analysis.Chunk;
import com.example.chunkstream.analysis.FileAnalysis;
import com.example.chunkstream.analysis.FileAnalyzer;
import com.example.chunkstream.checkpoint.Checkpoint;
import com.example.chunkstream.checkpoint.CheckpointManager;
import com.example.chunkstream.checkpoint.CheckpointMetadata;
import com.example.chunkstream.checkpoint.CheckpointRequest;
import com.example.chunkstream.checkpoint.CheckpointState;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEvent;
import com.example.chunkstream.event.StreamingEventType;
import com.example.chunkstream.memory.MemoryManager;
import com.example.chunkstream.pause.PauseResult;
import com.example.chunkstream.pause.ResumeOptions;
import com.example.chunkstream.pause.ResumeResult;
import com.example.chunkstream.pause.StreamPauseResume;
import com.example.chunkstream.processing.ChunkProcessor;
import com.example.chunkstream.processing.ProcessingMetrics;
import com.example.chunkstream.processing.ProcessingOptions;
import com.example.chunkstream.processing.ProcessingSummary;
import com.example.chunkstream.processing.StreamingManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Streams one program file end to end: analysis, memory monitoring, chunk processing, periodic
 * checkpoints and pause/resume. Only one file is streamed at a time per instance.
 */
public final class ChunkedFileStreamer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedFileStreamer.class);

    private final StreamingConfig config;
    private final FileAnalyzer analyzer;
    private final MemoryManager memoryManager;
    private final CheckpointManager checkpointManager;
    private final StreamPauseResume pauseResume;
    private final ChunkProcessor processor;
    private final EventChannel events;
    private final Clock clock;

    private final Object lock = new Object();
    private final Object checkpointLock = new Object();

    // guarded by lock
    private boolean streaming;
    private FileAnalysis currentAnalysis;
    private Instant streamStart;
    private long linesBeforeStart;
    private long completedLines;
    private long linesAtLastCheckpoint;
    private String lastError;
    private String stopReason;

    public ChunkedFileStreamer(StreamingConfig config, StreamingManager streamingManager) {
        this(config,
                new FileAnalyzer(config),
                new MemoryManager(config),
                new CheckpointManager(config),
                new StreamPauseResume(config),
                new ChunkProcessor(config, streamingManager),
                new EventChannel("ChunkedFileStreamer"),
                Clock.systemUTC());
    }

    public ChunkedFileStreamer(StreamingConfig config,
                               FileAnalyzer analyzer,
                               MemoryManager memoryManager,
                               CheckpointManager checkpointManager,
                               StreamPauseResume pauseResume,
                               ChunkProcessor processor,
                               EventChannel events,
                               Clock clock) {
        this.config = config;
        this.analyzer = analyzer;
        this.memoryManager = memoryManager;
        this.checkpointManager = checkpointManager;
        this.pauseResume = pauseResume;
        this.processor = processor;
        this.events = events;
        this.clock = clock;
        processor.events().addListener(this::onProcessorEvent);
        pauseResume.registerParticipant(processor);
    }

    public EventChannel events() {
        return events;
    }

    public FileAnalyzer analyzer() {
        return analyzer;
    }

    public MemoryManager memoryManager() {
        return memoryManager;
    }

    public CheckpointManager checkpointManager() {
        return checkpointManager;
    }

    public StreamPauseResume pauseResume() {
        return pauseResume;
    }

    public ChunkProcessor processor() {
        return processor;
    }

    public StreamingResult stream(Path filePath) {
        return stream(filePath, StreamOptions.from(config));
    }

    /**
     * Streams the file and blocks until every chunk has completed or permanently failed, or until
     * {@link #stop(String)} is called.
     *
     * @throws AnalysisException when the file cannot be analyzed
     * @throws IllegalStateException when another file is already being streamed
     */
    public StreamingResult stream(Path filePath, StreamOptions options) {
        synchronized (lock) {
            if (streaming) {
                throw new IllegalStateException("A file is already being streamed");
            }
            streaming = true;
            currentAnalysis = null;
            linesBeforeStart = 0;
            completedLines = 0;
            linesAtLastCheckpoint = 0;
            lastError = null;
            stopReason = null;
        }
        memoryManager.startMonitoring();
        try {
            Optional<Checkpoint> restored = Optional.empty();
            if (options.resumeFromCheckpoint() && config.enableCheckpointing()) {
                restored = checkpointManager.loadCheckpoint(filePath);
            }

            FileAnalysis analysis = analyzer.analyze(filePath, analysisOptions());
            restored = restored.filter(checkpoint -> isResumable(checkpoint, analysis));
            int startChunk = restored.map(checkpoint -> resumeIndex(checkpoint, analysis)).orElse(0);
            long linesBefore = startChunk < analysis.chunks().size()
                    ? analysis.chunks().get(startChunk).startLine() - 1
                    : analysis.totalLines();
            synchronized (lock) {
                currentAnalysis = analysis;
                streamStart = clock.instant();
                linesBeforeStart = linesBefore;
                completedLines = linesBefore;
                linesAtLastCheckpoint = linesBefore;
            }

            LOGGER.info("Streaming {}: {} chunks, {} lines, starting at chunk {}",
                    filePath, analysis.chunks().size(), analysis.totalLines(), startChunk);
            events.publish(StreamingEventType.CHUNKED_STREAMING_STARTED, EventChannel.details(
                    "filePath", filePath.toString(),
                    "totalChunks", analysis.chunks().size(),
                    "totalLines", analysis.totalLines(),
                    "startChunk", startChunk,
                    "resumedFrom", restored.map(Checkpoint::id).orElse(null)
            ));

            ProcessingSummary summary = processor.startProcessing(analysis.chunks(), ProcessingOptions.startingAt(startChunk));
            Optional<Checkpoint> finalCheckpoint = createCheckpoint();

            String reason;
            synchronized (lock) {
                reason = stopReason;
            }
            if (summary.stopped()) {
                LOGGER.info("Streaming of {} stopped ({}) after {} chunks", filePath, reason, summary.processedChunks());
                events.publish(StreamingEventType.CHUNKED_STREAMING_STOPPED, EventChannel.details(
                        "filePath", filePath.toString(),
                        "reason", reason,
                        "processedChunks", summary.processedChunks(),
                        "failedChunks", summary.failedChunks()
                ));
            } else {
                LOGGER.info("Streaming of {} completed: {} chunks processed, {} failed",
                        filePath, summary.processedChunks(), summary.failedChunks());
                events.publish(StreamingEventType.CHUNKED_STREAMING_COMPLETED, EventChannel.details(
                        "filePath", filePath.toString(),
                        "processedChunks", summary.processedChunks(),
                        "failedChunks", summary.failedChunks(),
                        "processingTimeMs", summary.processingTime().toMillis()
                ));
            }
            return new StreamingResult(filePath, startChunk, restored.map(Checkpoint::id),
                    finalCheckpoint.map(Checkpoint::id), summary);
        } finally {
            memoryManager.stopMonitoring();
            synchronized (lock) {
                streaming = false;
            }
        }
    }

    private AnalysisOptions analysisOptions() {
        if (!config.adaptiveChunkSizing()) {
            return AnalysisOptions.defaults();
        }
        memoryManager.checkMemoryUsage();
        int recommended = Math.max(1, memoryManager.getChunkSizeRecommendation(config.chunkSize()));
        if (recommended != config.chunkSize()) {
            LOGGER.info("Using chunk size {} instead of {} under current memory pressure", recommended, config.chunkSize());
        }
        return AnalysisOptions.withChunkSize(recommended);
    }

    /**
     * A checkpoint taken for a file of different length, or one recording that every line
     * completed, starts the file from the beginning.
     */
    private static boolean isResumable(Checkpoint checkpoint, FileAnalysis analysis) {
        CheckpointState state = checkpoint.state();
        if (state.totalLines() != analysis.totalLines()) {
            LOGGER.warn("Checkpoint {} was taken for {} lines but {} has {}, starting from the beginning",
                    checkpoint.id(), state.totalLines(), analysis.filePath(), analysis.totalLines());
            return false;
        }
        if (state.currentLine() >= state.totalLines()) {
            LOGGER.info("Checkpoint {} records a finished run of {}, starting from the beginning",
                    checkpoint.id(), analysis.filePath());
            return false;
        }
        return true;
    }

    /**
     * Maps the checkpoint's completed line count onto the current chunking, which may differ from the
     * one the checkpoint was taken with.
     */
    private static int resumeIndex(Checkpoint checkpoint, FileAnalysis analysis) {
        CheckpointState state = checkpoint.state();
        List<Chunk> chunks = analysis.chunks();
        for (Chunk chunk : chunks) {
            if (chunk.endLine() > state.currentLine()) {
                LOGGER.info("Resuming {} from checkpoint {} at chunk {} (line {})",
                        analysis.filePath(), checkpoint.id(), chunk.index(), chunk.startLine());
                return chunk.index();
            }
        }
        return chunks.size();
    }

    private void onProcessorEvent(StreamingEvent event) {
        switch (event.type()) {
            case CHUNK_STARTED:
            case CHUNK_RETRY_STARTED:
                memoryManager.trackChunkMemory(chunkId(event), event.detail("byteLength", Long.class));
                break;
            case CHUNK_COMPLETED:
                memoryManager.releaseChunkMemory(chunkId(event));
                onChunkCompleted(event.detail("lineCount", Integer.class));
                break;
            case CHUNK_RETRY_QUEUED:
            case CHUNK_FAILED:
                memoryManager.releaseChunkMemory(chunkId(event));
                synchronized (lock) {
                    lastError = event.detail("error", String.class);
                }
                break;
            default:
                break;
        }
    }

    private void onChunkCompleted(int lineCount) {
        boolean due;
        synchronized (lock) {
            completedLines += lineCount;
            due = config.enableCheckpointing()
                    && completedLines - linesAtLastCheckpoint >= config.checkpointInterval();
            if (due) {
                linesAtLastCheckpoint = completedLines;
            }
        }
        if (due) {
            try {
                createCheckpoint();
            } catch (UncheckedIOException ex) {
                LOGGER.error("Failed to write periodic checkpoint", ex);
            }
        }
    }

    private static String chunkId(StreamingEvent event) {
        return "chunk_" + event.detail("chunkIndex", Integer.class);
    }

    /**
     * Checkpoints the progress of the file being streamed, or of the last streamed file. Everything
     * below the recorded chunk has completed. Empty when checkpointing is disabled or nothing has been
     * analyzed yet.
     *
     * @throws UncheckedIOException when the checkpoint cannot be written
     */
    public Optional<Checkpoint> createCheckpoint() {
        FileAnalysis analysis;
        Instant startedAt;
        String error;
        synchronized (lock) {
            analysis = currentAnalysis;
            startedAt = streamStart;
            error = lastError;
        }
        if (analysis == null || !config.enableCheckpointing()) {
            return Optional.empty();
        }

        synchronized (checkpointLock) {
            List<Chunk> chunks = analysis.chunks();
            int next = processor.nextUnprocessedIndex();
            long currentLine = next < chunks.size() ? chunks.get(next).startLine() - 1 : analysis.totalLines();
            long bytesProcessed = next < chunks.size() ? chunks.get(next).startByteOffset() : analysis.totalBytes();
            CheckpointState state = new CheckpointState(
                    next,
                    chunks.size(),
                    currentLine,
                    analysis.totalLines(),
                    bytesProcessed,
                    analysis.totalBytes(),
                    startedAt,
                    pauseResume.getPauseState().pauseTime()
            );

            ProcessingMetrics metrics = processor.getMetrics();
            Map<String, Double> values = new LinkedHashMap<>();
            values.put("chunksProcessed", (double) metrics.chunksProcessed());
            values.put("chunksRetried", (double) metrics.chunksRetried());
            values.put("linesSent", (double) metrics.linesSent());
            values.put("linesFailed", (double) metrics.linesFailed());
            values.put("successRate", metrics.successRate());
            values.put("memoryUsage", (double) memoryManager.getMemoryStatus().current());
            CheckpointMetadata metadata = new CheckpointMetadata(
                    (int) metrics.chunksSuccessful(),
                    (int) metrics.chunksFailed(),
                    metrics.averageChunkTime().toNanos() / 1_000_000.0,
                    error
            );

            Optional<Checkpoint> checkpoint = checkpointManager.createCheckpoint(new CheckpointRequest(
                    analysis.filePath(), state, values, processor.getCompletedChunks(), metadata, true));
            synchronized (lock) {
                linesAtLastCheckpoint = Math.max(linesAtLastCheckpoint, completedLines);
            }
            return checkpoint;
        }
    }

    public PauseResult pause(String reason) {
        PauseResult result = pauseResume.requestPause(reason);
        if (result.success() && config.saveStateOnPause() && isStreaming()) {
            try {
                createCheckpoint();
            } catch (UncheckedIOException ex) {
                LOGGER.error("Failed to checkpoint paused stream", ex);
            }
        }
        return result;
    }

    public ResumeResult resume() {
        return pauseResume.requestResume();
    }

    /**
     * Stops the running stream. The in-progress {@link #stream(Path, StreamOptions)} call returns
     * once the processor has drained.
     */
    public ProcessingSummary stop(String reason) {
        synchronized (lock) {
            stopReason = reason;
        }
        LOGGER.info("Stopping stream: {}", reason);
        ProcessingSummary summary = processor.stop();
        if (pauseResume.isPaused()) {
            pauseResume.requestResume(new ResumeOptions(true));
        }
        return summary;
    }

    public boolean isStreaming() {
        synchronized (lock) {
            return streaming;
        }
    }

    /**
     * Completed lines are counted from the processor's completed chunks, so they are current even
     * before the chunk events have reached this streamer.
     */
    public StreamingProgress getProgress() {
        FileAnalysis analysis;
        boolean active;
        long lines;
        Instant startedAt;
        synchronized (lock) {
            analysis = currentAnalysis;
            active = streaming;
            lines = linesBeforeStart;
            startedAt = streamStart;
        }
        if (analysis != null) {
            List<Chunk> chunks = analysis.chunks();
            for (int index : processor.getCompletedChunks()) {
                // the processor still reports the previous run until this one starts
                if (index < chunks.size()) {
                    lines += chunks.get(index).lineCount();
                }
            }
        }
        long totalLines = analysis == null ? 0 : analysis.totalLines();
        double percent = totalLines == 0 ? 0 : Math.min(100.0, (double) lines / totalLines * 100);
        Duration elapsed = startedAt == null ? Duration.ZERO : Duration.between(startedAt, clock.instant());
        return new StreamingProgress(
                Optional.ofNullable(analysis).map(FileAnalysis::filePath),
                active,
                pauseResume.isPaused(),
                lines,
                totalLines,
                percent,
                elapsed,
                processor.getStatus(),
                memoryManager.getMemoryStatus()
        );
    }

    @Override
    public void close() {
        processor.close();
        pauseResume.close();
        memoryManager.close();
        LOGGER.debug("Chunked file streamer closed");
    }
}
