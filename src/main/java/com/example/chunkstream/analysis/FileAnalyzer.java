package com.example.chunkstream.analysis;

import com.example.chunkstream.AnalysisException;
import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Streams a program file once and partitions its kept lines into fixed-size chunks. The file is read
 * through a buffer of {@link StreamingConfig#readBufferSize()} bytes; only the lines of the chunks
 * themselves are retained.
 */
public final class FileAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileAnalyzer.class);
    private static final int PROGRESS_INTERVAL = 10_000;
    private static final int DEADLINE_CHECK_INTERVAL = 1024;
    private static final double DEFAULT_BYTES_PER_SECOND = 1024 * 1024;

    private final StreamingConfig config;
    private final EventChannel events;
    private final Object statsLock = new Object();

    private long totalFiles;
    private long totalLines;
    private long totalBytes;
    private Duration totalAnalysisTime = Duration.ZERO;

    public FileAnalyzer(StreamingConfig config) {
        this(config, new EventChannel("FileAnalyzer"));
    }

    public FileAnalyzer(StreamingConfig config, EventChannel events) {
        this.config = config;
        this.events = events;
    }

    public EventChannel events() {
        return events;
    }

    public FileAnalysis analyze(Path path) {
        return analyze(path, AnalysisOptions.defaults());
    }

    /**
     * Analyzes the file into contiguous chunks.
     *
     * @throws AnalysisException when the file cannot be read or analysis exceeds the configured time limit
     */
    public FileAnalysis analyze(Path path, AnalysisOptions options) {
        long started = System.nanoTime();
        int chunkSize = options.chunkSize().orElse(config.chunkSize());
        LOGGER.debug("Analyzing {} with chunk size {}", path, chunkSize);

        BasicFileAttributes attributes;
        try {
            attributes = Files.readAttributes(path, BasicFileAttributes.class);
        } catch (IOException ex) {
            LOGGER.error("Failed to read attributes for {}", path, ex);
            throw new AnalysisException(path, "file is not accessible", ex);
        }
        if (attributes.isDirectory()) {
            throw new AnalysisException(path, "path is a directory");
        }

        ScanResult scan;
        try (LineReader reader = new LineReader(Files.newInputStream(path), config.readBufferSize())) {
            scan = scan(path, reader, chunkSize, started);
        } catch (IOException ex) {
            LOGGER.error("Failed to read {}", path, ex);
            throw new AnalysisException(path, "read failed", ex);
        }

        if (config.validateChunks()) {
            validateChunks(scan.chunks, scan.keptLines);
        }
        ChunkStatistics statistics = ChunkStatistics.of(scan.chunks, scan.keptLines);
        Duration analysisTime = Duration.ofNanos(System.nanoTime() - started);

        FileAnalysis analysis = new FileAnalysis(
                path,
                attributes.size(),
                attributes.lastModifiedTime().toInstant(),
                scan.keptLines,
                scan.bytesRead,
                scan.chunks,
                scan.metadata,
                statistics,
                analysisTime
        );
        recordStatistics(analysis);

        LOGGER.info("Analyzed {}: {} lines in {} chunks ({} ms)",
                path, analysis.totalLines(), statistics.totalChunks(), analysisTime.toMillis());
        events.publish(StreamingEventType.FILE_ANALYZED, EventChannel.details(
                "filePath", path.toString(),
                "totalLines", analysis.totalLines(),
                "totalChunks", statistics.totalChunks(),
                "analysisTimeMs", analysisTime.toMillis()
        ));
        return analysis;
    }

    private ScanResult scan(Path path, LineReader reader, int chunkSize, long started) throws IOException {
        long deadline = started + config.maxAnalysisTime().toNanos();
        List<Chunk> chunks = new ArrayList<>();
        List<String> pending = new ArrayList<>(Math.min(chunkSize, 4096));
        long pendingStartOffset = 0;
        long pendingEndOffset = 0;
        long kept = 0;
        long skipped = 0;
        long rawLines = 0;

        boolean hasComments = false;
        boolean hasSubPrograms = false;
        int toolChanges = 0;
        int coordinateChanges = 0;

        LineReader.Line line;
        while ((line = reader.readLine()) != null) {
            if (++rawLines % DEADLINE_CHECK_INTERVAL == 0 && System.nanoTime() - deadline > 0) {
                throw new AnalysisException(path, "exceeded maximum analysis time of "
                        + config.maxAnalysisTime().toMillis() + "ms");
            }
            String trimmed = line.content().trim();
            if (shouldSkip(trimmed)) {
                skipped++;
                continue;
            }

            if (config.enableMetadata()) {
                hasComments |= GcodeTokens.hasComment(trimmed);
                String code = GcodeTokens.stripComments(trimmed);
                hasSubPrograms |= GcodeTokens.isSubProgramCall(code);
                if (GcodeTokens.isToolChange(code)) {
                    toolChanges++;
                }
                if (GcodeTokens.isCoordinateSystemChange(code)) {
                    coordinateChanges++;
                }
            }

            if (pending.isEmpty()) {
                pendingStartOffset = line.byteOffset();
            }
            pending.add(line.content());
            pendingEndOffset = line.byteOffset() + line.byteLength();
            kept++;

            if (pending.size() >= chunkSize) {
                chunks.add(Chunk.of(chunks.size(), kept - pending.size() + 1, pending, pendingStartOffset, pendingEndOffset));
                pending = new ArrayList<>(Math.min(chunkSize, 4096));
            }
            if (kept % PROGRESS_INTERVAL == 0) {
                events.publish(StreamingEventType.ANALYSIS_PROGRESS, EventChannel.details(
                        "filePath", path.toString(),
                        "linesProcessed", kept,
                        "bytesProcessed", reader.bytesRead(),
                        "chunksCreated", chunks.size()
                ));
            }
        }
        if (!pending.isEmpty()) {
            chunks.add(Chunk.of(chunks.size(), kept - pending.size() + 1, pending, pendingStartOffset, pendingEndOffset));
        }

        ProgramMetadata metadata = new ProgramMetadata(hasComments, hasSubPrograms, toolChanges, coordinateChanges, skipped);
        return new ScanResult(chunks, kept, reader.bytesRead(), metadata);
    }

    private boolean shouldSkip(String trimmed) {
        if (config.skipEmptyLines() && trimmed.isEmpty()) {
            return true;
        }
        return config.skipComments() && GcodeTokens.isCommentLine(trimmed);
    }

    /**
     * Logs index mismatches, line gaps and inverted ranges. Returns the number of violations found.
     */
    static int validateChunks(List<Chunk> chunks, long totalLines) {
        int violations = 0;
        long expectedStart = 1;
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            if (chunk.index() != i) {
                LOGGER.warn("Chunk index mismatch: expected {}, got {}", i, chunk.index());
                violations++;
            }
            if (chunk.startLine() != expectedStart) {
                LOGGER.warn("Line continuity broken at chunk {}: expected start line {}, got {}",
                        i, expectedStart, chunk.startLine());
                violations++;
            }
            if (chunk.endLine() < chunk.startLine()) {
                LOGGER.warn("Chunk {} has end line {} before start line {}", i, chunk.endLine(), chunk.startLine());
                violations++;
            }
            expectedStart = chunk.endLine() + 1;
        }
        if (!chunks.isEmpty() && expectedStart - 1 != totalLines) {
            LOGGER.warn("Chunks end at line {} but the file has {} lines", expectedStart - 1, totalLines);
            violations++;
        }
        LOGGER.debug("Validated {} chunks with {} violations", chunks.size(), violations);
        return violations;
    }

    /**
     * Describes the file without reading its content. Never throws for inaccessible files.
     */
    public FileInfo describe(Path path) {
        String fileName = path.getFileName() == null ? path.toString() : path.getFileName().toString();
        try {
            BasicFileAttributes attributes = Files.readAttributes(path, BasicFileAttributes.class);
            return new FileInfo(path, fileName, attributes.size(),
                    Optional.of(attributes.lastModifiedTime().toInstant()), true, Optional.empty());
        } catch (IOException ex) {
            LOGGER.warn("Failed to read attributes for {}", path, ex);
            return new FileInfo(path, fileName, 0, Optional.empty(), false, Optional.of(String.valueOf(ex.getMessage())));
        }
    }

    /**
     * Estimates the analysis time of a file from the throughput observed so far, or 1 MiB/s before
     * anything has been analyzed. Inaccessible files estimate to zero.
     */
    public Duration estimateAnalysisTime(Path path) {
        FileInfo info = describe(path);
        if (!info.accessible()) {
            return Duration.ZERO;
        }
        double bytesPerSecond;
        synchronized (statsLock) {
            long millis = totalAnalysisTime.toMillis();
            bytesPerSecond = totalBytes > 0 && millis > 0
                    ? totalBytes / (millis / 1000.0)
                    : DEFAULT_BYTES_PER_SECOND;
        }
        return Duration.ofMillis(Math.round(info.fileSize() / bytesPerSecond * 1000));
    }

    public AnalysisStatistics getStatistics() {
        synchronized (statsLock) {
            Duration average = totalFiles == 0 ? Duration.ZERO : totalAnalysisTime.dividedBy(totalFiles);
            return new AnalysisStatistics(
                    totalFiles,
                    totalLines,
                    totalBytes,
                    totalAnalysisTime,
                    average,
                    totalFiles == 0 ? 0 : Math.round((double) totalLines / totalFiles),
                    totalFiles == 0 ? 0 : Math.round((double) totalBytes / totalFiles)
            );
        }
    }

    public void resetStatistics() {
        synchronized (statsLock) {
            totalFiles = 0;
            totalLines = 0;
            totalBytes = 0;
            totalAnalysisTime = Duration.ZERO;
        }
        LOGGER.debug("Analysis statistics reset");
        events.publish(StreamingEventType.STATISTICS_RESET, EventChannel.details("component", "FileAnalyzer"));
    }

    private void recordStatistics(FileAnalysis analysis) {
        synchronized (statsLock) {
            totalFiles++;
            totalLines += analysis.totalLines();
            totalBytes += analysis.totalBytes();
            totalAnalysisTime = totalAnalysisTime.plus(analysis.analysisTime());
        }
    }

    private record ScanResult(List<Chunk> chunks, long keptLines, long bytesRead, ProgramMetadata metadata) {
    }
}
