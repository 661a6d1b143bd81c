package com.example.chunkstream.processing;

import com.example.chunkstream.ChunkExecutionException;
import com.example.chunkstream.ChunkTimeoutException;
import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.StreamingException;
import com.example.chunkstream.analysis.Chunk;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEventType;
import com.example.chunkstream.pause.PauseParticipant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends analyzed chunks line by line through a {@link StreamingManager}, with at most
 * {@link StreamingConfig#maxConcurrentChunks()} chunks in flight. Failed or timed out chunks are
 * requeued up to {@link StreamingConfig#maxChunkRetries()} times before they are recorded as
 * permanently failed.
 *
 * <p>All scheduling state is guarded by one monitor. The dispatcher runs on the thread that calls
 * {@link #startProcessing(List, ProcessingOptions)} and sleeps on that monitor until a chunk
 * finishes, times out, or the processor is paused, resumed or stopped. Events, line events
 * included, are queued under the monitor and delivered outside it in the order they were queued,
 * by one thread at a time. A thread that finds delivery already in progress leaves its events to
 * the delivering thread, so listeners may call back into the processor. The chunk timeout starts
 * when a worker picks the attempt up, not when it is queued.
 */
public final class ChunkProcessor implements PauseParticipant, AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkProcessor.class);
    private static final double HIGH_LINE_FAILURE_RATE = 0.1;

    private final StreamingConfig config;
    private final StreamingManager streamingManager;
    private final EventChannel events;
    private final Clock clock;
    private final ExecutorService workers;
    private final ScheduledExecutorService timers;

    private final Object stateLock = new Object();
    private final ReentrantLock publishLock = new ReentrantLock();
    private final Deque<Chunk> chunkQueue = new ArrayDeque<>();
    private final Deque<Chunk> retryQueue = new ArrayDeque<>();
    private final Map<Integer, ChunkAttempt> activeChunks = new LinkedHashMap<>();
    private final SortedSet<Integer> completedChunks = new TreeSet<>();
    private final SortedSet<Integer> permanentlyFailed = new TreeSet<>();
    private final Map<Integer, Integer> retryCounts = new HashMap<>();
    private final Map<Integer, List<RetryAttempt>> failureHistory = new TreeMap<>();
    private final List<CompletableFuture<Void>> idleWaiters = new ArrayList<>();
    private final List<CompletableFuture<Void>> settledWaiters = new ArrayList<>();
    private final List<PendingEvent> pendingEvents = new ArrayList<>();

    private boolean processing;
    private boolean paused;
    private boolean stopped;
    private boolean closed;
    private int startIndex;
    private int currentChunkIndex;
    private int totalChunks;
    private int processedChunks;
    private int failedChunks;
    private Instant startTime;

    private long chunksProcessed;
    private long chunksSuccessful;
    private long chunksFailed;
    private long chunksRetried;
    private Duration totalChunkTime = Duration.ZERO;
    private int maxConcurrentReached;
    private final AtomicLong linesSent = new AtomicLong();
    private final AtomicLong linesFailed = new AtomicLong();

    public ChunkProcessor(StreamingConfig config, StreamingManager streamingManager) {
        this(config, streamingManager, new EventChannel("ChunkProcessor"), Clock.systemUTC());
    }

    public ChunkProcessor(StreamingConfig config, StreamingManager streamingManager, EventChannel events, Clock clock) {
        if (streamingManager == null) {
            throw new IllegalArgumentException("ChunkProcessor requires a StreamingManager");
        }
        this.config = config;
        this.streamingManager = streamingManager;
        this.events = events;
        this.clock = clock;
        this.workers = Executors.newFixedThreadPool(config.maxConcurrentChunks(), daemonThreads("chunk-worker"));
        this.timers = Executors.newSingleThreadScheduledExecutor(daemonThreads("chunk-timeout"));
    }

    public EventChannel events() {
        return events;
    }

    /**
     * Processes {@code chunks} from {@code options.startIndex()} onwards and blocks until every chunk
     * has completed or permanently failed, or until {@link #stop()} is called.
     *
     * @throws IllegalStateException when processing is already running or the processor is closed
     * @throws IllegalArgumentException when the start index lies beyond the chunk list
     */
    public ProcessingSummary startProcessing(List<Chunk> chunks, ProcessingOptions options) {
        synchronized (stateLock) {
            if (closed) {
                throw new IllegalStateException("Chunk processor is closed");
            }
            if (processing) {
                throw new IllegalStateException("Chunk processing already in progress");
            }
            if (options.startIndex() > chunks.size()) {
                throw new IllegalArgumentException("Start index " + options.startIndex()
                        + " is beyond the last chunk (" + chunks.size() + " chunks)");
            }
            processing = true;
            paused = false;
            stopped = false;
            startIndex = options.startIndex();
            currentChunkIndex = startIndex;
            totalChunks = chunks.size();
            processedChunks = 0;
            failedChunks = 0;
            startTime = clock.instant();
            chunkQueue.clear();
            chunkQueue.addAll(chunks.subList(startIndex, chunks.size()));
            retryQueue.clear();
            activeChunks.clear();
            completedChunks.clear();
            permanentlyFailed.clear();
            retryCounts.clear();
            failureHistory.clear();
        }
        LOGGER.info("Processing {} chunks starting at index {} (max {} concurrent)",
                chunks.size() - options.startIndex(), options.startIndex(), config.maxConcurrentChunks());

        try {
            runDispatchLoop();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            LOGGER.warn("Interrupted while processing chunks, stopping");
            stop();
        }

        ProcessingSummary summary;
        synchronized (stateLock) {
            processing = false;
            paused = false;
            completeIdleWaiters();
            summary = summaryLocked();
        }
        awaitEventDelivery();
        if (!summary.stopped()) {
            LOGGER.info("Chunk processing completed: {} processed, {} failed of {} in {} ms",
                    summary.processedChunks(), summary.failedChunks(), summary.totalChunks(),
                    summary.processingTime().toMillis());
            events.publish(StreamingEventType.PROCESSING_COMPLETED, EventChannel.details(
                    "totalChunks", summary.totalChunks(),
                    "processedChunks", summary.processedChunks(),
                    "failedChunks", summary.failedChunks(),
                    "processingTimeMs", summary.processingTime().toMillis()
            ));
        }
        return summary;
    }

    private void runDispatchLoop() throws InterruptedException {
        while (true) {
            flushEvents();
            synchronized (stateLock) {
                if (stopped) {
                    break;
                }
                if (!paused && activeChunks.size() < config.maxConcurrentChunks()) {
                    Chunk next = chunkQueue.pollFirst();
                    boolean retry = false;
                    if (next == null && config.retryFailedChunks()) {
                        next = retryQueue.pollFirst();
                        retry = next != null;
                    }
                    if (next != null) {
                        dispatch(next, retry);
                        continue;
                    }
                }
                if (chunkQueue.isEmpty() && retryQueue.isEmpty() && activeChunks.isEmpty()) {
                    break;
                }
                stateLock.wait();
            }
        }
    }

    // caller holds stateLock
    private void dispatch(Chunk chunk, boolean retry) {
        int attemptNumber = retryCounts.getOrDefault(chunk.index(), 0) + 1;
        ChunkAttempt attempt = new ChunkAttempt(chunk, attemptNumber);
        activeChunks.put(chunk.index(), attempt);
        maxConcurrentReached = Math.max(maxConcurrentReached, activeChunks.size());
        if (retry) {
            chunksRetried++;
        }
        attempt.future = workers.submit(() -> runAttempt(attempt));

        LOGGER.debug("Dispatched chunk {} (attempt {})", chunk.index(), attemptNumber);
        publishLater(retry ? StreamingEventType.CHUNK_RETRY_STARTED : StreamingEventType.CHUNK_STARTED,
                EventChannel.details(
                        "chunkIndex", chunk.index(),
                        "attempt", attemptNumber,
                        "lineCount", chunk.lineCount(),
                        "byteLength", chunk.byteLength()
                ));
    }

    private void runAttempt(ChunkAttempt attempt) {
        synchronized (stateLock) {
            if (activeChunks.get(attempt.chunk.index()) != attempt) {
                return;
            }
            attempt.started();
            attempt.timer = timers.schedule(() -> onTimeout(attempt),
                    config.chunkTimeout().toMillis(), TimeUnit.MILLISECONDS);
        }
        flushEvents();
        Chunk chunk = attempt.chunk;
        List<String> lines = chunk.lines();
        List<LineResult> results = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            if (attempt.cancelled || Thread.currentThread().isInterrupted()) {
                break;
            }
            String line = lines.get(i);
            long lineNumber = chunk.startLine() + i;
            LineContext context = new LineContext(lineNumber, chunk.index(), i == lines.size() - 1);
            try {
                Object result = streamingManager.sendLine(line, context);
                results.add(LineResult.sent(lineNumber, line, result));
                linesSent.incrementAndGet();
                synchronized (stateLock) {
                    publishLater(StreamingEventType.LINE_PROCESSED, EventChannel.details(
                            "chunkIndex", chunk.index(),
                            "lineNumber", lineNumber,
                            "result", result
                    ));
                }
                flushEvents();
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception ex) {
                String message = ex.getMessage() == null ? ex.getClass().getSimpleName() : ex.getMessage();
                results.add(LineResult.failed(lineNumber, line, message));
                linesFailed.incrementAndGet();
                LOGGER.warn("Line {} of chunk {} failed: {}", lineNumber, chunk.index(), message);
            }
        }
        finishAttempt(attempt, results);
        flushEvents();
    }

    private void finishAttempt(ChunkAttempt attempt, List<LineResult> results) {
        Chunk chunk = attempt.chunk;
        synchronized (stateLock) {
            if (activeChunks.get(chunk.index()) != attempt) {
                // timed out or stopped while the worker was still sending
                return;
            }
            activeChunks.remove(chunk.index());
            attempt.timer.cancel(false);

            int failed = 0;
            String firstError = null;
            for (LineResult result : results) {
                if (!result.success()) {
                    failed++;
                    if (firstError == null) {
                        firstError = result.error();
                    }
                }
            }
            if (results.size() < chunk.lineCount()) {
                recordFailure(attempt, new ChunkExecutionException(chunk.index(),
                        "interrupted after " + results.size() + " of " + chunk.lineCount() + " lines", null));
            } else if ((double) failed / chunk.lineCount() > config.maxLineFailureRatio()) {
                recordFailure(attempt, new ChunkExecutionException(chunk.index(), failed, chunk.lineCount(), firstError));
            } else {
                recordSuccess(attempt, results, failed);
            }
            stateLock.notifyAll();
        }
    }

    private void onTimeout(ChunkAttempt attempt) {
        synchronized (stateLock) {
            if (activeChunks.get(attempt.chunk.index()) != attempt) {
                return;
            }
            activeChunks.remove(attempt.chunk.index());
            attempt.cancelled = true;
            attempt.future.cancel(true);
            LOGGER.warn("Chunk {} timed out after {} ms", attempt.chunk.index(), config.chunkTimeout().toMillis());
            recordFailure(attempt, new ChunkTimeoutException(attempt.chunk.index(), config.chunkTimeout()));
            stateLock.notifyAll();
        }
        flushEvents();
    }

    // caller holds stateLock
    private void recordSuccess(ChunkAttempt attempt, List<LineResult> results, int failedLines) {
        Chunk chunk = attempt.chunk;
        Duration elapsed = attempt.elapsed();
        completedChunks.add(chunk.index());
        processedChunks++;
        currentChunkIndex = Math.max(currentChunkIndex, chunk.index() + 1);
        chunksProcessed++;
        chunksSuccessful++;
        totalChunkTime = totalChunkTime.plus(elapsed);

        if (config.validateChunkCompletion()) {
            validateCompletion(chunk, results, failedLines);
        }
        LOGGER.debug("Chunk {} completed: {} lines in {} ms", chunk.index(), chunk.lineCount(), elapsed.toMillis());
        publishLater(StreamingEventType.CHUNK_COMPLETED, EventChannel.details(
                "chunkIndex", chunk.index(),
                "lineCount", chunk.lineCount(),
                "failedLines", failedLines,
                "attempt", attempt.number,
                "byteLength", chunk.byteLength(),
                "processingTimeMs", elapsed.toMillis()
        ));
        completeIdleWaitersIfIdle();
    }

    // caller holds stateLock
    private void recordFailure(ChunkAttempt attempt, StreamingException error) {
        Chunk chunk = attempt.chunk;
        int index = chunk.index();
        chunksProcessed++;
        chunksFailed++;
        totalChunkTime = totalChunkTime.plus(attempt.elapsed());
        failureHistory.computeIfAbsent(index, k -> new ArrayList<>())
                .add(new RetryAttempt(index, attempt.number, clock.instant(), error.getMessage()));

        int retries = retryCounts.getOrDefault(index, 0);
        if (config.retryFailedChunks() && retries < config.maxChunkRetries()) {
            retryCounts.put(index, retries + 1);
            retryQueue.addLast(chunk);
            LOGGER.warn("Chunk {} failed on attempt {}, queued retry {}/{}: {}",
                    index, attempt.number, retries + 1, config.maxChunkRetries(), error.getMessage());
            publishLater(StreamingEventType.CHUNK_RETRY_QUEUED, EventChannel.details(
                    "chunkIndex", index,
                    "retryCount", retries + 1,
                    "error", error.getMessage()
            ));
        } else {
            permanentlyFailed.add(index);
            failedChunks++;
            LOGGER.error("Chunk {} failed permanently after {} retries: {}", index, retries, error.getMessage());
            publishLater(StreamingEventType.CHUNK_FAILED, EventChannel.details(
                    "chunkIndex", index,
                    "retryCount", retries,
                    "byteLength", chunk.byteLength(),
                    "error", error.getMessage()
            ));
        }
        completeIdleWaitersIfIdle();
    }

    private static void validateCompletion(Chunk chunk, List<LineResult> results, int failedLines) {
        if (results.size() != chunk.lineCount()) {
            LOGGER.warn("Chunk {} line count mismatch: expected {}, got {}",
                    chunk.index(), chunk.lineCount(), results.size());
        }
        if ((double) failedLines / chunk.lineCount() > HIGH_LINE_FAILURE_RATE) {
            LOGGER.warn("Chunk {} completed with a high line failure rate: {} of {} lines failed",
                    chunk.index(), failedLines, chunk.lineCount());
        }
    }

    public boolean pause() {
        synchronized (stateLock) {
            if (!processing || paused || stopped) {
                return false;
            }
            paused = true;
            publishLater(StreamingEventType.PROCESSING_PAUSED, EventChannel.details(
                    "currentChunk", currentChunkIndex,
                    "activeChunks", activeChunks.size(),
                    "remainingChunks", chunkQueue.size() + retryQueue.size()
            ));
        }
        LOGGER.info("Chunk processing paused");
        flushEvents();
        return true;
    }

    public boolean resume() {
        synchronized (stateLock) {
            if (!processing || !paused) {
                return false;
            }
            paused = false;
            stateLock.notifyAll();
            publishLater(StreamingEventType.PROCESSING_RESUMED, EventChannel.details(
                    "currentChunk", currentChunkIndex,
                    "remainingChunks", chunkQueue.size() + retryQueue.size()
            ));
        }
        LOGGER.info("Chunk processing resumed");
        flushEvents();
        return true;
    }

    /**
     * Cancels in-flight attempts, discards everything still queued and makes the running
     * {@link #startProcessing(List, ProcessingOptions)} call return.
     */
    public ProcessingSummary stop() {
        ProcessingSummary summary;
        synchronized (stateLock) {
            if (!processing || stopped) {
                return summaryLocked();
            }
            stopped = true;
            paused = false;
            for (ChunkAttempt attempt : activeChunks.values()) {
                attempt.cancelled = true;
                if (attempt.timer != null) {
                    attempt.timer.cancel(false);
                }
                attempt.future.cancel(true);
            }
            activeChunks.clear();
            chunkQueue.clear();
            retryQueue.clear();
            completeIdleWaiters();
            summary = summaryLocked();
            publishLater(StreamingEventType.PROCESSING_STOPPED, EventChannel.details(
                    "processedChunks", summary.processedChunks(),
                    "failedChunks", summary.failedChunks(),
                    "totalChunks", summary.totalChunks()
            ));
            stateLock.notifyAll();
        }
        LOGGER.info("Chunk processing stopped: {} processed, {} failed of {}",
                summary.processedChunks(), summary.failedChunks(), summary.totalChunks());
        flushEvents();
        return summary;
    }

    @Override
    public CompletableFuture<Void> prepareForPause(String reason) {
        pause();
        synchronized (stateLock) {
            if (activeChunks.isEmpty()) {
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> idle = new CompletableFuture<>();
            idleWaiters.add(idle);
            return idle;
        }
    }

    @Override
    public void onPause(String reason) {
        pause();
    }

    @Override
    public void onResume() {
        resume();
    }

    @Override
    public Map<String, Object> captureState() {
        synchronized (stateLock) {
            Map<String, Object> state = new LinkedHashMap<>();
            state.put("currentChunkIndex", currentChunkIndex);
            state.put("nextUnprocessedChunk", nextUnprocessedIndexLocked());
            state.put("totalChunks", totalChunks);
            state.put("processedChunks", processedChunks);
            state.put("failedChunks", failedChunks);
            return state;
        }
    }

    /**
     * Lowest chunk index at or after the start index that has not completed. Everything below it is
     * done, which makes it a safe point to resume from.
     */
    public int nextUnprocessedIndex() {
        synchronized (stateLock) {
            return nextUnprocessedIndexLocked();
        }
    }

    private int nextUnprocessedIndexLocked() {
        int index = startIndex;
        while (index < totalChunks && completedChunks.contains(index)) {
            index++;
        }
        return index;
    }

    public boolean isProcessing() {
        synchronized (stateLock) {
            return processing;
        }
    }

    public boolean isPaused() {
        synchronized (stateLock) {
            return paused;
        }
    }

    public int getRetryCount(int chunkIndex) {
        synchronized (stateLock) {
            return retryCounts.getOrDefault(chunkIndex, 0);
        }
    }

    public List<Integer> getCompletedChunks() {
        synchronized (stateLock) {
            return List.copyOf(completedChunks);
        }
    }

    public List<FailedChunkRecord> getFailedChunks() {
        synchronized (stateLock) {
            List<FailedChunkRecord> records = new ArrayList<>();
            for (Map.Entry<Integer, List<RetryAttempt>> entry : failureHistory.entrySet()) {
                List<RetryAttempt> attempts = entry.getValue();
                RetryAttempt last = attempts.get(attempts.size() - 1);
                records.add(new FailedChunkRecord(
                        entry.getKey(),
                        attempts.size(),
                        config.maxChunkRetries(),
                        last.getTimestamp(),
                        last.getError(),
                        permanentlyFailed.contains(entry.getKey()),
                        attempts
                ));
            }
            return records;
        }
    }

    public ProcessingState getState() {
        synchronized (stateLock) {
            return new ProcessingState(processing, paused, currentChunkIndex, totalChunks,
                    processedChunks, failedChunks, startTime);
        }
    }

    public ProcessingStatus getStatus() {
        synchronized (stateLock) {
            int remaining = totalChunks - startIndex;
            double progress = remaining <= 0 ? 0 : (double) (processedChunks + failedChunks) / remaining * 100;
            return new ProcessingStatus(
                    processing,
                    paused,
                    currentChunkIndex,
                    totalChunks,
                    processedChunks,
                    failedChunks,
                    activeChunks.size(),
                    chunkQueue.size(),
                    retryQueue.size(),
                    progress
            );
        }
    }

    public ProcessingMetrics getMetrics() {
        synchronized (stateLock) {
            double processed = chunksProcessed;
            return new ProcessingMetrics(
                    chunksProcessed,
                    chunksSuccessful,
                    chunksFailed,
                    chunksRetried,
                    linesSent.get(),
                    linesFailed.get(),
                    chunksProcessed == 0 ? 0 : chunksSuccessful / processed * 100,
                    chunksProcessed == 0 ? 0 : chunksFailed / processed * 100,
                    chunksProcessed == 0 ? 0 : chunksRetried / processed * 100,
                    chunksProcessed == 0 ? Duration.ZERO : totalChunkTime.dividedBy(chunksProcessed),
                    totalChunkTime,
                    maxConcurrentReached
            );
        }
    }

    /**
     * Zeroes the metric counters. Completion and failure history are kept while processing runs.
     */
    public void resetStatistics() {
        synchronized (stateLock) {
            chunksProcessed = 0;
            chunksSuccessful = 0;
            chunksFailed = 0;
            chunksRetried = 0;
            totalChunkTime = Duration.ZERO;
            maxConcurrentReached = 0;
            linesSent.set(0);
            linesFailed.set(0);
            if (!processing) {
                completedChunks.clear();
                permanentlyFailed.clear();
                retryCounts.clear();
                failureHistory.clear();
            }
        }
        LOGGER.debug("Chunk processing statistics reset");
        events.publish(StreamingEventType.STATISTICS_RESET, EventChannel.details("component", "ChunkProcessor"));
    }

    @Override
    public void close() {
        stop();
        synchronized (stateLock) {
            closed = true;
        }
        workers.shutdownNow();
        timers.shutdownNow();
        LOGGER.debug("Chunk processor closed");
    }

    // caller holds stateLock
    private ProcessingSummary summaryLocked() {
        Duration elapsed = startTime == null ? Duration.ZERO : Duration.between(startTime, clock.instant());
        return new ProcessingSummary(
                totalChunks,
                processedChunks,
                failedChunks,
                stopped,
                elapsed,
                List.copyOf(completedChunks),
                List.copyOf(permanentlyFailed)
        );
    }

    // caller holds stateLock
    private void completeIdleWaitersIfIdle() {
        if (activeChunks.isEmpty()) {
            completeIdleWaiters();
        }
    }

    // caller holds stateLock; waiters complete on the next flush, outside the monitor
    private void completeIdleWaiters() {
        settledWaiters.addAll(idleWaiters);
        idleWaiters.clear();
    }

    // caller holds stateLock
    private void publishLater(StreamingEventType type, Map<String, Object> details) {
        pendingEvents.add(new PendingEvent(type, details));
    }

    private void flushEvents() {
        completeSettledWaiters();
        while (publishLock.tryLock()) {
            try {
                deliverPendingEvents();
            } finally {
                publishLock.unlock();
            }
            synchronized (stateLock) {
                if (pendingEvents.isEmpty()) {
                    return;
                }
            }
        }
    }

    // blocks until a delivery running on another thread has finished, then delivers the rest
    private void awaitEventDelivery() {
        completeSettledWaiters();
        publishLock.lock();
        try {
            deliverPendingEvents();
        } finally {
            publishLock.unlock();
        }
    }

    private void completeSettledWaiters() {
        List<CompletableFuture<Void>> settled;
        synchronized (stateLock) {
            if (settledWaiters.isEmpty()) {
                return;
            }
            settled = new ArrayList<>(settledWaiters);
            settledWaiters.clear();
        }
        for (CompletableFuture<Void> waiter : settled) {
            waiter.complete(null);
        }
    }

    // caller holds publishLock
    private void deliverPendingEvents() {
        while (true) {
            List<PendingEvent> batch;
            synchronized (stateLock) {
                if (pendingEvents.isEmpty()) {
                    return;
                }
                batch = new ArrayList<>(pendingEvents);
                pendingEvents.clear();
            }
            for (PendingEvent event : batch) {
                events.publish(event.type(), event.details());
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private record PendingEvent(StreamingEventType type, Map<String, Object> details) {
    }

    private static final class ChunkAttempt {
        private final Chunk chunk;
        private final int number;
        private long startNanos = System.nanoTime();
        private volatile boolean cancelled;
        private Future<?> future;
        private ScheduledFuture<?> timer;

        private ChunkAttempt(Chunk chunk, int number) {
            this.chunk = chunk;
            this.number = number;
        }

        // caller holds stateLock
        private void started() {
            startNanos = System.nanoTime();
        }

        private Duration elapsed() {
            return Duration.ofNanos(System.nanoTime() - startNanos);
        }
    }
}
