package com.example.chunkstream.memory;

import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEventType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Samples memory usage, classifies pressure against the configured ceiling and derives chunk sizing
 * hints from the latest sample. All sampled state is guarded by a single monitor and is only ever
 * mutated here.
 */
public final class MemoryManager implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryManager.class);
    private static final int MAX_HISTORY = 100;
    private static final int TRIMMED_HISTORY = 50;
    private static final int LEAK_WINDOW = 10;
    private static final double LEAK_GROWTH_RATIO = 0.8;
    private static final Duration HISTORY_RETENTION = Duration.ofMinutes(5);
    private static final Duration CHUNK_TRACKING_RETENTION = Duration.ofMinutes(10);
    private static final long MEGABYTE = 1024 * 1024;

    private final StreamingConfig config;
    private final EventChannel events;
    private final MemoryUsageSource usageSource;
    private final GarbageCollector garbageCollector;
    private final Clock clock;
    private final Object lock = new Object();

    private ScheduledExecutorService sampler;
    private long currentUsage;
    private long peakUsage;
    private long baselineUsage;
    private Instant lastGcTime;
    private final List<MemorySample> history = new ArrayList<>();
    private final Map<String, TrackedChunk> chunkMemory = new LinkedHashMap<>();

    private double averageUsage;
    private long memoryWarnings;
    private long memoryCriticals;
    private long optimizationsTriggered;
    private long garbageCollections;
    private long totalAllocations;
    private long totalDeallocations;

    public MemoryManager(StreamingConfig config) {
        this(config, new EventChannel("MemoryManager"), MemoryUsageSource.heap(), GarbageCollector.system(),
                Clock.systemUTC());
    }

    public MemoryManager(StreamingConfig config,
                         EventChannel events,
                         MemoryUsageSource usageSource,
                         GarbageCollector garbageCollector,
                         Clock clock) {
        this.config = config;
        this.events = events;
        this.usageSource = usageSource;
        this.garbageCollector = garbageCollector;
        this.clock = clock;
    }

    public EventChannel events() {
        return events;
    }

    /**
     * Captures the baseline and schedules periodic sampling. Calling it while monitoring is a no-op.
     */
    public void startMonitoring() {
        long baseline;
        synchronized (lock) {
            if (sampler != null) {
                return;
            }
            baseline = usageSource.currentUsage();
            baselineUsage = baseline;
            sampler = Executors.newSingleThreadScheduledExecutor(runnable -> {
                Thread thread = new Thread(runnable, "memory-monitor");
                thread.setDaemon(true);
                return thread;
            });
            long interval = config.monitoringInterval().toMillis();
            sampler.scheduleAtFixedRate(this::sample, interval, interval, TimeUnit.MILLISECONDS);
        }
        LOGGER.info("Memory monitoring started (baseline {} MB, limit {} MB)",
                baseline / MEGABYTE, config.maxMemoryUsage() / MEGABYTE);
        events.publish(StreamingEventType.MONITORING_STARTED, EventChannel.details(
                "baselineUsage", baseline,
                "limit", config.maxMemoryUsage()
        ));
    }

    public void stopMonitoring() {
        long peak;
        double average;
        synchronized (lock) {
            if (sampler == null) {
                return;
            }
            sampler.shutdownNow();
            sampler = null;
            peak = peakUsage;
            average = averageUsage;
        }
        LOGGER.info("Memory monitoring stopped (peak {} MB)", peak / MEGABYTE);
        events.publish(StreamingEventType.MONITORING_STOPPED, EventChannel.details(
                "peakUsage", peak,
                "averageUsage", average
        ));
    }

    public boolean isMonitoring() {
        synchronized (lock) {
            return sampler != null;
        }
    }

    private void sample() {
        try {
            checkMemoryUsage();
            if (config.enableMemoryLeakDetection()) {
                detectMemoryLeaks();
            }
        } catch (RuntimeException ex) {
            LOGGER.warn("Memory sampling failed", ex);
        }
    }

    /**
     * Takes one sample, records it and reacts to the resulting pressure level.
     */
    public MemoryPressure checkMemoryUsage() {
        long usage = usageSource.currentUsage();
        long peak;
        synchronized (lock) {
            currentUsage = usage;
            if (usage > peakUsage) {
                peakUsage = usage;
            }
            history.add(new MemorySample(clock.instant(), usage));
            if (history.size() > MAX_HISTORY) {
                history.subList(0, history.size() - TRIMMED_HISTORY).clear();
            }
            long total = 0;
            for (MemorySample sample : history) {
                total += sample.usage();
            }
            averageUsage = (double) total / history.size();
            peak = peakUsage;
        }

        double fraction = fractionOf(usage);
        MemoryPressure pressure = MemoryPressure.classify(fraction, config.warningThreshold(), config.criticalThreshold());
        if (pressure == MemoryPressure.CRITICAL) {
            handleCritical(usage, fraction);
        } else if (pressure == MemoryPressure.WARNING) {
            handleWarning(usage, fraction);
        }

        events.publish(StreamingEventType.MEMORY_STATUS, EventChannel.details(
                "current", usage,
                "percentage", fraction * 100,
                "peak", peak,
                "limit", config.maxMemoryUsage(),
                "pressure", pressure
        ));
        return pressure;
    }

    private void handleWarning(long usage, double fraction) {
        synchronized (lock) {
            memoryWarnings++;
        }
        LOGGER.warn("Memory usage at {}% of {} MB", String.format("%.1f", fraction * 100),
                config.maxMemoryUsage() / MEGABYTE);
        events.publish(StreamingEventType.MEMORY_WARNING, EventChannel.details(
                "usage", usage,
                "percentage", fraction,
                "limit", config.maxMemoryUsage()
        ));
        if (config.enableMemoryOptimization()) {
            optimizeMemoryUsage(MemoryPressure.WARNING);
        }
    }

    private void handleCritical(long usage, double fraction) {
        synchronized (lock) {
            memoryCriticals++;
        }
        LOGGER.error("Critical memory usage at {}% of {} MB", String.format("%.1f", fraction * 100),
                config.maxMemoryUsage() / MEGABYTE);
        events.publish(StreamingEventType.MEMORY_CRITICAL, EventChannel.details(
                "usage", usage,
                "percentage", fraction,
                "limit", config.maxMemoryUsage()
        ));
        optimizeMemoryUsage(MemoryPressure.CRITICAL);
        if (config.enableGarbageCollection()) {
            forceGarbageCollection();
        }
    }

    /**
     * Prunes history older than five minutes and chunk tracking entries older than ten minutes.
     */
    public void optimizeMemoryUsage(MemoryPressure level) {
        Instant now = clock.instant();
        int prunedChunks = 0;
        synchronized (lock) {
            optimizationsTriggered++;
            Instant historyCutoff = now.minus(HISTORY_RETENTION);
            history.removeIf(sample -> !sample.timestamp().isAfter(historyCutoff));
            Instant chunkCutoff = now.minus(CHUNK_TRACKING_RETENTION);
            Iterator<TrackedChunk> iterator = chunkMemory.values().iterator();
            while (iterator.hasNext()) {
                if (iterator.next().allocatedAt().isBefore(chunkCutoff)) {
                    iterator.remove();
                    prunedChunks++;
                }
            }
        }
        LOGGER.info("Memory optimization ({}) completed, {} stale chunk entries pruned", level, prunedChunks);
        events.publish(StreamingEventType.MEMORY_OPTIMIZED, EventChannel.details(
                "level", level,
                "prunedChunks", prunedChunks,
                "usageAfter", usageSource.currentUsage()
        ));
    }

    /**
     * Asks the collector for a pass. Returns whether the request was honoured.
     */
    public boolean forceGarbageCollection() {
        long before = usageSource.currentUsage();
        boolean collected;
        try {
            collected = garbageCollector.collect();
        } catch (RuntimeException ex) {
            LOGGER.warn("Failed to force garbage collection", ex);
            return false;
        }
        if (!collected) {
            return false;
        }
        long after = usageSource.currentUsage();
        synchronized (lock) {
            lastGcTime = clock.instant();
            garbageCollections++;
        }
        LOGGER.debug("Forced garbage collection freed {} MB", (before - after) / MEGABYTE);
        events.publish(StreamingEventType.GARBAGE_COLLECTED, EventChannel.details(
                "freed", before - after,
                "beforeGc", before,
                "afterGc", after
        ));
        return true;
    }

    public void trackChunkMemory(String chunkId, long bytes) {
        synchronized (lock) {
            chunkMemory.put(chunkId, new TrackedChunk(bytes, clock.instant()));
            totalAllocations++;
        }
        LOGGER.debug("Tracking {} KB for chunk {}", bytes / 1024, chunkId);
    }

    public void releaseChunkMemory(String chunkId) {
        synchronized (lock) {
            if (chunkMemory.remove(chunkId) != null) {
                totalDeallocations++;
            }
        }
    }

    /**
     * Sizing hint derived from the latest sample: shrink by the reduction factor at or above the critical
     * threshold, by a quarter at or above the warning threshold, grow by a quarter below half usage.
     */
    public int getChunkSizeRecommendation(int currentSize) {
        long usage;
        synchronized (lock) {
            usage = currentUsage;
        }
        double fraction = fractionOf(usage);
        if (fraction >= config.criticalThreshold()) {
            return (int) Math.floor(currentSize * config.chunkSizeReduction());
        }
        if (fraction >= config.warningThreshold()) {
            return (int) Math.floor(currentSize * 0.75);
        }
        if (fraction < 0.5) {
            return (int) Math.floor(currentSize * 1.25);
        }
        return currentSize;
    }

    public boolean isMemoryAvailable(long requiredBytes) {
        long projected = usageSource.currentUsage() + requiredBytes;
        return projected <= config.maxMemoryUsage() * config.warningThreshold();
    }

    /**
     * Looks at the last ten samples; if usage grew in more than 80% of consecutive pairs a leak is
     * suspected. Only warns.
     */
    public Optional<MemoryLeakReport> detectMemoryLeaks() {
        if (!config.enableMemoryLeakDetection()) {
            return Optional.empty();
        }
        List<MemorySample> window;
        synchronized (lock) {
            if (history.size() < LEAK_WINDOW) {
                return Optional.empty();
            }
            window = new ArrayList<>(history.subList(history.size() - LEAK_WINDOW, history.size()));
        }
        int growing = 0;
        for (int i = 1; i < window.size(); i++) {
            if (window.get(i).usage() > window.get(i - 1).usage()) {
                growing++;
            }
        }
        double ratio = (double) growing / (window.size() - 1);
        if (ratio <= LEAK_GROWTH_RATIO) {
            return Optional.empty();
        }
        long growth = window.get(window.size() - 1).usage() - window.get(0).usage();
        MemoryLeakReport report = new MemoryLeakReport(ratio * 100, growth);
        LOGGER.warn("Potential memory leak: usage grew in {}% of recent samples (+{} MB)",
                String.format("%.1f", report.growthPercentage()), growth / MEGABYTE);
        events.publish(StreamingEventType.MEMORY_LEAK_DETECTED, EventChannel.details(
                "growthPercentage", report.growthPercentage(),
                "recentGrowth", report.recentGrowth()
        ));
        return Optional.of(report);
    }

    public MemoryStatus getMemoryStatus() {
        long usage = usageSource.currentUsage();
        double fraction = fractionOf(usage);
        synchronized (lock) {
            return new MemoryStatus(
                    usage,
                    peakUsage,
                    baselineUsage,
                    fraction * 100,
                    config.maxMemoryUsage(),
                    config.maxMemoryUsage() - usage,
                    MemoryPressure.classify(fraction, config.warningThreshold(), config.criticalThreshold()),
                    chunkMemory.size(),
                    sampler != null
            );
        }
    }

    public MemoryStatistics getStatistics() {
        synchronized (lock) {
            return new MemoryStatistics(
                    currentUsage,
                    peakUsage,
                    baselineUsage,
                    averageUsage,
                    memoryWarnings,
                    memoryCriticals,
                    optimizationsTriggered,
                    garbageCollections,
                    totalAllocations,
                    totalDeallocations,
                    chunkMemory.size(),
                    history.size(),
                    Optional.ofNullable(lastGcTime)
            );
        }
    }

    public List<MemorySample> getHistory() {
        synchronized (lock) {
            return List.copyOf(history);
        }
    }

    public void resetStatistics() {
        synchronized (lock) {
            averageUsage = 0;
            memoryWarnings = 0;
            memoryCriticals = 0;
            optimizationsTriggered = 0;
            garbageCollections = 0;
            totalAllocations = 0;
            totalDeallocations = 0;
            history.clear();
            chunkMemory.clear();
        }
        LOGGER.debug("Memory statistics reset");
        events.publish(StreamingEventType.STATISTICS_RESET, EventChannel.details("component", "MemoryManager"));
    }

    @Override
    public void close() {
        stopMonitoring();
        synchronized (lock) {
            history.clear();
            chunkMemory.clear();
        }
    }

    private double fractionOf(long usage) {
        return (double) usage / config.maxMemoryUsage();
    }

    private record TrackedChunk(long bytes, Instant allocatedAt) {
    }
}
