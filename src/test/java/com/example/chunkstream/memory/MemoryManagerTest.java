package com.example.chunkstream.memory;

import com.example.chunkstream.StreamingConfig;
import com.example.chunkstream.event.EventChannel;
import com.example.chunkstream.event.StreamingEvent;
import com.example.chunkstream.event.StreamingEventType;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MemoryManagerTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);

    private final AtomicLong usage = new AtomicLong();
    private final AtomicInteger collections = new AtomicInteger();
    private final List<StreamingEvent> events = new ArrayList<>();

    private MemoryManager manager(StreamingConfig config) {
        EventChannel channel = new EventChannel("MemoryManager", CLOCK);
        channel.addListener(events::add);
        return new MemoryManager(config, channel, usage::get, () -> {
            collections.incrementAndGet();
            return true;
        }, CLOCK);
    }

    private static StreamingConfig.Builder limitedTo(long bytes) {
        return StreamingConfig.builder().maxMemoryUsage(bytes);
    }

    @Test
    void shrinksChunksUnderCriticalPressure() {
        MemoryManager manager = manager(limitedTo(1000).build());
        usage.set(950);

        assertEquals(MemoryPressure.CRITICAL, manager.checkMemoryUsage());
        assertEquals(500, manager.getChunkSizeRecommendation(1000));
        assertEquals(1, collections.get());
        assertEquals(1, manager.getStatistics().garbageCollections());
        assertTrue(manager.getStatistics().lastGcTime().isPresent());
        assertTrue(hasEvent(StreamingEventType.MEMORY_CRITICAL));
        assertTrue(hasEvent(StreamingEventType.MEMORY_OPTIMIZED));
        assertTrue(hasEvent(StreamingEventType.GARBAGE_COLLECTED));
    }

    @Test
    void recommendationNeverGrowsAsUsageRises() {
        MemoryManager manager = manager(limitedTo(1000).enableGarbageCollection(false).build());
        int previous = Integer.MAX_VALUE;
        for (long used = 0; used <= 1000; used += 50) {
            usage.set(used);
            manager.checkMemoryUsage();
            int recommendation = manager.getChunkSizeRecommendation(1000);
            assertTrue(recommendation <= previous, "recommendation grew at usage " + used);
            previous = recommendation;
        }

        usage.set(850);
        manager.checkMemoryUsage();
        assertEquals(750, manager.getChunkSizeRecommendation(1000));
        usage.set(400);
        manager.checkMemoryUsage();
        assertEquals(1250, manager.getChunkSizeRecommendation(1000));
        usage.set(600);
        manager.checkMemoryUsage();
        assertEquals(1000, manager.getChunkSizeRecommendation(1000));
    }

    @Test
    void skipsCollectionWhenDisabled() {
        MemoryManager manager = manager(limitedTo(1000).enableGarbageCollection(false).build());
        usage.set(990);

        manager.checkMemoryUsage();

        assertEquals(0, collections.get());
        assertEquals(1, manager.getStatistics().memoryCriticals());
        assertFalse(hasEvent(StreamingEventType.GARBAGE_COLLECTED));
    }

    @Test
    void unavailableCollectorIsANoOp() {
        MemoryManager manager = new MemoryManager(limitedTo(1000).build(), new EventChannel("MemoryManager"),
                usage::get, GarbageCollector.unavailable(), CLOCK);

        assertFalse(manager.forceGarbageCollection());
        assertEquals(0, manager.getStatistics().garbageCollections());
    }

    @Test
    void detectsSteadyGrowth() {
        MemoryManager manager = manager(limitedTo(10_000).build());
        for (int i = 0; i < 10; i++) {
            usage.set(1000 + i * 100L);
            manager.checkMemoryUsage();
        }

        Optional<MemoryLeakReport> report = manager.detectMemoryLeaks();

        assertTrue(report.isPresent());
        assertEquals(100.0, report.get().growthPercentage());
        assertEquals(900, report.get().recentGrowth());
        assertTrue(hasEvent(StreamingEventType.MEMORY_LEAK_DETECTED));
    }

    @Test
    void flatUsageIsNotALeak() {
        MemoryManager manager = manager(limitedTo(10_000).build());
        usage.set(1000);
        for (int i = 0; i < 10; i++) {
            manager.checkMemoryUsage();
        }

        assertTrue(manager.detectMemoryLeaks().isEmpty());
    }

    @Test
    void trimsHistoryOnOverflow() {
        MemoryManager manager = manager(limitedTo(10_000).build());
        usage.set(10);
        for (int i = 0; i < 101; i++) {
            manager.checkMemoryUsage();
        }

        assertEquals(50, manager.getHistory().size());
    }

    @Test
    void tracksChunkAllocations() {
        MemoryManager manager = manager(limitedTo(1000).build());
        manager.trackChunkMemory("chunk_0", 100);
        manager.trackChunkMemory("chunk_1", 100);
        manager.releaseChunkMemory("chunk_0");
        manager.releaseChunkMemory("chunk_unknown");

        MemoryStatistics statistics = manager.getStatistics();
        assertEquals(2, statistics.totalAllocations());
        assertEquals(1, statistics.totalDeallocations());
        assertEquals(1, statistics.trackedChunks());

        usage.set(500);
        assertTrue(manager.isMemoryAvailable(300));
        assertFalse(manager.isMemoryAvailable(301));
    }

    @Test
    void monitoringStartsAndStopsOnce() {
        MemoryManager manager = manager(limitedTo(1000).build());
        usage.set(200);

        manager.startMonitoring();
        manager.startMonitoring();
        assertTrue(manager.isMonitoring());
        assertEquals(200, manager.getMemoryStatus().baseline());

        manager.close();
        manager.stopMonitoring();
        assertFalse(manager.isMonitoring());
        assertEquals(1, events.stream().filter(e -> e.type() == StreamingEventType.MONITORING_STARTED).count());
        assertEquals(1, events.stream().filter(e -> e.type() == StreamingEventType.MONITORING_STOPPED).count());
    }

    private boolean hasEvent(StreamingEventType type) {
        return events.stream().anyMatch(event -> event.type() == type);
    }
}
