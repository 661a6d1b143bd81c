package com.example.chunkstream.memory;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryMXBean;

/**
 * Supplies the current memory usage in bytes.
 */
@FunctionalInterface
public interface MemoryUsageSource {
    long currentUsage();

    /**
     * Heap bytes in use, as reported by the platform memory bean.
     */
    static MemoryUsageSource heap() {
        MemoryMXBean bean = ManagementFactory.getMemoryMXBean();
        return () -> bean.getHeapMemoryUsage().getUsed();
    }
}
