package com.example.chunkstream.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;

/**
 * Requests a garbage collection pass. Returns {@code false} when the host does not honour explicit
 * requests.
 */
@FunctionalInterface
public interface GarbageCollector {
    boolean collect();

    static GarbageCollector system() {
        boolean disabled = ManagementFactory.getRuntimeMXBean().getInputArguments()
                .contains("-XX:+DisableExplicitGC");
        if (disabled) {
            return unavailable();
        }
        return () -> {
            System.gc();
            return true;
        };
    }

    static GarbageCollector unavailable() {
        Logger logger = LoggerFactory.getLogger(GarbageCollector.class);
        return () -> {
            logger.debug("Explicit garbage collection is disabled on this JVM; skipping request.");
            return false;
        };
    }
}
