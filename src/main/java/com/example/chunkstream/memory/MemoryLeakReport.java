package com.example.chunkstream.memory;

/**
 * Suspected leak: the share of growing consecutive samples (as a percentage) and the bytes gained
 * across the inspected window. A heuristic signal only.
 */
public record MemoryLeakReport(double growthPercentage, long recentGrowth) {
}
