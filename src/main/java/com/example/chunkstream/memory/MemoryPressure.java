package com.example.chunkstream.memory;

public enum MemoryPressure {
    NORMAL,
    WARNING,
    CRITICAL;

    public static MemoryPressure classify(double usageFraction, double warningThreshold, double criticalThreshold) {
        if (usageFraction >= criticalThreshold) {
            return CRITICAL;
        }
        if (usageFraction >= warningThreshold) {
            return WARNING;
        }
        return NORMAL;
    }
}
