package com.example.chunkstream.memory;

import java.time.Instant;

public record MemorySample(Instant timestamp, long usage) {
}
