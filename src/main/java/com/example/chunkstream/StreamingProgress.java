package com.example.chunkstream;

import com.example.chunkstream.memory.MemoryStatus;
import com.example.chunkstream.processing.ProcessingStatus;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Optional;

public record StreamingProgress(
        Optional<Path> filePath,
        boolean streaming,
        boolean paused,
        long completedLines,
        long totalLines,
        double percentComplete,
        Duration elapsed,
        ProcessingStatus processing,
        MemoryStatus memory
) {
}
