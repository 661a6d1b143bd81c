package com.example.chunkstream.analysis;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * Cheap description of a source file, produced without reading its content.
 */
public record FileInfo(
        Path filePath,
        String fileName,
        long fileSize,
        Optional<Instant> fileModified,
        boolean accessible,
        Optional<String> error
) {
}
