package com.example.chunkstream;

import java.nio.file.Path;

/**
 * Thrown when a program file cannot be opened, read or analyzed in time.
 * Fatal to the analysis call.
 */
public class AnalysisException extends StreamingException {

    private final Path filePath;

    public AnalysisException(Path filePath, String message) {
        super("Analysis of " + filePath + " failed: " + message);
        this.filePath = filePath;
    }

    public AnalysisException(Path filePath, String message, Throwable cause) {
        super("Analysis of " + filePath + " failed: " + message, cause);
        this.filePath = filePath;
    }

    public Path getFilePath() {
        return filePath;
    }
}
