package com.example.chunkstream.processing;

/**
 * @param startIndex index of the first chunk to process; earlier chunks are treated as already done
 */
public record ProcessingOptions(int startIndex) {
    public ProcessingOptions {
        if (startIndex < 0) {
            throw new IllegalArgumentException("startIndex must not be negative.");
        }
    }

    public static ProcessingOptions defaults() {
        return new ProcessingOptions(0);
    }

    public static ProcessingOptions startingAt(int startIndex) {
        return new ProcessingOptions(startIndex);
    }
}
