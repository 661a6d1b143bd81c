package com.example.chunkstream.processing;

/**
 * Outcome of sending one line. Failures are data here, never exceptions.
 */
public record LineResult(long lineNumber, String line, boolean success, Object result, String error) {
    public static LineResult sent(long lineNumber, String line, Object result) {
        return new LineResult(lineNumber, line, true, result, null);
    }

    public static LineResult failed(long lineNumber, String line, String error) {
        return new LineResult(lineNumber, line, false, null, error);
    }
}
