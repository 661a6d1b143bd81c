package com.example.chunkstream.processing;

/**
 * Transmits one program line to the controller. Implementations report a failed line by throwing;
 * the message of the exception is recorded with the line.
 */
@FunctionalInterface
public interface StreamingManager {
    Object sendLine(String line, LineContext context) throws Exception;
}
