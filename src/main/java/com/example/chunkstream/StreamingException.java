package com.example.chunkstream;

/**
 * Base exception for streaming engine errors. Domain exceptions extend this class so callers
 * can handle every engine failure in one place.
 */
public class StreamingException extends RuntimeException {

    public StreamingException(String message) {
        super(message);
    }

    public StreamingException(String message, Throwable cause) {
        super(message, cause);
    }
}
