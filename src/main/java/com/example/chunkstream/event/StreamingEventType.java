package com.example.chunkstream.event;

/**
 * Every notification the streaming components emit.
 */
public enum StreamingEventType {
    // analysis
    FILE_ANALYZED,
    ANALYSIS_PROGRESS,

    // chunk processing
    CHUNK_STARTED,
    CHUNK_RETRY_STARTED,
    LINE_PROCESSED,
    CHUNK_COMPLETED,
    CHUNK_RETRY_QUEUED,
    CHUNK_FAILED,
    PROCESSING_PAUSED,
    PROCESSING_RESUMED,
    PROCESSING_STOPPED,
    PROCESSING_COMPLETED,

    // memory
    MONITORING_STARTED,
    MONITORING_STOPPED,
    MEMORY_STATUS,
    MEMORY_WARNING,
    MEMORY_CRITICAL,
    MEMORY_OPTIMIZED,
    GARBAGE_COLLECTED,
    MEMORY_LEAK_DETECTED,

    // checkpoints
    CHECKPOINT_CREATED,
    CHECKPOINT_LOADED,
    CHECKPOINT_REMOVED,
    CHECKPOINTS_CLEARED,

    // pause / resume
    PAUSE_REQUESTED,
    PAUSE_EXECUTE,
    STREAM_PAUSED,
    PAUSE_FAILED,
    RESUME_EXECUTE,
    STREAM_RESUMED,
    RESUME_FAILED,
    PAUSE_TIMEOUT_EXCEEDED,

    // facade
    CHUNKED_STREAMING_STARTED,
    CHUNKED_STREAMING_COMPLETED,
    CHUNKED_STREAMING_STOPPED,

    STATISTICS_RESET
}
