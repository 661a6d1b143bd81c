package com.example.chunkstream;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Immutable runtime settings for the streaming engine. Built once at startup (usually through
 * {@link ConfigLoader}) and shared by reference between the components.
 */
public record StreamingConfig(
        // analysis
        int chunkSize,
        int readBufferSize,
        boolean skipEmptyLines,
        boolean skipComments,
        boolean enableMetadata,
        boolean validateChunks,
        Duration maxAnalysisTime,
        // chunk processing
        int maxConcurrentChunks,
        boolean retryFailedChunks,
        int maxChunkRetries,
        Duration chunkTimeout,
        boolean validateChunkCompletion,
        double maxLineFailureRatio,
        // memory
        long maxMemoryUsage,
        double warningThreshold,
        double criticalThreshold,
        Duration monitoringInterval,
        boolean enableGarbageCollection,
        double chunkSizeReduction,
        boolean enableMemoryOptimization,
        boolean enableMemoryLeakDetection,
        // checkpoints
        boolean enableCheckpointing,
        long checkpointInterval,
        Path checkpointDirectory,
        int maxCheckpoints,
        boolean compressionEnabled,
        boolean validateChecksums,
        boolean autoCleanup,
        int retentionDays,
        // pause / resume
        boolean enablePauseResume,
        boolean enableGracefulPause,
        Duration pauseTimeout,
        Duration maxPauseDuration,
        boolean saveStateOnPause,
        boolean validateStateOnResume,
        // facade
        boolean resumeFromCheckpoint,
        boolean adaptiveChunkSizing
) {
    public StreamingConfig {
        requirePositive(chunkSize, "chunkSize");
        requirePositive(readBufferSize, "readBufferSize");
        requirePositive(maxConcurrentChunks, "maxConcurrentChunks");
        requirePositive(maxCheckpoints, "maxCheckpoints");
        requirePositive(retentionDays, "retentionDays");
        if (maxChunkRetries < 0) {
            throw new IllegalArgumentException("maxChunkRetries must not be negative.");
        }
        if (maxMemoryUsage <= 0) {
            throw new IllegalArgumentException("maxMemoryUsage must be positive.");
        }
        if (checkpointInterval <= 0) {
            throw new IllegalArgumentException("checkpointInterval must be positive.");
        }
        requireFraction(warningThreshold, "warningThreshold");
        requireFraction(criticalThreshold, "criticalThreshold");
        requireFraction(chunkSizeReduction, "chunkSizeReduction");
        if (warningThreshold > criticalThreshold) {
            throw new IllegalArgumentException("warningThreshold must not exceed criticalThreshold.");
        }
        if (maxLineFailureRatio < 0 || maxLineFailureRatio > 1) {
            throw new IllegalArgumentException("maxLineFailureRatio must be within [0, 1].");
        }
        requirePositive(maxAnalysisTime, "maxAnalysisTime");
        requirePositive(chunkTimeout, "chunkTimeout");
        requirePositive(monitoringInterval, "monitoringInterval");
        requirePositive(pauseTimeout, "pauseTimeout");
        if (maxPauseDuration == null || maxPauseDuration.isNegative()) {
            throw new IllegalArgumentException("maxPauseDuration must not be negative.");
        }
        if (checkpointDirectory == null) {
            throw new IllegalArgumentException("checkpointDirectory is required.");
        }
    }

    public static StreamingConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    private static void requirePositive(int value, String name) {
        if (value <= 0) {
            throw new IllegalArgumentException(name + " must be positive.");
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be a positive duration.");
        }
    }

    private static void requireFraction(double value, String name) {
        if (value <= 0 || value > 1) {
            throw new IllegalArgumentException(name + " must be within (0, 1].");
        }
    }

    /**
     * Mutable builder seeded with the engine defaults.
     */
    public static final class Builder {
        private int chunkSize = 1000;
        private int readBufferSize = 64 * 1024;
        private boolean skipEmptyLines = true;
        private boolean skipComments = true;
        private boolean enableMetadata = true;
        private boolean validateChunks = true;
        private Duration maxAnalysisTime = Duration.ofSeconds(30);
        private int maxConcurrentChunks = 1;
        private boolean retryFailedChunks = true;
        private int maxChunkRetries = 3;
        private Duration chunkTimeout = Duration.ofSeconds(30);
        private boolean validateChunkCompletion = true;
        private double maxLineFailureRatio = 0.0;
        private long maxMemoryUsage = Runtime.getRuntime().maxMemory();
        private double warningThreshold = 0.8;
        private double criticalThreshold = 0.9;
        private Duration monitoringInterval = Duration.ofSeconds(1);
        private boolean enableGarbageCollection = true;
        private double chunkSizeReduction = 0.5;
        private boolean enableMemoryOptimization = true;
        private boolean enableMemoryLeakDetection = true;
        private boolean enableCheckpointing = true;
        private long checkpointInterval = 5000;
        private Path checkpointDirectory = Path.of(".checkpoints");
        private int maxCheckpoints = 10;
        private boolean compressionEnabled = false;
        private boolean validateChecksums = true;
        private boolean autoCleanup = true;
        private int retentionDays = 7;
        private boolean enablePauseResume = true;
        private boolean enableGracefulPause = true;
        private Duration pauseTimeout = Duration.ofSeconds(5);
        private Duration maxPauseDuration = Duration.ofMinutes(5);
        private boolean saveStateOnPause = true;
        private boolean validateStateOnResume = true;
        private boolean resumeFromCheckpoint = true;
        private boolean adaptiveChunkSizing = false;

        private Builder() {
        }

        private Builder(StreamingConfig config) {
            chunkSize = config.chunkSize;
            readBufferSize = config.readBufferSize;
            skipEmptyLines = config.skipEmptyLines;
            skipComments = config.skipComments;
            enableMetadata = config.enableMetadata;
            validateChunks = config.validateChunks;
            maxAnalysisTime = config.maxAnalysisTime;
            maxConcurrentChunks = config.maxConcurrentChunks;
            retryFailedChunks = config.retryFailedChunks;
            maxChunkRetries = config.maxChunkRetries;
            chunkTimeout = config.chunkTimeout;
            validateChunkCompletion = config.validateChunkCompletion;
            maxLineFailureRatio = config.maxLineFailureRatio;
            maxMemoryUsage = config.maxMemoryUsage;
            warningThreshold = config.warningThreshold;
            criticalThreshold = config.criticalThreshold;
            monitoringInterval = config.monitoringInterval;
            enableGarbageCollection = config.enableGarbageCollection;
            chunkSizeReduction = config.chunkSizeReduction;
            enableMemoryOptimization = config.enableMemoryOptimization;
            enableMemoryLeakDetection = config.enableMemoryLeakDetection;
            enableCheckpointing = config.enableCheckpointing;
            checkpointInterval = config.checkpointInterval;
            checkpointDirectory = config.checkpointDirectory;
            maxCheckpoints = config.maxCheckpoints;
            compressionEnabled = config.compressionEnabled;
            validateChecksums = config.validateChecksums;
            autoCleanup = config.autoCleanup;
            retentionDays = config.retentionDays;
            enablePauseResume = config.enablePauseResume;
            enableGracefulPause = config.enableGracefulPause;
            pauseTimeout = config.pauseTimeout;
            maxPauseDuration = config.maxPauseDuration;
            saveStateOnPause = config.saveStateOnPause;
            validateStateOnResume = config.validateStateOnResume;
            resumeFromCheckpoint = config.resumeFromCheckpoint;
            adaptiveChunkSizing = config.adaptiveChunkSizing;
        }

        public Builder chunkSize(int value) {
            this.chunkSize = value;
            return this;
        }

        public Builder readBufferSize(int value) {
            this.readBufferSize = value;
            return this;
        }

        public Builder skipEmptyLines(boolean value) {
            this.skipEmptyLines = value;
            return this;
        }

        public Builder skipComments(boolean value) {
            this.skipComments = value;
            return this;
        }

        public Builder enableMetadata(boolean value) {
            this.enableMetadata = value;
            return this;
        }

        public Builder validateChunks(boolean value) {
            this.validateChunks = value;
            return this;
        }

        public Builder maxAnalysisTime(Duration value) {
            this.maxAnalysisTime = value;
            return this;
        }

        public Builder maxConcurrentChunks(int value) {
            this.maxConcurrentChunks = value;
            return this;
        }

        public Builder retryFailedChunks(boolean value) {
            this.retryFailedChunks = value;
            return this;
        }

        public Builder maxChunkRetries(int value) {
            this.maxChunkRetries = value;
            return this;
        }

        public Builder chunkTimeout(Duration value) {
            this.chunkTimeout = value;
            return this;
        }

        public Builder validateChunkCompletion(boolean value) {
            this.validateChunkCompletion = value;
            return this;
        }

        public Builder maxLineFailureRatio(double value) {
            this.maxLineFailureRatio = value;
            return this;
        }

        public Builder maxMemoryUsage(long value) {
            this.maxMemoryUsage = value;
            return this;
        }

        public Builder warningThreshold(double value) {
            this.warningThreshold = value;
            return this;
        }

        public Builder criticalThreshold(double value) {
            this.criticalThreshold = value;
            return this;
        }

        public Builder monitoringInterval(Duration value) {
            this.monitoringInterval = value;
            return this;
        }

        public Builder enableGarbageCollection(boolean value) {
            this.enableGarbageCollection = value;
            return this;
        }

        public Builder chunkSizeReduction(double value) {
            this.chunkSizeReduction = value;
            return this;
        }

        public Builder enableMemoryOptimization(boolean value) {
            this.enableMemoryOptimization = value;
            return this;
        }

        public Builder enableMemoryLeakDetection(boolean value) {
            this.enableMemoryLeakDetection = value;
            return this;
        }

        public Builder enableCheckpointing(boolean value) {
            this.enableCheckpointing = value;
            return this;
        }

        public Builder checkpointInterval(long value) {
            this.checkpointInterval = value;
            return this;
        }

        public Builder checkpointDirectory(Path value) {
            this.checkpointDirectory = value;
            return this;
        }

        public Builder maxCheckpoints(int value) {
            this.maxCheckpoints = value;
            return this;
        }

        public Builder compressionEnabled(boolean value) {
            this.compressionEnabled = value;
            return this;
        }

        public Builder validateChecksums(boolean value) {
            this.validateChecksums = value;
            return this;
        }

        public Builder autoCleanup(boolean value) {
            this.autoCleanup = value;
            return this;
        }

        public Builder retentionDays(int value) {
            this.retentionDays = value;
            return this;
        }

        public Builder enablePauseResume(boolean value) {
            this.enablePauseResume = value;
            return this;
        }

        public Builder enableGracefulPause(boolean value) {
            this.enableGracefulPause = value;
            return this;
        }

        public Builder pauseTimeout(Duration value) {
            this.pauseTimeout = value;
            return this;
        }

        public Builder maxPauseDuration(Duration value) {
            this.maxPauseDuration = value;
            return this;
        }

        public Builder saveStateOnPause(boolean value) {
            this.saveStateOnPause = value;
            return this;
        }

        public Builder validateStateOnResume(boolean value) {
            this.validateStateOnResume = value;
            return this;
        }

        public Builder resumeFromCheckpoint(boolean value) {
            this.resumeFromCheckpoint = value;
            return this;
        }

        public Builder adaptiveChunkSizing(boolean value) {
            this.adaptiveChunkSizing = value;
            return this;
        }

        public StreamingConfig build() {
            return new StreamingConfig(
                    chunkSize,
                    readBufferSize,
                    skipEmptyLines,
                    skipComments,
                    enableMetadata,
                    validateChunks,
                    maxAnalysisTime,
                    maxConcurrentChunks,
                    retryFailedChunks,
                    maxChunkRetries,
                    chunkTimeout,
                    validateChunkCompletion,
                    maxLineFailureRatio,
                    maxMemoryUsage,
                    warningThreshold,
                    criticalThreshold,
                    monitoringInterval,
                    enableGarbageCollection,
                    chunkSizeReduction,
                    enableMemoryOptimization,
                    enableMemoryLeakDetection,
                    enableCheckpointing,
                    checkpointInterval,
                    checkpointDirectory,
                    maxCheckpoints,
                    compressionEnabled,
                    validateChecksums,
                    autoCleanup,
                    retentionDays,
                    enablePauseResume,
                    enableGracefulPause,
                    pauseTimeout,
                    maxPauseDuration,
                    saveStateOnPause,
                    validateStateOnResume,
                    resumeFromCheckpoint,
                    adaptiveChunkSizing
            );
        }
    }
}
