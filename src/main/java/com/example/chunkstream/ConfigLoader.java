package com.example.chunkstream;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Duration;
import java.util.function.Consumer;

/**
 * Reads a {@link StreamingConfig} from JSON. Missing options keep the builder defaults, durations are
 * given in milliseconds, and out-of-range values are rejected with {@link IllegalArgumentException}.
 */
public class ConfigLoader {
    private final ObjectMapper mapper;

    public ConfigLoader() {
        mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public StreamingConfig load(Path path) throws IOException {
        return toConfig(mapper.readValue(path.toFile(), RawConfig.class));
    }

    public StreamingConfig load(InputStream input) throws IOException {
        return toConfig(mapper.readValue(input, RawConfig.class));
    }

    private StreamingConfig toConfig(RawConfig raw) {
        StreamingConfig.Builder builder = StreamingConfig.builder();

        apply(raw.chunkSize, builder::chunkSize);
        apply(raw.readBufferSize, builder::readBufferSize);
        apply(raw.skipEmptyLines, builder::skipEmptyLines);
        apply(raw.skipComments, builder::skipComments);
        apply(raw.enableMetadata, builder::enableMetadata);
        apply(raw.validateChunks, builder::validateChunks);
        applyMillis(raw.maxAnalysisTime, builder::maxAnalysisTime);

        apply(raw.maxConcurrentChunks, builder::maxConcurrentChunks);
        apply(raw.retryFailedChunks, builder::retryFailedChunks);
        apply(raw.maxChunkRetries, builder::maxChunkRetries);
        applyMillis(raw.chunkTimeout, builder::chunkTimeout);
        apply(raw.validateChunkCompletion, builder::validateChunkCompletion);
        apply(raw.maxLineFailureRatio, builder::maxLineFailureRatio);

        apply(raw.maxMemoryUsage, builder::maxMemoryUsage);
        apply(raw.warningThreshold, builder::warningThreshold);
        apply(raw.criticalThreshold, builder::criticalThreshold);
        applyMillis(raw.monitoringInterval, builder::monitoringInterval);
        apply(raw.enableGarbageCollection, builder::enableGarbageCollection);
        apply(raw.chunkSizeReduction, builder::chunkSizeReduction);
        apply(raw.enableMemoryOptimization, builder::enableMemoryOptimization);
        apply(raw.enableMemoryLeakDetection, builder::enableMemoryLeakDetection);

        apply(raw.enableCheckpointing, builder::enableCheckpointing);
        apply(raw.checkpointInterval, builder::checkpointInterval);
        if (raw.checkpointDirectory != null) {
            if (raw.checkpointDirectory.isBlank()) {
                throw new IllegalArgumentException("checkpointDirectory must not be blank.");
            }
            builder.checkpointDirectory(Path.of(raw.checkpointDirectory));
        }
        apply(raw.maxCheckpoints, builder::maxCheckpoints);
        apply(raw.compressionEnabled, builder::compressionEnabled);
        apply(raw.validateChecksums, builder::validateChecksums);
        apply(raw.autoCleanup, builder::autoCleanup);
        apply(raw.retentionDays, builder::retentionDays);

        apply(raw.enablePauseResume, builder::enablePauseResume);
        apply(raw.enableGracefulPause, builder::enableGracefulPause);
        applyMillis(raw.pauseTimeout, builder::pauseTimeout);
        applyMillis(raw.maxPauseDuration, builder::maxPauseDuration);
        apply(raw.saveStateOnPause, builder::saveStateOnPause);
        apply(raw.validateStateOnResume, builder::validateStateOnResume);

        apply(raw.resumeFromCheckpoint, builder::resumeFromCheckpoint);
        apply(raw.adaptiveChunkSizing, builder::adaptiveChunkSizing);

        return builder.build();
    }

    private static <T> void apply(T value, Consumer<T> setter) {
        if (value != null) {
            setter.accept(value);
        }
    }

    private static void applyMillis(Long millis, Consumer<Duration> setter) {
        if (millis != null) {
            setter.accept(Duration.ofMillis(millis));
        }
    }

    private static class RawConfig {
        public Integer chunkSize;
        public Integer readBufferSize;
        public Boolean skipEmptyLines;
        public Boolean skipComments;
        public Boolean enableMetadata;
        public Boolean validateChunks;
        public Long maxAnalysisTime;
        public Integer maxConcurrentChunks;
        public Boolean retryFailedChunks;
        public Integer maxChunkRetries;
        public Long chunkTimeout;
        public Boolean validateChunkCompletion;
        public Double maxLineFailureRatio;
        public Long maxMemoryUsage;
        public Double warningThreshold;
        public Double criticalThreshold;
        public Long monitoringInterval;
        public Boolean enableGarbageCollection;
        public Double chunkSizeReduction;
        public Boolean enableMemoryOptimization;
        public Boolean enableMemoryLeakDetection;
        public Boolean enableCheckpointing;
        public Long checkpointInterval;
        public String checkpointDirectory;
        public Integer maxCheckpoints;
        public Boolean compressionEnabled;
        public Boolean validateChecksums;
        public Boolean autoCleanup;
        public Integer retentionDays;
        public Boolean enablePauseResume;
        public Boolean enableGracefulPause;
        public Long pauseTimeout;
        public Long maxPauseDuration;
        public Boolean saveStateOnPause;
        public Boolean validateStateOnResume;
        public Boolean resumeFromCheckpoint;
        public Boolean adaptiveChunkSizing;
    }
}
