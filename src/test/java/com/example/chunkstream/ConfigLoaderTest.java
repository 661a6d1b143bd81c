package com.example.chunkstream;

import org.junit.jupiter.api.Test;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConfigLoaderTest {
    @Test
    void loadsOverridesAndKeepsDefaults() throws Exception {
        StreamingConfig config;
        try (InputStream input = getClass().getResourceAsStream("/streaming-config.json")) {
            assertNotNull(input);
            config = new ConfigLoader().load(input);
        }

        assertEquals(250, config.chunkSize());
        assertEquals(2, config.maxConcurrentChunks());
        assertEquals(5, config.maxChunkRetries());
        assertEquals(Duration.ofMillis(1500), config.chunkTimeout());
        assertEquals(Duration.ZERO, config.maxPauseDuration());
        assertEquals(Path.of("state/checkpoints"), config.checkpointDirectory());
        assertTrue(config.compressionEnabled());
        assertEquals(0.7, config.warningThreshold());
        assertEquals(0.85, config.criticalThreshold());

        StreamingConfig defaults = StreamingConfig.defaults();
        assertEquals(defaults.readBufferSize(), config.readBufferSize());
        assertEquals(defaults.checkpointInterval(), config.checkpointInterval());
        assertEquals(defaults.pauseTimeout(), config.pauseTimeout());
        assertTrue(config.skipComments());
        assertFalse(config.adaptiveChunkSizing());
    }

    @Test
    void rejectsInconsistentThresholds() throws Exception {
        Path file = Files.createTempFile("streaming-config", ".json");
        Files.writeString(file, "{\"warningThreshold\": 0.95, \"criticalThreshold\": 0.9}");

        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void rejectsBlankCheckpointDirectory() throws Exception {
        Path file = Files.createTempFile("streaming-config", ".json");
        Files.writeString(file, "{\"checkpointDirectory\": \"  \"}");

        assertThrows(IllegalArgumentException.class, () -> new ConfigLoader().load(file));
    }

    @Test
    void builderValidatesRanges() {
        assertThrows(IllegalArgumentException.class, () -> StreamingConfig.builder().chunkSize(0).build());
        assertThrows(IllegalArgumentException.class, () -> StreamingConfig.builder().maxLineFailureRatio(1.5).build());
        assertThrows(IllegalArgumentException.class, () -> StreamingConfig.builder().chunkTimeout(Duration.ZERO).build());

        StreamingConfig copy = StreamingConfig.defaults().toBuilder().maxChunkRetries(0).build();
        assertEquals(0, copy.maxChunkRetries());
    }
}
