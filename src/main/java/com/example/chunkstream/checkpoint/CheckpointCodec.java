package com.example.chunkstream.checkpoint;

import com.example.chunkstream.CheckpointCorruptionException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.zip.CRC32;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * JSON encoding of checkpoints and the checksum over their canonical form. The canonical form sorts
 * record properties and map keys so the checksum does not depend on field order.
 */
public final class CheckpointCodec {
    static final String COMPRESSED_PREFIX = "compressed:";

    private final ObjectMapper mapper;
    private final ObjectMapper canonicalMapper;

    public CheckpointCodec() {
        mapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .build();
        canonicalMapper = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    public String encode(Checkpoint checkpoint, boolean compress) {
        try {
            if (!compress) {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(checkpoint);
            }
            ByteArrayOutputStream bytes = new ByteArrayOutputStream();
            try (GZIPOutputStream gzip = new GZIPOutputStream(bytes)) {
                mapper.writeValue(gzip, checkpoint);
            }
            return COMPRESSED_PREFIX + Base64.getEncoder().encodeToString(bytes.toByteArray());
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to encode checkpoint " + checkpoint.id(), ex);
        }
    }

    /**
     * Decodes either the plain or the {@code compressed:} form.
     *
     * @throws CheckpointCorruptionException when the data is not a readable checkpoint
     */
    public Checkpoint decode(String id, String data) {
        try {
            if (data.startsWith(COMPRESSED_PREFIX)) {
                byte[] packed = Base64.getDecoder().decode(data.substring(COMPRESSED_PREFIX.length()).trim());
                try (InputStream input = new GZIPInputStream(new ByteArrayInputStream(packed))) {
                    return requireDecoded(id, mapper.readValue(input, Checkpoint.class));
                }
            }
            return requireDecoded(id, mapper.readValue(data, Checkpoint.class));
        } catch (IllegalArgumentException | IOException ex) {
            throw new CheckpointCorruptionException(id, "unreadable data", ex);
        }
    }

    private static Checkpoint requireDecoded(String id, Checkpoint checkpoint) {
        if (checkpoint == null) {
            throw new CheckpointCorruptionException(id, "empty document");
        }
        return checkpoint;
    }

    /**
     * CRC32 of the canonical JSON of the checkpoint without its checksum, as eight hex digits.
     */
    public String checksum(Checkpoint checkpoint) {
        CRC32 crc = new CRC32();
        crc.update(canonicalBytes(checkpoint.withChecksum(null)));
        return String.format("%08x", crc.getValue());
    }

    public int sizeOf(Checkpoint checkpoint) {
        return canonicalBytes(checkpoint).length;
    }

    private byte[] canonicalBytes(Checkpoint checkpoint) {
        try {
            return canonicalMapper.writeValueAsString(checkpoint).getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException ex) {
            throw new UncheckedIOException("Failed to serialize checkpoint " + checkpoint.id(), ex);
        }
    }
}
