package com.example.chunkstream.checkpoint;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per checkpoint under {@code <source dir>/<checkpoint directory>/<source file name>/}.
 * An absolute checkpoint directory is used as is.
 */
public final class FileSystemCheckpointStore implements CheckpointStore {
    private static final Logger LOGGER = LoggerFactory.getLogger(FileSystemCheckpointStore.class);
    private static final String SUFFIX = ".json";

    private final Path checkpointDirectory;
    private final CheckpointCodec codec;
    private final boolean compress;

    public FileSystemCheckpointStore(Path checkpointDirectory, CheckpointCodec codec, boolean compress) {
        this.checkpointDirectory = checkpointDirectory;
        this.codec = codec;
        this.compress = compress;
    }

    public Path directoryFor(String filePath) {
        Path source = Path.of(filePath).toAbsolutePath().normalize();
        Path parent = source.getParent() == null ? source.getRoot() : source.getParent();
        return parent.resolve(checkpointDirectory).resolve(source.getFileName().toString());
    }

    @Override
    public void save(Checkpoint checkpoint) throws IOException {
        Path directory = directoryFor(checkpoint.filePath());
        Files.createDirectories(directory);
        Path target = directory.resolve(checkpoint.id() + SUFFIX);
        Path temp = directory.resolve(checkpoint.id() + SUFFIX + ".tmp");
        Files.writeString(temp, codec.encode(checkpoint, compress), StandardCharsets.UTF_8);
        Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        LOGGER.debug("Saved checkpoint {} to {}", checkpoint.id(), target);
    }

    @Override
    public List<String> listIds(String filePath) throws IOException {
        Path directory = directoryFor(filePath);
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.map(path -> path.getFileName().toString())
                    .filter(name -> name.endsWith(SUFFIX))
                    .map(name -> name.substring(0, name.length() - SUFFIX.length()))
                    .sorted(Comparator.reverseOrder())
                    .toList();
        }
    }

    @Override
    public Optional<Checkpoint> read(String filePath, String id) throws IOException {
        Path file = directoryFor(filePath).resolve(id + SUFFIX);
        if (!Files.exists(file)) {
            return Optional.empty();
        }
        return Optional.of(codec.decode(id, Files.readString(file, StandardCharsets.UTF_8)));
    }

    @Override
    public boolean delete(String filePath, String id) throws IOException {
        return Files.deleteIfExists(directoryFor(filePath).resolve(id + SUFFIX));
    }

    @Override
    public void deleteAll(String filePath) throws IOException {
        for (String id : listIds(filePath)) {
            delete(filePath, id);
        }
    }
}
