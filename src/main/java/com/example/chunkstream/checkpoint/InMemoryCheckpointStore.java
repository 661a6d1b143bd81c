package com.example.chunkstream.checkpoint;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

public final class InMemoryCheckpointStore implements CheckpointStore {
    private final Map<String, NavigableMap<String, Checkpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public void save(Checkpoint checkpoint) {
        checkpoints.computeIfAbsent(checkpoint.filePath(), key -> new ConcurrentSkipListMap<>())
                .put(checkpoint.id(), checkpoint);
    }

    @Override
    public List<String> listIds(String filePath) {
        NavigableMap<String, Checkpoint> forFile = checkpoints.get(filePath);
        if (forFile == null) {
            return List.of();
        }
        return new ArrayList<>(forFile.descendingKeySet());
    }

    @Override
    public Optional<Checkpoint> read(String filePath, String id) {
        NavigableMap<String, Checkpoint> forFile = checkpoints.get(filePath);
        return forFile == null ? Optional.empty() : Optional.ofNullable(forFile.get(id));
    }

    public Optional<Checkpoint> findById(String id) {
        for (NavigableMap<String, Checkpoint> forFile : checkpoints.values()) {
            Checkpoint checkpoint = forFile.get(id);
            if (checkpoint != null) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    public List<Checkpoint> listCheckpoints(String filePath) {
        NavigableMap<String, Checkpoint> forFile = checkpoints.get(filePath);
        if (forFile == null) {
            return List.of();
        }
        return List.copyOf(forFile.descendingMap().values());
    }

    public List<Checkpoint> all() {
        List<Checkpoint> all = new ArrayList<>();
        checkpoints.values().forEach(forFile -> all.addAll(forFile.values()));
        return all;
    }

    @Override
    public boolean delete(String filePath, String id) {
        NavigableMap<String, Checkpoint> forFile = checkpoints.get(filePath);
        return forFile != null && forFile.remove(id) != null;
    }

    @Override
    public void deleteAll(String filePath) {
        checkpoints.remove(filePath);
    }

    public int size() {
        return checkpoints.values().stream().mapToInt(Map::size).sum();
    }

    public void clear() {
        checkpoints.clear();
    }
}
