package com.example.chunkstream.analysis;

public record ChunkMetadata(boolean hasToolChange, boolean hasCoordinateChange, double complexity) {
}
