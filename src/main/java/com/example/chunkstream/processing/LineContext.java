package com.example.chunkstream.processing;

public record LineContext(long lineNumber, int chunkIndex, boolean lastLineInChunk) {
}
