package com.example.chunkstream.analysis;

import java.util.List;

/**
 * A contiguous slice of kept program lines. Line numbers are 1-based and count only the lines the
 * analyzer kept; byte offsets refer to the source file.
 */
public record Chunk(
        int index,
        long startLine,
        long endLine,
        int lineCount,
        long startByteOffset,
        long endByteOffset,
        long byteLength,
        List<String> lines,
        ChunkMetadata metadata
) {
    public Chunk {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative.");
        }
        if (lines == null || lines.size() != lineCount) {
            throw new IllegalArgumentException("lines must hold exactly lineCount entries.");
        }
        lines = List.copyOf(lines);
    }

    public static Chunk of(int index, long startLine, List<String> lines, long startByteOffset, long endByteOffset) {
        boolean toolChange = false;
        boolean coordinateChange = false;
        for (String line : lines) {
            String code = GcodeTokens.stripComments(line);
            toolChange |= GcodeTokens.isToolChange(code);
            coordinateChange |= GcodeTokens.isCoordinateSystemChange(code);
        }
        ChunkMetadata metadata = new ChunkMetadata(toolChange, coordinateChange, GcodeTokens.complexity(lines));
        return new Chunk(
                index,
                startLine,
                startLine + lines.size() - 1,
                lines.size(),
                startByteOffset,
                endByteOffset,
                endByteOffset - startByteOffset,
                lines,
                metadata
        );
    }
}
