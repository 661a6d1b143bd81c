package com.example.chunkstream.analysis;

public record ProgramMetadata(
        boolean hasComments,
        boolean hasSubPrograms,
        int toolChanges,
        int coordinateSystemChanges,
        long skippedLines
) {
    public static ProgramMetadata empty() {
        return new ProgramMetadata(false, false, 0, 0, 0);
    }
}
