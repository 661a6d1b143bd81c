package com.example.chunkstream.pause;

/**
 * @param graceful      wait for participants to reach a safe point before pausing
 * @param preserveState capture a {@link PausedStateSnapshot}
 */
public record PauseOptions(boolean graceful, boolean preserveState) {
    public static PauseOptions defaults() {
        return new PauseOptions(true, true);
    }

    public static PauseOptions immediate() {
        return new PauseOptions(false, true);
    }
}
