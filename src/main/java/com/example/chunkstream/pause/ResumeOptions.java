package com.example.chunkstream.pause;

/**
 * @param forced set when the resume is triggered by the pause watchdog
 */
public record ResumeOptions(boolean forced) {
    public static ResumeOptions defaults() {
        return new ResumeOptions(false);
    }
}
