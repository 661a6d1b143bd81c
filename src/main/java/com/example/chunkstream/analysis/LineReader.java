package com.example.chunkstream.analysis;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Splits a byte stream into lines while tracking the exact byte offset of every line. Both {@code \n}
 * and {@code \r\n} terminators are recognized; the terminator counts towards the line's byte length
 * but is not part of its content.
 */
final class LineReader implements Closeable {
    private final InputStream input;
    private final byte[] buffer;
    private int position;
    private int limit;
    private boolean endOfStream;

    private byte[] lineBytes = new byte[256];
    private int lineLength;
    private long offset;

    LineReader(InputStream input, int bufferSize) {
        this.input = input;
        this.buffer = new byte[bufferSize];
    }

    /**
     * Returns the next line, or {@code null} once the stream is exhausted.
     */
    Line readLine() throws IOException {
        lineLength = 0;
        long lineStart = offset;
        int consumed = 0;
        while (true) {
            if (position >= limit && !fill()) {
                if (consumed == 0) {
                    return null;
                }
                return finish(lineStart, consumed);
            }
            byte value = buffer[position++];
            consumed++;
            if (value == '\n') {
                if (lineLength > 0 && lineBytes[lineLength - 1] == '\r') {
                    lineLength--;
                }
                return finish(lineStart, consumed);
            }
            append(value);
        }
    }

    long bytesRead() {
        return offset;
    }

    private Line finish(long lineStart, int consumed) {
        offset += consumed;
        String content = new String(lineBytes, 0, lineLength, StandardCharsets.UTF_8);
        return new Line(content, lineStart, consumed);
    }

    private void append(byte value) {
        if (lineLength == lineBytes.length) {
            lineBytes = Arrays.copyOf(lineBytes, lineBytes.length * 2);
        }
        lineBytes[lineLength++] = value;
    }

    private boolean fill() throws IOException {
        if (endOfStream) {
            return false;
        }
        int read = input.read(buffer, 0, buffer.length);
        while (read == 0) {
            read = input.read(buffer, 0, buffer.length);
        }
        if (read < 0) {
            endOfStream = true;
            return false;
        }
        position = 0;
        limit = read;
        return true;
    }

    @Override
    public void close() throws IOException {
        input.close();
    }

    record Line(String content, long byteOffset, int byteLength) {
    }
}
