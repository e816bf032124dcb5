/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;
import java.util.Arrays;

/**
 * Buffered line reader on top of a {@link FileChannel} with explicit seeking.
 * <p>
 * Lines are terminated by {@code '\n'}; the byte length reported for a line
 * includes its terminator, so summing lengths gives the exact number of
 * bytes consumed since the last seek. The channel's own position is not used;
 * this class keeps its own logical position.
 * </p>
 * <p>
 * Not thread-safe.
 * </p>
 */
public final class LineSource {

    private static final int BUFFER_SIZE = 8192;

    /**
     * A line read from the source.
     *
     * @param text the decoded line without its terminator (and without a trailing {@code '\r'})
     * @param byteLength the number of bytes the line occupies, terminator included
     * @param offset the file offset at which the line starts
     */
    public record Line(String text, int byteLength, long offset) {}

    private final FileChannel channel;
    private final Charset charset;
    private final ByteBuffer buffer;

    // file offset of buffer position 0
    private long bufferStart;
    private byte[] lineBytes = new byte[256];

    public LineSource(FileChannel channel, Charset charset) {
        this.channel = channel;
        this.charset = charset;
        this.buffer = ByteBuffer.allocate(BUFFER_SIZE);
        this.buffer.limit(0);
        this.bufferStart = 0;
    }

    /**
     * Returns the offset of the next byte to be read.
     */
    public long position() {
        return bufferStart + buffer.position();
    }

    /**
     * Moves to the given file offset. Buffered data is kept if it covers the offset.
     */
    public void seek(long offset) {
        if (offset < 0) {
            throw new IllegalArgumentException("Offset must not be negative: " + offset);
        }
        if (offset >= bufferStart && offset <= bufferStart + buffer.limit()) {
            buffer.position((int) (offset - bufferStart));
            return;
        }
        bufferStart = offset;
        buffer.clear();
        buffer.limit(0);
    }

    /**
     * Reads the next line.
     *
     * @return the line, or {@code null} at end of file
     */
    public Line readLine() throws IOException {
        long lineOffset = position();
        int length = 0;
        boolean terminated = false;

        while (!terminated) {
            if (!buffer.hasRemaining() && !fill()) {
                break;
            }
            byte b = buffer.get();
            if (length == lineBytes.length) {
                lineBytes = Arrays.copyOf(lineBytes, length * 2);
            }
            lineBytes[length++] = b;
            terminated = b == '\n';
        }

        if (length == 0) {
            return null;
        }

        int textLength = length;
        if (terminated) {
            textLength--;
            if (textLength > 0 && lineBytes[textLength - 1] == '\r') {
                textLength--;
            }
        }
        return new Line(new String(lineBytes, 0, textLength, charset), length, lineOffset);
    }

    private boolean fill() throws IOException {
        bufferStart += buffer.limit();
        buffer.clear();
        int read = channel.read(buffer, bufferStart);
        buffer.flip();
        return read > 0;
    }
}
