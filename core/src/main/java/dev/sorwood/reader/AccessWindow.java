/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

import java.util.Objects;
import java.util.OptionalLong;

/**
 * Byte range of a SoR file in which rows may be located.
 *
 * <p>Usage examples:</p>
 * <pre>{@code
 * // Whole file (default)
 * AccessWindow.all()
 *
 * // From byte 1024 to the end of the file
 * AccessWindow.from(1024)
 *
 * // 4096 bytes starting at byte 1024
 * AccessWindow.of(1024, 4096)
 * }</pre>
 *
 * <p>A window starting past offset 0 is assumed to begin in the middle of a
 * line: the first line read after the start is skipped. The window only
 * restricts row lookup; schema inference always samples the start of the file.</p>
 */
public final class AccessWindow {

    private static final AccessWindow ALL = new AccessWindow(0, -1);

    private final long startByte;
    private final long lengthBytes;

    private AccessWindow(long startByte, long lengthBytes) {
        this.startByte = startByte;
        this.lengthBytes = lengthBytes;
    }

    /**
     * Returns a window covering the whole file.
     */
    public static AccessWindow all() {
        return ALL;
    }

    /**
     * Returns an unbounded window starting at the given offset.
     *
     * @throws IllegalArgumentException if {@code startByte} is negative
     */
    public static AccessWindow from(long startByte) {
        if (startByte < 0) {
            throw new IllegalArgumentException("Start byte must not be negative: " + startByte);
        }
        return startByte == 0 ? ALL : new AccessWindow(startByte, -1);
    }

    /**
     * Returns a window of {@code lengthBytes} bytes starting at {@code startByte}.
     *
     * @throws IllegalArgumentException if either value is negative
     */
    public static AccessWindow of(long startByte, long lengthBytes) {
        if (startByte < 0) {
            throw new IllegalArgumentException("Start byte must not be negative: " + startByte);
        }
        if (lengthBytes < 0) {
            throw new IllegalArgumentException("Length must not be negative: " + lengthBytes);
        }
        return new AccessWindow(startByte, lengthBytes);
    }

    public long startByte() {
        return startByte;
    }

    /**
     * Returns the window length, or empty if the window extends to the end of the file.
     */
    public OptionalLong lengthBytes() {
        return isBounded() ? OptionalLong.of(lengthBytes) : OptionalLong.empty();
    }

    public boolean isBounded() {
        return lengthBytes >= 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AccessWindow)) {
            return false;
        }
        AccessWindow other = (AccessWindow) o;
        return startByte == other.startByte && lengthBytes == other.lengthBytes;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startByte, lengthBytes);
    }

    @Override
    public String toString() {
        return "[" + startByte + ", " + (isBounded() ? "+" + lengthBytes : "EOF") + ")";
    }
}
