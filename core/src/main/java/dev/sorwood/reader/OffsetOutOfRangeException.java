/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

/**
 * Thrown when a row offset is not reached within the reader's access window.
 */
public class OffsetOutOfRangeException extends SorReadException {

    private final long rowOffset;
    private final AccessWindow window;

    public OffsetOutOfRangeException(long rowOffset, AccessWindow window) {
        super("Offset out of range: row " + rowOffset + " is not within window " + window);
        this.rowOffset = rowOffset;
        this.window = window;
    }

    public long getRowOffset() {
        return rowOffset;
    }

    public AccessWindow getWindow() {
        return window;
    }
}
