/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.io.IOException;

import dev.sorwood.reader.AccessWindow;

/**
 * Forward cursor over the rows of an access window.
 * <p>
 * Row boundaries follow these rules:
 * </p>
 * <ul>
 *   <li>if the window starts past offset 0, the first line read is skipped;
 *       its bytes count as consumed</li>
 *   <li>the next line becomes row 0 only if the bytes consumed so far are
 *       strictly less than the window length</li>
 *   <li>each further line becomes the next row unless the bytes consumed
 *       exceed the window length</li>
 * </ul>
 * <p>
 * The cursor keeps its own file position, so other reads on the shared
 * {@link LineSource} between two calls to {@link #next()} do not disturb it.
 * </p>
 */
final class WindowScan {

    private final LineSource source;
    private final AccessWindow window;

    private boolean started;
    private boolean exhausted;
    private long rowIndex = -1;
    private long consumed;
    private long nextPosition;
    private String currentLine;

    WindowScan(LineSource source, AccessWindow window) {
        this.source = source;
        this.window = window;
    }

    /**
     * Index of the current row within the window; -1 before the first row.
     */
    long rowIndex() {
        return rowIndex;
    }

    /**
     * Text of the current row.
     */
    String currentLine() {
        return currentLine;
    }

    long bytesConsumed() {
        return consumed;
    }

    /**
     * Advances to the next row of the window.
     *
     * @return {@code false} if the window has no further row
     */
    boolean next() throws IOException {
        if (exhausted) {
            return false;
        }
        if (!started) {
            return first();
        }

        source.seek(nextPosition);
        LineSource.Line line = source.readLine();
        if (line == null) {
            return exhaust();
        }
        consumed += line.byteLength();
        if (window.isBounded() && consumed > window.lengthBytes().getAsLong()) {
            return exhaust();
        }
        return advance(line);
    }

    private boolean first() throws IOException {
        started = true;
        source.seek(window.startByte());

        if (window.startByte() != 0) {
            LineSource.Line partial = source.readLine();
            if (partial == null) {
                return exhaust();
            }
            consumed += partial.byteLength();
        }

        LineSource.Line line = source.readLine();
        if (line == null) {
            return exhaust();
        }
        consumed += line.byteLength();
        if (window.isBounded() && consumed >= window.lengthBytes().getAsLong()) {
            return exhaust();
        }
        return advance(line);
    }

    private boolean advance(LineSource.Line line) {
        rowIndex++;
        currentLine = line.text();
        nextPosition = source.position();
        return true;
    }

    private boolean exhaust() {
        exhausted = true;
        return false;
    }
}
