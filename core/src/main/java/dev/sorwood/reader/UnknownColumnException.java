/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

/**
 * Thrown when a column index is not part of the inferred schema.
 */
public class UnknownColumnException extends SorReadException {

    private final int columnIndex;
    private final int columnCount;

    public UnknownColumnException(int columnIndex, int columnCount) {
        super("Unknown column: " + columnIndex + " (schema has " + columnCount + " columns)");
        this.columnIndex = columnIndex;
        this.columnCount = columnCount;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public int getColumnCount() {
        return columnCount;
    }
}
