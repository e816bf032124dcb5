/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BooleanSupplier;

import dev.sorwood.internal.reader.RowLocator;
import dev.sorwood.row.Row;
import dev.sorwood.schema.TypeRank;

/**
 * Cursor over the rows of a reader's access window, in file order.
 *
 * <pre>{@code
 * RowReader rows = reader.createRowReader();
 * while (rows.hasNext()) {
 *     rows.next();
 *     String name = rows.getValue(1);
 * }
 * }</pre>
 *
 * <p>Values are reconciled against the schema the same way as
 * {@link SorFileReader#getValue(int, long)}. A row reader cannot be used
 * once its {@link SorFileReader} is closed.</p>
 */
public final class RowReader {

    private final RowLocator locator;
    private final Iterator<Row> rows;
    private final BooleanSupplier open;

    private Row current;
    private long rowIndex = -1;

    RowReader(RowLocator locator, BooleanSupplier open) {
        this.locator = locator;
        this.rows = locator.rows();
        this.open = open;
    }

    /**
     * @throws IllegalStateException if the owning reader is closed
     */
    public boolean hasNext() {
        checkOpen();
        return rows.hasNext();
    }

    /**
     * Moves to the next row.
     *
     * @throws NoSuchElementException if the window has no further row
     * @throws IllegalStateException if the owning reader is closed
     */
    public void next() {
        checkOpen();
        current = rows.next();
        rowIndex++;
    }

    /**
     * Returns the offset of the current row within the window.
     */
    public long getRowIndex() {
        return rowIndex;
    }

    public Row getRow() {
        checkPositioned();
        return current;
    }

    /**
     * Returns the value of the given column in the current row, or the empty
     * string if it is missing.
     *
     * @throws IllegalArgumentException if {@code columnIndex} is negative
     * @throws UnknownColumnException if the column is not in the schema
     */
    public String getValue(int columnIndex) {
        checkPositioned();
        locator.requireColumn(columnIndex);
        return current.getValue(columnIndex);
    }

    public boolean isMissing(int columnIndex) {
        return getValue(columnIndex).isEmpty();
    }

    public TypeRank getColumnType(int columnIndex) {
        return locator.requireColumn(columnIndex).type();
    }

    private void checkOpen() {
        if (!open.getAsBoolean()) {
            throw new IllegalStateException("Reader is closed");
        }
    }

    private void checkPositioned() {
        if (current == null) {
            throw new IllegalStateException("No current row, call next() first");
        }
    }
}
