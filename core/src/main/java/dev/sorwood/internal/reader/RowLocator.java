/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import dev.sorwood.reader.AccessWindow;
import dev.sorwood.reader.OffsetOutOfRangeException;
import dev.sorwood.reader.UnknownColumnException;
import dev.sorwood.row.Field;
import dev.sorwood.row.Row;
import dev.sorwood.schema.ColumnSchema;
import dev.sorwood.schema.FileSchema;
import dev.sorwood.schema.TypeRank;

/**
 * Locates rows within an access window and reconciles their fields against
 * the fixed schema.
 * <p>
 * Each lookup scans forward from the window start. With the position cache
 * enabled, a lookup at or after the last row found resumes from there instead;
 * results are the same either way.
 * </p>
 * <p>
 * Not thread-safe: lookups move the shared {@link LineSource}.
 * </p>
 */
public final class RowLocator {

    private static final System.Logger LOG = System.getLogger(RowLocator.class.getName());

    private final LineSource source;
    private final FileSchema schema;
    private final AccessWindow window;
    private final boolean positionCache;

    private WindowScan lastScan;

    public RowLocator(LineSource source, FileSchema schema, AccessWindow window, boolean positionCache) {
        this.source = source;
        this.schema = schema;
        this.window = window;
        this.positionCache = positionCache;
    }

    public AccessWindow getWindow() {
        return window;
    }

    /**
     * Returns the value of a field, or the empty string if it is missing.
     * <p>
     * A field is missing if the row has fewer fields than {@code columnIndex + 1},
     * if it could not be classified, or if its type is more general than the
     * column's inferred type.
     * </p>
     *
     * @throws UnknownColumnException if the column is not in the schema
     * @throws OffsetOutOfRangeException if the row is not within the window
     */
    public String getValue(int columnIndex, long rowOffset) throws IOException {
        requireColumn(columnIndex);
        Row row = RowTokenizer.tokenize(findLine(rowOffset), schema::rankOrBottom);
        if (columnIndex >= row.getFieldCount()) {
            return Field.MISSING_VALUE;
        }
        return reconcile(row.getField(columnIndex), columnIndex).value();
    }

    /**
     * Returns the row at the given offset with one field per schema column.
     * Fields past the schema are dropped; absent or mismatching fields are missing.
     *
     * @throws OffsetOutOfRangeException if the row is not within the window
     */
    public Row getRow(long rowOffset) throws IOException {
        return reconcile(findLine(rowOffset));
    }

    /**
     * Returns an iterator over the reconciled rows of the window, in file order.
     * The iterator keeps its own position and may be interleaved with lookups.
     */
    public Iterator<Row> rows() {
        WindowScan scan = new WindowScan(source, window);
        return new Iterator<>() {

            private Boolean hasNext;

            @Override
            public boolean hasNext() {
                if (hasNext == null) {
                    try {
                        hasNext = scan.next();
                    }
                    catch (IOException e) {
                        throw new UncheckedIOException("Failed to read rows in window " + window, e);
                    }
                }
                return hasNext;
            }

            @Override
            public Row next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                hasNext = null;
                return reconcile(scan.currentLine());
            }
        };
    }

    /**
     * Returns the schema column at the given index.
     *
     * @throws IllegalArgumentException if {@code columnIndex} is negative
     * @throws UnknownColumnException if the column is not in the schema
     */
    public ColumnSchema requireColumn(int columnIndex) {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + columnIndex);
        }
        if (!schema.hasColumn(columnIndex)) {
            throw new UnknownColumnException(columnIndex, schema.getColumnCount());
        }
        return schema.getColumn(columnIndex);
    }

    private String findLine(long rowOffset) throws IOException {
        if (rowOffset < 0) {
            throw new IllegalArgumentException("Row offset must not be negative: " + rowOffset);
        }

        WindowScan scan = lastScan;
        if (scan == null || !positionCache || scan.rowIndex() > rowOffset) {
            scan = new WindowScan(source, window);
        }
        boolean more = true;
        while (more && scan.rowIndex() < rowOffset) {
            more = scan.next();
        }
        lastScan = scan;

        if (scan.rowIndex() != rowOffset) {
            LOG.log(System.Logger.Level.TRACE, "Row {0} not reached in window {1}, last row {2} after {3} bytes",
                    rowOffset, window, scan.rowIndex(), scan.bytesConsumed());
            throw new OffsetOutOfRangeException(rowOffset, window);
        }
        return scan.currentLine();
    }

    private Row reconcile(String line) {
        Row tokens = RowTokenizer.tokenize(line, schema::rankOrBottom);
        List<Field> fields = new ArrayList<>(schema.getColumnCount());
        for (int i = 0; i < schema.getColumnCount(); i++) {
            if (i < tokens.getFieldCount()) {
                fields.add(reconcile(tokens.getField(i), i));
            }
            else {
                fields.add(Field.missing(schema.getColumn(i).type()));
            }
        }
        return new Row(fields);
    }

    private Field reconcile(Field field, int columnIndex) {
        TypeRank columnRank = schema.getColumn(columnIndex).type();
        if (field.rank().fitsWithin(columnRank)) {
            return field;
        }
        return Field.missing(field.rank());
    }
}
