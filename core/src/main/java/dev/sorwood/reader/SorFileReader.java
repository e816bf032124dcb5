/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

import dev.sorwood.internal.reader.LineSource;
import dev.sorwood.internal.reader.RowLocator;
import dev.sorwood.internal.reader.SchemaInferrer;
import dev.sorwood.row.Row;
import dev.sorwood.schema.FileSchema;
import dev.sorwood.schema.TypeRank;

/**
 * Reader for individual SoR files.
 *
 * <pre>{@code
 * try (SorFileReader reader = SorFileReader.open(path, AccessWindow.of(0, 4096))) {
 *     TypeRank type = reader.getColumnType(2);
 *     String value = reader.getValue(2, 10);
 * }
 * }</pre>
 *
 * <p>The schema is inferred once, when the reader is opened, from the leading
 * lines of the file. Value lookups are restricted to the access window.</p>
 *
 * <p>Instances are not thread-safe: every lookup moves the reader's shared file
 * position, so concurrent use must be serialized by the caller.</p>
 */
public class SorFileReader implements AutoCloseable {

    private static final System.Logger LOG = System.getLogger(SorFileReader.class.getName());

    private final Path path;
    private final FileChannel channel;
    private final FileSchema schema;
    private final RowLocator locator;
    private boolean closed;

    private SorFileReader(Path path, FileChannel channel, FileSchema schema, RowLocator locator) {
        this.path = path;
        this.channel = channel;
        this.schema = schema;
        this.locator = locator;
    }

    /**
     * Open a SoR file for lookups across the whole file.
     */
    public static SorFileReader open(Path path) throws IOException {
        return open(path, AccessWindow.all());
    }

    /**
     * Open a SoR file for lookups within the given window, using settings from system properties.
     */
    public static SorFileReader open(Path path, AccessWindow window) throws IOException {
        return open(path, window, SorContext.create());
    }

    /**
     * Open a SoR file for lookups within the given window.
     */
    public static SorFileReader open(Path path, AccessWindow window, SorContext context) throws IOException {
        if (window == null) {
            throw new IllegalArgumentException("Access window must not be null");
        }
        FileChannel channel = FileChannel.open(path, StandardOpenOption.READ);
        try {
            LineSource source = new LineSource(channel, context.charset());
            FileSchema schema = SchemaInferrer.infer(source, context.sampleRows());
            RowLocator locator = new RowLocator(source, schema, window, context.positionCache());

            LOG.log(System.Logger.Level.DEBUG, "Opened ''{0}'' ({1} bytes) with window {2}, {3} columns",
                    path, channel.size(), window, schema.getColumnCount());

            return new SorFileReader(path, channel, schema, locator);
        }
        catch (Exception e) {
            // Close channel if there was an error during initialization
            try {
                channel.close();
            }
            catch (IOException closeException) {
                e.addSuppressed(closeException);
            }
            throw e;
        }
    }

    public Path getPath() {
        return path;
    }

    public AccessWindow getWindow() {
        return locator.getWindow();
    }

    public FileSchema getFileSchema() {
        checkOpen();
        return schema;
    }

    public int getColumnCount() {
        checkOpen();
        return schema.getColumnCount();
    }

    /**
     * Returns the inferred type of a column.
     *
     * @throws UnknownColumnException if the column is not in the schema
     */
    public TypeRank getColumnType(int columnIndex) {
        checkOpen();
        return locator.requireColumn(columnIndex).type();
    }

    /**
     * Returns the value of a field, or the empty string if it is missing.
     * <p>
     * Quoted strings are returned with their quotes; unquoted strings are
     * returned wrapped in quotes. A value whose type is more general than the
     * column's inferred type counts as missing.
     * </p>
     *
     * @param columnIndex column position, starting at 0
     * @param rowOffset row position within the access window, starting at 0
     * @throws UnknownColumnException if the column is not in the schema
     * @throws OffsetOutOfRangeException if the row is not within the window
     * @throws UncheckedIOException if reading the file fails
     */
    public String getValue(int columnIndex, long rowOffset) {
        checkOpen();
        try {
            return locator.getValue(columnIndex, rowOffset);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read row " + rowOffset + " of " + path, e);
        }
    }

    /**
     * Whether a field is missing, i.e. {@link #getValue(int, long)} returns the empty string.
     */
    public boolean isMissing(int columnIndex, long rowOffset) {
        return getValue(columnIndex, rowOffset).isEmpty();
    }

    /**
     * Returns the row at the given offset with one field per schema column.
     *
     * @throws OffsetOutOfRangeException if the row is not within the window
     * @throws UncheckedIOException if reading the file fails
     */
    public Row getRow(long rowOffset) {
        checkOpen();
        try {
            return locator.getRow(rowOffset);
        }
        catch (IOException e) {
            throw new UncheckedIOException("Failed to read row " + rowOffset + " of " + path, e);
        }
    }

    /**
     * Create a RowReader over all rows of the access window.
     */
    public RowReader createRowReader() {
        checkOpen();
        return new RowReader(locator, () -> !closed);
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Reader is closed: " + path);
        }
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        closed = true;
        channel.close();
    }
}
