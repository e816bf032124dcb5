/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.reader;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import dev.sorwood.internal.reader.SchemaInferrer;

/**
 * Settings shared by SoR readers.
 * <p>
 * {@link #create()} reads the following system properties:
 * </p>
 * <ul>
 *   <li>{@code sorwood.sample.rows}: number of leading lines sampled for schema inference (default 500)</li>
 *   <li>{@code sorwood.position.cache}: {@code false} disables resuming sequential lookups
 *       from the last row found (default enabled)</li>
 *   <li>{@code sorwood.charset}: charset used to decode lines (default UTF-8)</li>
 * </ul>
 */
public final class SorContext {

    static final String SAMPLE_ROWS_PROPERTY = "sorwood.sample.rows";
    static final String POSITION_CACHE_PROPERTY = "sorwood.position.cache";
    static final String CHARSET_PROPERTY = "sorwood.charset";

    private static final System.Logger LOG = System.getLogger(SorContext.class.getName());

    private final int sampleRows;
    private final boolean positionCache;
    private final Charset charset;

    private SorContext(int sampleRows, boolean positionCache, Charset charset) {
        this.sampleRows = sampleRows;
        this.positionCache = positionCache;
        this.charset = charset;
    }

    /**
     * Create a context from system properties, falling back to the defaults.
     */
    public static SorContext create() {
        Builder builder = builder();

        String sampleRows = System.getProperty(SAMPLE_ROWS_PROPERTY);
        if (sampleRows != null) {
            try {
                builder.sampleRows(Integer.parseInt(sampleRows.trim()));
            }
            catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid value for " + SAMPLE_ROWS_PROPERTY + ": " + sampleRows, e);
            }
        }

        if ("false".equalsIgnoreCase(System.getProperty(POSITION_CACHE_PROPERTY))) {
            LOG.log(System.Logger.Level.DEBUG, "Position cache disabled via system property");
            builder.positionCache(false);
        }

        String charset = System.getProperty(CHARSET_PROPERTY);
        if (charset != null) {
            builder.charset(Charset.forName(charset.trim()));
        }

        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public int sampleRows() {
        return sampleRows;
    }

    public boolean positionCache() {
        return positionCache;
    }

    public Charset charset() {
        return charset;
    }

    @Override
    public String toString() {
        return "SorContext[sampleRows=" + sampleRows + ", positionCache=" + positionCache + ", charset=" + charset + "]";
    }

    public static final class Builder {

        private static final byte[] NEW_LINE = { '\n' };

        private int sampleRows = SchemaInferrer.DEFAULT_SAMPLE_ROWS;
        private boolean positionCache = true;
        private Charset charset = StandardCharsets.UTF_8;

        private Builder() {
        }

        public Builder sampleRows(int sampleRows) {
            if (sampleRows <= 0) {
                throw new IllegalArgumentException("Sample rows must be positive: " + sampleRows);
            }
            this.sampleRows = sampleRows;
            return this;
        }

        public Builder positionCache(boolean positionCache) {
            this.positionCache = positionCache;
            return this;
        }

        /**
         * @throws IllegalArgumentException if the charset does not encode {@code '\n'} as the single byte 0x0A
         */
        public Builder charset(Charset charset) {
            if (charset == null) {
                throw new IllegalArgumentException("Charset must not be null");
            }
            if (!charset.canEncode() || !Arrays.equals("\n".getBytes(charset), NEW_LINE)) {
                throw new IllegalArgumentException("Charset must encode lines with single-byte '\\n' terminators: " + charset);
            }
            this.charset = charset;
            return this;
        }

        public SorContext build() {
            return new SorContext(sampleRows, positionCache, charset);
        }
    }
}
