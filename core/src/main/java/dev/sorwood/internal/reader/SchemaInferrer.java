/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.internal.reader;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import dev.sorwood.row.Row;
import dev.sorwood.schema.FileSchema;
import dev.sorwood.schema.TypeRank;

/**
 * Infers the column types of a SoR file from its leading lines.
 * <p>
 * The sample always starts at offset 0, independent of any access window.
 * Each column's type is the most general rank observed for it in the sample;
 * columns first appearing after the sample are not part of the schema.
 * </p>
 */
public final class SchemaInferrer {

    public static final int DEFAULT_SAMPLE_ROWS = 500;

    private static final System.Logger LOG = System.getLogger(SchemaInferrer.class.getName());

    private SchemaInferrer() {
        // Utility class
    }

    /**
     * Scans up to {@code sampleRows} lines from the start of the source.
     *
     * @param source the line source; its position is moved
     * @param sampleRows maximum number of lines to sample
     * @return the inferred schema
     * @throws IOException if reading fails
     */
    public static FileSchema infer(LineSource source, int sampleRows) throws IOException {
        if (sampleRows <= 0) {
            throw new IllegalArgumentException("Sample size must be positive: " + sampleRows);
        }
        source.seek(0);

        List<TypeRank> ranks = new ArrayList<>();
        int sampled = 0;
        LineSource.Line line;
        while (sampled < sampleRows && (line = source.readLine()) != null) {
            accept(ranks, line.text());
            sampled++;
        }

        FileSchema schema = FileSchema.fromRanks(ranks);
        LOG.log(System.Logger.Level.DEBUG, "Inferred {0} columns from {1} sampled lines: {2}",
                schema.getColumnCount(), sampled, schema);
        return schema;
    }

    /**
     * Folds one line into the ranks inferred so far.
     */
    static void accept(List<TypeRank> ranks, String line) {
        Row row = RowTokenizer.tokenize(line, i -> i < ranks.size() ? ranks.get(i) : TypeRank.BOOL);
        for (int i = 0; i < row.getFieldCount(); i++) {
            TypeRank promoted = row.getField(i).rank();
            if (i < ranks.size()) {
                ranks.set(i, promoted);
            }
            else {
                ranks.add(promoted);
            }
        }
    }
}
