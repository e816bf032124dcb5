/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.schema;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Per-column type vector of a SoR file, inferred once from a leading sample
 * of the file. Instances are immutable.
 */
public class FileSchema {

    private final List<ColumnSchema> columns;

    private FileSchema(List<ColumnSchema> columns) {
        this.columns = columns;
    }

    /**
     * Creates a schema from column ranks, indexed by position.
     */
    public static FileSchema fromRanks(List<TypeRank> ranks) {
        List<ColumnSchema> columns = new ArrayList<>(ranks.size());
        for (int i = 0; i < ranks.size(); i++) {
            columns.add(new ColumnSchema(i, ranks.get(i)));
        }
        return new FileSchema(Collections.unmodifiableList(columns));
    }

    public List<ColumnSchema> getColumns() {
        return columns;
    }

    public ColumnSchema getColumn(int index) {
        return columns.get(index);
    }

    public int getColumnCount() {
        return columns.size();
    }

    public boolean hasColumn(int index) {
        return index >= 0 && index < columns.size();
    }

    /**
     * Returns the rank of the given column, or {@link TypeRank#BOOL}, the
     * bottom of the lattice, if the column is not part of this schema.
     */
    public TypeRank rankOrBottom(int index) {
        return hasColumn(index) ? columns.get(index).type() : TypeRank.BOOL;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < columns.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(columns.get(i));
        }
        return sb.toString();
    }
}
