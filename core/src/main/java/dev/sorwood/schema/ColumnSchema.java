/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.schema;

/**
 * A single column of an inferred SoR schema.
 */
public record ColumnSchema(int columnIndex, TypeRank type) {

    public ColumnSchema {
        if (columnIndex < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + columnIndex);
        }
        if (type == null) {
            throw new IllegalArgumentException("Column type must not be null");
        }
    }

    @Override
    public String toString() {
        return columnIndex + ": " + type.displayName();
    }
}
