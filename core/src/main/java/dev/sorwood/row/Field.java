/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.row;

import dev.sorwood.schema.TypeRank;

/**
 * A classified field of a SoR row.
 * <p>
 * The rank is the observed rank promoted against the column's schema rank
 * at classification time. A missing field has the empty string as value;
 * note that an explicit quoted empty string ({@code ""}) is a STRING, not missing.
 * </p>
 */
public record Field(TypeRank rank, String value, boolean missing) {

    public static final String MISSING_VALUE = "";

    public Field {
        if (missing) {
            value = MISSING_VALUE;
        }
    }

    public static Field missing(TypeRank rank) {
        return new Field(rank, MISSING_VALUE, true);
    }

    public static Field of(TypeRank rank, String value) {
        return new Field(rank, value, false);
    }

    @Override
    public String toString() {
        return missing ? "<missing:" + rank + ">" : value + ":" + rank;
    }
}
