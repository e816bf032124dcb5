/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.schema;

/**
 * Inferred type of a SoR column. Ranks are totally ordered from the most
 * specific ({@link #BOOL}) to the most general ({@link #STRING}); a column's
 * type is the loosest rank observed for it.
 */
public enum TypeRank {
    BOOL("bool"),
    INTEGER("int"),
    FLOAT("float"),
    STRING("string");

    private final String displayName;

    TypeRank(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Returns the more general of this rank and the given one.
     */
    public TypeRank promote(TypeRank other) {
        return promote(this, other);
    }

    public static TypeRank promote(TypeRank a, TypeRank b) {
        return a.ordinal() >= b.ordinal() ? a : b;
    }

    /**
     * Whether a value observed with this rank fits a column of the given rank.
     */
    public boolean fitsWithin(TypeRank columnRank) {
        return ordinal() <= columnRank.ordinal();
    }

    public static TypeRank fromDisplayName(String name) {
        for (TypeRank rank : values()) {
            if (rank.displayName.equals(name)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown type name: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
