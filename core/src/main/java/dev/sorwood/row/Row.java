/*
 *  SPDX-License-Identifier: Apache-2.0
 *
 *  Copyright The original authors
 *
 *  Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package dev.sorwood.row;

import java.util.List;

/**
 * The fields of one SoR line, in left-to-right marker order.
 */
public record Row(List<Field> fields) {

    public Row {
        fields = List.copyOf(fields);
    }

    public int getFieldCount() {
        return fields.size();
    }

    public Field getField(int index) {
        return fields.get(index);
    }

    /**
     * Returns the value at the given position, or the empty string if the row
     * has no field there.
     */
    public String getValue(int index) {
        if (index < 0 || index >= fields.size()) {
            return Field.MISSING_VALUE;
        }
        return fields.get(index).value();
    }

    public boolean isMissing(int index) {
        return getValue(index).isEmpty();
    }
}
