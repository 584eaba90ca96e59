package com.framejoin.merge;

import com.framejoin.types.DataType;

/**
 * Non-fatal notice that a key column could not be cast to the dtype its join
 * kind asked for and was promoted to a common supertype instead.
 *
 * @param column the key column that could not be cast
 * @param side "left" or "right"
 * @param sourceType the column's dtype
 * @param requestedType the dtype the join kind asked for
 * @param chosenType the supertype used instead (null when no common type exists)
 */
public record PrecisionWarning(String column, String side, DataType sourceType,
                               DataType requestedType, DataType chosenType) {

    /**
     * Returns the warning as a log message.
     */
    public String message() {
        return String.format("can't safely cast column %s from %s with type %s to %s, upcasting to %s",
            column, side, sourceType.typeName(), requestedType.typeName(),
            chosenType == null ? "none" : chosenType.typeName());
    }
}
