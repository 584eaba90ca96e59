package com.framejoin.merge;

import com.framejoin.table.Column;

/**
 * One side of a join key pair, handed to {@link TypeUnifier#unify} so the casting
 * rules can inspect values without reaching into the tables.
 *
 * @param side "left" or "right"
 * @param name the key column name (null for an unnamed index)
 * @param column the key values
 */
public record KeyColumn(String side, String name, Column column) {

    public static KeyColumn left(String name, Column column) {
        return new KeyColumn("left", name, column);
    }

    public static KeyColumn right(String name, Column column) {
        return new KeyColumn("right", name, column);
    }
}
