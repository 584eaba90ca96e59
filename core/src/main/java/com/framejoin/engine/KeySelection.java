package com.framejoin.engine;

import java.util.Collections;
import java.util.List;

/**
 * The join keys of one side: either named columns or the table index.
 *
 * @param columns the key column names (empty when the index is used)
 * @param useIndex whether the side joins on its index
 */
public record KeySelection(List<String> columns, boolean useIndex) {

    public static KeySelection columns(List<String> names) {
        return new KeySelection(List.copyOf(names), false);
    }

    public static KeySelection index() {
        return new KeySelection(Collections.emptyList(), true);
    }

    /**
     * Returns the number of keys on this side.
     */
    public int size() {
        return useIndex ? 1 : columns.size();
    }
}
