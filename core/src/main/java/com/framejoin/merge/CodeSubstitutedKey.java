package com.framejoin.merge;

import com.framejoin.types.CategoricalType;

/**
 * A categorical key that is joined on its decoded values while its codes travel
 * through the engine in a separate column.
 *
 * @param keyName the key column name on the categorical side
 * @param codesColumn the name of the temporary codes column
 * @param dtype the original categorical dtype
 */
public record CodeSubstitutedKey(String keyName, String codesColumn, CategoricalType dtype) {

    /** Suffix of the temporary codes column added next to a substituted key. */
    public static final String CODES_SUFFIX = "_codes";

    public static CodeSubstitutedKey of(String keyName, CategoricalType dtype) {
        return new CodeSubstitutedKey(keyName, keyName + CODES_SUFFIX, dtype);
    }
}
