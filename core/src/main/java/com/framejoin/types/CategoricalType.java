package com.framejoin.types;

import com.framejoin.table.Column;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Data type of a categorical column: integer codes indexing into a column of
 * distinct categories, plus an orderedness flag.
 *
 * <p>Two categorical types are equal when their categories hold the same values
 * in the same order with the same dtype, and their orderedness matches.
 */
public final class CategoricalType implements DataType {

    private final Column categories;
    private final boolean ordered;
    private final Map<Object, Integer> codesByValue;

    /**
     * Creates a categorical type.
     *
     * @param categories the categories column (must not itself be categorical)
     * @param ordered whether the categories have a meaningful order
     */
    public CategoricalType(Column categories, boolean ordered) {
        this.categories = Objects.requireNonNull(categories, "categories must not be null");
        if (categories.dtype() instanceof CategoricalType) {
            throw new IllegalArgumentException("categories must not be categorical");
        }
        if (categories.nullCount() > 0) {
            throw new IllegalArgumentException("categories must not contain nulls");
        }
        this.ordered = ordered;
        this.codesByValue = new HashMap<>();
        for (int i = 0; i < categories.size(); i++) {
            codesByValue.putIfAbsent(categories.get(i), i);
        }
    }

    public Column categories() {
        return categories;
    }

    public boolean ordered() {
        return ordered;
    }

    /**
     * Returns the dtype of the category values.
     */
    public DataType valueType() {
        return categories.dtype();
    }

    /**
     * Returns the code of a category value, or -1 if the value is not a category.
     *
     * @param value the category value
     * @return the code, or -1
     */
    public int codeOf(Object value) {
        if (value == null) {
            return -1;
        }
        Integer code = codesByValue.get(value);
        return code == null ? -1 : code;
    }

    @Override
    public String typeName() {
        return "category";
    }

    @Override
    public int defaultSize() {
        return 4; // int32 codes
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CategoricalType)) return false;
        CategoricalType that = (CategoricalType) obj;
        return ordered == that.ordered && categories.equals(that.categories);
    }

    @Override
    public int hashCode() {
        return Objects.hash(categories, ordered);
    }

    @Override
    public String toString() {
        return String.format("category(%s, ordered=%s, categories=%s)",
            valueType(), ordered, categories.values());
    }
}
