package com.framejoin.types;

/**
 * Sealed interface for all column data types in the framejoin type system.
 *
 * <p>The set of types is closed so that every place that dispatches on a
 * type (unification, casting, SQL mapping) covers all of them:
 * <ul>
 *   <li>Numeric types: {@link IntegerType} (signed and unsigned widths), {@link FloatType}</li>
 *   <li>{@link BooleanType} and {@link StringType}</li>
 *   <li>Temporal types: {@link TemporalType} (datetime and timedelta with a resolution)</li>
 *   <li>{@link CategoricalType}: integer codes into a categories column</li>
 * </ul>
 */
public sealed interface DataType
    permits IntegerType, FloatType, BooleanType, StringType,
            TemporalType, CategoricalType {

    /**
     * Returns a human-readable name for this data type.
     *
     * @return the type name, e.g. {@code int64} or {@code datetime64[ms]}
     */
    String typeName();

    /**
     * Returns the size in bytes of one value of this type.
     *
     * <p>Returns -1 for variable-length types (e.g., String).
     *
     * @return the size in bytes, or -1 for variable-length types
     */
    default int defaultSize() {
        return -1;
    }

    /**
     * Returns true for integer and floating point types. Booleans are not numeric.
     */
    default boolean isNumeric() {
        return this instanceof IntegerType || this instanceof FloatType;
    }
}
