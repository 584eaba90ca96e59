package com.framejoin.types;

import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Maps framejoin DataTypes to the physical DuckDB SQL types and Arrow types
 * used to move columns through the execution engine.
 *
 * <p>The engine works on physical representations only:
 * <ul>
 *   <li>Temporal values travel as {@code BIGINT} unit counts</li>
 *   <li>Categorical columns travel as their {@code INTEGER} codes</li>
 *   <li>{@code uint64} travels as {@code BIGINT} (values are limited to the long range)</li>
 * </ul>
 *
 * @see DataType
 */
public class TypeMapper {

    /**
     * Converts a DataType to the DuckDB SQL type string of its physical representation.
     *
     * <p>Examples:
     * <pre>
     *   int32 → "INTEGER"
     *   uint16 → "USMALLINT"
     *   string → "VARCHAR"
     *   datetime64[ns] → "BIGINT"
     *   category → "INTEGER"
     * </pre>
     *
     * @param type the data type
     * @return the DuckDB SQL type string
     */
    public static String toDuckDBType(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type instanceof IntegerType) {
            IntegerType intType = (IntegerType) type;
            switch (intType.bitWidth()) {
                case 8:
                    return intType.signed() ? "TINYINT" : "UTINYINT";
                case 16:
                    return intType.signed() ? "SMALLINT" : "USMALLINT";
                case 32:
                    return intType.signed() ? "INTEGER" : "UINTEGER";
                default:
                    return "BIGINT";
            }
        }
        if (type instanceof FloatType) {
            return ((FloatType) type).bitWidth() == 32 ? "FLOAT" : "DOUBLE";
        }
        if (type instanceof BooleanType) {
            return "BOOLEAN";
        }
        if (type instanceof StringType) {
            return "VARCHAR";
        }
        if (type instanceof TemporalType) {
            return "BIGINT";
        }
        return "INTEGER"; // categorical codes
    }

    /**
     * Converts a DataType to the Arrow type of its physical representation.
     *
     * @param type the data type
     * @return the Arrow type
     */
    public static ArrowType toArrowType(DataType type) {
        if (type == null) {
            throw new IllegalArgumentException("type must not be null");
        }
        if (type instanceof IntegerType) {
            IntegerType intType = (IntegerType) type;
            if (intType.bitWidth() == 64) {
                return new ArrowType.Int(64, true);
            }
            return new ArrowType.Int(intType.bitWidth(), intType.signed());
        }
        if (type instanceof FloatType) {
            return new ArrowType.FloatingPoint(((FloatType) type).bitWidth() == 32
                ? FloatingPointPrecision.SINGLE
                : FloatingPointPrecision.DOUBLE);
        }
        if (type instanceof BooleanType) {
            return ArrowType.Bool.INSTANCE;
        }
        if (type instanceof StringType) {
            return ArrowType.Utf8.INSTANCE;
        }
        if (type instanceof TemporalType) {
            return new ArrowType.Int(64, true);
        }
        return new ArrowType.Int(32, true);
    }

    /**
     * Returns the physical dtype a column of the given type has after a trip
     * through the engine, before any categorical re-wrapping.
     *
     * @param type the declared data type
     * @return the physical data type
     */
    public static DataType physicalType(DataType type) {
        if (type instanceof CategoricalType) {
            return IntegerType.int32();
        }
        return type;
    }
}
