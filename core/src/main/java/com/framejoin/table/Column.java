package com.framejoin.table;

import com.framejoin.exception.CastException;
import com.framejoin.types.BooleanType;
import com.framejoin.types.CategoricalType;
import com.framejoin.types.DataType;
import com.framejoin.types.FloatType;
import com.framejoin.types.IntegerType;
import com.framejoin.types.StringType;
import com.framejoin.types.TemporalType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, typed, nullable sequence of values.
 *
 * <p>Values are held boxed:
 * <ul>
 *   <li>{@link IntegerType}, {@link TemporalType}: {@code Long}</li>
 *   <li>{@link FloatType}: {@code Double} (float32 values rounded through {@code float})</li>
 *   <li>{@link BooleanType}: {@code Boolean}</li>
 *   <li>{@link StringType}: {@code String}</li>
 *   <li>{@link CategoricalType}: {@code Long} codes into the type's categories</li>
 * </ul>
 * A {@code null} entry is a null value.
 *
 * <p>Example usage:
 * <pre>
 *   Column ids = Column.ofLongs(1L, 2L, null);
 *   if (ids.canCastSafely(FloatType.float64())) {
 *       Column asDouble = ids.cast(FloatType.float64());
 *   }
 * </pre>
 */
public final class Column {

    private static final Object UNSAFE = new Object();

    private final DataType dtype;
    private final List<Object> values;

    private Column(DataType dtype, List<Object> normalizedValues) {
        this.dtype = dtype;
        this.values = Collections.unmodifiableList(normalizedValues);
    }

    // ========================================================================
    // Factories
    // ========================================================================

    /**
     * Creates a column of the given dtype, normalizing each value to its boxed representation.
     *
     * <p>For categorical dtypes the values are codes.
     *
     * @param dtype the column dtype
     * @param values the values (null entries are nulls)
     * @return the column
     * @throws IllegalArgumentException if a value does not fit the dtype
     */
    public static Column of(DataType dtype, List<?> values) {
        Objects.requireNonNull(dtype, "dtype must not be null");
        Objects.requireNonNull(values, "values must not be null");
        List<Object> normalized = new ArrayList<>(values.size());
        for (Object value : values) {
            normalized.add(normalize(dtype, value));
        }
        return new Column(dtype, normalized);
    }

    public static Column ofLongs(Long... values) {
        return of(IntegerType.int64(), Arrays.asList(values));
    }

    public static Column ofInts(Integer... values) {
        return of(IntegerType.int32(), Arrays.asList(values));
    }

    public static Column ofDoubles(Double... values) {
        return of(FloatType.float64(), Arrays.asList(values));
    }

    public static Column ofStrings(String... values) {
        return of(StringType.get(), Arrays.asList(values));
    }

    public static Column ofBooleans(Boolean... values) {
        return of(BooleanType.get(), Arrays.asList(values));
    }

    public static Column ofDatetimes(TemporalType.Resolution resolution, Long... values) {
        return of(TemporalType.datetime(resolution), Arrays.asList(values));
    }

    /**
     * Builds a categorical column from categories and codes.
     *
     * @param categories the distinct category values
     * @param codes integer codes into {@code categories}; nulls are null entries
     * @param ordered whether the categories are ordered
     * @return the categorical column
     * @throws IllegalArgumentException if codes is not an integer column or a code is out of range
     */
    public static Column categorical(Column categories, Column codes, boolean ordered) {
        if (!(codes.dtype() instanceof IntegerType)) {
            throw new IllegalArgumentException("codes must be an integer column, got " + codes.dtype());
        }
        CategoricalType type = new CategoricalType(categories, ordered);
        for (int i = 0; i < codes.size(); i++) {
            Object code = codes.get(i);
            if (code != null && ((Long) code < 0 || (Long) code >= categories.size())) {
                throw new IllegalArgumentException(
                    "code " + code + " at row " + i + " is outside [0, " + categories.size() + ")");
            }
        }
        return new Column(type, new ArrayList<>(codes.values));
    }

    /**
     * Creates a column of {@code size} nulls.
     */
    public static Column nulls(DataType dtype, int size) {
        return new Column(dtype, new ArrayList<>(Collections.nCopies(size, null)));
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public DataType dtype() {
        return dtype;
    }

    public int size() {
        return values.size();
    }

    /**
     * Returns the stored value at a row: the code for categorical columns.
     *
     * @param row the row index
     * @return the value, or null
     */
    public Object get(int row) {
        return values.get(row);
    }

    /**
     * Returns the logical value at a row: the category value for categorical columns.
     *
     * @param row the row index
     * @return the value, or null
     */
    public Object value(int row) {
        Object stored = values.get(row);
        if (stored == null || !(dtype instanceof CategoricalType)) {
            return stored;
        }
        return ((CategoricalType) dtype).categories().get(((Long) stored).intValue());
    }

    /**
     * Returns the stored values (codes for categorical columns).
     */
    public List<Object> values() {
        return values;
    }

    public boolean isNull(int row) {
        return values.get(row) == null;
    }

    public int nullCount() {
        int count = 0;
        for (Object value : values) {
            if (value == null) {
                count++;
            }
        }
        return count;
    }

    public boolean dtypeEquals(DataType other) {
        return dtype.equals(other);
    }

    public boolean isCategorical() {
        return dtype instanceof CategoricalType;
    }

    // ========================================================================
    // Categorical accessors
    // ========================================================================

    public Column categories() {
        return categoricalType().categories();
    }

    /**
     * Returns the codes of a categorical column as an int32 column.
     */
    public Column codes() {
        categoricalType();
        return new Column(IntegerType.int32(), new ArrayList<>(values));
    }

    public boolean ordered() {
        return categoricalType().ordered();
    }

    /**
     * Returns a categorical column's values as a column of the category dtype.
     */
    public Column decode() {
        CategoricalType type = categoricalType();
        List<Object> decoded = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            decoded.add(value(i));
        }
        return new Column(type.valueType(), decoded);
    }

    private CategoricalType categoricalType() {
        if (!(dtype instanceof CategoricalType)) {
            throw new IllegalStateException("Column of type " + dtype + " is not categorical");
        }
        return (CategoricalType) dtype;
    }

    // ========================================================================
    // Null handling
    // ========================================================================

    /**
     * Returns a copy with nulls replaced by a value.
     *
     * @param value the replacement, a logical value of this column's dtype
     * @return the filled column
     */
    public Column fillNulls(Object value) {
        Object replacement;
        if (dtype instanceof CategoricalType) {
            int code = ((CategoricalType) dtype).codeOf(value);
            if (code < 0) {
                throw new IllegalArgumentException("fill value " + value + " is not a category");
            }
            replacement = (long) code;
        } else {
            replacement = normalize(dtype, value);
        }
        List<Object> filled = new ArrayList<>(values.size());
        for (Object v : values) {
            filled.add(v == null ? replacement : v);
        }
        return new Column(dtype, filled);
    }

    /**
     * Returns a copy with nulls replaced by the dtype's neutral value
     * (zero, false, the empty string, or the first category).
     */
    public Column fillNullsWithNeutral() {
        if (nullCount() == 0) {
            return this;
        }
        if (dtype instanceof CategoricalType) {
            Column categories = categories();
            return categories.size() == 0 ? this : fillNulls(categories.get(0));
        }
        return fillNulls(neutralValue(dtype));
    }

    private static Object neutralValue(DataType type) {
        if (type instanceof FloatType) {
            return 0.0d;
        }
        if (type instanceof BooleanType) {
            return Boolean.FALSE;
        }
        if (type instanceof StringType) {
            return "";
        }
        return 0L;
    }

    // ========================================================================
    // Casting
    // ========================================================================

    /**
     * Checks whether every non-null value converts to {@code target} without
     * overflow, truncation or loss of precision.
     *
     * @param target the target dtype
     * @return true if {@link #cast(DataType)} would succeed
     */
    public boolean canCastSafely(DataType target) {
        if (dtype.equals(target)) {
            return true;
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) != null && convertValue(value(i), logicalType(), target) == UNSAFE) {
                return false;
            }
        }
        return true;
    }

    /**
     * Converts this column to {@code target}.
     *
     * @param target the target dtype
     * @return the converted column (this column if the dtypes are equal)
     * @throws CastException if a value cannot be converted safely
     */
    public Column cast(DataType target) {
        Objects.requireNonNull(target, "target must not be null");
        if (dtype.equals(target)) {
            return this;
        }
        List<Object> converted = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                converted.add(null);
                continue;
            }
            Object result = convertValue(value(i), logicalType(), target);
            if (result == UNSAFE) {
                throw new CastException(String.format(
                    "Cannot safely cast value %s at row %d from %s to %s",
                    value(i), i, dtype.typeName(), target.typeName()), dtype, target);
            }
            converted.add(result);
        }
        return new Column(target, converted);
    }

    private DataType logicalType() {
        return dtype instanceof CategoricalType ? ((CategoricalType) dtype).valueType() : dtype;
    }

    /**
     * Converts one logical value, returning {@link #UNSAFE} when the conversion loses information.
     */
    private static Object convertValue(Object value, DataType from, DataType to) {
        if (to instanceof CategoricalType) {
            CategoricalType categorical = (CategoricalType) to;
            Object asCategory = convertValue(value, from, categorical.valueType());
            if (asCategory == UNSAFE) {
                return UNSAFE;
            }
            int code = categorical.codeOf(asCategory);
            return code < 0 ? UNSAFE : (Object) (long) code;
        }
        if (from.equals(to)) {
            return value;
        }
        if (from instanceof IntegerType) {
            return convertLong((Long) value, to);
        }
        if (from instanceof FloatType) {
            return convertDouble((Double) value, to);
        }
        if (from instanceof BooleanType) {
            boolean b = (Boolean) value;
            if (to instanceof IntegerType) {
                return b ? 1L : 0L;
            }
            if (to instanceof FloatType) {
                return b ? 1.0d : 0.0d;
            }
            return UNSAFE;
        }
        if (from instanceof TemporalType && to instanceof TemporalType) {
            return convertTemporal((Long) value, (TemporalType) from, (TemporalType) to);
        }
        return UNSAFE;
    }

    private static Object convertLong(long value, DataType to) {
        if (to instanceof IntegerType) {
            return ((IntegerType) to).contains(value) ? (Object) value : UNSAFE;
        }
        if (to instanceof FloatType) {
            FloatType floatType = (FloatType) to;
            if (Math.abs(value) > floatType.exactIntegerLimit()) {
                return UNSAFE;
            }
            return floatType.bitWidth() == 32 ? (double) (float) value : (double) value;
        }
        return UNSAFE;
    }

    private static Object convertDouble(double value, DataType to) {
        if (to instanceof FloatType) {
            if (((FloatType) to).bitWidth() == 64) {
                return value;
            }
            if (Double.isNaN(value) || Double.isInfinite(value) || (double) (float) value == value) {
                return (double) (float) value;
            }
            return UNSAFE;
        }
        if (to instanceof IntegerType) {
            if (Double.isNaN(value) || Double.isInfinite(value) || value != Math.rint(value)) {
                return UNSAFE;
            }
            if (value < -0x1p63 || value >= 0x1p63) {
                return UNSAFE;
            }
            long asLong = (long) value;
            return ((IntegerType) to).contains(asLong) ? (Object) asLong : UNSAFE;
        }
        return UNSAFE;
    }

    private static Object convertTemporal(long value, TemporalType from, TemporalType to) {
        if (from.kind() != to.kind()) {
            return UNSAFE;
        }
        long fromPerSecond = from.resolution().perSecond();
        long toPerSecond = to.resolution().perSecond();
        if (toPerSecond >= fromPerSecond) {
            try {
                return Math.multiplyExact(value, toPerSecond / fromPerSecond);
            } catch (ArithmeticException e) {
                return UNSAFE;
            }
        }
        long factor = fromPerSecond / toPerSecond;
        return value % factor == 0 ? (Object) (value / factor) : UNSAFE;
    }

    // ========================================================================
    // Normalization
    // ========================================================================

    private static Object normalize(DataType dtype, Object value) {
        if (value == null) {
            return null;
        }
        if (dtype instanceof IntegerType) {
            long asLong = integralValue(value, dtype);
            if (!((IntegerType) dtype).contains(asLong)) {
                throw new IllegalArgumentException(value + " is out of range for " + dtype);
            }
            return asLong;
        }
        if (dtype instanceof FloatType) {
            if (!(value instanceof Number)) {
                throw new IllegalArgumentException("Expected a number for " + dtype + ", got " + value);
            }
            double d = ((Number) value).doubleValue();
            return ((FloatType) dtype).bitWidth() == 32 ? (double) (float) d : d;
        }
        if (dtype instanceof BooleanType) {
            if (!(value instanceof Boolean)) {
                throw new IllegalArgumentException("Expected a boolean, got " + value);
            }
            return value;
        }
        if (dtype instanceof StringType) {
            return value.toString();
        }
        if (dtype instanceof TemporalType) {
            return integralValue(value, dtype);
        }
        CategoricalType categorical = (CategoricalType) dtype;
        long code = integralValue(value, dtype);
        if (code < 0 || code >= categorical.categories().size()) {
            throw new IllegalArgumentException("code " + code + " is not a valid category code");
        }
        return code;
    }

    private static long integralValue(Object value, DataType dtype) {
        if (value instanceof Long || value instanceof Integer
                || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        throw new IllegalArgumentException("Expected an integral value for " + dtype + ", got " + value);
    }

    // ========================================================================
    // Object methods
    // ========================================================================

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Column)) return false;
        Column that = (Column) obj;
        return dtype.equals(that.dtype) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dtype, values);
    }

    @Override
    public String toString() {
        return String.format("Column(%s, %s)", dtype.typeName(), values);
    }
}
