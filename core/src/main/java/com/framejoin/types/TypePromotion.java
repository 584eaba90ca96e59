package com.framejoin.types;

/**
 * Numeric and temporal type promotion rules used when two key columns of
 * different dtypes must be brought to a common type.
 *
 * <h2>Promotion rules</h2>
 * <ul>
 *   <li>Same kind (signed/signed, unsigned/unsigned, float/float): the wider type</li>
 *   <li>Signed and unsigned integers: the narrowest signed type holding both ranges;
 *       {@code uint64} with any signed type promotes to {@code float64}</li>
 *   <li>Integer and float: {@code float32} when the integer has at most 16 bits and the
 *       float is 32 bits, {@code float64} otherwise</li>
 *   <li>Temporal types of the same kind: the finer resolution</li>
 * </ul>
 */
public final class TypePromotion {

    private TypePromotion() {
        // Utility class - prevent instantiation
    }

    // ========================================================================
    // Numeric Type Promotion
    // ========================================================================

    /**
     * Checks whether two numeric types belong to the same kind.
     *
     * @param left the left type
     * @param right the right type
     * @return true for two floats, two signed integers or two unsigned integers
     */
    public static boolean isSameNumericKind(DataType left, DataType right) {
        if (left instanceof FloatType && right instanceof FloatType) {
            return true;
        }
        if (left instanceof IntegerType && right instanceof IntegerType) {
            return ((IntegerType) left).signed() == ((IntegerType) right).signed();
        }
        return false;
    }

    /**
     * Returns the wider of two numeric types of the same kind.
     *
     * @param left the left type
     * @param right the right type
     * @return the wider type (left on ties)
     * @throws IllegalArgumentException if the kinds differ
     */
    public static DataType wider(DataType left, DataType right) {
        if (!isSameNumericKind(left, right)) {
            throw new IllegalArgumentException(
                "Cannot pick wider of different kinds: " + left + ", " + right);
        }
        return left.defaultSize() >= right.defaultSize() ? left : right;
    }

    /**
     * Promotes two numeric types to the smallest type representing both value ranges.
     *
     * @param left the left operand type
     * @param right the right operand type
     * @return the promoted type
     * @throws IllegalArgumentException if either type is not numeric
     */
    public static DataType promoteNumericTypes(DataType left, DataType right) {
        if (!left.isNumeric() || !right.isNumeric()) {
            throw new IllegalArgumentException(
                "Numeric promotion requires numeric types: " + left + ", " + right);
        }
        if (isSameNumericKind(left, right)) {
            return wider(left, right);
        }

        // Integer with float
        if (left instanceof FloatType || right instanceof FloatType) {
            FloatType floatType = (FloatType) (left instanceof FloatType ? left : right);
            IntegerType intType = (IntegerType) (left instanceof FloatType ? right : left);
            if (floatType.bitWidth() == 32 && intType.bitWidth() <= 16) {
                return FloatType.float32();
            }
            return FloatType.float64();
        }

        // Signed with unsigned
        IntegerType signedType = ((IntegerType) left).signed() ? (IntegerType) left : (IntegerType) right;
        IntegerType unsignedType = ((IntegerType) left).signed() ? (IntegerType) right : (IntegerType) left;
        if (unsignedType.bitWidth() < signedType.bitWidth()) {
            return signedType;
        }
        if (unsignedType.bitWidth() == 64) {
            return FloatType.float64();
        }
        return IntegerType.of(unsignedType.bitWidth() * 2, true);
    }

    // ========================================================================
    // Temporal Type Promotion
    // ========================================================================

    /**
     * Returns the finer-resolution type of two temporal types of the same kind.
     *
     * @param left the left type
     * @param right the right type
     * @return the finer type, or null if the kinds differ
     */
    public static TemporalType finerTemporal(TemporalType left, TemporalType right) {
        if (left.kind() != right.kind()) {
            return null;
        }
        return left.resolution().isAtLeastAsFineAs(right.resolution()) ? left : right;
    }
}
