package com.framejoin.types;

import java.util.Objects;

/**
 * Data type representing a fixed-width signed or unsigned integer.
 *
 * <p>Supported widths are 8, 16, 32 and 64 bits. Values of all widths are
 * held as {@code Long}; {@code uint64} values are limited to the non-negative
 * range of a {@code long}.
 */
public final class IntegerType implements DataType {

    private static final IntegerType INT8 = new IntegerType(8, true);
    private static final IntegerType INT16 = new IntegerType(16, true);
    private static final IntegerType INT32 = new IntegerType(32, true);
    private static final IntegerType INT64 = new IntegerType(64, true);
    private static final IntegerType UINT8 = new IntegerType(8, false);
    private static final IntegerType UINT16 = new IntegerType(16, false);
    private static final IntegerType UINT32 = new IntegerType(32, false);
    private static final IntegerType UINT64 = new IntegerType(64, false);

    private final int bitWidth;
    private final boolean signed;

    private IntegerType(int bitWidth, boolean signed) {
        this.bitWidth = bitWidth;
        this.signed = signed;
    }

    /**
     * Returns the integer type with the given width and signedness.
     *
     * @param bitWidth the width in bits (8, 16, 32 or 64)
     * @param signed whether the type is signed
     * @return the integer type
     * @throws IllegalArgumentException if the width is not supported
     */
    public static IntegerType of(int bitWidth, boolean signed) {
        switch (bitWidth) {
            case 8:
                return signed ? INT8 : UINT8;
            case 16:
                return signed ? INT16 : UINT16;
            case 32:
                return signed ? INT32 : UINT32;
            case 64:
                return signed ? INT64 : UINT64;
            default:
                throw new IllegalArgumentException("Unsupported integer width: " + bitWidth);
        }
    }

    public static IntegerType int8() {
        return INT8;
    }

    public static IntegerType int16() {
        return INT16;
    }

    public static IntegerType int32() {
        return INT32;
    }

    public static IntegerType int64() {
        return INT64;
    }

    public static IntegerType uint8() {
        return UINT8;
    }

    public static IntegerType uint16() {
        return UINT16;
    }

    public static IntegerType uint32() {
        return UINT32;
    }

    public static IntegerType uint64() {
        return UINT64;
    }

    public int bitWidth() {
        return bitWidth;
    }

    public boolean signed() {
        return signed;
    }

    /**
     * Returns the smallest value representable by this type.
     */
    public long minValue() {
        if (!signed) {
            return 0L;
        }
        return bitWidth == 64 ? Long.MIN_VALUE : -(1L << (bitWidth - 1));
    }

    /**
     * Returns the largest value representable by this type.
     *
     * <p>For {@code uint64} this is {@link Long#MAX_VALUE}.
     */
    public long maxValue() {
        if (bitWidth == 64) {
            return Long.MAX_VALUE;
        }
        return signed ? (1L << (bitWidth - 1)) - 1 : (1L << bitWidth) - 1;
    }

    /**
     * Checks whether a value lies in the range of this type.
     *
     * @param value the value to check
     * @return true if the value is representable
     */
    public boolean contains(long value) {
        return value >= minValue() && value <= maxValue();
    }

    @Override
    public String typeName() {
        return (signed ? "int" : "uint") + bitWidth;
    }

    @Override
    public int defaultSize() {
        return bitWidth / 8;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IntegerType)) return false;
        IntegerType that = (IntegerType) obj;
        return bitWidth == that.bitWidth && signed == that.signed;
    }

    @Override
    public int hashCode() {
        return Objects.hash(bitWidth, signed);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
