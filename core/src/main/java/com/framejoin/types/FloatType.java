package com.framejoin.types;

/**
 * Data type representing an IEEE 754 floating point number of 32 or 64 bits.
 */
public final class FloatType implements DataType {

    private static final FloatType FLOAT32 = new FloatType(32);
    private static final FloatType FLOAT64 = new FloatType(64);

    private final int bitWidth;

    private FloatType(int bitWidth) {
        this.bitWidth = bitWidth;
    }

    /**
     * Returns the floating point type of the given width.
     *
     * @param bitWidth 32 or 64
     * @return the floating point type
     * @throws IllegalArgumentException if the width is not supported
     */
    public static FloatType of(int bitWidth) {
        if (bitWidth == 32) {
            return FLOAT32;
        }
        if (bitWidth == 64) {
            return FLOAT64;
        }
        throw new IllegalArgumentException("Unsupported floating point width: " + bitWidth);
    }

    public static FloatType float32() {
        return FLOAT32;
    }

    public static FloatType float64() {
        return FLOAT64;
    }

    public int bitWidth() {
        return bitWidth;
    }

    /**
     * Returns the number of integer values exactly representable on either side of zero,
     * i.e. 2^24 for float32 and 2^53 for float64.
     */
    public long exactIntegerLimit() {
        return bitWidth == 32 ? 1L << 24 : 1L << 53;
    }

    @Override
    public String typeName() {
        return "float" + bitWidth;
    }

    @Override
    public int defaultSize() {
        return bitWidth / 8;
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof FloatType && ((FloatType) obj).bitWidth == bitWidth;
    }

    @Override
    public int hashCode() {
        return Integer.hashCode(bitWidth);
    }

    @Override
    public String toString() {
        return typeName();
    }
}
