package com.framejoin.exception;

import com.framejoin.types.DataType;

/**
 * Exception thrown when a column cannot be converted to another dtype without
 * overflow, truncation or loss of precision.
 */
public class CastException extends RuntimeException {

    private final DataType sourceType;
    private final DataType targetType;

    /**
     * Creates a cast exception.
     *
     * @param message the error message
     * @param sourceType the column's dtype
     * @param targetType the requested dtype
     */
    public CastException(String message, DataType sourceType, DataType targetType) {
        super(message);
        this.sourceType = sourceType;
        this.targetType = targetType;
    }

    public DataType sourceType() {
        return sourceType;
    }

    public DataType targetType() {
        return targetType;
    }
}
