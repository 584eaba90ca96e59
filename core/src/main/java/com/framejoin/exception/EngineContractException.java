package com.framejoin.exception;

/**
 * Internal error raised when the join engine's output breaks the contract the
 * result assembler relies on, for example by returning a column that cannot be
 * placed in the result.
 *
 * <p>This is never a user input error; it signals a defect in the merge layer
 * or the engine adapter and must not be caught and ignored.
 */
public class EngineContractException extends IllegalStateException {

    private final String columnName;

    /**
     * Creates an engine contract exception.
     *
     * @param message the error message
     * @param columnName the offending engine output column (may be null)
     */
    public EngineContractException(String message, String columnName) {
        super(message);
        this.columnName = columnName;
    }

    public String columnName() {
        return columnName;
    }
}
