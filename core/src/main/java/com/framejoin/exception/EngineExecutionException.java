package com.framejoin.exception;

/**
 * Exception thrown when the execution engine fails to run a join or table operation.
 *
 * <p>This exception wraps the engine's {@code SQLException} together with the
 * statement that failed, so that a rejected key type mismatch or a resource
 * problem can be traced back to the generated SQL.
 *
 * @see com.framejoin.engine.DuckDBJoinEngine
 */
public class EngineExecutionException extends RuntimeException {

    private final String failedSQL;

    /**
     * Creates a join engine exception with a cause.
     *
     * @param message the error message
     * @param cause the underlying cause (typically SQLException)
     * @param sql the SQL that failed to execute (may be null)
     */
    public EngineExecutionException(String message, Throwable cause, String sql) {
        super(message, cause);
        this.failedSQL = sql;
    }

    /**
     * Returns the SQL statement that failed to execute.
     *
     * @return the failed SQL, or null if not available
     */
    public String getFailedSQL() {
        return failedSQL;
    }

    /**
     * Returns a user-friendly error message.
     *
     * <p>Translates the most common engine errors into actionable guidance.
     *
     * @return user-friendly error message
     */
    public String getUserMessage() {
        String message = getMessage();
        if (message == null) {
            return "Engine execution failed.";
        }
        if (message.contains("Binder Error") && message.contains("Cannot compare")) {
            return "Join key types are not comparable and could not be unified. "
                + "Cast the key columns to a common type before merging.";
        }
        if (message.contains("Conversion Error")) {
            return "Join key values could not be converted to a common type. "
                + "Check that key columns hold compatible values.";
        }
        if (message.contains("Out of Memory Error")) {
            return "Join requires more memory than available. "
                + "Try reducing the input sizes or increasing the memory limit.";
        }
        return "Engine execution failed: " + message;
    }
}
