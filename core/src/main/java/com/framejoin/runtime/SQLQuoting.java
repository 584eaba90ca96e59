package com.framejoin.runtime;

/**
 * Utilities for safely quoting SQL identifiers.
 *
 * <p>Column names of user tables reach DuckDB verbatim, so every identifier the
 * engine emits goes through {@link #quoteIdentifier(String)}.
 *
 * <p>Example usage:
 * <pre>
 *   String column = SQLQuoting.quoteIdentifier("order \"id\"");
 *   // Result: "order ""id"""
 * </pre>
 */
public final class SQLQuoting {

    private SQLQuoting() {}

    /**
     * Quotes an identifier (table name, column name, alias).
     *
     * <p>Uses double quotes and escapes internal quotes according to SQL standard.
     *
     * @param identifier the identifier to quote
     * @return quoted identifier safe for SQL
     * @throws IllegalArgumentException if identifier is null or empty
     */
    public static String quoteIdentifier(String identifier) {
        if (identifier == null || identifier.isEmpty()) {
            throw new IllegalArgumentException("Identifier cannot be null or empty");
        }

        // Escape double quotes by doubling them (SQL standard)
        String escaped = identifier.replace("\"", "\"\"");
        return "\"" + escaped + "\"";
    }

    /**
     * Qualifies a quoted column with a table alias: {@code alias."column"}.
     */
    public static String qualified(String alias, String column) {
        return alias + "." + quoteIdentifier(column);
    }
}
