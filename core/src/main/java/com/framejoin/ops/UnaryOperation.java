package com.framejoin.ops;

/**
 * Element-wise math functions applied by {@link TableOperations#unaryOp}.
 *
 * <p>Each operation renders as a DuckDB expression over a {@code DOUBLE} operand.
 * Inputs outside an operation's domain produce {@code NaN} (or {@code -Infinity}
 * for the logarithm of zero) instead of an error. Nulls stay null.
 */
public enum UnaryOperation {
    SIN("CASE WHEN isinf(%1$s) THEN 'NaN'::DOUBLE ELSE sin(%1$s) END"),
    COS("CASE WHEN isinf(%1$s) THEN 'NaN'::DOUBLE ELSE cos(%1$s) END"),
    TAN("CASE WHEN isinf(%1$s) THEN 'NaN'::DOUBLE ELSE tan(%1$s) END"),
    ASIN("CASE WHEN %1$s < -1 OR %1$s > 1 THEN 'NaN'::DOUBLE ELSE asin(%1$s) END"),
    ACOS("CASE WHEN %1$s < -1 OR %1$s > 1 THEN 'NaN'::DOUBLE ELSE acos(%1$s) END"),
    ATAN("atan(%s)"),
    EXP("exp(%s)"),
    /** Natural logarithm */
    LOG("CASE WHEN isnan(%1$s) OR %1$s < 0 THEN 'NaN'::DOUBLE"
        + " WHEN %1$s = 0 THEN '-Infinity'::DOUBLE ELSE ln(%1$s) END"),
    SQRT("CASE WHEN isnan(%1$s) OR %1$s < 0 THEN 'NaN'::DOUBLE ELSE sqrt(%1$s) END");

    private final String template;

    UnaryOperation(String template) {
        this.template = template;
    }

    /**
     * Renders the operation over an operand expression.
     *
     * @param operand a {@code DOUBLE} SQL expression
     * @return the SQL expression
     */
    public String toSQL(String operand) {
        return String.format(template, operand);
    }
}
