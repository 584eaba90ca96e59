package com.framejoin.exception;

import java.util.Objects;

/**
 * Exception thrown when a merge request is rejected before the join engine runs.
 *
 * <p>Every failure carries a {@link Kind} so that callers and tests can tell the
 * causes apart without parsing messages. All kinds are deterministic for the same
 * inputs and are raised before either input table has been transformed.
 *
 * <p>Example usage:
 * <pre>
 *   try {
 *       Table result = merger.merge(left, right, spec);
 *   } catch (MergeException e) {
 *       if (e.kind() == MergeException.Kind.AMBIGUOUS_OVERLAP) {
 *           // retry with suffixes
 *       }
 *   }
 * </pre>
 *
 * @see com.framejoin.merge.MergeValidator
 */
public class MergeException extends RuntimeException {

    /**
     * Reasons a merge request can be rejected.
     */
    public enum Kind {
        /** Either side's index is composite (multi-level). */
        UNSUPPORTED_KEY_STRUCTURE,
        /** The join kind is not one of left, inner, outer. */
        UNSUPPORTED_JOIN_KIND,
        /** {@code on} was combined with {@code leftOn} or {@code rightOn}. */
        AMBIGUOUS_KEY_SPEC,
        /** The two sides name a different number of join keys. */
        KEY_COUNT_MISMATCH,
        /** No keys were given and the tables share no column names. */
        NO_JOIN_KEYS,
        /** A shared non-key column name exists and no suffixes were supplied. */
        AMBIGUOUS_OVERLAP,
        /** A named key does not exist in its table. */
        MISSING_KEY,
        /** Both key columns are categorical with different categories. */
        INCOMPATIBLE_CATEGORIES,
        /** The categorical key side would be discarded by the requested join kind. */
        CATEGORICAL_DROPPED,
        /** Applying the suffixes produces duplicate column names. */
        SUFFIX_COLLISION,
        /** A column name reserved for categorical codes already exists. */
        RESERVED_NAME
    }

    private final Kind kind;

    /**
     * Creates a merge exception.
     *
     * @param kind the failure kind
     * @param message the error message
     */
    public MergeException(Kind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /**
     * Returns the failure kind.
     *
     * @return the kind
     */
    public Kind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "MergeException[" + kind + "]: " + getMessage();
    }
}
