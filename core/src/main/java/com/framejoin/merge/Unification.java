package com.framejoin.merge;

import com.framejoin.types.DataType;

/**
 * Outcome of unifying the dtypes of one join key pair.
 *
 * <p>Either a target dtype both sides are cast to, or none when the casting rules
 * have no justified common type (the mismatch is left to the join engine). A
 * categorical key may additionally be marked for code substitution.
 */
public final class Unification {

    /**
     * Which side's categorical key is joined on its decoded values with its codes carried along.
     */
    public enum CodeSubstitution {
        NONE,
        LEFT,
        RIGHT
    }

    private static final Unification NONE = new Unification(null, CodeSubstitution.NONE, null);

    private final DataType targetType;
    private final CodeSubstitution codeSubstitution;
    private final PrecisionWarning warning;

    private Unification(DataType targetType, CodeSubstitution codeSubstitution, PrecisionWarning warning) {
        this.targetType = targetType;
        this.codeSubstitution = codeSubstitution;
        this.warning = warning;
    }

    public static Unification none() {
        return NONE;
    }

    public static Unification to(DataType targetType) {
        return new Unification(targetType, CodeSubstitution.NONE, null);
    }

    public static Unification withCodeSubstitution(DataType valueType, CodeSubstitution side) {
        return new Unification(valueType, side, null);
    }

    /**
     * Returns a copy carrying a precision warning.
     */
    public Unification withWarning(PrecisionWarning newWarning) {
        return new Unification(targetType, codeSubstitution, newWarning);
    }

    /**
     * Returns the target dtype, or null if the pair is not unified.
     */
    public DataType targetType() {
        return targetType;
    }

    public boolean isUnified() {
        return targetType != null;
    }

    public CodeSubstitution codeSubstitution() {
        return codeSubstitution;
    }

    /**
     * Returns the precision warning, or null.
     */
    public PrecisionWarning warning() {
        return warning;
    }

    @Override
    public String toString() {
        return String.format("Unification(target=%s, codes=%s, warning=%s)",
            targetType, codeSubstitution, warning != null);
    }
}
