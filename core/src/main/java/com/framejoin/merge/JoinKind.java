package com.framejoin.merge;

import java.util.Locale;

/**
 * Join kinds understood by the casting rules.
 *
 * <p>{@link #RIGHT} is defined because the casting rules treat it symmetrically
 * to {@link #LEFT}; merge requests only accept {@link #LEFT}, {@link #INNER}
 * and {@link #OUTER}.
 */
public enum JoinKind {
    LEFT("left"),
    RIGHT("right"),
    INNER("inner"),
    OUTER("outer");

    private final String label;

    JoinKind(String label) {
        this.label = label;
    }

    /**
     * Returns the lowercase name used in merge requests.
     */
    public String label() {
        return label;
    }

    /**
     * Returns true if a merge request may use this join kind.
     */
    public boolean isMergeable() {
        return this != RIGHT;
    }

    /**
     * Parses a join kind name (case-insensitive).
     *
     * @param how "left", "right", "inner" or "outer"
     * @return the join kind, or null if the name is not recognized
     */
    public static JoinKind parse(String how) {
        if (how == null) {
            return null;
        }
        String normalized = how.trim().toLowerCase(Locale.ROOT);
        for (JoinKind kind : values()) {
            if (kind.label.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }

    @Override
    public String toString() {
        return label;
    }
}
