package com.framejoin.merge;

import com.framejoin.exception.MergeException;
import com.framejoin.exception.MergeException.Kind;
import com.framejoin.table.Table;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Validates merge requests before any renaming, casting or engine work.
 *
 * <p>Validation rules, checked in this order:
 * <ol>
 *   <li>Neither table may have a composite (multi-level) index</li>
 *   <li>The join kind must be one of left, inner, outer</li>
 *   <li>{@code on} must not be combined with {@code leftOn}/{@code rightOn}, and an
 *       index flag must not be combined with key columns on the same side</li>
 *   <li>Both sides must name the same number of keys, counting an index as one</li>
 *   <li>Without explicit keys, the tables must share at least one column name</li>
 *   <li>Shared column names that are not congruent keys require suffixes</li>
 *   <li>Every named key (and every requested index) must exist</li>
 * </ol>
 *
 * <p>Validation never modifies the tables.
 *
 * @see MergeException
 */
public class MergeValidator {

    /**
     * Validates a merge request and returns its effective join keys.
     *
     * @param lhs the left table
     * @param rhs the right table
     * @param spec the merge specification
     * @return the join keys after {@code on} expansion and key inference
     * @throws MergeException if the request is invalid
     * @throws NullPointerException if any argument is null
     */
    public static JoinKeys validate(Table lhs, Table rhs, MergeSpec spec) {
        Objects.requireNonNull(lhs, "lhs must not be null");
        Objects.requireNonNull(rhs, "rhs must not be null");
        Objects.requireNonNull(spec, "spec must not be null");

        validateKeyStructure(lhs, rhs);
        validateJoinKind(spec);
        validateKeySources(spec);
        validateKeyCount(spec);

        List<String> sharedNames = sharedColumnNames(lhs, rhs);
        validateKeysPresent(spec, sharedNames);

        JoinKeys keys = effectiveKeys(spec, sharedNames);
        validateOverlap(keys, spec, sharedNames);
        validateKeysExist(lhs, rhs, spec, keys);
        return keys;
    }

    /**
     * Returns the column names present in both tables, in left-table order.
     *
     * @param lhs the left table
     * @param rhs the right table
     * @return the shared names
     */
    public static List<String> sharedColumnNames(Table lhs, Table rhs) {
        List<String> shared = new ArrayList<>();
        for (String name : lhs.columnNames()) {
            if (rhs.hasColumn(name)) {
                shared.add(name);
            }
        }
        return shared;
    }

    /**
     * Rejects composite indexes on either side.
     */
    private static void validateKeyStructure(Table lhs, Table rhs) {
        if ((lhs.hasIndex() && lhs.index().isComposite())
                || (rhs.hasIndex() && rhs.index().isComposite())) {
            throw new MergeException(Kind.UNSUPPORTED_KEY_STRUCTURE,
                "Joins on multi-level indexes are not supported");
        }
    }

    /**
     * Requires one of the mergeable join kinds.
     */
    private static void validateJoinKind(MergeSpec spec) {
        JoinKind kind = spec.joinKind();
        if (kind == null || !kind.isMergeable()) {
            throw new MergeException(Kind.UNSUPPORTED_JOIN_KIND,
                String.format("'%s' merge is not supported; use left, inner or outer", spec.how()));
        }
    }

    /**
     * Rejects combinations of key sources that make the key pairing ambiguous.
     */
    private static void validateKeySources(MergeSpec spec) {
        if (spec.hasOn() && (!spec.leftOn().isEmpty() || !spec.rightOn().isEmpty())) {
            throw new MergeException(Kind.AMBIGUOUS_KEY_SPEC,
                "Can only pass 'on' OR 'leftOn' and 'rightOn', not a combination of both");
        }
        if (spec.hasOn() && spec.leftIndex() && spec.rightIndex()) {
            throw new MergeException(Kind.AMBIGUOUS_KEY_SPEC,
                "Can only pass 'on' OR 'leftIndex' and 'rightIndex', not a combination of both");
        }
        if ((spec.leftIndex() && !spec.leftOn().isEmpty())
                || (spec.rightIndex() && !spec.rightOn().isEmpty())) {
            throw new MergeException(Kind.AMBIGUOUS_KEY_SPEC,
                "Can only join a side on its index OR on key columns, not both");
        }
    }

    /**
     * Requires the same total number of keys on both sides.
     */
    private static void validateKeyCount(MergeSpec spec) {
        int onCount = spec.hasOn() ? spec.on().size() : 0;
        int leftCount = onCount + spec.leftOn().size() + (spec.leftIndex() ? 1 : 0);
        int rightCount = onCount + spec.rightOn().size() + (spec.rightIndex() ? 1 : 0);
        if (leftCount != rightCount) {
            throw new MergeException(Kind.KEY_COUNT_MISMATCH, String.format(
                "Merge operands must have the same number of join keys (left %d, right %d)",
                leftCount, rightCount));
        }
    }

    /**
     * Requires shared column names when no keys are given.
     */
    private static void validateKeysPresent(MergeSpec spec, List<String> sharedNames) {
        boolean explicitKeys = spec.hasOn() || !spec.leftOn().isEmpty() || !spec.rightOn().isEmpty()
            || spec.leftIndex() || spec.rightIndex();
        if (!explicitKeys && sharedNames.isEmpty()) {
            throw new MergeException(Kind.NO_JOIN_KEYS, "No common columns to perform merge on");
        }
    }

    /**
     * Requires suffixes when a shared name is not a congruent key.
     */
    private static void validateOverlap(JoinKeys keys, MergeSpec spec, List<String> sharedNames) {
        if (spec.hasSuffixes()) {
            return;
        }
        for (String name : sharedNames) {
            if (!keys.isCongruent(name)) {
                throw new MergeException(Kind.AMBIGUOUS_OVERLAP, String.format(
                    "Column '%s' exists in both tables but is not a common join key, "
                        + "and no suffixes were supplied", name));
            }
        }
    }

    /**
     * Requires every named key and every requested index to exist.
     */
    private static void validateKeysExist(Table lhs, Table rhs, MergeSpec spec, JoinKeys keys) {
        if (spec.hasOn()) {
            for (String key : spec.on()) {
                if (!lhs.hasColumn(key) || !rhs.hasColumn(key)) {
                    throw new MergeException(Kind.MISSING_KEY,
                        String.format("Key '%s' not in both operands", key));
                }
            }
        } else {
            for (String key : keys.leftOn()) {
                if (!lhs.hasColumn(key)) {
                    throw new MergeException(Kind.MISSING_KEY,
                        String.format("Key '%s' not in left operand", key));
                }
            }
            for (String key : keys.rightOn()) {
                if (!rhs.hasColumn(key)) {
                    throw new MergeException(Kind.MISSING_KEY,
                        String.format("Key '%s' not in right operand", key));
                }
            }
        }
        if (keys.leftIndex() && !lhs.hasIndex()) {
            throw new MergeException(Kind.MISSING_KEY, "Left operand has no index to join on");
        }
        if (keys.rightIndex() && !rhs.hasIndex()) {
            throw new MergeException(Kind.MISSING_KEY, "Right operand has no index to join on");
        }
    }

    /**
     * Expands {@code on} and infers keys from the shared names when none are given.
     */
    private static JoinKeys effectiveKeys(MergeSpec spec, List<String> sharedNames) {
        if (spec.hasOn()) {
            return new JoinKeys(spec.on(), spec.on(), false, false);
        }
        boolean noKeys = spec.leftOn().isEmpty() && spec.rightOn().isEmpty()
            && !spec.leftIndex() && !spec.rightIndex();
        if (noKeys) {
            return new JoinKeys(sharedNames, sharedNames, false, false);
        }
        return new JoinKeys(spec.leftOn(), spec.rightOn(), spec.leftIndex(), spec.rightIndex());
    }
}
