package com.framejoin.merge;

import com.framejoin.exception.MergeException;
import com.framejoin.exception.MergeException.Kind;
import com.framejoin.table.Table;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Disambiguates column names shared by both merge inputs.
 *
 * <p>Every shared name that is not a congruent key is renamed on both sides by
 * appending the left and right suffix, and key list entries referring to it are
 * rewritten at the same position so the key pairing is kept. Congruent keys keep
 * their name and are emitted once.
 *
 * <p>The input tables are not modified; renamed copies are returned. Column order
 * and row counts are preserved.
 */
public final class SuffixResolver {

    private static final Logger logger = LoggerFactory.getLogger(SuffixResolver.class);

    private SuffixResolver() {}

    /**
     * Resolves name collisions between the two inputs.
     *
     * @param lhs the left table
     * @param rhs the right table
     * @param keys the validated join keys
     * @param lsuffix the suffix for left columns (null means empty)
     * @param rsuffix the suffix for right columns (null means empty)
     * @return renamed tables and rewritten keys
     * @throws MergeException with {@link Kind#SUFFIX_COLLISION} if the new names collide
     */
    public static ResolvedInputs resolve(Table lhs, Table rhs, JoinKeys keys,
                                         String lsuffix, String rsuffix) {
        String left = lsuffix == null ? "" : lsuffix;
        String right = rsuffix == null ? "" : rsuffix;

        Map<String, String> leftRenames = new HashMap<>();
        Map<String, String> rightRenames = new HashMap<>();
        for (String name : MergeValidator.sharedColumnNames(lhs, rhs)) {
            if (keys.isCongruent(name)) {
                continue;
            }
            leftRenames.put(name, name + left);
            rightRenames.put(name, name + right);
        }
        if (leftRenames.isEmpty()) {
            return new ResolvedInputs(lhs, rhs, keys);
        }

        checkCollisions(lhs, leftRenames, rhs, rightRenames);
        logger.debug("Suffixing overlapping columns: left={}, right={}", leftRenames, rightRenames);

        List<String> leftOn = renameKeys(keys.leftOn(), leftRenames);
        List<String> rightOn = renameKeys(keys.rightOn(), rightRenames);
        return new ResolvedInputs(
            lhs.renameColumns(leftRenames),
            rhs.renameColumns(rightRenames),
            keys.withKeys(leftOn, rightOn));
    }

    /**
     * Rewrites the first occurrence of each renamed key, keeping positions.
     */
    private static List<String> renameKeys(List<String> keyNames, Map<String, String> renames) {
        List<String> renamed = new ArrayList<>(keyNames);
        for (Map.Entry<String, String> rename : renames.entrySet()) {
            int position = renamed.indexOf(rename.getKey());
            if (position >= 0) {
                renamed.set(position, rename.getValue());
            }
        }
        return renamed;
    }

    /**
     * Fails if a new name equals another column of either table, or the two new names are equal.
     */
    private static void checkCollisions(Table lhs, Map<String, String> leftRenames,
                                        Table rhs, Map<String, String> rightRenames) {
        for (Map.Entry<String, String> rename : leftRenames.entrySet()) {
            String name = rename.getKey();
            String newLeft = rename.getValue();
            String newRight = rightRenames.get(name);
            if (newLeft.equals(newRight)) {
                throw new MergeException(Kind.SUFFIX_COLLISION, String.format(
                    "Suffixes map overlapping column '%s' to the same name '%s' on both sides",
                    name, newLeft));
            }
            if (collides(newLeft, name, lhs, leftRenames) || collides(newLeft, null, rhs, rightRenames)
                    || collides(newRight, name, rhs, rightRenames) || collides(newRight, null, lhs, leftRenames)) {
                throw new MergeException(Kind.SUFFIX_COLLISION, String.format(
                    "Suffixing overlapping column '%s' produces a duplicate column name", name));
            }
        }
    }

    /**
     * Checks whether {@code newName} matches a column of {@code table} after that table's renames.
     */
    private static boolean collides(String newName, String source, Table table, Map<String, String> renames) {
        for (String existing : table.columnNames()) {
            if (existing.equals(source)) {
                continue;
            }
            if (renames.getOrDefault(existing, existing).equals(newName)) {
                return true;
            }
        }
        return false;
    }
}
