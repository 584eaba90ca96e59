package com.framejoin.merge;

import com.framejoin.table.Table;

/**
 * Merge inputs after name disambiguation: renamed copies of both tables and the
 * join keys rewritten to the new names.
 *
 * @param left the left table with suffixed names
 * @param right the right table with suffixed names
 * @param keys the join keys referring to the new names
 */
public record ResolvedInputs(Table left, Table right, JoinKeys keys) {
}
