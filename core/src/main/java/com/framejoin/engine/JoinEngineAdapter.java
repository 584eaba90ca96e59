package com.framejoin.engine;

import com.framejoin.table.Table;

/**
 * Executes the physical join of two prepared tables.
 *
 * <p>The returned table holds:
 * <ul>
 *   <li>one column per congruent key pair (shared name, values coalesced across sides)</li>
 *   <li>both columns of every key pair with different names</li>
 *   <li>every non-key column of the left table, then of the right table</li>
 *   <li>categorical columns as their integer codes</li>
 *   <li>an index holding the coalesced index-side key when an index is materialized</li>
 * </ul>
 * Row count follows the join kind; unmatched rows of an outer side carry nulls.
 *
 * <p>A call blocks until the result is fully materialized. Implementations do not
 * retry and do not return partial results: a join either completes or throws.
 */
public interface JoinEngineAdapter {

    /**
     * Executes a join.
     *
     * @param request the normalized join request
     * @return the flat join result
     * @throws com.framejoin.exception.EngineExecutionException if the engine fails
     */
    Table join(JoinRequest request);
}
