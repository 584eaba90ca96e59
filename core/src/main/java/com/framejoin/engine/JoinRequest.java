package com.framejoin.engine;

import com.framejoin.merge.JoinKind;
import com.framejoin.table.Table;

import java.util.Objects;

/**
 * A normalized join handed to a {@link JoinEngineAdapter}: names are already
 * disambiguated and key columns already cast to common dtypes.
 *
 * @param left the left table
 * @param right the right table
 * @param leftKeys the left keys
 * @param rightKeys the right keys, paired positionally with {@code leftKeys}
 * @param kind the join kind
 * @param materializeLeftIndex whether the result carries the left index key
 * @param materializeRightIndex whether the result carries the right index key
 */
public record JoinRequest(Table left, Table right,
                          KeySelection leftKeys, KeySelection rightKeys,
                          JoinKind kind,
                          boolean materializeLeftIndex, boolean materializeRightIndex) {

    public JoinRequest {
        Objects.requireNonNull(left, "left must not be null");
        Objects.requireNonNull(right, "right must not be null");
        Objects.requireNonNull(leftKeys, "leftKeys must not be null");
        Objects.requireNonNull(rightKeys, "rightKeys must not be null");
        Objects.requireNonNull(kind, "kind must not be null");
        if (leftKeys.size() != rightKeys.size()) {
            throw new IllegalArgumentException("left and right key counts differ");
        }
    }
}
