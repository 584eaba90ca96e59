package com.framejoin.ops;

/**
 * Where nulls sit in a sorted table, whatever the sort direction.
 */
public enum NullPosition {
    FIRST,
    LAST
}
