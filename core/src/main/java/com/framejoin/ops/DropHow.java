package com.framejoin.ops;

/**
 * Decides when a row (or column) with nulls is dropped.
 */
public enum DropHow {
    /** Drop when at least one considered value is null */
    ANY,
    /** Drop only when every considered value is null */
    ALL
}
