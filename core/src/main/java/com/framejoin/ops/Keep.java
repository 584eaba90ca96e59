package com.framejoin.ops;

/**
 * Which row of a group of duplicates survives {@link TableOperations#dropDuplicates}.
 */
public enum Keep {
    FIRST,
    LAST,
    /** Drop every row that has a duplicate */
    NONE
}
