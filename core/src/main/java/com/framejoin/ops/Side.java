package com.framejoin.ops;

/**
 * Which end of a run of equal rows {@link TableOperations#searchSorted} reports.
 */
public enum Side {
    /** The first position at which the row could be inserted */
    LEFT,
    /** The position just past the last equal row */
    RIGHT
}
