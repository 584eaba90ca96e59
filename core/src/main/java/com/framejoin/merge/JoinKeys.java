package com.framejoin.merge;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The effective join keys of a merge after {@code on} expansion and key inference.
 *
 * <p>{@code leftOn.get(i)} pairs with {@code rightOn.get(i)}. When an index flag is
 * set, the index takes the place of the (single) key on that side.
 */
public final class JoinKeys {

    private final List<String> leftOn;
    private final List<String> rightOn;
    private final boolean leftIndex;
    private final boolean rightIndex;

    public JoinKeys(List<String> leftOn, List<String> rightOn, boolean leftIndex, boolean rightIndex) {
        this.leftOn = Collections.unmodifiableList(new ArrayList<>(leftOn));
        this.rightOn = Collections.unmodifiableList(new ArrayList<>(rightOn));
        this.leftIndex = leftIndex;
        this.rightIndex = rightIndex;
    }

    public List<String> leftOn() {
        return leftOn;
    }

    public List<String> rightOn() {
        return rightOn;
    }

    public boolean leftIndex() {
        return leftIndex;
    }

    public boolean rightIndex() {
        return rightIndex;
    }

    /**
     * Returns true if either side joins on its index.
     */
    public boolean isIndexJoin() {
        return leftIndex || rightIndex;
    }

    /**
     * Checks whether a name is a congruent key: present in both key lists at the same position.
     *
     * @param name the column name
     * @return true if the name is emitted once, unsuffixed
     */
    public boolean isCongruent(String name) {
        int leftPosition = leftOn.indexOf(name);
        return leftPosition >= 0 && leftPosition == rightOn.indexOf(name);
    }

    /**
     * Checks whether a name is used as a key on either side.
     */
    public boolean isKey(String name) {
        return leftOn.contains(name) || rightOn.contains(name);
    }

    /**
     * Returns a copy with new key lists and the same index flags.
     */
    public JoinKeys withKeys(List<String> newLeftOn, List<String> newRightOn) {
        return new JoinKeys(newLeftOn, newRightOn, leftIndex, rightIndex);
    }

    @Override
    public String toString() {
        return String.format("JoinKeys(leftOn=%s, rightOn=%s, leftIndex=%s, rightIndex=%s)",
            leftOn, rightOn, leftIndex, rightIndex);
    }
}
