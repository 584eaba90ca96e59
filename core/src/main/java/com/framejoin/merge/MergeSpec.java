package com.framejoin.merge;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Parameters of one merge call.
 *
 * <p>Join keys are given by exactly one of:
 * <ul>
 *   <li>{@code on}: column names present in both tables</li>
 *   <li>{@code leftOn}/{@code rightOn}: positionally paired column names</li>
 *   <li>{@code leftIndex}/{@code rightIndex}: the table index, optionally paired with a
 *       single {@code rightOn}/{@code leftOn} column</li>
 * </ul>
 * When none is given, the shared column names are used.
 *
 * <p>Example usage:
 * <pre>
 *   MergeSpec spec = MergeSpec.builder()
 *       .on("id")
 *       .how("left")
 *       .suffixes("_l", "_r")
 *       .build();
 * </pre>
 */
public final class MergeSpec {

    private final List<String> on;
    private final List<String> leftOn;
    private final List<String> rightOn;
    private final boolean leftIndex;
    private final boolean rightIndex;
    private final String how;
    private final String lsuffix;
    private final String rsuffix;
    private final boolean sort;

    private MergeSpec(Builder builder) {
        this.on = builder.on == null ? null : Collections.unmodifiableList(new ArrayList<>(builder.on));
        this.leftOn = Collections.unmodifiableList(new ArrayList<>(builder.leftOn));
        this.rightOn = Collections.unmodifiableList(new ArrayList<>(builder.rightOn));
        this.leftIndex = builder.leftIndex;
        this.rightIndex = builder.rightIndex;
        this.how = builder.how;
        this.lsuffix = builder.lsuffix;
        this.rsuffix = builder.rsuffix;
        this.sort = builder.sort;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns the {@code on} keys, or null if not given.
     */
    public List<String> on() {
        return on;
    }

    public boolean hasOn() {
        return on != null && !on.isEmpty();
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
     * Returns the requested join kind name as given.
     */
    public String how() {
        return how;
    }

    /**
     * Returns the parsed join kind, or null if {@link #how()} is not a known kind.
     */
    public JoinKind joinKind() {
        return JoinKind.parse(how);
    }

    public String lsuffix() {
        return lsuffix;
    }

    public String rsuffix() {
        return rsuffix;
    }

    /**
     * Returns true if at least one non-empty suffix was supplied.
     */
    public boolean hasSuffixes() {
        return (lsuffix != null && !lsuffix.isEmpty()) || (rsuffix != null && !rsuffix.isEmpty());
    }

    public boolean sort() {
        return sort;
    }

    @Override
    public String toString() {
        return String.format(
            "MergeSpec(on=%s, leftOn=%s, rightOn=%s, leftIndex=%s, rightIndex=%s, how=%s, suffixes=(%s, %s), sort=%s)",
            on, leftOn, rightOn, leftIndex, rightIndex, how, lsuffix, rsuffix, sort);
    }

    /**
     * Builder for merge specifications. Defaults to an inner join on the shared
     * column names without suffixes or sorting.
     */
    public static final class Builder {

        private List<String> on;
        private List<String> leftOn = Collections.emptyList();
        private List<String> rightOn = Collections.emptyList();
        private boolean leftIndex;
        private boolean rightIndex;
        private String how = JoinKind.INNER.label();
        private String lsuffix;
        private String rsuffix;
        private boolean sort;

        private Builder() {}

        public Builder on(String... keys) {
            this.on = Arrays.asList(keys);
            return this;
        }

        public Builder on(List<String> keys) {
            this.on = keys;
            return this;
        }

        public Builder leftOn(String... keys) {
            this.leftOn = Arrays.asList(keys);
            return this;
        }

        public Builder leftOn(List<String> keys) {
            this.leftOn = keys == null ? Collections.emptyList() : keys;
            return this;
        }

        public Builder rightOn(String... keys) {
            this.rightOn = Arrays.asList(keys);
            return this;
        }

        public Builder rightOn(List<String> keys) {
            this.rightOn = keys == null ? Collections.emptyList() : keys;
            return this;
        }

        public Builder leftIndex(boolean leftIndex) {
            this.leftIndex = leftIndex;
            return this;
        }

        public Builder rightIndex(boolean rightIndex) {
            this.rightIndex = rightIndex;
            return this;
        }

        public Builder how(String how) {
            this.how = how;
            return this;
        }

        public Builder how(JoinKind kind) {
            this.how = kind.label();
            return this;
        }

        public Builder suffixes(String lsuffix, String rsuffix) {
            this.lsuffix = lsuffix;
            this.rsuffix = rsuffix;
            return this;
        }

        public Builder sort(boolean sort) {
            this.sort = sort;
            return this;
        }

        public MergeSpec build() {
            return new MergeSpec(this);
        }
    }
}
