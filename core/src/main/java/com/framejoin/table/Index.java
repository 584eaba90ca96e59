package com.framejoin.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Row labels of a {@link Table}: one or more named levels of equal length.
 *
 * <p>An index with more than one level is composite (multi-level). Level names
 * may be null for unnamed levels.
 */
public final class Index {

    private final List<String> names;
    private final List<Column> levels;

    private Index(List<String> names, List<Column> levels) {
        if (levels.isEmpty()) {
            throw new IllegalArgumentException("index must have at least one level");
        }
        if (names.size() != levels.size()) {
            throw new IllegalArgumentException("index names and levels must have the same length");
        }
        int size = levels.get(0).size();
        for (Column level : levels) {
            if (level.size() != size) {
                throw new IllegalArgumentException("index levels must have equal length");
            }
        }
        this.names = Collections.unmodifiableList(new ArrayList<>(names));
        this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
    }

    /**
     * Creates a single-level index.
     *
     * @param name the level name (may be null)
     * @param values the index values
     * @return the index
     */
    public static Index of(String name, Column values) {
        Objects.requireNonNull(values, "values must not be null");
        return new Index(Collections.singletonList(name), Collections.singletonList(values));
    }

    /**
     * Creates a multi-level index.
     *
     * @param names the level names
     * @param levels the level values
     * @return the index
     */
    public static Index multi(List<String> names, List<Column> levels) {
        return new Index(names, levels);
    }

    public boolean isComposite() {
        return levels.size() > 1;
    }

    public int numLevels() {
        return levels.size();
    }

    public int size() {
        return levels.get(0).size();
    }

    public List<String> names() {
        return names;
    }

    public List<Column> levels() {
        return levels;
    }

    /**
     * Returns the name of a single-level index.
     */
    public String name() {
        requireSingleLevel();
        return names.get(0);
    }

    /**
     * Returns the values of a single-level index.
     */
    public Column column() {
        requireSingleLevel();
        return levels.get(0);
    }

    /**
     * Returns a single-level index with the same name and new values.
     */
    public Index withColumn(Column values) {
        requireSingleLevel();
        return of(names.get(0), values);
    }

    private void requireSingleLevel() {
        if (isComposite()) {
            throw new IllegalStateException("index has " + levels.size() + " levels");
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Index)) return false;
        Index that = (Index) obj;
        return names.equals(that.names) && levels.equals(that.levels);
    }

    @Override
    public int hashCode() {
        return Objects.hash(names, levels);
    }

    @Override
    public String toString() {
        return String.format("Index(names=%s, levels=%s)", names, levels);
    }
}
