package com.framejoin.table;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable ordered mapping from column name to {@link Column}, plus an
 * optional {@link Index}.
 *
 * <p>Column names are unique and every column (and the index) has the same
 * number of rows. Modifying methods return new tables and never change this one.
 *
 * <p>Example usage:
 * <pre>
 *   Table orders = Table.builder()
 *       .column("id", Column.ofLongs(1L, 2L, 3L))
 *       .column("amount", Column.ofDoubles(9.5, 12.0, 3.25))
 *       .build();
 * </pre>
 */
public final class Table {

    private final LinkedHashMap<String, Column> columns;
    private final Index index;
    private final int numRows;

    private Table(LinkedHashMap<String, Column> columns, Index index) {
        int rows = -1;
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            Objects.requireNonNull(entry.getKey(), "column name must not be null");
            int size = entry.getValue().size();
            if (rows >= 0 && size != rows) {
                throw new IllegalArgumentException(String.format(
                    "column '%s' has %d rows, expected %d", entry.getKey(), size, rows));
            }
            rows = size;
        }
        if (index != null) {
            if (rows >= 0 && index.size() != rows) {
                throw new IllegalArgumentException(String.format(
                    "index has %d rows, expected %d", index.size(), rows));
            }
            rows = index.size();
        }
        this.columns = columns;
        this.index = index;
        this.numRows = Math.max(rows, 0);
    }

    /**
     * Creates a table from an ordered column mapping.
     *
     * @param columns the columns in order
     * @param index the index (may be null)
     * @return the table
     */
    public static Table of(Map<String, Column> columns, Index index) {
        return new Table(new LinkedHashMap<>(columns), index);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Accessors
    // ========================================================================

    public int numRows() {
        return numRows;
    }

    public int numColumns() {
        return columns.size();
    }

    /**
     * Returns the column names in order.
     */
    public List<String> columnNames() {
        return Collections.unmodifiableList(new ArrayList<>(columns.keySet()));
    }

    /**
     * Returns an unmodifiable view of the ordered column mapping.
     */
    public Map<String, Column> columns() {
        return Collections.unmodifiableMap(columns);
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Returns a column by name.
     *
     * @param name the column name
     * @return the column
     * @throws IllegalArgumentException if there is no such column
     */
    public Column column(String name) {
        Column column = columns.get(name);
        if (column == null) {
            throw new IllegalArgumentException(
                "Column '" + name + "' not found. Available columns: " + columns.keySet());
        }
        return column;
    }

    /**
     * Returns the index, or null if the table has none.
     */
    public Index index() {
        return index;
    }

    public boolean hasIndex() {
        return index != null;
    }

    /**
     * Returns the logical values of one row keyed by column name.
     *
     * @param row the row index
     * @return the row as an ordered map
     */
    public Map<String, Object> row(int row) {
        Map<String, Object> values = new LinkedHashMap<>();
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            values.put(entry.getKey(), entry.getValue().value(row));
        }
        return values;
    }

    // ========================================================================
    // Derivations
    // ========================================================================

    /**
     * Returns a table with a column replaced in place, or appended when the name is new.
     */
    public Table withColumn(String name, Column column) {
        LinkedHashMap<String, Column> copy = new LinkedHashMap<>(columns);
        copy.put(name, column);
        return new Table(copy, index);
    }

    /**
     * Returns a table whose columns are renamed according to {@code renames},
     * keeping column order. Names missing from the map keep their name.
     *
     * @param renames old name to new name
     * @return the renamed table
     * @throws IllegalArgumentException if the renaming produces duplicate names
     */
    public Table renameColumns(Map<String, String> renames) {
        LinkedHashMap<String, Column> copy = new LinkedHashMap<>();
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            String name = renames.getOrDefault(entry.getKey(), entry.getKey());
            if (copy.put(name, entry.getValue()) != null) {
                throw new IllegalArgumentException("Renaming produces duplicate column '" + name + "'");
            }
        }
        return new Table(copy, index);
    }

    public Table withIndex(Index newIndex) {
        return new Table(new LinkedHashMap<>(columns), newIndex);
    }

    /**
     * Returns a table holding the named columns in the given order.
     */
    public Table select(List<String> names) {
        LinkedHashMap<String, Column> selected = new LinkedHashMap<>();
        for (String name : names) {
            selected.put(name, column(name));
        }
        return new Table(selected, index);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Table)) return false;
        Table that = (Table) obj;
        return new ArrayList<>(columns.entrySet()).equals(new ArrayList<>(that.columns.entrySet()))
            && Objects.equals(index, that.index);
    }

    @Override
    public int hashCode() {
        return Objects.hash(new ArrayList<>(columns.entrySet()), index);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Table(rows=").append(numRows);
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            sb.append(", ").append(entry.getKey()).append(": ").append(entry.getValue().dtype().typeName());
        }
        if (index != null) {
            sb.append(", index=").append(index.names());
        }
        return sb.append(")").toString();
    }

    /**
     * Builder for tables, keeping insertion order of columns.
     */
    public static final class Builder {

        private final LinkedHashMap<String, Column> columns = new LinkedHashMap<>();
        private Index index;

        private Builder() {}

        public Builder column(String name, Column column) {
            Objects.requireNonNull(column, "column must not be null");
            if (columns.put(name, column) != null) {
                throw new IllegalArgumentException("Duplicate column '" + name + "'");
            }
            return this;
        }

        public Builder index(Index index) {
            this.index = index;
            return this;
        }

        public Table build() {
            return new Table(new LinkedHashMap<>(columns), index);
        }
    }
}
