package com.framejoin.ops;

import com.framejoin.config.FrameJoinConfig;
import com.framejoin.exception.EngineExecutionException;
import com.framejoin.runtime.DuckDBRuntime;
import com.framejoin.runtime.SQLQuoting;
import com.framejoin.runtime.TableTransfer;
import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.types.DataType;
import com.framejoin.types.FloatType;
import com.framejoin.types.IntegerType;
import com.framejoin.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Row filters and element-wise math over tables, executed on DuckDB.
 *
 * <p>Every operation runs as a single query over a temporary copy of the input and
 * keeps the input row order and index. Categorical columns travel as codes and are
 * rebuilt with {@link #copyCategories(Table, Table)}.
 *
 * <p>Example usage:
 * <pre>
 *   try (TableOperations ops = TableOperations.create()) {
 *       Table complete = ops.dropNulls(table, DropHow.ANY, null, null);
 *       Table unique = ops.dropDuplicates(complete, List.of("id"), Keep.FIRST, true);
 *   }
 * </pre>
 *
 * <p>Not thread-safe; use one instance per thread.
 */
public class TableOperations implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TableOperations.class);

    private static final String POSITION_COLUMN = "__fj_position";

    private final DuckDBRuntime runtime;
    private final TableTransfer transfer;
    private final AtomicLong sequence = new AtomicLong();

    public TableOperations(DuckDBRuntime runtime, FrameJoinConfig config) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.transfer = new TableTransfer(runtime.getConnection(), config.batchSize());
    }

    public static TableOperations create() {
        return create(FrameJoinConfig.fromSystemProperties());
    }

    public static TableOperations create(FrameJoinConfig config) {
        return new TableOperations(DuckDBRuntime.create(config.jdbcUrl()), config);
    }

    // ========================================================================
    // Null handling
    // ========================================================================

    /**
     * Drops rows containing nulls.
     *
     * @param table the input table
     * @param how whether one null ({@code ANY}) or only all nulls ({@code ALL}) drop a row
     * @param subset the columns to consider (null for all columns)
     * @param thresh if non-null, keep only rows with at least this many non-null
     *               values in {@code subset}; overrides {@code how}
     * @return the filtered table
     * @throws IllegalArgumentException if a subset column does not exist
     */
    public Table dropNulls(Table table, DropHow how, List<String> subset, Integer thresh) {
        Objects.requireNonNull(how, "how must not be null");
        List<String> columns = resolveSubset(table, subset);
        if (columns.isEmpty()) {
            return table;
        }

        List<String> notNull = new ArrayList<>();
        for (String name : columns) {
            notNull.add(SQLQuoting.quoteIdentifier(name) + " IS NOT NULL");
        }
        String predicate;
        if (thresh != null) {
            List<String> counts = new ArrayList<>();
            for (String term : notNull) {
                counts.add("CAST(" + term + " AS INTEGER)");
            }
            predicate = "(" + String.join(" + ", counts) + ") >= " + thresh;
        } else if (how == DropHow.ANY) {
            predicate = String.join(" AND ", notNull);
        } else {
            predicate = String.join(" OR ", notNull);
        }
        return filterRows("dropNulls", table, "WHERE " + predicate);
    }

    /**
     * Drops columns containing nulls.
     *
     * @param table the input table
     * @param how whether one null ({@code ANY}) or only all nulls ({@code ALL}) drop a column
     * @param rows the row positions to consider (null for all rows)
     * @param thresh if non-null, keep only columns with at least this many non-null
     *               values in {@code rows}; overrides {@code how}
     * @return the table without the dropped columns
     */
    public static Table dropNullColumns(Table table, DropHow how, List<Integer> rows, Integer thresh) {
        Objects.requireNonNull(how, "how must not be null");
        List<Integer> positions = rows;
        if (positions == null) {
            positions = new ArrayList<>();
            for (int row = 0; row < table.numRows(); row++) {
                positions.add(row);
            }
        }
        int minimum = thresh != null ? thresh : (how == DropHow.ALL ? 1 : positions.size());

        List<String> kept = new ArrayList<>();
        for (String name : table.columnNames()) {
            Column column = table.column(name);
            int nonNull = 0;
            for (int row : positions) {
                if (!column.isNull(row)) {
                    nonNull++;
                }
            }
            if (nonNull >= minimum) {
                kept.add(name);
            }
        }
        return table.select(kept);
    }

    // ========================================================================
    // Duplicates
    // ========================================================================

    /**
     * Drops duplicate rows, comparing the values of {@code subset}.
     *
     * @param table the input table
     * @param subset the columns to compare (null for all columns)
     * @param keep which row of each group of duplicates survives
     * @param nullsAreEqual whether null values compare equal to each other
     * @return the table without duplicates, in input order
     * @throws IllegalArgumentException if a subset column does not exist
     */
    public Table dropDuplicates(Table table, List<String> subset, Keep keep, boolean nullsAreEqual) {
        Objects.requireNonNull(keep, "keep must not be null");
        List<String> columns = resolveSubset(table, subset);
        if (columns.isEmpty()) {
            return table;
        }

        List<String> partition = new ArrayList<>();
        List<String> isNull = new ArrayList<>();
        for (String name : columns) {
            partition.add(SQLQuoting.quoteIdentifier(name));
            isNull.add(SQLQuoting.quoteIdentifier(name) + " IS NULL");
        }
        if (!nullsAreEqual) {
            // rows with a null key form groups of their own
            partition.add("CASE WHEN " + String.join(" OR ", isNull) + " THEN "
                + SQLQuoting.quoteIdentifier(TableTransfer.ROW_COLUMN) + " END");
        }
        String window = "PARTITION BY " + String.join(", ", partition);
        String row = SQLQuoting.quoteIdentifier(TableTransfer.ROW_COLUMN);

        String qualify;
        switch (keep) {
            case FIRST:
                qualify = "ROW_NUMBER() OVER (" + window + " ORDER BY " + row + ") = 1";
                break;
            case LAST:
                qualify = "ROW_NUMBER() OVER (" + window + " ORDER BY " + row + " DESC) = 1";
                break;
            default:
                qualify = "COUNT(*) OVER (" + window + ") = 1";
                break;
        }
        return filterRows("dropDuplicates", table, "QUALIFY " + qualify);
    }

    // ========================================================================
    // Searching
    // ========================================================================

    /**
     * Finds, for each row of {@code values}, the position at which it would be inserted
     * into {@code sorted} to keep it sorted. Columns are paired by position and compared
     * lexicographically; categorical columns compare by code.
     *
     * @param sorted the table, sorted over all of its columns
     * @param values the rows to place, with as many columns as {@code sorted}
     * @param side whether a row equal to rows of {@code sorted} goes before ({@code LEFT})
     *             or after ({@code RIGHT}) them
     * @param ascending whether {@code sorted} is in ascending order
     * @param nullPosition where nulls sit in {@code sorted}
     * @return an int32 column of insertion positions, one per row of {@code values}
     * @throws IllegalArgumentException if the column counts differ or paired columns
     *                                  cannot be compared
     */
    public Column searchSorted(Table sorted, Table values, Side side, boolean ascending,
                               NullPosition nullPosition) {
        Objects.requireNonNull(side, "side must not be null");
        Objects.requireNonNull(nullPosition, "nullPosition must not be null");
        List<String> sortedNames = sorted.columnNames();
        List<String> valueNames = values.columnNames();
        if (sortedNames.isEmpty() || sortedNames.size() != valueNames.size()) {
            throw new IllegalArgumentException(String.format(
                "searchSorted needs the same non-zero number of columns in both tables, got %d and %d",
                sortedNames.size(), valueNames.size()));
        }
        for (int i = 0; i < sortedNames.size(); i++) {
            DataType sortedType = sorted.column(sortedNames.get(i)).dtype();
            DataType valueType = values.column(valueNames.get(i)).dtype();
            if (!sortedType.equals(valueType) && !(sortedType.isNumeric() && valueType.isNumeric())) {
                throw new IllegalArgumentException(String.format(
                    "Cannot compare column '%s' of type %s with column '%s' of type %s",
                    sortedNames.get(i), sortedType.typeName(), valueNames.get(i), valueType.typeName()));
            }
        }

        // a row of t precedes v when it sorts strictly before it, or also when equal for RIGHT
        String precedes = side == Side.LEFT ? "FALSE" : "TRUE";
        for (int i = sortedNames.size() - 1; i >= 0; i--) {
            String t = "t." + SQLQuoting.quoteIdentifier(sortedNames.get(i));
            String v = "v." + SQLQuoting.quoteIdentifier(valueNames.get(i));
            precedes = "(" + sortsBefore(t, v, ascending, nullPosition)
                + " OR (" + t + " IS NOT DISTINCT FROM " + v + " AND " + precedes + "))";
        }

        long id = sequence.incrementAndGet();
        String sortedTable = "fj_ops_" + id + "_sorted";
        String valuesTable = "fj_ops_" + id + "_values";
        String sql = "SELECT CAST((SELECT COUNT(*) FROM " + SQLQuoting.quoteIdentifier(sortedTable)
            + " AS t WHERE " + precedes + ") AS INTEGER) AS " + SQLQuoting.quoteIdentifier(POSITION_COLUMN)
            + " FROM " + SQLQuoting.quoteIdentifier(valuesTable) + " AS v"
            + " ORDER BY v." + SQLQuoting.quoteIdentifier(TableTransfer.ROW_COLUMN);
        try {
            transfer.load(sortedTable, sorted, false);
            transfer.load(valuesTable, values, false);
            logger.debug("Generated searchSorted SQL: {}", sql);
            Map<String, DataType> columnTypes = new LinkedHashMap<>();
            columnTypes.put(POSITION_COLUMN, IntegerType.int32());
            Table result = transfer.query(sql, columnTypes, Collections.emptyList(), Collections.emptyList());
            return result.column(POSITION_COLUMN);
        } catch (SQLException e) {
            logger.error("searchSorted failed: {}", sql, e);
            throw new EngineExecutionException("searchSorted failed: " + e.getMessage(), e, sql);
        } finally {
            transfer.drop(sortedTable);
            transfer.drop(valuesTable);
        }
    }

    /**
     * Strict sort order between two non-equal values, nulls included.
     */
    private static String sortsBefore(String t, String v, boolean ascending, NullPosition nullPosition) {
        String less = t + (ascending ? " < " : " > ") + v;
        if (nullPosition == NullPosition.FIRST) {
            return "(" + v + " IS NOT NULL AND (" + t + " IS NULL OR " + less + "))";
        }
        return "(" + t + " IS NOT NULL AND (" + v + " IS NULL OR " + less + "))";
    }

    // ========================================================================
    // Element-wise math
    // ========================================================================

    /**
     * Applies a math function to every column. Results are float64.
     *
     * @param table the input table; every column must be integer or floating point
     * @param op the function
     * @return the table of results, with the input index
     * @throws IllegalArgumentException if a column is not numeric
     */
    public Table unaryOp(Table table, UnaryOperation op) {
        Objects.requireNonNull(op, "op must not be null");
        for (String name : table.columnNames()) {
            DataType dtype = table.column(name).dtype();
            if (!dtype.isNumeric()) {
                throw new IllegalArgumentException(String.format(
                    "Cannot apply %s to column '%s' of type %s", op, name, dtype.typeName()));
            }
        }

        List<String> select = new ArrayList<>();
        Map<String, DataType> columnTypes = new LinkedHashMap<>();
        for (String name : table.columnNames()) {
            String operand = "CAST(" + SQLQuoting.quoteIdentifier(name) + " AS DOUBLE)";
            select.add(op.toSQL(operand) + " AS " + SQLQuoting.quoteIdentifier(name));
            columnTypes.put(name, FloatType.float64());
        }
        return copyCategories(runOnCopy(op.name().toLowerCase(), table, select, columnTypes, ""), table);
    }

    // ========================================================================
    // Categorical restoration
    // ========================================================================

    /**
     * Re-wraps integer columns of {@code result} as categoricals where the column at
     * the same position of {@code source} is categorical. Index levels are handled
     * the same way.
     *
     * @param result the table holding codes
     * @param source the table holding the categorical dtypes
     * @return the table with categorical columns restored
     */
    public static Table copyCategories(Table result, Table source) {
        List<String> resultNames = result.columnNames();
        List<String> sourceNames = source.columnNames();
        LinkedHashMap<String, Column> columns = new LinkedHashMap<>();
        for (int i = 0; i < resultNames.size(); i++) {
            Column column = result.column(resultNames.get(i));
            if (i < sourceNames.size()) {
                column = copyCategories(column, source.column(sourceNames.get(i)));
            }
            columns.put(resultNames.get(i), column);
        }

        Index index = result.index();
        if (index != null && source.hasIndex()) {
            List<Column> levels = new ArrayList<>();
            for (int level = 0; level < index.numLevels(); level++) {
                Column values = index.levels().get(level);
                if (level < source.index().numLevels()) {
                    values = copyCategories(values, source.index().levels().get(level));
                }
                levels.add(values);
            }
            index = Index.multi(index.names(), levels);
        }
        return Table.of(columns, index);
    }

    private static Column copyCategories(Column column, Column source) {
        if (source.isCategorical() && !column.isCategorical()
                && column.dtype() instanceof IntegerType) {
            return Column.categorical(source.categories(), column, source.ordered());
        }
        return column;
    }

    // ========================================================================
    // Execution
    // ========================================================================

    private Table filterRows(String operation, Table table, String clause) {
        List<String> select = new ArrayList<>();
        Map<String, DataType> columnTypes = new LinkedHashMap<>();
        for (String name : table.columnNames()) {
            select.add(SQLQuoting.quoteIdentifier(name));
            columnTypes.put(name, TypeMapper.physicalType(table.column(name).dtype()));
        }
        Table result = runOnCopy(operation, table, select, columnTypes, " " + clause);
        return copyCategories(result, table);
    }

    private Table runOnCopy(String operation, Table table, List<String> select,
                            Map<String, DataType> columnTypes, String clause) {
        String tableName = "fj_ops_" + sequence.incrementAndGet();

        List<String> projections = new ArrayList<>(select);
        List<String> indexNames = Collections.emptyList();
        List<DataType> indexTypes = new ArrayList<>();
        if (table.hasIndex()) {
            indexNames = table.index().names();
            for (int level = 0; level < table.index().numLevels(); level++) {
                projections.add(SQLQuoting.quoteIdentifier(TableTransfer.indexColumn(level)));
                indexTypes.add(TypeMapper.physicalType(table.index().levels().get(level).dtype()));
            }
        }
        if (projections.isEmpty()) {
            return table;
        }

        String sql = "SELECT " + String.join(", ", projections)
            + " FROM " + SQLQuoting.quoteIdentifier(tableName) + clause
            + " ORDER BY " + SQLQuoting.quoteIdentifier(TableTransfer.ROW_COLUMN);
        try {
            transfer.load(tableName, table, true);
            logger.debug("Generated {} SQL: {}", operation, sql);
            Table result = transfer.query(sql, columnTypes, indexNames, indexTypes);
            logger.debug("{} kept {} of {} rows", operation, result.numRows(), table.numRows());
            return result;
        } catch (SQLException e) {
            logger.error("{} failed: {}", operation, sql, e);
            throw new EngineExecutionException(operation + " failed: " + e.getMessage(), e, sql);
        } finally {
            transfer.drop(tableName);
        }
    }

    private static List<String> resolveSubset(Table table, List<String> subset) {
        if (subset == null) {
            return table.columnNames();
        }
        Set<String> missing = new LinkedHashSet<>(subset);
        missing.removeAll(table.columnNames());
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("columns " + missing + " do not exist");
        }
        List<String> columns = new ArrayList<>();
        for (String name : table.columnNames()) {
            if (subset.contains(name)) {
                columns.add(name);
            }
        }
        return columns;
    }

    @Override
    public void close() {
        transfer.close();
        runtime.close();
    }
}
