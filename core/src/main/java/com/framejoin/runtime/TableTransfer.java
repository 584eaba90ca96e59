package com.framejoin.runtime;

import com.framejoin.table.Column;
import com.framejoin.table.Index;
import com.framejoin.table.Table;
import com.framejoin.types.DataType;
import com.framejoin.types.IntegerType;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.ipc.ArrowReader;
import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBResultSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Moves {@link Table}s into DuckDB and query results back out.
 *
 * <p>A loaded table carries two kinds of helper columns next to its own columns:
 * <ul>
 *   <li>{@value #ROW_COLUMN}: the 0-based input row number, used to restore row order</li>
 *   <li>{@code __fj_index_<level>}: the index levels, when requested</li>
 * </ul>
 * Columns of user tables may not use these names.
 *
 * <p>Results are read through DuckDB's {@code arrowExportStream()} batch by batch.
 * Instances own an Arrow allocator and must be closed.
 */
public class TableTransfer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(TableTransfer.class);

    public static final String ROW_COLUMN = "__fj_row";
    private static final String INDEX_COLUMN_PREFIX = "__fj_index_";

    private final DuckDBConnection connection;
    private final BufferAllocator allocator;
    private final int batchSize;

    /**
     * Creates a transfer over a connection the caller keeps ownership of.
     *
     * @param connection the DuckDB connection
     * @param batchSize rows per exported Arrow batch
     */
    public TableTransfer(DuckDBConnection connection, int batchSize) {
        this.connection = Objects.requireNonNull(connection, "connection must not be null");
        this.allocator = new RootAllocator(Long.MAX_VALUE);
        this.batchSize = batchSize;
    }

    /**
     * Returns the helper column name holding an index level.
     *
     * @param level the 0-based level
     * @return the helper column name
     */
    public static String indexColumn(int level) {
        return INDEX_COLUMN_PREFIX + level;
    }

    /**
     * Loads a table into a new temporary DuckDB table.
     *
     * @param tableName the temporary table name
     * @param table the table to load
     * @param withIndex whether to load the index levels as helper columns
     * @throws SQLException if the load fails
     * @throws IllegalArgumentException if a column uses a helper column name
     */
    public void load(String tableName, Table table, boolean withIndex) throws SQLException {
        LinkedHashMap<String, Column> columns = new LinkedHashMap<>();
        List<Long> rowNumbers = new ArrayList<>(table.numRows());
        for (long row = 0; row < table.numRows(); row++) {
            rowNumbers.add(row);
        }
        columns.put(ROW_COLUMN, Column.of(IntegerType.int64(), rowNumbers));

        for (Map.Entry<String, Column> entry : table.columns().entrySet()) {
            if (isHelperColumn(entry.getKey())) {
                throw new IllegalArgumentException(
                    "Column name '" + entry.getKey() + "' is reserved for internal use");
            }
            columns.put(entry.getKey(), entry.getValue());
        }

        if (withIndex && table.hasIndex()) {
            List<Column> levels = table.index().levels();
            for (int level = 0; level < levels.size(); level++) {
                columns.put(indexColumn(level), levels.get(level));
            }
        }

        try (VectorSchemaRoot root = ArrowInterchange.toVectorSchemaRoot(columns, allocator)) {
            ArrowInterchange.toTable(root, tableName, connection);
        }
        logger.debug("Loaded {} rows x {} columns into {}", table.numRows(), columns.size(), tableName);
    }

    /**
     * Runs a query and converts its result into a table.
     *
     * <p>Every entry of {@code columnTypes} names a result column and the dtype its
     * values are read as. Index levels are read from {@link #indexColumn(int)}.
     *
     * @param sql the query
     * @param columnTypes the result columns, in output order, and their dtypes
     * @param indexNames the names of the index levels to read (empty for no index)
     * @param indexTypes the dtypes of the index levels
     * @return the result table
     * @throws SQLException if the query fails
     */
    public Table query(String sql, Map<String, DataType> columnTypes,
                       List<String> indexNames, List<DataType> indexTypes) throws SQLException {
        Map<String, List<Object>> values = new LinkedHashMap<>();
        for (String name : columnTypes.keySet()) {
            values.put(name, new ArrayList<>());
        }
        List<List<Object>> indexValues = new ArrayList<>();
        for (int level = 0; level < indexNames.size(); level++) {
            indexValues.add(new ArrayList<>());
        }

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            DuckDBResultSet duckRS = rs.unwrap(DuckDBResultSet.class);
            try (ArrowReader reader = (ArrowReader) duckRS.arrowExportStream(allocator, batchSize)) {
                VectorSchemaRoot root = reader.getVectorSchemaRoot();
                while (reader.loadNextBatch()) {
                    int rowCount = root.getRowCount();
                    for (Map.Entry<String, List<Object>> entry : values.entrySet()) {
                        readInto(requireVector(root, entry.getKey()), rowCount, entry.getValue());
                    }
                    for (int level = 0; level < indexValues.size(); level++) {
                        readInto(requireVector(root, indexColumn(level)), rowCount, indexValues.get(level));
                    }
                }
            }
        } catch (IOException e) {
            throw new SQLException("Failed to read Arrow result batch", e);
        }

        Table.Builder builder = Table.builder();
        for (Map.Entry<String, DataType> entry : columnTypes.entrySet()) {
            builder.column(entry.getKey(), Column.of(entry.getValue(), values.get(entry.getKey())));
        }
        if (!indexNames.isEmpty()) {
            List<Column> levels = new ArrayList<>();
            for (int level = 0; level < indexNames.size(); level++) {
                levels.add(Column.of(indexTypes.get(level), indexValues.get(level)));
            }
            builder.index(levels.size() == 1
                ? Index.of(indexNames.get(0), levels.get(0))
                : Index.multi(indexNames, levels));
        }
        return builder.build();
    }

    /**
     * Drops a temporary table if it exists. Failures are logged, not thrown.
     *
     * @param tableName the table name
     */
    public void drop(String tableName) {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute("DROP TABLE IF EXISTS " + SQLQuoting.quoteIdentifier(tableName));
        } catch (SQLException e) {
            logger.warn("Failed to drop temporary table {}: {}", tableName, e.getMessage());
        }
    }

    public BufferAllocator getAllocator() {
        return allocator;
    }

    @Override
    public void close() {
        try {
            allocator.close();
        } catch (IllegalStateException e) {
            logger.warn("Error closing Arrow allocator: {}", e.getMessage());
        }
    }

    private static boolean isHelperColumn(String name) {
        return ROW_COLUMN.equals(name) || name.startsWith(INDEX_COLUMN_PREFIX);
    }

    private static FieldVector requireVector(VectorSchemaRoot root, String name) throws SQLException {
        FieldVector vector = root.getVector(name);
        if (vector == null) {
            throw new SQLException("Query result has no column '" + name + "'");
        }
        return vector;
    }

    private static void readInto(FieldVector vector, int rowCount, List<Object> target) {
        for (int row = 0; row < rowCount; row++) {
            target.add(ArrowInterchange.readValue(vector, row));
        }
    }
}
