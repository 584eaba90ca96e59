package com.framejoin.engine;

import com.framejoin.config.FrameJoinConfig;
import com.framejoin.exception.EngineExecutionException;
import com.framejoin.merge.JoinKind;
import com.framejoin.runtime.DuckDBRuntime;
import com.framejoin.runtime.SQLQuoting;
import com.framejoin.runtime.TableTransfer;
import com.framejoin.table.Table;
import com.framejoin.types.DataType;
import com.framejoin.types.TypeMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Join engine backed by an embedded DuckDB database.
 *
 * <p>Each join loads both inputs into temporary tables, runs a single SQL join and
 * reads the result back as Arrow batches. Keys match with
 * {@code IS NOT DISTINCT FROM}, so null keys match each other. Rows come back in left
 * input order (matches in right input order), followed by unmatched right rows in
 * right input order.
 *
 * <p>Generated SQL for {@code on=["id"], how="outer"}:
 * <pre>
 *   SELECT COALESCE(l."id", r."id") AS "id", l."x_l" AS "x_l", r."x_r" AS "x_r"
 *   FROM "fj_left_1" AS l FULL OUTER JOIN "fj_right_1" AS r
 *     ON l."id" IS NOT DISTINCT FROM r."id"
 *   ORDER BY l."__fj_row" NULLS LAST, r."__fj_row" NULLS LAST
 * </pre>
 *
 * <p>An engine owns one DuckDB connection and is not thread-safe; use one engine
 * per thread.
 */
public class DuckDBJoinEngine implements JoinEngineAdapter, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBJoinEngine.class);

    private static final String LEFT_ALIAS = "l";
    private static final String RIGHT_ALIAS = "r";

    private final DuckDBRuntime runtime;
    private final TableTransfer transfer;
    private final AtomicLong sequence = new AtomicLong();

    /**
     * Creates an engine on an existing runtime. The engine takes ownership of the runtime.
     *
     * @param runtime the DuckDB runtime
     * @param config the configuration (batch size)
     */
    public DuckDBJoinEngine(DuckDBRuntime runtime, FrameJoinConfig config) {
        this.runtime = Objects.requireNonNull(runtime, "runtime must not be null");
        Objects.requireNonNull(config, "config must not be null");
        this.transfer = new TableTransfer(runtime.getConnection(), config.batchSize());
    }

    /**
     * Creates an engine configured from system properties.
     *
     * @return the engine
     */
    public static DuckDBJoinEngine create() {
        return create(FrameJoinConfig.fromSystemProperties());
    }

    /**
     * Creates an engine with the given configuration.
     *
     * @param config the configuration
     * @return the engine
     */
    public static DuckDBJoinEngine create(FrameJoinConfig config) {
        return new DuckDBJoinEngine(DuckDBRuntime.create(config.jdbcUrl()), config);
    }

    @Override
    public Table join(JoinRequest request) {
        if (request.leftKeys().size() == 0) {
            throw new IllegalArgumentException("A join needs at least one key pair");
        }
        long id = sequence.incrementAndGet();
        String leftTable = "fj_left_" + id;
        String rightTable = "fj_right_" + id;
        JoinPlan plan = plan(request, leftTable, rightTable);

        long startTime = System.nanoTime();
        try {
            transfer.load(leftTable, request.left(), request.leftKeys().useIndex());
            transfer.load(rightTable, request.right(), request.rightKeys().useIndex());
            logger.debug("Generated join SQL: {}", plan.sql());

            Table result = transfer.query(plan.sql(), plan.columnTypes(), plan.indexNames(), plan.indexTypes());

            long elapsedMs = (System.nanoTime() - startTime) / 1_000_000;
            logger.debug("{} join of {} x {} rows produced {} rows in {} ms",
                request.kind(), request.left().numRows(), request.right().numRows(),
                result.numRows(), elapsedMs);
            return result;
        } catch (SQLException e) {
            logger.error("Join execution failed: {}", plan.sql(), e);
            throw new EngineExecutionException("Join execution failed: " + e.getMessage(), e, plan.sql());
        } finally {
            transfer.drop(leftTable);
            transfer.drop(rightTable);
        }
    }

    /**
     * Builds the join SQL and the expected result shape.
     */
    private JoinPlan plan(JoinRequest request, String leftTable, String rightTable) {
        Table left = request.left();
        Table right = request.right();
        KeySelection leftKeys = request.leftKeys();
        KeySelection rightKeys = request.rightKeys();

        List<String> select = new ArrayList<>();
        Map<String, DataType> columnTypes = new LinkedHashMap<>();

        for (String name : left.columnNames()) {
            DataType type = TypeMapper.physicalType(left.column(name).dtype());
            String expr = isCongruentKey(name, leftKeys, rightKeys)
                ? "COALESCE(" + SQLQuoting.qualified(LEFT_ALIAS, name) + ", "
                    + SQLQuoting.qualified(RIGHT_ALIAS, name) + ")"
                : SQLQuoting.qualified(LEFT_ALIAS, name);
            select.add(expr + " AS " + SQLQuoting.quoteIdentifier(name));
            columnTypes.put(name, type);
        }
        for (String name : right.columnNames()) {
            if (left.hasColumn(name)) {
                if (!isCongruentKey(name, leftKeys, rightKeys)) {
                    throw new IllegalArgumentException(
                        "Column '" + name + "' appears on both sides but is not a shared key");
                }
                continue;
            }
            select.add(SQLQuoting.qualified(RIGHT_ALIAS, name) + " AS " + SQLQuoting.quoteIdentifier(name));
            columnTypes.put(name, TypeMapper.physicalType(right.column(name).dtype()));
        }

        List<String> indexNames = Collections.emptyList();
        List<DataType> indexTypes = Collections.emptyList();
        if (request.materializeLeftIndex() || request.materializeRightIndex()) {
            boolean fromLeft = request.materializeLeftIndex();
            Table indexSide = fromLeft ? left : right;
            String primary = keyExpression(fromLeft ? LEFT_ALIAS : RIGHT_ALIAS,
                fromLeft ? leftKeys : rightKeys, 0);
            String secondary = keyExpression(fromLeft ? RIGHT_ALIAS : LEFT_ALIAS,
                fromLeft ? rightKeys : leftKeys, 0);
            select.add("COALESCE(" + primary + ", " + secondary + ") AS "
                + SQLQuoting.quoteIdentifier(TableTransfer.indexColumn(0)));
            indexNames = Collections.singletonList(indexSide.index().name());
            indexTypes = Collections.singletonList(TypeMapper.physicalType(indexSide.index().column().dtype()));
        }

        List<String> conditions = new ArrayList<>();
        for (int i = 0; i < leftKeys.size(); i++) {
            conditions.add(keyExpression(LEFT_ALIAS, leftKeys, i) + " IS NOT DISTINCT FROM "
                + keyExpression(RIGHT_ALIAS, rightKeys, i));
        }

        String sql = "SELECT " + String.join(", ", select)
            + " FROM " + SQLQuoting.quoteIdentifier(leftTable) + " AS " + LEFT_ALIAS
            + " " + joinClause(request.kind()) + " "
            + SQLQuoting.quoteIdentifier(rightTable) + " AS " + RIGHT_ALIAS
            + " ON " + String.join(" AND ", conditions)
            + " ORDER BY " + SQLQuoting.qualified(LEFT_ALIAS, TableTransfer.ROW_COLUMN) + " NULLS LAST, "
            + SQLQuoting.qualified(RIGHT_ALIAS, TableTransfer.ROW_COLUMN) + " NULLS LAST";
        return new JoinPlan(sql, columnTypes, indexNames, indexTypes);
    }

    private static boolean isCongruentKey(String name, KeySelection leftKeys, KeySelection rightKeys) {
        if (leftKeys.useIndex() || rightKeys.useIndex()) {
            return false;
        }
        int position = leftKeys.columns().indexOf(name);
        return position >= 0 && name.equals(rightKeys.columns().get(position));
    }

    private static String keyExpression(String alias, KeySelection keys, int position) {
        return keys.useIndex()
            ? SQLQuoting.qualified(alias, TableTransfer.indexColumn(0))
            : SQLQuoting.qualified(alias, keys.columns().get(position));
    }

    private static String joinClause(JoinKind kind) {
        switch (kind) {
            case LEFT: return "LEFT JOIN";
            case RIGHT: return "RIGHT JOIN";
            case OUTER: return "FULL OUTER JOIN";
            default: return "INNER JOIN";
        }
    }

    @Override
    public void close() {
        transfer.close();
        runtime.close();
    }

    private record JoinPlan(String sql, Map<String, DataType> columnTypes,
                            List<String> indexNames, List<DataType> indexTypes) {
    }
}
