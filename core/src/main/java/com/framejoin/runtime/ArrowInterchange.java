package com.framejoin.runtime;

import com.framejoin.table.Column;
import com.framejoin.types.TypeMapper;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.BaseIntVector;
import org.apache.arrow.vector.BitVector;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.Float4Vector;
import org.apache.arrow.vector.Float8Vector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.types.FloatingPointPrecision;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.Text;
import org.duckdb.DuckDBConnection;

import java.nio.charset.StandardCharsets;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Arrow data interchange utilities for DuckDB.
 *
 * <p>Columns travel to DuckDB as Arrow vectors of their physical representation
 * (see {@link TypeMapper}); results travel back through DuckDB's
 * {@code arrowExportStream()} and are read with {@link #readValue(FieldVector, int)}.
 *
 * <p>Example usage:
 * <pre>
 *   try (VectorSchemaRoot root = ArrowInterchange.toVectorSchemaRoot(columns, allocator)) {
 *       ArrowInterchange.toTable(root, "fj_left", connection);
 *   }
 * </pre>
 */
public final class ArrowInterchange {

    private ArrowInterchange() {} // Utility class

    /**
     * Copies columns into a new VectorSchemaRoot. The caller owns (and closes) the root.
     *
     * @param columns the columns by name, all of one length
     * @param allocator the allocator for the vectors
     * @return the populated root
     */
    public static VectorSchemaRoot toVectorSchemaRoot(Map<String, Column> columns,
                                                      BufferAllocator allocator) {
        Objects.requireNonNull(columns, "columns must not be null");
        Objects.requireNonNull(allocator, "allocator must not be null");

        List<Field> fields = new ArrayList<>(columns.size());
        for (Map.Entry<String, Column> entry : columns.entrySet()) {
            ArrowType arrowType = TypeMapper.toArrowType(entry.getValue().dtype());
            fields.add(new Field(entry.getKey(), FieldType.nullable(arrowType), null));
        }

        VectorSchemaRoot root = VectorSchemaRoot.create(new Schema(fields), allocator);
        int rowCount = 0;
        int col = 0;
        for (Column column : columns.values()) {
            FieldVector vector = root.getVector(col++);
            vector.setInitialCapacity(column.size());
            vector.allocateNew();
            for (int row = 0; row < column.size(); row++) {
                Object value = column.get(row);
                if (value != null) {
                    setVectorValue(vector, row, value);
                }
            }
            rowCount = column.size();
        }
        root.setRowCount(rowCount);
        return root;
    }

    /**
     * Converts Arrow VectorSchemaRoot to DuckDB table.
     *
     * <p>This method creates a table in DuckDB and imports the Arrow data into it.
     *
     * @param root the Arrow VectorSchemaRoot
     * @param tableName the target table name (unquoted)
     * @param conn the DuckDB connection
     * @throws SQLException if import fails
     */
    public static void toTable(VectorSchemaRoot root, String tableName,
                               DuckDBConnection conn) throws SQLException {
        Objects.requireNonNull(root, "root must not be null");
        Objects.requireNonNull(tableName, "tableName must not be null");
        Objects.requireNonNull(conn, "conn must not be null");

        String createSQL = generateCreateTable(tableName, root.getSchema());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(createSQL);
        }

        if (root.getRowCount() == 0) {
            return;
        }

        String insertSQL = generateInsertStatement(tableName, root.getSchema());
        try (PreparedStatement pstmt = conn.prepareStatement(insertSQL)) {
            for (int row = 0; row < root.getRowCount(); row++) {
                for (int col = 0; col < root.getFieldVectors().size(); col++) {
                    pstmt.setObject(col + 1, readValue(root.getVector(col), row));
                }
                pstmt.addBatch();
            }
            pstmt.executeBatch();
        }
    }

    /**
     * Gets a value from an Arrow vector at the specified index.
     *
     * <p>Integer vectors of every width and signedness read as {@code Long},
     * floating point vectors as {@code Float} or {@code Double}, booleans as
     * {@code Boolean} and strings as {@code String}.
     *
     * @param vector the vector to read from
     * @param index the row index
     * @return the value (may be null)
     * @throws IllegalArgumentException if the vector type is not supported
     */
    public static Object readValue(FieldVector vector, int index) {
        if (vector.isNull(index)) {
            return null;
        }

        if (vector instanceof BaseIntVector) {
            return ((BaseIntVector) vector).getValueAsLong(index);
        } else if (vector instanceof Float4Vector) {
            return ((Float4Vector) vector).get(index);
        } else if (vector instanceof Float8Vector) {
            return ((Float8Vector) vector).get(index);
        } else if (vector instanceof BitVector) {
            return ((BitVector) vector).get(index) != 0;
        } else if (vector instanceof VarCharVector) {
            byte[] bytes = ((VarCharVector) vector).get(index);
            return new String(bytes, StandardCharsets.UTF_8);
        }

        Object value = vector.getObject(index);
        if (value instanceof Text) {
            return value.toString();
        }
        throw new IllegalArgumentException(
            "Unsupported Arrow vector " + vector.getClass().getSimpleName() + " for column "
                + vector.getName());
    }

    private static void setVectorValue(FieldVector vector, int index, Object value) {
        if (vector instanceof BaseIntVector) {
            ((BaseIntVector) vector).setWithPossibleTruncate(index, (Long) value);
        } else if (vector instanceof Float4Vector) {
            ((Float4Vector) vector).setSafe(index, ((Double) value).floatValue());
        } else if (vector instanceof Float8Vector) {
            ((Float8Vector) vector).setSafe(index, (Double) value);
        } else if (vector instanceof BitVector) {
            ((BitVector) vector).setSafe(index, (Boolean) value ? 1 : 0);
        } else if (vector instanceof VarCharVector) {
            ((VarCharVector) vector).setSafe(index, ((String) value).getBytes(StandardCharsets.UTF_8));
        } else {
            throw new IllegalArgumentException(
                "Unsupported Arrow vector " + vector.getClass().getSimpleName());
        }
    }

    /**
     * Generates a CREATE TABLE statement from Arrow schema.
     */
    private static String generateCreateTable(String tableName, Schema schema) {
        StringBuilder sql = new StringBuilder("CREATE TEMPORARY TABLE ");
        sql.append(SQLQuoting.quoteIdentifier(tableName)).append(" (");

        List<Field> fields = schema.getFields();
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) {
                sql.append(", ");
            }
            Field field = fields.get(i);
            sql.append(SQLQuoting.quoteIdentifier(field.getName())).append(" ");
            sql.append(arrowTypeToSQLType(field.getType()));
        }

        sql.append(")");
        return sql.toString();
    }

    /**
     * Generates an INSERT statement for Arrow schema.
     */
    private static String generateInsertStatement(String tableName, Schema schema) {
        int fieldCount = schema.getFields().size();
        StringBuilder sql = new StringBuilder("INSERT INTO ");
        sql.append(SQLQuoting.quoteIdentifier(tableName)).append(" VALUES (");

        for (int i = 0; i < fieldCount; i++) {
            if (i > 0) {
                sql.append(", ");
            }
            sql.append("?");
        }

        sql.append(")");
        return sql.toString();
    }

    /**
     * Converts Arrow type to DuckDB SQL type string.
     *
     * @param type the Arrow type
     * @return the SQL type name
     */
    static String arrowTypeToSQLType(ArrowType type) {
        switch (type.getTypeID()) {
            case Bool: return "BOOLEAN";
            case Int:
                ArrowType.Int intType = (ArrowType.Int) type;
                switch (intType.getBitWidth()) {
                    case 8: return intType.getIsSigned() ? "TINYINT" : "UTINYINT";
                    case 16: return intType.getIsSigned() ? "SMALLINT" : "USMALLINT";
                    case 32: return intType.getIsSigned() ? "INTEGER" : "UINTEGER";
                    default: return intType.getIsSigned() ? "BIGINT" : "UBIGINT";
                }
            case FloatingPoint:
                ArrowType.FloatingPoint fpType = (ArrowType.FloatingPoint) type;
                return fpType.getPrecision() == FloatingPointPrecision.SINGLE ? "FLOAT" : "DOUBLE";
            case Utf8: return "VARCHAR";
            default:
                throw new IllegalArgumentException("Unsupported Arrow type: " + type);
        }
    }
}
