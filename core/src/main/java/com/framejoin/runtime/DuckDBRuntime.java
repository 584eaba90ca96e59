package com.framejoin.runtime;

import org.duckdb.DuckDBConnection;
import org.duckdb.DuckDBDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Properties;

/**
 * DuckDB runtime - owns a single DuckDB connection.
 *
 * <p>Each DuckDBRuntime instance manages one DuckDB connection. The runtime
 * is responsible for creating, configuring, and closing the connection. The
 * connection is not shared between threads.
 *
 * <p>Test usage:
 * <pre>{@code
 * @BeforeEach
 * void setup() {
 *     runtime = DuckDBRuntime.create("jdbc:duckdb:");
 * }
 *
 * @AfterEach
 * void teardown() {
 *     runtime.close();
 * }
 * }</pre>
 */
public class DuckDBRuntime implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(DuckDBRuntime.class);

    private final String jdbcUrl;
    private final DuckDBConnection connection;
    private volatile boolean closed = false;

    /**
     * Private constructor - use create() factory method.
     *
     * @param jdbcUrl JDBC URL for DuckDB connection
     * @throws SQLException if connection fails
     */
    private DuckDBRuntime(String jdbcUrl) throws SQLException {
        this.jdbcUrl = jdbcUrl;

        logger.info("Creating DuckDB runtime with URL: {}", jdbcUrl);

        Properties props = new Properties();
        props.setProperty(DuckDBDriver.JDBC_STREAM_RESULTS, "true");

        Connection rawConn = DriverManager.getConnection(jdbcUrl, props);
        this.connection = rawConn.unwrap(DuckDBConnection.class);
        configureConnection();
    }

    /**
     * Configure the connection for deterministic join output.
     */
    private void configureConnection() throws SQLException {
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(String.format("SET threads=%d",
                Math.max(1, Runtime.getRuntime().availableProcessors())));

            stmt.execute("SET enable_progress_bar=false");

            // Result order is imposed with ORDER BY; insertion order keeps loads stable
            stmt.execute("SET preserve_insertion_order=true");
        }
    }

    /**
     * Create a new DuckDBRuntime with custom JDBC URL.
     *
     * @param jdbcUrl JDBC URL (e.g., "jdbc:duckdb:" for a private in-memory database)
     * @return new DuckDBRuntime instance
     * @throws RuntimeException if connection fails
     */
    public static DuckDBRuntime create(String jdbcUrl) {
        try {
            return new DuckDBRuntime(jdbcUrl);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to create DuckDB runtime: " + jdbcUrl, e);
        }
    }

    /**
     * Get the underlying DuckDB connection.
     *
     * <p>The connection is managed by the runtime - callers should NOT close it.
     *
     * @return the DuckDB connection
     * @throws IllegalStateException if runtime is closed
     */
    public DuckDBConnection getConnection() {
        if (closed) {
            throw new IllegalStateException("DuckDB runtime is closed");
        }
        return connection;
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Close the runtime and release resources.
     *
     * <p>After closing, the runtime cannot be used.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;

        logger.info("Closing DuckDB runtime: {}", jdbcUrl);
        try {
            connection.close();
        } catch (SQLException e) {
            logger.error("Error closing DuckDB connection", e);
        }
    }
}
