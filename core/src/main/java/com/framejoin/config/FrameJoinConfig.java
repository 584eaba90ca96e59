package com.framejoin.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Engine configuration: where DuckDB runs and how results are batched.
 *
 * <p>Values are read from system properties:
 * <ul>
 *   <li>{@value #PROP_JDBC_URL}: DuckDB JDBC URL (default {@value #DEFAULT_JDBC_URL},
 *       a private in-memory database)</li>
 *   <li>{@value #PROP_BATCH_SIZE}: rows per Arrow result batch (default 8192,
 *       clamped to [1024, 65536])</li>
 * </ul>
 */
public final class FrameJoinConfig {

    private static final Logger logger = LoggerFactory.getLogger(FrameJoinConfig.class);

    public static final String PROP_JDBC_URL = "framejoin.duckdb.url";
    public static final String PROP_BATCH_SIZE = "framejoin.arrow.batchSize";

    /** Default JDBC URL: a private in-memory database per connection */
    public static final String DEFAULT_JDBC_URL = "jdbc:duckdb:";

    /** Default batch size in rows - aligned with DuckDB row group */
    public static final int DEFAULT_BATCH_SIZE = 8192;

    /** Maximum batch size to prevent excessive memory per batch */
    public static final int MAX_BATCH_SIZE = 65536;

    /** Minimum batch size to prevent too many small batches */
    public static final int MIN_BATCH_SIZE = 1024;

    private final String jdbcUrl;
    private final int batchSize;

    private FrameJoinConfig(String jdbcUrl, int batchSize) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        this.batchSize = normalizeBatchSize(batchSize);
    }

    public static FrameJoinConfig defaults() {
        return new FrameJoinConfig(DEFAULT_JDBC_URL, DEFAULT_BATCH_SIZE);
    }

    public static FrameJoinConfig of(String jdbcUrl, int batchSize) {
        return new FrameJoinConfig(jdbcUrl, batchSize);
    }

    /**
     * Reads the configuration from system properties, falling back to defaults.
     *
     * @return the configuration
     */
    public static FrameJoinConfig fromSystemProperties() {
        String url = System.getProperty(PROP_JDBC_URL, DEFAULT_JDBC_URL);
        int batchSize = DEFAULT_BATCH_SIZE;
        String value = System.getProperty(PROP_BATCH_SIZE);
        if (value != null) {
            try {
                batchSize = Integer.parseInt(value.trim());
            } catch (NumberFormatException e) {
                logger.warn("Invalid value for {}: '{}', using default {}", PROP_BATCH_SIZE, value,
                    DEFAULT_BATCH_SIZE);
            }
        }
        return new FrameJoinConfig(url, batchSize);
    }

    /**
     * Validate and normalize batch size to be within allowed bounds.
     *
     * @param requested the requested batch size
     * @return normalized batch size within [MIN_BATCH_SIZE, MAX_BATCH_SIZE]
     */
    public static int normalizeBatchSize(int requested) {
        if (requested <= 0) return DEFAULT_BATCH_SIZE;
        if (requested < MIN_BATCH_SIZE) return MIN_BATCH_SIZE;
        if (requested > MAX_BATCH_SIZE) return MAX_BATCH_SIZE;
        return requested;
    }

    public String jdbcUrl() {
        return jdbcUrl;
    }

    public int batchSize() {
        return batchSize;
    }

    @Override
    public String toString() {
        return "FrameJoinConfig(jdbcUrl=" + jdbcUrl + ", batchSize=" + batchSize + ")";
    }
}
