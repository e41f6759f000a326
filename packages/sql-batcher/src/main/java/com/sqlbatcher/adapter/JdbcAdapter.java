package com.sqlbatcher.adapter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link SQLAdapter} over any JDBC connection.
 *
 * <p>With auto-commit enabled every executed batch is committed by the driver,
 * except inside {@link #beginTransaction()} / {@link #commitTransaction()}.
 * A failed statement outside a transaction is rolled back when the connection
 * is not in driver auto-commit mode.
 */
public class JdbcAdapter implements SQLAdapter {
    private static final Logger logger = LoggerFactory.getLogger(JdbcAdapter.class);

    public static final int DEFAULT_MAX_QUERY_SIZE = 500_000;

    private final Connection connection;
    private final int maxQuerySize;
    private final boolean autoCommit;
    private boolean inTransaction;

    public JdbcAdapter(Connection connection) throws SQLException {
        this(connection, DEFAULT_MAX_QUERY_SIZE, true);
    }

    public JdbcAdapter(Connection connection, int maxQuerySize, boolean autoCommit) throws SQLException {
        if (maxQuerySize <= 0) {
            throw new IllegalArgumentException("max query size must be positive, got " + maxQuerySize);
        }
        this.connection = Objects.requireNonNull(connection, "connection");
        this.maxQuerySize = maxQuerySize;
        this.autoCommit = autoCommit;
        connection.setAutoCommit(autoCommit);
        logger.debug("Initialized {} with maxQuerySize={}, autoCommit={}",
                getClass().getSimpleName(), maxQuerySize, autoCommit);
    }

    public Connection getConnection() {
        return connection;
    }

    public boolean isAutoCommit() {
        return autoCommit;
    }

    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public QueryResult execute(String sql) throws SQLException {
        long startTime = System.currentTimeMillis();
        logger.debug("Executing SQL ({} chars)", sql.length());

        try (Statement stmt = connection.createStatement()) {
            boolean hasResultSet = stmt.execute(sql);
            if (!hasResultSet) {
                return QueryResult.empty(System.currentTimeMillis() - startTime);
            }
            try (ResultSet rs = stmt.getResultSet()) {
                return readResults(rs, startTime);
            }
        } catch (SQLException e) {
            logger.error("Error executing SQL: {}", e.getMessage());
            if (!inTransaction && !connection.getAutoCommit()) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackError) {
                    e.addSuppressed(rollbackError);
                }
            }
            throw e;
        }
    }

    private QueryResult readResults(ResultSet rs, long startTime) throws SQLException {
        List<String> columnNames = new ArrayList<>();
        List<List<Object>> rows = new ArrayList<>();

        ResultSetMetaData meta = rs.getMetaData();
        int columnCount = meta.getColumnCount();

        for (int i = 1; i <= columnCount; i++) {
            columnNames.add(meta.getColumnName(i));
        }

        while (rs.next()) {
            List<Object> row = new ArrayList<>();
            for (int i = 1; i <= columnCount; i++) {
                row.add(rs.getObject(i));
            }
            rows.add(row);
        }

        return new QueryResult(columnNames, rows, System.currentTimeMillis() - startTime);
    }

    @Override
    public int getMaxQuerySize() {
        return maxQuerySize;
    }

    @Override
    public void beginTransaction() throws SQLException {
        if (inTransaction) {
            throw new SQLException("Transaction already in progress");
        }
        connection.setAutoCommit(false);
        inTransaction = true;
        logger.debug("Transaction started");
    }

    @Override
    public void commitTransaction() throws SQLException {
        requireTransaction();
        try {
            connection.commit();
            logger.debug("Transaction committed");
        } finally {
            endTransaction();
        }
    }

    @Override
    public void rollbackTransaction() throws SQLException {
        requireTransaction();
        try {
            connection.rollback();
            logger.debug("Transaction rolled back");
        } finally {
            endTransaction();
        }
    }

    private void requireTransaction() throws SQLException {
        if (!inTransaction) {
            throw new SQLException("No transaction in progress");
        }
    }

    private void endTransaction() throws SQLException {
        inTransaction = false;
        connection.setAutoCommit(autoCommit);
    }

    @Override
    public void close() throws SQLException {
        if (!connection.isClosed()) {
            connection.close();
            logger.debug("Closed JDBC connection");
        }
    }
}
