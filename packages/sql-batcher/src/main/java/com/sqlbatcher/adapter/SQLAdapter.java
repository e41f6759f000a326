package com.sqlbatcher.adapter;

import java.sql.SQLException;

/**
 * Database-specific execution capabilities a {@link com.sqlbatcher.core.SQLBatcher}
 * can be paired with, typically as {@code batcher.processStatements(statements, adapter::execute)}.
 *
 * <p>The batcher never calls the transaction hooks; callers wrap them around
 * one or more {@code processStatements} calls.
 */
public interface SQLAdapter extends AutoCloseable {

    /**
     * Runs the SQL and returns its rows, or an empty result for statements that produce none.
     */
    QueryResult execute(String sql) throws SQLException;

    /**
     * Advisory maximum query size in bytes, suitable as the batcher's max bytes.
     */
    int getMaxQuerySize();

    @Override
    void close() throws SQLException;

    default void beginTransaction() throws SQLException {
    }

    default void commitTransaction() throws SQLException {
    }

    default void rollbackTransaction() throws SQLException {
    }
}
