package com.sqlbatcher.adapter;

import com.sqlbatcher.config.AppConfig;

import java.sql.DriverManager;
import java.sql.SQLException;

/**
 * Opens the adapter selected in the application configuration.
 */
public final class AdapterFactory {

    private AdapterFactory() {
    }

    public static SQLAdapter create(AppConfig config) throws SQLException {
        switch (config.getAdapterType()) {
            case DUCKDB:
                return new DuckDBAdapter(config.getDatabasePath(), config.getMaxQuerySize());
            case JDBC:
                if (config.getJdbcUrl() == null || config.getJdbcUrl().isEmpty()) {
                    throw new SQLException("database.url must be set for the jdbc adapter");
                }
                return new JdbcAdapter(
                        DriverManager.getConnection(config.getJdbcUrl(), config.getJdbcUser(), config.getJdbcPassword()),
                        config.getMaxQuerySize(),
                        true);
            default:
                throw new IllegalArgumentException("Unsupported adapter: " + config.getAdapterType());
        }
    }
}
