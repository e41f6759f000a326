package com.sqlbatcher.adapter;

import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link JdbcAdapter} for an embedded DuckDB database. An empty path opens an in-memory database.
 */
public class DuckDBAdapter extends JdbcAdapter {
    private final String databasePath;

    static {
        try {
            Class.forName("org.duckdb.DuckDBDriver");
        } catch (ClassNotFoundException e) {
            throw new RuntimeException("DuckDB driver not found", e);
        }
    }

    public DuckDBAdapter(String databasePath) throws SQLException {
        this(databasePath, DEFAULT_MAX_QUERY_SIZE);
    }

    public DuckDBAdapter(String databasePath, int maxQuerySize) throws SQLException {
        super(DriverManager.getConnection("jdbc:duckdb:" + (databasePath == null ? "" : databasePath)),
                maxQuerySize, true);
        this.databasePath = databasePath == null ? "" : databasePath;
    }

    public static DuckDBAdapter inMemory() throws SQLException {
        return new DuckDBAdapter("");
    }

    public String getDatabasePath() {
        return databasePath;
    }

    /**
     * Get list of table names in the main schema.
     */
    public List<String> getTableNames() throws SQLException {
        List<String> tables = new ArrayList<>();
        try (Statement stmt = getConnection().createStatement();
             ResultSet rs = stmt.executeQuery(
                     "SELECT table_name FROM information_schema.tables " +
                             "WHERE table_schema = 'main' AND table_type = 'BASE TABLE' " +
                             "ORDER BY table_name")) {
            while (rs.next()) {
                tables.add(rs.getString("table_name"));
            }
        }
        return tables;
    }

    public long getRowCount(String tableName) throws SQLException {
        String quoted = "\"" + tableName.replace("\"", "\"\"") + "\"";
        try (Statement stmt = getConnection().createStatement();
             ResultSet rs = stmt.executeQuery("SELECT COUNT(*) FROM " + quoted)) {
            rs.next();
            return rs.getLong(1);
        }
    }
}
