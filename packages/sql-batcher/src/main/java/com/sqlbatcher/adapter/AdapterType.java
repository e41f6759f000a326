package com.sqlbatcher.adapter;

/**
 * Adapters the command line can construct.
 */
public enum AdapterType {
    DUCKDB("DuckDB embedded database (file path or in-memory)"),
    JDBC("Any JDBC driver on the classpath, addressed by URL");

    private final String description;

    AdapterType(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }

    public String getName() {
        return name().toLowerCase();
    }
}
