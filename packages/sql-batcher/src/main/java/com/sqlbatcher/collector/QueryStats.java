package com.sqlbatcher.collector;

import java.util.Map;

/**
 * Summary of the queries held by a {@link ListQueryCollector}.
 */
public class QueryStats {
    private final int totalQueries;
    private final long totalRowCount;
    private final Map<String, Integer> tables;
    private final Map<String, Integer> queryTypes;

    public QueryStats(int totalQueries, long totalRowCount,
                      Map<String, Integer> tables, Map<String, Integer> queryTypes) {
        this.totalQueries = totalQueries;
        this.totalRowCount = totalRowCount;
        this.tables = tables;
        this.queryTypes = queryTypes;
    }

    public int getTotalQueries() { return totalQueries; }
    public long getTotalRowCount() { return totalRowCount; }
    public Map<String, Integer> getTables() { return tables; }
    public Map<String, Integer> getQueryTypes() { return queryTypes; }

    public String formatSummary() {
        StringBuilder sb = new StringBuilder();
        sb.append("Collected queries: ").append(totalQueries).append("\n");
        sb.append("Estimated rows:    ").append(totalRowCount).append("\n");
        if (!tables.isEmpty()) {
            sb.append("By table:\n");
            tables.forEach((table, count) -> sb.append("  ").append(table).append(": ").append(count).append("\n"));
        }
        if (!queryTypes.isEmpty()) {
            sb.append("By type:\n");
            queryTypes.forEach((type, count) -> sb.append("  ").append(type).append(": ").append(count).append("\n"));
        }
        return sb.toString();
    }
}
