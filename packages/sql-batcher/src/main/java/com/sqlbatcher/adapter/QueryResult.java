package com.sqlbatcher.adapter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Rows returned by an adapter, plus the time the statement took.
 */
public class QueryResult {
    private final List<String> columnNames;
    private final List<List<Object>> rows;
    private final long executionTimeMs;

    public QueryResult(List<String> columnNames, List<List<Object>> rows, long executionTimeMs) {
        this.columnNames = columnNames;
        this.rows = rows;
        this.executionTimeMs = executionTimeMs;
    }

    /**
     * Result of a statement that returns no rows (DDL, DML).
     */
    public static QueryResult empty(long executionTimeMs) {
        return new QueryResult(Collections.emptyList(), Collections.emptyList(), executionTimeMs);
    }

    public List<String> getColumnNames() { return columnNames; }
    public List<List<Object>> getRows() { return rows; }
    public long getExecutionTimeMs() { return executionTimeMs; }
    public int getRowCount() { return rows.size(); }
    public boolean isEmpty() { return columnNames.isEmpty(); }

    /**
     * Renders up to {@code maxRows} rows as a text table. Cells are cut at 50 characters.
     */
    public String formatResults(int maxRows) {
        if (columnNames.isEmpty()) {
            return "No results";
        }

        int shown = Math.min(rows.size(), Math.max(maxRows, 0));
        List<List<String>> cells = new ArrayList<>(shown);
        for (List<Object> row : rows.subList(0, shown)) {
            List<String> line = new ArrayList<>(row.size());
            for (Object value : row) {
                line.add(cell(value));
            }
            cells.add(line);
        }

        int[] widths = new int[columnNames.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = columnNames.get(i).length();
            for (List<String> line : cells) {
                if (i < line.size()) {
                    widths[i] = Math.max(widths[i], line.get(i).length());
                }
            }
        }

        StringBuilder sb = new StringBuilder();
        appendLine(sb, columnNames, widths, " | ");
        List<String> rule = new ArrayList<>(widths.length);
        for (int width : widths) {
            rule.add("-".repeat(width));
        }
        appendLine(sb, rule, widths, "-+-");
        for (List<String> line : cells) {
            appendLine(sb, line, widths, " | ");
        }

        if (rows.size() > shown) {
            sb.append("... ").append(rows.size() - shown).append(" more rows\n");
        }
        return sb.toString();
    }

    private static void appendLine(StringBuilder sb, List<String> values, int[] widths, String separator) {
        for (int i = 0; i < values.size() && i < widths.length; i++) {
            if (i > 0) sb.append(separator);
            sb.append(String.format("%-" + widths[i] + "s", values.get(i)));
        }
        sb.append("\n");
    }

    private static String cell(Object value) {
        String text = value == null ? "NULL" : value.toString();
        return text.length() > 50 ? text.substring(0, 47) + "..." : text;
    }
}
