package com.sqlbatcher.collector;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * In-memory, append-only {@link QueryCollector}.
 *
 * <p>Metadata keys {@code table_name}, {@code type} and {@code row_count} are
 * understood by the lookup and statistics methods; any other keys are kept as-is.
 */
public class ListQueryCollector implements QueryCollector {
    private static final Logger logger = LoggerFactory.getLogger(ListQueryCollector.class);
    private static final Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static final String TABLE_NAME = "table_name";
    public static final String TYPE = "type";
    public static final String ROW_COUNT = "row_count";

    private static final String UNKNOWN = "unknown";

    private final List<CollectedQuery> queries = new ArrayList<>();

    @Override
    public void addQuery(String sql, Map<String, Object> metadata) {
        CollectedQuery query = new CollectedQuery(sql, metadata);
        queries.add(query);
        logger.debug("Collected query #{} ({} chars, table={})",
                queries.size(), sql.length(), query.getMetadataString(TABLE_NAME, UNKNOWN));
    }

    @Override
    public List<CollectedQuery> getQueries() {
        return Collections.unmodifiableList(queries);
    }

    public int size() {
        return queries.size();
    }

    public void clear() {
        queries.clear();
    }

    public List<CollectedQuery> getQueriesByTable(String tableName) {
        return queries.stream()
                .filter(q -> tableName.equals(q.getMetadataString(TABLE_NAME, UNKNOWN)))
                .collect(Collectors.toList());
    }

    public List<CollectedQuery> getQueriesByType(String type) {
        return queries.stream()
                .filter(q -> type.equals(q.getMetadataString(TYPE, null)))
                .collect(Collectors.toList());
    }

    /**
     * Sum of the {@code row_count} metadata of every query; queries without it count as 0.
     */
    public long getTotalRowCount() {
        long total = 0;
        for (CollectedQuery query : queries) {
            Object rowCount = query.getMetadata().get(ROW_COUNT);
            if (rowCount instanceof Number) {
                total += ((Number) rowCount).longValue();
            }
        }
        return total;
    }

    public QueryStats getStats() {
        Map<String, Integer> tables = new TreeMap<>();
        Map<String, Integer> types = new TreeMap<>();
        for (CollectedQuery query : queries) {
            tables.merge(query.getMetadataString(TABLE_NAME, UNKNOWN), 1, Integer::sum);
            String type = query.getMetadataString(TYPE, null);
            if (type != null) {
                types.merge(type, 1, Integer::sum);
            }
        }
        return new QueryStats(queries.size(), getTotalRowCount(), tables, types);
    }

    /**
     * Renders the collected queries and their statistics as JSON.
     */
    public String toJson() {
        JsonObject root = new JsonObject();

        JsonArray items = new JsonArray();
        for (CollectedQuery query : queries) {
            JsonObject item = new JsonObject();
            item.addProperty("sql", query.getSql());
            item.add("metadata", gson.toJsonTree(query.getMetadata()));
            items.add(item);
        }
        root.add("queries", items);

        QueryStats stats = getStats();
        JsonObject statsJson = new JsonObject();
        statsJson.addProperty("total_queries", stats.getTotalQueries());
        statsJson.addProperty("total_row_count", stats.getTotalRowCount());
        statsJson.add("tables", gson.toJsonTree(stats.getTables()));
        statsJson.add("query_types", gson.toJsonTree(stats.getQueryTypes()));
        root.add("stats", statsJson);

        return gson.toJson(root);
    }
}
