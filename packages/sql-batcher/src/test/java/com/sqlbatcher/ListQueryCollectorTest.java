package com.sqlbatcher;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.sqlbatcher.collector.CollectedQuery;
import com.sqlbatcher.collector.ListQueryCollector;
import com.sqlbatcher.collector.QueryStats;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ListQueryCollectorTest {

    private ListQueryCollector collector;

    @BeforeEach
    void setUp() {
        collector = new ListQueryCollector();
        collector.addQuery("INSERT INTO users VALUES (1)", Map.of("table_name", "users", "type", "INSERT", "row_count", 1));
        collector.addQuery("CREATE TABLE orders (id INT)", Map.of("table_name", "orders", "type", "DDL"));
        collector.addQuery("INSERT INTO users VALUES (2);INSERT INTO users VALUES (3)",
                Map.of("table_name", "users", "type", "INSERT", "row_count", 2));
    }

    @Test
    void testKeepsInsertionOrder() {
        List<CollectedQuery> queries = collector.getQueries();

        assertEquals(3, queries.size());
        assertEquals("INSERT INTO users VALUES (1)", queries.get(0).getSql());
        assertEquals("CREATE TABLE orders (id INT)", queries.get(1).getSql());
        assertTrue(queries.get(2).getSql().endsWith("(3)"));
    }

    @Test
    void testQueriesViewIsReadOnly() {
        assertThrows(UnsupportedOperationException.class,
                () -> collector.getQueries().add(new CollectedQuery("SELECT 1", null)));
    }

    @Test
    void testMetadataIsCopied() {
        ListQueryCollector fresh = new ListQueryCollector();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("table_name", "a");

        fresh.addQuery("SELECT 1", metadata);
        metadata.put("table_name", "b");

        assertEquals("a", fresh.getQueries().get(0).getMetadata().get("table_name"));
    }

    @Test
    void testNullMetadataBecomesEmpty() {
        ListQueryCollector fresh = new ListQueryCollector();
        fresh.addQuery("SELECT 1", null);

        assertTrue(fresh.getQueries().get(0).getMetadata().isEmpty());
        assertEquals(1, fresh.getQueriesByTable("unknown").size());
    }

    @Test
    void testLookupByTableAndType() {
        assertEquals(2, collector.getQueriesByTable("users").size());
        assertEquals(1, collector.getQueriesByTable("orders").size());
        assertTrue(collector.getQueriesByTable("missing").isEmpty());

        assertEquals(2, collector.getQueriesByType("INSERT").size());
        assertEquals(1, collector.getQueriesByType("DDL").size());
    }

    @Test
    void testStats() {
        QueryStats stats = collector.getStats();

        assertEquals(3, stats.getTotalQueries());
        assertEquals(3, stats.getTotalRowCount());
        assertEquals(2, stats.getTables().get("users"));
        assertEquals(1, stats.getTables().get("orders"));
        assertEquals(2, stats.getQueryTypes().get("INSERT"));
        assertTrue(stats.formatSummary().contains("users: 2"));
    }

    @Test
    void testClear() {
        collector.clear();

        assertEquals(0, collector.size());
        assertEquals(0, collector.getTotalRowCount());
        assertEquals(0, collector.getStats().getTotalQueries());
    }

    @Test
    void testToJson() {
        JsonObject json = JsonParser.parseString(collector.toJson()).getAsJsonObject();

        assertEquals(3, json.getAsJsonArray("queries").size());
        JsonObject first = json.getAsJsonArray("queries").get(0).getAsJsonObject();
        assertEquals("INSERT INTO users VALUES (1)", first.get("sql").getAsString());
        assertEquals("users", first.getAsJsonObject("metadata").get("table_name").getAsString());

        JsonObject stats = json.getAsJsonObject("stats");
        assertEquals(3, stats.get("total_queries").getAsInt());
        assertEquals(3, stats.get("total_row_count").getAsLong());
        assertEquals(1, stats.getAsJsonObject("query_types").get("DDL").getAsInt());
    }
}
