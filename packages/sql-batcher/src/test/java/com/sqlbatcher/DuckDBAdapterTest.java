package com.sqlbatcher;

import com.sqlbatcher.adapter.DuckDBAdapter;
import com.sqlbatcher.adapter.JdbcAdapter;
import com.sqlbatcher.adapter.QueryResult;
import com.sqlbatcher.core.BatcherConfig;
import com.sqlbatcher.core.SQLBatcher;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DuckDBAdapterTest {

    private DuckDBAdapter adapter;

    @BeforeEach
    void setUp() throws SQLException {
        adapter = DuckDBAdapter.inMemory();
        adapter.execute("CREATE TABLE users (id INTEGER, name VARCHAR)");
    }

    @AfterEach
    void tearDown() throws SQLException {
        adapter.close();
    }

    @Test
    void testExecuteReturnsRows() throws SQLException {
        QueryResult ddl = adapter.execute("INSERT INTO users VALUES (1, 'Alice'), (2, 'Bob')");
        assertTrue(ddl.isEmpty());

        QueryResult result = adapter.execute("SELECT id, name FROM users ORDER BY id");

        assertEquals(List.of("id", "name"), result.getColumnNames());
        assertEquals(2, result.getRowCount());
        assertEquals("Alice", result.getRows().get(0).get(1));
        assertTrue(result.formatResults(10).contains("Bob"));
    }

    @Test
    void testBatchedInsertsThroughBatcher() throws SQLException {
        List<String> statements = new ArrayList<>();
        for (int i = 0; i < 250; i++) {
            statements.add("INSERT INTO users VALUES (" + i + ", 'user" + i + "')");
        }
        SQLBatcher batcher = new SQLBatcher(BatcherConfig.builder()
                .maxBytes(adapter.getMaxQuerySize() / 100)
                .build());

        int total = batcher.processStatements(statements, adapter::execute);

        assertEquals(250, total);
        assertTrue(batcher.getTotalBatchesFlushed() > 1);
        assertEquals(250, adapter.getRowCount("users"));
    }

    @Test
    void testExecutionErrorPropagatesThroughBatcher() throws SQLException {
        SQLBatcher batcher = new SQLBatcher(BatcherConfig.builder().maxBytes(37).build());
        List<String> statements = List.of(
                "INSERT INTO users VALUES (1, 'Alice')",
                "INSERT INTO no_such_table VALUES (2)");

        assertThrows(SQLException.class, () -> batcher.processStatements(statements, adapter::execute));

        assertEquals(1, adapter.getRowCount("users"));
        assertEquals(1, batcher.getCurrentBatch().size());
    }

    @Test
    void testRollbackTransaction() throws SQLException {
        adapter.beginTransaction();
        assertTrue(adapter.isInTransaction());
        adapter.execute("INSERT INTO users VALUES (1, 'Alice')");
        adapter.rollbackTransaction();

        assertFalse(adapter.isInTransaction());
        assertEquals(0, adapter.getRowCount("users"));
        assertTrue(adapter.getConnection().getAutoCommit());
    }

    @Test
    void testCommitTransaction() throws SQLException {
        adapter.beginTransaction();
        adapter.execute("INSERT INTO users VALUES (1, 'Alice')");
        adapter.commitTransaction();

        assertEquals(1, adapter.getRowCount("users"));
    }

    @Test
    void testNestedTransactionRejected() throws SQLException {
        adapter.beginTransaction();

        assertThrows(SQLException.class, adapter::beginTransaction);
        adapter.rollbackTransaction();
    }

    @Test
    void testCommitOrRollbackWithoutTransactionRejected() throws SQLException {
        assertThrows(SQLException.class, adapter::commitTransaction);
        assertThrows(SQLException.class, adapter::rollbackTransaction);

        assertFalse(adapter.isInTransaction());
        assertTrue(adapter.getConnection().getAutoCommit());
    }

    @Test
    void testFormatResultsTruncates() throws SQLException {
        adapter.execute("INSERT INTO users VALUES (1, '" + "a".repeat(80) + "'), (2, NULL), (3, 'Carol')");

        String table = adapter.execute("SELECT id, name FROM users ORDER BY id").formatResults(2);

        assertTrue(table.startsWith("id | name"));
        assertTrue(table.contains("a".repeat(47) + "..."));
        assertFalse(table.contains("a".repeat(48)));
        assertTrue(table.contains("NULL"));
        assertFalse(table.contains("Carol"));
        assertTrue(table.contains("... 1 more rows"));
        assertEquals("No results", QueryResult.empty(0).formatResults(10));
    }

    @Test
    void testTableNames() throws SQLException {
        adapter.execute("CREATE TABLE orders (id INTEGER)");

        assertEquals(List.of("orders", "users"), adapter.getTableNames());
    }

    @Test
    void testGenericJdbcAdapter() throws SQLException {
        try (JdbcAdapter jdbc = new JdbcAdapter(DriverManager.getConnection("jdbc:duckdb:"), 1000, false)) {
            assertEquals(1000, jdbc.getMaxQuerySize());
            assertFalse(jdbc.isAutoCommit());

            QueryResult result = jdbc.execute("SELECT 42 AS answer");

            assertEquals(42, ((Number) result.getRows().get(0).get(0)).intValue());
        }
    }

    @Test
    void testInvalidMaxQuerySize() {
        assertThrows(IllegalArgumentException.class,
                () -> new JdbcAdapter(DriverManager.getConnection("jdbc:duckdb:"), 0, true));
    }
}
