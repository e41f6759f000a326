package com.sqlbatcher.cli;

import com.sqlbatcher.adapter.AdapterFactory;
import com.sqlbatcher.adapter.DuckDBAdapter;
import com.sqlbatcher.adapter.QueryResult;
import com.sqlbatcher.adapter.SQLAdapter;
import com.sqlbatcher.collector.CollectedQuery;
import com.sqlbatcher.collector.ListQueryCollector;
import com.sqlbatcher.config.AppConfig;
import com.sqlbatcher.core.SQLBatcher;
import com.sqlbatcher.io.BatchFileWriter;
import com.sqlbatcher.io.SqlFileReader;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

@Command(
        name = "process",
        description = "Process SQL statements from a file"
)
public class ProcessCommand implements Callable<Integer> {

    @ParentCommand
    private MainCommand parent;

    @Parameters(index = "0", description = "SQL file to process")
    private Path inputFile;

    @Option(names = {"--max-size"}, description = "Maximum batch size in bytes")
    private Integer maxSize;

    @Option(names = {"--delimiter"}, description = "SQL statement delimiter")
    private String delimiter;

    @Option(names = {"--dry-run"}, description = "Don't execute, just collect the batches")
    private boolean dryRun;

    @Option(names = {"--output"}, description = "Output file for batched SQL (dry-run mode)")
    private Path output;

    @Option(names = {"--collect"}, description = "Output file for collected queries as JSON (dry-run mode)")
    private Path collectFile;

    @Option(names = {"--table"}, description = "Table name recorded with collected queries")
    private String tableName;

    @Option(names = {"-d", "--database"}, description = "DuckDB database path")
    private String databasePath;

    @Option(names = {"--transaction"}, description = "Run all batches in a single transaction")
    private boolean transaction;

    @Option(names = {"--use-adapter-limit"}, description = "Use the adapter's max query size as batch size")
    private boolean useAdapterLimit;

    @Option(names = {"--max-rows"}, description = "Rows to show from a final query (default: ${DEFAULT-VALUE})")
    private int maxRows = 20;

    @Override
    public Integer call() {
        try {
            // Load configuration
            AppConfig config = parent.loadConfig();
            applyOverrides(config);

            SqlFileReader reader = new SqlFileReader(config.getDelimiter());
            System.out.println("Processing SQL file: " + inputFile);

            if (config.isDryRun()) {
                return dryRun(config, reader);
            }
            return execute(config, reader);

        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            if (parent.isVerbose()) {
                e.printStackTrace();
            }
            return 1;
        }
    }

    private void applyOverrides(AppConfig config) {
        if (maxSize != null) {
            config.setMaxBytes(maxSize);
        }
        if (delimiter != null) {
            config.setDelimiter(delimiter);
        }
        if (dryRun) {
            config.setDryRun(true);
        }
        if (databasePath != null) {
            config.setDatabasePath(databasePath);
        }
        if (useAdapterLimit) {
            config.setUseAdapterLimit(true);
        }
    }

    private int dryRun(AppConfig config, SqlFileReader reader) throws IOException {
        SQLBatcher batcher = new SQLBatcher(config.toBatcherConfig());
        ListQueryCollector collector = new ListQueryCollector();

        int total;
        try (SqlFileReader.StatementStream statements = reader.stream(inputFile)) {
            total = batcher.processStatements(statements, sql -> {
                throw new IllegalStateException("Statements are not executed in dry-run mode");
            }, collector, metadata());
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("DRY RUN");
        System.out.println("=".repeat(60));
        System.out.printf("Processed %d statements in %d batches (max %,d bytes per batch)%n",
                total, collector.size(), config.getMaxBytes());

        List<CollectedQuery> queries = collector.getQueries();
        for (int i = 0; i < queries.size(); i++) {
            int bytes = queries.get(i).getSql().getBytes(StandardCharsets.UTF_8).length;
            System.out.printf("  Batch %d: %,d bytes%n", i + 1, bytes);
        }
        System.out.println();
        System.out.print(collector.getStats().formatSummary());

        if (output != null) {
            BatchFileWriter.write(output, queries.stream()
                    .map(CollectedQuery::getSql)
                    .collect(Collectors.toList()));
            System.out.println("Saved batched SQL to: " + output);
        }
        if (collectFile != null) {
            Files.writeString(collectFile, collector.toJson(), StandardCharsets.UTF_8);
            System.out.println("Saved collected queries to: " + collectFile);
        }
        return 0;
    }

    private int execute(AppConfig config, SqlFileReader reader) throws IOException, SQLException {
        try (SQLAdapter adapter = AdapterFactory.create(config);
             SqlFileReader.StatementStream statements = reader.stream(inputFile)) {

            SQLBatcher batcher = new SQLBatcher(config.toBatcherConfig(adapter));
            AtomicReference<QueryResult> lastResult = new AtomicReference<>();
            long startTime = System.currentTimeMillis();

            if (transaction) {
                adapter.beginTransaction();
            }
            int total;
            try {
                total = batcher.processStatements(statements, sql -> lastResult.set(adapter.execute(sql)));
                if (transaction) {
                    adapter.commitTransaction();
                }
            } catch (SQLException | RuntimeException e) {
                if (transaction) {
                    try {
                        adapter.rollbackTransaction();
                        System.err.println("Transaction rolled back");
                    } catch (SQLException rollbackError) {
                        e.addSuppressed(rollbackError);
                    }
                }
                throw e;
            }

            System.out.println("\n" + "-".repeat(60));
            System.out.println("EXECUTION SUMMARY");
            System.out.println("-".repeat(60));
            System.out.printf("Executed %d statements in %d batches%n", total, batcher.getTotalBatchesFlushed());
            System.out.printf("Execution time: %d ms%n", System.currentTimeMillis() - startTime);

            // Rows of the last batch, when it ended in a query
            QueryResult result = lastResult.get();
            if (result != null && !result.isEmpty()) {
                System.out.println("\nResults:");
                System.out.println(result.formatResults(maxRows));
                System.out.printf("Total rows: %d%n", result.getRowCount());
            }

            if (adapter instanceof DuckDBAdapter) {
                printTables((DuckDBAdapter) adapter);
            }
            return 0;
        }
    }

    private void printTables(DuckDBAdapter duckDB) throws SQLException {
        List<String> tables = duckDB.getTableNames();
        if (tables.isEmpty()) {
            return;
        }
        System.out.println("\nTables:");
        for (String table : tables) {
            System.out.printf("  %-30s %,d rows%n", table, duckDB.getRowCount(table));
        }
    }

    private Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("source", inputFile.getFileName().toString());
        if (tableName != null) {
            metadata.put(ListQueryCollector.TABLE_NAME, tableName);
        }
        return metadata;
    }
}
