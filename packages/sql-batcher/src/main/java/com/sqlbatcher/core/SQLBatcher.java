package com.sqlbatcher.core;

import com.sqlbatcher.collector.QueryCollector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups SQL statements into size-bounded batches and hands each batch to a
 * {@link StatementExecutor}.
 *
 * <p>The running batch size is the sum of the individually measured statement
 * sizes. Delimiter bytes are not counted, so the joined SQL of a batch of
 * {@code n} statements may exceed {@code maxBytes} by up to
 * {@code (n - 1) * delimiterSize}.
 *
 * <p>A batch is flushed as soon as its running size reaches {@code maxBytes}.
 * A statement that alone is larger than {@code maxBytes} is never merged with
 * others: the pending batch is flushed first and the statement is then flushed
 * on its own.
 *
 * <p>Instances keep mutable state and are not thread-safe. Use one batcher per
 * statement stream.
 */
public class SQLBatcher {

    private final BatcherConfig config;
    private final List<String> currentBatch = new ArrayList<>();
    private long currentSize;

    private long totalStatementsFlushed;
    private long totalBatchesFlushed;

    public SQLBatcher() {
        this(BatcherConfig.defaults());
    }

    public SQLBatcher(BatcherConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    /**
     * Appends a statement to the current batch.
     *
     * @return true if the batch has reached the size limit and should be flushed
     */
    public boolean addStatement(String statement) {
        append(statement, measure(statement));
        return currentSize >= config.getMaxBytes();
    }

    /**
     * Discards the current batch without executing it.
     */
    public void reset() {
        currentBatch.clear();
        currentSize = 0;
    }

    public <E extends Exception> int flush(StatementExecutor<E> executor) throws E {
        return flush(executor, null, null);
    }

    /**
     * Executes the current batch as one delimiter-joined SQL string, or records
     * it in the collector when running dry.
     *
     * <p>If the executor or collector throws, the batch is kept as it was.
     *
     * @param executor  runs the joined SQL; never called in dry-run mode
     * @param collector receives the joined SQL in dry-run mode, may be null
     * @param metadata  attached to the collected query, may be null
     * @return number of statements flushed, 0 if the batch was empty
     */
    public <E extends Exception> int flush(StatementExecutor<E> executor,
                                           QueryCollector collector,
                                           Map<String, Object> metadata) throws E {
        if (currentBatch.isEmpty()) {
            return 0;
        }

        int count = currentBatch.size();
        String sql = String.join(config.getDelimiter(), currentBatch);

        if (config.isDryRun()) {
            if (collector != null) {
                collector.addQuery(sql, metadata);
            }
        } else {
            Objects.requireNonNull(executor, "executor").execute(sql);
        }

        config.getListener().onFlush(count, currentSize, config.isDryRun());
        totalStatementsFlushed += count;
        totalBatchesFlushed++;
        reset();
        return count;
    }

    public <E extends Exception> int processStatements(Iterable<String> statements,
                                                       StatementExecutor<E> executor) throws E {
        return processStatements(statements, executor, null, null);
    }

    /**
     * Batches and flushes every statement in order, including a final flush of
     * whatever remains pending.
     *
     * <p>The statements are iterated once, so a lazily produced sequence is fine.
     *
     * @return number of statements flushed by this call
     */
    public <E extends Exception> int processStatements(Iterable<String> statements,
                                                       StatementExecutor<E> executor,
                                                       QueryCollector collector,
                                                       Map<String, Object> metadata) throws E {
        Objects.requireNonNull(statements, "statements");
        int total = 0;

        for (String statement : statements) {
            int size = measure(statement);

            if (size > config.getMaxBytes()) {
                total += flush(executor, collector, metadata);
                config.getListener().onOversizedStatement(size, config.getMaxBytes());
                append(statement, size);
                total += flush(executor, collector, metadata);
                continue;
            }

            append(statement, size);
            if (currentSize >= config.getMaxBytes()) {
                total += flush(executor, collector, metadata);
            }
        }

        total += flush(executor, collector, metadata);
        return total;
    }

    private void append(String statement, int size) {
        currentBatch.add(statement);
        currentSize += size;
    }

    private int measure(String statement) {
        Objects.requireNonNull(statement, "statement");
        int size = config.getSizeFunction().sizeOf(statement);
        if (size < 0) {
            throw new IllegalStateException("Size function returned negative size " + size);
        }
        return size;
    }

    public BatcherConfig getConfig() { return config; }
    public List<String> getCurrentBatch() { return Collections.unmodifiableList(currentBatch); }
    public long getCurrentSize() { return currentSize; }
    public boolean isEmpty() { return currentBatch.isEmpty(); }
    public long getTotalStatementsFlushed() { return totalStatementsFlushed; }
    public long getTotalBatchesFlushed() { return totalBatchesFlushed; }
}
