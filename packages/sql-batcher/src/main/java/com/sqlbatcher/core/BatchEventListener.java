package com.sqlbatcher.core;

/**
 * Receives diagnostics from a {@link SQLBatcher}. All methods default to no-ops.
 */
public interface BatchEventListener {

    BatchEventListener NONE = new BatchEventListener() { };

    /**
     * Called before a statement larger than the configured maximum is flushed on its own.
     */
    default void onOversizedStatement(int size, int maxBytes) {
    }

    /**
     * Called after a batch was executed or, in dry-run mode, recorded.
     */
    default void onFlush(int statementCount, long byteSize, boolean dryRun) {
    }
}
