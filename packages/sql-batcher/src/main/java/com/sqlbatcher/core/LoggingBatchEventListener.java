package com.sqlbatcher.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link BatchEventListener} that writes diagnostics through SLF4J.
 */
public class LoggingBatchEventListener implements BatchEventListener {
    private static final Logger logger = LoggerFactory.getLogger(SQLBatcher.class);

    @Override
    public void onOversizedStatement(int size, int maxBytes) {
        logger.warn("SQL statement exceeds max batch size ({} bytes > {} bytes), executing it on its own",
                size, maxBytes);
    }

    @Override
    public void onFlush(int statementCount, long byteSize, boolean dryRun) {
        if (dryRun) {
            logger.info("[DRY RUN] SQL batch with {} statements ({} bytes)", statementCount, byteSize);
        } else {
            logger.debug("Flushed SQL batch with {} statements ({} bytes)", statementCount, byteSize);
        }
    }
}
