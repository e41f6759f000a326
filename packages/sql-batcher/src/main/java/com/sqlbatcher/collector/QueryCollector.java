package com.sqlbatcher.collector;

import java.util.List;
import java.util.Map;

/**
 * Sink for the SQL a batcher would have run in dry-run mode.
 */
public interface QueryCollector {

    void addQuery(String sql, Map<String, Object> metadata);

    /**
     * Returns the collected queries in the order they were added.
     */
    List<CollectedQuery> getQueries();
}
