package com.sqlbatcher.collector;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One collected batch of SQL together with the caller's metadata.
 */
public final class CollectedQuery {
    private final String sql;
    private final Map<String, Object> metadata;

    public CollectedQuery(String sql, Map<String, Object> metadata) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.metadata = metadata == null || metadata.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String getSql() { return sql; }
    public Map<String, Object> getMetadata() { return metadata; }

    /**
     * Returns the metadata value as a string, or the fallback when absent.
     */
    public String getMetadataString(String key, String fallback) {
        Object value = metadata.get(key);
        return value != null ? value.toString() : fallback;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CollectedQuery)) return false;
        CollectedQuery that = (CollectedQuery) o;
        return sql.equals(that.sql) && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sql, metadata);
    }

    @Override
    public String toString() {
        return "CollectedQuery{sql='" + sql + "', metadata=" + metadata + "}";
    }
}
