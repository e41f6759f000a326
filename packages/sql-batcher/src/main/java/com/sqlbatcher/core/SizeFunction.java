package com.sqlbatcher.core;

import java.nio.charset.StandardCharsets;

/**
 * Measures the size of a single SQL statement for batching purposes.
 */
@FunctionalInterface
public interface SizeFunction {

    /**
     * Returns the measured size of the statement. Must not be negative.
     */
    int sizeOf(String statement);

    /**
     * Default measurement: number of bytes in the UTF-8 encoding.
     */
    static SizeFunction utf8() {
        return statement -> statement.getBytes(StandardCharsets.UTF_8).length;
    }
}
