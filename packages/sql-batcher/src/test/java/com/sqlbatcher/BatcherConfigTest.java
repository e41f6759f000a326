package com.sqlbatcher;

import com.sqlbatcher.core.BatchEventListener;
import com.sqlbatcher.core.BatcherConfig;
import com.sqlbatcher.core.LoggingBatchEventListener;
import com.sqlbatcher.core.SizeFunction;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BatcherConfigTest {

    @Test
    void testDefaults() {
        BatcherConfig config = BatcherConfig.defaults();

        assertEquals(1_000_000, config.getMaxBytes());
        assertEquals(";", config.getDelimiter());
        assertFalse(config.isDryRun());
        assertEquals(5, config.getSizeFunction().sizeOf("hello"));
        assertTrue(config.getListener() instanceof LoggingBatchEventListener);
    }

    @Test
    void testRejectsNonPositiveMaxBytes() {
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().maxBytes(0).build());
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().maxBytes(-5).build());
    }

    @Test
    void testRejectsNullDelimiterAndSizeFunction() {
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().delimiter(null).build());
        assertThrows(IllegalArgumentException.class, () -> BatcherConfig.builder().sizeFunction(null).build());
    }

    @Test
    void testNullListenerDisablesDiagnostics() {
        BatcherConfig config = BatcherConfig.builder().listener(null).build();

        assertSame(BatchEventListener.NONE, config.getListener());
    }

    @Test
    void testToBuilderCopiesSettings() {
        SizeFunction chars = String::length;
        BatcherConfig original = BatcherConfig.builder()
                .maxBytes(42)
                .delimiter("\n")
                .dryRun(true)
                .sizeFunction(chars)
                .build();

        BatcherConfig copy = original.toBuilder().maxBytes(7).build();

        assertEquals(7, copy.getMaxBytes());
        assertEquals("\n", copy.getDelimiter());
        assertTrue(copy.isDryRun());
        assertSame(chars, copy.getSizeFunction());
        assertEquals(42, original.getMaxBytes());
    }

    @Test
    void testUtf8SizeFunction() {
        SizeFunction utf8 = SizeFunction.utf8();

        assertEquals(0, utf8.sizeOf(""));
        assertEquals(3, utf8.sizeOf("abc"));
        assertEquals(3, utf8.sizeOf("€"));
    }
}
