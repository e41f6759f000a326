package com.sqlbatcher.io;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes batched SQL to a script file, one {@code -- Batch N} section per batch.
 */
public final class BatchFileWriter {

    private BatchFileWriter() {
    }

    public static void write(Path path, List<String> batches) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            for (int i = 0; i < batches.size(); i++) {
                writer.write("-- Batch " + (i + 1) + "\n");
                writer.write(batches.get(i));
                writer.write("\n\n");
            }
        }
    }
}
