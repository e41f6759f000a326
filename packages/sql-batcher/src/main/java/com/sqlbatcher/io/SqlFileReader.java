package com.sqlbatcher.io;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Reads SQL statements from a script file.
 *
 * <p>Blank lines and {@code --} comment lines are skipped. Lines are trimmed
 * and joined with a single space until a line ends with the delimiter. The
 * terminating delimiter is removed from each statement. A final statement
 * without a delimiter is still returned.
 *
 * <p>This is line-based, not a SQL parser: a delimiter at the end of a line
 * inside a string literal also ends the statement.
 */
public class SqlFileReader {

    private final String delimiter;

    public SqlFileReader(String delimiter) {
        if (delimiter == null || delimiter.isEmpty()) {
            throw new IllegalArgumentException("delimiter must not be empty");
        }
        this.delimiter = delimiter;
    }

    /**
     * Reads every statement in the file.
     */
    public List<String> read(Path path) throws IOException {
        List<String> statements = new ArrayList<>();
        try (BufferedReader reader = open(path)) {
            StatementIterator it = new StatementIterator(reader);
            while (it.hasNext()) {
                statements.add(it.next());
            }
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        return statements;
    }

    /**
     * Returns the statements as a lazily read, single-pass sequence.
     *
     * <p>The file stays open until the returned reader is closed.
     */
    public StatementStream stream(Path path) throws IOException {
        return new StatementStream(open(path));
    }

    private BufferedReader open(Path path) throws IOException {
        if (!Files.exists(path)) {
            throw new NoSuchFileException(path.toString(), null, "SQL file not found");
        }
        return Files.newBufferedReader(path, StandardCharsets.UTF_8);
    }

    /**
     * Single-pass statement sequence backed by an open file.
     */
    public final class StatementStream implements Iterable<String>, AutoCloseable {
        private final BufferedReader reader;
        private boolean consumed;

        private StatementStream(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public Iterator<String> iterator() {
            if (consumed) {
                throw new IllegalStateException("Statement stream can only be iterated once");
            }
            consumed = true;
            return new StatementIterator(reader);
        }

        @Override
        public void close() throws IOException {
            reader.close();
        }
    }

    private final class StatementIterator implements Iterator<String> {
        private final BufferedReader reader;
        private String next;
        private boolean done;

        private StatementIterator(BufferedReader reader) {
            this.reader = reader;
        }

        @Override
        public boolean hasNext() {
            if (next == null && !done) {
                next = readStatement();
                done = next == null;
            }
            return next != null;
        }

        @Override
        public String next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            String statement = next;
            next = null;
            return statement;
        }

        private String readStatement() {
            StringBuilder current = new StringBuilder();
            try {
                String line;
                while ((line = reader.readLine()) != null) {
                    line = line.trim();
                    if (line.isEmpty() || line.startsWith("--")) {
                        continue;
                    }
                    if (current.length() > 0) {
                        current.append(' ');
                    }
                    current.append(line);
                    if (line.endsWith(delimiter)) {
                        String statement = stripDelimiter(current.toString());
                        if (!statement.isEmpty()) {
                            return statement;
                        }
                        current.setLength(0);
                    }
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
            String remaining = current.toString().trim();
            return remaining.isEmpty() ? null : remaining;
        }
    }

    private String stripDelimiter(String statement) {
        return statement.substring(0, statement.length() - delimiter.length()).trim();
    }
}
