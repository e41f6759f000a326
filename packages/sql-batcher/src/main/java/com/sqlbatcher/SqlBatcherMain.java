package com.sqlbatcher;

import com.sqlbatcher.cli.MainCommand;
import picocli.CommandLine;

/**
 * SQLBatcher - groups SQL statements into size-bounded batches and runs them
 * through a database adapter, or collects them in dry-run mode.
 */
public class SqlBatcherMain {

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand())
                .setCaseInsensitiveEnumValuesAllowed(true)
                .execute(args);
        System.exit(exitCode);
    }
}
