package com.sqlbatcher.cli;

import com.sqlbatcher.adapter.AdapterType;
import com.sqlbatcher.adapter.JdbcAdapter;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
        name = "adapters",
        description = "List available database adapters"
)
public class AdaptersCommand implements Callable<Integer> {

    @Option(names = {"--verbose"}, description = "Show adapter details")
    private boolean verbose;

    @Override
    public Integer call() {
        System.out.println("Available adapters:");
        for (AdapterType type : AdapterType.values()) {
            if (verbose) {
                System.out.printf("  %-8s %s%n", type.getName(), type.getDescription());
            } else {
                System.out.println("  " + type.getName());
            }
        }
        if (verbose) {
            System.out.printf("%nDefault max query size: %,d bytes%n", JdbcAdapter.DEFAULT_MAX_QUERY_SIZE);
        }
        return 0;
    }
}
