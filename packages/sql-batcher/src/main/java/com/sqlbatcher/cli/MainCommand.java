package com.sqlbatcher.cli;

import ch.qos.logback.classic.Level;
import com.sqlbatcher.config.AppConfig;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "sqlbatcher",
        description = "Batch SQL statements by size for efficient execution",
        mixinStandardHelpOptions = true,
        version = "SQLBatcher 1.0.0",
        subcommands = {
                ProcessCommand.class,
                AdaptersCommand.class,
                CommandLine.HelpCommand.class
        }
)
public class MainCommand implements Runnable {

    @Option(names = {"-c", "--config"}, description = "Configuration file path")
    String configPath;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output")
    boolean verbose;

    @Override
    public void run() {
        // If no subcommand specified, show help
        CommandLine.usage(this, System.out);
    }

    /**
     * Loads the configuration and applies the global CLI overrides.
     */
    AppConfig loadConfig() {
        AppConfig config = AppConfig.load(configPath);
        if (verbose) {
            config.setVerbose(true);
        }
        if (config.isVerbose()) {
            ch.qos.logback.classic.Logger logger =
                    (ch.qos.logback.classic.Logger) LoggerFactory.getLogger("com.sqlbatcher");
            logger.setLevel(Level.DEBUG);
        }
        return config;
    }

    public String getConfigPath() { return configPath; }
    public boolean isVerbose() { return verbose; }
}
