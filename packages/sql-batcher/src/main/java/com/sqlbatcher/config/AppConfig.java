package com.sqlbatcher.config;

import com.sqlbatcher.adapter.AdapterType;
import com.sqlbatcher.adapter.JdbcAdapter;
import com.sqlbatcher.adapter.SQLAdapter;
import com.sqlbatcher.core.BatcherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

public class AppConfig {
    private static final Logger logger = LoggerFactory.getLogger(AppConfig.class);

    private int maxBytes;
    private String delimiter;
    private boolean dryRun;
    private boolean useAdapterLimit;
    private AdapterType adapterType;
    private String databasePath;
    private String jdbcUrl;
    private String jdbcUser;
    private String jdbcPassword;
    private int maxQuerySize;
    private boolean verbose;

    private static final String DEFAULT_CONFIG_PATH = "config/application.yaml";

    public AppConfig() {
        // Set defaults
        this.maxBytes = BatcherConfig.DEFAULT_MAX_BYTES;
        this.delimiter = BatcherConfig.DEFAULT_DELIMITER;
        this.dryRun = false;
        this.useAdapterLimit = false;
        this.adapterType = AdapterType.DUCKDB;
        this.databasePath = "database.duckdb";
        this.jdbcUser = System.getenv("DB_USER");
        this.jdbcPassword = System.getenv("DB_PASSWORD");
        this.maxQuerySize = JdbcAdapter.DEFAULT_MAX_QUERY_SIZE;
        this.verbose = false;
    }

    /**
     * Loads the configuration file, falling back to defaults for anything missing.
     * A file that cannot be read or parsed is reported and ignored as a whole.
     */
    public static AppConfig load(String configPath) {
        Path path = configPath != null ? Path.of(configPath) : Path.of(DEFAULT_CONFIG_PATH);

        if (!Files.exists(path) && configPath == null) {
            // Try to find config relative to jar location
            Path jarDir = Path.of(AppConfig.class.getProtectionDomain().getCodeSource().getLocation().getPath())
                    .getParent();
            if (jarDir != null) {
                path = jarDir.resolve(DEFAULT_CONFIG_PATH);
            }
        }

        if (Files.exists(path)) {
            try (InputStream is = Files.newInputStream(path)) {
                Yaml yaml = new Yaml();
                Map<String, Object> data = yaml.load(is);
                AppConfig config = new AppConfig();
                config.parseConfig(data);
                logger.debug("Loaded configuration from {}", path);
                return config;
            } catch (IOException | YAMLException | ClassCastException | IllegalArgumentException e) {
                logger.warn("Could not load config file {}, using defaults: {}", path, e.getMessage());
            }
        } else if (configPath != null) {
            logger.warn("Config file not found: {}", path);
        }

        return new AppConfig();
    }

    @SuppressWarnings("unchecked")
    private void parseConfig(Map<String, Object> data) {
        if (data == null) return;

        // Batcher config
        Map<String, Object> batcher = (Map<String, Object>) data.get("batcher");
        if (batcher != null) {
            if (batcher.get("max_bytes") != null) {
                this.maxBytes = ((Number) batcher.get("max_bytes")).intValue();
            }
            if (batcher.get("delimiter") != null) {
                this.delimiter = (String) batcher.get("delimiter");
            }
            if (batcher.get("dry_run") != null) {
                this.dryRun = (Boolean) batcher.get("dry_run");
            }
            if (batcher.get("use_adapter_limit") != null) {
                this.useAdapterLimit = (Boolean) batcher.get("use_adapter_limit");
            }
        }

        // Database config
        Map<String, Object> database = (Map<String, Object>) data.get("database");
        if (database != null) {
            if (database.get("adapter") != null) {
                this.adapterType = AdapterType.valueOf(((String) database.get("adapter")).toUpperCase());
            }
            if (database.get("path") != null) {
                this.databasePath = (String) database.get("path");
            }
            if (database.get("url") != null) {
                this.jdbcUrl = resolveEnv((String) database.get("url"));
            }
            if (database.get("user") != null) {
                this.jdbcUser = resolveEnv((String) database.get("user"));
            }
            if (database.get("password") != null) {
                this.jdbcPassword = resolveEnv((String) database.get("password"));
            }
            if (database.get("max_query_size") != null) {
                this.maxQuerySize = ((Number) database.get("max_query_size")).intValue();
            }
        }

        // Output config
        Map<String, Object> output = (Map<String, Object>) data.get("output");
        if (output != null) {
            if (output.get("verbose") != null) {
                this.verbose = (Boolean) output.get("verbose");
            }
        }
    }

    // Support environment variable substitution: ${NAME}
    private static String resolveEnv(String value) {
        if (value.startsWith("${") && value.endsWith("}")) {
            return System.getenv(value.substring(2, value.length() - 1));
        }
        return value;
    }

    /**
     * Builds the batcher settings from this configuration.
     *
     * @throws IllegalArgumentException if max bytes is not positive
     */
    public BatcherConfig toBatcherConfig() {
        return BatcherConfig.builder()
                .maxBytes(maxBytes)
                .delimiter(delimiter)
                .dryRun(dryRun)
                .build();
    }

    /**
     * Same as {@link #toBatcherConfig()}, but takes max bytes from the adapter when
     * {@code use_adapter_limit} is set.
     */
    public BatcherConfig toBatcherConfig(SQLAdapter adapter) {
        BatcherConfig config = toBatcherConfig();
        if (useAdapterLimit && adapter != null) {
            return config.toBuilder().maxBytes(adapter.getMaxQuerySize()).build();
        }
        return config;
    }

    // Getters
    public int getMaxBytes() { return maxBytes; }
    public String getDelimiter() { return delimiter; }
    public boolean isDryRun() { return dryRun; }
    public boolean isUseAdapterLimit() { return useAdapterLimit; }
    public AdapterType getAdapterType() { return adapterType; }
    public String getDatabasePath() { return databasePath; }
    public String getJdbcUrl() { return jdbcUrl; }
    public String getJdbcUser() { return jdbcUser; }
    public String getJdbcPassword() { return jdbcPassword; }
    public int getMaxQuerySize() { return maxQuerySize; }
    public boolean isVerbose() { return verbose; }

    // Setters for CLI overrides
    public void setMaxBytes(int maxBytes) { this.maxBytes = maxBytes; }
    public void setDelimiter(String delimiter) { this.delimiter = delimiter; }
    public void setDryRun(boolean dryRun) { this.dryRun = dryRun; }
    public void setUseAdapterLimit(boolean useAdapterLimit) { this.useAdapterLimit = useAdapterLimit; }
    public void setAdapterType(AdapterType adapterType) { this.adapterType = adapterType; }
    public void setDatabasePath(String path) { this.databasePath = path; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public void setVerbose(boolean verbose) { this.verbose = verbose; }
}
