package com.sqlbatcher.core;

/**
 * Immutable settings for a {@link SQLBatcher}.
 */
public final class BatcherConfig {

    public static final int DEFAULT_MAX_BYTES = 1_000_000;
    public static final String DEFAULT_DELIMITER = ";";

    private final int maxBytes;
    private final String delimiter;
    private final boolean dryRun;
    private final SizeFunction sizeFunction;
    private final BatchEventListener listener;

    private BatcherConfig(Builder builder) {
        this.maxBytes = builder.maxBytes;
        this.delimiter = builder.delimiter;
        this.dryRun = builder.dryRun;
        this.sizeFunction = builder.sizeFunction;
        this.listener = builder.listener;
    }

    public static BatcherConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .maxBytes(maxBytes)
                .delimiter(delimiter)
                .dryRun(dryRun)
                .sizeFunction(sizeFunction)
                .listener(listener);
    }

    public int getMaxBytes() { return maxBytes; }
    public String getDelimiter() { return delimiter; }
    public boolean isDryRun() { return dryRun; }
    public SizeFunction getSizeFunction() { return sizeFunction; }
    public BatchEventListener getListener() { return listener; }

    @Override
    public String toString() {
        return "BatcherConfig{maxBytes=" + maxBytes
                + ", delimiter='" + delimiter + "'"
                + ", dryRun=" + dryRun + "}";
    }

    public static final class Builder {
        private int maxBytes = DEFAULT_MAX_BYTES;
        private String delimiter = DEFAULT_DELIMITER;
        private boolean dryRun;
        private SizeFunction sizeFunction = SizeFunction.utf8();
        private BatchEventListener listener = new LoggingBatchEventListener();

        private Builder() {
        }

        public Builder maxBytes(int maxBytes) {
            this.maxBytes = maxBytes;
            return this;
        }

        public Builder delimiter(String delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder sizeFunction(SizeFunction sizeFunction) {
            this.sizeFunction = sizeFunction;
            return this;
        }

        /**
         * Sets the diagnostic sink; {@code null} disables diagnostics.
         */
        public Builder listener(BatchEventListener listener) {
            this.listener = listener != null ? listener : BatchEventListener.NONE;
            return this;
        }

        /**
         * @throws IllegalArgumentException if max bytes is not positive or a required value is null
         */
        public BatcherConfig build() {
            if (maxBytes <= 0) {
                throw new IllegalArgumentException("max_bytes must be positive, got " + maxBytes);
            }
            if (delimiter == null) {
                throw new IllegalArgumentException("delimiter must not be null");
            }
            if (sizeFunction == null) {
                throw new IllegalArgumentException("size function must not be null");
            }
            return new BatcherConfig(this);
        }
    }
}
