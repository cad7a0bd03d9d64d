package com.ttennebkram.stylize.batch;

import com.ttennebkram.stylize.config.Configuration;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Settings for one batch run. Build through {@link #builder()}.
 */
public final class BatchOptions {

    public static final Duration DEFAULT_POLL_INTERVAL = Duration.ofMillis(100);

    private final Path inputDir;
    private final Path outputDir;
    private final Configuration configuration;
    private final Path configPath;
    private final String effectName;
    private final String presetName;
    private final int parallelism;
    private final int variations;
    private final Long baseSeed;
    private final boolean subprocess;
    private final Duration jobTimeout;
    private final Duration pollInterval;

    private BatchOptions(Builder b) {
        this.inputDir = b.inputDir;
        this.outputDir = b.outputDir;
        this.configuration = b.configuration;
        this.configPath = b.configPath;
        this.effectName = b.effectName;
        this.presetName = b.presetName;
        this.parallelism = b.parallelism;
        this.variations = b.variations;
        this.baseSeed = b.baseSeed;
        this.subprocess = b.subprocess;
        this.jobTimeout = b.jobTimeout;
        this.pollInterval = b.pollInterval;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Path getInputDir() { return inputDir; }
    public Path getOutputDir() { return outputDir; }
    public Configuration getConfiguration() { return configuration; }

    /**
     * Configuration document handed to child processes, or null.
     */
    public Path getConfigPath() { return configPath; }
    public String getEffectName() { return effectName; }
    public String getPresetName() { return presetName; }
    public int getParallelism() { return parallelism; }
    public int getVariations() { return variations; }
    public Long getBaseSeed() { return baseSeed; }
    public boolean isSubprocess() { return subprocess; }

    /**
     * Per-job wall-clock limit, or null for none.
     */
    public Duration getJobTimeout() { return jobTimeout; }
    public Duration getPollInterval() { return pollInterval; }

    public static final class Builder {
        private Path inputDir;
        private Path outputDir;
        private Configuration configuration = Configuration.defaults();
        private Path configPath;
        private String effectName;
        private String presetName;
        private int parallelism = Runtime.getRuntime().availableProcessors();
        private int variations = 1;
        private Long baseSeed;
        private boolean subprocess;
        private Duration jobTimeout;
        private Duration pollInterval = DEFAULT_POLL_INTERVAL;

        private Builder() {
        }

        public Builder inputDir(Path dir) { this.inputDir = dir; return this; }
        public Builder outputDir(Path dir) { this.outputDir = dir; return this; }
        public Builder configuration(Configuration config) { this.configuration = config; return this; }
        public Builder configPath(Path path) { this.configPath = path; return this; }
        public Builder effectName(String name) { this.effectName = name; return this; }
        public Builder presetName(String name) { this.presetName = name; return this; }
        public Builder parallelism(int n) { this.parallelism = n; return this; }
        public Builder variations(int n) { this.variations = n; return this; }
        public Builder baseSeed(Long seed) { this.baseSeed = seed; return this; }
        public Builder subprocess(boolean enabled) { this.subprocess = enabled; return this; }
        public Builder jobTimeout(Duration timeout) { this.jobTimeout = timeout; return this; }
        public Builder pollInterval(Duration interval) { this.pollInterval = interval; return this; }

        public BatchOptions build() {
            Objects.requireNonNull(inputDir, "inputDir");
            Objects.requireNonNull(outputDir, "outputDir");
            Objects.requireNonNull(configuration, "configuration");
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be at least 1, got " + parallelism);
            }
            if (variations < 1) {
                throw new IllegalArgumentException("variations must be at least 1, got " + variations);
            }
            if (jobTimeout != null && (jobTimeout.isNegative() || jobTimeout.isZero())) {
                throw new IllegalArgumentException("jobTimeout must be positive");
            }
            if (pollInterval == null || pollInterval.isNegative() || pollInterval.isZero()) {
                throw new IllegalArgumentException("pollInterval must be positive");
            }
            return new BatchOptions(this);
        }
    }
}
