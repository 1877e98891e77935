package com.gazapps.mcpevals.config;

import java.nio.file.Path;

import com.gazapps.mcpevals.report.ReportFormat;

/**
 * Run options taken from the command line. Passed to whatever needs them instead of
 * being read from the environment.
 */
public final class EvaluationOptions {

    private final Path configPath;
    private final Path outputPath;
    private final ReportFormat format;
    private final boolean verbose;
    private final int parallelism;
    private final String apiKey;
    private final String endpoint;
    private final boolean metricsEnabled;

    private EvaluationOptions(Builder builder) {
        this.configPath = builder.configPath;
        this.outputPath = builder.outputPath;
        this.format = builder.format;
        this.verbose = builder.verbose;
        this.parallelism = builder.parallelism;
        this.apiKey = builder.apiKey;
        this.endpoint = builder.endpoint;
        this.metricsEnabled = builder.metricsEnabled;
    }

    public static Builder builder(Path configPath) {
        return new Builder(configPath);
    }

    public Path getConfigPath() { return configPath; }
    public Path getOutputPath() { return outputPath; }
    public ReportFormat getFormat() { return format; }
    public boolean isVerbose() { return verbose; }
    public String getApiKey() { return apiKey; }
    public String getEndpoint() { return endpoint; }
    public boolean isMetricsEnabled() { return metricsEnabled; }

    /**
     * Requested parallelism, or {@code fallback} when none was given.
     */
    public int getParallelism(int fallback) {
        return parallelism > 0 ? parallelism : fallback;
    }

    @Override
    public String toString() {
        return String.format("EvaluationOptions{config=%s, output=%s, format=%s, verbose=%b, parallelism=%d, metrics=%b, apiKey=%s}",
                configPath, outputPath, format, verbose, parallelism, metricsEnabled, apiKey != null ? "***" : "null");
    }

    public static final class Builder {
        private final Path configPath;
        private Path outputPath;
        private ReportFormat format = ReportFormat.CLEAN;
        private boolean verbose;
        private int parallelism;
        private String apiKey;
        private String endpoint;
        private boolean metricsEnabled;

        private Builder(Path configPath) {
            this.configPath = configPath;
        }

        public Builder outputPath(Path outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder format(ReportFormat format) {
            this.format = format;
            return this;
        }

        public Builder verbose(boolean verbose) {
            this.verbose = verbose;
            return this;
        }

        public Builder parallelism(int parallelism) {
            this.parallelism = parallelism;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public EvaluationOptions build() {
            return new EvaluationOptions(this);
        }
    }
}
