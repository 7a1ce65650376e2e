package com.trendsentinel.job;

import com.trendsentinel.core.config.TableLayout;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Trend Sentinel batch job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the job can be driven from a container, a scheduler or a shell.
 * Analysis parameters live in a separate YAML file named by
 * {@code ANALYSIS_CONFIG_PATH}; this object only carries the job plumbing.
 * </p>
 *
 * <h3>Environment</h3>
 * <ul>
 *   <li>{@code INPUT_PATH} (required): CSV file with a header row</li>
 *   <li>{@code OUTPUT_PATH}: JSON-lines report file, default {@value #DEFAULT_OUTPUT_PATH}</li>
 *   <li>{@code ANALYSIS_CONFIG_PATH}: analysis YAML, default the bundled {@code analysis.yml}</li>
 *   <li>{@code TIMESTAMP_COLUMN}: default {@value #DEFAULT_TIMESTAMP_COLUMN}</li>
 *   <li>{@code METRIC_COLUMNS} (required): comma-separated metric column names</li>
 *   <li>{@code DIMENSION_COLUMNS}: comma-separated dimension column names</li>
 *   <li>{@code PARALLELISM}: worker threads, default the number of available processors</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class JobConfig {

    public static final String DEFAULT_OUTPUT_PATH = "trend-report.jsonl";
    public static final String DEFAULT_TIMESTAMP_COLUMN = "Date";

    // ---------------------------------------------------------------
    // Files
    // ---------------------------------------------------------------
    private final String inputPath;
    private final String outputPath;
    private final String analysisConfigPath;

    // ---------------------------------------------------------------
    // Table layout
    // ---------------------------------------------------------------
    private final String timestampColumn;
    private final List<String> metricColumns;
    private final List<String> dimensionColumns;

    // ---------------------------------------------------------------
    // Execution
    // ---------------------------------------------------------------
    private final int parallelism;

    private JobConfig(Builder b) {
        this.inputPath = b.inputPath;
        this.outputPath = b.outputPath;
        this.analysisConfigPath = b.analysisConfigPath;
        this.timestampColumn = b.timestampColumn;
        this.metricColumns = List.copyOf(b.metricColumns);
        this.dimensionColumns = List.copyOf(b.dimensionColumns);
        this.parallelism = b.parallelism;
    }

    // ---------------------------------------------------------------
    // Factory: resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from the process environment.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is missing or out of range
     */
    public static JobConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link JobConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     * @throws IllegalStateException    if a value cannot be parsed
     * @throws IllegalArgumentException if a validated field is missing or out of range
     */
    public static JobConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .inputPath(env(env, "INPUT_PATH", null))
                    .outputPath(env(env, "OUTPUT_PATH", DEFAULT_OUTPUT_PATH))
                    .analysisConfigPath(env(env, "ANALYSIS_CONFIG_PATH", ""))
                    .timestampColumn(env(env, "TIMESTAMP_COLUMN", DEFAULT_TIMESTAMP_COLUMN))
                    .metricColumns(splitList(env(env, "METRIC_COLUMNS", "")))
                    .dimensionColumns(splitList(env(env, "DIMENSION_COLUMNS", "")))
                    .parallelism(parseIntEnv(env, "PARALLELISM",
                            String.valueOf(Runtime.getRuntime().availableProcessors())))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * @return the column roles this job analyzes
     * @throws IllegalArgumentException if a column is given more than one role
     */
    public TableLayout toLayout() {
        return new TableLayout(timestampColumn, metricColumns, dimensionColumns);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getInputPath() {
        return inputPath;
    }

    public String getOutputPath() {
        return outputPath;
    }

    public String getAnalysisConfigPath() {
        return analysisConfigPath;
    }

    public String getTimestampColumn() {
        return timestampColumn;
    }

    public List<String> getMetricColumns() {
        return metricColumns;
    }

    public List<String> getDimensionColumns() {
        return dimensionColumns;
    }

    public int getParallelism() {
        return parallelism;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that the input path, the
     * timestamp column and at least one metric column are present and that
     * parallelism is positive.
     * </p>
     */
    public static class Builder {
        private String inputPath;
        private String outputPath = DEFAULT_OUTPUT_PATH;
        private String analysisConfigPath = "";
        private String timestampColumn = DEFAULT_TIMESTAMP_COLUMN;
        private List<String> metricColumns = new ArrayList<>();
        private List<String> dimensionColumns = new ArrayList<>();
        private int parallelism = 1;

        public Builder inputPath(String v) {
            this.inputPath = v;
            return this;
        }

        public Builder outputPath(String v) {
            this.outputPath = v;
            return this;
        }

        public Builder analysisConfigPath(String v) {
            this.analysisConfigPath = v;
            return this;
        }

        public Builder timestampColumn(String v) {
            this.timestampColumn = v;
            return this;
        }

        public Builder metricColumns(List<String> v) {
            this.metricColumns = new ArrayList<>(Objects.requireNonNull(v, "metricColumns must not be null"));
            return this;
        }

        public Builder metricColumns(String... v) {
            return metricColumns(Arrays.asList(v));
        }

        public Builder dimensionColumns(List<String> v) {
            this.dimensionColumns = new ArrayList<>(Objects.requireNonNull(v, "dimensionColumns must not be null"));
            return this;
        }

        public Builder dimensionColumns(String... v) {
            return dimensionColumns(Arrays.asList(v));
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            requireNonBlank(inputPath, "inputPath");
            requireNonBlank(outputPath, "outputPath");
            requireNonBlank(timestampColumn, "timestampColumn");
            Objects.requireNonNull(analysisConfigPath, "analysisConfigPath required");

            if (metricColumns.isEmpty()) {
                throw new IllegalArgumentException("metricColumns must name at least one column");
            }
            metricColumns.forEach(name -> requireNonBlank(name, "metric column"));
            dimensionColumns.forEach(name -> requireNonBlank(name, "dimension column"));
            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value.trim() : defaultValue;
    }

    private static int parseIntEnv(Map<String, String> env, String name, String defaultValue) {
        return Integer.parseInt(env(env, name, defaultValue));
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String part : value.split(",")) {
            if (!part.isBlank()) {
                items.add(part.trim());
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "inputPath='" + inputPath + '\'' +
                ", outputPath='" + outputPath + '\'' +
                ", analysisConfigPath='" + analysisConfigPath + '\'' +
                ", timestampColumn='" + timestampColumn + '\'' +
                ", metricColumns=" + metricColumns +
                ", dimensionColumns=" + dimensionColumns +
                ", parallelism=" + parallelism +
                '}';
    }
}
