package com.trendsentinel.job;

import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.analysis.TimeSeriesAnalyzer;
import com.trendsentinel.core.config.AnalysisConfig;
import com.trendsentinel.core.config.AnalysisConfigLoader;
import com.trendsentinel.core.config.TableLayout;
import com.trendsentinel.core.error.SchemaException;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.preparation.RawSeries;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Main entry point for the Trend Sentinel batch job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   CSV file (INPUT_PATH)
 *     → DataTable (all columns as text)
 *     → split into one series per metric and dimension combination
 *     → SeriesFanOut (one analysis per series on a worker pool)
 *     → JSON lines (OUTPUT_PATH), one document per series
 * </pre>
 *
 * <h3>Exit status</h3>
 * <p>
 * The job exits with {@value #EXIT_INPUT_ERROR} when the input cannot be read
 * or does not match the configured layout. Failures of individual series are
 * reported in the output and do not change the exit status.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendSentinelJob {

    private static final Logger LOG = LoggerFactory.getLogger(TrendSentinelJob.class);

    static final int EXIT_OK = 0;
    static final int EXIT_INPUT_ERROR = 2;

    private TrendSentinelJob() {
        // entry-point class, not instantiable
    }

    public static void main(String[] args) throws IOException {
        int status = run(JobConfig.fromEnvironment());
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /**
     * Run the whole pipeline once.
     *
     * @param config job configuration
     * @return process exit status
     * @throws IOException if the report cannot be written
     */
    static int run(JobConfig config) throws IOException {
        // 1. Configuration
        LOG.info("Starting Trend Sentinel with config: {}", config);
        AnalysisConfig analysisConfig = loadAnalysisConfig(config);
        TableLayout layout = config.toLayout();
        LOG.info("Analysis configuration: {}", analysisConfig);

        // 2. Read the input table
        DataTable table;
        try {
            table = new CsvTableReader().read(Path.of(config.getInputPath()));
        } catch (IOException e) {
            LOG.error("Cannot read input {}: {}", config.getInputPath(), e.getMessage(), e);
            return EXIT_INPUT_ERROR;
        } catch (SchemaException e) {
            LOG.error("Malformed input {}: {}", config.getInputPath(), e.getMessage());
            return EXIT_INPUT_ERROR;
        }

        // 3. Split into series
        TimeSeriesAnalyzer analyzer = new TimeSeriesAnalyzer(analysisConfig);
        List<RawSeries> series;
        try {
            series = analyzer.split(table, layout);
        } catch (SchemaException e) {
            LOG.error("Input does not match layout {}: {}", layout, e.getMessage());
            return EXIT_INPUT_ERROR;
        }
        LOG.info("Split input into {} series", series.size());

        // 4. Analyze
        JobMetrics metrics = new JobMetrics();
        List<AnalysisOutcome> outcomes;
        try (SeriesFanOut fanOut = new SeriesFanOut(analyzer, config.getParallelism(), metrics)) {
            outcomes = fanOut.analyzeAll(series);
        }

        // 5. Write the report
        Path output = Path.of(config.getOutputPath());
        ReportJsonWriter writer = new ReportJsonWriter(table.getSchema(), layout.getTimestampColumn());
        try (Writer out = Files.newBufferedWriter(output, StandardCharsets.UTF_8)) {
            writer.write(outcomes, out);
        }
        LOG.info("Wrote {} series report(s) to {}", outcomes.size(), output);
        metrics.logSummary();
        return EXIT_OK;
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static AnalysisConfig loadAnalysisConfig(JobConfig config) {
        String path = config.getAnalysisConfigPath();
        if (path != null && !path.isBlank()) {
            return AnalysisConfigLoader.fromFile(path);
        }
        return AnalysisConfigLoader.load();
    }
}
