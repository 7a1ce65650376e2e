package com.trendsentinel.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.analysis.TimeSeriesAnalyzer;
import com.trendsentinel.core.config.TableLayout;
import com.trendsentinel.core.error.InsufficientDataException;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.SeriesKey;
import com.trendsentinel.core.report.ReportTableWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.StringWriter;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ReportJsonWriter}.
 */
class ReportJsonWriterTest {

    private ReportJsonWriter writer;
    private List<AnalysisOutcome> outcomes;

    @BeforeEach
    void setUp() {
        DataTable table = JobFixtures.stores();
        writer = new ReportJsonWriter(table.getSchema(), "Date");
        outcomes = new TimeSeriesAnalyzer(JobFixtures.config()).analyzeTable(table, JobFixtures.LAYOUT);
    }

    @Test
    @DisplayName("Should write the series key, summary and annotated rows of a successful series")
    void writesSuccess() throws Exception {
        AnalysisOutcome north = outcomes.get(0);
        AnalysisReport report = north.getReport();

        JsonNode doc = parse(writer.toJson(north));

        assertThat(doc.get("status").asText()).isEqualTo(ReportJsonWriter.STATUS_OK);
        assertThat(doc.path("series").path("metric").asText()).isEqualTo("TotalSales");
        assertThat(doc.path("series").path("dimensions").path("Store").asText()).isEqualTo("north");
        assertThat(doc.has("error")).isFalse();

        JsonNode summary = doc.get("report");
        assertThat(summary.get("frequency").asText()).isEqualTo("PT24H");
        assertThat(summary.get("detectors").size()).isEqualTo(report.getDetectors().size());
        assertThat(summary.path("trend").path("direction").isMissingNode()).isFalse();
        assertThat(summary.path("anomalySummary").path("consensusAnomalies").asInt())
                .isEqualTo(report.getAnomalySummary().getConsensusAnomalies());
        assertThat(summary.has("rows")).isFalse();
        assertThat(summary.has("forecast")).isFalse();

        JsonNode rows = doc.get("rows");
        assertThat(rows.size()).isEqualTo(report.getRows().size());
        assertThat(rows.get(0).get("Date").asText()).isEqualTo("2024-01-01T00:00:00Z");
        assertThat(rows.get(0).get("Store").asText()).isEqualTo("north");
        assertThat(rows.get(0).get(ReportTableWriter.ROW_KIND).asText()).isEqualTo("OBSERVED");
        assertThat(rows.get(rows.size() - 1).get(ReportTableWriter.ROW_KIND).asText()).isEqualTo("FORECAST");
        assertThat(rows.get(rows.size() - 1).get(ReportTableWriter.FORECAST_POINT).isNumber()).isTrue();
    }

    @Test
    @DisplayName("Should write the error code and message of a failed series")
    void writesFailure() throws Exception {
        AnalysisOutcome failure = AnalysisOutcome.failure(
                new SeriesKey("TotalSales", Map.of("Store", "east")),
                new InsufficientDataException("double exponential smoothing", 3, 2));

        JsonNode doc = parse(writer.toJson(failure));

        assertThat(doc.get("status").asText()).isEqualTo(ReportJsonWriter.STATUS_FAILED);
        assertThat(doc.path("error").path("code").asText()).isEqualTo("TS-003");
        assertThat(doc.path("error").path("type").asText()).isEqualTo("INSUFFICIENT_DATA");
        assertThat(doc.path("error").path("message").asText()).isEqualTo(failure.getMessage());
        assertThat(doc.has("report")).isFalse();
        assertThat(doc.has("rows")).isFalse();
    }

    @Test
    @DisplayName("Should write a null series for a failure before splitting")
    void writesTableLevelFailure() throws Exception {
        DataTable table = JobFixtures.stores();
        AnalysisOutcome failure = new TimeSeriesAnalyzer(JobFixtures.config())
                .analyzeTable(table, TableLayout.of("Date", "Revenue")).get(0);

        JsonNode doc = parse(writer.toJson(failure));

        assertThat(doc.get("series").isNull()).isTrue();
        assertThat(doc.path("error").path("code").asText()).isEqualTo("TS-001");
    }

    @Test
    @DisplayName("Should write one line per outcome")
    void writesLines() throws Exception {
        StringWriter out = new StringWriter();

        writer.write(outcomes, out);

        String[] lines = out.toString().split("\n");
        assertThat(lines).hasSize(3);
        assertThat(parse(lines[1]).path("series").path("dimensions").path("Store").asText()).isEqualTo("south");
        assertThat(parse(lines[2]).get("status").asText()).isEqualTo(ReportJsonWriter.STATUS_FAILED);
    }

    // ---------------------------------------------------------------
    // Helper
    // ---------------------------------------------------------------

    private JsonNode parse(String json) throws Exception {
        assertThat(json).doesNotContain("\n");
        return writer.getMapper().readTree(json);
    }
}
