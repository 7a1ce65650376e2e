package com.trendsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.trendsentinel.core.analysis.AnalysisOutcome;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.TableSchema;
import com.trendsentinel.core.report.ReportTableWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.util.List;
import java.util.Objects;

/**
 * Writes analysis outcomes as JSON lines, one document per series.
 *
 * <p>
 * A successful series carries its report summary and the annotated rows
 * from {@link ReportTableWriter}, with the input's non-metric columns
 * passed through; a failed series carries its error code and message.
 * Timestamps are ISO-8601 strings and non-finite numbers are written as the
 * strings {@code "NaN"} and {@code "Infinity"}.
 * </p>
 *
 * <pre>
 * {"series":{...},"status":"ok","report":{...},"rows":[...]}
 * {"series":{...},"status":"failed","error":{"code":"TS-003","type":"INSUFFICIENT_DATA","message":"..."}}
 * </pre>
 *
 * @since 1.0.0
 */
public class ReportJsonWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportJsonWriter.class);

    static final String STATUS_OK = "ok";
    static final String STATUS_FAILED = "failed";

    private final ObjectMapper mapper;
    private final ReportTableWriter tableWriter = new ReportTableWriter();
    private final TableSchema inputSchema;
    private final String timestampColumn;

    /**
     * @param inputSchema     schema of the analyzed table, for pass-through columns
     * @param timestampColumn name of the timestamp column in the rows
     */
    public ReportJsonWriter(TableSchema inputSchema, String timestampColumn) {
        this.inputSchema = Objects.requireNonNull(inputSchema, "inputSchema must not be null");
        this.timestampColumn = Objects.requireNonNull(timestampColumn, "timestampColumn must not be null");
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS, false);
    }

    /**
     * @param outcome one series outcome
     * @return single-line JSON document
     * @throws UncheckedIOException if the document cannot be serialized
     */
    public String toJson(AnalysisOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome must not be null");
        try {
            return mapper.writeValueAsString(toDocument(outcome));
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize outcome for [{}]: {}", outcome.getSeriesKey(), e.getMessage(), e);
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Write one line per outcome. The writer is flushed, not closed.
     *
     * @throws IOException if writing fails
     */
    public void write(List<AnalysisOutcome> outcomes, Writer out) throws IOException {
        for (AnalysisOutcome outcome : outcomes) {
            out.write(toJson(outcome));
            out.write('\n');
        }
        out.flush();
    }

    ObjectMapper getMapper() {
        return mapper;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private ObjectNode toDocument(AnalysisOutcome outcome) {
        ObjectNode doc = mapper.createObjectNode();
        doc.set("series", mapper.valueToTree(outcome.getSeriesKey()));
        if (outcome.isSuccess()) {
            AnalysisReport report = outcome.getReport();
            doc.put("status", STATUS_OK);
            doc.set("report", mapper.valueToTree(report));
            doc.set("rows", mapper.valueToTree(
                    tableWriter.toTable(report, inputSchema, timestampColumn).toMaps()));
        } else {
            doc.put("status", STATUS_FAILED);
            ObjectNode error = doc.putObject("error");
            error.put("code", outcome.getErrorCode().getCode());
            error.put("type", outcome.getErrorCode().name());
            error.put("message", outcome.getMessage());
        }
        return doc;
    }
}
