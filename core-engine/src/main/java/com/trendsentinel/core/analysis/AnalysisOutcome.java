package com.trendsentinel.core.analysis;

import com.trendsentinel.core.error.AnalysisException;
import com.trendsentinel.core.error.ErrorCode;
import com.trendsentinel.core.model.AnalysisReport;
import com.trendsentinel.core.model.SeriesKey;

import java.util.Objects;

/**
 * Result of one analysis that never throws: either a report or a structured
 * failure.
 *
 * <p>
 * Failures carry the {@link ErrorCode} of the exception that ended the
 * analysis, its message, and the series key when it was known.
 * </p>
 *
 * @since 1.0.0
 */
public final class AnalysisOutcome {

    private final SeriesKey seriesKey;
    private final AnalysisReport report;
    private final ErrorCode errorCode;
    private final String message;

    private AnalysisOutcome(SeriesKey seriesKey, AnalysisReport report, ErrorCode errorCode, String message) {
        this.seriesKey = seriesKey;
        this.report = report;
        this.errorCode = errorCode;
        this.message = message;
    }

    public static AnalysisOutcome success(AnalysisReport report) {
        Objects.requireNonNull(report, "report must not be null");
        return new AnalysisOutcome(report.getSeriesKey(), report, null, null);
    }

    /**
     * @param seriesKey affected series, or {@code null} when the failure
     *                  happened before series were identified
     * @param error     the analysis failure
     */
    public static AnalysisOutcome failure(SeriesKey seriesKey, AnalysisException error) {
        Objects.requireNonNull(error, "error must not be null");
        return new AnalysisOutcome(seriesKey, null, error.getErrorCode(), error.getMessage());
    }

    /**
     * Failure for an unexpected exception, reported as {@link ErrorCode#INTERNAL}.
     */
    public static AnalysisOutcome internalFailure(SeriesKey seriesKey, RuntimeException error) {
        Objects.requireNonNull(error, "error must not be null");
        return new AnalysisOutcome(seriesKey, null, ErrorCode.INTERNAL,
                ErrorCode.INTERNAL.format(error.getClass().getSimpleName() + ": " + error.getMessage()));
    }

    public boolean isSuccess() {
        return report != null;
    }

    /**
     * @return series key, {@code null} for a failure before splitting
     */
    public SeriesKey getSeriesKey() {
        return seriesKey;
    }

    /**
     * @return the report, {@code null} on failure
     */
    public AnalysisReport getReport() {
        return report;
    }

    /**
     * @return error code, {@code null} on success
     */
    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return failure message, {@code null} on success
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "AnalysisOutcome{success " + seriesKey + '}'
                : "AnalysisOutcome{" + errorCode + " " + seriesKey + ": " + message + '}';
    }
}
