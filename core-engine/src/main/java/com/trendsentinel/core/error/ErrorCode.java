package com.trendsentinel.core.error;

/**
 * Failure categories reported by the analysis core.
 *
 * <p>
 * Each code carries a stable identifier that is safe to surface to the
 * reporting layer, and a message template used by {@link AnalysisException}.
 * </p>
 *
 * @since 1.0.0
 */
public enum ErrorCode {

    /** Malformed input shape or cell types. */
    SCHEMA("TS-001", "Schema error: %s"),

    /** Two rows of one series share a timestamp under the strict policy. */
    DUPLICATE_TIMESTAMP("TS-002", "Duplicate timestamp: %s"),

    /** Too few points for a requested method. */
    INSUFFICIENT_DATA("TS-003", "Insufficient data: %s"),

    /** Out-of-range configuration. */
    INVALID_PARAMETER("TS-004", "Invalid parameter: %s"),

    /** One ensemble member cannot run; recovered inside the ensemble. */
    DETECTOR_UNAVAILABLE("TS-005", "Detector unavailable: %s"),

    /** Any other failure of a single invocation. */
    INTERNAL("TS-999", "Internal error: %s");

    private final String code;
    private final String messageTemplate;

    ErrorCode(String code, String messageTemplate) {
        this.code = code;
        this.messageTemplate = messageTemplate;
    }

    public String getCode() {
        return code;
    }

    /**
     * Render the message template with the given detail.
     *
     * @param detail human-readable detail
     * @return formatted message
     */
    public String format(String detail) {
        return String.format(messageTemplate, detail);
    }
}
