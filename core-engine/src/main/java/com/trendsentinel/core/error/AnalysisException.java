package com.trendsentinel.core.error;

import java.util.Objects;

/**
 * Base class of every failure raised by the analysis core.
 *
 * <p>
 * All subclasses are unchecked. Callers that cannot recover from an exception
 * (for example a rendering context) should go through
 * {@code TimeSeriesAnalyzer#analyzeSafely}, which converts them into a
 * structured outcome instead.
 * </p>
 *
 * @since 1.0.0
 */
public abstract class AnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final String detail;

    protected AnalysisException(ErrorCode errorCode, String detail) {
        super(Objects.requireNonNull(errorCode, "errorCode must not be null").format(detail));
        this.errorCode = errorCode;
        this.detail = detail;
    }

    protected AnalysisException(ErrorCode errorCode, String detail, Throwable cause) {
        super(Objects.requireNonNull(errorCode, "errorCode must not be null").format(detail), cause);
        this.errorCode = errorCode;
        this.detail = detail;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    /**
     * @return the detail without the category prefix
     */
    public String getDetail() {
        return detail;
    }
}
