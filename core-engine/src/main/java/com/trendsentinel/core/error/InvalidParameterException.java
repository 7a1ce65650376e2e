package com.trendsentinel.core.error;

/**
 * Raised for out-of-range or missing configuration values.
 */
public class InvalidParameterException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String detail) {
        super(ErrorCode.INVALID_PARAMETER, detail);
    }

    public InvalidParameterException(String detail, Throwable cause) {
        super(ErrorCode.INVALID_PARAMETER, detail, cause);
    }
}
