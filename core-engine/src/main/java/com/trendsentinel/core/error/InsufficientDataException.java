package com.trendsentinel.core.error;

/**
 * Raised when a series is shorter than the minimum a requested method needs.
 */
public class InsufficientDataException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int available;

    public InsufficientDataException(String method, int required, int available) {
        super(ErrorCode.INSUFFICIENT_DATA,
                method + " requires at least " + required + " observed points, got " + available);
        this.required = required;
        this.available = available;
    }

    public InsufficientDataException(String detail) {
        super(ErrorCode.INSUFFICIENT_DATA, detail);
        this.required = -1;
        this.available = -1;
    }

    /**
     * @return minimum number of points, or {@code -1} when not applicable
     */
    public int getRequired() {
        return required;
    }

    /**
     * @return number of points available, or {@code -1} when not applicable
     */
    public int getAvailable() {
        return available;
    }
}
