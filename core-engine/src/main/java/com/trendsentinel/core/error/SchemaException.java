package com.trendsentinel.core.error;

/**
 * Raised when the input table does not match the declared layout: a missing
 * column, a column of the wrong type, or a cell that cannot be coerced.
 */
public class SchemaException extends AnalysisException {

    private static final long serialVersionUID = 1L;

    private final String column;

    public SchemaException(String column, String detail) {
        super(ErrorCode.SCHEMA, "column '" + column + "': " + detail);
        this.column = column;
    }

    /**
     * @return name of the offending column
     */
    public String getColumn() {
        return column;
    }
}
