package com.trendsentinel.core.preparation;

import com.trendsentinel.core.error.SchemaException;
import com.trendsentinel.core.model.DataTable;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;
import java.util.regex.Pattern;

/**
 * Coerces timestamp cells into {@link Instant}s.
 *
 * <p>
 * Accepted cells: {@link Instant}, {@link OffsetDateTime},
 * {@link ZonedDateTime}, {@link Date}, {@link LocalDateTime},
 * {@link LocalDate}, and ISO-8601 strings of those forms (a space is accepted
 * in place of the {@code T} separator). Local values are interpreted at UTC.
 * All cells of one column must resolve to the same {@link TemporalKind}.
 * </p>
 *
 * @since 1.0.0
 */
final class TimestampCoercer {

    private static final Pattern SPACE_SEPARATED = Pattern.compile("^\\d{4}-\\d{2}-\\d{2} \\d{2}:.*");

    /** Temporal resolution of a cell. */
    enum TemporalKind {
        DATE,
        LOCAL_DATE_TIME,
        INSTANT
    }

    private TimestampCoercer() {
        // utility class, not instantiable
    }

    /**
     * Coerce every cell of a timestamp column.
     *
     * @param table  input table
     * @param column timestamp column name
     * @return one instant per row
     * @throws SchemaException if a cell is missing, unparseable, or of a
     *                         different temporal kind than the first row
     */
    static Instant[] coerceColumn(DataTable table, String column) {
        Instant[] result = new Instant[table.rowCount()];
        TemporalKind expected = null;
        for (int row = 0; row < result.length; row++) {
            Object cell = table.value(row, column);
            if (cell == null || (cell instanceof String s && s.isBlank())) {
                throw new SchemaException(column, "row " + row + " has no timestamp");
            }
            TemporalKind kind = kindOf(cell, column, row);
            if (expected == null) {
                expected = kind;
            } else if (kind != expected) {
                throw new SchemaException(column, "row " + row + " holds a " + kind
                        + " value but earlier rows hold " + expected + " values");
            }
            result[row] = toInstant(cell, kind);
        }
        return result;
    }

    private static TemporalKind kindOf(Object cell, String column, int row) {
        if (cell instanceof Instant || cell instanceof OffsetDateTime || cell instanceof ZonedDateTime
                || cell instanceof Date) {
            return TemporalKind.INSTANT;
        }
        if (cell instanceof LocalDateTime) {
            return TemporalKind.LOCAL_DATE_TIME;
        }
        if (cell instanceof LocalDate) {
            return TemporalKind.DATE;
        }
        if (cell instanceof String s) {
            String text = normalize(s);
            if (parses(text, TemporalKind.INSTANT)) {
                return TemporalKind.INSTANT;
            }
            if (parses(text, TemporalKind.LOCAL_DATE_TIME)) {
                return TemporalKind.LOCAL_DATE_TIME;
            }
            if (parses(text, TemporalKind.DATE)) {
                return TemporalKind.DATE;
            }
            throw new SchemaException(column, "row " + row + " value '" + s + "' is not an ISO-8601 timestamp");
        }
        throw new SchemaException(column, "row " + row + " holds a "
                + cell.getClass().getSimpleName() + ", expected a timestamp");
    }

    private static Instant toInstant(Object cell, TemporalKind kind) {
        if (cell instanceof Instant i) {
            return i;
        }
        if (cell instanceof OffsetDateTime o) {
            return o.toInstant();
        }
        if (cell instanceof ZonedDateTime z) {
            return z.toInstant();
        }
        if (cell instanceof Date d) {
            return Instant.ofEpochMilli(d.getTime());
        }
        if (cell instanceof LocalDateTime l) {
            return l.toInstant(ZoneOffset.UTC);
        }
        if (cell instanceof LocalDate d) {
            return d.atStartOfDay(ZoneOffset.UTC).toInstant();
        }
        String text = normalize((String) cell);
        return switch (kind) {
            case INSTANT -> parseInstant(text);
            case LOCAL_DATE_TIME -> LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
            case DATE -> LocalDate.parse(text).atStartOfDay(ZoneOffset.UTC).toInstant();
        };
    }

    private static boolean parses(String text, TemporalKind kind) {
        try {
            switch (kind) {
                case INSTANT -> parseInstant(text);
                case LOCAL_DATE_TIME -> LocalDateTime.parse(text);
                case DATE -> LocalDate.parse(text);
            }
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static Instant parseInstant(String text) {
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return ZonedDateTime.parse(text).toInstant();
        }
    }

    private static String normalize(String text) {
        String trimmed = text.trim();
        return SPACE_SEPARATED.matcher(trimmed).matches() ? trimmed.replaceFirst(" ", "T") : trimmed;
    }
}
