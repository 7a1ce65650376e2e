package com.trendsentinel.job;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.trendsentinel.core.error.SchemaException;
import com.trendsentinel.core.model.Column;
import com.trendsentinel.core.model.ColumnType;
import com.trendsentinel.core.model.DataTable;
import com.trendsentinel.core.model.TableSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Reads a headed CSV file into a {@link DataTable}.
 *
 * <p>
 * Every column is declared {@link ColumnType#STRING}; timestamps and numbers
 * are coerced later, when the table is split into series. Blank cells become
 * {@code null} (a missing observation). Rows shorter than the header are
 * padded with {@code null}; rows longer than the header are rejected.
 * </p>
 *
 * @since 1.0.0
 */
public final class CsvTableReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvTableReader.class);
    private static final String HEADER = "(header)";

    private final ObjectReader rowReader;

    public CsvTableReader() {
        CsvMapper mapper = new CsvMapper();
        this.rowReader = mapper.readerForListOf(String.class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES);
    }

    /**
     * @param path UTF-8 CSV file
     * @return table with one STRING column per header cell
     * @throws IOException     if the file cannot be read or is not valid CSV
     * @throws SchemaException if the header is missing, blank or repeated, or
     *                         a row has more cells than the header
     */
    public DataTable read(Path path) throws IOException {
        Objects.requireNonNull(path, "path must not be null");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            DataTable table = read(reader);
            LOG.info("Read {} rows from {}", table.rowCount(), path);
            return table;
        }
    }

    /**
     * @param reader CSV text
     * @return table with one STRING column per header cell
     * @throws IOException     if the text is not valid CSV
     * @throws SchemaException if the header is missing, blank or repeated, or
     *                         a row has more cells than the header
     */
    public DataTable read(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        MappingIterator<List<String>> rows = rowReader.readValues(reader);
        if (!rows.hasNextValue()) {
            throw new SchemaException(HEADER, "input has no header row");
        }
        TableSchema schema = toSchema(rows.nextValue());

        DataTable.Builder builder = DataTable.builder(schema);
        int line = 1;
        while (rows.hasNextValue()) {
            List<String> cells = rows.nextValue();
            line++;
            if (cells.size() > schema.size()) {
                throw new SchemaException(HEADER, "row " + line + " has " + cells.size()
                        + " cells but the header has " + schema.size());
            }
            Object[] row = new Object[schema.size()];
            for (int i = 0; i < cells.size(); i++) {
                String cell = cells.get(i);
                row[i] = (cell == null || cell.isBlank()) ? null : cell;
            }
            builder.addRow(row);
        }
        DataTable table = builder.build();
        LOG.debug("Parsed CSV with columns {}", schema.names());
        return table;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static TableSchema toSchema(List<String> header) {
        List<Column> columns = new ArrayList<>(header.size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i);
            if (name == null || name.isBlank()) {
                throw new SchemaException(HEADER, "header cell " + (i + 1) + " is blank");
            }
            if (!seen.add(name)) {
                throw new SchemaException(name, "appears more than once in the header");
            }
            columns.add(Column.of(name, ColumnType.STRING));
        }
        return TableSchema.of(columns);
    }
}
