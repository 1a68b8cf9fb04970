package com.siccatalog.core.source;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.siccatalog.core.model.ActivityRow;
import com.siccatalog.core.model.DescriptionRow;
import com.siccatalog.core.model.LeafText;
import com.siccatalog.core.model.RephraseRow;
import com.siccatalog.core.model.StructureRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads the tabular sources of the catalog from CSV files with a header row.
 *
 * <p>Columns are matched by header name; extra columns are ignored.
 * <ul>
 *   <li>structure: {@code description, section, most_disaggregated_level, level_headings}</li>
 *   <li>activity index: {@code uk_sic_2007, activity}</li>
 *   <li>description lookup: {@code label, description}</li>
 *   <li>rephrase: {@code sic_code, reviewed_description}</li>
 * </ul>
 */
public final class SourceReader {

    private static final Logger log = LoggerFactory.getLogger(SourceReader.class);
    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    private SourceReader() {
        // Utility class
    }

    public static List<StructureRow> readStructure(Path path) throws IOException {
        return read(path, StructureRow.class);
    }

    public static List<ActivityRow> readActivities(Path path) throws IOException {
        return read(path, ActivityRow.class);
    }

    public static List<DescriptionRow> readDescriptions(Path path) throws IOException {
        return read(path, DescriptionRow.class);
    }

    public static List<RephraseRow> readRephrases(Path path) throws IOException {
        return read(path, RephraseRow.class);
    }

    /**
     * Reads rows of the given type from CSV text.
     *
     * @param reader CSV input with a header row; not closed
     * @param rowType row record type
     * @param <T> row type
     * @return all rows in file order
     * @throws IOException if the input cannot be parsed
     */
    public static <T> List<T> read(Reader reader, Class<T> rowType) throws IOException {
        try (MappingIterator<T> rows = CSV_MAPPER.readerFor(rowType).with(HEADER_SCHEMA).readValues(reader)) {
            return rows.readAll();
        }
    }

    private static <T> List<T> read(Path path, Class<T> rowType) throws IOException {
        log.debug("Reading {} rows from: {}", rowType.getSimpleName(), path);
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            List<T> rows = read(reader, rowType);
            log.debug("Read {} rows from: {}", rows.size(), path);
            return rows;
        }
    }

    /**
     * Writes the leaf text corpus as CSV with a {@code code,text} header.
     *
     * @param rows leaf text rows
     * @param writer destination; not closed
     * @throws IOException if writing fails
     */
    public static void writeLeafText(List<LeafText> rows, Writer writer) throws IOException {
        CsvSchema schema = CSV_MAPPER.schemaFor(LeafText.class).withHeader();
        CSV_MAPPER.writer(schema)
            .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
            .writeValue(writer, rows);
    }
}
