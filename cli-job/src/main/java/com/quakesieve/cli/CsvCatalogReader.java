package com.quakesieve.cli;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads a headed CSV catalog into raw string rows.
 *
 * <p>
 * Values are returned verbatim; typing and validation are left to
 * {@link com.quakesieve.core.record.EventRecordParser}. A row holding
 * non-blank cells beyond the last header column is kept, truncated to the
 * header, and listed in {@link Table#getMalformed()} so the parser can drop
 * or refuse it like any other invalid record.
 * </p>
 */
public class CsvCatalogReader {

    private static final Logger LOG = LoggerFactory.getLogger(CsvCatalogReader.class);

    private final CsvMapper mapper;

    public CsvCatalogReader() {
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
    }

    /**
     * Read the file.
     *
     * @param source the CSV file; its first line is the header
     * @return header and rows, in file order
     * @throws IOException if the file cannot be read or is not valid CSV
     */
    public Table read(Path source) throws IOException {
        Objects.requireNonNull(source, "Source path must not be null");

        List<String> header = new ArrayList<>();
        List<Map<String, String>> rows = new ArrayList<>();
        Map<Integer, String> malformed = new LinkedHashMap<>();
        try (Reader in = Files.newBufferedReader(source, StandardCharsets.UTF_8);
                MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(in)) {
            if (it.hasNextValue()) {
                header.addAll(Arrays.asList(it.nextValue()));
            }
            while (it.hasNextValue()) {
                String[] cells = it.nextValue();
                int rowNumber = rows.size() + 1;
                Map<String, String> row = new LinkedHashMap<>();
                for (int i = 0; i < Math.min(cells.length, header.size()); i++) {
                    row.put(header.get(i), cells[i]);
                }
                rows.add(row);
                if (hasExtraCells(cells, header.size())) {
                    malformed.put(rowNumber, "row has " + cells.length + " cells but the header has "
                            + header.size() + " columns");
                }
            }
        }

        LOG.info("Read {} row(s) with {} column(s) from {}", rows.size(), header.size(), source);
        return new Table(header, rows, malformed);
    }

    private static boolean hasExtraCells(String[] cells, int columns) {
        for (int i = columns; i < cells.length; i++) {
            if (cells[i] != null && !cells[i].isBlank()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Header and rows of a CSV file.
     */
    public static final class Table {

        private final List<String> header;
        private final List<Map<String, String>> rows;

        /** Reasons keyed by 1-based row number. */
        private final Map<Integer, String> malformed;

        public Table(List<String> header, List<Map<String, String>> rows, Map<Integer, String> malformed) {
            this.header = Collections.unmodifiableList(header);
            this.rows = Collections.unmodifiableList(rows);
            this.malformed = Collections.unmodifiableMap(malformed);
        }

        public List<String> getHeader() {
            return header;
        }

        public List<Map<String, String>> getRows() {
            return rows;
        }

        public Map<Integer, String> getMalformed() {
            return malformed;
        }
    }
}
