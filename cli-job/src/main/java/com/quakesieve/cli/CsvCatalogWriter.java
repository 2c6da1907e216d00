package com.quakesieve.cli;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.quakesieve.core.record.OutputRecord;

import java.io.IOException;
import java.io.Writer;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV output through jackson-dataformat-csv.
 *
 * <p>
 * Each row is written as a string array in header order, so the header row
 * is present even for an empty catalog and fields missing from a record come
 * out as empty cells. Cells are quoted only when they contain a separator,
 * a quote or a line break. Numbers never use exponent notation.
 * </p>
 */
public class CsvCatalogWriter implements CatalogWriter {

    private final CsvMapper mapper = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    @Override
    public void write(Path target, List<String> header, List<OutputRecord> records) throws IOException {
        createParentDirectories(target);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                SequenceWriter rows = mapper.writerFor(String[].class).writeValues(out)) {
            rows.write(header.toArray(new String[0]));
            for (OutputRecord record : records) {
                rows.write(toRow(header, record));
            }
        }
    }

    private static String[] toRow(List<String> header, OutputRecord record) {
        String[] row = new String[header.size()];
        for (int i = 0; i < row.length; i++) {
            row[i] = record.getField(header.get(i)).map(CsvCatalogWriter::cell).orElse("");
        }
        return row;
    }

    /**
     * Text of one cell. Doubles are written in plain decimal
     * notation with at least one fractional digit, e.g. {@code -34560000.0}.
     */
    static String cell(Object value) {
        if (value instanceof Double number) {
            double d = number;
            if (!Double.isFinite(d)) {
                return String.valueOf(d);
            }
            String plain = BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
            return plain.indexOf('.') < 0 ? plain + ".0" : plain;
        }
        return String.valueOf(value);
    }

    static void createParentDirectories(Path target) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
