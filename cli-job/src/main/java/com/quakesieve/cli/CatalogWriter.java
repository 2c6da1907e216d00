package com.quakesieve.cli;

import com.quakesieve.core.record.OutputRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes one output catalog to a file.
 */
public interface CatalogWriter {

    /**
     * Write {@code records} to {@code target}, replacing any existing file.
     * The header is written even when there are no records, where the format
     * has one.
     *
     * @param target  output file
     * @param header  column names, in output order
     * @param records the rows
     * @throws IOException if the file cannot be written
     */
    void write(Path target, List<String> header, List<OutputRecord> records) throws IOException;
}
