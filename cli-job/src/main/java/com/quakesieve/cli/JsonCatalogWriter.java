package com.quakesieve.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.quakesieve.core.record.OutputRecord;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * JSON output: an array of flat objects whose keys follow the header order.
 */
public class JsonCatalogWriter implements CatalogWriter {

    private final ObjectMapper mapper = JsonMappers.create();

    @Override
    public void write(Path target, List<String> header, List<OutputRecord> records) throws IOException {
        CsvCatalogWriter.createParentDirectories(target);
        mapper.writeValue(target.toFile(), records);
    }
}
