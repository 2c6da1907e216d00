package com.quakesieve.cli;

import com.quakesieve.core.record.OutputRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link CsvCatalogWriter}.
 */
class CsvCatalogWriterTest {

    @TempDir
    Path tempDir;

    private final CsvCatalogWriter writer = new CsvCatalogWriter();

    @Test
    @DisplayName("Should write the header row for an empty catalog")
    void shouldWriteHeaderForEmptyCatalog() throws IOException {
        Path file = tempDir.resolve("empty.csv");

        writer.write(file, List.of("event_id", "magnitude"), List.of());

        assertThat(Files.readAllLines(file)).containsExactly("event_id,magnitude");
    }

    @Test
    @DisplayName("Should write fields in header order and leave missing fields empty")
    void shouldFollowHeaderOrder() throws IOException {
        Path file = tempDir.resolve("rows.csv");
        OutputRecord record = new OutputRecord();
        record.setField("magnitude", "4.2");
        record.setField("event_id", "ev1");
        record.setField("parent_magnitude", 6.0);

        writer.write(file, List.of("event_id", "depth_km", "magnitude", "parent_magnitude"), List.of(record));

        assertThat(Files.readAllLines(file))
                .containsExactly("event_id,depth_km,magnitude,parent_magnitude", "ev1,,4.2,6.0");
    }

    @Test
    @DisplayName("Should quote only values that need it")
    void shouldQuoteWhenNeeded() throws IOException {
        Path file = tempDir.resolve("quoted.csv");
        OutputRecord record = new OutputRecord();
        record.setField("event_id", "ev1");
        record.setField("place", "Tokyo, Japan");

        writer.write(file, List.of("event_id", "place"), List.of(record));

        assertThat(Files.readAllLines(file)).containsExactly("event_id,place", "ev1,\"Tokyo, Japan\"");
        assertThat(new CsvCatalogReader().read(file).getRows().get(0).get("place")).isEqualTo("Tokyo, Japan");
    }

    @Test
    @DisplayName("Should write doubles in plain decimal notation")
    void shouldWritePlainDecimals() {
        assertThat(CsvCatalogWriter.cell(-3.456E7)).isEqualTo("-34560000.0");
        assertThat(CsvCatalogWriter.cell(388800.0)).isEqualTo("388800.0");
        assertThat(CsvCatalogWriter.cell(6.0)).isEqualTo("6.0");
        assertThat(CsvCatalogWriter.cell(7.1860659484455125)).isEqualTo("7.1860659484455125");
        assertThat(CsvCatalogWriter.cell(1.5E-4)).isEqualTo("0.00015");
        assertThat(CsvCatalogWriter.cell("2.5E3")).isEqualTo("2.5E3");
    }

    @Test
    @DisplayName("Should create missing parent directories")
    void shouldCreateParentDirectories() throws IOException {
        Path file = tempDir.resolve("nested/dir/out.csv");

        writer.write(file, List.of("event_id"), List.of());

        assertThat(file).exists();
    }
}
