package com.quakesieve.core.record;

import com.quakesieve.core.model.Event;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link EventRecordParser}.
 */
class EventRecordParserTest {

    private static final List<String> HEADER = List.of(
            "event_id", "magnitude", "timestamp", "latitude", "longitude", "depth_km", "place");

    private EventRecordParser lenient;

    @BeforeEach
    void setUp() {
        lenient = new EventRecordParser(new ColumnMapping(), false);
    }

    @Test
    @DisplayName("Should parse valid records and keep every field")
    void shouldParseValidRecords() {
        List<Map<String, String>> rows = List.of(
                row("us1", "6.1", "2020-01-01T00:00:00Z", "35.0", "139.0", "10.5", "Honshu"),
                row("us2", "4.2", "2020-01-02T12:30:00Z", "-33.5", "-70.6", "", "Chile"));

        ParsedCatalog catalog = lenient.parse(HEADER, rows);

        assertThat(catalog.getRejections()).isEmpty();
        assertThat(catalog.getEvents()).hasSize(2);

        Event first = catalog.getEvents().get(0);
        assertThat(first.getId()).isEqualTo("us1");
        assertThat(first.getMagnitude()).isEqualTo(6.1);
        assertThat(first.getTime()).isEqualTo(Instant.parse("2020-01-01T00:00:00Z"));
        assertThat(first.getDepthKm()).isEqualTo(10.5);
        assertThat(first.getAttributes().keySet()).containsExactlyElementsOf(HEADER);
        assertThat(first.getAttribute("place")).contains("Honshu");

        assertThat(catalog.getEvents().get(1).getDepthKm()).isZero();
    }

    @Test
    @DisplayName("Should default depth to zero when the column is absent")
    void shouldDefaultDepthWithoutColumn() {
        List<String> header = List.of("event_id", "magnitude", "timestamp", "latitude", "longitude");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("event_id", "a");
        row.put("magnitude", "3.0");
        row.put("timestamp", "2020-01-01T00:00:00Z");
        row.put("latitude", "0");
        row.put("longitude", "0");

        ParsedCatalog catalog = lenient.parse(header, List.of(row));

        assertThat(catalog.getEvents()).singleElement()
                .satisfies(e -> assertThat(e.getDepthKm()).isZero());
    }

    @Test
    @DisplayName("Should fail on a header missing required columns")
    void shouldFailOnMissingColumns() {
        List<String> header = List.of("event_id", "magnitude", "latitude", "longitude");

        assertThatThrownBy(() -> lenient.parse(header, List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("timestamp");
    }

    @Test
    @DisplayName("Should drop invalid records in lenient mode")
    void shouldDropInvalidRecordsWhenLenient() {
        List<Map<String, String>> rows = List.of(
                row("ok", "5.0", "2020-01-01T00:00:00Z", "0", "0", "5", ""),
                row("bad-mag", "abc", "2020-01-01T00:00:00Z", "0", "0", "5", ""),
                row("bad-lat", "5.0", "2020-01-01T00:00:00Z", "95", "0", "5", ""),
                row("ok", "4.0", "2020-01-02T00:00:00Z", "0", "0", "5", ""),
                row("no-time", "4.0", " ", "0", "0", "5", ""),
                row("zero-mag", "0", "2020-01-01T00:00:00Z", "0", "0", "5", ""),
                row("deep", "4.0", "2020-01-01T00:00:00Z", "0", "0", "-1", ""),
                row("bad-time", "4.0", "yesterday", "0", "0", "5", ""));

        ParsedCatalog catalog = lenient.parse(HEADER, rows);

        assertThat(catalog.getEvents()).extracting(Event::getId).containsExactly("ok");
        assertThat(catalog.getRejections()).extracting(InputRejection::getRowNumber)
                .containsExactly(2, 3, 4, 5, 6, 7, 8);
        assertThat(catalog.getRejections().get(0).getReason()).contains("unparseable number");
        assertThat(catalog.getRejections().get(1).getReason()).contains("latitude");
        assertThat(catalog.getRejections().get(2).getReason()).contains("duplicate");
        assertThat(catalog.getRejections().get(3).getReason()).contains("missing value");
        assertThat(catalog.getRejections().get(4).getReason()).contains("magnitude");
        assertThat(catalog.getRejections().get(5).getReason()).contains("depth");
        assertThat(catalog.getRejections().get(6).getReason()).contains("timestamp");
        assertThat(catalog.getRejections().get(6).getEventId()).contains("bad-time");
    }

    @Test
    @DisplayName("Should abort on the first invalid record in strict mode")
    void shouldAbortWhenStrict() {
        EventRecordParser strict = new EventRecordParser(new ColumnMapping(), true);
        List<Map<String, String>> rows = List.of(
                row("ok", "5.0", "2020-01-01T00:00:00Z", "0", "0", "5", ""),
                row("bad", "5.0", "2020-01-01T00:00:00Z", "0", "200", "5", ""));

        assertThatThrownBy(() -> strict.parse(HEADER, rows))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("row 2")
                .hasMessageContaining("longitude")
                .satisfies(e -> assertThat(((InvalidRecordException) e).getRowNumber()).isEqualTo(2));
    }

    @Test
    @DisplayName("Should drop rows flagged as malformed when lenient")
    void shouldDropMalformedRowsWhenLenient() {
        List<Map<String, String>> rows = List.of(
                row("a", "5.0", "2020-01-01T00:00:00Z", "0", "0", "5", ""),
                row("b", "4.0", "2020-01-02T00:00:00Z", "0", "0", "5", ""),
                row("c", "3.0", "2020-01-03T00:00:00Z", "0", "0", "5", ""));

        ParsedCatalog catalog = lenient.parse(HEADER, rows, Map.of(2, "row has 8 cells but the header has 7 columns"));

        assertThat(catalog.getEvents()).extracting(Event::getId).containsExactly("a", "c");
        assertThat(catalog.getRejections()).hasSize(1);
        assertThat(catalog.getRejections().get(0).getRowNumber()).isEqualTo(2);
        assertThat(catalog.getRejections().get(0).getEventId()).contains("b");
        assertThat(catalog.getRejections().get(0).getReason()).contains("8 cells");
    }

    @Test
    @DisplayName("Should abort on a malformed row in strict mode")
    void shouldAbortOnMalformedRowWhenStrict() {
        EventRecordParser strict = new EventRecordParser(new ColumnMapping(), true);
        List<Map<String, String>> rows = List.of(
                row("a", "5.0", "2020-01-01T00:00:00Z", "0", "0", "5", ""));

        assertThatThrownBy(() -> strict.parse(HEADER, rows, Map.of(1, "row has 9 cells but the header has 7 columns")))
                .isInstanceOf(InvalidRecordException.class)
                .hasMessageContaining("row 1")
                .hasMessageContaining("9 cells");
    }

    @Test
    @DisplayName("Should read zone-less timestamps as UTC and convert offsets")
    void shouldParseTimestampForms() {
        Instant expected = Instant.parse("2020-06-01T03:00:00Z");

        assertThat(EventRecordParser.parseTimestamp("2020-06-01T03:00:00Z")).isEqualTo(expected);
        assertThat(EventRecordParser.parseTimestamp("2020-06-01T03:00:00")).isEqualTo(expected);
        assertThat(EventRecordParser.parseTimestamp("2020-06-01 03:00:00")).isEqualTo(expected);
        assertThat(EventRecordParser.parseTimestamp("2020-06-01T12:00:00+09:00")).isEqualTo(expected);
        assertThat(EventRecordParser.parseTimestamp("2020-06-01T03:00:00.000Z")).isEqualTo(expected);
        assertThat(EventRecordParser.parseTimestamp("2020-06-01"))
                .isEqualTo(Instant.parse("2020-06-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Should honour column overrides")
    void shouldUseColumnMapping() {
        ColumnMapping mapping = new ColumnMapping();
        mapping.setId("usgs_id");
        mapping.setMagnitude("usgs_mag");
        mapping.setTimestamp("event_at");
        List<String> header = List.of("usgs_id", "usgs_mag", "event_at", "latitude", "longitude");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("usgs_id", "x1");
        row.put("usgs_mag", "5.5");
        row.put("event_at", "2021-08-22T00:00:00Z");
        row.put("latitude", "35.05");
        row.put("longitude", "139.05");

        ParsedCatalog catalog = new EventRecordParser(mapping, true).parse(header, List.of(row));

        assertThat(catalog.getEvents()).singleElement()
                .satisfies(e -> {
                    assertThat(e.getId()).isEqualTo("x1");
                    assertThat(e.getMagnitude()).isEqualTo(5.5);
                });
    }

    @Test
    @DisplayName("Should reject an invalid column mapping")
    void shouldRejectInvalidMapping() {
        ColumnMapping mapping = new ColumnMapping();
        mapping.setLongitude("latitude");

        assertThatThrownBy(() -> new EventRecordParser(mapping, false))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("more than one field");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Map<String, String> row(String... values) {
        Map<String, String> row = new LinkedHashMap<>();
        List<String> header = new ArrayList<>(HEADER);
        for (int i = 0; i < header.size(); i++) {
            row.put(header.get(i), values[i]);
        }
        return row;
    }
}
