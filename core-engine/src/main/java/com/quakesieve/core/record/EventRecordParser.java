package com.quakesieve.core.record;

import com.quakesieve.core.model.Event;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Turns raw string records into validated {@link Event}s.
 *
 * <h3>Validation</h3>
 * <p>
 * A record is invalid when a required field is missing or blank, a number or
 * timestamp does not parse, a coordinate is out of range, the magnitude is
 * not a finite positive number, the depth is negative, or the id repeats an
 * earlier accepted record. In lenient mode such a record is dropped with a
 * WARN and reported as an {@link InputRejection}; in strict mode the first
 * one aborts parsing with an {@link InvalidRecordException}.
 * </p>
 *
 * <p>
 * A header lacking a required column is always fatal.
 * </p>
 *
 * <h3>Timestamps</h3>
 * <p>
 * ISO-8601 instants ({@code 2020-01-01T00:00:00Z}), offset date-times
 * ({@code 2020-01-01T09:00:00+09:00}), zone-less date-times (read as UTC,
 * with either {@code T} or a space between date and time) and bare dates
 * (midnight UTC).
 * </p>
 *
 * @since 1.0.0
 */
public class EventRecordParser {

    private static final Logger LOG = LoggerFactory.getLogger(EventRecordParser.class);

    private final ColumnMapping columns;
    private final boolean strict;

    /**
     * @param columns column names of the typed fields; must not be
     *                {@code null}
     * @param strict  whether the first invalid record aborts parsing
     * @throws IllegalArgumentException if the mapping is invalid
     */
    public EventRecordParser(ColumnMapping columns, boolean strict) {
        this.columns = Objects.requireNonNull(columns, "ColumnMapping must not be null");
        List<String> errors = columns.collectErrors();
        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid column mapping: " + String.join("; ", errors));
        }
        this.strict = strict;
    }

    /**
     * Parse records.
     *
     * @param header column names in input order
     * @param rows   records keyed by column name, in input order
     * @return accepted events and rejections
     * @throws IllegalArgumentException if {@code header} lacks a required
     *                                  column
     * @throws InvalidRecordException   in strict mode, on the first invalid
     *                                  record
     */
    public ParsedCatalog parse(List<String> header, List<Map<String, String>> rows) {
        return parse(header, rows, Map.of());
    }

    /**
     * Parse records, some of which the reader already found structurally
     * broken. Those rows go through the same drop-or-abort policy as any
     * other invalid record.
     *
     * @param header    column names in input order
     * @param rows      records keyed by column name, in input order
     * @param malformed reasons keyed by 1-based row number
     * @return accepted events and rejections
     * @throws IllegalArgumentException if {@code header} lacks a required
     *                                  column
     * @throws InvalidRecordException   in strict mode, on the first invalid
     *                                  record
     */
    public ParsedCatalog parse(List<String> header, List<Map<String, String>> rows,
            Map<Integer, String> malformed) {
        Objects.requireNonNull(header, "Header must not be null");
        Objects.requireNonNull(rows, "Rows must not be null");
        Objects.requireNonNull(malformed, "Malformed rows must not be null");

        List<String> missing = columns.missingFrom(header);
        if (!missing.isEmpty()) {
            throw new IllegalArgumentException("Input is missing required column(s): " + missing
                    + ". Present: " + header);
        }
        boolean hasDepth = header.contains(columns.getDepth());

        List<Event> events = new ArrayList<>(rows.size());
        List<InputRejection> rejections = new ArrayList<>();
        Set<String> ids = new HashSet<>();

        for (int i = 0; i < rows.size(); i++) {
            int rowNumber = i + 1;
            Map<String, String> row = rows.get(i);
            try {
                String broken = malformed.get(rowNumber);
                if (broken != null) {
                    throw new InvalidRecordException(rowNumber, broken);
                }
                Event event = toEvent(rowNumber, header, row, hasDepth);
                if (!ids.add(event.getId())) {
                    throw new InvalidRecordException(rowNumber, "duplicate event id '" + event.getId() + "'");
                }
                events.add(event);
            } catch (InvalidRecordException e) {
                if (strict) {
                    throw e;
                }
                String id = trimmed(row.get(columns.getId()));
                LOG.warn("Dropping record at row {} (id={}): {}", rowNumber, id, e.getReason());
                rejections.add(new InputRejection(rowNumber, id, e.getReason()));
            }
        }

        LOG.info("Parsed {} record(s): {} accepted, {} rejected",
                rows.size(), events.size(), rejections.size());
        return new ParsedCatalog(header, events, rejections);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private Event toEvent(int rowNumber, List<String> header, Map<String, String> row, boolean hasDepth) {
        String id = required(rowNumber, row, columns.getId());
        double magnitude = number(rowNumber, row, columns.getMagnitude());
        Instant time = timestamp(rowNumber, required(rowNumber, row, columns.getTimestamp()));
        double latitude = number(rowNumber, row, columns.getLatitude());
        double longitude = number(rowNumber, row, columns.getLongitude());

        double depthKm = 0.0;
        String depth = hasDepth ? trimmed(row.get(columns.getDepth())) : null;
        if (depth != null) {
            depthKm = parseDouble(rowNumber, columns.getDepth(), depth);
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        for (String column : header) {
            String value = row.get(column);
            attributes.put(column, value != null ? value : "");
        }

        try {
            return Event.builder()
                    .id(id)
                    .magnitude(magnitude)
                    .time(time)
                    .latitude(latitude)
                    .longitude(longitude)
                    .depthKm(depthKm)
                    .attributes(attributes)
                    .build();
        } catch (IllegalArgumentException e) {
            throw new InvalidRecordException(rowNumber, e.getMessage());
        }
    }

    private static String required(int rowNumber, Map<String, String> row, String column) {
        String value = trimmed(row.get(column));
        if (value == null) {
            throw new InvalidRecordException(rowNumber, "missing value for '" + column + "'");
        }
        return value;
    }

    private static double number(int rowNumber, Map<String, String> row, String column) {
        return parseDouble(rowNumber, column, required(rowNumber, row, column));
    }

    private static double parseDouble(int rowNumber, String column, String value) {
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new InvalidRecordException(rowNumber,
                    "unparseable number in '" + column + "': '" + value + "'");
        }
    }

    private Instant timestamp(int rowNumber, String value) {
        try {
            return parseTimestamp(value);
        } catch (DateTimeParseException e) {
            throw new InvalidRecordException(rowNumber,
                    "unparseable timestamp in '" + columns.getTimestamp() + "': '" + value + "'");
        }
    }

    /**
     * Parse an ISO-8601 timestamp, reading zone-less values as UTC.
     *
     * @param value the raw value
     * @return the instant
     * @throws DateTimeParseException if no supported form matches
     */
    public static Instant parseTimestamp(String value) {
        String text = value.trim();
        if (text.length() > 10 && text.charAt(10) == ' ') {
            text = text.substring(0, 10) + 'T' + text.substring(11);
        }
        if (text.length() == 10) {
            return LocalDate.parse(text).atStartOfDay().toInstant(ZoneOffset.UTC);
        }
        if (text.endsWith("Z") || text.endsWith("z")) {
            return Instant.parse(text.substring(0, text.length() - 1) + 'Z');
        }
        try {
            return OffsetDateTime.parse(text).toInstant();
        } catch (DateTimeParseException e) {
            return LocalDateTime.parse(text).toInstant(ZoneOffset.UTC);
        }
    }

    private static String trimmed(String value) {
        if (value == null) {
            return null;
        }
        String t = value.trim();
        return t.isEmpty() ? null : t;
    }

    public ColumnMapping getColumns() {
        return columns;
    }

    public boolean isStrict() {
        return strict;
    }
}
