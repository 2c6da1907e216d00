package com.quakesieve.core.record;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Names of the input columns that carry the typed event fields.
 *
 * <p>
 * Defaults follow the catalog schema ({@code event_id}, {@code magnitude},
 * {@code timestamp}, {@code latitude}, {@code longitude}, {@code depth_km});
 * catalogs exported with other headers (for example {@code usgs_id},
 * {@code usgs_mag}, {@code event_at}) can be read by overriding them.
 * </p>
 *
 * @since 1.0.0
 */
public class ColumnMapping implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id = "event_id";
    private String magnitude = "magnitude";
    private String timestamp = "timestamp";
    private String latitude = "latitude";
    private String longitude = "longitude";

    /** Optional column; absent or blank values mean depth 0. */
    private String depth = "depth_km";

    /**
     * @return the required columns keyed by their role, in schema order
     */
    public Map<String, String> requiredColumns() {
        Map<String, String> columns = new LinkedHashMap<>();
        columns.put("id", id);
        columns.put("magnitude", magnitude);
        columns.put("timestamp", timestamp);
        columns.put("latitude", latitude);
        columns.put("longitude", longitude);
        return columns;
    }

    /**
     * Return the required columns absent from {@code header}.
     *
     * @param header column names present in the input
     * @return missing column names, in schema order
     */
    public List<String> missingFrom(Iterable<String> header) {
        Set<String> present = new HashSet<>();
        header.forEach(present::add);
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns().values()) {
            if (!present.contains(column)) {
                missing.add(column);
            }
        }
        return missing;
    }

    /**
     * Collect every problem with this mapping.
     *
     * @return error messages, empty when valid
     */
    public List<String> collectErrors() {
        List<String> errors = new ArrayList<>();
        Map<String, String> columns = requiredColumns();
        columns.put("depth", depth);
        Set<String> seen = new HashSet<>();
        for (Map.Entry<String, String> entry : columns.entrySet()) {
            String name = entry.getValue();
            if (name == null || name.isBlank()) {
                errors.add("Column for '" + entry.getKey() + "' must not be blank");
            } else if (!seen.add(name)) {
                errors.add("Column '" + name + "' is mapped to more than one field");
            }
        }
        return errors;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getMagnitude() {
        return magnitude;
    }

    public void setMagnitude(String magnitude) {
        this.magnitude = magnitude;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(String timestamp) {
        this.timestamp = timestamp;
    }

    public String getLatitude() {
        return latitude;
    }

    public void setLatitude(String latitude) {
        this.latitude = latitude;
    }

    public String getLongitude() {
        return longitude;
    }

    public void setLongitude(String longitude) {
        this.longitude = longitude;
    }

    public String getDepth() {
        return depth;
    }

    public void setDepth(String depth) {
        this.depth = depth;
    }

    @Override
    public String toString() {
        return "ColumnMapping{" +
                "id='" + id + '\'' +
                ", magnitude='" + magnitude + '\'' +
                ", timestamp='" + timestamp + '\'' +
                ", latitude='" + latitude + '\'' +
                ", longitude='" + longitude + '\'' +
                ", depth='" + depth + '\'' +
                '}';
    }
}
