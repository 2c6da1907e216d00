package com.quakesieve.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single catalog earthquake.
 *
 * <p>
 * Events are immutable. The typed fields ({@code id}, {@code magnitude},
 * {@code time}, {@code latitude}, {@code longitude}, {@code depthKm}) drive
 * classification; {@link #getAttributes()} holds the original record's fields
 * in their original column order so they can be written back verbatim.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. The builder enforces that {@code id} and
 * {@code time} are present and that the coordinates are in range. When no
 * attributes are supplied, the builder derives them from the typed fields
 * using the default column names of {@link com.quakesieve.core.record.ColumnMapping}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Event implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final double magnitude;
    private final Instant time;
    private final double latitude;
    private final double longitude;
    private final double depthKm;

    /** Every field of the source record, in source order. */
    private final Map<String, String> attributes;

    private Event(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.time = Objects.requireNonNull(builder.time, "time must not be null");
        this.magnitude = builder.magnitude;
        this.latitude = builder.latitude;
        this.longitude = builder.longitude;
        this.depthKm = builder.depthKm;

        if (!Double.isFinite(magnitude) || magnitude <= 0) {
            throw new IllegalArgumentException(
                    "magnitude must be finite and > 0 for event '" + id + "', got: " + magnitude);
        }
        if (!(latitude >= -90.0 && latitude <= 90.0)) {
            throw new IllegalArgumentException(
                    "latitude must be in [-90, 90] for event '" + id + "', got: " + latitude);
        }
        if (!(longitude >= -180.0 && longitude <= 180.0)) {
            throw new IllegalArgumentException(
                    "longitude must be in [-180, 180] for event '" + id + "', got: " + longitude);
        }
        if (!(depthKm >= 0.0) || Double.isInfinite(depthKm)) {
            throw new IllegalArgumentException(
                    "depth must be finite and >= 0 for event '" + id + "', got: " + depthKm);
        }

        this.attributes = builder.attributes != null
                ? new LinkedHashMap<>(builder.attributes)
                : defaultAttributes();
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Create a new {@link Builder}.
     *
     * @return builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Event} instances.
     */
    public static class Builder {
        private String id;
        private double magnitude = Double.NaN;
        private Instant time;
        private double latitude = Double.NaN;
        private double longitude = Double.NaN;
        private double depthKm;
        private Map<String, String> attributes;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder magnitude(double magnitude) {
            this.magnitude = magnitude;
            return this;
        }

        public Builder time(Instant time) {
            this.time = time;
            return this;
        }

        public Builder latitude(double latitude) {
            this.latitude = latitude;
            return this;
        }

        public Builder longitude(double longitude) {
            this.longitude = longitude;
            return this;
        }

        public Builder depthKm(double depthKm) {
            this.depthKm = depthKm;
            return this;
        }

        public Builder attributes(Map<String, String> attributes) {
            this.attributes = attributes;
            return this;
        }

        /**
         * Build the event.
         *
         * @return a new {@link Event}
         * @throws NullPointerException     if {@code id} or {@code time} is
         *                                  {@code null}
         * @throws IllegalArgumentException if a numeric field is out of range
         */
        public Event build() {
            return new Event(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public double getMagnitude() {
        return magnitude;
    }

    public Instant getTime() {
        return time;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    public double getDepthKm() {
        return depthKm;
    }

    /**
     * Return an <strong>unmodifiable</strong> view of the source record fields.
     *
     * @return unmodifiable map of column names to raw values
     */
    public Map<String, String> getAttributes() {
        return Collections.unmodifiableMap(attributes);
    }

    /**
     * Retrieve a raw source field by column name.
     *
     * @param column the column name
     * @return optional containing the raw value, or empty if not present
     */
    public Optional<String> getAttribute(String column) {
        return Optional.ofNullable(attributes.get(column));
    }

    private Map<String, String> defaultAttributes() {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("event_id", id);
        values.put("magnitude", String.valueOf(magnitude));
        values.put("timestamp", time.toString());
        values.put("latitude", String.valueOf(latitude));
        values.put("longitude", String.valueOf(longitude));
        values.put("depth_km", String.valueOf(depthKm));
        return values;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event that))
            return false;
        return Objects.equals(id, that.id)
                && Double.compare(magnitude, that.magnitude) == 0
                && Objects.equals(time, that.time)
                && Double.compare(latitude, that.latitude) == 0
                && Double.compare(longitude, that.longitude) == 0
                && Double.compare(depthKm, that.depthKm) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, magnitude, time, latitude, longitude, depthKm);
    }

    @Override
    public String toString() {
        return "Event{" +
                "id='" + id + '\'' +
                ", magnitude=" + magnitude +
                ", time=" + time +
                ", latitude=" + latitude +
                ", longitude=" + longitude +
                ", depthKm=" + depthKm +
                '}';
    }
}
