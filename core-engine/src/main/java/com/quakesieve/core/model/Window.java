package com.quakesieve.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Space-time neighbourhood of a triggering event: a spatial radius in
 * kilometres and a temporal half-width in days.
 *
 * @since 1.0.0
 */
public final class Window implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Seconds per day, used for all day/second conversions. */
    public static final double SECONDS_PER_DAY = 86_400.0;

    private final double spatialKm;
    private final double temporalDays;

    /**
     * @param spatialKm    radius in km; must be finite and &gt; 0
     * @param temporalDays half-width in days; must be finite and &gt; 0
     * @throws IllegalArgumentException if either extent is not positive
     */
    public Window(double spatialKm, double temporalDays) {
        if (!Double.isFinite(spatialKm) || spatialKm <= 0) {
            throw new IllegalArgumentException("spatialKm must be finite and > 0, got: " + spatialKm);
        }
        if (!Double.isFinite(temporalDays) || temporalDays <= 0) {
            throw new IllegalArgumentException("temporalDays must be finite and > 0, got: " + temporalDays);
        }
        this.spatialKm = spatialKm;
        this.temporalDays = temporalDays;
    }

    public double getSpatialKm() {
        return spatialKm;
    }

    public double getTemporalDays() {
        return temporalDays;
    }

    public double getTemporalSeconds() {
        return temporalDays * SECONDS_PER_DAY;
    }

    /**
     * Return a copy with both extents multiplied by {@code factor}.
     *
     * @param factor positive multiplier
     * @return scaled window
     */
    public Window scale(double factor) {
        return new Window(spatialKm * factor, temporalDays * factor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Window that))
            return false;
        return Double.compare(spatialKm, that.spatialKm) == 0
                && Double.compare(temporalDays, that.temporalDays) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(spatialKm, temporalDays);
    }

    @Override
    public String toString() {
        return "Window{spatialKm=" + spatialKm + ", temporalDays=" + temporalDays + '}';
    }
}
